package warden.core.model.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-derived metadata recorded with sessions and login history.
 *
 * @param ipAddress  client address (first forwarded hop when behind a proxy)
 * @param userAgent  user agent header, may be null
 * @param deviceInfo client-supplied device metadata, never null
 */
public record ClientContext(String ipAddress, String userAgent, Map<String, Object> deviceInfo) {

    public ClientContext {
        ipAddress = ipAddress == null ? "unknown" : ipAddress;
        deviceInfo = deviceInfo == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(deviceInfo));
    }

    public static ClientContext unknown() {
        return new ClientContext(null, null, null);
    }
}
