package warden.adapter.in.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.in.dto.LoginRequest;
import warden.adapter.in.dto.SessionResponse;
import warden.adapter.in.dto.TokenResponse;

@DisplayName("JacksonCustomizer")
class JacksonCustomizerTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        new JacksonCustomizer().customize(mapper);
    }

    @Test
    @DisplayName("should ignore unknown request fields")
    void shouldIgnoreUnknownFields() throws Exception {
        final var request = mapper.readValue(
                "{\"email\":\"a@example.com\",\"password\":\"pw\",\"captcha\":\"x\"}", LoginRequest.class);

        assertEquals("a@example.com", request.email());
        assertNull(request.deviceInfo());
    }

    @Test
    @DisplayName("should omit absent optional fields")
    void shouldOmitNullFields() throws Exception {
        final var json = mapper.writeValueAsString(new SessionResponse(UUID.randomUUID(), null, null, null));

        assertFalse(json.contains("device_info"));
        assertFalse(json.contains("null"));
    }

    @Test
    @DisplayName("should write token responses with snake_case names")
    void shouldWriteSnakeCaseTokenResponse() throws Exception {
        final var tree = mapper.readTree(mapper.writeValueAsString(new TokenResponse("a", "r", "bearer", 900)));

        assertEquals("bearer", tree.get("token_type").asText());
        assertEquals(900, tree.get("expires_in").asLong());
    }
}
