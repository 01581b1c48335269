package warden.adapter.out.storage.jdbc;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.LoginRecord;
import warden.core.model.session.RefreshTokenRecord;
import warden.core.port.out.RefreshTokenRepository;

/**
 * PostgreSQL refresh-token store.
 *
 * <p>Rotation is linearized by a conditional update: only the transaction
 * that flips {@code revoked_at} from null inserts the successor.
 */
public class JdbcRefreshTokenRepository implements RefreshTokenRepository {

    private static final Logger LOG = Logger.getLogger(JdbcRefreshTokenRepository.class);

    private static final TypeReference<Map<String, Object>> DEVICE_INFO_TYPE = new TypeReference<>() {};

    private static final String COLUMNS =
            "id, subject_id, chain_id, token_hash, access_jti, device_info, created_at, expires_at, revoked_at";

    private static final String FIND_BY_HASH = "SELECT " + COLUMNS + " FROM refresh_tokens WHERE token_hash = ?";

    private static final String INSERT =
            """
            INSERT INTO refresh_tokens (
                id, subject_id, chain_id, token_hash, access_jti, device_info, created_at, expires_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?)
            """;

    // Serializes concurrent logins of one subject until commit
    private static final String SUBJECT_LOCK = "SELECT pg_advisory_xact_lock(hashtext(?))";

    private static final String TOUCH_LAST_LOGIN =
            "UPDATE users SET last_login_at = ?, updated_at = ? WHERE id = ?";

    private static final String INSERT_LOGIN_HISTORY =
            """
            INSERT INTO login_history (
                subject_id, ip_address, user_agent, device_info, success, failure_reason, attempted_at
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?)
            """;

    private static final String REVOKE_IF_ACTIVE =
            "UPDATE refresh_tokens SET revoked_at = ? WHERE id = ? AND revoked_at IS NULL";

    private static final String REVOKE_CHAIN_BY_ACCESS_JTI =
            """
            UPDATE refresh_tokens SET revoked_at = ?
            WHERE revoked_at IS NULL
              AND chain_id IN (
                  SELECT chain_id FROM refresh_tokens WHERE subject_id = ? AND access_jti = ?
              )
            """;

    private static final String REVOKE_CHAIN =
            "UPDATE refresh_tokens SET revoked_at = ? WHERE chain_id = ? AND revoked_at IS NULL";

    private static final String REVOKE_ALL_FOR_SUBJECT =
            "UPDATE refresh_tokens SET revoked_at = ? WHERE subject_id = ? AND revoked_at IS NULL";

    private static final String FIND_ACTIVE_BY_SUBJECT = "SELECT " + COLUMNS
            + " FROM refresh_tokens WHERE subject_id = ? AND revoked_at IS NULL AND expires_at > ?"
            + " ORDER BY created_at DESC";

    private final JdbcExecutor jdbc;
    private final ObjectMapper objectMapper;

    public JdbcRefreshTokenRepository(JdbcExecutor jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public Uni<Optional<RefreshTokenRecord>> findByTokenHash(String tokenHash) {
        return jdbc.query("findByTokenHash", connection -> {
            try (var ps = jdbc.prepare(connection, FIND_BY_HASH)) {
                ps.setString(1, tokenHash);
                try (var rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<RefreshTokenRecord>empty();
                }
            }
        });
    }

    @Override
    public Uni<Void> saveLogin(RefreshTokenRecord record, LoginRecord login) {
        return jdbc.inTransaction("saveLogin", connection -> {
            try (var ps = jdbc.prepare(connection, SUBJECT_LOCK)) {
                ps.setString(1, record.subjectId());
                ps.execute();
            }
            insert(connection, record);
            try (var ps = jdbc.prepare(connection, TOUCH_LAST_LOGIN)) {
                ps.setTimestamp(1, JdbcExecutor.timestamp(login.attemptedAt()));
                ps.setTimestamp(2, JdbcExecutor.timestamp(login.attemptedAt()));
                ps.setString(3, login.subjectId());
                ps.executeUpdate();
            }
            insertHistory(connection, login);
            return null;
        });
    }

    @Override
    public Uni<Void> recordFailedLogin(LoginRecord attempt) {
        return jdbc.query("recordFailedLogin", connection -> {
            insertHistory(connection, attempt);
            return null;
        });
    }

    @Override
    public Uni<Boolean> rotate(UUID currentId, RefreshTokenRecord successor, Instant now) {
        return jdbc.inTransaction("rotate", connection -> {
            final int updated;
            try (var ps = jdbc.prepare(connection, REVOKE_IF_ACTIVE)) {
                ps.setTimestamp(1, JdbcExecutor.timestamp(now));
                ps.setObject(2, currentId);
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                LOG.debugf("Rotation of %s lost: record already revoked", currentId);
                connection.rollback();
                return false;
            }
            insert(connection, successor);
            return true;
        });
    }

    @Override
    public Uni<Integer> revokeChainByAccessJti(String subjectId, String accessJti, Instant now) {
        return jdbc.query("revokeChainByAccessJti", connection -> {
            try (var ps = jdbc.prepare(connection, REVOKE_CHAIN_BY_ACCESS_JTI)) {
                ps.setTimestamp(1, JdbcExecutor.timestamp(now));
                ps.setString(2, subjectId);
                ps.setString(3, accessJti);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Uni<Integer> revokeChain(UUID chainId, Instant now) {
        return jdbc.query("revokeChain", connection -> {
            try (var ps = jdbc.prepare(connection, REVOKE_CHAIN)) {
                ps.setTimestamp(1, JdbcExecutor.timestamp(now));
                ps.setObject(2, chainId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Uni<Integer> revokeAllForSubject(String subjectId, Instant now) {
        return jdbc.query("revokeAllForSubject", connection -> {
            try (var ps = jdbc.prepare(connection, REVOKE_ALL_FOR_SUBJECT)) {
                ps.setTimestamp(1, JdbcExecutor.timestamp(now));
                ps.setString(2, subjectId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Uni<List<RefreshTokenRecord>> findActiveBySubject(String subjectId, Instant now) {
        return jdbc.query("findActiveBySubject", connection -> {
            try (var ps = jdbc.prepare(connection, FIND_ACTIVE_BY_SUBJECT)) {
                ps.setString(1, subjectId);
                ps.setTimestamp(2, JdbcExecutor.timestamp(now));
                try (var rs = ps.executeQuery()) {
                    final var records = new ArrayList<RefreshTokenRecord>();
                    while (rs.next()) {
                        records.add(map(rs));
                    }
                    return List.copyOf(records);
                }
            }
        });
    }

    private void insertHistory(Connection connection, LoginRecord login) throws SQLException {
        try (var ps = jdbc.prepare(connection, INSERT_LOGIN_HISTORY)) {
            ps.setString(1, login.subjectId());
            ps.setString(2, login.client().ipAddress());
            ps.setString(3, login.client().userAgent());
            ps.setString(4, toJson(login.deviceInfo()));
            ps.setBoolean(5, login.success());
            ps.setString(6, login.failureReason());
            ps.setTimestamp(7, JdbcExecutor.timestamp(login.attemptedAt()));
            ps.executeUpdate();
        }
    }

    private void insert(Connection connection, RefreshTokenRecord record) throws SQLException {
        try (var ps = jdbc.prepare(connection, INSERT)) {
            ps.setObject(1, record.id());
            ps.setString(2, record.subjectId());
            ps.setObject(3, record.chainId());
            ps.setString(4, record.tokenHash());
            ps.setString(5, record.accessJti());
            ps.setString(6, toJson(record.deviceInfo()));
            ps.setTimestamp(7, JdbcExecutor.timestamp(record.createdAt()));
            ps.setTimestamp(8, JdbcExecutor.timestamp(record.expiresAt()));
            ps.executeUpdate();
        }
    }

    private RefreshTokenRecord map(ResultSet rs) throws SQLException {
        return new RefreshTokenRecord(
                rs.getObject("id", UUID.class),
                rs.getString("subject_id"),
                rs.getObject("chain_id", UUID.class),
                rs.getString("token_hash"),
                rs.getString("access_jti"),
                fromJson(rs.getString("device_info")),
                JdbcExecutor.instant(rs.getTimestamp("created_at")),
                JdbcExecutor.instant(rs.getTimestamp("expires_at")),
                JdbcExecutor.instant(rs.getTimestamp("revoked_at")));
    }

    private String toJson(Map<String, Object> deviceInfo) throws SQLException {
        if (deviceInfo == null || deviceInfo.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(deviceInfo);
        } catch (JsonProcessingException e) {
            throw new SQLException("Unserializable device info", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DEVICE_INFO_TYPE);
        } catch (JsonProcessingException e) {
            LOG.warnv("Ignoring unreadable device info: {0}", e.getMessage());
            return Map.of();
        }
    }
}
