package warden.adapter.out.storage.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.Account;
import warden.core.port.out.AccountRepository;

/**
 * Reads accounts from the {@code users} table.
 */
public class JdbcAccountRepository implements AccountRepository {

    private static final String FIND_BY_EMAIL =
            """
            SELECT id, email, password_hash, is_active, last_login_at
            FROM users
            WHERE lower(email) = lower(?) AND deleted_at IS NULL
            """;

    private final JdbcExecutor jdbc;

    public JdbcAccountRepository(JdbcExecutor jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Uni<Optional<Account>> findByEmail(String email) {
        return jdbc.query("findByEmail", connection -> {
            try (var ps = jdbc.prepare(connection, FIND_BY_EMAIL)) {
                ps.setString(1, email.trim());
                try (var rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<Account>empty();
                }
            }
        });
    }

    private static Account map(ResultSet rs) throws SQLException {
        return new Account(
                rs.getString("id"),
                rs.getString("email"),
                rs.getString("password_hash"),
                rs.getBoolean("is_active"),
                JdbcExecutor.instant(rs.getTimestamp("last_login_at")));
    }
}
