package warden.adapter.out.storage.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

import io.agroal.api.AgroalDataSource;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import warden.core.model.common.StoreUnavailableException;
import warden.core.port.out.Metrics;

/**
 * Runs blocking JDBC work off the event loop.
 *
 * <p>Work is subscribed on the Mutiny default worker pool. Every statement
 * prepared through {@link #prepare} carries the configured query timeout, and
 * any {@link SQLException} surfaces as {@link StoreUnavailableException}.
 */
public class JdbcExecutor {

    private static final Logger LOG = Logger.getLogger(JdbcExecutor.class);

    /**
     * Unit of JDBC work against a borrowed connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    private final AgroalDataSource dataSource;
    private final int queryTimeoutSeconds;
    private final Metrics metrics;
    private final String storeName;

    public JdbcExecutor(AgroalDataSource dataSource, Duration queryTimeout, Metrics metrics, String storeName) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
        this.metrics = metrics;
        this.storeName = storeName;
    }

    /**
     * Run work in auto-commit mode.
     */
    public <T> Uni<T> query(String operationName, SqlWork<T> work) {
        return Uni.createFrom()
                .item(() -> {
                    try (Connection connection = dataSource.getConnection()) {
                        return work.apply(connection);
                    } catch (SQLException e) {
                        throw failure(operationName, e);
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    /**
     * Run work in one transaction, committed when the work returns and rolled
     * back when it throws.
     */
    public <T> Uni<T> inTransaction(String operationName, SqlWork<T> work) {
        return Uni.createFrom()
                .item(() -> {
                    try (Connection connection = dataSource.getConnection()) {
                        connection.setAutoCommit(false);
                        try {
                            final var result = work.apply(connection);
                            connection.commit();
                            return result;
                        } catch (SQLException | RuntimeException e) {
                            connection.rollback();
                            throw e;
                        } finally {
                            connection.setAutoCommit(true);
                        }
                    } catch (SQLException e) {
                        throw failure(operationName, e);
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    /**
     * Prepare a statement with the query timeout applied.
     */
    public PreparedStatement prepare(Connection connection, String sql) throws SQLException {
        final var statement = connection.prepareStatement(sql);
        statement.setQueryTimeout(queryTimeoutSeconds);
        return statement;
    }

    static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private StoreUnavailableException failure(String operationName, SQLException e) {
        LOG.warnv("JDBC operation failure: {0} in {1}: {2} (SQLState {3})",
                operationName, storeName, e.getMessage(), e.getSQLState());
        if (metrics != null) {
            metrics.recordStoreFailure(storeName, operationName);
        }
        return new StoreUnavailableException(storeName, "JDBC operation failed: " + operationName, e);
    }
}
