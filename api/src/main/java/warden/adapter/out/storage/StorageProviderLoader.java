package warden.adapter.out.storage;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agroal.api.AgroalDataSource;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.jdbc.JdbcAccountRepository;
import warden.adapter.out.storage.jdbc.JdbcExecutor;
import warden.adapter.out.storage.jdbc.JdbcRbacRepository;
import warden.adapter.out.storage.jdbc.JdbcRefreshTokenRepository;
import warden.adapter.out.storage.memory.InMemoryAccountRepository;
import warden.adapter.out.storage.memory.InMemoryFailedLoginRepository;
import warden.adapter.out.storage.memory.InMemoryPermissionCacheRepository;
import warden.adapter.out.storage.memory.InMemoryRbacRepository;
import warden.adapter.out.storage.memory.InMemoryRefreshTokenRepository;
import warden.adapter.out.storage.memory.InMemoryTokenRevocationRepository;
import warden.adapter.out.storage.redis.RedisFailedLoginRepository;
import warden.adapter.out.storage.redis.RedisPermissionCacheRepository;
import warden.adapter.out.storage.redis.RedisTokenRevocationRepository;
import warden.core.config.PermissionCacheConfig;
import warden.core.config.ResiliencyConfig;
import warden.core.config.StorageConfig;
import warden.core.port.out.AccountRepository;
import warden.core.port.out.FailedLoginRepository;
import warden.core.port.out.Metrics;
import warden.core.port.out.PermissionCacheRepository;
import warden.core.port.out.RbacRepository;
import warden.core.port.out.RefreshTokenRepository;
import warden.core.port.out.TokenRevocationRepository;

/**
 * CDI producer for the storage ports.
 *
 * <p>Selects implementations from {@code warden.storage}:
 * <ul>
 *   <li>{@code registry=redis} (default) - revocation registry, permission cache
 *       and login failure counters in Redis</li>
 *   <li>{@code relational=jdbc} (default) - refresh tokens, accounts and RBAC in
 *       PostgreSQL through the Agroal pool</li>
 *   <li>{@code memory} - single-instance in-memory stores for development</li>
 * </ul>
 */
@ApplicationScoped
public class StorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(StorageProviderLoader.class);

    private static final String MEMORY = "memory";
    private static final long IN_MEMORY_CACHE_ENTRIES = 10_000;

    private final StorageConfig storageConfig;
    private final ResiliencyConfig resiliencyConfig;
    private final PermissionCacheConfig permissionCacheConfig;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Instance<AgroalDataSource> dataSource;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;
    private final Clock clock;

    private InMemoryAccountRepository inMemoryAccounts;

    @Inject
    public StorageProviderLoader(
            StorageConfig storageConfig,
            ResiliencyConfig resiliencyConfig,
            PermissionCacheConfig permissionCacheConfig,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Instance<AgroalDataSource> dataSource,
            ObjectMapper objectMapper,
            Metrics metrics,
            Clock clock) {
        this.storageConfig = storageConfig;
        this.resiliencyConfig = resiliencyConfig;
        this.permissionCacheConfig = permissionCacheConfig;
        this.redisDataSource = redisDataSource;
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Produces
    @ApplicationScoped
    public TokenRevocationRepository tokenRevocationRepository() {
        if (useInMemoryRegistry()) {
            return new InMemoryTokenRevocationRepository(clock);
        }
        return new RedisTokenRevocationRepository(redis(), redisTimeout(), metrics);
    }

    @Produces
    @ApplicationScoped
    public PermissionCacheRepository permissionCacheRepository() {
        if (useInMemoryRegistry()) {
            return new InMemoryPermissionCacheRepository(IN_MEMORY_CACHE_ENTRIES);
        }
        return new RedisPermissionCacheRepository(
                redis(), objectMapper, redisTimeout(), permissionCacheConfig.scanBatchSize(), metrics);
    }

    @Produces
    @ApplicationScoped
    public FailedLoginRepository failedLoginRepository() {
        if (useInMemoryRegistry()) {
            return new InMemoryFailedLoginRepository(clock);
        }
        return new RedisFailedLoginRepository(redis(), redisTimeout(), metrics);
    }

    @Produces
    @ApplicationScoped
    public RefreshTokenRepository refreshTokenRepository() {
        if (useInMemoryRelational()) {
            return new InMemoryRefreshTokenRepository(inMemoryAccounts());
        }
        return new JdbcRefreshTokenRepository(jdbc("refresh_tokens"), objectMapper);
    }

    @Produces
    @ApplicationScoped
    public AccountRepository accountRepository() {
        if (useInMemoryRelational()) {
            return inMemoryAccounts();
        }
        return new JdbcAccountRepository(jdbc("users"));
    }

    @Produces
    @ApplicationScoped
    public RbacRepository rbacRepository() {
        if (useInMemoryRelational()) {
            return new InMemoryRbacRepository();
        }
        return new JdbcRbacRepository(jdbc("rbac"));
    }

    private boolean useInMemoryRegistry() {
        if (MEMORY.equalsIgnoreCase(storageConfig.registry())) {
            LOG.warn("Using in-memory registry storage; state is not shared between instances");
            return true;
        }
        return false;
    }

    private boolean useInMemoryRelational() {
        if (MEMORY.equalsIgnoreCase(storageConfig.relational())) {
            LOG.warn("Using in-memory relational storage; sessions are lost on restart");
            return true;
        }
        return false;
    }

    private synchronized InMemoryAccountRepository inMemoryAccounts() {
        if (inMemoryAccounts == null) {
            inMemoryAccounts = new InMemoryAccountRepository();
        }
        return inMemoryAccounts;
    }

    private ReactiveRedisDataSource redis() {
        if (!redisDataSource.isResolvable()) {
            throw new IllegalStateException(
                    "warden.storage.registry=redis but no ReactiveRedisDataSource is available");
        }
        return redisDataSource.get();
    }

    private JdbcExecutor jdbc(String storeName) {
        if (!dataSource.isResolvable()) {
            throw new IllegalStateException("warden.storage.relational=jdbc but no datasource is configured");
        }
        return new JdbcExecutor(dataSource.get(), resiliencyConfig.jdbc().queryTimeout(), metrics, storeName);
    }

    private Duration redisTimeout() {
        return resiliencyConfig.redis().operationTimeout();
    }
}
