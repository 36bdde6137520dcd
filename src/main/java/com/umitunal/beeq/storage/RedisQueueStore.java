package com.umitunal.beeq.storage;

import com.umitunal.beeq.config.QueueConfig;
import com.umitunal.beeq.core.QueueStore;
import com.umitunal.beeq.exception.StoreException;
import com.umitunal.beeq.exception.StoreTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.args.ListDirection;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * Redis implementation of QueueStore.
 * <p>Lists are Redis LISTs, records are plain string keys with an expiry. The blocking move
 * is {@code BLMOVE source dest LEFT RIGHT}, which needs Redis 6.2 or newer.
 * <p>Connections come from a Jedis pool; borrowing waits at most the configured connect timeout.
 */
public class RedisQueueStore implements QueueStore {

    private static final Logger log = LogManager.getLogger(RedisQueueStore.class);

    private final JedisPool jedisPool;
    private final Duration socketTimeout;

    public RedisQueueStore(QueueConfig config) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(config.getPoolSize());
        poolConfig.setMaxIdle(config.getPoolSize());
        poolConfig.setMinIdle(1);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(config.getConnectTimeout());

        this.socketTimeout = config.getOperationTimeout();

        JedisClientConfig clientConfig = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(Math.toIntExact(config.getConnectTimeout().toMillis()))
                .socketTimeoutMillis(Math.toIntExact(socketTimeout.toMillis()))
                .user(config.getUsername())
                .password(config.getPassword())
                .database(config.getDatabase())
                .clientName("beeq-" + config.getEnvironment())
                .build();

        this.jedisPool = new JedisPool(poolConfig, new HostAndPort(config.getHost(), config.getPort()), clientConfig);
        log.info("Redis queue store created: host={}, port={}, db={}, poolSize={}",
                config.getHost(), config.getPort(), config.getDatabase(), config.getPoolSize());
    }

    /**
     * Wrap an existing pool. The store takes ownership and closes it.
     */
    public RedisQueueStore(JedisPool jedisPool, Duration socketTimeout) {
        this.jedisPool = jedisPool;
        this.socketTimeout = socketTimeout;
    }

    @Override
    public void appendRight(String listKey, String value) throws StoreException {
        execute("RPUSH " + listKey, jedis -> jedis.rpush(listKey, value));
    }

    @Override
    public void appendLeft(String listKey, String value) throws StoreException {
        execute("LPUSH " + listKey, jedis -> jedis.lpush(listKey, value));
    }

    @Override
    public String popLeft(String listKey) throws StoreException {
        return execute("LPOP " + listKey, jedis -> jedis.lpop(listKey));
    }

    @Override
    public String moveBlocking(String sourceKey, String destKey, int timeoutSeconds) throws StoreException {
        // Jedis lifts the socket timeout for the duration of blocking commands
        return execute("BLMOVE " + sourceKey,
                jedis -> jedis.blmove(sourceKey, destKey, ListDirection.LEFT, ListDirection.RIGHT, timeoutSeconds));
    }

    @Override
    public boolean removeOne(String listKey, String value) throws StoreException {
        Long removed = execute("LREM " + listKey, jedis -> jedis.lrem(listKey, 1, value));
        return removed != null && removed > 0;
    }

    @Override
    public long length(String listKey) throws StoreException {
        Long length = execute("LLEN " + listKey, jedis -> jedis.llen(listKey));
        return length == null ? 0 : length;
    }

    @Override
    public List<String> range(String listKey) throws StoreException {
        return execute("LRANGE " + listKey, jedis -> jedis.lrange(listKey, 0, -1));
    }

    @Override
    public void setWithExpiry(String key, String value, long ttlSeconds) throws StoreException {
        execute("SETEX " + key, jedis -> jedis.setex(key, ttlSeconds, value));
    }

    @Override
    public void setAndAppendRight(String key, String listKey, String value, long ttlSeconds) throws StoreException {
        execute("MULTI SETEX+RPUSH " + key, jedis -> {
            // An unfinished MULTI is discarded when the connection goes back to the pool
            Transaction tx = jedis.multi();
            tx.setex(key, ttlSeconds, value);
            tx.rpush(listKey, value);
            return tx.exec();
        });
    }

    @Override
    public String get(String key) throws StoreException {
        return execute("GET " + key, jedis -> jedis.get(key));
    }

    @Override
    public void delete(String key) throws StoreException {
        execute("DEL " + key, jedis -> jedis.del(key));
    }

    @Override
    public boolean ping() throws StoreException {
        return "PONG".equalsIgnoreCase(execute("PING", Jedis::ping));
    }

    @Override
    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            try {
                jedisPool.close();
                log.debug("Redis connection pool closed");
            } catch (JedisException e) {
                log.warn("Error closing Redis connection pool: {}", e.getMessage());
            }
        }
    }

    private <V> V execute(String operation, JedisCall<V> call) throws StoreException {
        try (Jedis jedis = jedisPool.getResource()) {
            return call.apply(jedis);
        } catch (JedisConnectionException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new StoreTimeoutException(operation, socketTimeout);
            }
            throw new StoreException("Redis connection failed during " + operation + ": " + e.getMessage(), e);
        } catch (JedisException e) {
            throw new StoreException("Redis error during " + operation + ": " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface JedisCall<V> {
        V apply(Jedis jedis);
    }
}
