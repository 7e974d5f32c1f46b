package com.admissioncontrol.storage;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.args.ListDirection;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Redis-backed storage implementation.
 *
 * Only idempotent commands off the admission path (plain sets, deletes and
 * read-only inspection) are retried on transient failures. Everything a
 * permit or breaker decision reads or writes, and every command that is
 * unsafe to re-send after a read timeout (counters, list pushes and moves,
 * scripts, transactions), gets a single attempt.
 */
@Slf4j
public class RedisStateStorage implements StateStorage {

    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 100;
    private static final long POOL_MAX_WAIT_MS = 250;
    private static final int CONNECT_TIMEOUT_MS = 500;
    private static final int SOCKET_TIMEOUT_MS = 5000;

    private final JedisPool jedisPool;
    private final int maxRetries;
    private final long retryDelayMs;

    public RedisStateStorage(String host, int port) {
        this(createPool(host, port), DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY_MS);
        log.info("Redis storage initialized: {}:{}", host, port);
    }

    RedisStateStorage(JedisPool jedisPool, int maxRetries, long retryDelayMs) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        this.jedisPool = jedisPool;
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
    }

    private static JedisPool createPool(String host, int port) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(128);
        poolConfig.setMaxIdle(32);
        poolConfig.setMinIdle(16);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(POOL_MAX_WAIT_MS));
        // socket timeout must outlast the longest blocking list move
        JedisClientConfig clientConfig = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(CONNECT_TIMEOUT_MS)
                .socketTimeoutMillis(SOCKET_TIMEOUT_MS)
                .build();
        return new JedisPool(poolConfig, new HostAndPort(host, port), clientConfig);
    }

    @Override
    public String get(String key) {
        return executeOnce(jedis -> jedis.get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        executeWithRetry(jedis -> {
            if (ttl == null) {
                return jedis.set(key, value);
            }
            return jedis.set(key, value, new SetParams().px(ttl.toMillis()));
        });
    }

    @Override
    public void delete(String... keys) {
        if (keys.length == 0) {
            return;
        }
        executeWithRetry(jedis -> jedis.del(keys));
    }

    @Override
    public boolean exists(String key) {
        return executeWithRetry(jedis -> jedis.exists(key));
    }

    @Override
    public long increment(String key) {
        return executeOnce(jedis -> jedis.incr(key));
    }

    @Override
    public long incrementAndExpire(String key, Duration ttl) {
        return executeOnce(jedis -> {
            Transaction tx = jedis.multi();
            var incrResp = tx.incr(key);
            tx.pexpire(key, ttl.toMillis());
            tx.exec();
            return incrResp.get();
        });
    }

    @Override
    public Map<String, String> hashGetAll(String key) {
        return executeWithRetry(jedis -> jedis.hgetAll(key));
    }

    @Override
    public long hashIncrement(String key, String field, long delta) {
        return executeOnce(jedis -> jedis.hincrBy(key, field, delta));
    }

    @Override
    public long leftPush(String key, String value) {
        return executeOnce(jedis -> jedis.lpush(key, value));
    }

    @Override
    public String blockingMove(String source, String destination, Duration timeout) {
        double seconds = timeout.toMillis() / 1000.0;
        return executeOnce(jedis ->
                jedis.blmove(source, destination, ListDirection.RIGHT, ListDirection.LEFT, seconds));
    }

    @Override
    public long listLength(String key) {
        return executeWithRetry(jedis -> jedis.llen(key));
    }

    @Override
    public long listRemove(String key, String value) {
        return executeOnce(jedis -> jedis.lrem(key, 1, value));
    }

    @Override
    public List<String> listRange(String key) {
        return executeWithRetry(jedis -> jedis.lrange(key, 0, -1));
    }

    @Override
    public <T> Optional<T> watchAndCommit(List<String> keys, StorageTransaction<T> transaction) {
        return executeOnce(jedis -> {
            String[] watched = keys.toArray(new String[0]);
            jedis.watch(watched);
            try {
                Map<String, String> snapshot = new HashMap<>();
                for (String key : watched) {
                    String value = jedis.get(key);
                    if (value != null) {
                        snapshot.put(key, value);
                    }
                }

                QueuedWrites writes = new QueuedWrites();
                T result = transaction.execute(snapshot, writes);
                if (writes.isEmpty()) {
                    jedis.unwatch();
                    return Optional.of(result);
                }

                Transaction tx = jedis.multi();
                writes.applyTo(tx);
                List<Object> committed = tx.exec();
                if (committed == null) {
                    log.debug("Transaction on {} aborted by a concurrent writer", keys);
                    return Optional.empty();
                }
                return Optional.of(result);
            } catch (RuntimeException e) {
                jedis.unwatch();
                throw e;
            }
        });
    }

    @Override
    public boolean supportsScripting() {
        return true;
    }

    @Override
    public Object evalScript(String script, List<String> keys, List<String> args) {
        return executeOnce(jedis -> jedis.eval(script, keys, args));
    }

    @Override
    public boolean isAvailable() {
        try (var jedis = jedisPool.getResource()) {
            return "PONG".equals(jedis.ping());
        } catch (Exception e) {
            log.warn("Redis health check failed", e);
            return false;
        }
    }

    private <T> T executeOnce(StorageOperation<T> operation) {
        try (Jedis jedis = jedisPool.getResource()) {
            return operation.execute(jedis);
        } catch (JedisException e) {
            log.warn("Storage operation failed: {}", e.getMessage());
            throw new StorageException("Operation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Retry wrapper for transient Redis failures, for idempotent commands
     * only. Errors raised by caller code are not retried.
     */
    private <T> T executeWithRetry(StorageOperation<T> operation) {
        JedisException lastException = null;

        for (int i = 0; i < maxRetries; i++) {
            try (Jedis jedis = jedisPool.getResource()) {
                return operation.execute(jedis);
            } catch (JedisException e) {
                lastException = e;
                log.warn("Storage operation failed (attempt {}/{}): {}",
                        i + 1, maxRetries, e.getMessage());

                if (i < maxRetries - 1) {
                    try {
                        Thread.sleep(retryDelayMs * (1L << i));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }

        throw new StorageException("Operation failed after " + maxRetries + " retries", lastException);
    }

    @FunctionalInterface
    private interface StorageOperation<T> {
        T execute(Jedis jedis);
    }

    private static final class QueuedWrites implements TransactionWriter {

        private final List<Write> writes = new ArrayList<>();

        @Override
        public void set(String key, String value, Duration ttl) {
            writes.add(new Write(key, value, ttl));
        }

        @Override
        public void delete(String key) {
            writes.add(new Write(key, null, null));
        }

        boolean isEmpty() {
            return writes.isEmpty();
        }

        void applyTo(Transaction tx) {
            for (Write write : writes) {
                if (write.value == null) {
                    tx.del(write.key);
                } else if (write.ttl == null) {
                    tx.set(write.key, write.value);
                } else {
                    tx.set(write.key, write.value, new SetParams().px(write.ttl.toMillis()));
                }
            }
        }

        private record Write(String key, String value, Duration ttl) {}
    }

    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis connection pool closed");
        }
    }
}
