package com.admissioncontrol.storage;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Abstraction over the shared key-value store (Redis in production).
 * Every method is a single atomic operation against the store, so
 * several processes can mutate the same keys safely.
 */
public interface StateStorage {

    /**
     * @return the string value of a key, or null if absent or expired
     */
    String get(String key);

    /**
     * Set a value. A null ttl keeps the key until it is deleted.
     */
    void set(String key, String value, Duration ttl);

    void delete(String... keys);

    boolean exists(String key);

    /**
     * Increment a counter, keeping any expiration it already has.
     *
     * @return new value after increment
     */
    long increment(String key);

    /**
     * Increment a counter and (re)set its TTL in one round trip.
     */
    long incrementAndExpire(String key, Duration ttl);

    /**
     * @return all fields of a hash, empty if the key does not exist
     */
    Map<String, String> hashGetAll(String key);

    long hashIncrement(String key, String field, long delta);

    /**
     * Push onto the head of a list.
     *
     * @return list length after the push
     */
    long leftPush(String key, String value);

    /**
     * Atomically pop the oldest element (tail) of {@code source} and push it
     * onto the head of {@code destination}, waiting up to {@code timeout}.
     *
     * @return the moved element, or null when the wait timed out
     */
    String blockingMove(String source, String destination, Duration timeout);

    long listLength(String key);

    /**
     * Remove the first occurrence of a value from a list.
     *
     * @return number of removed elements
     */
    long listRemove(String key, String value);

    /**
     * @return every element of a list, head first
     */
    List<String> listRange(String key);

    /**
     * Optimistic multi-key transaction: watch the keys, hand their current
     * values to the transaction, commit whatever it wrote.
     *
     * @param keys keys to watch and read
     * @param transaction builds the writes; must return a non-null result
     * @return the transaction result, or empty if another writer touched a
     *         watched key before the commit
     */
    <T> Optional<T> watchAndCommit(List<String> keys, StorageTransaction<T> transaction);

    /**
     * @return true if {@link #evalScript} can run server-side scripts
     */
    boolean supportsScripting();

    /**
     * Execute a Lua script atomically on the store.
     */
    Object evalScript(String script, List<String> keys, List<String> args);

    /**
     * Health check
     */
    boolean isAvailable();

    /**
     * Body of a {@link #watchAndCommit} call.
     */
    @FunctionalInterface
    interface StorageTransaction<T> {

        /**
         * @param snapshot current values of the watched keys; absent keys are missing from the map
         * @param writer queues the writes committed with the transaction
         */
        T execute(Map<String, String> snapshot, TransactionWriter writer);
    }

    /**
     * Writes queued inside a transaction. Nothing is visible to other
     * writers until the transaction commits.
     */
    interface TransactionWriter {

        void set(String key, String value, Duration ttl);

        void delete(String key);
    }
}
