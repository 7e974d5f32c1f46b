package com.admissioncontrol.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Process-local storage used for degraded operation and tests.
 *
 * NOT authoritative: state lives in this JVM only, so limits are not
 * coordinated with other instances. Expiration is handled by Caffeine,
 * driven by the supplied clock. Every operation holds the instance
 * monitor, which makes transactions trivially atomic.
 */
public class InMemoryStateStorage implements StateStorage {

    private final Cache<String, Entry> entries;

    public InMemoryStateStorage() {
        this(Clock.systemUTC());
    }

    public InMemoryStateStorage(Clock clock) {
        // epoch nanos overflow a long, so tick from construction time
        long origin = clock.millis();
        this.entries = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis() - origin))
                .expireAfter(new EntryExpiry())
                .build();
    }

    @Override
    public synchronized String get(String key) {
        Entry entry = entries.getIfPresent(key);
        return entry != null ? entry.text(key) : null;
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        entries.put(key, new TextEntry(value, ttl, false));
    }

    @Override
    public synchronized void delete(String... keys) {
        for (String key : keys) {
            entries.invalidate(key);
        }
    }

    @Override
    public synchronized boolean exists(String key) {
        return entries.getIfPresent(key) != null;
    }

    @Override
    public synchronized long increment(String key) {
        Entry entry = entries.getIfPresent(key);
        long next = (entry == null ? 0L : parseCounter(key, entry)) + 1;
        entries.put(key, new TextEntry(String.valueOf(next), entry == null ? null : entry.ttl, entry != null));
        return next;
    }

    @Override
    public synchronized long incrementAndExpire(String key, Duration ttl) {
        Entry entry = entries.getIfPresent(key);
        long next = (entry == null ? 0L : parseCounter(key, entry)) + 1;
        entries.put(key, new TextEntry(String.valueOf(next), ttl, false));
        return next;
    }

    @Override
    public synchronized Map<String, String> hashGetAll(String key) {
        Entry entry = entries.getIfPresent(key);
        if (entry == null) {
            return Map.of();
        }
        return new HashMap<>(entry.hash(key));
    }

    @Override
    public synchronized long hashIncrement(String key, String field, long delta) {
        Entry entry = entries.getIfPresent(key);
        if (entry == null) {
            entry = new HashEntry();
            entries.put(key, entry);
        }
        Map<String, String> hash = entry.hash(key);
        long next = Long.parseLong(hash.getOrDefault(field, "0")) + delta;
        hash.put(field, String.valueOf(next));
        return next;
    }

    @Override
    public synchronized long leftPush(String key, String value) {
        Deque<String> list = listFor(key, true);
        list.addFirst(value);
        notifyAll();
        return list.size();
    }

    @Override
    public synchronized String blockingMove(String source, String destination, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        Deque<String> list = listFor(source, false);
        while (list == null || list.isEmpty()) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return null;
            }
            try {
                wait(remainingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
            list = listFor(source, false);
        }
        String value = list.pollLast();
        listFor(destination, true).addFirst(value);
        return value;
    }

    @Override
    public synchronized long listLength(String key) {
        Deque<String> list = listFor(key, false);
        return list == null ? 0 : list.size();
    }

    @Override
    public synchronized long listRemove(String key, String value) {
        Deque<String> list = listFor(key, false);
        return list != null && list.removeFirstOccurrence(value) ? 1 : 0;
    }

    @Override
    public synchronized List<String> listRange(String key) {
        Deque<String> list = listFor(key, false);
        return list == null ? List.of() : new ArrayList<>(list);
    }

    @Override
    public synchronized <T> Optional<T> watchAndCommit(List<String> keys, StorageTransaction<T> transaction) {
        Map<String, String> snapshot = new HashMap<>();
        for (String key : keys) {
            Entry entry = entries.getIfPresent(key);
            if (entry != null) {
                snapshot.put(key, entry.text(key));
            }
        }
        // the monitor is held for the whole body, so there is no concurrent writer to lose against
        return Optional.of(transaction.execute(snapshot, new TransactionWriter() {
            @Override
            public void set(String key, String value, Duration ttl) {
                InMemoryStateStorage.this.set(key, value, ttl);
            }

            @Override
            public void delete(String key) {
                InMemoryStateStorage.this.delete(key);
            }
        }));
    }

    @Override
    public boolean supportsScripting() {
        return false;
    }

    @Override
    public Object evalScript(String script, List<String> keys, List<String> args) {
        throw new UnsupportedOperationException("In-memory storage cannot run server-side scripts");
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private Deque<String> listFor(String key, boolean create) {
        Entry entry = entries.getIfPresent(key);
        if (entry == null) {
            if (!create) {
                return null;
            }
            entry = new ListEntry();
            entries.put(key, entry);
        }
        return entry.list(key);
    }

    private static long parseCounter(String key, Entry entry) {
        try {
            return Long.parseLong(entry.text(key));
        } catch (NumberFormatException e) {
            throw new StorageException("Key " + key + " does not hold an integer", e);
        }
    }

    /**
     * A stored value plus its time-to-live. {@code keepTtl} marks updates
     * that must not reset an existing expiration.
     */
    private abstract static class Entry {
        final Duration ttl;
        final boolean keepTtl;

        Entry(Duration ttl, boolean keepTtl) {
            this.ttl = ttl;
            this.keepTtl = keepTtl;
        }

        String text(String key) {
            throw new StorageException("Key " + key + " does not hold a string value");
        }

        Map<String, String> hash(String key) {
            throw new StorageException("Key " + key + " does not hold a hash");
        }

        Deque<String> list(String key) {
            throw new StorageException("Key " + key + " does not hold a list");
        }

        long ttlNanos() {
            return ttl == null ? Long.MAX_VALUE : ttl.toNanos();
        }
    }

    private static final class TextEntry extends Entry {
        private final String value;

        TextEntry(String value, Duration ttl, boolean keepTtl) {
            super(ttl, keepTtl);
            this.value = value;
        }

        @Override
        String text(String key) {
            return value;
        }
    }

    private static final class HashEntry extends Entry {
        private final Map<String, String> fields = new LinkedHashMap<>();

        HashEntry() {
            super(null, false);
        }

        @Override
        Map<String, String> hash(String key) {
            return fields;
        }
    }

    private static final class ListEntry extends Entry {
        private final Deque<String> items = new ArrayDeque<>();

        ListEntry() {
            super(null, false);
        }

        @Override
        Deque<String> list(String key) {
            return items;
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.keepTtl ? currentDuration : entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
