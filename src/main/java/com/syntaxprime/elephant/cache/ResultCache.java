package com.syntaxprime.elephant.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Size-bounded, thread-safe memoization of computed results keyed by request signature.
 *
 * <p>Entries either expire a fixed time after being written ({@code ttl} present) or live until
 * explicitly invalidated. Caffeine evicts least-recently-used entries once {@code maxSize} is reached.</p>
 */
public class ResultCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final String name;
    private final long maxSize;
    private final Duration ttl;
    private final Cache<K, V> cache;

    public ResultCache(String name, long maxSize, Duration ttl) {
        this(name, maxSize, ttl, Ticker.systemTicker());
    }

    ResultCache(String name, long maxSize, Duration ttl, Ticker ticker) {
        this.name = name;
        this.maxSize = Math.max(1L, maxSize);
        this.ttl = ttl;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(this.maxSize)
                .ticker(ticker);
        if (ttl != null) {
            builder.expireAfterWrite(ttl);
        }
        this.cache = builder.build();
        log.info("Result cache '{}' initialized: maxSize={}, ttl={}", name, this.maxSize, ttl == null ? "none" : ttl);
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(this.cache.getIfPresent(key));
    }

    public void put(K key, V value) {
        if (key == null || value == null) {
            return;
        }
        this.cache.put(key, value);
    }

    public void invalidate(K key) {
        this.cache.invalidate(key);
    }

    /**
     * Removes every entry whose key matches. Returns how many were removed.
     */
    public int invalidateIf(Predicate<K> keyFilter) {
        List<K> matching = new ArrayList<>();
        for (K key : this.cache.asMap().keySet()) {
            if (keyFilter.test(key)) {
                matching.add(key);
            }
        }
        this.cache.invalidateAll(matching);
        return matching.size();
    }

    public void clear() {
        this.cache.invalidateAll();
        this.cache.cleanUp();
    }

    /**
     * Runs pending expiry and eviction now. Returns the number of entries dropped.
     */
    public long cleanup() {
        long before = this.cache.estimatedSize();
        this.cache.cleanUp();
        long removed = Math.max(0L, before - this.cache.estimatedSize());
        if (removed > 0 && log.isDebugEnabled()) {
            log.debug("Result cache '{}' dropped {} expired entries", this.name, removed);
        }
        return removed;
    }

    public CacheStats stats() {
        this.cache.cleanUp();
        return new CacheStats(this.name, this.cache.estimatedSize(), this.maxSize, this.ttl);
    }

    public String name() {
        return this.name;
    }

    public record CacheStats(String name, long size, long maxSize, Duration ttl) {
    }
}
