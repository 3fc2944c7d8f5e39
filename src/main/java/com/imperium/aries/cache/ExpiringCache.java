package com.imperium.aries.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 进程内 key-value 缓存，条目按 TTL 过期。
 * 过期条目在访问时惰性剔除，另由定时任务周期清扫。单个 key 上的操作是原子的。
 */
@Component
public class ExpiringCache {

    private static final Logger log = LoggerFactory.getLogger(ExpiringCache.class);

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public ExpiringCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return 未过期的值；不存在或已过期时返回 null
     */
    public String get(String key) {
        Instant now = clock.instant();
        Entry entry = entries.computeIfPresent(key, (k, old) -> old.isExpired(now) ? null : old);
        return entry != null ? entry.value() : null;
    }

    public void put(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    /**
     * 存在未过期的值则原样返回，否则用 supplier 生成新值并以 ttl 写入。
     * 命中时不刷新过期时间。
     */
    public String getOrCreate(String key, Supplier<String> supplier, Duration ttl) {
        Instant now = clock.instant();
        return entries.compute(key, (k, old) -> {
            if (old != null && !old.isExpired(now)) {
                return old;
            }
            return new Entry(supplier.get(), now.plus(ttl));
        }).value();
    }

    /**
     * 删除并返回未过期的值；不存在或已过期时返回 null。
     */
    public String remove(String key) {
        Entry removed = entries.remove(key);
        if (removed == null || removed.isExpired(clock.instant())) {
            return null;
        }
        return removed.value();
    }

    public int size() {
        return entries.size();
    }

    @Scheduled(fixedDelayString = "${app.cache.sweep-interval-ms:60000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired cache entries, {} remaining", evicted, entries.size());
        }
    }

    private record Entry(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
