package fr.lapetina.feedback.orchestrator.infrastructure.cache;

import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded result cache with one independent LRU partition per analysis kind.
 *
 * Eviction pressure in one partition never displaces entries of another. Reads refresh
 * recency. An optional time-to-live expires entries on read.
 *
 * Thread-safe: each partition is guarded by its own monitor.
 */
public final class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    static final int MAX_RAW_KEY_LENGTH = 1000;
    static final int KEY_PREFIX_LENGTH = 100;

    private final Map<AnalysisKind, Partition> partitions = new EnumMap<>(AnalysisKind.class);
    private final Duration ttl;
    private final Clock clock;

    /**
     * @param capacities maximum entry count per partition
     * @param ttl        time-to-live, {@code null} or zero to disable
     */
    public ResultCache(Map<AnalysisKind, Integer> capacities, Duration ttl, Clock clock) {
        this.ttl = ttl != null && !ttl.isZero() && !ttl.isNegative() ? ttl : null;
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        for (AnalysisKind kind : AnalysisKind.values()) {
            Integer capacity = capacities.get(kind);
            if (capacity == null || capacity <= 0) {
                throw new IllegalArgumentException("Capacity must be positive for partition " + kind);
            }
            partitions.put(kind, new Partition(kind, capacity));
        }
        log.info("ResultCache initialized: capacities={}, ttl={}", capacities, this.ttl);
    }

    public ResultCache(int capacityPerPartition) {
        this(Map.of(
                AnalysisKind.SENTIMENT, capacityPerPartition,
                AnalysisKind.INSIGHT, capacityPerPartition,
                AnalysisKind.SUMMARY, capacityPerPartition
        ), null, Clock.systemUTC());
    }

    public Optional<AnalysisResult> get(String text, AnalysisKind partition) {
        return partitions.get(partition).get(cacheKey(text), clock.instant());
    }

    public void put(String text, AnalysisResult result, AnalysisKind partition) {
        Objects.requireNonNull(result, "Result is required");
        if (result.kind() != partition) {
            throw new IllegalArgumentException(
                    "Result of kind " + result.kind() + " cannot be stored in partition " + partition);
        }
        partitions.get(partition).put(cacheKey(text), result, clock.instant());
    }

    public CacheStats stats() {
        long hits = 0;
        long misses = 0;
        Map<AnalysisKind, CacheStats.PartitionStats> perPartition = new EnumMap<>(AnalysisKind.class);
        for (Partition partition : partitions.values()) {
            CacheStats.PartitionStats stats = partition.stats();
            perPartition.put(partition.kind, stats);
            hits += stats.hits();
            misses += stats.misses();
        }
        return new CacheStats(hits, misses, perPartition);
    }

    public int size(AnalysisKind partition) {
        return partitions.get(partition).size();
    }

    public void clear() {
        partitions.values().forEach(Partition::clear);
        log.info("ResultCache cleared");
    }

    /**
     * Short texts key themselves; long texts key on a prefix plus a SHA-256 digest of the whole text.
     */
    public static String cacheKey(String text) {
        Objects.requireNonNull(text, "Text is required");
        if (text.length() <= MAX_RAW_KEY_LENGTH) {
            return text;
        }
        return text.substring(0, KEY_PREFIX_LENGTH) + "_" + sha256(text);
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private final class Partition {

        private final AnalysisKind kind;
        private final int capacity;
        private final LinkedHashMap<String, CacheEntry> entries;
        private final AtomicLong hits = new AtomicLong();
        private final AtomicLong misses = new AtomicLong();
        private final AtomicLong evictions = new AtomicLong();

        Partition(AnalysisKind kind, int capacity) {
            this.kind = kind;
            this.capacity = capacity;
            this.entries = new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                    if (size() > Partition.this.capacity) {
                        evictions.incrementAndGet();
                        log.debug("Evicting cache entry: partition={}, lastAccess={}",
                                Partition.this.kind, eldest.getValue().lastAccess());
                        return true;
                    }
                    return false;
                }
            };
        }

        synchronized Optional<AnalysisResult> get(String key, Instant now) {
            CacheEntry entry = entries.get(key);
            if (entry != null && isExpired(entry, now)) {
                entries.remove(key);
                entry = null;
            }
            if (entry == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            entries.put(key, entry.touch(now));
            hits.incrementAndGet();
            return Optional.of(entry.value());
        }

        synchronized void put(String key, AnalysisResult result, Instant now) {
            entries.put(key, new CacheEntry(key, result, kind, now, now));
        }

        synchronized int size() {
            return entries.size();
        }

        synchronized void clear() {
            entries.clear();
        }

        synchronized CacheStats.PartitionStats stats() {
            return new CacheStats.PartitionStats(entries.size(), capacity, hits.get(), misses.get(), evictions.get());
        }

        private boolean isExpired(CacheEntry entry, Instant now) {
            return ttl != null && !now.isBefore(entry.createdAt().plus(ttl));
        }
    }
}
