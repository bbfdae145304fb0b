package com.eainde.truckticket.reference;

import com.eainde.truckticket.exception.ReferenceNotFoundException;
import com.eainde.truckticket.model.ReferenceCategory;
import com.eainde.truckticket.model.ReferenceEntity;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Name-to-entity cache over a {@link ReferenceDataSource}, scoped to one batch run.
 *
 * <p>Lazy mode resolves a name on first request and memoizes it; concurrent requests for
 * the same missing key wait for a single lookup. {@link #preload(Set)} loads whole tables
 * up front, after which misses in those tables are answered without touching the source.
 * Misses are never memoized.</p>
 *
 * <p>Create one instance per run; {@link #invalidate()} clears it explicitly.</p>
 */
@Slf4j
public class ReferenceDataCache {

    private final ReferenceDataSource source;
    private final ConcurrentMap<Key, ReferenceEntity> entries = new ConcurrentHashMap<>();
    private final Set<ReferenceCategory> preloaded = ConcurrentHashMap.newKeySet();
    private final AtomicLong sourceLookups = new AtomicLong();

    public ReferenceDataCache(ReferenceDataSource source) {
        this.source = source;
    }

    /**
     * @throws ReferenceNotFoundException when no entity of that category has the name
     */
    public ReferenceEntity resolve(ReferenceCategory category, String canonicalName) {
        return find(category, canonicalName)
                .orElseThrow(() -> new ReferenceNotFoundException(category, canonicalName));
    }

    public Optional<ReferenceEntity> find(ReferenceCategory category, String canonicalName) {
        if (canonicalName == null || canonicalName.isBlank()) {
            return Optional.empty();
        }
        Key key = Key.of(category, canonicalName);
        ReferenceEntity cached = entries.get(key);
        if (cached != null || preloaded.contains(category)) {
            return Optional.ofNullable(cached);
        }
        return Optional.ofNullable(entries.computeIfAbsent(key, k -> {
            sourceLookups.incrementAndGet();
            return source.findByName(category, canonicalName).orElse(null);
        }));
    }

    public void preload() {
        preload(EnumSet.allOf(ReferenceCategory.class));
    }

    public void preload(Set<ReferenceCategory> categories) {
        for (ReferenceCategory category : categories) {
            int count = 0;
            for (ReferenceEntity entity : source.findAll(category)) {
                entries.put(Key.of(category, entity.canonicalName()), entity);
                count++;
            }
            sourceLookups.incrementAndGet();
            preloaded.add(category);
            log.debug("Preloaded {} {} references", count, category);
        }
        log.info("Reference cache preloaded: {} entries across {}", entries.size(), categories);
    }

    public void invalidate() {
        entries.clear();
        preloaded.clear();
    }

    public int size() {
        return entries.size();
    }

    /** Number of calls made to the underlying source, for diagnostics. */
    public long sourceLookups() {
        return sourceLookups.get();
    }

    private record Key(ReferenceCategory category, String name) {
        static Key of(ReferenceCategory category, String name) {
            return new Key(category, name.trim().toUpperCase(Locale.ROOT));
        }
    }
}
