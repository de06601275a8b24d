package com.structcheck.verification.cache;

import com.structcheck.common.flexure.InteractionCurveBuilder;
import com.structcheck.common.model.InteractionCurve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Content-addressed cache of interaction curves.
 *
 * <p>Curves are keyed by {@link CurveKey}, so two members with identical sections share
 * one curve. Each member also remembers the key it last used: when its reinforcement
 * changes, or on an explicit {@link #invalidate(String)}, the old entry is dropped.
 * Cached curves are immutable and safe to hand out to concurrent callers.
 */
@Component
public class CurveCache {

    private static final Logger log = LoggerFactory.getLogger(CurveCache.class);

    private final ConcurrentHashMap<CurveKey, InteractionCurve> store = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CurveKey> keysByMember = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Returns the curve for {@code key}, building it on first use.
     *
     * @throws com.structcheck.common.exception.SectionInputException when the section is invalid;
     *         nothing is cached in that case
     */
    public InteractionCurve getOrBuild(String memberId, CurveKey key) {
        CurveKey previous = keysByMember.put(memberId, key);
        if (previous != null && !previous.equals(key)) {
            evict(previous);
            log.info("CACHE_INVALIDATE memberId={} reason=section-changed fingerprint={}",
                memberId, previous.shortFingerprint());
        }

        InteractionCurve cached = store.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }

        AtomicBoolean built = new AtomicBoolean();
        InteractionCurve curve = store.computeIfAbsent(key, k -> {
            InteractionCurve fresh = InteractionCurveBuilder.build(k.section(), k.samplePoints());
            built.set(true);
            misses.incrementAndGet();
            log.info("CACHE_REFRESH memberId={} fingerprint={} points={}",
                memberId, k.shortFingerprint(), fresh.size());
            return fresh;
        });
        // Another caller built it between get() and computeIfAbsent()
        if (!built.get()) {
            hits.incrementAndGet();
        }
        return curve;
    }

    /** Drops the curve last used by {@code memberId}; no-op for unknown members. */
    public void invalidate(String memberId) {
        CurveKey key = keysByMember.remove(memberId);
        if (key == null) return;
        evict(key);
        log.info("CACHE_INVALIDATE memberId={} reason=explicit fingerprint={}",
            memberId, key.shortFingerprint());
    }

    public void clear() {
        store.clear();
        keysByMember.clear();
    }

    public int size() {
        return store.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    private void evict(CurveKey key) {
        // Another member may still point at the same content; keep the entry for it
        if (!keysByMember.containsValue(key)) {
            store.remove(key);
        }
    }

    Map<String, CurveKey> keysByMember() {
        return Map.copyOf(keysByMember);
    }
}
