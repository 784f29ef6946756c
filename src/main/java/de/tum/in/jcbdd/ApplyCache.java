/*
 * This file is part of JCBDD.
 * Copyright (c) 2024 The JCBDD authors.
 *
 * JCBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JCBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JCBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jcbdd;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/*
 * Possible improvements:
 *  - Partial invalidation after garbage collection (only entries referring to freed nodes)
 */

/**
 * Memoization of apply results. The cache is direct mapped and lossy, i.e. each key hashes to exactly one slot and a
 * put overwrites whatever was stored there before. Each slot holds an immutable entry, so concurrent readers observe
 * either a complete entry or none. Entries do not own references of the edges they store, hence the cache has to be
 * invalidated whenever nodes are freed.
 */
final class ApplyCache {
    private static final Logger logger = Logger.getLogger(ApplyCache.class.getName());

    private final int size;
    private final AtomicReferenceArray<Entry> entries;
    private final CacheStatistics statistics = new CacheStatistics();

    ApplyCache(int size) {
        this.size = Primes.nextPrime(Math.max(size, 2));
        this.entries = new AtomicReferenceArray<>(this.size);
    }

    private static int hash(Operator operator, Edge first, @Nullable Edge second, @Nullable Edge third) {
        return HashUtil.hash(
                (byte) operator.ordinal(),
                first.hashCode(),
                second == null ? 0 : second.hashCode(),
                third == null ? 0 : third.hashCode());
    }

    int size() {
        return size;
    }

    /**
     * Returns the cached result of applying {@code operator} to the given operands or {@code null}. The result is a
     * borrowed edge which stays valid until the next garbage collection.
     */
    @Nullable
    Edge get(Operator operator, Edge first, @Nullable Edge second, @Nullable Edge third) {
        Entry entry = entries.get(HashUtil.mod(hash(operator, first, second, third), size));
        if (entry != null && entry.matches(operator, first, second, third)) {
            statistics.cacheHit();
            return entry.result;
        }
        statistics.cacheMiss();
        return null;
    }

    void put(Operator operator, Edge first, @Nullable Edge second, @Nullable Edge third, Edge result) {
        statistics.put();
        Entry entry = new Entry(
                operator,
                first.borrow(),
                second == null ? null : second.borrow(),
                third == null ? null : third.borrow(),
                result.borrow());
        entries.set(HashUtil.mod(hash(operator, first, second, third), size), entry);
    }

    /**
     * Removes all entries. Requires that no operation is running concurrently.
     */
    void invalidate() {
        logger.log(Level.FINER, "Invalidating cache");
        statistics.invalidation();
        for (int i = 0; i < size; i++) {
            entries.set(i, null);
        }
    }

    private float loadFactor() {
        int loadedBins = 0;
        for (int i = 0; i < size; i++) {
            if (entries.get(i) != null) {
                loadedBins++;
            }
        }
        return (float) loadedBins / (float) size;
    }

    public String statistics() {
        return String.format("Apply cache: size: %d, load: %s%n %s", size, loadFactor(), statistics);
    }

    private static final class Entry {
        final Operator operator;
        final Edge first;
        @Nullable
        final Edge second;
        @Nullable
        final Edge third;
        final Edge result;

        Entry(Operator operator, Edge first, @Nullable Edge second, @Nullable Edge third, Edge result) {
            this.operator = operator;
            this.first = first;
            this.second = second;
            this.third = third;
            this.result = result;
        }

        boolean matches(Operator operator, Edge first, @Nullable Edge second, @Nullable Edge third) {
            return this.operator == operator
                    && this.first.equals(first)
                    && Objects.equals(this.second, second)
                    && Objects.equals(this.third, third);
        }
    }

    private static final class CacheStatistics {
        private final LongAdder hitCount = new LongAdder();
        private final LongAdder hitCountSinceInvalidation = new LongAdder();
        private final LongAdder missCount = new LongAdder();
        private final LongAdder putCount = new LongAdder();
        private final LongAdder putCountSinceInvalidation = new LongAdder();
        private final LongAdder invalidationCount = new LongAdder();

        void cacheHit() {
            hitCount.increment();
            hitCountSinceInvalidation.increment();
        }

        void cacheMiss() {
            missCount.increment();
        }

        void invalidation() {
            invalidationCount.increment();
            hitCountSinceInvalidation.reset();
            putCountSinceInvalidation.reset();
        }

        void put() {
            putCount.increment();
            putCountSinceInvalidation.increment();
        }

        @Override
        public String toString() {
            long hits = hitCount.sum();
            float hitToPutRatio = (float) hits / (float) Math.max(putCount.sum(), 1L);
            return String.format(
                    "Cache access: put=%d, hit=%d, miss=%d, hit-to-put=%3.3f%n"
                            + "       invalidation: %d times, since last: put=%d, hit=%d",
                    putCount.sum(),
                    hits,
                    missCount.sum(),
                    hitToPutRatio,
                    invalidationCount.sum(),
                    putCountSinceInvalidation.sum(),
                    hitCountSinceInvalidation.sum());
        }
    }
}
