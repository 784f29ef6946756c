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

import static de.tum.in.jcbdd.Util.checkArgument;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class BcddConfiguration {
    public static final int DEFAULT_MAXIMUM_NODE_COUNT = 1 << 24;
    public static final int DEFAULT_INITIAL_LEVEL_CAPACITY = 64;
    public static final int DEFAULT_APPLY_CACHE_SIZE = 1 << 16;
    public static final int DEFAULT_THREADS = 1;
    /** Marks the split depth to be derived from the number of threads. */
    public static final int AUTOMATIC_SPLIT_DEPTH = -1;

    @Value.Default
    public int maximumNodeCount() {
        return DEFAULT_MAXIMUM_NODE_COUNT;
    }

    @Value.Default
    public int initialLevelCapacity() {
        return DEFAULT_INITIAL_LEVEL_CAPACITY;
    }

    @Value.Default
    public int applyCacheSize() {
        return DEFAULT_APPLY_CACHE_SIZE;
    }

    /**
     * Number of worker threads of the apply engine. A value of {@literal 1} selects the sequential engine.
     */
    @Value.Default
    public int threads() {
        return DEFAULT_THREADS;
    }

    /**
     * Recursion depth up to which the parallel engine forks branches, or {@link #AUTOMATIC_SPLIT_DEPTH}.
     */
    @Value.Default
    public int parallelSplitDepth() {
        return AUTOMATIC_SPLIT_DEPTH;
    }

    @Value.Default
    public boolean useGarbageCollection() {
        return true;
    }

    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Check
    protected void check() {
        checkArgument(maximumNodeCount() > 0, "Maximum node count must be positive, got %d", maximumNodeCount());
        checkArgument(
                initialLevelCapacity() > 0, "Initial level capacity must be positive, got %d", initialLevelCapacity());
        checkArgument(applyCacheSize() > 0, "Apply cache size must be positive, got %d", applyCacheSize());
        checkArgument(threads() > 0, "Thread count must be positive, got %d", threads());
        checkArgument(
                parallelSplitDepth() >= 0 || parallelSplitDepth() == AUTOMATIC_SPLIT_DEPTH,
                "Invalid split depth %d",
                parallelSplitDepth());
    }
}
