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

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;

@State(Scope.Benchmark)
public class BcddState {
    @Param({"1", "4"})
    private int threads;

    @Param({"1"})
    private float cacheSizeFactor;

    private Bcdd bcdd;

    @SuppressWarnings("NumericCastThatLosesPrecision")
    @Setup(Level.Iteration)
    public void setUpBcdd() {
        bcdd = BcddFactory.buildBcdd(ImmutableBcddConfiguration.builder()
                .threads(threads)
                .applyCacheSize((int) (BcddConfiguration.DEFAULT_APPLY_CACHE_SIZE * cacheSizeFactor))
                .build());
    }

    @TearDown(Level.Iteration)
    public void tearDownBcdd() {
        bcdd.close();
    }

    public Bcdd bcdd() {
        return bcdd;
    }
}
