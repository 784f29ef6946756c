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

public final class BcddFactory {
    private BcddFactory() {}

    public static Bcdd buildBcdd() {
        return buildBcdd(ImmutableBcddConfiguration.builder().build());
    }

    /**
     * Builds a diagram with the sequential engine if the configuration asks for a single thread and with the parallel
     * engine otherwise.
     */
    public static Bcdd buildBcdd(BcddConfiguration configuration) {
        return buildBcdd(configuration.threads() > 1, configuration);
    }

    public static Bcdd buildSequential(BcddConfiguration configuration) {
        return buildBcdd(false, configuration);
    }

    public static Bcdd buildParallel(BcddConfiguration configuration) {
        return buildBcdd(true, configuration);
    }

    public static Bcdd buildBcdd(boolean parallel, BcddConfiguration configuration) {
        return new BcddImpl(configuration, parallel);
    }
}
