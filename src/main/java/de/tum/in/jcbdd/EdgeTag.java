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

/**
 * The annotation carried by every edge of a complement edge BDD. Together with {@link #xor(EdgeTag)} the two
 * values form a group with identity {@link #NONE}.
 */
public enum EdgeTag {
    /** The edge denotes the function of the referenced node. */
    NONE,
    /** The edge denotes the negation of the function of the referenced node. */
    COMPLEMENTED;

    public static EdgeTag of(boolean complemented) {
        return complemented ? COMPLEMENTED : NONE;
    }

    public EdgeTag not() {
        return this == NONE ? COMPLEMENTED : NONE;
    }

    public EdgeTag xor(EdgeTag other) {
        return this == other ? NONE : COMPLEMENTED;
    }

    public boolean isComplemented() {
        return this == COMPLEMENTED;
    }
}
