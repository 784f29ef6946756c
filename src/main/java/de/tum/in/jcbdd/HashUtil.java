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

final class HashUtil {
    // Note: These are deliberately simple hash functions. They are evaluated for every node lookup and every cache
    // access, the combination with a prime table size spreads them well enough.

    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int level, int firstKey, int secondKey) {
        return (PRIME * level) + 31 * firstKey + secondKey;
    }

    static int hash(byte operation, int firstKey, int secondKey, int thirdKey) {
        return (PRIME * operation) + 961 * firstKey + 31 * secondKey + thirdKey;
    }

    static int mod(int value, int modulus) {
        int val = value % modulus;
        return val < 0 ? val + modulus : val;
    }
}
