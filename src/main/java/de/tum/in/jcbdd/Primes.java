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

import java.math.BigInteger;

final class Primes {
    private Primes() {}

    /**
     * Returns the smallest prime which is greater than or equal to {@code value}.
     */
    static int nextPrime(int value) {
        if (value <= 2) {
            return 2;
        }
        BigInteger candidate = BigInteger.valueOf(value);
        if (candidate.isProbablePrime(32)) {
            return value;
        }
        return candidate.nextProbablePrime().intValueExact();
    }
}
