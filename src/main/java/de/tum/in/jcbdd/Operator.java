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
 * The operators natively implemented by the apply engine. The set is closed, behaviour is selected by switching over
 * the constants.
 */
public enum Operator {
    AND(2),
    XOR(2),
    /** If-then-else, operands are condition, then-function and else-function. */
    ITE(3),
    /** Restriction of a function (first operand) by a cube of literals (second operand). */
    RESTRICT(2),
    /** Universal quantification of a function (first operand) over a positive cube of variables (second operand). */
    FORALL(2),
    /** Existential quantification, operands as for {@link #FORALL}. */
    EXIST(2),
    /** Unique quantification (the parity of both cofactors), operands as for {@link #FORALL}. */
    UNIQUE(2);

    private final int arity;

    Operator(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    public boolean isQuantifier() {
        return this == FORALL || this == EXIST || this == UNIQUE;
    }
}
