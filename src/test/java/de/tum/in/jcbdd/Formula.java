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

import java.util.BitSet;
import java.util.Objects;

/**
 * Propositional formulas as reference for the diagram operations.
 */
@SuppressWarnings({"AccessingNonPublicFieldOfAnotherObject", "checkstyle:javadoc"})
abstract class Formula {
    enum BinaryType {
        AND,
        OR,
        XOR,
        IMPLICATION,
        EQUIVALENCE
    }

    abstract boolean evaluate(boolean[] valuation);

    /**
     * Builds the owned edge representing this formula.
     */
    abstract Edge toEdge(Bcdd bcdd) throws NodeAllocationException;

    abstract boolean evaluate(BitSet valuation);

    static Formula constant(boolean value) {
        return new Constant(value);
    }

    static Formula literal(int variable) {
        return new Literal(variable);
    }

    static Formula not(Formula child) {
        return new Not(child);
    }

    static Formula and(Formula left, Formula right) {
        return new Binary(BinaryType.AND, left, right);
    }

    static Formula or(Formula left, Formula right) {
        return new Binary(BinaryType.OR, left, right);
    }

    static Formula xor(Formula left, Formula right) {
        return new Binary(BinaryType.XOR, left, right);
    }

    static Formula implication(Formula left, Formula right) {
        return new Binary(BinaryType.IMPLICATION, left, right);
    }

    static Formula equivalence(Formula left, Formula right) {
        return new Binary(BinaryType.EQUIVALENCE, left, right);
    }

    static Formula ifThenElse(Formula condition, Formula thenFormula, Formula elseFormula) {
        return new IfThenElse(condition, thenFormula, elseFormula);
    }

    private static final class Constant extends Formula {
        private final boolean value;

        Constant(boolean value) {
            this.value = value;
        }

        @Override
        boolean evaluate(boolean[] valuation) {
            return value;
        }

        @Override
        boolean evaluate(BitSet valuation) {
            return value;
        }

        @Override
        Edge toEdge(Bcdd bcdd) {
            return bcdd.cloneEdge(bcdd.terminalEdge(value));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Constant && ((Constant) o).value == value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    private static final class Literal extends Formula {
        private final int variable;

        Literal(int variable) {
            this.variable = variable;
        }

        @Override
        boolean evaluate(boolean[] valuation) {
            return valuation[variable];
        }

        @Override
        boolean evaluate(BitSet valuation) {
            return valuation.get(variable);
        }

        @Override
        Edge toEdge(Bcdd bcdd) {
            return bcdd.cloneEdge(bcdd.variable(variable));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal && ((Literal) o).variable == variable;
        }

        @Override
        public int hashCode() {
            return variable;
        }

        @Override
        public String toString() {
            return "x" + variable;
        }
    }

    private static final class Not extends Formula {
        private final Formula child;

        Not(Formula child) {
            this.child = child;
        }

        @Override
        boolean evaluate(boolean[] valuation) {
            return !child.evaluate(valuation);
        }

        @Override
        boolean evaluate(BitSet valuation) {
            return !child.evaluate(valuation);
        }

        @Override
        Edge toEdge(Bcdd bcdd) throws NodeAllocationException {
            Edge edge = child.toEdge(bcdd);
            Edge result = bcdd.not(edge);
            bcdd.dropEdge(edge);
            return result;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && ((Not) o).child.equals(child);
        }

        @Override
        public int hashCode() {
            return ~child.hashCode();
        }

        @Override
        public String toString() {
            return "!" + child;
        }
    }

    private static final class Binary extends Formula {
        private final BinaryType type;
        private final Formula left;
        private final Formula right;

        Binary(BinaryType type, Formula left, Formula right) {
            this.type = type;
            this.left = left;
            this.right = right;
        }

        private boolean apply(boolean leftValue, boolean rightValue) {
            switch (type) {
                case AND:
                    return leftValue && rightValue;
                case OR:
                    return leftValue || rightValue;
                case XOR:
                    return leftValue ^ rightValue;
                case IMPLICATION:
                    return !leftValue || rightValue;
                case EQUIVALENCE:
                    return leftValue == rightValue;
                default:
                    throw new IllegalStateException("Unknown type " + type);
            }
        }

        @Override
        boolean evaluate(boolean[] valuation) {
            return apply(left.evaluate(valuation), right.evaluate(valuation));
        }

        @Override
        boolean evaluate(BitSet valuation) {
            return apply(left.evaluate(valuation), right.evaluate(valuation));
        }

        @Override
        Edge toEdge(Bcdd bcdd) throws NodeAllocationException {
            Edge leftEdge = left.toEdge(bcdd);
            try {
                Edge rightEdge = right.toEdge(bcdd);
                try {
                    return combine(bcdd, leftEdge, rightEdge);
                } finally {
                    bcdd.dropEdge(rightEdge);
                }
            } finally {
                bcdd.dropEdge(leftEdge);
            }
        }

        private Edge combine(Bcdd bcdd, Edge leftEdge, Edge rightEdge) throws NodeAllocationException {
            switch (type) {
                case AND:
                    return bcdd.and(leftEdge, rightEdge);
                case OR:
                    return bcdd.or(leftEdge, rightEdge);
                case XOR:
                    return bcdd.xor(leftEdge, rightEdge);
                case IMPLICATION:
                    return bcdd.implication(leftEdge, rightEdge);
                case EQUIVALENCE:
                    return bcdd.equivalence(leftEdge, rightEdge);
                default:
                    throw new IllegalStateException("Unknown type " + type);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Binary)) {
                return false;
            }
            Binary other = (Binary) o;
            return type == other.type && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, left, right);
        }

        @Override
        public String toString() {
            return type + "[" + left + "," + right + "]";
        }
    }

    private static final class IfThenElse extends Formula {
        private final Formula condition;
        private final Formula thenFormula;
        private final Formula elseFormula;

        IfThenElse(Formula condition, Formula thenFormula, Formula elseFormula) {
            this.condition = condition;
            this.thenFormula = thenFormula;
            this.elseFormula = elseFormula;
        }

        @Override
        boolean evaluate(boolean[] valuation) {
            return condition.evaluate(valuation) ? thenFormula.evaluate(valuation) : elseFormula.evaluate(valuation);
        }

        @Override
        boolean evaluate(BitSet valuation) {
            return condition.evaluate(valuation)
                    ? thenFormula.evaluate(valuation)
                    : elseFormula.evaluate(valuation);
        }

        @Override
        Edge toEdge(Bcdd bcdd) throws NodeAllocationException {
            Edge conditionEdge = condition.toEdge(bcdd);
            try {
                Edge thenEdge = thenFormula.toEdge(bcdd);
                try {
                    Edge elseEdge = elseFormula.toEdge(bcdd);
                    try {
                        return bcdd.ifThenElse(conditionEdge, thenEdge, elseEdge);
                    } finally {
                        bcdd.dropEdge(elseEdge);
                    }
                } finally {
                    bcdd.dropEdge(thenEdge);
                }
            } finally {
                bcdd.dropEdge(conditionEdge);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof IfThenElse)) {
                return false;
            }
            IfThenElse other = (IfThenElse) o;
            return condition.equals(other.condition)
                    && thenFormula.equals(other.thenFormula)
                    && elseFormula.equals(other.elseFormula);
        }

        @Override
        public int hashCode() {
            return Objects.hash(condition, thenFormula, elseFormula);
        }

        @Override
        public String toString() {
            return "ITE[" + condition + "," + thenFormula + "," + elseFormula + "]";
        }
    }
}
