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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates random formulas together with their diagrams.
 */
public final class Generator {
    private static final Logger logger = Logger.getLogger(Generator.class.getName());

    private Generator() {
        // empty
    }

    static Formula randomFormula(Random random, int variableCount, int depth) {
        if (depth == 0 || random.nextInt(5) == 0) {
            return random.nextInt(10) == 0
                    ? Formula.constant(random.nextBoolean())
                    : Formula.literal(random.nextInt(variableCount));
        }
        switch (random.nextInt(7)) {
            case 0:
                return Formula.not(randomFormula(random, variableCount, depth - 1));
            case 1:
                return Formula.and(
                        randomFormula(random, variableCount, depth - 1),
                        randomFormula(random, variableCount, depth - 1));
            case 2:
                return Formula.or(
                        randomFormula(random, variableCount, depth - 1),
                        randomFormula(random, variableCount, depth - 1));
            case 3:
                return Formula.xor(
                        randomFormula(random, variableCount, depth - 1),
                        randomFormula(random, variableCount, depth - 1));
            case 4:
                return Formula.implication(
                        randomFormula(random, variableCount, depth - 1),
                        randomFormula(random, variableCount, depth - 1));
            case 5:
                return Formula.equivalence(
                        randomFormula(random, variableCount, depth - 1),
                        randomFormula(random, variableCount, depth - 1));
            default:
                return Formula.ifThenElse(
                        randomFormula(random, variableCount, depth - 1),
                        randomFormula(random, variableCount, depth - 1),
                        randomFormula(random, variableCount, depth - 1));
        }
    }

    /**
     * Creates {@code variableCount} variables in {@code bcdd} and builds {@code count} random formulas of at most the
     * given {@code depth}. The generation only depends on the {@code seed}.
     */
    static List<DataPoint> fill(Bcdd bcdd, long seed, int variableCount, int depth, int count)
            throws NodeAllocationException {
        logger.log(Level.FINE, "Filling {0}: {1} variables, depth {2}, {3} formulas", new Object[] {
            bcdd, variableCount, depth, count
        });
        bcdd.createVariables(variableCount - bcdd.numberOfVariables());

        Random random = new Random(seed);
        List<DataPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Formula formula = randomFormula(random, variableCount, depth);
            points.add(new DataPoint(bcdd, formula, formula.toEdge(bcdd)));
        }
        return points;
    }

    static final class DataPoint {
        final Bcdd bcdd;
        final Formula formula;
        // Owned by the data point for the whole test run
        final Edge edge;

        DataPoint(Bcdd bcdd, Formula formula, Edge edge) {
            this.bcdd = bcdd;
            this.formula = formula;
            this.edge = edge;
        }

        @Override
        public String toString() {
            return formula + " -> " + edge;
        }
    }

    static final class BinaryDataPoint {
        final DataPoint left;
        final DataPoint right;

        BinaryDataPoint(DataPoint left, DataPoint right) {
            assert left.bcdd == right.bcdd;
            this.left = left;
            this.right = right;
        }

        Bcdd bcdd() {
            return left.bcdd;
        }

        @Override
        public String toString() {
            return left + " / " + right;
        }
    }

    static final class TernaryDataPoint {
        final DataPoint first;
        final DataPoint second;
        final DataPoint third;

        TernaryDataPoint(DataPoint first, DataPoint second, DataPoint third) {
            this.first = first;
            this.second = second;
            this.third = third;
        }

        Bcdd bcdd() {
            return first.bcdd;
        }

        @Override
        public String toString() {
            return first + " / " + second + " / " + third;
        }
    }
}
