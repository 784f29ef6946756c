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
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(1)
@State(Scope.Benchmark)
public class QueensBenchmark {
    @Param({"6", "7", "8"})
    private int size;

    /**
     * Builds the constraint "a queen on (row, column) excludes queens on all attacked cells" for all cells.
     */
    static Edge queens(Bcdd bcdd, int size) throws NodeAllocationException {
        bcdd.createVariables(size * size - bcdd.numberOfVariables());
        Edge board = bcdd.cloneEdge(bcdd.trueEdge());

        for (int row = 0; row < size; row++) {
            // At least one queen per row
            Edge rowConstraint = bcdd.cloneEdge(bcdd.falseEdge());
            for (int column = 0; column < size; column++) {
                Edge extended = bcdd.or(rowConstraint, bcdd.variable(row * size + column));
                bcdd.dropEdge(rowConstraint);
                rowConstraint = extended;
            }
            board = conjoin(bcdd, board, rowConstraint);
        }

        for (int row = 0; row < size; row++) {
            for (int column = 0; column < size; column++) {
                Edge cell = bcdd.variable(row * size + column);
                for (int otherRow = 0; otherRow < size; otherRow++) {
                    for (int otherColumn = 0; otherColumn < size; otherColumn++) {
                        if (otherRow == row && otherColumn == column) {
                            continue;
                        }
                        boolean attacked = otherRow == row
                                || otherColumn == column
                                || Math.abs(otherRow - row) == Math.abs(otherColumn - column);
                        if (attacked) {
                            Edge other = bcdd.variable(otherRow * size + otherColumn);
                            board = conjoin(bcdd, board, bcdd.nand(cell, other));
                        }
                    }
                }
            }
        }
        return board;
    }

    private static Edge conjoin(Bcdd bcdd, Edge board, Edge constraint) throws NodeAllocationException {
        Edge result = bcdd.and(board, constraint);
        bcdd.dropEdge(board);
        bcdd.dropEdge(constraint);
        return result;
    }

    @Benchmark
    public void queens(BcddState state, Blackhole blackhole) throws NodeAllocationException {
        Bcdd bcdd = state.bcdd();
        Edge board = queens(bcdd, size);
        BigInteger solutions = bcdd.countSatisfyingAssignments(board);
        blackhole.consume(solutions);
        bcdd.dropEdge(board);
    }
}
