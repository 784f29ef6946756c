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
 * Evaluates both branches of every decomposition one after the other on the calling thread.
 */
final class SequentialApplyEngine extends ApplyEngine {
    SequentialApplyEngine(NodeTable table, ApplyCache cache, OperatorStatistics statistics) {
        super(table, cache, statistics);
    }

    @Override
    Edge run(Computation computation) throws NodeAllocationException {
        return computation.compute();
    }

    @Override
    Edge[] evaluate(int depth, Computation thenBranch, Computation elseBranch) throws NodeAllocationException {
        return evaluateSequentially(thenBranch, elseBranch);
    }
}
