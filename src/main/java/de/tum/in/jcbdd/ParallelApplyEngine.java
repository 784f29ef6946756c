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

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Evaluates the branches of decompositions in parallel on a fork/join pool. Up to the split depth, the else branch is
 * forked while the then branch is computed by the current worker; deeper decompositions are evaluated sequentially.
 *
 * <p>Workers share the node table and the apply cache. Since insertion into the node table is atomic, both branches
 * end up with the same canonical nodes as a sequential evaluation would produce.</p>
 */
final class ParallelApplyEngine extends ApplyEngine {
    private static final Logger logger = Logger.getLogger(ParallelApplyEngine.class.getName());

    private final ForkJoinPool pool;
    private final int splitDepth;

    ParallelApplyEngine(
            NodeTable table, ApplyCache cache, OperatorStatistics statistics, int threads, int splitDepth) {
        super(table, cache, statistics);
        this.pool = new ForkJoinPool(threads);
        this.splitDepth = splitDepth;
        logger.log(Level.FINE, "Created parallel apply engine with {0} threads and split depth {1}", new Object[] {
            threads, splitDepth
        });
    }

    /**
     * The split depth used when none is configured: enough levels of forking to give every worker a few tasks.
     */
    static int defaultSplitDepth(int threads) {
        return 32 - Integer.numberOfLeadingZeros(Math.max(threads, 1) - 1) + 2;
    }

    int splitDepth() {
        return splitDepth;
    }

    @Override
    Edge run(Computation computation) throws NodeAllocationException {
        ComputationTask task = new ComputationTask(computation);
        if (task.inPool(pool)) {
            task.compute();
        } else {
            pool.invoke(task);
        }
        return task.result();
    }

    @Override
    Edge[] evaluate(int depth, Computation thenBranch, Computation elseBranch) throws NodeAllocationException {
        if (depth >= splitDepth) {
            return evaluateSequentially(thenBranch, elseBranch);
        }

        ComputationTask elseTask = new ComputationTask(elseBranch);
        elseTask.fork();
        Edge thenResult;
        try {
            thenResult = thenBranch.compute();
        } catch (NodeAllocationException | RuntimeException | Error e) {
            // The forked task always has to be joined, even if the then branch failed
            joinAndDrop(elseTask, e);
            throw e;
        }

        try {
            elseTask.join();
        } catch (RuntimeException | Error e) {
            table.dropEdge(thenResult);
            throw e;
        }
        if (elseTask.failure != null) {
            table.dropEdge(thenResult);
            throw elseTask.failure;
        }
        return new Edge[] {thenResult, elseTask.result()};
    }

    private void joinAndDrop(ComputationTask task, Throwable cause) {
        try {
            task.join();
        } catch (RuntimeException | Error e) {
            cause.addSuppressed(e);
            return;
        }
        if (task.failure == null) {
            assert task.result != null;
            table.dropEdge(task.result);
        }
    }

    @Override
    void shutdown() {
        logger.log(Level.FINE, "Shutting down apply workers");
        pool.shutdown();
        try {
            if (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.log(Level.WARNING, "Apply workers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @SuppressWarnings("serial")
    private static final class ComputationTask extends RecursiveAction {
        private final Computation computation;

        @Nullable
        private Edge result;

        @Nullable
        private NodeAllocationException failure;

        ComputationTask(Computation computation) {
            this.computation = computation;
        }

        boolean inPool(ForkJoinPool pool) {
            return inForkJoinPool() && getPool() == pool;
        }

        @Override
        protected void compute() {
            try {
                result = computation.compute();
            } catch (NodeAllocationException e) {
                failure = e;
            }
        }

        Edge result() throws NodeAllocationException {
            if (failure != null) {
                throw failure;
            }
            assert result != null;
            return result;
        }
    }
}
