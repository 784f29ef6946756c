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

import static de.tum.in.jcbdd.Util.checkArgument;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/*
 * Possible improvements:
 *  - Trigger garbage collection proactively based on the approximate dead node count
 *  - Iterative traversal for queries on very deep diagrams
 */

final class BcddImpl implements Bcdd {
    private static final Logger logger = Logger.getLogger(BcddImpl.class.getName());
    private static final Collection<BcddImpl> statisticsShutdownHook = new ConcurrentLinkedDeque<>();

    private final BcddConfiguration configuration;
    private final NodeTable table;
    private final ApplyCache cache;
    private final OperatorStatistics operatorStatistics = new OperatorStatistics();
    private final ApplyEngine engine;

    // Operations hold the read lock, modifications of the table structure the write lock
    private final Lock readLock;
    private final Lock writeLock;

    // Owned edges of the variables, written under the write lock
    private volatile List<Edge> variables = List.of();

    BcddImpl(BcddConfiguration configuration, boolean parallel) {
        this.configuration = configuration;
        this.table = new NodeTable(configuration.maximumNodeCount(), configuration.initialLevelCapacity());
        this.cache = new ApplyCache(configuration.applyCacheSize());
        if (parallel) {
            int splitDepth = configuration.parallelSplitDepth() == BcddConfiguration.AUTOMATIC_SPLIT_DEPTH
                    ? ParallelApplyEngine.defaultSplitDepth(configuration.threads())
                    : configuration.parallelSplitDepth();
            this.engine =
                    new ParallelApplyEngine(table, cache, operatorStatistics, configuration.threads(), splitDepth);
        } else {
            this.engine = new SequentialApplyEngine(table, cache, operatorStatistics);
        }
        ReadWriteLock lock = new ReentrantReadWriteLock();
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();

        if (configuration.logStatisticsOnShutdown()) {
            logger.log(Level.FINER, "Adding {0} to shutdown hook", this);
            addToShutdownHook(this);
        }
    }

    private static void addToShutdownHook(BcddImpl bcdd) {
        ShutdownHookLazyHolder.init();
        statisticsShutdownHook.add(bcdd);
    }

    ApplyEngine engine() {
        return engine;
    }

    // Constants and variables

    @Override
    public Edge terminalEdge(boolean value) {
        return table.terminalEdge(value);
    }

    @Override
    public int createVariable() throws NodeAllocationException {
        writeLock.lock();
        try {
            List<Edge> variables = this.variables;
            int level = variables.size();
            table.ensureLevels(level + 1);
            Edge variable = createNode(level, table.terminalEdge(true), table.terminalEdge(false));

            List<Edge> extended = new ArrayList<>(level + 1);
            extended.addAll(variables);
            extended.add(variable);
            this.variables = Collections.unmodifiableList(extended);
            return level;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Edge variable(int variable) {
        List<Edge> variables = this.variables;
        checkArgument(0 <= variable && variable < variables.size(), "Unknown variable %d", variable);
        return variables.get(variable).borrow();
    }

    @Override
    public int numberOfVariables() {
        return variables.size();
    }

    @Override
    public Edge makeNode(int level, Edge thenEdge, Edge elseEdge) throws NodeAllocationException {
        checkArgument(0 <= level && level < numberOfVariables(), "Unknown level %d", level);
        checkArgument(
                level < thenEdge.level() && level < elseEdge.level(),
                "Children of node on level %d do not lie below it",
                level);
        return withRetry(() -> createNode(level, thenEdge, elseEdge));
    }

    private Edge createNode(int level, Edge thenEdge, Edge elseEdge) throws NodeAllocationException {
        return BcddRules.reduce(table, level, table.cloneEdge(thenEdge), table.cloneEdge(elseEdge))
                .thenInsert(table);
    }

    // Operations

    /* Runs the computation under the read lock. If it fails, garbage is collected once (if enabled) and the
     * computation is repeated. */
    private Edge withRetry(ApplyEngine.Computation computation) throws NodeAllocationException {
        readLock.lock();
        try {
            return computation.compute();
        } catch (NodeAllocationException e) {
            if (!configuration.useGarbageCollection()) {
                throw e;
            }
            logger.log(Level.FINE, "Node table full, collecting garbage and retrying", e);
        } finally {
            readLock.unlock();
        }

        collectGarbage();
        readLock.lock();
        try {
            return computation.compute();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Edge apply(Operator operator, Edge... operands) throws NodeAllocationException {
        checkArgument(
                operands.length == operator.arity(),
                "%s expects %d operands, got %d",
                operator,
                operator.arity(),
                operands.length);
        if (operator == Operator.RESTRICT) {
            checkArgument(isCube(operands[1], false), "%s is not a cube", operands[1]);
        } else if (operator.isQuantifier()) {
            checkArgument(isCube(operands[1], true), "%s is not a positive cube", operands[1]);
        }
        return withRetry(() -> engine.apply(operator, operands));
    }

    @Override
    public Edge not(Edge edge) {
        return table.cloneEdge(edge).not();
    }

    @Override
    public Edge restrict(Edge edge, Edge cube) throws NodeAllocationException {
        return apply(Operator.RESTRICT, edge, cube);
    }

    @Override
    public Edge exists(Edge edge, Edge variables) throws NodeAllocationException {
        return apply(Operator.EXIST, edge, variables);
    }

    @Override
    public Edge forall(Edge edge, Edge variables) throws NodeAllocationException {
        return apply(Operator.FORALL, edge, variables);
    }

    @Override
    public Edge unique(Edge edge, Edge variables) throws NodeAllocationException {
        return apply(Operator.UNIQUE, edge, variables);
    }

    // Cubes

    private boolean isCube(Edge edge, boolean positive) {
        Edge falseEdge = table.terminalEdge(false);
        Edge current = edge;
        while (!current.isTerminal()) {
            InnerNode node = (InnerNode) current.node();
            Edge thenCofactor = BcddRules.cofactor(current.tag(), node, 0);
            Edge elseCofactor = BcddRules.cofactor(current.tag(), node, 1);
            if (elseCofactor.equals(falseEdge)) {
                current = thenCofactor;
            } else if (!positive && thenCofactor.equals(falseEdge)) {
                current = elseCofactor;
            } else {
                return false;
            }
        }
        return current.equals(table.terminalEdge(true));
    }

    @Override
    public Edge cube(BitSet variables) throws NodeAllocationException {
        return cube(variables, variables);
    }

    @Override
    public Edge cube(BitSet variables, BitSet values) throws NodeAllocationException {
        checkArgument(
                variables.isEmpty() || variables.length() <= numberOfVariables(),
                "Unknown variable %d",
                variables.length() - 1);
        return withRetry(() -> {
            Edge falseEdge = table.terminalEdge(false);
            Edge cube = table.cloneEdge(table.terminalEdge(true));
            for (int variable = variables.previousSetBit(variables.length());
                    variable >= 0;
                    variable = variables.previousSetBit(variable - 1)) {
                ReducedOrNew outcome = values.get(variable)
                        ? BcddRules.reduce(table, variable, cube, table.cloneEdge(falseEdge))
                        : BcddRules.reduce(table, variable, table.cloneEdge(falseEdge), cube);
                cube = outcome.thenInsert(table);
            }
            return cube;
        });
    }

    // Queries

    @Override
    public boolean evaluate(Edge edge, BitSet assignment) {
        Edge current = edge;
        while (!current.isTerminal()) {
            current = BcddRules.cofactor(
                    current.tag(), (InnerNode) current.node(), assignment.get(current.level()) ? 0 : 1);
        }
        return !current.isComplemented();
    }

    @Override
    public boolean evaluate(Edge edge, boolean[] assignment) {
        Edge current = edge;
        while (!current.isTerminal()) {
            current = BcddRules.cofactor(
                    current.tag(), (InnerNode) current.node(), assignment[current.level()] ? 0 : 1);
        }
        return !current.isComplemented();
    }

    @Override
    public BitSet getSatisfyingAssignment(Edge edge) {
        Edge falseEdge = table.terminalEdge(false);
        if (edge.equals(falseEdge)) {
            throw new NoSuchElementException("False has no satisfying assignment");
        }
        // Every edge other than false is satisfiable, so we never have to backtrack
        BitSet assignment = new BitSet();
        Edge current = edge;
        while (!current.isTerminal()) {
            InnerNode node = (InnerNode) current.node();
            Edge thenCofactor = BcddRules.cofactor(current.tag(), node, 0);
            if (thenCofactor.equals(falseEdge)) {
                current = BcddRules.cofactor(current.tag(), node, 1);
            } else {
                assignment.set(node.level());
                current = thenCofactor;
            }
        }
        assert !current.isComplemented();
        return assignment;
    }

    @Override
    public BigInteger countSatisfyingAssignments(Edge edge) {
        int variableCount = numberOfVariables();
        Map<InnerNode, BigInteger> counts = new IdentityHashMap<>();
        return countSatisfyingAssignments(edge, variableCount, counts).shiftLeft(levelOf(edge, variableCount));
    }

    private static int levelOf(Edge edge, int variableCount) {
        return edge.isTerminal() ? variableCount : edge.level();
    }

    /* Number of satisfying assignments of the edge over the variables from its own level on. */
    private static BigInteger countSatisfyingAssignments(
            Edge edge, int variableCount, Map<InnerNode, BigInteger> counts) {
        BigInteger count;
        if (edge.isTerminal()) {
            count = BigInteger.ONE;
        } else {
            InnerNode node = (InnerNode) edge.node();
            count = counts.get(node);
            if (count == null) {
                int level = node.level();
                Edge thenChild = node.thenChild();
                Edge elseChild = node.elseChild();
                BigInteger thenCount = countSatisfyingAssignments(thenChild, variableCount, counts)
                        .shiftLeft(levelOf(thenChild, variableCount) - level - 1);
                BigInteger elseCount = countSatisfyingAssignments(elseChild, variableCount, counts)
                        .shiftLeft(levelOf(elseChild, variableCount) - level - 1);
                count = thenCount.add(elseCount);
                counts.put(node, count);
            }
        }
        if (edge.isComplemented()) {
            return BigInteger.ONE.shiftLeft(variableCount - levelOf(edge, variableCount)).subtract(count);
        }
        return count;
    }

    @Override
    public BitSet support(Edge edge) {
        BitSet support = new BitSet();
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(edge.node());
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.isTerminal() || !visited.add(node)) {
                continue;
            }
            InnerNode inner = (InnerNode) node;
            support.set(inner.level());
            stack.push(inner.thenChild().node());
            stack.push(inner.elseChild().node());
        }
        return support;
    }

    @Override
    public int nodeCount(Edge edge) {
        return table.nodeCount(edge);
    }

    // Memory

    @Override
    public Edge cloneEdge(Edge edge) {
        return table.cloneEdge(edge);
    }

    @Override
    public void dropEdge(Edge edge) {
        checkArgument(edge.isOwned(), "Cannot drop borrowed edge %s", edge);
        table.dropEdge(edge);
    }

    @Override
    public int referenceCount(Edge edge) {
        return table.referenceCount(edge);
    }

    @Override
    public int collectGarbage() {
        writeLock.lock();
        try {
            int freed = table.collectGarbage();
            cache.invalidate();
            return freed;
        } finally {
            writeLock.unlock();
        }
    }

    // Diagnostics

    @Override
    public int nodeCount() {
        return table.nodeCount();
    }

    @Override
    public String statistics() {
        return table.statistics() + System.lineSeparator() + cache.statistics() + System.lineSeparator()
                + operatorStatistics.statistics();
    }

    @Override
    public OperatorStatistics operatorStatistics() {
        return operatorStatistics;
    }

    @Override
    public boolean check() {
        writeLock.lock();
        try {
            return table.check();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        engine.shutdown();
    }

    private static final class ShutdownHookLazyHolder {
        private static final Runnable shutdownHook = new ShutdownHookPrinter();

        static {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));
        }

        static void init() {
            // Forces static initialization
        }
    }

    private static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (BcddImpl bcdd : statisticsShutdownHook) {
                logger.info(bcdd.statistics());
            }
        }
    }
}
