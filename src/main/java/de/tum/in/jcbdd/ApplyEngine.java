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

import javax.annotation.Nullable;

/**
 * The memoized apply algorithm. All operations take borrowed operands and return an owned result.
 *
 * <p>Every recursive step follows the same scheme: terminal cases, operand normalization, cache lookup, decomposition
 * by the cofactors of the topmost variable, evaluation of both branches, reduction of the results and storing the
 * result in the cache. How the two branches are evaluated is left to the implementations, which may evaluate them one
 * after the other or in parallel. Whatever the implementation, the result is the same canonical edge.</p>
 *
 * <p>If the node table is full, a {@link NodeAllocationException} propagates out of the operation and all
 * intermediate results created so far are released again. Apart from the cache contents (which only refer to
 * canonical results) the operation leaves no trace.</p>
 */
abstract class ApplyEngine {
    final NodeTable table;
    final ApplyCache cache;
    final OperatorStatistics statistics;

    ApplyEngine(NodeTable table, ApplyCache cache, OperatorStatistics statistics) {
        this.table = table;
        this.cache = cache;
        this.statistics = statistics;
    }

    /**
     * A computation yielding an owned edge.
     */
    @FunctionalInterface
    interface Computation {
        Edge compute() throws NodeAllocationException;
    }

    /**
     * Runs the top-level {@code computation}.
     */
    abstract Edge run(Computation computation) throws NodeAllocationException;

    /**
     * Evaluates both branches of a decomposition performed at recursion depth {@code depth} and returns the owned
     * results in the order then, else. If one of the branches fails, the result of the other one is released before
     * the failure is propagated.
     */
    abstract Edge[] evaluate(int depth, Computation thenBranch, Computation elseBranch)
            throws NodeAllocationException;

    /**
     * Releases resources (like worker threads) held by this engine.
     */
    void shutdown() {
        // Nothing to release by default
    }

    final Edge[] evaluateSequentially(Computation thenBranch, Computation elseBranch)
            throws NodeAllocationException {
        Edge thenResult = thenBranch.compute();
        Edge elseResult;
        try {
            elseResult = elseBranch.compute();
        } catch (NodeAllocationException | RuntimeException | Error e) {
            table.dropEdge(thenResult);
            throw e;
        }
        return new Edge[] {thenResult, elseResult};
    }

    /**
     * Applies {@code operator} to the given operands. The number of operands has to match the arity of the operator.
     */
    final Edge apply(Operator operator, Edge... operands) throws NodeAllocationException {
        checkArgument(
                operands.length == operator.arity(),
                "%s expects %d operands, got %d",
                operator,
                operator.arity(),
                operands.length);
        Edge first = operands[0].borrow();
        Edge second = operands[1].borrow();
        switch (operator) {
            case AND:
                return run(() -> and(first, second, 0));
            case XOR:
                return run(() -> xor(first, second, 0));
            case ITE:
                Edge third = operands[2].borrow();
                return run(() -> ifThenElse(first, second, third, 0));
            case RESTRICT:
                return run(() -> restrict(first, second, 0));
            case FORALL:
            case EXIST:
            case UNIQUE:
                return run(() -> quantify(operator, first, second, 0));
            default:
                throw new AssertionError(operator);
        }
    }

    // Shared steps

    @Nullable
    private Edge cached(Operator operator, Edge first, @Nullable Edge second, @Nullable Edge third) {
        statistics.cacheQuery(operator);
        Edge result = cache.get(operator, first, second, third);
        if (result == null) {
            return null;
        }
        statistics.cacheHit(operator);
        return table.cloneEdge(result);
    }

    private Edge reduce(Operator operator, int level, Edge thenResult, Edge elseResult)
            throws NodeAllocationException {
        ReducedOrNew outcome = BcddRules.reduce(table, level, thenResult, elseResult);
        if (outcome.isReduced()) {
            statistics.countReduced(operator);
        }
        return outcome.thenInsert(table);
    }

    private Edge decompose(Operator operator, int level, int depth, Computation thenBranch, Computation elseBranch)
            throws NodeAllocationException {
        Edge[] results = evaluate(depth, thenBranch, elseBranch);
        return reduce(operator, level, results[0], results[1]);
    }

    /* Orders operands of commutative operators by level, then by node id, then by tag. Only called for inner
     * nodes. */
    private static boolean isOrdered(Edge first, Edge second) {
        int firstLevel = first.level();
        int secondLevel = second.level();
        if (firstLevel != secondLevel) {
            return firstLevel < secondLevel;
        }
        int firstId = ((InnerNode) first.node()).id();
        int secondId = ((InnerNode) second.node()).id();
        if (firstId != secondId) {
            return firstId < secondId;
        }
        return first.tag().ordinal() <= second.tag().ordinal();
    }

    /* The remaining cube below the topmost literal of a cube, i.e. the child which is not the false terminal. */
    private Edge cubeRest(Edge cube) {
        Edge thenCofactor = BcddRules.cofactor(cube.tag(), (InnerNode) cube.node(), 0);
        Edge elseCofactor = BcddRules.cofactor(cube.tag(), (InnerNode) cube.node(), 1);
        return thenCofactor.equals(table.terminalEdge(false)) ? elseCofactor : thenCofactor;
    }

    private boolean isPositiveLiteral(Edge cube) {
        return BcddRules.cofactor(cube.tag(), (InnerNode) cube.node(), 1).equals(table.terminalEdge(false));
    }

    // Conjunction

    final Edge and(Edge f, Edge g, int depth) throws NodeAllocationException {
        statistics.call(Operator.AND);
        Edge shortcut = TerminalCases.and(table, f, g);
        if (shortcut != null) {
            statistics.terminalCase(Operator.AND);
            return shortcut;
        }

        boolean ordered = isOrdered(f, g);
        Edge first = ordered ? f : g;
        Edge second = ordered ? g : f;
        Edge cached = cached(Operator.AND, first, second, null);
        if (cached != null) {
            return cached;
        }

        int level = Math.min(first.level(), second.level());
        Edge firstThen = BcddRules.cofactorOn(first, level, 0);
        Edge firstElse = BcddRules.cofactorOn(first, level, 1);
        Edge secondThen = BcddRules.cofactorOn(second, level, 0);
        Edge secondElse = BcddRules.cofactorOn(second, level, 1);

        Edge result = decompose(
                Operator.AND,
                level,
                depth,
                () -> and(firstThen, secondThen, depth + 1),
                () -> and(firstElse, secondElse, depth + 1));
        cache.put(Operator.AND, first, second, null, result);
        return result;
    }

    final Edge or(Edge f, Edge g, int depth) throws NodeAllocationException {
        return and(f.not(), g.not(), depth).not();
    }

    // Exclusive or

    final Edge xor(Edge f, Edge g, int depth) throws NodeAllocationException {
        statistics.call(Operator.XOR);
        Edge shortcut = TerminalCases.xor(table, f, g);
        if (shortcut != null) {
            statistics.terminalCase(Operator.XOR);
            return shortcut;
        }

        // Complements can be pulled out: f ^ ~g = ~(f ^ g)
        EdgeTag tag = f.tag().xor(g.tag());
        Edge fUntagged = f.untagged();
        Edge gUntagged = g.untagged();
        boolean ordered = isOrdered(fUntagged, gUntagged);
        Edge first = ordered ? fUntagged : gUntagged;
        Edge second = ordered ? gUntagged : fUntagged;

        Edge result = cached(Operator.XOR, first, second, null);
        if (result == null) {
            int level = Math.min(first.level(), second.level());
            Edge firstThen = BcddRules.cofactorOn(first, level, 0);
            Edge firstElse = BcddRules.cofactorOn(first, level, 1);
            Edge secondThen = BcddRules.cofactorOn(second, level, 0);
            Edge secondElse = BcddRules.cofactorOn(second, level, 1);

            result = decompose(
                    Operator.XOR,
                    level,
                    depth,
                    () -> xor(firstThen, secondThen, depth + 1),
                    () -> xor(firstElse, secondElse, depth + 1));
            cache.put(Operator.XOR, first, second, null, result);
        }
        return result.withTag(result.tag().xor(tag));
    }

    // If-then-else

    final Edge ifThenElse(Edge f, Edge g, Edge h, int depth) throws NodeAllocationException {
        statistics.call(Operator.ITE);
        if (f.isTerminal()) {
            statistics.terminalCase(Operator.ITE);
            return table.cloneEdge(f.isComplemented() ? h : g);
        }
        if (g.equals(h)) {
            statistics.terminalCase(Operator.ITE);
            return table.cloneEdge(g);
        }
        if (g.sameNode(h)) {
            // ite(f, g, ~g) = f <-> g = f ^ ~g
            statistics.terminalCase(Operator.ITE);
            return xor(f, h, depth);
        }

        // In the then branch f is true, in the else branch it is false
        Edge thenEdge = f.sameNode(g) ? table.terminalEdge(f.tag() == g.tag()) : g;
        Edge elseEdge = f.sameNode(h) ? table.terminalEdge(f.tag() != h.tag()) : h;
        if (thenEdge.isTerminal() || elseEdge.isTerminal()) {
            statistics.terminalCase(Operator.ITE);
            return ifThenElseConstant(f, thenEdge, elseEdge, depth);
        }

        // ite(~f, g, h) = ite(f, h, g) and ite(f, ~g, ~h) = ~ite(f, g, h)
        Edge condition = f.untagged();
        if (f.isComplemented()) {
            Edge swap = thenEdge;
            thenEdge = elseEdge;
            elseEdge = swap;
        }
        EdgeTag tag = thenEdge.tag();
        if (tag == EdgeTag.COMPLEMENTED) {
            thenEdge = thenEdge.not();
            elseEdge = elseEdge.not();
        }
        Edge result = ifThenElseNormalized(condition, thenEdge, elseEdge, depth);
        return result.withTag(result.tag().xor(tag));
    }

    private Edge ifThenElseConstant(Edge f, Edge g, Edge h, int depth) throws NodeAllocationException {
        if (g.isTerminal() && h.isTerminal()) {
            if (g.equals(h)) {
                return table.cloneEdge(g);
            }
            return table.cloneEdge(g.isComplemented() ? f.not() : f);
        }
        if (g.isTerminal()) {
            // ite(f, 1, h) = f | h and ite(f, 0, h) = ~f & h
            return g.isComplemented() ? and(f.not(), h, depth) : or(f, h, depth);
        }
        // ite(f, g, 1) = ~f | g and ite(f, g, 0) = f & g
        return h.isComplemented() ? and(f, g, depth) : or(f.not(), g, depth);
    }

    /* Requires that neither f nor g are complemented and that none of the operands is constant. */
    private Edge ifThenElseNormalized(Edge f, Edge g, Edge h, int depth) throws NodeAllocationException {
        Edge cached = cached(Operator.ITE, f, g, h);
        if (cached != null) {
            return cached;
        }

        int level = Util.min(f.level(), g.level(), h.level());
        Edge fThen = BcddRules.cofactorOn(f, level, 0);
        Edge fElse = BcddRules.cofactorOn(f, level, 1);
        Edge gThen = BcddRules.cofactorOn(g, level, 0);
        Edge gElse = BcddRules.cofactorOn(g, level, 1);
        Edge hThen = BcddRules.cofactorOn(h, level, 0);
        Edge hElse = BcddRules.cofactorOn(h, level, 1);

        Edge result = decompose(
                Operator.ITE,
                level,
                depth,
                () -> ifThenElse(fThen, gThen, hThen, depth + 1),
                () -> ifThenElse(fElse, gElse, hElse, depth + 1));
        cache.put(Operator.ITE, f, g, h, result);
        return result;
    }

    // Restriction

    final Edge restrict(Edge f, Edge cube, int depth) throws NodeAllocationException {
        statistics.call(Operator.RESTRICT);

        // Literals above the top variable of f do not matter, literals on it select a cofactor
        EdgeTag tag = f.tag();
        Edge function = f.untagged();
        Edge literals = cube;
        while (!function.isTerminal() && !literals.isTerminal() && literals.level() <= function.level()) {
            if (literals.level() == function.level()) {
                Edge cofactor = BcddRules.cofactor(
                        EdgeTag.NONE, (InnerNode) function.node(), isPositiveLiteral(literals) ? 0 : 1);
                tag = tag.xor(cofactor.tag());
                function = cofactor.untagged();
            }
            literals = cubeRest(literals);
        }
        if (function.isTerminal() || literals.isTerminal()) {
            statistics.terminalCase(Operator.RESTRICT);
            return table.cloneEdge(function.withTag(tag));
        }

        Edge result = cached(Operator.RESTRICT, function, literals, null);
        if (result == null) {
            int level = function.level();
            Edge thenCofactor = BcddRules.cofactorOn(function, level, 0);
            Edge elseCofactor = BcddRules.cofactorOn(function, level, 1);
            Edge remaining = literals;
            result = decompose(
                    Operator.RESTRICT,
                    level,
                    depth,
                    () -> restrict(thenCofactor, remaining, depth + 1),
                    () -> restrict(elseCofactor, remaining, depth + 1));
            cache.put(Operator.RESTRICT, function, literals, null, result);
        }
        return result.withTag(result.tag().xor(tag));
    }

    // Quantification

    final Edge quantify(Operator operator, Edge f, Edge variables, int depth) throws NodeAllocationException {
        assert operator.isQuantifier();
        statistics.call(operator);
        if (variables.isTerminal()) {
            statistics.terminalCase(operator);
            return table.cloneEdge(f);
        }

        Edge function = f;
        if (operator == Operator.UNIQUE) {
            // The parity of an even number of cofactors does not change under negation
            function = f.untagged();
        }
        Edge cube = variables;
        while (!cube.isTerminal() && cube.level() < function.level()) {
            if (operator == Operator.UNIQUE) {
                // f does not depend on the variable, hence f ^ f
                statistics.terminalCase(operator);
                return TerminalCases.constant(table, false);
            }
            cube = cubeRest(cube);
        }
        if (function.isTerminal() || cube.isTerminal()) {
            statistics.terminalCase(operator);
            return table.cloneEdge(function);
        }

        Edge cached = cached(operator, function, cube, null);
        if (cached != null) {
            return cached;
        }

        int level = function.level();
        Edge thenCofactor = BcddRules.cofactorOn(function, level, 0);
        Edge elseCofactor = BcddRules.cofactorOn(function, level, 1);
        Edge result;
        if (cube.level() == level) {
            Edge remaining = cubeRest(cube);
            Edge[] results = evaluate(
                    depth,
                    () -> quantify(operator, thenCofactor, remaining, depth + 1),
                    () -> quantify(operator, elseCofactor, remaining, depth + 1));
            try {
                result = combine(operator, results[0].borrow(), results[1].borrow(), depth);
            } finally {
                table.dropEdge(results[0]);
                table.dropEdge(results[1]);
            }
        } else {
            Edge remaining = cube;
            result = decompose(
                    operator,
                    level,
                    depth,
                    () -> quantify(operator, thenCofactor, remaining, depth + 1),
                    () -> quantify(operator, elseCofactor, remaining, depth + 1));
        }
        cache.put(operator, function, cube, null, result);
        return result;
    }

    private Edge combine(Operator operator, Edge thenResult, Edge elseResult, int depth)
            throws NodeAllocationException {
        switch (operator) {
            case FORALL:
                return and(thenResult, elseResult, depth);
            case EXIST:
                return or(thenResult, elseResult, depth);
            case UNIQUE:
                return xor(thenResult, elseResult, depth);
            default:
                throw new AssertionError(operator);
        }
    }
}
