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
import java.util.BitSet;
import java.util.NoSuchElementException;

/**
 * This interface contains the operations on complement edge BDDs.
 *
 * <p>Functions are represented by {@link Edge edges}. Unless stated otherwise, edges passed to the methods of this
 * interface are only borrowed, i.e. they remain owned by the caller, and every returned edge is owned by the caller,
 * who eventually has to release it with {@link #dropEdge(Edge)}. Nodes only reachable from released edges are
 * reclaimed by the next {@link #collectGarbage() garbage collection}.</p>
 *
 * <p>All methods may be called concurrently. Operations creating nodes throw a {@link NodeAllocationException} if the
 * node table is full, even after an attempt to free nodes by garbage collection (if enabled).</p>
 */
public interface Bcdd extends AutoCloseable {
    // Constants and variables

    /**
     * Returns the borrowed edge representing the constant {@code value}. It never has to be released.
     */
    Edge terminalEdge(boolean value);

    default Edge trueEdge() {
        return terminalEdge(true);
    }

    default Edge falseEdge() {
        return terminalEdge(false);
    }

    /**
     * Creates a new variable, placed on the next level below all existing ones, and returns its number. Variables are
     * allocated sequentially starting from 0.
     */
    int createVariable() throws NodeAllocationException;

    /**
     * Creates {@code count} variables and returns the number of the first one.
     */
    default int createVariables(int count) throws NodeAllocationException {
        int first = numberOfVariables();
        for (int i = 0; i < count; i++) {
            createVariable();
        }
        return first;
    }

    /**
     * Returns the edge representing the given variable. The edge is borrowed from the diagram and stays valid as long
     * as the diagram exists.
     *
     * @throws IllegalArgumentException
     *     if the variable has not been created.
     */
    Edge variable(int variable);

    int numberOfVariables();

    /**
     * Returns the edge for the function "if variable on {@code level} then {@code thenEdge} else {@code elseEdge}",
     * i.e. applies the reduction rule to the given triple and finds or creates the corresponding node. Both children
     * must lie strictly below {@code level}.
     */
    Edge makeNode(int level, Edge thenEdge, Edge elseEdge) throws NodeAllocationException;

    // Operations

    /**
     * Applies the given operator, the number of {@code operands} must equal its {@link Operator#arity() arity}.
     */
    Edge apply(Operator operator, Edge... operands) throws NodeAllocationException;

    /**
     * Returns the negation of {@code edge}. This never allocates nodes.
     */
    Edge not(Edge edge);

    default Edge and(Edge first, Edge second) throws NodeAllocationException {
        return apply(Operator.AND, first, second);
    }

    default Edge or(Edge first, Edge second) throws NodeAllocationException {
        return apply(Operator.AND, first.not(), second.not()).not();
    }

    default Edge nand(Edge first, Edge second) throws NodeAllocationException {
        return and(first, second).not();
    }

    default Edge nor(Edge first, Edge second) throws NodeAllocationException {
        return apply(Operator.AND, first.not(), second.not());
    }

    default Edge xor(Edge first, Edge second) throws NodeAllocationException {
        return apply(Operator.XOR, first, second);
    }

    default Edge equivalence(Edge first, Edge second) throws NodeAllocationException {
        return apply(Operator.XOR, first, second.not());
    }

    default Edge implication(Edge first, Edge second) throws NodeAllocationException {
        return apply(Operator.AND, first, second.not()).not();
    }

    default Edge ifThenElse(Edge condition, Edge thenEdge, Edge elseEdge) throws NodeAllocationException {
        return apply(Operator.ITE, condition, thenEdge, elseEdge);
    }

    /**
     * Restricts {@code edge} by the given cube of literals, i.e. replaces each variable occurring in the cube by its
     * polarity in the cube.
     *
     * @throws IllegalArgumentException
     *     if {@code cube} is not a conjunction of literals.
     */
    Edge restrict(Edge edge, Edge cube) throws NodeAllocationException;

    /**
     * Existentially quantifies the variables of the positive cube {@code variables}.
     *
     * @throws IllegalArgumentException
     *     if {@code variables} is not a conjunction of positive literals.
     */
    Edge exists(Edge edge, Edge variables) throws NodeAllocationException;

    /**
     * Universally quantifies the variables of the positive cube {@code variables}.
     *
     * @see #exists(Edge, Edge)
     */
    Edge forall(Edge edge, Edge variables) throws NodeAllocationException;

    /**
     * Uniquely quantifies the variables of the positive cube {@code variables}, i.e. computes the exclusive or of both
     * cofactors for each variable.
     *
     * @see #exists(Edge, Edge)
     */
    Edge unique(Edge edge, Edge variables) throws NodeAllocationException;

    // Cubes

    /**
     * Returns the conjunction of all variables in {@code variables}.
     */
    Edge cube(BitSet variables) throws NodeAllocationException;

    /**
     * Returns the conjunction of the literals given by {@code variables}, where a variable occurs positively if it is
     * set in {@code values} and negated otherwise.
     */
    Edge cube(BitSet variables, BitSet values) throws NodeAllocationException;

    // Queries

    /**
     * Evaluates the function under the given {@code assignment}, where variable {@code i} is true iff bit {@code i} is
     * set.
     */
    boolean evaluate(Edge edge, BitSet assignment);

    boolean evaluate(Edge edge, boolean[] assignment);

    default boolean isSatisfiable(Edge edge) {
        return !edge.equals(falseEdge());
    }

    default boolean isValid(Edge edge) {
        return edge.equals(trueEdge());
    }

    /**
     * Returns some satisfying assignment of the function. Variables which are not set in the returned assignment are
     * either false or irrelevant.
     *
     * @throws NoSuchElementException
     *     if the function is unsatisfiable.
     */
    BitSet getSatisfyingAssignment(Edge edge);

    /**
     * Counts the satisfying assignments of the function over all {@link #numberOfVariables() variables}.
     */
    BigInteger countSatisfyingAssignments(Edge edge);

    /**
     * Returns the variables the function depends on.
     */
    BitSet support(Edge edge);

    /**
     * Returns the number of inner nodes of the function.
     */
    int nodeCount(Edge edge);

    // Memory

    /**
     * Returns a new owned copy of {@code edge}.
     */
    Edge cloneEdge(Edge edge);

    /**
     * Releases the owned {@code edge}. Afterwards, the edge must not be used anymore.
     */
    void dropEdge(Edge edge);

    /**
     * Returns the reference count of the node of {@code edge} or {@literal -1} for the terminal.
     */
    int referenceCount(Edge edge);

    /**
     * Removes all nodes which are not reachable from an owned edge and returns their number. Blocks until all running
     * operations are completed.
     */
    int collectGarbage();

    // Diagnostics

    int nodeCount();

    String statistics();

    OperatorStatistics operatorStatistics();

    /**
     * Performs integrity checks on the node table.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     * @throws IllegalStateException
     *     if an invariant is violated.
     */
    boolean check();

    /**
     * Stops the worker threads of this diagram. Edges remain valid for queries.
     */
    @Override
    void close();
}
