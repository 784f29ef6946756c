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
import static de.tum.in.jcbdd.Util.checkState;

import java.math.BigInteger;
import java.util.BitSet;

/**
 * A handle owning a single edge of a {@link Bcdd}. Closing the handle releases the edge; operations on closed handles
 * fail with an {@link IllegalStateException}. The handles of one diagram can be combined freely, mixing handles of
 * different diagrams is an error.
 */
public final class BcddFunction implements AutoCloseable {
    private final Bcdd bcdd;
    private final Edge edge;
    private boolean closed = false;

    private BcddFunction(Bcdd bcdd, Edge edge) {
        this.bcdd = bcdd;
        this.edge = edge;
    }

    /**
     * Wraps the owned {@code edge}, which is consumed.
     */
    public static BcddFunction of(Bcdd bcdd, Edge edge) {
        checkArgument(edge.isOwned(), "Edge %s is not owned", edge);
        return new BcddFunction(bcdd, edge);
    }

    public static BcddFunction constant(Bcdd bcdd, boolean value) {
        return new BcddFunction(bcdd, bcdd.cloneEdge(bcdd.terminalEdge(value)));
    }

    public static BcddFunction variable(Bcdd bcdd, int variable) {
        return new BcddFunction(bcdd, bcdd.cloneEdge(bcdd.variable(variable)));
    }

    public Bcdd bcdd() {
        return bcdd;
    }

    /**
     * Returns a borrowed view of the edge, valid as long as this handle is open.
     */
    public Edge edge() {
        checkState(!closed, "Function is closed");
        return edge.borrow();
    }

    private Edge operand(BcddFunction other) {
        checkArgument(other.bcdd == bcdd, "Functions belong to different diagrams");
        return other.edge();
    }

    public BcddFunction not() {
        return new BcddFunction(bcdd, bcdd.not(edge()));
    }

    public BcddFunction and(BcddFunction other) throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.and(edge(), operand(other)));
    }

    public BcddFunction or(BcddFunction other) throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.or(edge(), operand(other)));
    }

    public BcddFunction xor(BcddFunction other) throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.xor(edge(), operand(other)));
    }

    public BcddFunction equivalence(BcddFunction other) throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.equivalence(edge(), operand(other)));
    }

    public BcddFunction implication(BcddFunction other) throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.implication(edge(), operand(other)));
    }

    public BcddFunction ifThenElse(BcddFunction thenFunction, BcddFunction elseFunction)
            throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.ifThenElse(edge(), operand(thenFunction), operand(elseFunction)));
    }

    public BcddFunction restrict(BcddFunction cube) throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.restrict(edge(), operand(cube)));
    }

    public BcddFunction exists(BcddFunction variables) throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.exists(edge(), operand(variables)));
    }

    public BcddFunction forall(BcddFunction variables) throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.forall(edge(), operand(variables)));
    }

    public BcddFunction unique(BcddFunction variables) throws NodeAllocationException {
        return new BcddFunction(bcdd, bcdd.unique(edge(), operand(variables)));
    }

    public boolean evaluate(BitSet assignment) {
        return bcdd.evaluate(edge(), assignment);
    }

    public boolean isSatisfiable() {
        return bcdd.isSatisfiable(edge());
    }

    public boolean isValid() {
        return bcdd.isValid(edge());
    }

    public BigInteger countSatisfyingAssignments() {
        return bcdd.countSatisfyingAssignments(edge());
    }

    public BitSet support() {
        return bcdd.support(edge());
    }

    public int nodeCount() {
        return bcdd.nodeCount(edge());
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            bcdd.dropEdge(edge);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BcddFunction)) {
            return false;
        }
        BcddFunction other = (BcddFunction) o;
        return bcdd == other.bcdd && edge.equals(other.edge);
    }

    @Override
    public int hashCode() {
        return edge.hashCode();
    }

    @Override
    public String toString() {
        return closed ? "closed" : edge.toString();
    }
}
