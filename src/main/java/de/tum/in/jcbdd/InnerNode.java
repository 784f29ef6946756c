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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A decision node with a level and two children. The node owns both child edges.
 *
 * <p>{@link #equals(Object)} and {@link #hashCode()} are defined over the content (level and children), which is what
 * the unique table of the {@link NodeTable} is keyed on. Edges compare nodes by identity.</p>
 */
public final class InnerNode implements Node {
    private final int level;
    private final Edge thenEdge;
    private final Edge elseEdge;
    private final int hash;
    private final AtomicInteger references = new AtomicInteger();
    // Assigned by the node table before the node is published
    private int id = -1;

    InnerNode(int level, Edge thenEdge, Edge elseEdge) {
        assert thenEdge.isOwned() && elseEdge.isOwned();
        assert level < thenEdge.level() && level < elseEdge.level() : "Children do not descend";
        this.level = level;
        this.thenEdge = thenEdge;
        this.elseEdge = elseEdge;
        this.hash = HashUtil.hash(level, thenEdge.hashCode(), elseEdge.hashCode());
    }

    @Override
    public int level() {
        return level;
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    int id() {
        return id;
    }

    void assignId(int id) {
        assert this.id == -1;
        this.id = id;
    }

    /**
     * Returns a borrowed view of the child with the given index, {@code 0} being the then-child and {@code 1} the
     * else-child.
     */
    public Edge child(int index) {
        switch (index) {
            case 0:
                return thenEdge.borrow();
            case 1:
                return elseEdge.borrow();
            default:
                throw new IndexOutOfBoundsException(index);
        }
    }

    public Edge thenChild() {
        return thenEdge.borrow();
    }

    public Edge elseChild() {
        return elseEdge.borrow();
    }

    // The owned child edges, only to be released by the node table
    Edge ownedThen() {
        return thenEdge;
    }

    Edge ownedElse() {
        return elseEdge;
    }

    int referenceCount() {
        return references.get();
    }

    void incrementReferences() {
        references.incrementAndGet();
    }

    int decrementReferences() {
        int count = references.decrementAndGet();
        assert count >= 0 : "Negative reference count on " + this;
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InnerNode)) {
            return false;
        }
        InnerNode other = (InnerNode) o;
        return hash == other.hash
                && level == other.level
                && thenEdge.equals(other.thenEdge)
                && elseEdge.equals(other.elseEdge);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return String.format("%d|%d|%s|%s", id, level, thenEdge, elseEdge);
    }
}
