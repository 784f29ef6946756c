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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The reduction and decomposition rules of complement edge BDDs.
 *
 * <p>The complement bit is never stored on a then-edge: whenever a node would get a complemented then-child, both
 * children are negated and the complement is moved to the edge pointing to the node. Hence, a node and its negation
 * share one record.</p>
 */
public final class BcddRules {
    private BcddRules() {}

    /**
     * Canonicalizes the triple ({@code level}, {@code thenEdge}, {@code elseEdge}). Both edges must be owned and are
     * consumed.
     *
     * <ul>
     *   <li>If both edges are equal, the else-edge is released and the then-edge is returned as is.</li>
     *   <li>If the then-edge is complemented, the candidate node gets the negated children and the resulting edge
     *   will be complemented.</li>
     *   <li>Otherwise, the candidate node gets the children as given.</li>
     * </ul>
     *
     * <p>A candidate still has to be passed through the node table, see {@link ReducedOrNew#thenInsert(NodeTable)}.</p>
     */
    public static ReducedOrNew reduce(NodeTable table, int level, Edge thenEdge, Edge elseEdge) {
        assert thenEdge.isOwned() && elseEdge.isOwned();
        if (thenEdge.equals(elseEdge)) {
            table.dropEdge(elseEdge);
            return ReducedOrNew.reduced(thenEdge);
        }
        if (thenEdge.isComplemented()) {
            return ReducedOrNew.newNode(new InnerNode(level, thenEdge.not(), elseEdge.not()), EdgeTag.COMPLEMENTED);
        }
        return ReducedOrNew.newNode(new InnerNode(level, thenEdge, elseEdge), EdgeTag.NONE);
    }

    /**
     * Returns a borrowed view of the child {@code index} of {@code node} as seen through an edge tagged with {@code
     * tag}. The node itself is not modified.
     */
    public static Edge cofactor(EdgeTag tag, InnerNode node, int index) {
        Edge child = node.child(index);
        return tag == EdgeTag.NONE ? child : child.not();
    }

    /**
     * Returns the then- and else-cofactor (in this order) of {@code node} as seen through an edge tagged with {@code
     * tag}. The cofactors are computed lazily.
     */
    public static Iterator<Edge> cofactors(EdgeTag tag, InnerNode node) {
        return new Cofactors(tag, node);
    }

    /**
     * Returns the cofactor {@code index} of {@code edge} with respect to the variable on {@code level}. An edge whose
     * node lies below that level does not depend on the variable and is its own cofactor.
     */
    static Edge cofactorOn(Edge edge, int level, int index) {
        assert edge.level() >= level;
        if (edge.level() != level) {
            return edge.borrow();
        }
        return cofactor(edge.tag(), (InnerNode) edge.node(), index);
    }

    private static final class Cofactors implements Iterator<Edge> {
        private final EdgeTag tag;
        private final InnerNode node;
        private int index = 0;

        Cofactors(EdgeTag tag, InnerNode node) {
            this.tag = tag;
            this.node = node;
        }

        @Override
        public boolean hasNext() {
            return index < 2;
        }

        @Override
        public Edge next() {
            if (index >= 2) {
                throw new NoSuchElementException();
            }
            Edge cofactor = cofactor(tag, node, index);
            index += 1;
            return cofactor;
        }
    }
}
