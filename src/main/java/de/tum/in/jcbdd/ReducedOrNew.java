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

import javax.annotation.Nullable;

/**
 * Outcome of the {@link BcddRules#reduce(NodeTable, int, Edge, Edge) reduction rule}: either an existing edge which
 * makes a new node unnecessary, or a candidate node together with the tag of the edge which will point to it.
 */
public final class ReducedOrNew {
    @Nullable
    private final Edge reduced;

    @Nullable
    private final InnerNode node;

    private final EdgeTag tag;

    private ReducedOrNew(@Nullable Edge reduced, @Nullable InnerNode node, EdgeTag tag) {
        this.reduced = reduced;
        this.node = node;
        this.tag = tag;
    }

    static ReducedOrNew reduced(Edge edge) {
        return new ReducedOrNew(edge, null, edge.tag());
    }

    static ReducedOrNew newNode(InnerNode node, EdgeTag tag) {
        return new ReducedOrNew(null, node, tag);
    }

    public boolean isReduced() {
        return reduced != null;
    }

    /**
     * The owned edge of a reduced outcome.
     *
     * @throws IllegalStateException if this is a new node outcome.
     */
    public Edge reducedEdge() {
        if (reduced == null) {
            throw new IllegalStateException("Not reduced");
        }
        return reduced;
    }

    /**
     * The candidate node of a new node outcome. It is not yet resident in any node table.
     *
     * @throws IllegalStateException if this is a reduced outcome.
     */
    public InnerNode candidate() {
        if (node == null) {
            throw new IllegalStateException("Reduced");
        }
        return node;
    }

    public EdgeTag tag() {
        return tag;
    }

    /**
     * Completes the reduction: a reduced outcome yields its edge, a candidate is inserted into the {@code table}, which
     * either makes it resident or replaces it by the equal resident node.
     */
    public Edge thenInsert(NodeTable table) throws NodeAllocationException {
        if (reduced != null) {
            return reduced;
        }
        assert node != null;
        return table.insert(node, tag);
    }

    @Override
    public String toString() {
        return reduced == null ? String.format("New(%s, %s)", node, tag) : String.format("Reduced(%s)", reduced);
    }
}
