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
 * A reference to a {@link Node} together with an {@link EdgeTag}. An edge with tag {@link EdgeTag#NONE} denotes the
 * function of the node, an edge with tag {@link EdgeTag#COMPLEMENTED} its negation.
 *
 * <p>Edges are either <i>owned</i> or <i>borrowed</i>. The holder of an owned edge is responsible for eventually
 * releasing it through {@link NodeTable#dropEdge(Edge)} (or handing it on to someone who does). A borrowed edge is a
 * temporary view which must not outlive the owned edge it was obtained from and must never be dropped. Equality of
 * edges is the identity of the referenced node plus the tag, ownership is not taken into account.</p>
 */
public final class Edge {
    private final Node node;
    private final EdgeTag tag;
    private final boolean owned;

    private Edge(Node node, EdgeTag tag, boolean owned) {
        this.node = node;
        this.tag = tag;
        this.owned = owned;
    }

    static Edge owned(Node node, EdgeTag tag) {
        return new Edge(node, tag, true);
    }

    static Edge borrowed(Node node, EdgeTag tag) {
        return new Edge(node, tag, false);
    }

    public Node node() {
        return node;
    }

    public EdgeTag tag() {
        return tag;
    }

    public boolean isOwned() {
        return owned;
    }

    public boolean isComplemented() {
        return tag == EdgeTag.COMPLEMENTED;
    }

    public boolean isTerminal() {
        return node.isTerminal();
    }

    public int level() {
        return node.level();
    }

    /**
     * Returns a borrowed view of this edge.
     */
    public Edge borrow() {
        return owned ? new Edge(node, tag, false) : this;
    }

    /**
     * Returns an edge to the same node with the given {@code tag}. If this edge is owned, the ownership moves to the
     * returned edge and this edge must not be used anymore. If it is borrowed, the result is another borrowed view.
     */
    public Edge withTag(EdgeTag tag) {
        return tag == this.tag ? this : new Edge(node, tag, owned);
    }

    /**
     * Flips the tag of this edge, see {@link #withTag(EdgeTag)} for the ownership semantics.
     */
    public Edge not() {
        return new Edge(node, tag.not(), owned);
    }

    /**
     * Returns a borrowed view to the same node with tag {@link EdgeTag#NONE}.
     */
    public Edge untagged() {
        return tag == EdgeTag.NONE && !owned ? this : new Edge(node, EdgeTag.NONE, false);
    }

    /**
     * Whether both edges point to the same node, regardless of their tags.
     */
    public boolean sameNode(Edge other) {
        return node == other.node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Edge)) {
            return false;
        }
        Edge edge = (Edge) o;
        return node == edge.node && tag == edge.tag;
    }

    @Override
    public int hashCode() {
        return 31 * node.hashCode() + tag.ordinal();
    }

    @Override
    public String toString() {
        String prefix = tag == EdgeTag.COMPLEMENTED ? "~" : "";
        if (node.isTerminal()) {
            return prefix + node;
        }
        return prefix + "@" + ((InnerNode) node).id();
    }
}
