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
 * Constant time shortcuts for binary operators. Each method either returns the owned result of the operation or
 * {@code null}, if both operands are distinct inner nodes and the operation needs to be decomposed.
 */
final class TerminalCases {
    private TerminalCases() {}

    static Edge constant(NodeTable table, boolean value) {
        return table.cloneEdge(table.terminalEdge(value));
    }

    @Nullable
    static Edge and(NodeTable table, Edge f, Edge g) {
        EdgeTag ft = f.tag();
        EdgeTag gt = g.tag();
        // There is only one terminal, so this also covers two constant operands
        if (f.sameNode(g)) {
            return ft == gt ? table.cloneEdge(g) : constant(table, false);
        }

        Edge other;
        EdgeTag terminalTag;
        if (f.isTerminal()) {
            other = g;
            terminalTag = ft;
        } else if (g.isTerminal()) {
            other = f;
            terminalTag = gt;
        } else {
            return null;
        }
        return terminalTag == EdgeTag.COMPLEMENTED ? constant(table, false) : table.cloneEdge(other);
    }

    @Nullable
    static Edge xor(NodeTable table, Edge f, Edge g) {
        EdgeTag ft = f.tag();
        EdgeTag gt = g.tag();
        if (f.sameNode(g)) {
            return constant(table, ft != gt);
        }

        Edge other;
        EdgeTag terminalTag;
        if (f.isTerminal()) {
            other = g;
            terminalTag = ft;
        } else if (g.isTerminal()) {
            other = f;
            terminalTag = gt;
        } else {
            return null;
        }
        Edge result = table.cloneEdge(other);
        // Exclusive or with true is the negation
        return terminalTag == EdgeTag.COMPLEMENTED ? result : result.not();
    }
}
