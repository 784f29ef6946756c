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
 * Thrown when the node table cannot store another node because its configured maximum is reached. Nodes created
 * before the failure remain valid. The operation may be retried, e.g. after {@link Bcdd#collectGarbage()}.
 */
public class NodeAllocationException extends Exception {
    private static final long serialVersionUID = 1L;

    private final int maximumNodeCount;

    public NodeAllocationException(int maximumNodeCount) {
        super(String.format("Node table is full (maximum of %d nodes reached)", maximumNodeCount));
        this.maximumNodeCount = maximumNodeCount;
    }

    public int maximumNodeCount() {
        return maximumNodeCount;
    }
}
