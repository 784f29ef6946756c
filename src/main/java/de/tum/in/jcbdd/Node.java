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
 * A node of a complement edge BDD, either the single {@link Terminal} or an {@link InnerNode}.
 */
public interface Node {
    /**
     * Position of the node's decision variable in the variable order. Lower levels are decided first, the terminal is
     * on level {@link Integer#MAX_VALUE}.
     */
    int level();

    boolean isTerminal();
}
