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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

public class NodeTableTest {
    private static Edge node(NodeTable table, int level, Edge thenEdge, Edge elseEdge)
            throws NodeAllocationException {
        return BcddRules.reduce(table, level, table.cloneEdge(thenEdge), table.cloneEdge(elseEdge))
                .thenInsert(table);
    }

    @Test
    public void testUniqueness() throws NodeAllocationException {
        NodeTable table = new NodeTable(16, 4);
        table.ensureLevels(2);
        Edge first = node(table, 1, table.terminalEdge(true), table.terminalEdge(false));
        Edge second = node(table, 1, table.terminalEdge(true), table.terminalEdge(false));
        assertThat(first, is(second));
        assertThat(first.node(), sameInstance(second.node()));
        assertThat(table.nodeCount(), is(1));
        assertThat(table.referenceCount(first), is(2));
        assertThat(table.check(), is(true));
    }

    @Test
    public void testGarbageCollectionCascades() throws NodeAllocationException {
        NodeTable table = new NodeTable(16, 4);
        table.ensureLevels(3);
        Edge x2 = node(table, 2, table.terminalEdge(true), table.terminalEdge(false));
        Edge f = node(table, 1, x2, table.terminalEdge(false));
        Edge g = node(table, 0, f, x2);
        table.dropEdge(f);
        table.dropEdge(x2);
        assertThat(table.nodeCount(), is(3));
        assertThat(table.collectGarbage(), is(0));

        table.dropEdge(g);
        assertThat(table.collectGarbage(), is(3));
        assertThat(table.nodeCount(), is(0));
        assertThat(table.check(), is(true));
    }

    @Test
    public void testCloneAndDrop() throws NodeAllocationException {
        NodeTable table = new NodeTable(16, 4);
        table.ensureLevels(1);
        Edge x = node(table, 0, table.terminalEdge(true), table.terminalEdge(false));
        Edge clone = table.cloneEdge(x.not());
        assertThat(clone.isOwned(), is(true));
        assertThat(clone, is(x.not()));
        assertThat(table.referenceCount(x), is(2));
        table.dropEdge(clone);
        assertThat(table.referenceCount(x), is(1));
        assertThat(table.approximateDeadNodeCount(), is(0L));
        table.dropEdge(x);
        assertThat(table.approximateDeadNodeCount(), is(1L));
    }

    @Test
    public void testAllocationLimit() throws NodeAllocationException {
        NodeTable table = new NodeTable(2, 4);
        table.ensureLevels(3);
        Edge x2 = node(table, 2, table.terminalEdge(true), table.terminalEdge(false));
        Edge f = node(table, 1, x2, table.terminalEdge(false));
        assertThat(table.referenceCount(x2), is(2));

        NodeAllocationException exception =
                assertThrows(NodeAllocationException.class, () -> node(table, 0, f, x2));
        assertThat(exception.maximumNodeCount(), is(2));
        // The children of the rejected candidate have been released
        assertThat(table.referenceCount(x2), is(2));
        assertThat(table.referenceCount(f), is(1));
        assertThat(table.nodeCount(), is(2));

        // Existing nodes can still be found
        Edge again = node(table, 1, x2, table.terminalEdge(false));
        assertThat(again, is(f));
        assertThat(table.check(), is(true));
    }

    @Test
    public void testNodeCountOfEdge() throws NodeAllocationException {
        NodeTable table = new NodeTable(16, 4);
        table.ensureLevels(3);
        Edge x2 = node(table, 2, table.terminalEdge(true), table.terminalEdge(false));
        Edge x1 = node(table, 1, table.terminalEdge(true), table.terminalEdge(false));
        Edge f = node(table, 0, x1, x2);
        assertThat(table.nodeCount(f), is(3));
        assertThat(table.nodeCount(f.not()), is(3));
        assertThat(table.nodeCount(x2), is(1));
        assertThat(table.nodeCount(table.terminalEdge(false)), is(0));
    }

    @Test
    public void testConcurrentInsertion() throws Exception {
        NodeTable table = new NodeTable(1 << 12, 4);
        table.ensureLevels(2);
        Edge x1 = node(table, 1, table.terminalEdge(true), table.terminalEdge(false));

        int threads = 4;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<Edge>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> node(table, 0, x1, table.terminalEdge(false)));
            }
            List<Edge> results = new ArrayList<>();
            for (Future<Edge> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
            for (Edge result : results) {
                assertThat(result.node(), sameInstance(results.get(0).node()));
            }
            assertThat(table.nodeCount(), is(2));
            assertThat(table.referenceCount(results.get(0)), is(64));
            assertThat(table.referenceCount(x1), is(2));
        } finally {
            executor.shutdown();
        }
        assertThat(table.check(), is(true));
    }
}
