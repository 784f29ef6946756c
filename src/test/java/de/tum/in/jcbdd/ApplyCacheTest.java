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
import static org.hamcrest.Matchers.nullValue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ApplyCacheTest {
    private NodeTable table;
    private Edge x;
    private Edge y;

    @BeforeEach
    public void setUp() throws NodeAllocationException {
        table = new NodeTable(16, 4);
        table.ensureLevels(2);
        Edge trueEdge = table.terminalEdge(true);
        Edge falseEdge = table.terminalEdge(false);
        x = BcddRules.reduce(table, 0, table.cloneEdge(trueEdge), table.cloneEdge(falseEdge))
                .thenInsert(table);
        y = BcddRules.reduce(table, 1, table.cloneEdge(trueEdge), table.cloneEdge(falseEdge))
                .thenInsert(table);
    }

    @Test
    public void testSizeIsPrime() {
        assertThat(new ApplyCache(1000).size(), is(1009));
        assertThat(new ApplyCache(0).size(), is(2));
    }

    @Test
    public void testGetPut() {
        ApplyCache cache = new ApplyCache(128);
        assertThat(cache.get(Operator.AND, x, y, null), is(nullValue()));

        cache.put(Operator.AND, x, y, null, x.not());
        Edge result = cache.get(Operator.AND, x, y, null);
        assertThat(result, is(x.not()));
        assertThat(result.isOwned(), is(false));

        assertThat(cache.get(Operator.XOR, x, y, null), is(nullValue()));
        assertThat(cache.get(Operator.AND, x, y.not(), null), is(nullValue()));
        assertThat(cache.get(Operator.AND, y, x, null), is(nullValue()));
        assertThat(cache.get(Operator.ITE, x, y, x), is(nullValue()));
    }

    @Test
    public void testEntriesDoNotOwnReferences() {
        ApplyCache cache = new ApplyCache(128);
        cache.put(Operator.ITE, x, y, x.not(), y);
        assertThat(table.referenceCount(x), is(1));
        assertThat(table.referenceCount(y), is(1));
        assertThat(cache.get(Operator.ITE, x, y, x.not()), is(y));
    }

    @Test
    public void testInvalidate() {
        ApplyCache cache = new ApplyCache(128);
        cache.put(Operator.XOR, x, y, null, y);
        cache.put(Operator.EXIST, y, x, null, x);
        cache.invalidate();
        assertThat(cache.get(Operator.XOR, x, y, null), is(nullValue()));
        assertThat(cache.get(Operator.EXIST, y, x, null), is(nullValue()));
    }
}
