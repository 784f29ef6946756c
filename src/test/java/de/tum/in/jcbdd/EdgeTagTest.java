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
import static org.hamcrest.Matchers.not;

import org.junit.jupiter.api.Test;

public class EdgeTagTest {
    @Test
    public void testGroup() {
        for (EdgeTag a : EdgeTag.values()) {
            assertThat(a.xor(EdgeTag.NONE), is(a));
            assertThat(a.xor(a), is(EdgeTag.NONE));
            assertThat(a.not().not(), is(a));
            assertThat(a.not(), is(a.xor(EdgeTag.COMPLEMENTED)));
            for (EdgeTag b : EdgeTag.values()) {
                assertThat(a.xor(b), is(b.xor(a)));
                for (EdgeTag c : EdgeTag.values()) {
                    assertThat(a.xor(b).xor(c), is(a.xor(b.xor(c))));
                }
            }
        }
        assertThat(EdgeTag.of(true), is(EdgeTag.COMPLEMENTED));
        assertThat(EdgeTag.of(false), is(EdgeTag.NONE));
    }

    @Test
    public void testEdgeNegation() {
        NodeTable table = new NodeTable(16, 4);
        Edge trueEdge = table.terminalEdge(true);
        Edge falseEdge = table.terminalEdge(false);

        assertThat(trueEdge.isOwned(), is(false));
        assertThat(trueEdge.not(), is(falseEdge));
        assertThat(trueEdge.not().isOwned(), is(false));
        assertThat(trueEdge.not().not(), is(trueEdge));
        // The original edge is not affected
        assertThat(trueEdge.tag(), is(EdgeTag.NONE));

        Edge owned = table.cloneEdge(trueEdge);
        Edge negated = owned.not();
        assertThat(negated.isOwned(), is(true));
        assertThat(negated, is(falseEdge));
        assertThat(negated, is(not(owned)));
        assertThat(negated.untagged(), is(trueEdge));
        assertThat(negated.untagged().isOwned(), is(false));
    }
}
