/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.disjointsets.summaries;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;


public class QuickFindTest {

    private QuickFind qf;

    @Before
    public void setup() {
        qf = new QuickFind(10);
    }

    @Test
    public void testInitialRoots() throws Exception {
        assertEquals(10, qf.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(i, qf.findRoot(i));
        }
    }

    @Test
    public void testUnionRelabelsWholeComponent() throws Exception {
        qf.union(1, 2);
        qf.union(3, 4);
        qf.union(4, 5);
        // 3, 4 and 5 all carry root 3; merging into 1 must relabel every one of them
        qf.union(1, 5);

        assertArrayEquals(new int[]{0, 1, 1, 1, 1, 1, 6, 7, 8, 9}, qf.roots());
    }

    @Test
    public void testUnionKeepsRootOfFirstArgument() throws Exception {
        qf.union(7, 2);
        assertEquals(7, qf.findRoot(2));
        assertEquals(7, qf.findRoot(7));
    }

    @Test
    public void testRepeatedUnionDoesNotMutate() throws Exception {
        qf.union(1, 2);
        qf.union(2, 3);
        int[] before = qf.roots();

        qf.union(3, 1);
        qf.union(1, 3);
        qf.union(2, 2);

        assertArrayEquals(before, qf.roots());
    }

    @Test
    public void testOutOfRangeMessage() throws Exception {
        try {
            qf.findRoot(10);
            fail("Expected VertexOutOfRangeException");
        } catch (VertexOutOfRangeException e) {
            assertEquals("Vertex 10 must be less than the disjoint set size 10", e.getMessage());
            assertEquals(10, e.getVertex());
            assertEquals(10, e.getSize());
        }
    }

    @Test(expected = VertexOutOfRangeException.class)
    public void testUnionOutOfRangeLeavesNoPartialUpdate() throws Exception {
        try {
            qf.union(1, 12);
        } finally {
            assertArrayEquals(new QuickFind(10).roots(), qf.roots());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroSize() throws Exception {
        new QuickFind(0);
    }

    @Test
    public void testSingleVertex() throws Exception {
        QuickFind single = new QuickFind(1);
        assertTrue(single.connected(0, 0));
        try {
            single.connected(0, 1);
            fail("Expected VertexOutOfRangeException");
        } catch (VertexOutOfRangeException e) {
            assertEquals(1, e.getVertex());
        }
        assertFalse(single.components().isEmpty());
    }

    @Test
    public void testToString() throws Exception {
        QuickFind small = new QuickFind(4);
        small.union(0, 2);
        assertEquals("{0=[0, 2], 1=[1], 3=[3]}", small.toString());
    }
}
