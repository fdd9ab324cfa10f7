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

import org.junit.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

public class DisjointSetChecksTest {

	@Test
	public void testValidArgumentsPassThrough() throws Exception {
		assertEquals(1, DisjointSetChecks.checkSize(1));
		assertEquals(0, DisjointSetChecks.checkVertex(0, 1));
		assertEquals(9, DisjointSetChecks.checkVertex(9, 10));
	}

	@Test
	public void testInvalidSize() throws Exception {
		try {
			DisjointSetChecks.checkSize(0);
			fail("Expected IllegalArgumentException");
		} catch (IllegalArgumentException e) {
			assertEquals("Disjoint set size must be positive, got 0", e.getMessage());
		}
	}

	@Test(expected = VertexOutOfRangeException.class)
	public void testInvalidVertex() throws Exception {
		DisjointSetChecks.checkVertex(10, 10);
	}

	@Test
	public void testChecksAreNotPublicApi() throws Exception {
		assertFalse(Modifier.isPublic(DisjointSetChecks.class.getModifiers()));
		for (Method method : DisjointSet.class.getDeclaredMethods()) {
			if (!method.isSynthetic()) {
				assertFalse(method.getName(), Modifier.isStatic(method.getModifiers()));
			}
		}
	}
}
