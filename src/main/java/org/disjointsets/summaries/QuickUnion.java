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

import java.util.Arrays;

/**
 * Disjoint set that stores the parent of every vertex, forming an implicit forest.
 * <p>
 * A union links one root under the other in O(1) once both roots are known.
 * Finding a root walks up the tree, so find, union and connected all cost O(n) in the
 * worst case of a degenerate chain. Trees are never flattened or balanced.
 */
public final class QuickUnion implements DisjointSet {

	// index is a vertex, value is its parent; roots point to themselves
	private final int[] parents;

	public QuickUnion(int size) {
		parents = new int[DisjointSetChecks.checkSize(size)];
		for (int i = 0; i < parents.length; i++) {
			parents[i] = i;
		}
	}

	@Override
	public int size() {
		return parents.length;
	}

	@Override
	public int findRoot(int vertex) {
		int current = DisjointSetChecks.checkVertex(vertex, parents.length);
		while (current != parents[current]) {
			current = parents[current];
		}
		return current;
	}

	/**
	 * Attaches b's tree under a's root.
	 */
	@Override
	public void union(int a, int b) {
		int rootA = findRoot(a);
		int rootB = findRoot(b);
		if (rootA != rootB) {
			parents[rootB] = rootA;
		}
	}

	@Override
	public boolean connected(int a, int b) {
		return findRoot(a) == findRoot(b);
	}

	int[] parents() {
		return Arrays.copyOf(parents, parents.length);
	}

	@Override
	public String toString() {
		return components().toString();
	}
}
