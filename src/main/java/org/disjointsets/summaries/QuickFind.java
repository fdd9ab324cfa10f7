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
 * Disjoint set that stores the root of every vertex directly.
 * <p>
 * Finding a root and checking connectivity take O(1): a single array lookup.
 * A union takes O(n) since the whole array is scanned to relabel the merged component.
 */
public final class QuickFind implements DisjointSet {

	// index is a vertex, value is the root of its component
	private final int[] roots;

	public QuickFind(int size) {
		roots = new int[DisjointSetChecks.checkSize(size)];
		for (int i = 0; i < roots.length; i++) {
			roots[i] = i;
		}
	}

	@Override
	public int size() {
		return roots.length;
	}

	@Override
	public int findRoot(int vertex) {
		return roots[DisjointSetChecks.checkVertex(vertex, roots.length)];
	}

	/**
	 * Relabels every vertex rooted at b's root with a's root.
	 * The scan covers the whole array regardless of the component sizes.
	 */
	@Override
	public void union(int a, int b) {
		int rootA = findRoot(a);
		int rootB = findRoot(b);
		if (rootA == rootB) {
			return;
		}
		for (int vertex = 0; vertex < roots.length; vertex++) {
			if (roots[vertex] == rootB) {
				roots[vertex] = rootA;
			}
		}
	}

	@Override
	public boolean connected(int a, int b) {
		return findRoot(a) == findRoot(b);
	}

	int[] roots() {
		return Arrays.copyOf(roots, roots.length);
	}

	@Override
	public String toString() {
		return components().toString();
	}
}
