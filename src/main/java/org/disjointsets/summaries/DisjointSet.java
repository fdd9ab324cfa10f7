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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A partition of the vertices {@code 0..size()-1} into disjoint components.
 * Every vertex starts as its own singleton component; components only merge.
 * <p>
 * Implementations are not thread-safe. Callers sharing an instance between threads
 * must serialize all calls to {@link #union(int, int)} externally.
 */
public interface DisjointSet {

	/**
	 * @return the fixed number of vertices in this set
	 */
	int size();

	/**
	 * Find returns the root of the component the vertex belongs in.
	 *
	 * @param vertex the vertex index
	 * @return the root of the connected component
	 * @throws VertexOutOfRangeException if the vertex is negative or not less than {@link #size()}
	 */
	int findRoot(int vertex);

	/**
	 * Union combines the two possibly disjoint components where a and b belong in.
	 * Does nothing if they are already connected.
	 *
	 * @param a the first vertex
	 * @param b the second vertex
	 * @throws VertexOutOfRangeException if either vertex is out of range
	 */
	void union(int a, int b);

	/**
	 * @param a the first vertex
	 * @param b the second vertex
	 * @return true if a and b share a root
	 * @throws VertexOutOfRangeException if either vertex is out of range
	 */
	boolean connected(int a, int b);

	/**
	 * Groups all vertices by their root.
	 *
	 * @return the components keyed by root in ascending order, members ascending
	 */
	default Map<Integer, List<Integer>> components() {
		Map<Integer, List<Integer>> comps = new TreeMap<>();
		for (int vertex = 0; vertex < size(); vertex++) {
			comps.computeIfAbsent(findRoot(vertex), root -> new ArrayList<>()).add(vertex);
		}
		return comps;
	}
}
