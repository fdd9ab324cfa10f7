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

package org.disjointsets.library;

import org.apache.flink.api.java.tuple.Tuple2;
import org.apache.flink.api.java.tuple.Tuple3;
import org.apache.flink.graph.Edge;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.types.NullValue;
import org.disjointsets.summaries.DisjointSetVariant;

/**
 * Applies a fixed-size {@link org.disjointsets.summaries.DisjointSet} to a stream of edges.
 * Edge direction is ignored. Vertex IDs must lie in {@code 0..size-1}, otherwise the job
 * fails with a {@link org.disjointsets.summaries.VertexOutOfRangeException}.
 * <p>
 * Both operators run with parallelism 1, so a single disjoint set sees every edge in
 * stream order.
 */
public final class StreamingDisjointSets {

	private StreamingDisjointSets() {
	}

	/**
	 * @param edges the edge stream
	 * @param variant the disjoint set implementation to fold the edges into
	 * @param size the number of vertices
	 * @return (src, trg, merged) for every edge, merged being false for redundant edges
	 */
	public static DataStream<Tuple3<Integer, Integer, Boolean>> unionEdges(
			DataStream<Edge<Integer, NullValue>> edges, DisjointSetVariant variant, int size) {

		return edges.flatMap(new UnionEdges(variant, size))
				.name("Union edges (" + variant.getName() + ")")
				.setParallelism(1);
	}

	/**
	 * @param edges the edge stream
	 * @param variant the disjoint set implementation to fold the edges into
	 * @param size the number of vertices
	 * @return (vertex, root) updates, one for every vertex whose root changes
	 */
	public static DataStream<Tuple2<Integer, Integer>> connectedComponents(
			DataStream<Edge<Integer, NullValue>> edges, DisjointSetVariant variant, int size) {

		return edges.flatMap(new ComponentRoots(variant, size))
				.name("Component roots (" + variant.getName() + ")")
				.setParallelism(1);
	}
}
