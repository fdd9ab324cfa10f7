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

import org.apache.flink.api.common.functions.RichFlatMapFunction;
import org.apache.flink.api.java.tuple.Tuple2;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.graph.Edge;
import org.apache.flink.types.NullValue;
import org.apache.flink.util.Collector;
import org.disjointsets.summaries.DisjointSet;
import org.disjointsets.summaries.DisjointSetVariant;

/**
 * Assigns a component ID to each vertex as edges arrive.
 * After every edge, a (vertex, root) pair is emitted for each vertex whose root changed.
 * The last pair emitted for a vertex holds its current component root. A vertex is
 * emitted only when its root changes, so component roots are never emitted.
 * <p>
 * Like {@link UnionEdges}, this must run with parallelism 1.
 */
@SuppressWarnings("serial")
public class ComponentRoots extends RichFlatMapFunction<Edge<Integer, NullValue>, Tuple2<Integer, Integer>> {

	private final DisjointSetVariant variant;
	private final int size;

	private transient DisjointSet disjointSet;
	private transient int[] emittedRoots;

	public ComponentRoots(DisjointSetVariant variant, int size) {
		this.variant = variant;
		this.size = size;
	}

	@Override
	public void open(Configuration parameters) throws Exception {
		disjointSet = variant.create(size);
		emittedRoots = new int[size];
		for (int i = 0; i < size; i++) {
			emittedRoots[i] = i;
		}
	}

	@Override
	public void flatMap(Edge<Integer, NullValue> edge, Collector<Tuple2<Integer, Integer>> out) throws Exception {
		if (disjointSet.connected(edge.getSource(), edge.getTarget())) {
			return;
		}
		disjointSet.union(edge.getSource(), edge.getTarget());
		for (int vertex = 0; vertex < size; vertex++) {
			int root = disjointSet.findRoot(vertex);
			if (root != emittedRoots[vertex]) {
				emittedRoots[vertex] = root;
				out.collect(new Tuple2<>(vertex, root));
			}
		}
	}
}
