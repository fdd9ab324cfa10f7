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
import org.apache.flink.api.java.tuple.Tuple3;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.graph.Edge;
import org.apache.flink.types.NullValue;
import org.apache.flink.util.Collector;
import org.disjointsets.summaries.DisjointSet;
import org.disjointsets.summaries.DisjointSetVariant;

/**
 * Folds every incoming edge into a {@link DisjointSet} with a union of its endpoints.
 * For each edge (src, trg) it emits (src, trg, merged), where merged tells whether the
 * edge joined two different components. An edge between already connected vertices
 * is redundant and emitted with merged set to false.
 * <p>
 * The disjoint set lives in this function instance only, so the operator must run
 * with parallelism 1 to see the whole edge stream.
 */
@SuppressWarnings("serial")
public class UnionEdges extends RichFlatMapFunction<Edge<Integer, NullValue>, Tuple3<Integer, Integer, Boolean>> {

	private final DisjointSetVariant variant;
	private final int size;

	private transient DisjointSet disjointSet;

	public UnionEdges(DisjointSetVariant variant, int size) {
		this.variant = variant;
		this.size = size;
	}

	@Override
	public void open(Configuration parameters) throws Exception {
		disjointSet = variant.create(size);
	}

	@Override
	public void flatMap(Edge<Integer, NullValue> edge, Collector<Tuple3<Integer, Integer, Boolean>> out) throws Exception {
		int src = edge.getSource();
		int trg = edge.getTarget();
		boolean merged = !disjointSet.connected(src, trg);
		if (merged) {
			disjointSet.union(src, trg);
		}
		out.collect(new Tuple3<>(src, trg, merged));
	}
}
