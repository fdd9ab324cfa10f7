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

package org.disjointsets.example;

import org.apache.flink.api.common.ProgramDescription;
import org.apache.flink.api.common.functions.FlatMapFunction;
import org.apache.flink.graph.Edge;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.types.NullValue;
import org.apache.flink.util.Collector;
import org.disjointsets.library.StreamingDisjointSets;
import org.disjointsets.summaries.DisjointSet;
import org.disjointsets.summaries.DisjointSetVariant;

import java.util.ArrayList;
import java.util.List;

/**
 * Unions the edges of a small graph into a disjoint set and checks which vertices end up connected.
 * The same edges are then streamed through {@link StreamingDisjointSets#unionEdges}, which reports
 * for every edge whether it merged two components.
 * <p>
 * The built-in graph has 10 vertices and forms the components 1-2-5-6-7 and 3-8-9-4.
 */
public class DisjointSetExample implements ProgramDescription {

	public static void main(String[] args) throws Exception {

		if (!parseParameters(args)) {
			return;
		}

		if (!fileInput) {
			DisjointSet disjointSet = runChecks(variant.create(size));
			System.out.println("Components: " + disjointSet);
		}

		StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

		StreamingDisjointSets.unionEdges(getEdgeStream(env), variant, size).print();

		env.execute("Streaming Disjoint Set Unions");
	}

	/**
	 * Unions the built-in edges and fails if the resulting connectivity is not the expected one.
	 *
	 * @param disjointSet an empty disjoint set of at least 10 vertices
	 * @return the same disjoint set with every built-in edge applied
	 */
	public static DisjointSet runChecks(DisjointSet disjointSet) {
		for (int[] edge : DEFAULT_EDGES) {
			if (edge[0] == 9 && edge[1] == 4) {
				check(!disjointSet.connected(4, 9), "4 and 9 must not be connected before union(9, 4)");
			}
			disjointSet.union(edge[0], edge[1]);
		}
		check(disjointSet.connected(1, 5), "1 and 5 must be connected");
		check(disjointSet.connected(5, 7), "5 and 7 must be connected");
		check(disjointSet.connected(4, 9), "4 and 9 must be connected");
		return disjointSet;
	}

	private static void check(boolean condition, String message) {
		if (!condition) {
			throw new IllegalStateException(message);
		}
	}

	// *************************************************************************
	//     UTIL METHODS
	// *************************************************************************

	static final int[][] DEFAULT_EDGES = {
			{1, 2}, {2, 5}, {5, 6}, {6, 7}, {3, 8}, {8, 9}, {9, 4}
	};

	private static boolean fileInput = false;
	private static String edgeInputPath = null;
	private static int size = 10;
	private static DisjointSetVariant variant = DisjointSetVariant.QUICK_UNION;

	private static boolean parseParameters(String[] args) {

		if (args.length > 0) {
			if (args.length != 3) {
				System.err.println("Usage: DisjointSetExample <input edges path> <number of vertices> "
						+ "<quick-find|quick-union>");
				return false;
			}

			fileInput = true;
			edgeInputPath = args[0];
			size = Integer.parseInt(args[1]);
			variant = DisjointSetVariant.fromName(args[2]);
		} else {
			System.out.println("Executing DisjointSetExample example with default parameters and built-in default data.");
			System.out.println("  Provide parameters to read input data from files.");
			System.out.println("  Usage: DisjointSetExample <input edges path> <number of vertices> "
					+ "<quick-find|quick-union>");
		}
		return true;
	}

	private static DataStream<Edge<Integer, NullValue>> getEdgeStream(StreamExecutionEnvironment env) {

		if (fileInput) {
			return env.readTextFile(edgeInputPath).flatMap(new ParseEdges());
		}

		return env.fromCollection(getDefaultEdges());
	}

	public static List<Edge<Integer, NullValue>> getDefaultEdges() {
		List<Edge<Integer, NullValue>> edges = new ArrayList<>();
		for (int[] edge : DEFAULT_EDGES) {
			edges.add(new Edge<>(edge[0], edge[1], NullValue.getInstance()));
		}
		return edges;
	}

	/**
	 * Turns a "src trg" line into an edge. Blank lines produce nothing.
	 */
	@SuppressWarnings("serial")
	public static final class ParseEdges implements FlatMapFunction<String, Edge<Integer, NullValue>> {

		@Override
		public void flatMap(String line, Collector<Edge<Integer, NullValue>> out) {
			String trimmed = line.trim();
			if (trimmed.isEmpty()) {
				return;
			}
			String[] fields = trimmed.split("\\s+");
			int src = Integer.parseInt(fields[0]);
			int trg = Integer.parseInt(fields[1]);
			out.collect(new Edge<>(src, trg, NullValue.getInstance()));
		}
	}

	@Override
	public String getDescription() {
		return "Streaming Disjoint Set Unions";
	}
}
