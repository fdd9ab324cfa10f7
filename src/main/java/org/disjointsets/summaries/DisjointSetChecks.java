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

/**
 * Argument checks shared by the {@link DisjointSet} implementations.
 */
final class DisjointSetChecks {

	private DisjointSetChecks() {
	}

	static int checkSize(int size) {
		if (size <= 0) {
			throw new IllegalArgumentException("Disjoint set size must be positive, got " + size);
		}
		return size;
	}

	static int checkVertex(int vertex, int size) {
		if (vertex < 0 || vertex >= size) {
			throw new VertexOutOfRangeException(vertex, size);
		}
		return vertex;
	}
}
