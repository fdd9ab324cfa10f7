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
 * Thrown when a vertex index falls outside {@code 0..size-1} of a {@link DisjointSet}.
 */
public class VertexOutOfRangeException extends IndexOutOfBoundsException {

	private static final long serialVersionUID = 1L;

	private final int vertex;
	private final int size;

	public VertexOutOfRangeException(int vertex, int size) {
		super(vertex < 0
				? "Vertex " + vertex + " must not be negative"
				: "Vertex " + vertex + " must be less than the disjoint set size " + size);
		this.vertex = vertex;
		this.size = size;
	}

	public int getVertex() {
		return vertex;
	}

	public int getSize() {
		return size;
	}
}
