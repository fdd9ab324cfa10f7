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

import java.util.Locale;

/**
 * The available {@link DisjointSet} implementations.
 */
public enum DisjointSetVariant {

	QUICK_FIND("quick-find") {
		@Override
		public DisjointSet create(int size) {
			return new QuickFind(size);
		}
	},

	QUICK_UNION("quick-union") {
		@Override
		public DisjointSet create(int size) {
			return new QuickUnion(size);
		}
	};

	private final String name;

	DisjointSetVariant(String name) {
		this.name = name;
	}

	public abstract DisjointSet create(int size);

	public String getName() {
		return name;
	}

	/**
	 * @param name "quick-find" or "quick-union", case-insensitive
	 * @return the matching variant
	 */
	public static DisjointSetVariant fromName(String name) {
		String lower = name.trim().toLowerCase(Locale.ROOT);
		for (DisjointSetVariant variant : values()) {
			if (variant.name.equals(lower)) {
				return variant;
			}
		}
		throw new IllegalArgumentException("Unknown disjoint set variant: " + name
				+ ". Expected quick-find or quick-union.");
	}
}
