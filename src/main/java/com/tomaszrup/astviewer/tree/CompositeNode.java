////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.astviewer.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.tomaszrup.astviewer.span.SourcePosition;

/**
 * A typed parse tree node with named fields. Field iteration order is the
 * order in which fields were added and is preserved by the tree builder.
 */
public final class CompositeNode implements ParseNode {

	private final String typeName;
	private final SourcePosition position;
	private final Map<String, ParseNode> fields = new LinkedHashMap<>();

	public CompositeNode(String typeName) {
		this(typeName, null);
	}

	/**
	 * @param typeName the node's type name
	 * @param position the node's starting position, or {@code null} if the
	 *                 parser recorded none
	 */
	public CompositeNode(String typeName, SourcePosition position) {
		this.typeName = Objects.requireNonNull(typeName, "typeName");
		this.position = position;
	}

	/**
	 * Appends a field. A {@code null} value is stored as a
	 * {@link ScalarNode} holding {@code null}.
	 *
	 * @return this node, for chaining
	 */
	public CompositeNode field(String name, ParseNode value) {
		Objects.requireNonNull(name, "name");
		if (fields.containsKey(name)) {
			throw new IllegalArgumentException("Duplicate field '" + name + "' on " + typeName);
		}
		fields.put(name, value != null ? value : ScalarNode.of(null));
		return this;
	}

	@Override
	public String getTypeName() {
		return typeName;
	}

	/**
	 * The starting position recorded by the parser, or {@code null}.
	 */
	public SourcePosition getPosition() {
		return position;
	}

	public Map<String, ParseNode> getFields() {
		return Collections.unmodifiableMap(fields);
	}

	@Override
	public <R> R accept(ParseNodeVisitor<R> visitor) {
		return visitor.visitComposite(this);
	}

	@Override
	public String toString() {
		return typeName + (position != null ? "@" + position : "") + fields.keySet();
	}
}
