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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list or fixed tuple of parse tree values.
 */
public final class SequenceNode implements ParseNode {

	public static final String LIST = "List";
	public static final String ARRAY = "Array";

	private final String typeName;
	private final List<ParseNode> elements;

	public SequenceNode(String typeName, List<? extends ParseNode> elements) {
		this.typeName = Objects.requireNonNull(typeName, "typeName");
		List<ParseNode> copy = new ArrayList<>(elements.size());
		for (ParseNode element : elements) {
			copy.add(element != null ? element : ScalarNode.of(null));
		}
		this.elements = Collections.unmodifiableList(copy);
	}

	public static SequenceNode list(List<? extends ParseNode> elements) {
		return new SequenceNode(LIST, elements);
	}

	public static SequenceNode list(ParseNode... elements) {
		return new SequenceNode(LIST, List.of(elements));
	}

	@Override
	public String getTypeName() {
		return typeName;
	}

	public List<ParseNode> getElements() {
		return elements;
	}

	@Override
	public <R> R accept(ParseNodeVisitor<R> visitor) {
		return visitor.visitSequence(this);
	}

	@Override
	public String toString() {
		return typeName + "(" + elements.size() + ")";
	}
}
