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

import com.tomaszrup.astviewer.span.SourcePosition;
import com.tomaszrup.astviewer.span.SourceSpan;

/**
 * One row of the syntax tree view. Created by {@link TreeBuilder}, one per
 * visited parse tree value, and annotated with a span by
 * {@link SpanResolver}. The tree is read-only for everyone else.
 */
public final class DisplayNode {

	private final String fieldLabel;
	private final String typeName;
	private final String valueText;
	private final SourcePosition ownPosition;
	private final List<DisplayNode> children = new ArrayList<>();

	private SourceSpan span;
	private boolean outOfOrder;

	DisplayNode(String fieldLabel, String typeName, String valueText, SourcePosition ownPosition) {
		this.fieldLabel = fieldLabel;
		this.typeName = typeName;
		this.valueText = valueText;
		this.ownPosition = ownPosition;
	}

	/**
	 * How the parent refers to this node: a field name, a
	 * {@code field[index]} label for sequence elements, or the root label.
	 */
	public String getFieldLabel() {
		return fieldLabel;
	}

	public String getTypeName() {
		return typeName;
	}

	/**
	 * Literal rendering of a scalar value; empty for composites and
	 * sequences.
	 */
	public String getValueText() {
		return valueText;
	}

	/**
	 * The position the parser attached to this node, or {@code null}.
	 */
	public SourcePosition getOwnPosition() {
		return ownPosition;
	}

	public boolean hasOwnPosition() {
		return ownPosition != null;
	}

	/**
	 * The resolved span, or {@code null} before {@link SpanResolver#resolve}
	 * has run.
	 */
	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * Whether the computed span is inverted because descendants appear out
	 * of textual order. Display-level warning only.
	 */
	public boolean isOutOfOrder() {
		return outOfOrder;
	}

	public List<DisplayNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public int getChildCount() {
		return children.size();
	}

	public DisplayNode getChild(int index) {
		return children.get(index);
	}

	public boolean isLeaf() {
		return children.isEmpty();
	}

	void addChild(DisplayNode child) {
		children.add(child);
	}

	void setSpan(SourceSpan span, boolean outOfOrder) {
		this.span = span;
		this.outOfOrder = outOfOrder;
	}

	void clearSpan() {
		this.span = null;
		this.outOfOrder = false;
	}

	@Override
	public String toString() {
		return fieldLabel + " = " + typeName + (span != null ? " [" + span + "]" : "");
	}
}
