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

import com.tomaszrup.astviewer.span.SourcePosition;
import com.tomaszrup.astviewer.span.SourceSpan;

/**
 * Text for the columns of a syntax tree view: Node, Field, Class, Value,
 * {@code Line : Col} and Highlight.
 */
public final class DisplayColumns {

	public static final String[] HEADER_LABELS = { "Node", "Field", "Class", "Value", "Line : Col", "Highlight" };

	private DisplayColumns() {
	}

	/**
	 * {@code "field = Type"} for composites and sequences,
	 * {@code "field = value"} for scalars.
	 */
	public static String nodeText(DisplayNode node) {
		String right = node.isLeaf() && !node.getValueText().isEmpty() ? node.getValueText() : node.getTypeName();
		return node.getFieldLabel() + " = " + right;
	}

	public static String positionText(DisplayNode node) {
		SourcePosition position = node.getOwnPosition();
		if (position == null) {
			return "";
		}
		return position.getLine() + " : " + position.getColumn();
	}

	public static String highlightText(DisplayNode node) {
		SourceSpan span = node.getSpan();
		return span != null ? span.toString() : "";
	}

	/**
	 * All six column texts, in {@link #HEADER_LABELS} order.
	 */
	public static String[] row(DisplayNode node) {
		return new String[] {
				nodeText(node),
				node.getFieldLabel(),
				node.getTypeName(),
				node.getValueText(),
				positionText(node),
				highlightText(node)
		};
	}
}
