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

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@link DisplayNode} tree for a parse tree. One display node is
 * created per composite, sequence and scalar value; composite fields keep
 * their declared order and sequence elements are labelled
 * {@code "<field>[i]"}.
 *
 * <p>The parse tree must be finite. Cyclic input is not detected.</p>
 */
public class TreeBuilder {

	public DisplayNode build(ParseNode root, String rootLabel) {
		Objects.requireNonNull(root, "root");
		return root.accept(new NodeBuilder(rootLabel != null ? rootLabel : ""));
	}

	private static class NodeBuilder implements ParseNodeVisitor<DisplayNode> {
		private final String fieldLabel;

		NodeBuilder(String fieldLabel) {
			this.fieldLabel = fieldLabel;
		}

		@Override
		public DisplayNode visitComposite(CompositeNode node) {
			DisplayNode displayNode = new DisplayNode(fieldLabel, node.getTypeName(), "", node.getPosition());
			for (Map.Entry<String, ParseNode> field : node.getFields().entrySet()) {
				displayNode.addChild(field.getValue().accept(new NodeBuilder(field.getKey())));
			}
			return displayNode;
		}

		@Override
		public DisplayNode visitSequence(SequenceNode node) {
			DisplayNode displayNode = new DisplayNode(fieldLabel, node.getTypeName(), "", null);
			List<ParseNode> elements = node.getElements();
			for (int i = 0; i < elements.size(); i++) {
				String elementLabel = fieldLabel + "[" + i + "]";
				displayNode.addChild(elements.get(i).accept(new NodeBuilder(elementLabel)));
			}
			return displayNode;
		}

		@Override
		public DisplayNode visitScalar(ScalarNode node) {
			return new DisplayNode(fieldLabel, node.getTypeName(), node.render(), null);
		}
	}
}
