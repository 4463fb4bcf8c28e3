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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.astviewer.span.SourcePosition;

class DisplayColumnsTests {

	private static DisplayNode resolved(ParseNode parseNode, SourcePosition endOfDocument) {
		DisplayNode root = new TreeBuilder().build(parseNode, "module");
		new SpanResolver().resolve(root, endOfDocument);
		return root;
	}

	@Test
	void testCompositeRow() {
		CompositeNode function = new CompositeNode("FunctionDef", SourcePosition.of(8, 0))
				.field("name", ScalarNode.of("f"));
		DisplayNode root = resolved(new CompositeNode("Module").field("body", SequenceNode.list(function)),
				SourcePosition.of(9, 4));
		DisplayNode node = root.getChild(0).getChild(0);

		String[] row = DisplayColumns.row(node);
		Assertions.assertEquals(DisplayColumns.HEADER_LABELS.length, row.length);
		Assertions.assertEquals("body[0] = FunctionDef", row[0]);
		Assertions.assertEquals("body[0]", row[1]);
		Assertions.assertEquals("FunctionDef", row[2]);
		Assertions.assertEquals("", row[3]);
		Assertions.assertEquals("8 : 0", row[4]);
		Assertions.assertEquals("8:0 : 9:4", row[5]);
	}

	@Test
	void testScalarNodeText() {
		DisplayNode root = resolved(new CompositeNode("Name", SourcePosition.of(1, 0)).field("id", ScalarNode.of("x")),
				SourcePosition.of(1, 1));
		DisplayNode id = root.getChild(0);

		Assertions.assertEquals("id = \"x\"", DisplayColumns.nodeText(id));
		Assertions.assertEquals("", DisplayColumns.positionText(id));
		Assertions.assertEquals("1:0 : 1:1", DisplayColumns.highlightText(id));
	}

	@Test
	void testEmptySequenceShowsTypeName() {
		DisplayNode root = resolved(new CompositeNode("Module").field("body", SequenceNode.list()),
				SourcePosition.of(1, 0));
		Assertions.assertEquals("body = List", DisplayColumns.nodeText(root.getChild(0)));
		Assertions.assertEquals("<bof> : 1:0", DisplayColumns.highlightText(root));
	}

	@Test
	void testUnresolvedNodeHasEmptyHighlight() {
		DisplayNode root = new TreeBuilder().build(new CompositeNode("Module"), "module");
		Assertions.assertEquals("", DisplayColumns.highlightText(root));
	}
}
