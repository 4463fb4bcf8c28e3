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
package com.tomaszrup.astviewer.util;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.astviewer.span.SourcePosition;

/**
 * Unit tests for {@link SourcePositions}: end-of-document computation, LSP
 * conversions and offset calculation.
 */
class SourcePositionsTests {

	// ------------------------------------------------------------------
	// endOf()
	// ------------------------------------------------------------------

	@Test
	void testEndOfEmptyText() {
		Assertions.assertEquals(SourcePosition.of(1, 0), SourcePositions.endOf(""));
		Assertions.assertEquals(SourcePosition.of(1, 0), SourcePositions.endOf(null));
	}

	@Test
	void testEndOfSingleLine() {
		Assertions.assertEquals(SourcePosition.of(1, 5), SourcePositions.endOf("hello"));
	}

	@Test
	void testEndOfMultipleLines() {
		Assertions.assertEquals(SourcePosition.of(3, 3), SourcePositions.endOf("aaa\nbbb\nccc"));
	}

	@Test
	void testEndOfTextWithTrailingNewline() {
		Assertions.assertEquals(SourcePosition.of(2, 0), SourcePositions.endOf("def x = 1\n"));
	}

	// ------------------------------------------------------------------
	// LSP conversion
	// ------------------------------------------------------------------

	@Test
	void testFromLspShiftsLine() {
		Assertions.assertEquals(SourcePosition.of(8, 2), SourcePositions.fromLsp(new Position(7, 2)));
	}

	@Test
	void testToLspShiftsLine() {
		Assertions.assertEquals(new Position(7, 2), SourcePositions.toLsp(SourcePosition.of(8, 2), SourcePosition.of(10, 0)));
	}

	@Test
	void testToLspMapsSentinelsToDocumentBounds() {
		SourcePosition end = SourcePosition.of(10, 4);
		Assertions.assertEquals(new Position(0, 0), SourcePositions.toLsp(SourcePosition.UNBOUNDED_START, end));
		Assertions.assertEquals(new Position(9, 4), SourcePositions.toLsp(SourcePosition.UNBOUNDED_END, end));
	}

	// ------------------------------------------------------------------
	// getOffset()
	// ------------------------------------------------------------------

	@Test
	void testGetOffsetFirstLine() {
		Assertions.assertEquals(3, SourcePositions.getOffset("hello", new Position(0, 3)));
	}

	@Test
	void testGetOffsetSecondLine() {
		// "hello\nworld": line 1, col 3 is offset 9
		Assertions.assertEquals(9, SourcePositions.getOffset("hello\nworld", new Position(1, 3)));
	}

	@Test
	void testGetOffsetClampsColumnToLineEnd() {
		Assertions.assertEquals(5, SourcePositions.getOffset("hello\nworld", new Position(0, 40)));
	}

	@Test
	void testGetOffsetClampsLineToTextEnd() {
		Assertions.assertEquals(5, SourcePositions.getOffset("hello", new Position(5, 0)));
	}
}
