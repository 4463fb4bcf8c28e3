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
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.astviewer.span.SourcePosition;
import com.tomaszrup.astviewer.span.SourceSpan;

class SourceRangesTests {

	private static final String TEXT = "d = {'one': 1}\n\ndef f():\n    pass\n";
	private static final SourcePosition END = SourcePositions.endOf(TEXT);

	@Test
	void testToLspRange() {
		SourceSpan span = new SourceSpan(SourcePosition.of(3, 0), SourcePosition.of(4, 8));
		Range range = SourceRanges.toLspRange(span, END);
		Assertions.assertEquals(new Position(2, 0), range.getStart());
		Assertions.assertEquals(new Position(3, 8), range.getEnd());
	}

	@Test
	void testSubstringOfSpan() {
		SourceSpan span = new SourceSpan(SourcePosition.of(3, 0), SourcePosition.of(4, 8));
		Assertions.assertEquals("def f():\n    pass", SourceRanges.getSubstring(TEXT, span, END));
	}

	@Test
	void testSubstringOfSingleLineSpan() {
		SourceSpan span = new SourceSpan(SourcePosition.of(1, 5), SourcePosition.of(1, 10));
		Assertions.assertEquals("'one'", SourceRanges.getSubstring(TEXT, span, END));
	}

	@Test
	void testSubstringOfInvertedSpanCoversSameText() {
		SourceSpan span = new SourceSpan(SourcePosition.of(1, 10), SourcePosition.of(1, 5));
		Assertions.assertEquals("'one'", SourceRanges.getSubstring(TEXT, span, END));
	}

	@Test
	void testSubstringOfUnboundedSpanIsWholeText() {
		SourceSpan span = new SourceSpan(SourcePosition.UNBOUNDED_START, SourcePosition.UNBOUNDED_END);
		Assertions.assertEquals(TEXT, SourceRanges.getSubstring(TEXT, span, END));
	}

	@Test
	void testSubstringOfNullTextIsNull() {
		SourceSpan span = new SourceSpan(SourcePosition.of(1, 0), SourcePosition.of(1, 1));
		Assertions.assertNull(SourceRanges.getSubstring(null, span, END));
	}
}
