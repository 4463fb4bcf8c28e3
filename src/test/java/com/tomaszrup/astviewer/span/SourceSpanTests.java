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
package com.tomaszrup.astviewer.span;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SourceSpanTests {

	private static SourceSpan span(int startLine, int startColumn, int endLine, int endColumn) {
		return new SourceSpan(SourcePosition.of(startLine, startColumn), SourcePosition.of(endLine, endColumn));
	}

	@Test
	void testStrictContainmentExcludesBoundaries() {
		SourceSpan span = span(8, 0, 9, 4);
		Assertions.assertTrue(span.strictlyContains(SourcePosition.of(8, 1)));
		Assertions.assertTrue(span.strictlyContains(SourcePosition.of(9, 3)));
		Assertions.assertFalse(span.strictlyContains(SourcePosition.of(8, 0)));
		Assertions.assertFalse(span.strictlyContains(SourcePosition.of(9, 4)));
	}

	@Test
	void testUnboundedSpanContainsEverything() {
		SourceSpan span = new SourceSpan(SourcePosition.UNBOUNDED_START, SourcePosition.UNBOUNDED_END);
		Assertions.assertTrue(span.strictlyContains(SourcePosition.of(1, 0)));
		Assertions.assertTrue(span.contains(span(3, 0, 400, 2)));
	}

	@Test
	void testInvertedSpan() {
		Assertions.assertTrue(span(6, 18, 6, 12).isInverted());
		Assertions.assertFalse(span(6, 12, 6, 12).isInverted());
		Assertions.assertFalse(span(6, 12, 6, 18).strictlyContains(SourcePosition.of(6, 11)));
		Assertions.assertFalse(span(6, 18, 6, 12).strictlyContains(SourcePosition.of(6, 15)));
	}

	@Test
	void testContainsIncludesBoundaries() {
		SourceSpan outer = span(5, 0, 8, 0);
		Assertions.assertTrue(outer.contains(outer));
		Assertions.assertTrue(outer.contains(span(5, 0, 6, 0)));
		Assertions.assertFalse(outer.contains(span(4, 9, 6, 0)));
		Assertions.assertFalse(outer.contains(span(7, 0, 8, 1)));
	}

	@Test
	void testEqualityAndToString() {
		Assertions.assertEquals(span(5, 0, 8, 0), span(5, 0, 8, 0));
		Assertions.assertNotEquals(span(5, 0, 8, 0), span(5, 0, 8, 1));
		Assertions.assertEquals("5:0 : 8:0", span(5, 0, 8, 0).toString());
	}

	@Test
	void testNullBoundsAreRejected() {
		Assertions.assertThrows(NullPointerException.class, () -> new SourceSpan(null, SourcePosition.of(1, 0)));
		Assertions.assertThrows(NullPointerException.class, () -> new SourceSpan(SourcePosition.of(1, 0), null));
	}
}
