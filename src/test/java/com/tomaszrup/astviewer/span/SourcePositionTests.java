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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link SourcePosition}: ordering of finite positions and
 * the unbounded sentinels, validation and rendering.
 */
class SourcePositionTests {

	// ------------------------------------------------------------------
	// Ordering
	// ------------------------------------------------------------------

	@Test
	void testSamePositionComparesEqual() {
		Assertions.assertEquals(0, SourcePosition.of(5, 10).compareTo(SourcePosition.of(5, 10)));
		Assertions.assertEquals(SourcePosition.of(5, 10), SourcePosition.of(5, 10));
		Assertions.assertEquals(SourcePosition.of(5, 10).hashCode(), SourcePosition.of(5, 10).hashCode());
	}

	@Test
	void testLineTakesPrecedenceOverColumn() {
		SourcePosition earlier = SourcePosition.of(1, 40);
		SourcePosition later = SourcePosition.of(2, 0);
		Assertions.assertTrue(earlier.isBefore(later));
		Assertions.assertTrue(later.isAfter(earlier));
	}

	@Test
	void testSameLineComparesColumns() {
		Assertions.assertTrue(SourcePosition.of(3, 2).isBefore(SourcePosition.of(3, 10)));
		Assertions.assertTrue(SourcePosition.COMPARATOR.compare(SourcePosition.of(3, 10), SourcePosition.of(3, 2)) > 0);
	}

	@Test
	void testUnboundedStartSortsFirst() {
		Assertions.assertTrue(SourcePosition.UNBOUNDED_START.isBefore(SourcePosition.of(1, 0)));
		Assertions.assertTrue(SourcePosition.UNBOUNDED_START.isBefore(SourcePosition.UNBOUNDED_END));
		Assertions.assertEquals(0, SourcePosition.UNBOUNDED_START.compareTo(SourcePosition.UNBOUNDED_START));
	}

	@Test
	void testUnboundedEndSortsLast() {
		Assertions.assertTrue(SourcePosition.UNBOUNDED_END.isAfter(SourcePosition.of(Integer.MAX_VALUE, Integer.MAX_VALUE)));
		Assertions.assertEquals(0, SourcePosition.UNBOUNDED_END.compareTo(SourcePosition.UNBOUNDED_END));
	}

	@Test
	void testSortingMixedPositions() {
		List<SourcePosition> positions = new ArrayList<>(List.of(
				SourcePosition.UNBOUNDED_END,
				SourcePosition.of(2, 1),
				SourcePosition.UNBOUNDED_START,
				SourcePosition.of(1, 5),
				SourcePosition.of(2, 0)));
		Collections.sort(positions);
		Assertions.assertEquals(List.of(
				SourcePosition.UNBOUNDED_START,
				SourcePosition.of(1, 5),
				SourcePosition.of(2, 0),
				SourcePosition.of(2, 1),
				SourcePosition.UNBOUNDED_END), positions);
	}

	@Test
	void testMaxPrefersLaterPosition() {
		Assertions.assertEquals(SourcePosition.of(4, 0), SourcePosition.max(SourcePosition.of(3, 9), SourcePosition.of(4, 0)));
		Assertions.assertEquals(SourcePosition.UNBOUNDED_END, SourcePosition.max(SourcePosition.UNBOUNDED_END, SourcePosition.of(4, 0)));
	}

	// ------------------------------------------------------------------
	// Validation and accessors
	// ------------------------------------------------------------------

	@Test
	void testLineZeroIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> SourcePosition.of(0, 0));
	}

	@Test
	void testNegativeColumnIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> SourcePosition.of(1, -1));
	}

	@Test
	void testUnboundedPositionHasNoLine() {
		Assertions.assertFalse(SourcePosition.UNBOUNDED_START.isFinite());
		Assertions.assertThrows(IllegalStateException.class, SourcePosition.UNBOUNDED_START::getLine);
		Assertions.assertThrows(IllegalStateException.class, SourcePosition.UNBOUNDED_END::getColumn);
	}

	@Test
	void testToString() {
		Assertions.assertEquals("7:1", SourcePosition.of(7, 1).toString());
		Assertions.assertEquals("<bof>", SourcePosition.UNBOUNDED_START.toString());
		Assertions.assertEquals("<eof>", SourcePosition.UNBOUNDED_END.toString());
	}
}
