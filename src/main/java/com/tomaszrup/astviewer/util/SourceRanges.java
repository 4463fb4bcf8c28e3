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

import org.eclipse.lsp4j.Range;

import com.tomaszrup.astviewer.span.SourcePosition;
import com.tomaszrup.astviewer.span.SourceSpan;

/**
 * Turns resolved {@link SourceSpan}s into editor selections.
 */
public class SourceRanges {
	private SourceRanges() {
	}

	/**
	 * The LSP range covering {@code span}. Inverted spans are kept as they
	 * are, so the range's start may follow its end.
	 */
	public static Range toLspRange(SourceSpan span, SourcePosition endOfDocument) {
		return new Range(SourcePositions.toLsp(span.getStart(), endOfDocument),
				SourcePositions.toLsp(span.getEnd(), endOfDocument));
	}

	/**
	 * The text covered by {@code span}. For an inverted span this is the
	 * text between its end and its start.
	 */
	public static String getSubstring(String text, SourceSpan span, SourcePosition endOfDocument) {
		if (text == null || span == null) {
			return null;
		}
		Range range = toLspRange(span, endOfDocument);
		int from = SourcePositions.getOffset(text, range.getStart());
		int to = SourcePositions.getOffset(text, range.getEnd());
		return text.substring(Math.min(from, to), Math.max(from, to));
	}
}
