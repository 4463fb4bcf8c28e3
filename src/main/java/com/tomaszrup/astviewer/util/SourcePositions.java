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

import com.tomaszrup.astviewer.span.SourcePosition;

/**
 * Conversions between {@link SourcePosition} (1-based lines, 0-based
 * columns, unbounded sentinels) and LSP {@link Position}s (0-based lines and
 * characters) as used by editor front ends.
 */
public class SourcePositions {
	private SourcePositions() {
	}

	/**
	 * Position just after the last character of {@code text}: the number of
	 * lines and the length of the last line. Empty text gives {@code 1:0}.
	 */
	public static SourcePosition endOf(String text) {
		if (text == null || text.isEmpty()) {
			return SourcePosition.of(1, 0);
		}
		int lines = 1;
		int lastLineStart = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				lines++;
				lastLineStart = i + 1;
			}
		}
		return SourcePosition.of(lines, text.length() - lastLineStart);
	}

	public static SourcePosition fromLsp(Position position) {
		return SourcePosition.of(position.getLine() + 1, position.getCharacter());
	}

	/**
	 * Converts to an LSP position. The unbounded start maps to the start of
	 * the document and the unbounded end to {@code endOfDocument}.
	 */
	public static Position toLsp(SourcePosition position, SourcePosition endOfDocument) {
		if (position.isUnboundedStart()) {
			return new Position(0, 0);
		}
		if (position.isUnboundedEnd()) {
			return toLsp(endOfDocument, endOfDocument);
		}
		return new Position(position.getLine() - 1, position.getColumn());
	}

	/**
	 * Character offset of {@code position} in {@code text}. Lines past the
	 * end clamp to the text length and columns past the end of a line clamp
	 * to the line end.
	 */
	public static int getOffset(String text, Position position) {
		int lineStartOffset = findLineStartOffset(text, position.getLine());
		if (lineStartOffset < 0) {
			return text.length();
		}
		int lineEndOffset = findLineEndOffset(text, lineStartOffset);
		int character = Math.max(0, position.getCharacter());
		return Math.min(lineStartOffset + character, lineEndOffset);
	}

	private static int findLineStartOffset(String text, int line) {
		if (line <= 0) {
			return 0;
		}
		int currentLine = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				currentLine++;
				if (currentLine == line) {
					return i + 1;
				}
			}
		}
		return -1;
	}

	private static int findLineEndOffset(String text, int lineStartOffset) {
		for (int i = lineStartOffset; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\n' || c == '\r') {
				return i;
			}
		}
		return text.length();
	}
}
