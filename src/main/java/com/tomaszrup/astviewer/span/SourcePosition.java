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

import java.util.Comparator;
import java.util.Objects;

/**
 * A location in a source document: a finite {@code line:column} pair or one
 * of the two unbounded sentinels.
 *
 * <p>Lines are 1-based and columns are 0-based. {@link #UNBOUNDED_START}
 * sorts before every finite position and {@link #UNBOUNDED_END} after every
 * finite position; finite positions compare by line, then by column.</p>
 */
public final class SourcePosition implements Comparable<SourcePosition> {

	private enum Kind {
		UNBOUNDED_START, FINITE, UNBOUNDED_END
	}

	/** Conceptually minus infinity: "from the start of the document". */
	public static final SourcePosition UNBOUNDED_START = new SourcePosition(Kind.UNBOUNDED_START, 0, 0);

	/** Conceptually plus infinity: "to the end of the document". */
	public static final SourcePosition UNBOUNDED_END = new SourcePosition(Kind.UNBOUNDED_END, 0, 0);

	public static final Comparator<SourcePosition> COMPARATOR = (SourcePosition p1, SourcePosition p2) -> {
		if (p1.kind != p2.kind) {
			return p1.kind.compareTo(p2.kind);
		}
		if (p1.line != p2.line) {
			return Integer.compare(p1.line, p2.line);
		}
		return Integer.compare(p1.column, p2.column);
	};

	private final Kind kind;
	private final int line;
	private final int column;

	private SourcePosition(Kind kind, int line, int column) {
		this.kind = kind;
		this.line = line;
		this.column = column;
	}

	/**
	 * Creates a finite position.
	 *
	 * @param line   1-based line number
	 * @param column 0-based column offset
	 * @throws IllegalArgumentException if {@code line < 1} or {@code column < 0}
	 */
	public static SourcePosition of(int line, int column) {
		if (line < 1 || column < 0) {
			throw new IllegalArgumentException("Invalid source position " + line + ":" + column);
		}
		return new SourcePosition(Kind.FINITE, line, column);
	}

	public static SourcePosition max(SourcePosition p1, SourcePosition p2) {
		return COMPARATOR.compare(p1, p2) >= 0 ? p1 : p2;
	}

	public boolean isFinite() {
		return kind == Kind.FINITE;
	}

	public boolean isUnboundedStart() {
		return kind == Kind.UNBOUNDED_START;
	}

	public boolean isUnboundedEnd() {
		return kind == Kind.UNBOUNDED_END;
	}

	/**
	 * The 1-based line. Only meaningful for finite positions.
	 */
	public int getLine() {
		requireFinite();
		return line;
	}

	/**
	 * The 0-based column. Only meaningful for finite positions.
	 */
	public int getColumn() {
		requireFinite();
		return column;
	}

	public boolean isBefore(SourcePosition other) {
		return COMPARATOR.compare(this, other) < 0;
	}

	public boolean isAfter(SourcePosition other) {
		return COMPARATOR.compare(this, other) > 0;
	}

	@Override
	public int compareTo(SourcePosition other) {
		return COMPARATOR.compare(this, other);
	}

	private void requireFinite() {
		if (kind != Kind.FINITE) {
			throw new IllegalStateException("Unbounded position has no line or column: " + this);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SourcePosition)) return false;
		SourcePosition other = (SourcePosition) o;
		return kind == other.kind && line == other.line && column == other.column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, line, column);
	}

	@Override
	public String toString() {
		switch (kind) {
			case UNBOUNDED_START:
				return "<bof>";
			case UNBOUNDED_END:
				return "<eof>";
			default:
				return line + ":" + column;
		}
	}
}
