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

import java.util.Objects;

/**
 * An immutable {@code (start, end)} pair of {@link SourcePosition}s.
 *
 * <p>A span is normally ordered ({@code start <= end}). Spans computed for
 * nodes whose descendants appear out of textual order may be inverted; see
 * {@link #isInverted()}.</p>
 */
public final class SourceSpan {

	private final SourcePosition start;
	private final SourcePosition end;

	public SourceSpan(SourcePosition start, SourcePosition end) {
		this.start = Objects.requireNonNull(start, "start");
		this.end = Objects.requireNonNull(end, "end");
	}

	public SourcePosition getStart() {
		return start;
	}

	public SourcePosition getEnd() {
		return end;
	}

	public boolean isInverted() {
		return start.isAfter(end);
	}

	/**
	 * {@code start < position < end}. Positions on either boundary are not
	 * contained.
	 */
	public boolean strictlyContains(SourcePosition position) {
		return start.isBefore(position) && position.isBefore(end);
	}

	/**
	 * Whether {@code other} lies within this span, boundaries included.
	 */
	public boolean contains(SourceSpan other) {
		return !other.start.isBefore(start) && !other.end.isAfter(end);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SourceSpan)) return false;
		SourceSpan other = (SourceSpan) o;
		return start.equals(other.start) && end.equals(other.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end);
	}

	@Override
	public String toString() {
		return start + " : " + end;
	}
}
