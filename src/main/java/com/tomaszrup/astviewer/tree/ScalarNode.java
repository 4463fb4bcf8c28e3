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

/**
 * A leaf value: string, number, boolean, enum constant or {@code null}.
 */
public final class ScalarNode implements ParseNode {

	private static final ScalarNode NULL = new ScalarNode(null);

	private final Object value;

	private ScalarNode(Object value) {
		this.value = value;
	}

	public static ScalarNode of(Object value) {
		return value == null ? NULL : new ScalarNode(value);
	}

	public Object getValue() {
		return value;
	}

	@Override
	public String getTypeName() {
		return value == null ? "null" : value.getClass().getSimpleName();
	}

	/**
	 * Renders the value the way it would be written as a literal: strings
	 * are quoted and escaped, characters single-quoted, anything else uses
	 * {@link String#valueOf(Object)}.
	 */
	public String render() {
		if (value instanceof CharSequence) {
			return quote(value.toString(), '"');
		}
		if (value instanceof Character) {
			return quote(value.toString(), '\'');
		}
		return String.valueOf(value);
	}

	private static String quote(String text, char quote) {
		StringBuilder builder = new StringBuilder(text.length() + 2);
		builder.append(quote);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '\n':
					builder.append("\\n");
					break;
				case '\r':
					builder.append("\\r");
					break;
				case '\t':
					builder.append("\\t");
					break;
				case '\\':
					builder.append("\\\\");
					break;
				default:
					if (c == quote) {
						builder.append('\\');
					}
					builder.append(c);
			}
		}
		builder.append(quote);
		return builder.toString();
	}

	@Override
	public <R> R accept(ParseNodeVisitor<R> visitor) {
		return visitor.visitScalar(this);
	}

	@Override
	public String toString() {
		return render();
	}
}
