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
package com.tomaszrup.astviewer.groovy;

import java.util.List;

import org.codehaus.groovy.control.MultipleCompilationErrorsException;
import org.codehaus.groovy.control.messages.ExceptionMessage;
import org.codehaus.groovy.control.messages.Message;
import org.codehaus.groovy.control.messages.SyntaxErrorMessage;
import org.codehaus.groovy.syntax.SyntaxException;

import com.tomaszrup.astviewer.span.SourcePosition;

/**
 * Thrown when the Groovy compiler rejects a source text. Carries the
 * position of the first syntax error when the compiler reported one.
 */
public class SourceParseException extends Exception {

	private static final long serialVersionUID = 1L;

	private final String sourceName;
	private final transient SourcePosition position;

	public SourceParseException(String sourceName, String message, SourcePosition position, Throwable cause) {
		super(message, cause);
		this.sourceName = sourceName;
		this.position = position;
	}

	/**
	 * Builds an exception from the first error collected by the compiler.
	 */
	static SourceParseException from(String sourceName, MultipleCompilationErrorsException e) {
		List<? extends Message> errors = e.getErrorCollector().getErrors();
		if (errors != null) {
			for (Message message : errors) {
				if (message instanceof SyntaxErrorMessage) {
					SyntaxException cause = ((SyntaxErrorMessage) message).getCause();
					SourcePosition position = null;
					if (cause.getStartLine() > 0) {
						position = SourcePosition.of(cause.getStartLine(), Math.max(0, cause.getStartColumn() - 1));
					}
					return new SourceParseException(sourceName, cause.getOriginalMessage(), position, e);
				}
				if (message instanceof ExceptionMessage) {
					Exception cause = ((ExceptionMessage) message).getCause();
					return new SourceParseException(sourceName, String.valueOf(cause.getMessage()), null, e);
				}
			}
		}
		return new SourceParseException(sourceName, e.getMessage(), null, e);
	}

	public String getSourceName() {
		return sourceName;
	}

	/**
	 * Position of the first syntax error, or {@code null} if unknown.
	 */
	public SourcePosition getPosition() {
		return position;
	}
}
