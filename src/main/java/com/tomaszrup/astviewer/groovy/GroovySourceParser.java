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

import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilationUnit;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.MultipleCompilationErrorsException;
import org.codehaus.groovy.control.Phases;
import org.codehaus.groovy.control.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses Groovy source text into a {@link ModuleNode} by running the
 * compiler up to a fixed phase. Nothing is written to disk and no classes
 * are generated.
 */
public class GroovySourceParser {
	private static final Logger logger = LoggerFactory.getLogger(GroovySourceParser.class);

	private static final String DEFAULT_SOURCE_NAME = "Script.groovy";

	private final int phase;

	public GroovySourceParser() {
		this(Phases.CONVERSION);
	}

	/**
	 * @param phase the last compile phase to run, one of {@link Phases}
	 *              between {@link Phases#CONVERSION} and
	 *              {@link Phases#CANONICALIZATION}
	 */
	public GroovySourceParser(int phase) {
		if (phase < Phases.CONVERSION || phase > Phases.CANONICALIZATION) {
			throw new IllegalArgumentException("Unsupported compile phase: " + phase);
		}
		this.phase = phase;
	}

	public int getPhase() {
		return phase;
	}

	/**
	 * @param sourceName file name used for messages and the script class name
	 * @param text       the Groovy source
	 * @return the module's AST
	 * @throws SourceParseException if the compiler reports errors
	 */
	public ModuleNode parse(String sourceName, String text) throws SourceParseException {
		String name = sourceName == null || sourceName.isBlank() ? DEFAULT_SOURCE_NAME : sourceName;
		CompilerConfiguration config = new CompilerConfiguration();
		CompilationUnit unit = new CompilationUnit(config);
		SourceUnit sourceUnit = unit.addSource(name, text != null ? text : "");
		try {
			unit.compile(phase);
		} catch (MultipleCompilationErrorsException e) {
			SourceParseException failure = SourceParseException.from(name, e);
			logger.debug("Compilation of {} failed at {}: {}", name, failure.getPosition(), failure.getMessage());
			throw failure;
		} catch (CompilationFailedException e) {
			throw new SourceParseException(name, e.getMessage(), null, e);
		}
		logger.debug("Parsed {} up to phase {}", name, Phases.getDescription(phase));
		return sourceUnit.getAST();
	}
}
