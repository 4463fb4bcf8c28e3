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
package com.tomaszrup.astviewer;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.codehaus.groovy.control.Phases;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses viewer options from a JSON object, e.g.
 * <pre>{@code
 * { "logLevel": "debug", "rootLabel": "Main.groovy", "compilePhase": "semanticAnalysis" }
 * }</pre>
 * Missing or malformed entries fall back to their defaults.
 */
public class ViewerOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(ViewerOptionsParser.class);

    private static final String LOG_LEVEL_OPTION = "logLevel";
    private static final String ROOT_LABEL_OPTION = "rootLabel";
    private static final String COMPILE_PHASE_OPTION = "compilePhase";

    static final String PHASE_CONVERSION = "conversion";
    static final String PHASE_SEMANTIC_ANALYSIS = "semanticAnalysis";

    private ViewerOptionsParser() {
    }

    /** Immutable container for parsed options. */
    public static final class ParsedOptions {
        private final String rootLabel;
        private final int compilePhase;

        ParsedOptions(String rootLabel, int compilePhase) {
            this.rootLabel = rootLabel;
            this.compilePhase = compilePhase;
        }

        /**
         * Label for the root node, or {@code null} to use the source name.
         */
        public String getRootLabel() {
            return rootLabel;
        }

        /** One of the Groovy {@link Phases} constants. */
        public int getCompilePhase() {
            return compilePhase;
        }
    }

    public static ParsedOptions defaults() {
        return new ParsedOptions(null, Phases.CONVERSION);
    }

    /**
     * Parses options from JSON text. Text that is not valid JSON is logged
     * and yields the defaults.
     */
    public static ParsedOptions fromJson(String json) {
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            return parse(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            logger.warn("Ignoring malformed viewer options: {}", e.getMessage());
            return defaults();
        }
    }

    /**
     * Parses options and applies the log level option to Logback.
     *
     * @return parsed options; the defaults if {@code options} is not a
     *         {@link JsonObject}
     */
    public static ParsedOptions parse(Object options) {
        if (!(options instanceof JsonObject)) {
            return defaults();
        }
        JsonObject opts = (JsonObject) options;
        applyLogLevelOption(opts);

        String rootLabel = null;
        if (opts.has(ROOT_LABEL_OPTION) && isPrimitive(opts.get(ROOT_LABEL_OPTION))) {
            rootLabel = opts.get(ROOT_LABEL_OPTION).getAsString();
        }
        return new ParsedOptions(rootLabel, parseCompilePhaseOption(opts));
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && isPrimitive(opts.get(LOG_LEVEL_OPTION))) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Sets the Logback root logger level. Accepted values
     * (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE. Invalid values are
     * ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger rootLogger = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(rootLogger instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Root logger is not a Logback logger, cannot set level to {}", level);
            return;
        }
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) rootLogger;
        ch.qos.logback.classic.Level previous = root.getLevel();
        root.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }

    private static int parseCompilePhaseOption(JsonObject opts) {
        if (!opts.has(COMPILE_PHASE_OPTION) || !isPrimitive(opts.get(COMPILE_PHASE_OPTION))) {
            return Phases.CONVERSION;
        }
        String value = opts.get(COMPILE_PHASE_OPTION).getAsString();
        if (PHASE_CONVERSION.equalsIgnoreCase(value)) {
            return Phases.CONVERSION;
        }
        if (PHASE_SEMANTIC_ANALYSIS.equalsIgnoreCase(value)) {
            return Phases.SEMANTIC_ANALYSIS;
        }
        logger.warn("Unknown compile phase '{}', using '{}'", value, PHASE_CONVERSION);
        return Phases.CONVERSION;
    }

    private static boolean isPrimitive(JsonElement element) {
        return element != null && element.isJsonPrimitive();
    }
}
