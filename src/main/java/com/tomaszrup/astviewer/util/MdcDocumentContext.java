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

import org.slf4j.MDC;

/**
 * Manages the SLF4J MDC key {@code "document"} so that log lines written
 * while a source document is being rebuilt carry its name.
 *
 * <pre>{@code
 * MdcDocumentContext.setDocument(sourceName);
 * try {
 *     // ...
 * } finally {
 *     MdcDocumentContext.clear();
 * }
 * }</pre>
 */
public final class MdcDocumentContext {

    /** MDC key used in the logback pattern via {@code %X{document}}. */
    public static final String MDC_KEY = "document";

    private MdcDocumentContext() {
        // utility class
    }

    /**
     * Sets the MDC key to the file name of {@code sourceName} when it is
     * a path, or to the name itself. Blank names become
     * {@code "untitled"}.
     */
    public static void setDocument(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            MDC.put(MDC_KEY, "untitled");
            return;
        }
        int separator = Math.max(sourceName.lastIndexOf('/'), sourceName.lastIndexOf('\\'));
        String label = separator >= 0 && separator < sourceName.length() - 1
                ? sourceName.substring(separator + 1)
                : sourceName;
        MDC.put(MDC_KEY, label);
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }
}
