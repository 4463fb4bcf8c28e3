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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.codehaus.groovy.ast.ModuleNode;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.astviewer.groovy.GroovyParseTreeAdapter;
import com.tomaszrup.astviewer.groovy.GroovySourceParser;
import com.tomaszrup.astviewer.groovy.SourceParseException;
import com.tomaszrup.astviewer.span.SourcePosition;
import com.tomaszrup.astviewer.tree.DisplayNode;
import com.tomaszrup.astviewer.tree.ParseNode;
import com.tomaszrup.astviewer.tree.SpanResolver;
import com.tomaszrup.astviewer.tree.TreeBuilder;
import com.tomaszrup.astviewer.util.MdcDocumentContext;
import com.tomaszrup.astviewer.util.SourcePositions;
import com.tomaszrup.astviewer.util.SourceRanges;

/**
 * The syntax tree shown for one source document, and the entry point for a
 * viewer front end.
 *
 * <p>{@link #open} parses the text, builds the display tree and resolves
 * its spans. Each call replaces the previous tree entirely; if parsing
 * fails the previous tree and text stay current. Not thread-safe: a session
 * is owned by the UI thread that drives it.</p>
 */
public class SyntaxTreeSession {
    private static final Logger logger = LoggerFactory.getLogger(SyntaxTreeSession.class);

    private final GroovySourceParser parser;
    private final GroovyParseTreeAdapter adapter = new GroovyParseTreeAdapter();
    private final TreeBuilder treeBuilder = new TreeBuilder();
    private final SpanResolver spanResolver = new SpanResolver();
    private final String rootLabel;

    private String sourceName;
    private String sourceText;
    private SourcePosition endOfDocument;
    private DisplayNode root;

    public SyntaxTreeSession() {
        this(ViewerOptionsParser.defaults());
    }

    public SyntaxTreeSession(ViewerOptionsParser.ParsedOptions options) {
        this.parser = new GroovySourceParser(options.getCompilePhase());
        this.rootLabel = options.getRootLabel();
    }

    /**
     * Reads {@code file} as UTF-8 and opens it.
     *
     * @throws IOException if the file cannot be read; the current tree is kept
     */
    public DisplayNode open(Path file) throws IOException, SourceParseException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        Path fileName = file.getFileName();
        return open(fileName != null ? fileName.toString() : file.toString(), text);
    }

    /**
     * Parses {@code text} and makes its syntax tree current.
     *
     * @return the new, fully resolved root
     * @throws SourceParseException if the text does not compile; the previous
     *                              tree stays current
     */
    public DisplayNode open(String sourceName, String text) throws SourceParseException {
        MdcDocumentContext.setDocument(sourceName);
        try {
            long start = System.nanoTime();
            ModuleNode module;
            try {
                module = parser.parse(sourceName, text);
            } catch (SourceParseException e) {
                logger.warn("Unable to parse {} at {}: {}", sourceName, e.getPosition(), e.getMessage());
                throw e;
            }

            ParseNode parseTree = adapter.adapt(module);
            String label = rootLabel != null ? rootLabel : (sourceName != null ? sourceName : "");
            DisplayNode newRoot = treeBuilder.build(parseTree, label);
            SourcePosition newEnd = SourcePositions.endOf(text);
            spanResolver.resolve(newRoot, newEnd);

            this.sourceName = sourceName;
            this.sourceText = text != null ? text : "";
            this.endOfDocument = newEnd;
            this.root = newRoot;

            if (logger.isDebugEnabled()) {
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                logger.debug("Rebuilt syntax tree: {} nodes, end of document {}, {}ms",
                        countNodes(newRoot), newEnd, elapsedMs);
            }
            return newRoot;
        } finally {
            MdcDocumentContext.clear();
        }
    }

    /**
     * The deepest positioned node strictly containing {@code line:column}.
     *
     * @param line   1-based line
     * @param column 0-based column
     * @return the node, or {@code null} to clear the selection
     */
    public DisplayNode selectAt(int line, int column) {
        if (root == null || line < 1 || column < 0) {
            return null;
        }
        return spanResolver.findDeepest(root, SourcePosition.of(line, column));
    }

    /**
     * Same as {@link #selectAt(int, int)} for an editor's 0-based position.
     */
    public DisplayNode selectAt(Position position) {
        if (root == null || position == null || position.getLine() < 0 || position.getCharacter() < 0) {
            return null;
        }
        return spanResolver.findDeepest(root, SourcePositions.fromLsp(position));
    }

    /**
     * The editor range to highlight for {@code node}, or {@code null} if
     * there is no current tree or the node has no span.
     */
    public Range highlightRange(DisplayNode node) {
        if (root == null || node == null || node.getSpan() == null) {
            return null;
        }
        return SourceRanges.toLspRange(node.getSpan(), endOfDocument);
    }

    /**
     * The source text covered by {@code node}'s span.
     */
    public String highlightedText(DisplayNode node) {
        if (root == null || node == null || node.getSpan() == null) {
            return null;
        }
        return SourceRanges.getSubstring(sourceText, node.getSpan(), endOfDocument);
    }

    /** Current root, or {@code null} before the first successful open. */
    public DisplayNode getRoot() {
        return root;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getSourceText() {
        return sourceText;
    }

    public SourcePosition getEndOfDocument() {
        return endOfDocument;
    }

    private static int countNodes(DisplayNode node) {
        int count = 1;
        for (DisplayNode child : node.getChildren()) {
            count += countNodes(child);
        }
        return count;
    }
}
