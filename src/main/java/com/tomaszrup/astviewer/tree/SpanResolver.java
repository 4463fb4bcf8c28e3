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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.astviewer.span.SourcePosition;
import com.tomaszrup.astviewer.span.SourceSpan;

/**
 * Computes the source span of every {@link DisplayNode} and finds the
 * deepest node under a cursor.
 *
 * <p>{@link #resolve} runs two passes over a freshly built tree:</p>
 * <ol>
 * <li><b>Seeding</b>, bottom-up. Children are visited right to left while a
 * "last known position" is threaded through the walk, starting at the end of
 * the document. After its children, a node with its own position makes that
 * the last known position. The node's span runs from the last known
 * position to the largest position returned by any of its children (or the
 * position it was entered with). Children under a
 * {@linkplain LeadingDecoratorFields leading decorator field} widen the end
 * bound but do not move the last known position. Nodes without any
 * positioned node in their subtree are left unresolved.</li>
 * <li><b>Gap filling</b>, top-down. Unresolved nodes inherit the span of
 * their parent, including its out-of-order flag. An unresolved root spans
 * the whole document.</li>
 * </ol>
 *
 * <p>A node whose seeded start sorts after its end is flagged
 * {@linkplain DisplayNode#isOutOfOrder() out of order}, and so is every node
 * of a leading decorator subtree whose span does not lie within its parent's
 * span. Resolution carries on either way.</p>
 */
public class SpanResolver {
	private static final Logger logger = LoggerFactory.getLogger(SpanResolver.class);

	/** Result of seeding one subtree. */
	private static final class Seed {
		final SourcePosition lastKnown;
		final boolean positioned;

		Seed(SourcePosition lastKnown, boolean positioned) {
			this.lastKnown = lastKnown;
			this.positioned = positioned;
		}
	}

	/**
	 * Resolves the spans of every node under {@code root}, replacing any
	 * spans from an earlier call.
	 *
	 * @param root          root of a tree built by {@link TreeBuilder}
	 * @param endOfDocument position of the end of the source text
	 */
	public void resolve(DisplayNode root, SourcePosition endOfDocument) {
		Objects.requireNonNull(root, "root");
		Objects.requireNonNull(endOfDocument, "endOfDocument");

		clearSpans(root);
		seed(root, endOfDocument);
		if (root.getSpan() == null) {
			root.setSpan(new SourceSpan(SourcePosition.UNBOUNDED_START, endOfDocument), false);
		}
		fillGaps(root, root.getSpan(), root.isOutOfOrder());
	}

	/**
	 * Finds the deepest node that has its own position and whose span
	 * strictly contains {@code position}. Children are searched before their
	 * parent and the first match wins.
	 *
	 * @return the matching node, or {@code null} if there is none
	 */
	public DisplayNode findDeepest(DisplayNode root, SourcePosition position) {
		if (root == null || position == null) {
			return null;
		}
		for (DisplayNode child : root.getChildren()) {
			DisplayNode found = findDeepest(child, position);
			if (found != null) {
				return found;
			}
		}
		SourceSpan span = root.getSpan();
		if (span != null && root.hasOwnPosition() && span.strictlyContains(position)) {
			return root;
		}
		return null;
	}

	private void clearSpans(DisplayNode node) {
		node.clearSpan();
		for (DisplayNode child : node.getChildren()) {
			clearSpans(child);
		}
	}

	private Seed seed(DisplayNode node, SourcePosition lastKnown) {
		SourcePosition maxPosition = lastKnown;
		boolean positioned = false;
		List<DisplayNode> leading = new ArrayList<>();

		List<DisplayNode> children = node.getChildren();
		for (int i = children.size() - 1; i >= 0; i--) {
			DisplayNode child = children.get(i);
			Seed childSeed = seed(child, lastKnown);
			maxPosition = SourcePosition.max(maxPosition, childSeed.lastKnown);
			positioned |= childSeed.positioned;
			if (LeadingDecoratorFields.isLeadingDecoratorField(child.getFieldLabel())) {
				leading.add(child);
			} else {
				lastKnown = childSeed.lastKnown;
			}
		}

		if (node.hasOwnPosition()) {
			lastKnown = node.getOwnPosition();
			positioned = true;
		}

		if (positioned) {
			SourceSpan span = new SourceSpan(lastKnown, maxPosition);
			boolean inverted = span.isInverted();
			if (inverted) {
				logger.debug("Out-of-order span {} on {}", span, node.getFieldLabel());
			}
			node.setSpan(span, inverted);
			for (DisplayNode child : leading) {
				if (child.getSpan() != null && !span.contains(child.getSpan())) {
					logger.debug("Leading {} {} lies outside {}", child.getFieldLabel(), child.getSpan(), span);
					markOutOfOrder(child);
				}
			}
		}
		return new Seed(lastKnown, positioned);
	}

	/** Flags every seeded node under {@code node}; unseeded ones inherit the flag in pass 2. */
	private void markOutOfOrder(DisplayNode node) {
		if (node.getSpan() != null) {
			node.setSpan(node.getSpan(), true);
		}
		for (DisplayNode child : node.getChildren()) {
			markOutOfOrder(child);
		}
	}

	private void fillGaps(DisplayNode node, SourceSpan inherited, boolean inheritedOutOfOrder) {
		if (node.getSpan() == null) {
			node.setSpan(inherited, inheritedOutOfOrder);
		}
		for (DisplayNode child : node.getChildren()) {
			fillGaps(child, node.getSpan(), node.isOutOfOrder());
		}
	}
}
