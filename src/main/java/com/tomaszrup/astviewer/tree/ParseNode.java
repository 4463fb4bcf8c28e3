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
 * A value in a parse tree supplied by an external parser. Every value is
 * exactly one of {@link CompositeNode}, {@link SequenceNode} or
 * {@link ScalarNode}; consumers dispatch with {@link #accept}.
 */
public interface ParseNode {

	/**
	 * Name of the node's type, e.g. {@code MethodNode}, {@code List} or
	 * {@code Integer}.
	 */
	String getTypeName();

	<R> R accept(ParseNodeVisitor<R> visitor);
}
