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

import java.util.Set;

/**
 * Fields whose children precede their owner in the source text but follow
 * it in field order, such as Python's {@code decorator_list}. Their
 * positions may widen a span but never move the owner's start.
 */
public final class LeadingDecoratorFields {

	private static final Set<String> FIELD_LABELS = Set.of("decorator_list");

	private LeadingDecoratorFields() {
	}

	public static boolean isLeadingDecoratorField(String fieldLabel) {
		return FIELD_LABELS.contains(fieldLabel);
	}
}
