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
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.luafmt.verify;

/**
 * Which differences between the original tree and the reparsed output are
 * accepted as cosmetic. Whitespace and comments are always ignored; each
 * flag relaxes one normalization the formatter performs.
 */
public final class EquivalencePolicy {

	private static final EquivalencePolicy DEFAULT = new EquivalencePolicy(true, true, true, true);
	private static final EquivalencePolicy STRICT = new EquivalencePolicy(false, false, false, false);

	private final boolean ignoreConditionParentheses;
	private final boolean normalizeStringQuotes;
	private final boolean ignoreCallParentheses;
	private final boolean ignoreSeparators;

	private EquivalencePolicy(boolean ignoreConditionParentheses, boolean normalizeStringQuotes,
			boolean ignoreCallParentheses, boolean ignoreSeparators) {
		this.ignoreConditionParentheses = ignoreConditionParentheses;
		this.normalizeStringQuotes = normalizeStringQuotes;
		this.ignoreCallParentheses = ignoreCallParentheses;
		this.ignoreSeparators = ignoreSeparators;
	}

	/** Accepts every normalization the formatter performs. */
	public static EquivalencePolicy defaults() {
		return DEFAULT;
	}

	/** Only trivia is ignored. */
	public static EquivalencePolicy strict() {
		return STRICT;
	}

	/**
	 * Parentheses directly wrapping the condition of {@code if},
	 * {@code elseif}, {@code while} or {@code until}.
	 */
	public boolean isIgnoreConditionParentheses() {
		return ignoreConditionParentheses;
	}

	/** Strings compare by content, whatever their quotes. */
	public boolean isNormalizeStringQuotes() {
		return normalizeStringQuotes;
	}

	/** {@code f "s"} matches {@code f("s")}, {@code f {}} matches {@code f({})}. */
	public boolean isIgnoreCallParentheses() {
		return ignoreCallParentheses;
	}

	/** Table field separators and statement semicolons. */
	public boolean isIgnoreSeparators() {
		return ignoreSeparators;
	}

	public EquivalencePolicy withIgnoreConditionParentheses(boolean value) {
		return new EquivalencePolicy(value, normalizeStringQuotes, ignoreCallParentheses, ignoreSeparators);
	}

	public EquivalencePolicy withNormalizeStringQuotes(boolean value) {
		return new EquivalencePolicy(ignoreConditionParentheses, value, ignoreCallParentheses, ignoreSeparators);
	}

	public EquivalencePolicy withIgnoreCallParentheses(boolean value) {
		return new EquivalencePolicy(ignoreConditionParentheses, normalizeStringQuotes, value, ignoreSeparators);
	}

	public EquivalencePolicy withIgnoreSeparators(boolean value) {
		return new EquivalencePolicy(ignoreConditionParentheses, normalizeStringQuotes, ignoreCallParentheses, value);
	}

	@Override
	public String toString() {
		return "EquivalencePolicy{conditionParentheses=" + ignoreConditionParentheses
				+ ", stringQuotes=" + normalizeStringQuotes
				+ ", callParentheses=" + ignoreCallParentheses
				+ ", separators=" + ignoreSeparators + "}";
	}
}
