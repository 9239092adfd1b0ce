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
package com.tomaszrup.luafmt.syntax.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

/**
 * An ordered sequence of values, each optionally followed by a separator
 * token such as {@code ,} or {@code ;}.
 */
public final class Punctuated<T extends SyntaxNode> implements SyntaxNode {

	public static final class Pair<T extends SyntaxNode> {
		private final T value;
		private final Token separator;

		public Pair(T value, Token separator) {
			this.value = value;
			this.separator = separator;
		}

		public T getValue() {
			return value;
		}

		/** The separator after the value, or {@code null}. */
		public Token getSeparator() {
			return separator;
		}

		public Pair<T> withValue(T newValue) {
			return new Pair<>(newValue, separator);
		}

		public Pair<T> withSeparator(Token newSeparator) {
			return new Pair<>(value, newSeparator);
		}
	}

	private final List<Pair<T>> pairs;

	public Punctuated(List<Pair<T>> pairs) {
		this.pairs = Collections.unmodifiableList(new ArrayList<>(pairs));
	}

	public static <T extends SyntaxNode> Punctuated<T> empty() {
		return new Punctuated<>(Collections.emptyList());
	}

	public List<Pair<T>> getPairs() {
		return pairs;
	}

	public int size() {
		return pairs.size();
	}

	public boolean isEmpty() {
		return pairs.isEmpty();
	}

	public T get(int index) {
		return pairs.get(index).getValue();
	}

	public List<T> values() {
		List<T> values = new ArrayList<>(pairs.size());
		for (Pair<T> pair : pairs) {
			values.add(pair.getValue());
		}
		return values;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		for (Pair<T> pair : pairs) {
			Nodes.visit(visitor, pair.getValue(), pair.getSeparator());
		}
		visitor.exitNode(this);
	}

	/**
	 * Rebuilds the sequence with its values lifted to {@link SyntaxNode}. Owners
	 * that need to keep the value type use
	 * {@link #mapTokens(UnaryOperator, BiFunction)}.
	 */
	@Override
	public Punctuated<SyntaxNode> mapTokens(UnaryOperator<Token> mapper) {
		List<Pair<SyntaxNode>> mapped = new ArrayList<>(pairs.size());
		for (Pair<T> pair : pairs) {
			SyntaxNode value = Nodes.map(pair.getValue(), mapper, SyntaxNode::mapTokens);
			mapped.add(new Pair<>(value, Nodes.map(pair.getSeparator(), mapper)));
		}
		return new Punctuated<>(mapped);
	}

	/**
	 * Rebuilds the sequence, mapping each value with {@code valueMapper} and
	 * each separator with {@code mapper}.
	 */
	public Punctuated<T> mapTokens(UnaryOperator<Token> mapper,
			BiFunction<T, UnaryOperator<Token>, T> valueMapper) {
		List<Pair<T>> mapped = new ArrayList<>(pairs.size());
		for (Pair<T> pair : pairs) {
			T value = Nodes.map(pair.getValue(), mapper, valueMapper);
			Token separator = Nodes.map(pair.getSeparator(), mapper);
			mapped.add(new Pair<>(value, separator));
		}
		return new Punctuated<>(mapped);
	}
}
