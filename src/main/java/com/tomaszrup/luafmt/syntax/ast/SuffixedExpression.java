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
import java.util.function.UnaryOperator;

import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

/**
 * A name or parenthesized expression followed by index and call suffixes,
 * e.g. {@code a.b[c]:d(e)}.
 */
public final class SuffixedExpression extends Expression {

	private final Expression prefix;
	private final List<Suffix> suffixes;

	public SuffixedExpression(Expression prefix, List<Suffix> suffixes) {
		this.prefix = prefix;
		this.suffixes = Collections.unmodifiableList(new ArrayList<>(suffixes));
	}

	@Override
	public ExpressionKind getKind() {
		return ExpressionKind.SUFFIXED;
	}

	public Expression getPrefix() {
		return prefix;
	}

	public List<Suffix> getSuffixes() {
		return suffixes;
	}

	public boolean isCall() {
		return !suffixes.isEmpty() && suffixes.get(suffixes.size() - 1) instanceof CallSuffix;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, prefix);
		Nodes.visitAll(visitor, suffixes);
		visitor.exitNode(this);
	}

	@Override
	public SuffixedExpression mapTokens(UnaryOperator<Token> mapper) {
		Expression newPrefix = Nodes.map(prefix, mapper, Expression::mapTokens);
		List<Suffix> newSuffixes = Nodes.mapAll(suffixes, mapper, Suffix::mapTokens);
		return new SuffixedExpression(newPrefix, newSuffixes);
	}
}
