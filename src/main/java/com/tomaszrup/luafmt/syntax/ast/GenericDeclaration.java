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

import java.util.function.UnaryOperator;

import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

/**
 * {@code <T, U...>} on a function body or type declaration. The names,
 * packs and defaults between the angle brackets are kept as a flat
 * {@link TypeInfo}.
 */
public final class GenericDeclaration implements SyntaxNode {

	private final Token open;
	private final TypeInfo parameters;
	private final Token close;

	public GenericDeclaration(Token open, TypeInfo parameters, Token close) {
		this.open = open;
		this.parameters = parameters;
		this.close = close;
	}

	public Token getOpen() {
		return open;
	}

	public TypeInfo getParameters() {
		return parameters;
	}

	public Token getClose() {
		return close;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, open, parameters, close);
		visitor.exitNode(this);
	}

	@Override
	public GenericDeclaration mapTokens(UnaryOperator<Token> mapper) {
		Token newOpen = Nodes.map(open, mapper);
		TypeInfo newParameters = Nodes.map(parameters, mapper, TypeInfo::mapTokens);
		Token newClose = Nodes.map(close, mapper);
		return new GenericDeclaration(newOpen, newParameters, newClose);
	}
}
