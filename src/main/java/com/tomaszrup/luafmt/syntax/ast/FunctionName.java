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
 * {@code a.b.c} or {@code a.b:c}. The colon and method name are either both
 * present or both null.
 */
public final class FunctionName implements SyntaxNode {

	private final Punctuated<Token> names;
	private final Token colon;
	private final Token methodName;

	public FunctionName(Punctuated<Token> names, Token colon, Token methodName) {
		this.names = names;
		this.colon = colon;
		this.methodName = methodName;
	}

	public Punctuated<Token> getNames() {
		return names;
	}

	public Token getColon() {
		return colon;
	}

	public Token getMethodName() {
		return methodName;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, names, colon, methodName);
		visitor.exitNode(this);
	}

	@Override
	public FunctionName mapTokens(UnaryOperator<Token> mapper) {
		Punctuated<Token> newNames = names.mapTokens(mapper, Token::mapTokens);
		Token newColon = Nodes.map(colon, mapper);
		Token newMethod = Nodes.map(methodName, mapper);
		return new FunctionName(newNames, newColon, newMethod);
	}
}
