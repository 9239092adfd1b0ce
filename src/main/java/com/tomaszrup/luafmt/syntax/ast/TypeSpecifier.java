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
 * {@code : Type}
 */
public final class TypeSpecifier implements SyntaxNode {

	private final Token colon;
	private final TypeInfo type;

	public TypeSpecifier(Token colon, TypeInfo type) {
		this.colon = colon;
		this.type = type;
	}

	public Token getColon() {
		return colon;
	}

	public TypeInfo getType() {
		return type;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, colon, type);
		visitor.exitNode(this);
	}

	@Override
	public TypeSpecifier mapTokens(UnaryOperator<Token> mapper) {
		Token newColon = Nodes.map(colon, mapper);
		TypeInfo newType = Nodes.map(type, mapper, TypeInfo::mapTokens);
		return new TypeSpecifier(newColon, newType);
	}
}
