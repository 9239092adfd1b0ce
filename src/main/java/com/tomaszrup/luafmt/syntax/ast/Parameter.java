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
 * A named parameter or {@code ...}, with an optional type specifier.
 */
public final class Parameter implements SyntaxNode {

	private final Token name;
	private final TypeSpecifier type;

	public Parameter(Token name, TypeSpecifier type) {
		this.name = name;
		this.type = type;
	}

	public Token getName() {
		return name;
	}

	public TypeSpecifier getType() {
		return type;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, name, type);
		visitor.exitNode(this);
	}

	@Override
	public Parameter mapTokens(UnaryOperator<Token> mapper) {
		Token newName = Nodes.map(name, mapper);
		TypeSpecifier newType = Nodes.map(type, mapper, TypeSpecifier::mapTokens);
		return new Parameter(newName, newType);
	}
}
