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
 * One entry of a {@link TableConstructor}: {@code [key] = value},
 * {@code name = value} or a bare {@code value}. Fields not used by the kind
 * are null.
 */
public final class TableField implements SyntaxNode {

	public enum Kind {
		EXPRESSION_KEY,
		NAME_KEY,
		NO_KEY
	}

	private final Kind kind;
	private final Token openBracket;
	private final Expression key;
	private final Token closeBracket;
	private final Token name;
	private final Token equals;
	private final Expression value;

	private TableField(Kind kind, Token openBracket, Expression key, Token closeBracket, Token name, Token equals,
			Expression value) {
		this.kind = kind;
		this.openBracket = openBracket;
		this.key = key;
		this.closeBracket = closeBracket;
		this.name = name;
		this.equals = equals;
		this.value = value;
	}

	public static TableField expressionKey(Token openBracket, Expression key, Token closeBracket, Token equals,
			Expression value) {
		return new TableField(Kind.EXPRESSION_KEY, openBracket, key, closeBracket, null, equals, value);
	}

	public static TableField nameKey(Token name, Token equals, Expression value) {
		return new TableField(Kind.NAME_KEY, null, null, null, name, equals, value);
	}

	public static TableField noKey(Expression value) {
		return new TableField(Kind.NO_KEY, null, null, null, null, null, value);
	}

	public Kind getKind() {
		return kind;
	}

	public Token getOpenBracket() {
		return openBracket;
	}

	public Expression getKey() {
		return key;
	}

	public Token getCloseBracket() {
		return closeBracket;
	}

	public Token getName() {
		return name;
	}

	public Token getEquals() {
		return equals;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, openBracket, key, closeBracket, name, equals, value);
		visitor.exitNode(this);
	}

	@Override
	public TableField mapTokens(UnaryOperator<Token> mapper) {
		Token newOpen = Nodes.map(openBracket, mapper);
		Expression newKey = Nodes.map(key, mapper, Expression::mapTokens);
		Token newClose = Nodes.map(closeBracket, mapper);
		Token newName = Nodes.map(name, mapper);
		Token newEquals = Nodes.map(equals, mapper);
		Expression newValue = Nodes.map(value, mapper, Expression::mapTokens);
		return new TableField(kind, newOpen, newKey, newClose, newName, newEquals, newValue);
	}
}
