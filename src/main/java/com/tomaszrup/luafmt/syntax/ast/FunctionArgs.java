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
 * Call arguments: a parenthesized list, a lone string literal
 * ({@code f "x"}) or a lone table constructor ({@code f { }}).
 */
public final class FunctionArgs implements SyntaxNode {

	public enum Kind {
		PARENTHESES,
		STRING,
		TABLE
	}

	private final Kind kind;
	private final Token openParen;
	private final Punctuated<Expression> arguments;
	private final Token closeParen;
	private final Token string;
	private final TableConstructor table;

	private FunctionArgs(Kind kind, Token openParen, Punctuated<Expression> arguments, Token closeParen,
			Token string, TableConstructor table) {
		this.kind = kind;
		this.openParen = openParen;
		this.arguments = arguments;
		this.closeParen = closeParen;
		this.string = string;
		this.table = table;
	}

	public static FunctionArgs parentheses(Token openParen, Punctuated<Expression> arguments, Token closeParen) {
		return new FunctionArgs(Kind.PARENTHESES, openParen, arguments, closeParen, null, null);
	}

	public static FunctionArgs string(Token string) {
		return new FunctionArgs(Kind.STRING, null, null, null, string, null);
	}

	public static FunctionArgs table(TableConstructor table) {
		return new FunctionArgs(Kind.TABLE, null, null, null, null, table);
	}

	public Kind getKind() {
		return kind;
	}

	public Token getOpenParen() {
		return openParen;
	}

	public Punctuated<Expression> getArguments() {
		return arguments;
	}

	public Token getCloseParen() {
		return closeParen;
	}

	public Token getString() {
		return string;
	}

	public TableConstructor getTable() {
		return table;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, openParen, arguments, closeParen, string, table);
		visitor.exitNode(this);
	}

	@Override
	public FunctionArgs mapTokens(UnaryOperator<Token> mapper) {
		Token newOpen = Nodes.map(openParen, mapper);
		Punctuated<Expression> newArguments = Nodes.map(arguments, mapper,
				(list, m) -> list.mapTokens(m, Expression::mapTokens));
		Token newClose = Nodes.map(closeParen, mapper);
		Token newString = Nodes.map(string, mapper);
		TableConstructor newTable = Nodes.map(table, mapper, TableConstructor::mapTokens);
		return new FunctionArgs(kind, newOpen, newArguments, newClose, newString, newTable);
	}
}
