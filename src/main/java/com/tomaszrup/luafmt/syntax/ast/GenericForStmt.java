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
 * {@code for k, v in expressions do ... end}
 */
public final class GenericForStmt extends Stmt {

	private final Token forToken;
	private final Punctuated<Token> names;
	private final List<TypeSpecifier> typeSpecifiers;
	private final Token inToken;
	private final Punctuated<Expression> expressions;
	private final Token doToken;
	private final Block block;
	private final Token endToken;

	public GenericForStmt(Token forToken, Punctuated<Token> names, List<TypeSpecifier> typeSpecifiers,
			Token inToken, Punctuated<Expression> expressions, Token doToken, Block block, Token endToken) {
		this.forToken = forToken;
		this.names = names;
		this.typeSpecifiers = Collections.unmodifiableList(new ArrayList<>(typeSpecifiers));
		this.inToken = inToken;
		this.expressions = expressions;
		this.doToken = doToken;
		this.block = block;
		this.endToken = endToken;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.GENERIC_FOR;
	}

	public Token getForToken() {
		return forToken;
	}

	public Punctuated<Token> getNames() {
		return names;
	}

	public List<TypeSpecifier> getTypeSpecifiers() {
		return typeSpecifiers;
	}

	public Token getInToken() {
		return inToken;
	}

	public Punctuated<Expression> getExpressions() {
		return expressions;
	}

	public Token getDoToken() {
		return doToken;
	}

	public Block getBlock() {
		return block;
	}

	public Token getEndToken() {
		return endToken;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, forToken);
		LocalAssignmentStmt.visitNames(visitor, names, typeSpecifiers);
		Nodes.visit(visitor, inToken, expressions, doToken, block, endToken);
		visitor.exitNode(this);
	}

	@Override
	public GenericForStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newFor = Nodes.map(forToken, mapper);
		List<TypeSpecifier> newTypes = new ArrayList<>();
		Punctuated<Token> newNames = LocalAssignmentStmt.mapNames(names, typeSpecifiers, newTypes, mapper);
		Token newIn = Nodes.map(inToken, mapper);
		Punctuated<Expression> newExpressions = expressions.mapTokens(mapper, Expression::mapTokens);
		Token newDo = Nodes.map(doToken, mapper);
		Block newBlock = Nodes.map(block, mapper, Block::mapTokens);
		Token newEnd = Nodes.map(endToken, mapper);
		return new GenericForStmt(newFor, newNames, newTypes, newIn, newExpressions, newDo, newBlock, newEnd);
	}
}
