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

import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

public final class WhileStmt extends Stmt {

	private final Token whileToken;
	private final Expression condition;
	private final Token doToken;
	private final Block block;
	private final Token endToken;

	public WhileStmt(Token whileToken, Expression condition, Token doToken, Block block, Token endToken) {
		this.whileToken = whileToken;
		this.condition = condition;
		this.doToken = doToken;
		this.block = block;
		this.endToken = endToken;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.WHILE;
	}

	public Token getWhileToken() {
		return whileToken;
	}

	public Expression getCondition() {
		return condition;
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
		Nodes.visit(visitor, whileToken, condition, doToken, block, endToken);
		visitor.exitNode(this);
	}

	@Override
	public WhileStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newWhile = Nodes.map(whileToken, mapper);
		Expression newCondition = Nodes.map(condition, mapper, Expression::mapTokens);
		Token newDo = Nodes.map(doToken, mapper);
		Block newBlock = Nodes.map(block, mapper, Block::mapTokens);
		Token newEnd = Nodes.map(endToken, mapper);
		return new WhileStmt(newWhile, newCondition, newDo, newBlock, newEnd);
	}
}
