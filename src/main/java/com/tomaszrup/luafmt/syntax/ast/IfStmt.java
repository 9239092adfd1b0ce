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
 * {@code if c then ... elseif c then ... else ... end}. The else token and
 * else block are either both present or both null.
 */
public final class IfStmt extends Stmt {

	private final Token ifToken;
	private final Expression condition;
	private final Token thenToken;
	private final Block block;
	private final List<ElseIf> elseIfs;
	private final Token elseToken;
	private final Block elseBlock;
	private final Token endToken;

	public IfStmt(Token ifToken, Expression condition, Token thenToken, Block block, List<ElseIf> elseIfs,
			Token elseToken, Block elseBlock, Token endToken) {
		this.ifToken = ifToken;
		this.condition = condition;
		this.thenToken = thenToken;
		this.block = block;
		this.elseIfs = Collections.unmodifiableList(new ArrayList<>(elseIfs));
		this.elseToken = elseToken;
		this.elseBlock = elseBlock;
		this.endToken = endToken;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.IF;
	}

	public Token getIfToken() {
		return ifToken;
	}

	public Expression getCondition() {
		return condition;
	}

	public Token getThenToken() {
		return thenToken;
	}

	public Block getBlock() {
		return block;
	}

	public List<ElseIf> getElseIfs() {
		return elseIfs;
	}

	public Token getElseToken() {
		return elseToken;
	}

	public Block getElseBlock() {
		return elseBlock;
	}

	public Token getEndToken() {
		return endToken;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, ifToken, condition, thenToken, block);
		Nodes.visitAll(visitor, elseIfs);
		Nodes.visit(visitor, elseToken, elseBlock, endToken);
		visitor.exitNode(this);
	}

	@Override
	public IfStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newIf = Nodes.map(ifToken, mapper);
		Expression newCondition = Nodes.map(condition, mapper, Expression::mapTokens);
		Token newThen = Nodes.map(thenToken, mapper);
		Block newBlock = Nodes.map(block, mapper, Block::mapTokens);
		List<ElseIf> newElseIfs = Nodes.mapAll(elseIfs, mapper, ElseIf::mapTokens);
		Token newElse = Nodes.map(elseToken, mapper);
		Block newElseBlock = Nodes.map(elseBlock, mapper, Block::mapTokens);
		Token newEnd = Nodes.map(endToken, mapper);
		return new IfStmt(newIf, newCondition, newThen, newBlock, newElseIfs, newElse, newElseBlock, newEnd);
	}
}
