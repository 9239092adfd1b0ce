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

public final class RepeatStmt extends Stmt {

	private final Token repeatToken;
	private final Block block;
	private final Token untilToken;
	private final Expression condition;

	public RepeatStmt(Token repeatToken, Block block, Token untilToken, Expression condition) {
		this.repeatToken = repeatToken;
		this.block = block;
		this.untilToken = untilToken;
		this.condition = condition;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.REPEAT;
	}

	public Token getRepeatToken() {
		return repeatToken;
	}

	public Block getBlock() {
		return block;
	}

	public Token getUntilToken() {
		return untilToken;
	}

	public Expression getCondition() {
		return condition;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, repeatToken, block, untilToken, condition);
		visitor.exitNode(this);
	}

	@Override
	public RepeatStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newRepeat = Nodes.map(repeatToken, mapper);
		Block newBlock = Nodes.map(block, mapper, Block::mapTokens);
		Token newUntil = Nodes.map(untilToken, mapper);
		Expression newCondition = Nodes.map(condition, mapper, Expression::mapTokens);
		return new RepeatStmt(newRepeat, newBlock, newUntil, newCondition);
	}
}
