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
 * One {@code elseif <condition> then <block>} clause of an {@link IfStmt}.
 */
public final class ElseIf implements SyntaxNode {

	private final Token elseIfToken;
	private final Expression condition;
	private final Token thenToken;
	private final Block block;

	public ElseIf(Token elseIfToken, Expression condition, Token thenToken, Block block) {
		this.elseIfToken = elseIfToken;
		this.condition = condition;
		this.thenToken = thenToken;
		this.block = block;
	}

	public Token getElseIfToken() {
		return elseIfToken;
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

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, elseIfToken, condition, thenToken, block);
		visitor.exitNode(this);
	}

	@Override
	public ElseIf mapTokens(UnaryOperator<Token> mapper) {
		Token newElseIf = Nodes.map(elseIfToken, mapper);
		Expression newCondition = Nodes.map(condition, mapper, Expression::mapTokens);
		Token newThen = Nodes.map(thenToken, mapper);
		Block newBlock = Nodes.map(block, mapper, Block::mapTokens);
		return new ElseIf(newElseIf, newCondition, newThen, newBlock);
	}
}
