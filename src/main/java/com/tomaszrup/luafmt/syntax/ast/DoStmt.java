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

public final class DoStmt extends Stmt {

	private final Token doToken;
	private final Block block;
	private final Token endToken;

	public DoStmt(Token doToken, Block block, Token endToken) {
		this.doToken = doToken;
		this.block = block;
		this.endToken = endToken;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.DO;
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
		Nodes.visit(visitor, doToken, block, endToken);
		visitor.exitNode(this);
	}

	@Override
	public DoStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newDo = Nodes.map(doToken, mapper);
		Block newBlock = Nodes.map(block, mapper, Block::mapTokens);
		Token newEnd = Nodes.map(endToken, mapper);
		return new DoStmt(newDo, newBlock, newEnd);
	}
}
