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
 * A whole parsed file: the top-level block and the end-of-file token that
 * holds any trailing comments.
 */
public final class Ast implements SyntaxNode {

	private final Block block;
	private final Token eof;

	public Ast(Block block, Token eof) {
		this.block = block;
		this.eof = eof;
	}

	public Block getBlock() {
		return block;
	}

	public Token getEof() {
		return eof;
	}

	public Ast withBlock(Block newBlock) {
		return new Ast(newBlock, eof);
	}

	public Ast withEof(Token newEof) {
		return new Ast(block, newEof);
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, block, eof);
		visitor.exitNode(this);
	}

	@Override
	public Ast mapTokens(UnaryOperator<Token> mapper) {
		Block newBlock = Nodes.map(block, mapper, Block::mapTokens);
		Token newEof = Nodes.map(eof, mapper);
		return new Ast(newBlock, newEof);
	}
}
