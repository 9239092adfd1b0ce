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

/**
 * {@code for i = start, end[, step] do ... end}. The step comma and step
 * expression are either both present or both null.
 */
public final class NumericForStmt extends Stmt {

	private final Token forToken;
	private final Token index;
	private final TypeSpecifier indexType;
	private final Token equals;
	private final Expression start;
	private final Token endComma;
	private final Expression end;
	private final Token stepComma;
	private final Expression step;
	private final Token doToken;
	private final Block block;
	private final Token endToken;

	public NumericForStmt(Token forToken, Token index, TypeSpecifier indexType, Token equals, Expression start,
			Token endComma, Expression end, Token stepComma, Expression step, Token doToken, Block block,
			Token endToken) {
		this.forToken = forToken;
		this.index = index;
		this.indexType = indexType;
		this.equals = equals;
		this.start = start;
		this.endComma = endComma;
		this.end = end;
		this.stepComma = stepComma;
		this.step = step;
		this.doToken = doToken;
		this.block = block;
		this.endToken = endToken;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.NUMERIC_FOR;
	}

	public Token getForToken() {
		return forToken;
	}

	public Token getIndex() {
		return index;
	}

	public TypeSpecifier getIndexType() {
		return indexType;
	}

	public Token getEquals() {
		return equals;
	}

	public Expression getStart() {
		return start;
	}

	public Token getEndComma() {
		return endComma;
	}

	public Expression getEnd() {
		return end;
	}

	public Token getStepComma() {
		return stepComma;
	}

	public Expression getStep() {
		return step;
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
		Nodes.visit(visitor, forToken, index, indexType, equals, start, endComma, end, stepComma, step, doToken,
				block, endToken);
		visitor.exitNode(this);
	}

	@Override
	public NumericForStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newFor = Nodes.map(forToken, mapper);
		Token newIndex = Nodes.map(index, mapper);
		TypeSpecifier newIndexType = Nodes.map(indexType, mapper, TypeSpecifier::mapTokens);
		Token newEquals = Nodes.map(equals, mapper);
		Expression newStart = Nodes.map(start, mapper, Expression::mapTokens);
		Token newEndComma = Nodes.map(endComma, mapper);
		Expression newEnd = Nodes.map(end, mapper, Expression::mapTokens);
		Token newStepComma = Nodes.map(stepComma, mapper);
		Expression newStep = Nodes.map(step, mapper, Expression::mapTokens);
		Token newDo = Nodes.map(doToken, mapper);
		Block newBlock = Nodes.map(block, mapper, Block::mapTokens);
		Token newEndToken = Nodes.map(endToken, mapper);
		return new NumericForStmt(newFor, newIndex, newIndexType, newEquals, newStart, newEndComma, newEnd,
				newStepComma, newStep, newDo, newBlock, newEndToken);
	}
}
