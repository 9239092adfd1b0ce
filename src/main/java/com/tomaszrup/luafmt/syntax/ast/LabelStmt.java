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
 * {@code ::name::}
 */
public final class LabelStmt extends Stmt {

	private final Token leftColons;
	private final Token name;
	private final Token rightColons;

	public LabelStmt(Token leftColons, Token name, Token rightColons) {
		this.leftColons = leftColons;
		this.name = name;
		this.rightColons = rightColons;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.LABEL;
	}

	public Token getLeftColons() {
		return leftColons;
	}

	public Token getName() {
		return name;
	}

	public Token getRightColons() {
		return rightColons;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, leftColons, name, rightColons);
		visitor.exitNode(this);
	}

	@Override
	public LabelStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newLeft = Nodes.map(leftColons, mapper);
		Token newName = Nodes.map(name, mapper);
		Token newRight = Nodes.map(rightColons, mapper);
		return new LabelStmt(newLeft, newName, newRight);
	}
}
