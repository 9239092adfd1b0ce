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

public final class GotoStmt extends Stmt {

	private final Token gotoToken;
	private final Token label;

	public GotoStmt(Token gotoToken, Token label) {
		this.gotoToken = gotoToken;
		this.label = label;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.GOTO;
	}

	public Token getGotoToken() {
		return gotoToken;
	}

	public Token getLabel() {
		return label;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, gotoToken, label);
		visitor.exitNode(this);
	}

	@Override
	public GotoStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newGoto = Nodes.map(gotoToken, mapper);
		Token newLabel = Nodes.map(label, mapper);
		return new GotoStmt(newGoto, newLabel);
	}
}
