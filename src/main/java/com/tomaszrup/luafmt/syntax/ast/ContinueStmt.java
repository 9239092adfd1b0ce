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

public final class ContinueStmt extends Stmt {

	private final Token continueToken;

	public ContinueStmt(Token continueToken) {
		this.continueToken = continueToken;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.CONTINUE;
	}

	public Token getContinueToken() {
		return continueToken;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, continueToken);
		visitor.exitNode(this);
	}

	@Override
	public ContinueStmt mapTokens(UnaryOperator<Token> mapper) {
		return new ContinueStmt(Nodes.map(continueToken, mapper));
	}
}
