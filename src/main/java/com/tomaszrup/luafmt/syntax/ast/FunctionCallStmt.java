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
 * A call used as a statement. The wrapped expression always ends in a call suffix.
 */
public final class FunctionCallStmt extends Stmt {

	private final SuffixedExpression call;

	public FunctionCallStmt(SuffixedExpression call) {
		this.call = call;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.FUNCTION_CALL;
	}

	public SuffixedExpression getCall() {
		return call;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, call);
		visitor.exitNode(this);
	}

	@Override
	public FunctionCallStmt mapTokens(UnaryOperator<Token> mapper) {
		return new FunctionCallStmt(Nodes.map(call, mapper, SuffixedExpression::mapTokens));
	}
}
