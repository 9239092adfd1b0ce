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

public final class FunctionDeclarationStmt extends Stmt {

	private final Token functionToken;
	private final FunctionName name;
	private final FunctionBody body;

	public FunctionDeclarationStmt(Token functionToken, FunctionName name, FunctionBody body) {
		this.functionToken = functionToken;
		this.name = name;
		this.body = body;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.FUNCTION_DECLARATION;
	}

	public Token getFunctionToken() {
		return functionToken;
	}

	public FunctionName getName() {
		return name;
	}

	public FunctionBody getBody() {
		return body;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, functionToken, name, body);
		visitor.exitNode(this);
	}

	@Override
	public FunctionDeclarationStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newFunction = Nodes.map(functionToken, mapper);
		FunctionName newName = Nodes.map(name, mapper, FunctionName::mapTokens);
		FunctionBody newBody = Nodes.map(body, mapper, FunctionBody::mapTokens);
		return new FunctionDeclarationStmt(newFunction, newName, newBody);
	}
}
