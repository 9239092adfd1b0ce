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

public final class LocalFunctionStmt extends Stmt {

	private final Token localToken;
	private final Token functionToken;
	private final Token name;
	private final FunctionBody body;

	public LocalFunctionStmt(Token localToken, Token functionToken, Token name, FunctionBody body) {
		this.localToken = localToken;
		this.functionToken = functionToken;
		this.name = name;
		this.body = body;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.LOCAL_FUNCTION;
	}

	public Token getLocalToken() {
		return localToken;
	}

	public Token getFunctionToken() {
		return functionToken;
	}

	public Token getName() {
		return name;
	}

	public FunctionBody getBody() {
		return body;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, localToken, functionToken, name, body);
		visitor.exitNode(this);
	}

	@Override
	public LocalFunctionStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newLocal = Nodes.map(localToken, mapper);
		Token newFunction = Nodes.map(functionToken, mapper);
		Token newName = Nodes.map(name, mapper);
		FunctionBody newBody = Nodes.map(body, mapper, FunctionBody::mapTokens);
		return new LocalFunctionStmt(newLocal, newFunction, newName, newBody);
	}
}
