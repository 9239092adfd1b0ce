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
 * A call, either plain {@code (args)} or a method call {@code :name(args)}.
 */
public final class CallSuffix extends Suffix {

	private final Token colon;
	private final Token methodName;
	private final FunctionArgs args;

	public CallSuffix(Token colon, Token methodName, FunctionArgs args) {
		this.colon = colon;
		this.methodName = methodName;
		this.args = args;
	}

	public boolean isMethodCall() {
		return colon != null;
	}

	public Token getColon() {
		return colon;
	}

	public Token getMethodName() {
		return methodName;
	}

	public FunctionArgs getArgs() {
		return args;
	}

	public CallSuffix withArgs(FunctionArgs newArgs) {
		return new CallSuffix(colon, methodName, newArgs);
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, colon, methodName, args);
		visitor.exitNode(this);
	}

	@Override
	public CallSuffix mapTokens(UnaryOperator<Token> mapper) {
		Token newColon = Nodes.map(colon, mapper);
		Token newMethod = Nodes.map(methodName, mapper);
		FunctionArgs newArgs = Nodes.map(args, mapper, FunctionArgs::mapTokens);
		return new CallSuffix(newColon, newMethod, newArgs);
	}
}
