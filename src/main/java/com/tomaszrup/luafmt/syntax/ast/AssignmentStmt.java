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
 * {@code a, b.c = x, y}
 */
public final class AssignmentStmt extends Stmt {

	private final Punctuated<Expression> targets;
	private final Token equals;
	private final Punctuated<Expression> values;

	public AssignmentStmt(Punctuated<Expression> targets, Token equals, Punctuated<Expression> values) {
		this.targets = targets;
		this.equals = equals;
		this.values = values;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.ASSIGNMENT;
	}

	public Punctuated<Expression> getTargets() {
		return targets;
	}

	public Token getEquals() {
		return equals;
	}

	public Punctuated<Expression> getValues() {
		return values;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, targets, equals, values);
		visitor.exitNode(this);
	}

	@Override
	public AssignmentStmt mapTokens(UnaryOperator<Token> mapper) {
		Punctuated<Expression> newTargets = targets.mapTokens(mapper, Expression::mapTokens);
		Token newEquals = Nodes.map(equals, mapper);
		Punctuated<Expression> newValues = values.mapTokens(mapper, Expression::mapTokens);
		return new AssignmentStmt(newTargets, newEquals, newValues);
	}
}
