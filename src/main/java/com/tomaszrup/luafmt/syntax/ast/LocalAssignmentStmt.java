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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

/**
 * {@code local a: T, b = x, y}. Each name has a matching (possibly null)
 * type specifier; {@code equals} is null when there are no values.
 */
public final class LocalAssignmentStmt extends Stmt {

	private final Token local;
	private final Punctuated<Token> names;
	private final List<TypeSpecifier> typeSpecifiers;
	private final Token equals;
	private final Punctuated<Expression> values;

	public LocalAssignmentStmt(Token local, Punctuated<Token> names, List<TypeSpecifier> typeSpecifiers,
			Token equals, Punctuated<Expression> values) {
		this.local = local;
		this.names = names;
		this.typeSpecifiers = Collections.unmodifiableList(new ArrayList<>(typeSpecifiers));
		this.equals = equals;
		this.values = values;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.LOCAL_ASSIGNMENT;
	}

	public Token getLocal() {
		return local;
	}

	public Punctuated<Token> getNames() {
		return names;
	}

	public List<TypeSpecifier> getTypeSpecifiers() {
		return typeSpecifiers;
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
		Nodes.visit(visitor, local);
		visitNames(visitor, names, typeSpecifiers);
		Nodes.visit(visitor, equals, values);
		visitor.exitNode(this);
	}

	@Override
	public LocalAssignmentStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newLocal = Nodes.map(local, mapper);
		List<TypeSpecifier> newTypes = new ArrayList<>();
		Punctuated<Token> newNames = mapNames(names, typeSpecifiers, newTypes, mapper);
		Token newEquals = Nodes.map(equals, mapper);
		Punctuated<Expression> newValues = values.mapTokens(mapper, Expression::mapTokens);
		return new LocalAssignmentStmt(newLocal, newNames, newTypes, newEquals, newValues);
	}

	/**
	 * Visits a name list where each name may be followed by a type specifier
	 * before its separator.
	 */
	static void visitNames(SyntaxVisitor visitor, Punctuated<Token> names, List<TypeSpecifier> types) {
		visitor.enterNode(names);
		for (int i = 0; i < names.size(); i++) {
			Punctuated.Pair<Token> pair = names.getPairs().get(i);
			Nodes.visit(visitor, pair.getValue(), types.get(i), pair.getSeparator());
		}
		visitor.exitNode(names);
	}

	static Punctuated<Token> mapNames(Punctuated<Token> names, List<TypeSpecifier> types,
			List<TypeSpecifier> mappedTypes, UnaryOperator<Token> mapper) {
		List<Punctuated.Pair<Token>> pairs = new ArrayList<>();
		for (int i = 0; i < names.size(); i++) {
			Punctuated.Pair<Token> pair = names.getPairs().get(i);
			Token name = Nodes.map(pair.getValue(), mapper);
			mappedTypes.add(Nodes.map(types.get(i), mapper, TypeSpecifier::mapTokens));
			Token separator = Nodes.map(pair.getSeparator(), mapper);
			pairs.add(new Punctuated.Pair<>(name, separator));
		}
		return new Punctuated<>(pairs);
	}
}
