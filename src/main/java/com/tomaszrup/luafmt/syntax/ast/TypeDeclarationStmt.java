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
 * {@code [export] type Name<T> = Type}
 */
public final class TypeDeclarationStmt extends Stmt {

	private final Token exportToken;
	private final Token typeToken;
	private final Token name;
	private final GenericDeclaration generics;
	private final Token equals;
	private final TypeInfo type;

	public TypeDeclarationStmt(Token exportToken, Token typeToken, Token name, GenericDeclaration generics,
			Token equals, TypeInfo type) {
		this.exportToken = exportToken;
		this.typeToken = typeToken;
		this.name = name;
		this.generics = generics;
		this.equals = equals;
		this.type = type;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.TYPE_DECLARATION;
	}

	/** The {@code export} keyword, or {@code null}. */
	public Token getExportToken() {
		return exportToken;
	}

	public Token getTypeToken() {
		return typeToken;
	}

	public Token getName() {
		return name;
	}

	public GenericDeclaration getGenerics() {
		return generics;
	}

	public Token getEquals() {
		return equals;
	}

	public TypeInfo getType() {
		return type;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, exportToken, typeToken, name, generics, equals, type);
		visitor.exitNode(this);
	}

	@Override
	public TypeDeclarationStmt mapTokens(UnaryOperator<Token> mapper) {
		Token newExport = Nodes.map(exportToken, mapper);
		Token newType = Nodes.map(typeToken, mapper);
		Token newName = Nodes.map(name, mapper);
		GenericDeclaration newGenerics = Nodes.map(generics, mapper, GenericDeclaration::mapTokens);
		Token newEquals = Nodes.map(equals, mapper);
		TypeInfo newTypeInfo = Nodes.map(type, mapper, TypeInfo::mapTokens);
		return new TypeDeclarationStmt(newExport, newType, newName, newGenerics, newEquals, newTypeInfo);
	}
}
