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

import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

/**
 * Everything after the function name: {@code <T>(params): R block end}.
 * Generics and return type are null when absent.
 */
public final class FunctionBody implements SyntaxNode {

	private final GenericDeclaration generics;
	private final Token openParen;
	private final Punctuated<Parameter> parameters;
	private final Token closeParen;
	private final TypeSpecifier returnType;
	private final Block block;
	private final Token endToken;

	public FunctionBody(GenericDeclaration generics, Token openParen, Punctuated<Parameter> parameters,
			Token closeParen, TypeSpecifier returnType, Block block, Token endToken) {
		this.generics = generics;
		this.openParen = openParen;
		this.parameters = parameters;
		this.closeParen = closeParen;
		this.returnType = returnType;
		this.block = block;
		this.endToken = endToken;
	}

	public GenericDeclaration getGenerics() {
		return generics;
	}

	public Token getOpenParen() {
		return openParen;
	}

	public Punctuated<Parameter> getParameters() {
		return parameters;
	}

	public Token getCloseParen() {
		return closeParen;
	}

	public TypeSpecifier getReturnType() {
		return returnType;
	}

	public Block getBlock() {
		return block;
	}

	public Token getEndToken() {
		return endToken;
	}

	public FunctionBody withBlock(Block newBlock) {
		return new FunctionBody(generics, openParen, parameters, closeParen, returnType, newBlock, endToken);
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, generics, openParen, parameters, closeParen, returnType, block, endToken);
		visitor.exitNode(this);
	}

	@Override
	public FunctionBody mapTokens(UnaryOperator<Token> mapper) {
		GenericDeclaration newGenerics = Nodes.map(generics, mapper, GenericDeclaration::mapTokens);
		Token newOpen = Nodes.map(openParen, mapper);
		Punctuated<Parameter> newParameters = parameters.mapTokens(mapper, Parameter::mapTokens);
		Token newClose = Nodes.map(closeParen, mapper);
		TypeSpecifier newReturnType = Nodes.map(returnType, mapper, TypeSpecifier::mapTokens);
		Block newBlock = Nodes.map(block, mapper, Block::mapTokens);
		Token newEnd = Nodes.map(endToken, mapper);
		return new FunctionBody(newGenerics, newOpen, newParameters, newClose, newReturnType, newBlock, newEnd);
	}
}
