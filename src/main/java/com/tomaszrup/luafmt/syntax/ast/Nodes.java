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
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

/**
 * Traversal helpers shared by the node classes. Null children are skipped.
 */
final class Nodes {

	private Nodes() {
	}

	static void visit(SyntaxVisitor visitor, SyntaxNode... children) {
		for (SyntaxNode child : children) {
			if (child != null) {
				child.accept(visitor);
			}
		}
	}

	static void visitAll(SyntaxVisitor visitor, List<? extends SyntaxNode> children) {
		for (SyntaxNode child : children) {
			if (child != null) {
				child.accept(visitor);
			}
		}
	}

	static Token map(Token token, UnaryOperator<Token> mapper) {
		return token == null ? null : token.mapTokens(mapper);
	}

	/**
	 * Null-safe {@code rebuild.apply(node, mapper)}. {@code rebuild} is the
	 * node's own {@code mapTokens}, which keeps the static type.
	 */
	static <T extends SyntaxNode> T map(T node, UnaryOperator<Token> mapper,
			BiFunction<T, UnaryOperator<Token>, T> rebuild) {
		return node == null ? null : rebuild.apply(node, mapper);
	}

	static <T extends SyntaxNode> List<T> mapAll(List<T> nodes, UnaryOperator<Token> mapper,
			BiFunction<T, UnaryOperator<Token>, T> rebuild) {
		List<T> mapped = new ArrayList<>(nodes.size());
		for (T node : nodes) {
			mapped.add(map(node, mapper, rebuild));
		}
		return mapped;
	}
}
