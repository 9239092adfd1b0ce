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

import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

/**
 * A type annotation kept as the flat sequence of its parts. Parts are
 * tokens, except for the argument of {@code typeof(...)}, which is an
 * {@link Expression}.
 */
public final class TypeInfo implements SyntaxNode {

	private final List<SyntaxNode> parts;

	public TypeInfo(List<SyntaxNode> parts) {
		this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
	}

	public List<SyntaxNode> getParts() {
		return parts;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visitAll(visitor, parts);
		visitor.exitNode(this);
	}

	@Override
	public TypeInfo mapTokens(UnaryOperator<Token> mapper) {
		return new TypeInfo(Nodes.mapAll(parts, mapper, SyntaxNode::mapTokens));
	}
}
