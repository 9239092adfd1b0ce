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
package com.tomaszrup.luafmt.syntax;

import java.util.function.UnaryOperator;

/**
 * Common contract of every concrete syntax tree element, tokens included.
 *
 * <p>{@link #accept(SyntaxVisitor)} and {@link #mapTokens(UnaryOperator)} both
 * walk tokens in source order. Implementations narrow the return type of
 * {@code mapTokens} to their own class.</p>
 */
public interface SyntaxNode {

	void accept(SyntaxVisitor visitor);

	/**
	 * Rebuilds this node with every token replaced by {@code mapper.apply(token)},
	 * visiting tokens in source order.
	 */
	SyntaxNode mapTokens(UnaryOperator<Token> mapper);
}
