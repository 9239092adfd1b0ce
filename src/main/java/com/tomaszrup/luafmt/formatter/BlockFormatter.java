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
package com.tomaszrup.luafmt.formatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.Tokens;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.ast.Block;
import com.tomaszrup.luafmt.syntax.ast.Stmt;

/**
 * Formats the statements of a block, one per line. A single blank line
 * between statements survives; semicolons are dropped unless the next
 * statement starts with a parenthesis, where removing it would merge the
 * two statements into a call.
 */
public final class BlockFormatter {

	private BlockFormatter() {
	}

	public static Block formatBlock(FormatContext ctx, Block block, Shape shape) {
		List<Block.Item> items = block.getItems();
		List<Block.Item> result = new ArrayList<>(items.size());
		for (int i = 0; i < items.size(); i++) {
			Block.Item item = items.get(i);
			Stmt stmt = item.getStmt();
			Token semicolon = item.getSemicolon();
			if (!ctx.shouldFormatNode(stmt)) {
				result.add(new Block.Item(RangeBlockFormatter.formatStmt(ctx, stmt, shape), semicolon));
				continue;
			}

			Stmt source = stmt;
			if (semicolon != null) {
				List<Trivia> comments = new ArrayList<>(TriviaUtil.comments(semicolon.getLeadingTrivia()));
				comments.addAll(TriviaUtil.comments(semicolon.getTrailingTrivia()));
				if (!comments.isEmpty()) {
					source = stmt.mapTokens(GeneralFormatter.onLastToken(stmt,
							token -> GeneralFormatter.appendTrailing(token, comments)));
				}
			}
			Stmt formatted = StatementFormatter.formatStmt(ctx, source, shape);
			if (i > 0 && TriviaUtil.hasBlankLineBefore(Tokens.first(stmt))) {
				formatted = formatted.mapTokens(GeneralFormatter.onFirstToken(formatted,
						token -> GeneralFormatter.prependLeading(token,
								Collections.singletonList(ctx.newlineTrivia()))));
			}

			Token newSemicolon = null;
			if (semicolon != null && i + 1 < items.size() && Tokens.first(items.get(i + 1).getStmt()).is("(")) {
				List<Trivia> trailing = Tokens.last(formatted).getTrailingTrivia();
				formatted = formatted.mapTokens(GeneralFormatter.onLastToken(formatted,
						token -> token.withTrailingTrivia(Collections.emptyList())));
				newSemicolon = semicolon.withTrivia(Collections.emptyList(), trailing);
			}
			result.add(new Block.Item(formatted, newSemicolon));
		}
		return new Block(result);
	}
}
