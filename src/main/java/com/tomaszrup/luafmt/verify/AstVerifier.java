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
package com.tomaszrup.luafmt.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.luafmt.formatter.StringLiterals;
import com.tomaszrup.luafmt.syntax.LuaDialect;
import com.tomaszrup.luafmt.syntax.LuaParser;
import com.tomaszrup.luafmt.syntax.ParseException;
import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.TokenType;
import com.tomaszrup.luafmt.syntax.ast.Ast;
import com.tomaszrup.luafmt.syntax.ast.Block;
import com.tomaszrup.luafmt.syntax.ast.ElseIf;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.FunctionArgs;
import com.tomaszrup.luafmt.syntax.ast.IfStmt;
import com.tomaszrup.luafmt.syntax.ast.ParenthesesExpression;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;
import com.tomaszrup.luafmt.syntax.ast.RepeatStmt;
import com.tomaszrup.luafmt.syntax.ast.TableConstructor;
import com.tomaszrup.luafmt.syntax.ast.TableField;
import com.tomaszrup.luafmt.syntax.ast.TokenExpression;
import com.tomaszrup.luafmt.syntax.ast.WhileStmt;

/**
 * Reparses formatted output and compares it structurally with the original
 * tree.
 *
 * <p>Both trees are flattened into a stream of events (node entered, token,
 * node exited) with all trivia left out. Nodes and tokens that the
 * {@link EquivalencePolicy} declares cosmetic are dropped from the stream
 * before comparing.</p>
 */
public final class AstVerifier {

	private static final Logger logger = LoggerFactory.getLogger(AstVerifier.class);

	private AstVerifier() {
	}

	public static VerificationResult verify(Ast original, String formattedText, LuaDialect dialect,
			EquivalencePolicy policy) {
		Ast reparsed;
		try {
			reparsed = LuaParser.parse(formattedText, dialect);
		} catch (ParseException e) {
			logger.error("Formatted output no longer parses: {}", e.getMessage());
			return VerificationResult.reparseFault(e.getMessage());
		}
		return compare(original, reparsed, policy);
	}

	/**
	 * Compares two trees under the given policy.
	 */
	public static VerificationResult compare(Ast original, Ast output, EquivalencePolicy policy) {
		List<String> expected = events(original, policy);
		List<String> actual = events(output, policy);
		int size = Math.min(expected.size(), actual.size());
		for (int i = 0; i < size; i++) {
			if (!expected.get(i).equals(actual.get(i))) {
				String details = "expected " + expected.get(i) + " but found " + actual.get(i) + " at element " + i;
				logger.warn("Formatted output differs from input: {}", details);
				return VerificationResult.semanticDifference(details);
			}
		}
		if (expected.size() != actual.size()) {
			String details = "expected " + expected.size() + " elements but found " + actual.size();
			logger.warn("Formatted output differs from input: {}", details);
			return VerificationResult.semanticDifference(details);
		}
		return VerificationResult.ok();
	}

	static List<String> events(Ast ast, EquivalencePolicy policy) {
		Set<Object> skipped = Collections.newSetFromMap(new IdentityHashMap<>());
		ast.accept(new CosmeticNodeFinder(policy, skipped));
		List<String> events = new ArrayList<>();
		ast.accept(new SyntaxVisitor() {
			@Override
			public void enterNode(SyntaxNode node) {
				if (!skipped.contains(node)) {
					events.add("enter " + node.getClass().getSimpleName());
				}
			}

			@Override
			public void exitNode(SyntaxNode node) {
				if (!skipped.contains(node)) {
					events.add("exit " + node.getClass().getSimpleName());
				}
			}

			@Override
			public void visitToken(Token token) {
				if (skipped.contains(token)) {
					return;
				}
				String text = token.getText();
				if (policy.isNormalizeStringQuotes() && token.getType() == TokenType.STRING) {
					text = StringLiterals.canonicalContent(text);
				}
				events.add(token.getType() + " " + text);
			}
		});
		return events;
	}

	/**
	 * Collects the nodes and tokens that the policy treats as cosmetic.
	 */
	private static final class CosmeticNodeFinder implements SyntaxVisitor {

		private final EquivalencePolicy policy;
		private final Set<Object> skipped;

		CosmeticNodeFinder(EquivalencePolicy policy, Set<Object> skipped) {
			this.policy = policy;
			this.skipped = skipped;
		}

		@Override
		public void enterNode(SyntaxNode node) {
			if (policy.isIgnoreConditionParentheses()) {
				if (node instanceof IfStmt) {
					skipConditionParentheses(((IfStmt) node).getCondition());
				} else if (node instanceof ElseIf) {
					skipConditionParentheses(((ElseIf) node).getCondition());
				} else if (node instanceof WhileStmt) {
					skipConditionParentheses(((WhileStmt) node).getCondition());
				} else if (node instanceof RepeatStmt) {
					skipConditionParentheses(((RepeatStmt) node).getCondition());
				}
			}
			if (policy.isIgnoreCallParentheses() && node instanceof FunctionArgs) {
				skipCallParentheses((FunctionArgs) node);
			}
			if (policy.isIgnoreSeparators()) {
				if (node instanceof TableConstructor) {
					for (Punctuated.Pair<TableField> pair : ((TableConstructor) node).getFields().getPairs()) {
						skip(pair.getSeparator());
					}
				} else if (node instanceof Block) {
					for (Block.Item item : ((Block) node).getItems()) {
						skip(item.getSemicolon());
					}
				}
			}
		}

		private void skipConditionParentheses(Expression condition) {
			Expression current = condition;
			while (current instanceof ParenthesesExpression) {
				ParenthesesExpression parentheses = (ParenthesesExpression) current;
				skip(parentheses);
				skip(parentheses.getOpen());
				skip(parentheses.getClose());
				current = parentheses.getInner();
			}
		}

		/**
		 * {@code f("s")} and {@code f({})} reduce to the events of
		 * {@code f "s"} and {@code f {}}.
		 */
		private void skipCallParentheses(FunctionArgs args) {
			if (args.getKind() != FunctionArgs.Kind.PARENTHESES || args.getArguments().size() != 1) {
				return;
			}
			Expression only = args.getArguments().get(0);
			boolean string = only instanceof TokenExpression
					&& ((TokenExpression) only).getToken().getType() == TokenType.STRING;
			if (!string && !(only instanceof TableConstructor)) {
				return;
			}
			skip(args.getOpenParen());
			skip(args.getArguments());
			skip(args.getCloseParen());
			if (string) {
				skip(only);
			}
		}

		private void skip(Object node) {
			if (node != null) {
				skipped.add(node);
			}
		}
	}
}
