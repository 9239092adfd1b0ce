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
import java.util.List;

import com.tomaszrup.luafmt.syntax.ast.AssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.BinaryExpression;
import com.tomaszrup.luafmt.syntax.ast.Block;
import com.tomaszrup.luafmt.syntax.ast.CallSuffix;
import com.tomaszrup.luafmt.syntax.ast.CompoundAssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.DoStmt;
import com.tomaszrup.luafmt.syntax.ast.ElseIf;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.FunctionArgs;
import com.tomaszrup.luafmt.syntax.ast.FunctionBody;
import com.tomaszrup.luafmt.syntax.ast.FunctionCallStmt;
import com.tomaszrup.luafmt.syntax.ast.FunctionDeclarationStmt;
import com.tomaszrup.luafmt.syntax.ast.FunctionExpression;
import com.tomaszrup.luafmt.syntax.ast.GenericForStmt;
import com.tomaszrup.luafmt.syntax.ast.IfStmt;
import com.tomaszrup.luafmt.syntax.ast.IndexSuffix;
import com.tomaszrup.luafmt.syntax.ast.LocalAssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.LocalFunctionStmt;
import com.tomaszrup.luafmt.syntax.ast.NumericForStmt;
import com.tomaszrup.luafmt.syntax.ast.ParenthesesExpression;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;
import com.tomaszrup.luafmt.syntax.ast.RepeatStmt;
import com.tomaszrup.luafmt.syntax.ast.ReturnStmt;
import com.tomaszrup.luafmt.syntax.ast.Stmt;
import com.tomaszrup.luafmt.syntax.ast.Suffix;
import com.tomaszrup.luafmt.syntax.ast.SuffixedExpression;
import com.tomaszrup.luafmt.syntax.ast.TableConstructor;
import com.tomaszrup.luafmt.syntax.ast.TableField;
import com.tomaszrup.luafmt.syntax.ast.TypeAssertionExpression;
import com.tomaszrup.luafmt.syntax.ast.UnaryExpression;
import com.tomaszrup.luafmt.syntax.ast.WhileStmt;

/**
 * The pass applied to statements outside the formatting range. Their own
 * tokens keep the original trivia; only the blocks nested inside them, in
 * statement or expression position, are visited again so that statements
 * inside the range still get formatted.
 */
final class RangeBlockFormatter {

	private RangeBlockFormatter() {
	}

	static Stmt formatStmt(FormatContext ctx, Stmt stmt, Shape shape) {
		Shape blockShape = shape.incrementBlockIndent();
		switch (stmt.getKind()) {
			case ASSIGNMENT: {
				AssignmentStmt assignment = (AssignmentStmt) stmt;
				return new AssignmentStmt(formatList(ctx, assignment.getTargets(), shape), assignment.getEquals(),
						formatList(ctx, assignment.getValues(), shape));
			}
			case LOCAL_ASSIGNMENT: {
				LocalAssignmentStmt local = (LocalAssignmentStmt) stmt;
				return new LocalAssignmentStmt(local.getLocal(), local.getNames(), local.getTypeSpecifiers(),
						local.getEquals(), formatList(ctx, local.getValues(), shape));
			}
			case FUNCTION_CALL:
				return new FunctionCallStmt(
						(SuffixedExpression) formatExpression(ctx, ((FunctionCallStmt) stmt).getCall(), shape));
			case DO: {
				DoStmt doStmt = (DoStmt) stmt;
				return new DoStmt(doStmt.getDoToken(), BlockFormatter.formatBlock(ctx, doStmt.getBlock(), blockShape),
						doStmt.getEndToken());
			}
			case WHILE: {
				WhileStmt whileStmt = (WhileStmt) stmt;
				return new WhileStmt(whileStmt.getWhileToken(), formatExpression(ctx, whileStmt.getCondition(), shape),
						whileStmt.getDoToken(), BlockFormatter.formatBlock(ctx, whileStmt.getBlock(), blockShape),
						whileStmt.getEndToken());
			}
			case REPEAT: {
				RepeatStmt repeat = (RepeatStmt) stmt;
				return new RepeatStmt(repeat.getRepeatToken(),
						BlockFormatter.formatBlock(ctx, repeat.getBlock(), blockShape), repeat.getUntilToken(),
						formatExpression(ctx, repeat.getCondition(), shape));
			}
			case IF:
				return formatIf(ctx, (IfStmt) stmt, shape);
			case NUMERIC_FOR: {
				NumericForStmt forStmt = (NumericForStmt) stmt;
				Expression step = forStmt.getStep() != null ? formatExpression(ctx, forStmt.getStep(), shape) : null;
				return new NumericForStmt(forStmt.getForToken(), forStmt.getIndex(), forStmt.getIndexType(),
						forStmt.getEquals(), formatExpression(ctx, forStmt.getStart(), shape), forStmt.getEndComma(),
						formatExpression(ctx, forStmt.getEnd(), shape), forStmt.getStepComma(), step,
						forStmt.getDoToken(), BlockFormatter.formatBlock(ctx, forStmt.getBlock(), blockShape),
						forStmt.getEndToken());
			}
			case GENERIC_FOR: {
				GenericForStmt forStmt = (GenericForStmt) stmt;
				return new GenericForStmt(forStmt.getForToken(), forStmt.getNames(), forStmt.getTypeSpecifiers(),
						forStmt.getInToken(), formatList(ctx, forStmt.getExpressions(), shape), forStmt.getDoToken(),
						BlockFormatter.formatBlock(ctx, forStmt.getBlock(), blockShape), forStmt.getEndToken());
			}
			case FUNCTION_DECLARATION: {
				FunctionDeclarationStmt declaration = (FunctionDeclarationStmt) stmt;
				return new FunctionDeclarationStmt(declaration.getFunctionToken(), declaration.getName(),
						formatBody(ctx, declaration.getBody(), shape));
			}
			case LOCAL_FUNCTION: {
				LocalFunctionStmt function = (LocalFunctionStmt) stmt;
				return new LocalFunctionStmt(function.getLocalToken(), function.getFunctionToken(), function.getName(),
						formatBody(ctx, function.getBody(), shape));
			}
			case RETURN: {
				ReturnStmt returnStmt = (ReturnStmt) stmt;
				return new ReturnStmt(returnStmt.getReturnToken(), formatList(ctx, returnStmt.getValues(), shape));
			}
			case COMPOUND_ASSIGNMENT: {
				CompoundAssignmentStmt compound = (CompoundAssignmentStmt) stmt;
				return new CompoundAssignmentStmt(formatExpression(ctx, compound.getTarget(), shape),
						compound.getOperator(), formatExpression(ctx, compound.getValue(), shape));
			}
			case BREAK:
			case GOTO:
			case LABEL:
			case CONTINUE:
			case TYPE_DECLARATION:
				return stmt;
			default:
				throw new IllegalStateException("unknown node " + stmt.getKind());
		}
	}

	private static IfStmt formatIf(FormatContext ctx, IfStmt ifStmt, Shape shape) {
		Shape blockShape = shape.incrementBlockIndent();
		List<ElseIf> elseIfs = new ArrayList<>();
		for (ElseIf elseIf : ifStmt.getElseIfs()) {
			elseIfs.add(new ElseIf(elseIf.getElseIfToken(), formatExpression(ctx, elseIf.getCondition(), shape),
					elseIf.getThenToken(), BlockFormatter.formatBlock(ctx, elseIf.getBlock(), blockShape)));
		}
		Block elseBlock = ifStmt.getElseBlock() != null
				? BlockFormatter.formatBlock(ctx, ifStmt.getElseBlock(), blockShape)
				: null;
		return new IfStmt(ifStmt.getIfToken(), formatExpression(ctx, ifStmt.getCondition(), shape),
				ifStmt.getThenToken(), BlockFormatter.formatBlock(ctx, ifStmt.getBlock(), blockShape), elseIfs,
				ifStmt.getElseToken(), elseBlock, ifStmt.getEndToken());
	}

	private static FunctionBody formatBody(FormatContext ctx, FunctionBody body, Shape shape) {
		return body.withBlock(BlockFormatter.formatBlock(ctx, body.getBlock(), shape.nestedBlock()));
	}

	// ------------------------------------------------------------------
	// Expressions
	// ------------------------------------------------------------------

	private static Punctuated<Expression> formatList(FormatContext ctx, Punctuated<Expression> list, Shape shape) {
		List<Punctuated.Pair<Expression>> pairs = new ArrayList<>();
		for (Punctuated.Pair<Expression> pair : list.getPairs()) {
			pairs.add(pair.withValue(formatExpression(ctx, pair.getValue(), shape)));
		}
		return new Punctuated<>(pairs);
	}

	private static Expression formatExpression(FormatContext ctx, Expression expression, Shape shape) {
		switch (expression.getKind()) {
			case BINARY: {
				BinaryExpression binary = (BinaryExpression) expression;
				return new BinaryExpression(formatExpression(ctx, binary.getLhs(), shape), binary.getOperator(),
						formatExpression(ctx, binary.getRhs(), shape));
			}
			case UNARY: {
				UnaryExpression unary = (UnaryExpression) expression;
				return new UnaryExpression(unary.getOperator(), formatExpression(ctx, unary.getOperand(), shape));
			}
			case PARENTHESES: {
				ParenthesesExpression parentheses = (ParenthesesExpression) expression;
				return new ParenthesesExpression(parentheses.getOpen(),
						formatExpression(ctx, parentheses.getInner(), shape), parentheses.getClose());
			}
			case FUNCTION: {
				FunctionExpression function = (FunctionExpression) expression;
				return new FunctionExpression(function.getFunctionToken(), formatBody(ctx, function.getBody(), shape));
			}
			case TABLE:
				return formatTable(ctx, (TableConstructor) expression, shape);
			case SUFFIXED: {
				SuffixedExpression suffixed = (SuffixedExpression) expression;
				List<Suffix> suffixes = new ArrayList<>();
				for (Suffix suffix : suffixed.getSuffixes()) {
					suffixes.add(formatSuffix(ctx, suffix, shape));
				}
				return new SuffixedExpression(formatExpression(ctx, suffixed.getPrefix(), shape), suffixes);
			}
			case TYPE_ASSERTION: {
				TypeAssertionExpression assertion = (TypeAssertionExpression) expression;
				return new TypeAssertionExpression(formatExpression(ctx, assertion.getExpression(), shape),
						assertion.getDoubleColon(), assertion.getType());
			}
			case VALUE:
				return expression;
			default:
				throw new IllegalStateException("unknown node " + expression.getKind());
		}
	}

	private static TableConstructor formatTable(FormatContext ctx, TableConstructor table, Shape shape) {
		List<Punctuated.Pair<TableField>> pairs = new ArrayList<>();
		for (Punctuated.Pair<TableField> pair : table.getFields().getPairs()) {
			pairs.add(pair.withValue(formatField(ctx, pair.getValue(), shape)));
		}
		return new TableConstructor(table.getOpen(), new Punctuated<>(pairs), table.getClose());
	}

	private static TableField formatField(FormatContext ctx, TableField field, Shape shape) {
		Expression value = formatExpression(ctx, field.getValue(), shape);
		switch (field.getKind()) {
			case EXPRESSION_KEY:
				return TableField.expressionKey(field.getOpenBracket(), formatExpression(ctx, field.getKey(), shape),
						field.getCloseBracket(), field.getEquals(), value);
			case NAME_KEY:
				return TableField.nameKey(field.getName(), field.getEquals(), value);
			case NO_KEY:
				return TableField.noKey(value);
			default:
				throw new IllegalStateException("unknown node " + field.getKind());
		}
	}

	private static Suffix formatSuffix(FormatContext ctx, Suffix suffix, Shape shape) {
		if (suffix instanceof IndexSuffix) {
			IndexSuffix index = (IndexSuffix) suffix;
			if (index.isDot()) {
				return index;
			}
			return IndexSuffix.brackets(index.getOpenBracket(), formatExpression(ctx, index.getKey(), shape),
					index.getCloseBracket());
		}
		CallSuffix call = (CallSuffix) suffix;
		FunctionArgs args = call.getArgs();
		switch (args.getKind()) {
			case PARENTHESES:
				return call.withArgs(FunctionArgs.parentheses(args.getOpenParen(),
						formatList(ctx, args.getArguments(), shape), args.getCloseParen()));
			case TABLE:
				return call.withArgs(FunctionArgs.table(formatTable(ctx, args.getTable(), shape)));
			case STRING:
				return call;
			default:
				throw new IllegalStateException("unknown node " + args.getKind());
		}
	}
}
