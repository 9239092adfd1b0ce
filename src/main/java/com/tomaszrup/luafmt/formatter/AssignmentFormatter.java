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

import com.tomaszrup.luafmt.syntax.CstPrinter;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.ast.AssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.CompoundAssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.LocalAssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;
import com.tomaszrup.luafmt.syntax.ast.ReturnStmt;
import com.tomaszrup.luafmt.syntax.ast.TypeSpecifier;

/**
 * Formats assignments, local declarations, returns and compound
 * assignments. The right-hand side hangs when the statement does not fit on
 * one line or when comments sit between its values.
 */
final class AssignmentFormatter {

	private AssignmentFormatter() {
	}

	static AssignmentStmt formatAssignment(FormatContext ctx, AssignmentStmt assignment, Shape shape) {
		Punctuated<Expression> targets = ExpressionFormatter.formatList(ctx, assignment.getTargets(), shape);
		Token equals = GeneralFormatter.formatSpaced(assignment.getEquals());
		Shape valuesShape = shape.take(CstPrinter.print(targets)).add(3);
		Punctuated<Expression> values = formatValues(ctx, assignment.getValues(), valuesShape, shape);
		return new AssignmentStmt(targets, equals, values);
	}

	static LocalAssignmentStmt formatLocalAssignment(FormatContext ctx, LocalAssignmentStmt local, Shape shape) {
		Token localToken = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(local.getLocal()));
		Shape current = shape.add(6);

		List<Punctuated.Pair<Token>> names = new ArrayList<>();
		List<TypeSpecifier> types = new ArrayList<>();
		List<Punctuated.Pair<Token>> original = local.getNames().getPairs();
		for (int i = 0; i < original.size(); i++) {
			Punctuated.Pair<Token> pair = original.get(i);
			Token name = GeneralFormatter.formatToken(pair.getValue());
			current = current.add(name.getText().length());
			TypeSpecifier type = DialectFormatter.formatTypeSpecifier(ctx, local.getTypeSpecifiers().get(i), current);
			if (type != null) {
				current = current.take(CstPrinter.print(type));
			}
			Token separator = null;
			if (pair.getSeparator() != null) {
				separator = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(pair.getSeparator()));
				current = current.add(2);
			}
			names.add(new Punctuated.Pair<>(name, separator));
			types.add(type);
		}

		if (local.getEquals() == null) {
			return new LocalAssignmentStmt(localToken, new Punctuated<>(names), types, null, local.getValues());
		}
		Token equals = GeneralFormatter.formatSpaced(local.getEquals());
		Punctuated<Expression> values = formatValues(ctx, local.getValues(), current.add(3), shape);
		return new LocalAssignmentStmt(localToken, new Punctuated<>(names), types, equals, values);
	}

	static ReturnStmt formatReturn(FormatContext ctx, ReturnStmt returnStmt, Shape shape) {
		Token returnToken = GeneralFormatter.formatToken(returnStmt.getReturnToken());
		if (returnStmt.getValues().isEmpty()) {
			return new ReturnStmt(returnToken, returnStmt.getValues());
		}
		Punctuated<Expression> values = formatValues(ctx, returnStmt.getValues(), shape.add(7), shape);
		return new ReturnStmt(GeneralFormatter.withTrailingSpace(returnToken), values);
	}

	static CompoundAssignmentStmt formatCompoundAssignment(FormatContext ctx, CompoundAssignmentStmt compound,
			Shape shape) {
		Expression target = ExpressionFormatter.format(ctx, compound.getTarget(), shape);
		Token operator = GeneralFormatter.formatSpaced(compound.getOperator());
		Shape valueShape = shape.take(CstPrinter.print(target)).add(operator.getText().length() + 2);
		Expression value = ExpressionFormatter.format(ctx, compound.getValue(), valueShape);
		if (ExpressionFormatter.isHangable(compound.getValue())
				&& (valueShape.takeFirstLine(CstPrinter.printTrimmed(value)).overBudget()
						|| TriviaUtil.containsInlineComments(compound.getValue()))) {
			value = ExpressionFormatter.hang(ctx, compound.getValue(), valueShape, shape.incrementAdditionalIndent());
		}
		return new CompoundAssignmentStmt(target, operator, value);
	}

	/**
	 * Formats an expression list that ends a statement, hanging it when the
	 * single-line form overflows or carries inline comments.
	 */
	private static Punctuated<Expression> formatValues(FormatContext ctx, Punctuated<Expression> values, Shape shape,
			Shape statementShape) {
		Punctuated<Expression> singleLine = ExpressionFormatter.formatList(ctx, values, shape);
		if (!ExpressionFormatter.anyHangable(values)) {
			return singleLine;
		}
		boolean hang = shape.takeFirstLine(CstPrinter.printTrimmed(singleLine)).overBudget();
		for (Expression value : values.values()) {
			hang |= TriviaUtil.containsInlineComments(value);
		}
		if (!hang) {
			return singleLine;
		}
		return ExpressionFormatter.hangList(ctx, values, shape, statementShape.incrementAdditionalIndent());
	}
}
