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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.tomaszrup.luafmt.syntax.CstPrinter;
import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.GenericDeclaration;
import com.tomaszrup.luafmt.syntax.ast.TypeAssertionExpression;
import com.tomaszrup.luafmt.syntax.ast.TypeDeclarationStmt;
import com.tomaszrup.luafmt.syntax.ast.TypeInfo;
import com.tomaszrup.luafmt.syntax.ast.TypeSpecifier;

/**
 * Formats the dialect extensions: type annotations, generic parameter
 * lists, type assertions and type declarations.
 */
final class DialectFormatter {

	private static final Set<String> NO_SPACE_BEFORE = new HashSet<>(
			Arrays.asList(",", ")", "]", ">", "?", ":", ";"));
	private static final Set<String> SPACE_AFTER = new HashSet<>(
			Arrays.asList(",", ":", ";", "|", "&", "->", "="));
	private static final Set<String> SPACE_AROUND = new HashSet<>(Arrays.asList("|", "&", "->", "="));
	private static final Set<String> ATTACHING = new HashSet<>(Arrays.asList("(", "[", "<", ".", "..."));

	private DialectFormatter() {
	}

	static TypeInfo formatTypeInfo(FormatContext ctx, TypeInfo type, Shape shape) {
		List<SyntaxNode> parts = new ArrayList<>();
		String previous = null;
		Shape current = shape;
		for (SyntaxNode part : type.getParts()) {
			SyntaxNode formatted;
			String text;
			if (part instanceof Token) {
				formatted = GeneralFormatter.formatToken((Token) part);
				text = ((Token) part).getText();
			} else {
				formatted = ExpressionFormatter.format(ctx, (Expression) part, current);
				text = null;
			}
			if (previous != null && needsSpace(previous, text)) {
				formatted = formatted.mapTokens(GeneralFormatter.leadingSpace(formatted));
			}
			parts.add(formatted);
			current = current.take(CstPrinter.print(formatted));
			previous = text;
		}
		return new TypeInfo(parts);
	}

	/**
	 * Spacing between two adjacent parts of a type. A {@code null} text stands
	 * for an embedded expression and behaves like a word.
	 */
	static boolean needsSpace(String previous, String next) {
		if (next != null && NO_SPACE_BEFORE.contains(next)) {
			return false;
		}
		if (previous != null && SPACE_AFTER.contains(previous)) {
			return true;
		}
		if (next != null && SPACE_AROUND.contains(next)) {
			return true;
		}
		if ("}".equals(next)) {
			return !"{".equals(previous);
		}
		if ("{".equals(previous)) {
			return true;
		}
		if ((previous != null && ATTACHING.contains(previous)) || (next != null && ATTACHING.contains(next))) {
			return false;
		}
		return isWordLike(previous) && isWordLike(next);
	}

	private static boolean isWordLike(String text) {
		if (text == null) {
			return true;
		}
		if (text.isEmpty()) {
			return false;
		}
		char c = text.charAt(0);
		return Character.isLetterOrDigit(c) || c == '_' || c == '"' || c == '\'';
	}

	/** {@code : Type}, attached to the preceding name. */
	static TypeSpecifier formatTypeSpecifier(FormatContext ctx, TypeSpecifier specifier, Shape shape) {
		if (specifier == null) {
			return null;
		}
		Token colon = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(specifier.getColon()));
		TypeInfo type = formatTypeInfo(ctx, specifier.getType(), shape.add(2));
		return new TypeSpecifier(colon, type);
	}

	static GenericDeclaration formatGenerics(FormatContext ctx, GenericDeclaration generics, Shape shape) {
		if (generics == null) {
			return null;
		}
		Token open = GeneralFormatter.formatToken(generics.getOpen());
		TypeInfo parameters = formatTypeInfo(ctx, generics.getParameters(), shape.add(1));
		Token close = GeneralFormatter.formatToken(generics.getClose());
		return new GenericDeclaration(open, parameters, close);
	}

	static Expression formatTypeAssertion(FormatContext ctx, TypeAssertionExpression assertion, Shape shape) {
		Expression expression = ExpressionFormatter.format(ctx, assertion.getExpression(), shape);
		Token doubleColon = GeneralFormatter.formatSpaced(assertion.getDoubleColon());
		Shape typeShape = shape.take(CstPrinter.print(expression)).add(4);
		return new TypeAssertionExpression(expression, doubleColon, formatTypeInfo(ctx, assertion.getType(), typeShape));
	}

	/** {@code [export ]type Name<T> = Type} */
	static TypeDeclarationStmt formatTypeDeclaration(FormatContext ctx, TypeDeclarationStmt declaration, Shape shape) {
		Token export = null;
		Shape current = shape;
		if (declaration.getExportToken() != null) {
			export = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(declaration.getExportToken()));
			current = current.add(7);
		}
		Token typeToken = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(declaration.getTypeToken()));
		Token name = GeneralFormatter.formatToken(declaration.getName());
		current = current.add(5 + name.getText().length());
		GenericDeclaration generics = formatGenerics(ctx, declaration.getGenerics(), current);
		if (generics != null) {
			current = current.take(CstPrinter.print(generics));
		}
		Token equals = GeneralFormatter.formatSpaced(declaration.getEquals());
		TypeInfo type = formatTypeInfo(ctx, declaration.getType(), current.add(3));
		return new TypeDeclarationStmt(export, typeToken, name, generics, equals, type);
	}
}
