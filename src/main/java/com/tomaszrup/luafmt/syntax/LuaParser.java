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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.tomaszrup.luafmt.syntax.ast.AssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.Ast;
import com.tomaszrup.luafmt.syntax.ast.BinaryExpression;
import com.tomaszrup.luafmt.syntax.ast.Block;
import com.tomaszrup.luafmt.syntax.ast.BreakStmt;
import com.tomaszrup.luafmt.syntax.ast.CallSuffix;
import com.tomaszrup.luafmt.syntax.ast.CompoundAssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.ContinueStmt;
import com.tomaszrup.luafmt.syntax.ast.DoStmt;
import com.tomaszrup.luafmt.syntax.ast.ElseIf;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.FunctionArgs;
import com.tomaszrup.luafmt.syntax.ast.FunctionBody;
import com.tomaszrup.luafmt.syntax.ast.FunctionCallStmt;
import com.tomaszrup.luafmt.syntax.ast.FunctionDeclarationStmt;
import com.tomaszrup.luafmt.syntax.ast.FunctionExpression;
import com.tomaszrup.luafmt.syntax.ast.FunctionName;
import com.tomaszrup.luafmt.syntax.ast.GenericDeclaration;
import com.tomaszrup.luafmt.syntax.ast.GenericForStmt;
import com.tomaszrup.luafmt.syntax.ast.GotoStmt;
import com.tomaszrup.luafmt.syntax.ast.IfStmt;
import com.tomaszrup.luafmt.syntax.ast.IndexSuffix;
import com.tomaszrup.luafmt.syntax.ast.LabelStmt;
import com.tomaszrup.luafmt.syntax.ast.LocalAssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.LocalFunctionStmt;
import com.tomaszrup.luafmt.syntax.ast.NumericForStmt;
import com.tomaszrup.luafmt.syntax.ast.Parameter;
import com.tomaszrup.luafmt.syntax.ast.ParenthesesExpression;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;
import com.tomaszrup.luafmt.syntax.ast.RepeatStmt;
import com.tomaszrup.luafmt.syntax.ast.ReturnStmt;
import com.tomaszrup.luafmt.syntax.ast.Stmt;
import com.tomaszrup.luafmt.syntax.ast.Suffix;
import com.tomaszrup.luafmt.syntax.ast.SuffixedExpression;
import com.tomaszrup.luafmt.syntax.ast.TableConstructor;
import com.tomaszrup.luafmt.syntax.ast.TableField;
import com.tomaszrup.luafmt.syntax.ast.TokenExpression;
import com.tomaszrup.luafmt.syntax.ast.TypeAssertionExpression;
import com.tomaszrup.luafmt.syntax.ast.TypeDeclarationStmt;
import com.tomaszrup.luafmt.syntax.ast.TypeInfo;
import com.tomaszrup.luafmt.syntax.ast.TypeSpecifier;
import com.tomaszrup.luafmt.syntax.ast.UnaryExpression;
import com.tomaszrup.luafmt.syntax.ast.WhileStmt;

/**
 * Recursive-descent parser producing a lossless syntax tree.
 *
 * <p>Binary operators are parsed by precedence climbing using the usual Lua
 * priorities; {@code ..} and {@code ^} are right associative. Dialect
 * statements and type annotations are only recognized when the configured
 * {@link LuaDialect} supports them.</p>
 */
public final class LuaParser {

	static final int UNARY_PRIORITY = 8;

	/** Deepest combined nesting of blocks and sub-expressions accepted. */
	public static final int MAX_NESTING = 200;

	private static final Set<String> COMPOUND_OPERATORS = Set.of("+=", "-=", "*=", "/=", "%=", "^=", "..=");

	private final String source;
	private final List<Token> tokens;
	private final LuaDialect dialect;
	private int index;
	private int nesting;

	private LuaParser(String source, List<Token> tokens, LuaDialect dialect) {
		this.source = source;
		this.tokens = tokens;
		this.dialect = dialect;
	}

	public static Ast parse(String source) throws ParseException {
		return parse(source, LuaDialect.ALL);
	}

	public static Ast parse(String source, LuaDialect dialect) throws ParseException {
		List<Token> tokens = LuaTokenizer.tokenize(source);
		return new LuaParser(source, tokens, dialect).parseAst();
	}

	/**
	 * Left and right binding power of a binary operator, or {@code null} when
	 * the token is not one.
	 */
	public static int[] binaryPriority(Token token) {
		if (token.getType() != TokenType.SYMBOL && token.getType() != TokenType.KEYWORD) {
			return null;
		}
		switch (token.getText()) {
			case "or":
				return new int[] {1, 1};
			case "and":
				return new int[] {2, 2};
			case "<":
			case ">":
			case "<=":
			case ">=":
			case "~=":
			case "==":
				return new int[] {3, 3};
			case "..":
				return new int[] {5, 4};
			case "+":
			case "-":
				return new int[] {6, 6};
			case "*":
			case "/":
			case "%":
				return new int[] {7, 7};
			case "^":
				return new int[] {10, 9};
			default:
				return null;
		}
	}

	private Ast parseAst() throws ParseException {
		Block block = parseBlock();
		if (current().getType() != TokenType.EOF) {
			throw error("'<eof>' expected", current());
		}
		return new Ast(block, current());
	}

	// ------------------------------------------------------------------
	// Blocks and statements
	// ------------------------------------------------------------------

	private Block parseBlock() throws ParseException {
		enterLevel();
		List<Block.Item> items = new ArrayList<>();
		while (!isBlockEnd()) {
			if (check("return")) {
				Stmt stmt = parseReturn();
				items.add(new Block.Item(stmt, match(";")));
				break;
			}
			Stmt stmt = parseStatement();
			items.add(new Block.Item(stmt, match(";")));
		}
		leaveLevel();
		return new Block(items);
	}

	private boolean isBlockEnd() {
		Token token = current();
		return token.getType() == TokenType.EOF
				|| token.is("end") || token.is("else") || token.is("elseif") || token.is("until");
	}

	private Stmt parseStatement() throws ParseException {
		Token token = current();
		if (token.getType() == TokenType.KEYWORD) {
			switch (token.getText()) {
				case "if":
					return parseIf();
				case "while":
					return parseWhile();
				case "do":
					return parseDo();
				case "for":
					return parseFor();
				case "repeat":
					return parseRepeat();
				case "function":
					return parseFunctionDeclaration();
				case "local":
					return parseLocal();
				case "break":
					return new BreakStmt(advance());
				default:
					throw error("unexpected '" + token.getText() + "'", token);
			}
		}
		if (token.is("::") && supports(LanguageFeature.GOTO_LABELS)) {
			Token left = advance();
			Token name = expectIdentifier();
			return new LabelStmt(left, name, expect("::"));
		}
		if (token.getType() == TokenType.IDENTIFIER) {
			Token next = peek(1);
			if (token.getText().equals("goto") && supports(LanguageFeature.GOTO_LABELS)
					&& next.getType() == TokenType.IDENTIFIER) {
				Token gotoToken = advance();
				return new GotoStmt(gotoToken, advance());
			}
			if (token.getText().equals("continue") && supports(LanguageFeature.CONTINUE)
					&& !continuesExpression(next)) {
				return new ContinueStmt(advance());
			}
			if (token.getText().equals("type") && supports(LanguageFeature.TYPE_ANNOTATIONS)
					&& next.getType() == TokenType.IDENTIFIER) {
				return parseTypeDeclaration(null);
			}
			if (token.getText().equals("export") && supports(LanguageFeature.TYPE_ANNOTATIONS)
					&& next.isIdentifier("type") && peek(2).getType() == TokenType.IDENTIFIER) {
				return parseTypeDeclaration(advance());
			}
		}
		return parseExpressionStatement();
	}

	/**
	 * Whether a {@code continue} identifier followed by {@code next} is the
	 * start of an expression rather than the statement.
	 */
	private static boolean continuesExpression(Token next) {
		if (next.getType() == TokenType.STRING) {
			return true;
		}
		if (next.getType() != TokenType.SYMBOL) {
			return false;
		}
		switch (next.getText()) {
			case "(":
			case ".":
			case "[":
			case ":":
			case "=":
			case ",":
			case "{":
				return true;
			default:
				return COMPOUND_OPERATORS.contains(next.getText());
		}
	}

	private Stmt parseExpressionStatement() throws ParseException {
		Token start = current();
		Expression first = parsePrefixAndSuffixes();
		if (check("=") || check(",")) {
			List<Punctuated.Pair<Expression>> targets = new ArrayList<>();
			checkAssignable(first, start);
			targets.add(new Punctuated.Pair<>(first, null));
			while (check(",")) {
				setLastSeparator(targets, advance());
				Token targetStart = current();
				Expression target = parsePrefixAndSuffixes();
				checkAssignable(target, targetStart);
				targets.add(new Punctuated.Pair<>(target, null));
			}
			Token equals = expect("=");
			return new AssignmentStmt(new Punctuated<>(targets), equals, parseExpressionList());
		}
		if (current().getType() == TokenType.SYMBOL && COMPOUND_OPERATORS.contains(current().getText())) {
			if (!supports(LanguageFeature.COMPOUND_ASSIGNMENT)) {
				throw error("compound assignment is not supported by " + dialect, current());
			}
			checkAssignable(first, start);
			Token operator = advance();
			return new CompoundAssignmentStmt(first, operator, parseExpression());
		}
		if (first instanceof SuffixedExpression && ((SuffixedExpression) first).isCall()) {
			return new FunctionCallStmt((SuffixedExpression) first);
		}
		throw error("syntax error: expected statement", start);
	}

	private void checkAssignable(Expression target, Token at) throws ParseException {
		if (target instanceof TokenExpression
				&& ((TokenExpression) target).getToken().getType() == TokenType.IDENTIFIER) {
			return;
		}
		if (target instanceof SuffixedExpression) {
			List<Suffix> suffixes = ((SuffixedExpression) target).getSuffixes();
			if (suffixes.get(suffixes.size() - 1) instanceof IndexSuffix) {
				return;
			}
		}
		throw error("syntax error: cannot assign to expression", at);
	}

	private Stmt parseIf() throws ParseException {
		Token ifToken = advance();
		Expression condition = parseExpression();
		Token thenToken = expect("then");
		Block block = parseBlock();
		List<ElseIf> elseIfs = new ArrayList<>();
		while (check("elseif")) {
			Token elseIfToken = advance();
			Expression elseIfCondition = parseExpression();
			Token elseIfThen = expect("then");
			elseIfs.add(new ElseIf(elseIfToken, elseIfCondition, elseIfThen, parseBlock()));
		}
		Token elseToken = null;
		Block elseBlock = null;
		if (check("else")) {
			elseToken = advance();
			elseBlock = parseBlock();
		}
		Token endToken = expect("end");
		return new IfStmt(ifToken, condition, thenToken, block, elseIfs, elseToken, elseBlock, endToken);
	}

	private Stmt parseWhile() throws ParseException {
		Token whileToken = advance();
		Expression condition = parseExpression();
		Token doToken = expect("do");
		Block block = parseBlock();
		return new WhileStmt(whileToken, condition, doToken, block, expect("end"));
	}

	private Stmt parseDo() throws ParseException {
		Token doToken = advance();
		Block block = parseBlock();
		return new DoStmt(doToken, block, expect("end"));
	}

	private Stmt parseRepeat() throws ParseException {
		Token repeatToken = advance();
		Block block = parseBlock();
		Token untilToken = expect("until");
		return new RepeatStmt(repeatToken, block, untilToken, parseExpression());
	}

	private Stmt parseFor() throws ParseException {
		Token forToken = advance();
		Token firstName = expectIdentifier();
		TypeSpecifier firstType = parseOptionalTypeSpecifier();
		if (check("=")) {
			Token equals = advance();
			Expression start = parseExpression();
			Token endComma = expect(",");
			Expression end = parseExpression();
			Token stepComma = null;
			Expression step = null;
			if (check(",")) {
				stepComma = advance();
				step = parseExpression();
			}
			Token doToken = expect("do");
			Block block = parseBlock();
			return new NumericForStmt(forToken, firstName, firstType, equals, start, endComma, end, stepComma, step,
					doToken, block, expect("end"));
		}
		List<Punctuated.Pair<Token>> names = new ArrayList<>();
		List<TypeSpecifier> types = new ArrayList<>();
		names.add(new Punctuated.Pair<>(firstName, null));
		types.add(firstType);
		while (check(",")) {
			setLastSeparator(names, advance());
			names.add(new Punctuated.Pair<>(expectIdentifier(), null));
			types.add(parseOptionalTypeSpecifier());
		}
		Token inToken = expect("in");
		Punctuated<Expression> expressions = parseExpressionList();
		Token doToken = expect("do");
		Block block = parseBlock();
		return new GenericForStmt(forToken, new Punctuated<>(names), types, inToken, expressions, doToken, block,
				expect("end"));
	}

	private Stmt parseFunctionDeclaration() throws ParseException {
		Token functionToken = advance();
		List<Punctuated.Pair<Token>> names = new ArrayList<>();
		names.add(new Punctuated.Pair<>(expectIdentifier(), null));
		while (check(".")) {
			setLastSeparator(names, advance());
			names.add(new Punctuated.Pair<>(expectIdentifier(), null));
		}
		Token colon = null;
		Token method = null;
		if (check(":")) {
			colon = advance();
			method = expectIdentifier();
		}
		FunctionName name = new FunctionName(new Punctuated<>(names), colon, method);
		return new FunctionDeclarationStmt(functionToken, name, parseFunctionBody());
	}

	private Stmt parseLocal() throws ParseException {
		Token local = advance();
		if (check("function")) {
			Token functionToken = advance();
			Token name = expectIdentifier();
			return new LocalFunctionStmt(local, functionToken, name, parseFunctionBody());
		}
		List<Punctuated.Pair<Token>> names = new ArrayList<>();
		List<TypeSpecifier> types = new ArrayList<>();
		names.add(new Punctuated.Pair<>(expectIdentifier(), null));
		types.add(parseOptionalTypeSpecifier());
		while (check(",")) {
			setLastSeparator(names, advance());
			names.add(new Punctuated.Pair<>(expectIdentifier(), null));
			types.add(parseOptionalTypeSpecifier());
		}
		if (check("=")) {
			Token equals = advance();
			return new LocalAssignmentStmt(local, new Punctuated<>(names), types, equals, parseExpressionList());
		}
		return new LocalAssignmentStmt(local, new Punctuated<>(names), types, null, Punctuated.empty());
	}

	private Stmt parseReturn() throws ParseException {
		Token returnToken = advance();
		if (isBlockEnd() || check(";")) {
			return new ReturnStmt(returnToken, Punctuated.empty());
		}
		return new ReturnStmt(returnToken, parseExpressionList());
	}

	private Stmt parseTypeDeclaration(Token exportToken) throws ParseException {
		Token typeToken = advance();
		Token name = expectIdentifier();
		GenericDeclaration generics = check("<") ? parseGenericDeclaration() : null;
		Token equals = expect("=");
		return new TypeDeclarationStmt(exportToken, typeToken, name, generics, equals, parseType());
	}

	private FunctionBody parseFunctionBody() throws ParseException {
		GenericDeclaration generics = null;
		if (supports(LanguageFeature.TYPE_ANNOTATIONS) && check("<")) {
			generics = parseGenericDeclaration();
		}
		Token open = expect("(");
		List<Punctuated.Pair<Parameter>> parameters = new ArrayList<>();
		if (!check(")")) {
			while (true) {
				Token name;
				if (check("...")) {
					name = advance();
				} else {
					name = expectIdentifier();
				}
				parameters.add(new Punctuated.Pair<>(new Parameter(name, parseOptionalTypeSpecifier()), null));
				if (!check(",") || name.is("...")) {
					break;
				}
				setLastSeparator(parameters, advance());
			}
		}
		Token close = expect(")");
		TypeSpecifier returnType = parseOptionalTypeSpecifier();
		Block block = parseBlock();
		return new FunctionBody(generics, open, new Punctuated<>(parameters), close, returnType, block,
				expect("end"));
	}

	// ------------------------------------------------------------------
	// Expressions
	// ------------------------------------------------------------------

	private Punctuated<Expression> parseExpressionList() throws ParseException {
		List<Punctuated.Pair<Expression>> values = new ArrayList<>();
		values.add(new Punctuated.Pair<>(parseExpression(), null));
		while (check(",")) {
			setLastSeparator(values, advance());
			values.add(new Punctuated.Pair<>(parseExpression(), null));
		}
		return new Punctuated<>(values);
	}

	private Expression parseExpression() throws ParseException {
		return parseSubExpression(0);
	}

	private Expression parseSubExpression(int limit) throws ParseException {
		enterLevel();
		int chained = 0;
		Expression left;
		Token token = current();
		if (token.is("not") || token.is("-") || token.is("#")) {
			Token operator = advance();
			left = new UnaryExpression(operator, parseSubExpression(UNARY_PRIORITY));
		} else {
			left = parseSimpleExpression();
		}
		int[] priority = binaryPriority(current());
		while (priority != null && priority[0] > limit) {
			Token operator = advance();
			Expression right = parseSubExpression(priority[1]);
			left = new BinaryExpression(left, operator, right);
			// each operator in a left-associative chain nests the tree one level deeper
			enterLevel();
			chained++;
			priority = binaryPriority(current());
		}
		nesting -= chained;
		leaveLevel();
		return left;
	}

	private void enterLevel() throws ParseException {
		if (++nesting > MAX_NESTING) {
			throw error("too many nested levels (limit is " + MAX_NESTING + ")", current());
		}
	}

	private void leaveLevel() {
		nesting--;
	}

	private Expression parseSimpleExpression() throws ParseException {
		Token token = current();
		Expression expression;
		if (token.getType() == TokenType.NUMBER || token.getType() == TokenType.STRING
				|| token.is("nil") || token.is("true") || token.is("false") || token.is("...")) {
			expression = new TokenExpression(advance());
		} else if (token.is("{")) {
			expression = parseTable();
		} else if (token.is("function")) {
			Token functionToken = advance();
			expression = new FunctionExpression(functionToken, parseFunctionBody());
		} else {
			expression = parsePrefixAndSuffixes();
		}
		if (supports(LanguageFeature.TYPE_ANNOTATIONS) && check("::")) {
			Token doubleColon = advance();
			expression = new TypeAssertionExpression(expression, doubleColon, parseType());
		}
		return expression;
	}

	private Expression parsePrefixAndSuffixes() throws ParseException {
		Token token = current();
		Expression prefix;
		if (token.getType() == TokenType.IDENTIFIER) {
			prefix = new TokenExpression(advance());
		} else if (token.is("(")) {
			Token open = advance();
			Expression inner = parseExpression();
			prefix = new ParenthesesExpression(open, inner, expect(")"));
		} else {
			throw error("unexpected symbol near '" + describe(token) + "'", token);
		}
		List<Suffix> suffixes = new ArrayList<>();
		while (true) {
			Token next = current();
			if (next.is(".")) {
				Token dot = advance();
				suffixes.add(IndexSuffix.dot(dot, expectIdentifier()));
			} else if (next.is("[")) {
				Token open = advance();
				Expression key = parseExpression();
				suffixes.add(IndexSuffix.brackets(open, key, expect("]")));
			} else if (next.is(":")) {
				Token colon = advance();
				Token method = expectIdentifier();
				suffixes.add(new CallSuffix(colon, method, parseArgs()));
			} else if (next.is("(") || next.is("{") || next.getType() == TokenType.STRING) {
				suffixes.add(new CallSuffix(null, null, parseArgs()));
			} else {
				break;
			}
		}
		if (suffixes.isEmpty()) {
			return prefix;
		}
		return new SuffixedExpression(prefix, suffixes);
	}

	private FunctionArgs parseArgs() throws ParseException {
		Token token = current();
		if (token.getType() == TokenType.STRING) {
			return FunctionArgs.string(advance());
		}
		if (token.is("{")) {
			return FunctionArgs.table(parseTable());
		}
		Token open = expect("(");
		if (check(")")) {
			return FunctionArgs.parentheses(open, Punctuated.empty(), advance());
		}
		Punctuated<Expression> arguments = parseExpressionList();
		return FunctionArgs.parentheses(open, arguments, expect(")"));
	}

	private TableConstructor parseTable() throws ParseException {
		Token open = expect("{");
		List<Punctuated.Pair<TableField>> fields = new ArrayList<>();
		while (!check("}")) {
			TableField field;
			if (check("[")) {
				Token openBracket = advance();
				Expression key = parseExpression();
				Token closeBracket = expect("]");
				Token equals = expect("=");
				field = TableField.expressionKey(openBracket, key, closeBracket, equals, parseExpression());
			} else if (current().getType() == TokenType.IDENTIFIER && peek(1).is("=")) {
				Token name = advance();
				Token equals = advance();
				field = TableField.nameKey(name, equals, parseExpression());
			} else {
				field = TableField.noKey(parseExpression());
			}
			fields.add(new Punctuated.Pair<>(field, null));
			if (check(",") || check(";")) {
				setLastSeparator(fields, advance());
			} else {
				break;
			}
		}
		Token close = expect("}");
		return new TableConstructor(open, new Punctuated<>(fields), close);
	}

	// ------------------------------------------------------------------
	// Types
	// ------------------------------------------------------------------

	private TypeSpecifier parseOptionalTypeSpecifier() throws ParseException {
		if (supports(LanguageFeature.TYPE_ANNOTATIONS) && check(":")) {
			Token colon = advance();
			return new TypeSpecifier(colon, parseType());
		}
		return null;
	}

	private TypeInfo parseType() throws ParseException {
		List<SyntaxNode> parts = new ArrayList<>();
		parseUnionType(parts);
		return new TypeInfo(parts);
	}

	private GenericDeclaration parseGenericDeclaration() throws ParseException {
		Token open = expect("<");
		List<SyntaxNode> parts = new ArrayList<>();
		while (!check(">")) {
			parts.add(expectIdentifier());
			if (check("...")) {
				parts.add(advance());
			}
			if (check("=")) {
				parts.add(advance());
				parseUnionType(parts);
			}
			if (!check(",")) {
				break;
			}
			parts.add(advance());
		}
		Token close = expect(">");
		return new GenericDeclaration(open, new TypeInfo(parts), close);
	}

	private void parseUnionType(List<SyntaxNode> parts) throws ParseException {
		enterLevel();
		if (check("|") || check("&")) {
			parts.add(advance());
		}
		parseSingleType(parts);
		while (check("|") || check("&")) {
			parts.add(advance());
			parseSingleType(parts);
		}
		leaveLevel();
	}

	private void parseSingleType(List<SyntaxNode> parts) throws ParseException {
		Token token = current();
		if (token.is("nil") || token.is("true") || token.is("false") || token.getType() == TokenType.STRING) {
			parts.add(advance());
		} else if (token.isIdentifier("typeof") && peek(1).is("(")) {
			parts.add(advance());
			parts.add(advance());
			parts.add(parseExpression());
			parts.add(expect(")"));
		} else if (token.getType() == TokenType.IDENTIFIER) {
			parts.add(advance());
			if (check(".")) {
				parts.add(advance());
				parts.add(expectIdentifier());
			}
			if (check("<")) {
				parseTypeArguments(parts);
			}
			if (check("...")) {
				parts.add(advance());
			}
		} else if (token.is("{")) {
			parseTableType(parts);
		} else if (token.is("(")) {
			parseFunctionOrTupleType(parts);
		} else if (token.is("<")) {
			parts.add(advance());
			while (!check(">")) {
				parts.add(expectIdentifier());
				if (check("...")) {
					parts.add(advance());
				}
				if (!check(",")) {
					break;
				}
				parts.add(advance());
			}
			parts.add(expect(">"));
			if (!check("(")) {
				throw error("'(' expected after generic parameters", current());
			}
			parseFunctionOrTupleType(parts);
		} else if (token.is("...")) {
			parts.add(advance());
			parseSingleType(parts);
		} else {
			throw error("type expected near '" + describe(token) + "'", token);
		}
		while (check("?")) {
			parts.add(advance());
		}
	}

	private void parseTypeArguments(List<SyntaxNode> parts) throws ParseException {
		parts.add(advance());
		while (!check(">")) {
			parseUnionType(parts);
			if (!check(",")) {
				break;
			}
			parts.add(advance());
		}
		parts.add(expect(">"));
	}

	private void parseTableType(List<SyntaxNode> parts) throws ParseException {
		parts.add(advance());
		while (!check("}")) {
			if (check("[")) {
				parts.add(advance());
				parseUnionType(parts);
				parts.add(expect("]"));
				parts.add(expect(":"));
				parseUnionType(parts);
			} else if (current().getType() == TokenType.IDENTIFIER && peek(1).is(":")) {
				parts.add(advance());
				parts.add(advance());
				parseUnionType(parts);
			} else {
				parseUnionType(parts);
			}
			if (!check(",") && !check(";")) {
				break;
			}
			parts.add(advance());
		}
		parts.add(expect("}"));
	}

	private void parseFunctionOrTupleType(List<SyntaxNode> parts) throws ParseException {
		parts.add(advance());
		while (!check(")")) {
			if ((current().getType() == TokenType.IDENTIFIER || current().is("...")) && peek(1).is(":")) {
				parts.add(advance());
				parts.add(advance());
			}
			parseUnionType(parts);
			if (!check(",")) {
				break;
			}
			parts.add(advance());
		}
		parts.add(expect(")"));
		if (check("->")) {
			parts.add(advance());
			parseUnionType(parts);
		}
	}

	// ------------------------------------------------------------------
	// Token cursor
	// ------------------------------------------------------------------

	private boolean supports(LanguageFeature feature) {
		return dialect.supports(feature);
	}

	private Token current() {
		return tokens.get(index);
	}

	private Token peek(int ahead) {
		int at = Math.min(index + ahead, tokens.size() - 1);
		return tokens.get(at);
	}

	private Token advance() {
		Token token = tokens.get(index);
		if (index < tokens.size() - 1) {
			index++;
		}
		return token;
	}

	private boolean check(String text) {
		return current().is(text);
	}

	private Token match(String text) {
		return check(text) ? advance() : null;
	}

	private Token expect(String text) throws ParseException {
		if (!check(text)) {
			throw error("'" + text + "' expected near '" + describe(current()) + "'", current());
		}
		return advance();
	}

	private Token expectIdentifier() throws ParseException {
		if (current().getType() != TokenType.IDENTIFIER) {
			throw error("<name> expected near '" + describe(current()) + "'", current());
		}
		return advance();
	}

	private static <T extends SyntaxNode> void setLastSeparator(List<Punctuated.Pair<T>> pairs, Token separator) {
		int last = pairs.size() - 1;
		pairs.set(last, pairs.get(last).withSeparator(separator));
	}

	private static String describe(Token token) {
		return token.getType() == TokenType.EOF ? "<eof>" : token.getText();
	}

	private ParseException error(String message, Token at) {
		int offset = Math.max(0, at.getStartOffset());
		int line = 1;
		int column = 1;
		for (int i = 0; i < offset && i < source.length(); i++) {
			if (source.charAt(i) == '\n') {
				line++;
				column = 1;
			} else {
				column++;
			}
		}
		return new ParseException(message, offset, line, column);
	}
}
