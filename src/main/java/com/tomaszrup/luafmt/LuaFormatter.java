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
package com.tomaszrup.luafmt;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.luafmt.config.FormatRange;
import com.tomaszrup.luafmt.config.FormatterConfig;
import com.tomaszrup.luafmt.formatter.CodeFormatter;
import com.tomaszrup.luafmt.syntax.CstPrinter;
import com.tomaszrup.luafmt.syntax.LuaParser;
import com.tomaszrup.luafmt.syntax.ParseException;
import com.tomaszrup.luafmt.syntax.ast.Ast;
import com.tomaszrup.luafmt.verify.AstVerifier;
import com.tomaszrup.luafmt.verify.EquivalencePolicy;
import com.tomaszrup.luafmt.verify.VerificationResult;

/**
 * Entry point of the formatter.
 *
 * <p>All methods are stateless: trees are immutable and every call builds
 * its own context, so independent calls may run concurrently.</p>
 */
public final class LuaFormatter {

	private static final Logger logger = LoggerFactory.getLogger(LuaFormatter.class);

	private LuaFormatter() {
	}

	/**
	 * Parses, formats and prints {@code code}. With
	 * {@link OutputVerification#FULL} the output is reparsed and compared with
	 * the input tree before it is returned.
	 *
	 * @param range the part of the input to format, or {@code null} for all of it
	 */
	public static FormatResult formatCode(String code, FormatterConfig config, FormatRange range,
			OutputVerification verification) {
		long start = System.nanoTime();
		Ast input;
		try {
			input = LuaParser.parse(code, config.getSyntax());
		} catch (ParseException e) {
			logger.debug("Input does not parse: {}", e.getMessage());
			return FormatResult.failure(FormatError.PARSE_ERROR, e.getMessage());
		}

		Ast formatted = format(input, config, range);
		String output = CstPrinter.print(formatted);

		if (verification == OutputVerification.FULL) {
			VerificationResult result = verify(input, output, config);
			switch (result.getStatus()) {
				case REPARSE_FAULT:
					return FormatResult.failure(FormatError.VERIFICATION_AST_ERROR, result.getDetails());
				case SEMANTIC_DIFFERENCE:
					return FormatResult.failure(FormatError.VERIFICATION_AST_DIFFERENCE, result.getDetails());
				case OK:
					break;
				default:
					throw new IllegalStateException("unknown verification status " + result.getStatus());
			}
		}

		if (logger.isDebugEnabled()) {
			logger.debug("Formatted {} chars into {} chars (range: {}, verification: {}) in {} ms", code.length(),
					output.length(), range, verification,
					TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
		}
		return FormatResult.success(output);
	}

	/**
	 * Formats a parsed tree. Only statements inside {@code range} are
	 * reformatted; the rest keep their original text.
	 */
	public static Ast format(Ast ast, FormatterConfig config, FormatRange range) {
		return CodeFormatter.format(ast, config, range);
	}

	/**
	 * Reparses {@code formattedText} and compares it with {@code original}
	 * using the default equivalence policy.
	 */
	public static VerificationResult verify(Ast original, String formattedText, FormatterConfig config) {
		return verify(original, formattedText, config, EquivalencePolicy.defaults());
	}

	public static VerificationResult verify(Ast original, String formattedText, FormatterConfig config,
			EquivalencePolicy policy) {
		return AstVerifier.verify(original, formattedText, config.getSyntax(), policy);
	}
}
