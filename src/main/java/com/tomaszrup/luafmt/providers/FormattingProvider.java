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
package com.tomaszrup.luafmt.providers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Ranges;
import com.tomaszrup.luafmt.FormatResult;
import com.tomaszrup.luafmt.LuaFormatter;
import com.tomaszrup.luafmt.OutputVerification;
import com.tomaszrup.luafmt.config.FormatRange;
import com.tomaszrup.luafmt.config.FormatterConfig;
import com.tomaszrup.luafmt.config.IndentType;

/**
 * Provides textDocument/formatting and textDocument/rangeFormatting support
 * for Lua source files.
 *
 * <p>The document is formatted with full output verification. The client's
 * {@link FormattingOptions} decide the indentation; every other knob comes
 * from the configuration given at construction. The result is reported as a
 * single line-level edit covering the changed lines, or no edit at all when
 * nothing changed or formatting failed.</p>
 */
public class FormattingProvider {

	private static final Logger logger = LoggerFactory.getLogger(FormattingProvider.class);

	private final FormatterConfig config;

	public FormattingProvider(FormatterConfig config) {
		this.config = config;
	}

	public CompletableFuture<List<TextEdit>> provideFormatting(DocumentFormattingParams params, String sourceText) {
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		String uri = params.getTextDocument() != null ? params.getTextDocument().getUri() : null;
		String formatted = format(uri, sourceText, applyOptions(params.getOptions()), null);
		if (formatted == null || formatted.equals(sourceText)) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		return CompletableFuture.completedFuture(computeMinimalEdits(sourceText, formatted));
	}

	public CompletableFuture<List<TextEdit>> provideRangeFormatting(DocumentRangeFormattingParams params,
			String sourceText) {
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		String uri = params.getTextDocument() != null ? params.getTextDocument().getUri() : null;
		Range requested = params.getRange();
		int[] offsets = Ranges.getOffsets(sourceText, requested);
		if (offsets == null) {
			logger.warn("Ignoring range formatting request for {}: range {} is outside the document", uri,
					requested);
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		FormatRange range = FormatRange.from(offsets[0], Math.max(offsets[0], offsets[1] - 1));
		String formatted = format(uri, sourceText, applyOptions(params.getOptions()), range);
		if (formatted == null || formatted.equals(sourceText)) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		List<TextEdit> edits = new ArrayList<>();
		for (TextEdit edit : computeMinimalEdits(sourceText, formatted)) {
			if (Ranges.intersect(requested, edit.getRange())) {
				edits.add(edit);
			} else {
				logger.debug("Dropping edit {} outside the requested range {}", edit.getRange(), requested);
			}
		}
		return CompletableFuture.completedFuture(edits);
	}

	/**
	 * The configuration with the client's indentation settings applied.
	 */
	FormatterConfig applyOptions(FormattingOptions options) {
		if (options == null) {
			return config;
		}
		FormatterConfig result = config.withIndentType(options.isInsertSpaces() ? IndentType.SPACES : IndentType.TABS);
		if (options.getTabSize() > 0) {
			result = result.withIndentWidth(options.getTabSize());
		}
		return result;
	}

	private String format(String uri, String sourceText, FormatterConfig effectiveConfig, FormatRange range) {
		FormatResult result = LuaFormatter.formatCode(sourceText, effectiveConfig, range, OutputVerification.FULL);
		if (!result.isSuccess()) {
			logger.warn("Formatting {} failed: {}", uri, result.getMessage());
			return null;
		}
		return result.getFormattedText();
	}

	/**
	 * Compute minimal line-level TextEdits between the original and formatted text.
	 */
	public static List<TextEdit> computeMinimalEdits(String original, String formatted) {
		String[] origLines = original.split("\\n", -1);
		String[] fmtLines = formatted.split("\\n", -1);
		List<TextEdit> edits = new ArrayList<>();

		int origLen = origLines.length;
		int fmtLen = fmtLines.length;
		int top = findFirstDifferentLine(origLines, fmtLines, origLen, fmtLen);

		if (top == origLen && top == fmtLen) {
			return edits;
		}

		int[] bottoms = findLastDifferentLine(origLines, fmtLines, top, origLen, fmtLen);
		int origBottom = bottoms[0];
		int fmtBottom = bottoms[1];

		String replacement = buildReplacementText(fmtLines, top, fmtBottom);
		edits.add(createMinimalEdit(origLines, top, origBottom, fmtBottom, replacement));
		return edits;
	}

	private static int findFirstDifferentLine(String[] origLines, String[] fmtLines, int origLen, int fmtLen) {
		int top = 0;
		int minLen = Math.min(origLen, fmtLen);
		while (top < minLen && origLines[top].equals(fmtLines[top])) {
			top++;
		}
		return top;
	}

	private static int[] findLastDifferentLine(String[] origLines, String[] fmtLines, int top, int origLen,
			int fmtLen) {
		int origBottom = origLen - 1;
		int fmtBottom = fmtLen - 1;
		while (origBottom >= top && fmtBottom >= top && origLines[origBottom].equals(fmtLines[fmtBottom])) {
			origBottom--;
			fmtBottom--;
		}
		return new int[] {origBottom, fmtBottom};
	}

	private static String buildReplacementText(String[] fmtLines, int top, int fmtBottom) {
		StringBuilder replacement = new StringBuilder();
		for (int j = top; j <= fmtBottom; j++) {
			if (j > top) {
				replacement.append("\n");
			}
			replacement.append(fmtLines[j]);
		}
		return replacement.toString();
	}

	private static TextEdit createMinimalEdit(String[] origLines, int top, int origBottom, int fmtBottom,
			String replacementText) {
		String adjustedReplacement = replacementText;
		Position start;
		Position end;

		if (top > origBottom) {
			// pure insertion between two unchanged lines
			if (top == 0) {
				start = new Position(0, 0);
				end = new Position(0, 0);
				if (fmtBottom >= top) {
					adjustedReplacement = adjustedReplacement + "\n";
				}
			} else {
				start = new Position(top - 1, origLines[top - 1].length());
				end = new Position(top - 1, origLines[top - 1].length());
				if (fmtBottom >= top) {
					adjustedReplacement = "\n" + adjustedReplacement;
				}
			}
		} else if (fmtBottom < top) {
			// pure deletion: remove the lines together with one line break
			if (origBottom + 1 < origLines.length) {
				start = new Position(top, 0);
				end = new Position(origBottom + 1, 0);
			} else if (top > 0) {
				start = new Position(top - 1, origLines[top - 1].length());
				end = new Position(origBottom, origLines[origBottom].length());
			} else {
				start = new Position(0, 0);
				end = new Position(origBottom, origLines[origBottom].length());
			}
			adjustedReplacement = "";
		} else {
			start = new Position(top, 0);
			end = new Position(origBottom, origLines[origBottom].length());
		}

		return new TextEdit(new Range(start, end), adjustedReplacement);
	}
}
