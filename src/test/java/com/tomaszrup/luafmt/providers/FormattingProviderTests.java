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

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.luafmt.config.FormatterConfig;
import com.tomaszrup.luafmt.config.IndentType;

class FormattingProviderTests {

	private static final String URI = "file:///workspace/main.lua";

	private FormattingProvider provider;

	@BeforeEach
	void setup() {
		provider = new FormattingProvider(new FormatterConfig());
	}

	private List<TextEdit> format(String contents, FormattingOptions options) throws Exception {
		DocumentFormattingParams params = new DocumentFormattingParams(new TextDocumentIdentifier(URI), options);
		return provider.provideFormatting(params, contents).get();
	}

	private List<TextEdit> formatRange(String contents, Range range) throws Exception {
		DocumentRangeFormattingParams params = new DocumentRangeFormattingParams(new TextDocumentIdentifier(URI),
				new FormattingOptions(4, false), range);
		return provider.provideRangeFormatting(params, contents).get();
	}

	private String applyEdits(String original, List<? extends TextEdit> edits) {
		String text = original;
		// Apply edits in reverse document order to preserve earlier positions
		List<? extends TextEdit> sorted = new ArrayList<>(edits);
		sorted.sort((a, b) -> {
			int lineCmp = Integer.compare(b.getRange().getStart().getLine(),
					a.getRange().getStart().getLine());
			if (lineCmp != 0) return lineCmp;
			return Integer.compare(b.getRange().getStart().getCharacter(),
					a.getRange().getStart().getCharacter());
		});
		for (TextEdit edit : sorted) {
			Range range = edit.getRange();
			int startOffset = positionToOffset(text, range.getStart());
			int endOffset = positionToOffset(text, range.getEnd());
			text = text.substring(0, startOffset) + edit.getNewText() + text.substring(endOffset);
		}
		return text;
	}

	private int positionToOffset(String text, Position pos) {
		int line = 0;
		int offset = 0;
		while (line < pos.getLine() && offset < text.length()) {
			if (text.charAt(offset) == '\n') {
				line++;
			}
			offset++;
		}
		return offset + pos.getCharacter();
	}

	// --- Whole document ---

	@Test
	void testFormatsDocument() throws Exception {
		String contents = "local x=1\nif x then print( x ) end\n";
		List<TextEdit> edits = format(contents, new FormattingOptions(4, false));
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals("local x = 1\nif x then\n\tprint(x)\nend\n", applyEdits(contents, edits));
	}

	@Test
	void testClientOptionsControlIndentation() throws Exception {
		String contents = "do x() end\n";
		List<TextEdit> edits = format(contents, new FormattingOptions(2, true));
		Assertions.assertEquals("do\n  x()\nend\n", applyEdits(contents, edits));
	}

	@Test
	void testAlreadyFormattedDocumentGivesNoEdits() throws Exception {
		Assertions.assertTrue(format("local x = 1\n", new FormattingOptions(4, false)).isEmpty());
	}

	@Test
	void testEmptyDocumentGivesNoEdits() throws Exception {
		Assertions.assertTrue(format("", new FormattingOptions(4, false)).isEmpty());
	}

	@Test
	void testUnparsableDocumentGivesNoEdits() throws Exception {
		Assertions.assertTrue(format("local = ", new FormattingOptions(4, false)).isEmpty());
	}

	@Test
	void testApplyOptions() {
		FormatterConfig config = provider.applyOptions(new FormattingOptions(3, true));
		Assertions.assertEquals(IndentType.SPACES, config.getIndentType());
		Assertions.assertEquals(3, config.getIndentWidth());
		Assertions.assertEquals(new FormatterConfig(), provider.applyOptions(null));
	}

	// --- Range ---

	@Test
	void testFormatsOnlyRequestedRange() throws Exception {
		String contents = "a  =  1\nb  =  2\nc  =  3\n";
		List<TextEdit> edits = formatRange(contents, new Range(new Position(1, 0), new Position(1, 7)));
		Assertions.assertEquals("a  =  1\nb = 2\nc  =  3\n", applyEdits(contents, edits));
	}

	@Test
	void testRangeOutsideDocumentGivesNoEdits() throws Exception {
		String contents = "a  =  1\n";
		Assertions.assertTrue(formatRange(contents, new Range(new Position(5, 0), new Position(6, 0))).isEmpty());
	}

	@Test
	void testReversedRangeGivesNoEdits() throws Exception {
		String contents = "a  =  1\nb  =  2\n";
		Assertions.assertTrue(formatRange(contents, new Range(new Position(1, 0), new Position(0, 0))).isEmpty());
	}

	// --- computeMinimalEdits ---

	@Test
	void testMinimalEditsForIdenticalText() {
		Assertions.assertTrue(FormattingProvider.computeMinimalEdits("a\nb\n", "a\nb\n").isEmpty());
	}

	@Test
	void testMinimalEditReplacesChangedLine() {
		List<TextEdit> edits = FormattingProvider.computeMinimalEdits("a\nb\nc", "a\nB\nc");
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals(new Range(new Position(1, 0), new Position(1, 1)), edits.get(0).getRange());
		Assertions.assertEquals("B", edits.get(0).getNewText());
	}

	@Test
	void testMinimalEditForInsertedLine() {
		List<TextEdit> edits = FormattingProvider.computeMinimalEdits("a\nc", "a\nb\nc");
		Assertions.assertEquals(new Range(new Position(0, 1), new Position(0, 1)), edits.get(0).getRange());
		Assertions.assertEquals("\nb", edits.get(0).getNewText());
		Assertions.assertEquals("a\nb\nc", applyEdits("a\nc", edits));
	}

	@Test
	void testMinimalEditForDeletedLine() {
		List<TextEdit> edits = FormattingProvider.computeMinimalEdits("a\nb\nc", "a\nc");
		Assertions.assertEquals(new Range(new Position(1, 0), new Position(2, 0)), edits.get(0).getRange());
		Assertions.assertEquals("", edits.get(0).getNewText());
		Assertions.assertEquals("a\nc", applyEdits("a\nb\nc", edits));
	}

	@Test
	void testMinimalEditForInsertionAtTop() {
		List<TextEdit> edits = FormattingProvider.computeMinimalEdits("b", "a\nb");
		Assertions.assertEquals("a\nb", applyEdits("b", edits));
	}
}
