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
package com.tomaszrup.luafmt.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FormatterConfigTests {

	// ------------------------------------------------------------------
	// FormatterConfig
	// ------------------------------------------------------------------

	@Test
	void testWithersReturnNewInstances() {
		FormatterConfig defaults = new FormatterConfig();
		FormatterConfig narrow = defaults.withColumnWidth(40);
		Assertions.assertEquals(120, defaults.getColumnWidth());
		Assertions.assertEquals(40, narrow.getColumnWidth());
		Assertions.assertNotEquals(defaults, narrow);
	}

	@Test
	void testEqualsAndHashCode() {
		FormatterConfig a = new FormatterConfig().withIndentType(IndentType.SPACES).withIndentWidth(2);
		FormatterConfig b = new FormatterConfig().withIndentWidth(2).withIndentType(IndentType.SPACES);
		Assertions.assertEquals(a, b);
		Assertions.assertEquals(a.hashCode(), b.hashCode());
	}

	@Test
	void testInvalidWidthsAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new FormatterConfig().withColumnWidth(0));
		Assertions.assertThrows(IllegalArgumentException.class, () -> new FormatterConfig().withIndentWidth(-1));
	}

	@Test
	void testNullEnumIsRejected() {
		Assertions.assertThrows(NullPointerException.class, () -> new FormatterConfig().withQuoteStyle(null));
	}

	@Test
	void testLineEndingText() {
		Assertions.assertEquals("\n", LineEndings.UNIX.getNewline());
		Assertions.assertEquals("\r\n", LineEndings.WINDOWS.getNewline());
	}

	// ------------------------------------------------------------------
	// FormatRange
	// ------------------------------------------------------------------

	@Test
	void testRangeCovers() {
		FormatRange range = FormatRange.from(5, 10);
		Assertions.assertTrue(range.covers(5, 11));
		Assertions.assertFalse(range.covers(4, 8));
		Assertions.assertFalse(range.covers(6, 12));
	}

	@Test
	void testOpenRangeCovers() {
		Assertions.assertTrue(new FormatRange(null, 10).covers(0, 11));
		Assertions.assertTrue(new FormatRange(5, null).covers(5, 1000));
		Assertions.assertTrue(new FormatRange(null, null).covers(0, Integer.MAX_VALUE));
	}

	@Test
	void testReversedRangeIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> FormatRange.from(10, 5));
	}

	@Test
	void testRangeEquality() {
		Assertions.assertEquals(FormatRange.from(1, 2), new FormatRange(1, 2));
		Assertions.assertNotEquals(FormatRange.from(1, 2), new FormatRange(1, null));
	}
}
