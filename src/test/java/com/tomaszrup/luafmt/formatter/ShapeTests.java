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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.luafmt.config.FormatterConfig;

/**
 * Unit tests for {@link Shape}.
 */
class ShapeTests {

	private final Shape base = Shape.from(new FormatterConfig().withColumnWidth(20).withIndentWidth(4));

	@Test
	void testFreshShapeIsEmpty() {
		Assertions.assertEquals(0, base.usedWidth());
		Assertions.assertFalse(base.overBudget());
	}

	@Test
	void testAddIsNotMutating() {
		Shape wider = base.add(10);
		Assertions.assertEquals(0, base.getOffset());
		Assertions.assertEquals(10, wider.getOffset());
	}

	@Test
	void testOverBudgetOnlyPastColumnWidth() {
		Assertions.assertFalse(base.add(20).overBudget());
		Assertions.assertTrue(base.add(21).overBudget());
	}

	@Test
	void testIndentationCountsTowardsBudget() {
		Shape indented = base.incrementBlockIndent().incrementAdditionalIndent();
		Assertions.assertEquals(2, indented.totalIndentLevel());
		Assertions.assertEquals(8, indented.usedWidth());
		Assertions.assertTrue(indented.add(13).overBudget());
	}

	@Test
	void testResetKeepsIndentation() {
		Shape shape = base.incrementBlockIndent().incrementAdditionalIndent().add(7).reset();
		Assertions.assertEquals(0, shape.getOffset());
		Assertions.assertEquals(1, shape.getIndentLevel());
		Assertions.assertEquals(1, shape.getAdditionalIndent());
	}

	@Test
	void testNestedBlockFoldsHangingIndent() {
		Shape nested = base.incrementBlockIndent().incrementAdditionalIndent().add(5).nestedBlock();
		Assertions.assertEquals(3, nested.getIndentLevel());
		Assertions.assertEquals(0, nested.getAdditionalIndent());
		Assertions.assertEquals(0, nested.getOffset());
	}

	@Test
	void testTakeSingleLine() {
		Assertions.assertEquals(5, base.take("hello").getOffset());
	}

	@Test
	void testTakeMultiLineUsesLastLine() {
		Shape shape = base.incrementBlockIndent().add(12).take("{\n\t\ta = 1,\n\t}");
		// the block indentation of the last line is not part of the offset
		Assertions.assertEquals(1, shape.getOffset());
	}

	@Test
	void testTakeFirstLine() {
		Assertions.assertEquals(3, base.takeFirstLine("f({\n\t1,\n})").getOffset());
	}

	@Test
	void testTabsCountAsIndentWidth() {
		Assertions.assertEquals(9, base.width("\t\ta"));
		Assertions.assertEquals(1, base.width("a\r"));
	}
}
