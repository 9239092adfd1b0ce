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

/**
 * Thrown when source text cannot be tokenized or parsed.
 */
public class ParseException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int offset;
	private final int line;
	private final int column;

	public ParseException(String message, int offset, int line, int column) {
		super(message + " at line " + line + ", column " + column);
		this.offset = offset;
		this.line = line;
		this.column = column;
	}

	/** Offset of the offending text, in {@code char} units like {@code FormatRange}. */
	public int getOffset() {
		return offset;
	}

	/** One-based line of the offending text. */
	public int getLine() {
		return line;
	}

	/** One-based column of the offending text. */
	public int getColumn() {
		return column;
	}
}
