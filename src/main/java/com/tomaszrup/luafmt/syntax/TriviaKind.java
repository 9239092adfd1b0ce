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
 * Kinds of non-significant text attached to tokens.
 */
public enum TriviaKind {
	/** A horizontal whitespace run, optionally terminated by a single newline. */
	WHITESPACE,
	/** A {@code --} comment running to the end of its line, newline excluded. */
	SINGLE_LINE_COMMENT,
	/** A bracketed {@code --[[ ]]} comment, possibly spanning lines. */
	MULTI_LINE_COMMENT
}
