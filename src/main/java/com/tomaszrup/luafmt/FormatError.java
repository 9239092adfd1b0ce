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

/**
 * The ways a formatting call can fail.
 */
public enum FormatError {
	/** The input does not parse. */
	PARSE_ERROR("error parsing: %s"),
	/** The formatted output does not parse; a formatter defect. */
	VERIFICATION_AST_ERROR("INTERNAL ERROR: Output AST generated a syntax error. Please report this issue.%n%s"),
	/** The formatted output parses into a different tree. */
	VERIFICATION_AST_DIFFERENCE("INTERNAL WARNING: Output AST may be different to input AST. "
			+ "Code correctness may have changed. Please examine the formatting diff and report any issues.");

	private final String template;

	FormatError(String template) {
		this.template = template;
	}

	/**
	 * User-facing message for this error.
	 *
	 * @param details parser message or comparison details, may be {@code null}
	 */
	public String describe(String details) {
		return String.format(template, details == null ? "" : details);
	}
}
