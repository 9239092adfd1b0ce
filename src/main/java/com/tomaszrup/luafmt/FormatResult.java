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
 * Immutable result of {@link LuaFormatter#formatCode}: either the formatted
 * text or the error that prevented it.
 */
public final class FormatResult {

	private final String formattedText;
	private final FormatError error;
	private final String details;

	private FormatResult(String formattedText, FormatError error, String details) {
		this.formattedText = formattedText;
		this.error = error;
		this.details = details;
	}

	public static FormatResult success(String formattedText) {
		return new FormatResult(formattedText, null, null);
	}

	public static FormatResult failure(FormatError error, String details) {
		return new FormatResult(null, error, details);
	}

	public boolean isSuccess() {
		return error == null;
	}

	/**
	 * The formatted source, or {@code null} if formatting failed.
	 */
	public String getFormattedText() {
		return formattedText;
	}

	/**
	 * The failure kind, or {@code null} on success.
	 */
	public FormatError getError() {
		return error;
	}

	/**
	 * Parser message or comparison details behind the error.
	 */
	public String getDetails() {
		return details;
	}

	/**
	 * The user-facing error message, or {@code null} on success.
	 */
	public String getMessage() {
		return error == null ? null : error.describe(details);
	}

	@Override
	public String toString() {
		return isSuccess() ? "FormatResult{success}" : "FormatResult{" + getMessage() + "}";
	}
}
