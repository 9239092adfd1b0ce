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
package com.tomaszrup.luafmt.verify;

/**
 * Outcome of comparing a formatted output with the tree it came from.
 */
public final class VerificationResult {

	public enum Status {
		/** The output parses and matches the original tree. */
		OK,
		/** The output does not parse. Always a formatter defect. */
		REPARSE_FAULT,
		/** The output parses into a structurally different tree. */
		SEMANTIC_DIFFERENCE
	}

	private static final VerificationResult OK = new VerificationResult(Status.OK, null);

	private final Status status;
	private final String details;

	private VerificationResult(Status status, String details) {
		this.status = status;
		this.details = details;
	}

	public static VerificationResult ok() {
		return OK;
	}

	public static VerificationResult reparseFault(String details) {
		return new VerificationResult(Status.REPARSE_FAULT, details);
	}

	public static VerificationResult semanticDifference(String details) {
		return new VerificationResult(Status.SEMANTIC_DIFFERENCE, details);
	}

	public Status getStatus() {
		return status;
	}

	public boolean isOk() {
		return status == Status.OK;
	}

	/**
	 * The parser message for {@link Status#REPARSE_FAULT}, the first
	 * mismatch for {@link Status#SEMANTIC_DIFFERENCE}, {@code null} otherwise.
	 */
	public String getDetails() {
		return details;
	}

	@Override
	public String toString() {
		return details == null ? status.name() : status + ": " + details;
	}
}
