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

import java.util.Objects;

/**
 * Inclusive offsets bounding the statements that may be reformatted. A
 * {@code null} bound leaves that side open.
 *
 * <p>Offsets count UTF-16 code units, i.e. they are {@code char} indices into
 * the source {@code String}, not byte offsets into its encoded form. Outside
 * the Basic Multilingual Plane a code point takes two units.</p>
 */
public final class FormatRange {

	private final Integer start;
	private final Integer end;

	public FormatRange(Integer start, Integer end) {
		if (start != null && end != null && start > end) {
			throw new IllegalArgumentException("range start " + start + " is after range end " + end);
		}
		this.start = start;
		this.end = end;
	}

	public static FormatRange from(int start, int end) {
		return new FormatRange(start, end);
	}

	public Integer getStart() {
		return start;
	}

	public Integer getEnd() {
		return end;
	}

	/**
	 * Whether text spanning {@code [startOffset, endOffset)} lies entirely
	 * within this range.
	 */
	public boolean covers(int startOffset, int endOffset) {
		if (start != null && startOffset < start) {
			return false;
		}
		return end == null || endOffset - 1 <= end;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FormatRange)) {
			return false;
		}
		FormatRange other = (FormatRange) o;
		return Objects.equals(start, other.start) && Objects.equals(end, other.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end);
	}

	@Override
	public String toString() {
		return "FormatRange[" + start + ".." + end + "]";
	}
}
