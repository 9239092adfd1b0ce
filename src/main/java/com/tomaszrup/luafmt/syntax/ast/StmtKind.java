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
package com.tomaszrup.luafmt.syntax.ast;

import com.tomaszrup.luafmt.syntax.LanguageFeature;

/**
 * The closed set of statement kinds. Dialect-specific kinds name the
 * {@link LanguageFeature} that gates them.
 */
public enum StmtKind {
	ASSIGNMENT(LanguageFeature.CORE),
	LOCAL_ASSIGNMENT(LanguageFeature.CORE),
	FUNCTION_CALL(LanguageFeature.CORE),
	DO(LanguageFeature.CORE),
	WHILE(LanguageFeature.CORE),
	REPEAT(LanguageFeature.CORE),
	IF(LanguageFeature.CORE),
	NUMERIC_FOR(LanguageFeature.CORE),
	GENERIC_FOR(LanguageFeature.CORE),
	FUNCTION_DECLARATION(LanguageFeature.CORE),
	LOCAL_FUNCTION(LanguageFeature.CORE),
	RETURN(LanguageFeature.CORE),
	BREAK(LanguageFeature.CORE),
	GOTO(LanguageFeature.GOTO_LABELS),
	LABEL(LanguageFeature.GOTO_LABELS),
	CONTINUE(LanguageFeature.CONTINUE),
	COMPOUND_ASSIGNMENT(LanguageFeature.COMPOUND_ASSIGNMENT),
	TYPE_DECLARATION(LanguageFeature.TYPE_ANNOTATIONS);

	private final LanguageFeature feature;

	StmtKind(LanguageFeature feature) {
		this.feature = feature;
	}

	public LanguageFeature getFeature() {
		return feature;
	}
}
