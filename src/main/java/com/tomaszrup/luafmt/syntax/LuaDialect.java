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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The language variants the parser can be asked to accept.
 */
public enum LuaDialect {
	LUA51(EnumSet.of(LanguageFeature.CORE)),
	LUA52(EnumSet.of(LanguageFeature.CORE, LanguageFeature.GOTO_LABELS)),
	LUAU(EnumSet.of(LanguageFeature.CORE, LanguageFeature.CONTINUE, LanguageFeature.COMPOUND_ASSIGNMENT,
			LanguageFeature.TYPE_ANNOTATIONS)),
	ALL(EnumSet.allOf(LanguageFeature.class));

	private final Set<LanguageFeature> features;

	LuaDialect(EnumSet<LanguageFeature> features) {
		this.features = Collections.unmodifiableSet(features);
	}

	public boolean supports(LanguageFeature feature) {
		return features.contains(feature);
	}

	public Set<LanguageFeature> getFeatures() {
		return features;
	}
}
