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

/**
 * Thrown when a configuration document contains an unknown key or a value
 * of the wrong type.
 */
public class ConfigException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String key;

	public ConfigException(String key, String message) {
		super("Invalid configuration option '" + key + "': " + message);
		this.key = key;
	}

	public ConfigException(String message, Throwable cause) {
		super(message, cause);
		this.key = null;
	}

	/** The offending option, or {@code null} when the document itself is malformed. */
	public String getKey() {
		return key;
	}
}
