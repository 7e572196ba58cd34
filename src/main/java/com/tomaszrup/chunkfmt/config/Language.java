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
package com.tomaszrup.chunkfmt.config;

import java.util.Locale;

/**
 * Language variant of the document being formatted.
 */
public enum Language {
	C,
	CPP,
	CSHARP,
	D,
	JAVA,
	OBJC,
	VALA;

	/**
	 * Resolves a language by name or common alias ({@code "c++"}, {@code "cs"},
	 * {@code "c#"}, {@code "oc"}), case-insensitively.
	 *
	 * @return the language, or {@code null} when the name is not recognised
	 */
	public static Language fromName(String name) {
		if (name == null) {
			return null;
		}
		String key = name.trim().toLowerCase(Locale.ROOT);
		switch (key) {
			case "c++":
			case "cxx":
				return CPP;
			case "c#":
			case "cs":
				return CSHARP;
			case "oc":
			case "objective-c":
				return OBJC;
			default:
				break;
		}
		for (Language lang : values()) {
			if (lang.name().toLowerCase(Locale.ROOT).equals(key)) {
				return lang;
			}
		}
		return null;
	}
}
