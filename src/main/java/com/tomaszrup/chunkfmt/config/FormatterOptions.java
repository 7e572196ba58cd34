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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, read-only settings consumed by the formatting passes.
 *
 * <p>Instances are created with {@link #builder()}; {@link #defaults()} gives
 * every option its default value.
 */
public final class FormatterOptions {

	public static final int DEFAULT_ALIGN_SPAN = 3;
	public static final int DEFAULT_ALIGN_THRESHOLD = 0;
	public static final int DEFAULT_INPUT_TAB_SIZE = 8;

	private static final FormatterOptions DEFAULTS = builder().build();

	private final boolean alignSameFuncCallParams;
	private final int alignSameFuncCallParamsSpan;
	private final int alignSameFuncCallParamsThresh;
	private final boolean alignNumberRight;
	private final boolean alignOnTabstop;
	private final boolean modFullParenIfBool;
	private final boolean modFullParenAssignBool;
	private final boolean modFullParenReturnBool;
	private final Language language;
	private final Set<Language> parenExcludedLanguages;
	private final int inputTabSize;
	private final boolean indentWithTabs;

	private FormatterOptions(Builder b) {
		this.alignSameFuncCallParams = b.alignSameFuncCallParams;
		this.alignSameFuncCallParamsSpan = b.alignSameFuncCallParamsSpan;
		this.alignSameFuncCallParamsThresh = b.alignSameFuncCallParamsThresh;
		this.alignNumberRight = b.alignNumberRight;
		this.alignOnTabstop = b.alignOnTabstop;
		this.modFullParenIfBool = b.modFullParenIfBool;
		this.modFullParenAssignBool = b.modFullParenAssignBool;
		this.modFullParenReturnBool = b.modFullParenReturnBool;
		this.language = b.language;
		this.parenExcludedLanguages = b.parenExcludedLanguages.isEmpty()
				? Collections.emptySet()
				: Collections.unmodifiableSet(EnumSet.copyOf(b.parenExcludedLanguages));
		this.inputTabSize = b.inputTabSize;
		this.indentWithTabs = b.indentWithTabs;
	}

	public static FormatterOptions defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.alignSameFuncCallParams(alignSameFuncCallParams)
				.alignSameFuncCallParamsSpan(alignSameFuncCallParamsSpan)
				.alignSameFuncCallParamsThresh(alignSameFuncCallParamsThresh)
				.alignNumberRight(alignNumberRight)
				.alignOnTabstop(alignOnTabstop)
				.modFullParenIfBool(modFullParenIfBool)
				.modFullParenAssignBool(modFullParenAssignBool)
				.modFullParenReturnBool(modFullParenReturnBool)
				.language(language)
				.parenExcludedLanguages(parenExcludedLanguages)
				.inputTabSize(inputTabSize)
				.indentWithTabs(indentWithTabs);
	}

	public boolean isAlignSameFuncCallParams() {
		return alignSameFuncCallParams;
	}

	/**
	 * Span for aligning call parameters. A configured value of zero or less
	 * falls back to {@link #DEFAULT_ALIGN_SPAN}.
	 */
	public int getAlignSameFuncCallParamsSpan() {
		return alignSameFuncCallParamsSpan > 0 ? alignSameFuncCallParamsSpan : DEFAULT_ALIGN_SPAN;
	}

	/** Column threshold for call parameters; 0 means unlimited. */
	public int getAlignSameFuncCallParamsThresh() {
		return alignSameFuncCallParamsThresh;
	}

	public boolean isAlignNumberRight() {
		return alignNumberRight;
	}

	public boolean isAlignOnTabstop() {
		return alignOnTabstop;
	}

	public boolean isModFullParenIfBool() {
		return modFullParenIfBool;
	}

	public boolean isModFullParenAssignBool() {
		return modFullParenAssignBool;
	}

	public boolean isModFullParenReturnBool() {
		return modFullParenReturnBool;
	}

	public Language getLanguage() {
		return language;
	}

	public Set<Language> getParenExcludedLanguages() {
		return parenExcludedLanguages;
	}

	/** True when the parenthesis passes must leave the document alone. */
	public boolean isParenTransformExcluded() {
		return parenExcludedLanguages.contains(language);
	}

	public int getInputTabSize() {
		return inputTabSize;
	}

	/**
	 * Whether leading indentation is written with tabs of
	 * {@link #getInputTabSize()} columns, padded with spaces.
	 */
	public boolean isIndentWithTabs() {
		return indentWithTabs;
	}

	@Override
	public String toString() {
		return "FormatterOptions{"
				+ "alignSameFuncCallParams=" + alignSameFuncCallParams
				+ ", span=" + getAlignSameFuncCallParamsSpan()
				+ ", thresh=" + alignSameFuncCallParamsThresh
				+ ", alignNumberRight=" + alignNumberRight
				+ ", alignOnTabstop=" + alignOnTabstop
				+ ", parenIf=" + modFullParenIfBool
				+ ", parenAssign=" + modFullParenAssignBool
				+ ", parenReturn=" + modFullParenReturnBool
				+ ", language=" + language
				+ ", parenExcluded=" + parenExcludedLanguages
				+ ", inputTabSize=" + inputTabSize
				+ ", indentWithTabs=" + indentWithTabs
				+ '}';
	}

	public static final class Builder {
		private boolean alignSameFuncCallParams;
		private int alignSameFuncCallParamsSpan = DEFAULT_ALIGN_SPAN;
		private int alignSameFuncCallParamsThresh = DEFAULT_ALIGN_THRESHOLD;
		private boolean alignNumberRight;
		private boolean alignOnTabstop;
		private boolean modFullParenIfBool;
		private boolean modFullParenAssignBool;
		private boolean modFullParenReturnBool;
		private Language language = Language.CPP;
		private Set<Language> parenExcludedLanguages = EnumSet.of(Language.CSHARP);
		private int inputTabSize = DEFAULT_INPUT_TAB_SIZE;
		private boolean indentWithTabs;

		private Builder() {
		}

		public Builder alignSameFuncCallParams(boolean value) {
			this.alignSameFuncCallParams = value;
			return this;
		}

		public Builder alignSameFuncCallParamsSpan(int value) {
			this.alignSameFuncCallParamsSpan = value;
			return this;
		}

		public Builder alignSameFuncCallParamsThresh(int value) {
			this.alignSameFuncCallParamsThresh = value;
			return this;
		}

		public Builder alignNumberRight(boolean value) {
			this.alignNumberRight = value;
			return this;
		}

		public Builder alignOnTabstop(boolean value) {
			this.alignOnTabstop = value;
			return this;
		}

		public Builder modFullParenIfBool(boolean value) {
			this.modFullParenIfBool = value;
			return this;
		}

		public Builder modFullParenAssignBool(boolean value) {
			this.modFullParenAssignBool = value;
			return this;
		}

		public Builder modFullParenReturnBool(boolean value) {
			this.modFullParenReturnBool = value;
			return this;
		}

		public Builder language(Language value) {
			this.language = Objects.requireNonNull(value, "language");
			return this;
		}

		public Builder parenExcludedLanguages(Set<Language> value) {
			this.parenExcludedLanguages = value.isEmpty()
					? EnumSet.noneOf(Language.class)
					: EnumSet.copyOf(value);
			return this;
		}

		public Builder inputTabSize(int value) {
			if (value <= 0) {
				throw new IllegalArgumentException("inputTabSize must be positive: " + value);
			}
			this.inputTabSize = value;
			return this;
		}

		public Builder indentWithTabs(boolean value) {
			this.indentWithTabs = value;
			return this;
		}

		public FormatterOptions build() {
			return new FormatterOptions(this);
		}
	}
}
