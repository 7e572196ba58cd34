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
package com.tomaszrup.chunkfmt;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.chunkfmt.align.FuncCallAligner;
import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.config.FormatterOptions;
import com.tomaszrup.chunkfmt.lexer.ChunkLexer;
import com.tomaszrup.chunkfmt.parens.BoolParenInserter;
import com.tomaszrup.chunkfmt.render.ChunkRenderer;

/**
 * Runs the formatting passes in order: lex, add boolean parentheses, align
 * function call arguments, render.
 */
public class FormattingPipeline {
	private static final Logger logger = LoggerFactory.getLogger(FormattingPipeline.class);

	private final FormatterOptions options;

	public FormattingPipeline() {
		this(FormatterOptions.defaults());
	}

	public FormattingPipeline(FormatterOptions options) {
		this.options = Objects.requireNonNull(options, "options");
	}

	public FormatterOptions getOptions() {
		return options;
	}

	public String format(String source) {
		Objects.requireNonNull(source, "source");
		ChunkList chunks = new ChunkLexer(options.getInputTabSize()).lex(source);
		process(chunks);
		return ChunkRenderer.render(chunks, options.getInputTabSize(), options.isIndentWithTabs());
	}

	/**
	 * Runs the enabled passes on an already lexed list.
	 */
	public void process(ChunkList chunks) {
		Objects.requireNonNull(chunks, "chunks");
		long startTime = System.currentTimeMillis();
		int pairs = new BoolParenInserter(options).process(chunks);
		int groups = 0;
		if (options.isAlignSameFuncCallParams()) {
			groups = new FuncCallAligner(options).align(chunks);
		}
		logger.debug("Formatted {} chunk(s) in {}ms: {} paren pair(s) inserted, {} call group(s) aligned",
				chunks.size(), System.currentTimeMillis() - startTime, pairs, groups);
	}
}
