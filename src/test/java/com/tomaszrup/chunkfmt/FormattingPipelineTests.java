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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.config.FormatterOptions;
import com.tomaszrup.chunkfmt.config.Language;
import com.tomaszrup.chunkfmt.render.ChunkRenderer;

class FormattingPipelineTests {
	private static final String SOURCE = "void f() {\n"
			+ "    if (a == 1 || b > 2) {\n"
			+ "        set(1, x == y);\n"
			+ "        set(22, z);\n"
			+ "    }\n"
			+ "    return a && b != 0;\n"
			+ "}\n";

	@Test
	void testDefaultsLeaveSourceUnchanged() {
		Assertions.assertEquals(SOURCE, new FormattingPipeline().format(SOURCE));
	}

	@Test
	void testRunsParensThenAlignment() {
		FormatterOptions options = FormatterOptions.builder()
				.alignSameFuncCallParams(true)
				.modFullParenIfBool(true)
				.modFullParenReturnBool(true)
				.build();

		String formatted = new FormattingPipeline(options).format(SOURCE);

		Assertions.assertEquals("void f() {\n"
				+ "    if ((a == 1) || (b > 2)) {\n"
				+ "        set( 1, x == y);\n"
				+ "        set(22, z);\n"
				+ "    }\n"
				+ "    return a && (b != 0);\n"
				+ "}\n", formatted);
	}

	@Test
	void testFormattingIsStable() {
		FormatterOptions options = FormatterOptions.builder()
				.alignSameFuncCallParams(true)
				.modFullParenIfBool(true)
				.modFullParenAssignBool(true)
				.modFullParenReturnBool(true)
				.build();
		FormattingPipeline pipeline = new FormattingPipeline(options);

		String once = pipeline.format(SOURCE);

		Assertions.assertEquals(once, pipeline.format(once));
	}

	@Test
	void testExcludedLanguageStillAligns() {
		FormatterOptions options = FormatterOptions.builder()
				.language(Language.CSHARP)
				.alignSameFuncCallParams(true)
				.modFullParenIfBool(true)
				.build();

		String formatted = new FormattingPipeline(options).format(SOURCE);

		Assertions.assertTrue(formatted.contains("if (a == 1 || b > 2)"), formatted);
		Assertions.assertTrue(formatted.contains("set( 1, x == y);"), formatted);
	}

	@Test
	void testProcessWorksOnLexedList() {
		FormatterOptions options = FormatterOptions.builder().modFullParenIfBool(true).build();
		ChunkList chunks = TestChunks.lex("if (a && b == 1) x();");

		new FormattingPipeline(options).process(chunks);

		Assertions.assertEquals("if (a && (b == 1)) x();", ChunkRenderer.render(chunks));
	}

	@Test
	void testRejectsNullArguments() {
		Assertions.assertThrows(NullPointerException.class, () -> new FormattingPipeline(null));
		Assertions.assertThrows(NullPointerException.class, () -> new FormattingPipeline().format(null));
	}
}
