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
package com.tomaszrup.chunkfmt.align;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.chunkfmt.TestChunks;
import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.render.ChunkRenderer;

class AlignStackTests {
	private static final String ASSIGNMENTS = "a = 1;\nbb = 2;\nccc = 3;\n";

	private static void addRows(AlignStack stack, ChunkList chunks, String text, int rows) {
		for (int i = 0; i < rows; i++) {
			if (i > 0) {
				stack.newLines(1);
			}
			stack.add(TestChunks.find(chunks, text, i));
		}
	}

	@Test
	void testEndMovesRowsToLargestColumn() {
		ChunkList chunks = TestChunks.lex(ASSIGNMENTS);
		AlignStack stack = new AlignStack(chunks);
		stack.start(3, 0);
		addRows(stack, chunks, "=", 3);

		stack.end();

		Assertions.assertEquals("a   = 1;\nbb  = 2;\nccc = 3;\n", ChunkRenderer.render(chunks));
		Assertions.assertTrue(stack.pendingRows().isEmpty());
	}

	@Test
	void testFlushDiscardsPendingRows() {
		ChunkList chunks = TestChunks.lex(ASSIGNMENTS);
		AlignStack stack = new AlignStack(chunks);
		stack.start(3, 0);
		addRows(stack, chunks, "=", 3);

		stack.flush();
		stack.end();

		Assertions.assertEquals(ASSIGNMENTS, ChunkRenderer.render(chunks));
	}

	@Test
	void testSingleRowIsNotMoved() {
		ChunkList chunks = TestChunks.lex(ASSIGNMENTS);
		AlignStack stack = new AlignStack(chunks);
		stack.start(3, 0);
		stack.add(TestChunks.find(chunks, "=", 0));

		stack.end();

		Assertions.assertEquals(ASSIGNMENTS, ChunkRenderer.render(chunks));
	}

	@Test
	void testSpanExceededFinalizesEarlierRows() {
		ChunkList chunks = TestChunks.lex(ASSIGNMENTS);
		AlignStack stack = new AlignStack(chunks);
		stack.start(1, 0);
		stack.add(TestChunks.find(chunks, "=", 0));
		stack.newLines(1);
		stack.add(TestChunks.find(chunks, "=", 1));
		stack.newLines(3);
		stack.add(TestChunks.find(chunks, "=", 2));

		Assertions.assertEquals(1, stack.pendingRows().size(), "Span overflow should have finalized the first batch");
		stack.end();

		Assertions.assertEquals("a  = 1;\nbb = 2;\nccc = 3;\n", ChunkRenderer.render(chunks));
	}

	@Test
	void testThresholdEvictsDistantRow() {
		ChunkList chunks = TestChunks.lex("a = 1;\nbb = 2;\nxxxxxxxxx = 3;\n");
		AlignStack stack = new AlignStack(chunks);
		stack.start(3, 1);

		Assertions.assertTrue(stack.add(TestChunks.find(chunks, "=", 0)));
		Assertions.assertTrue(stack.add(TestChunks.find(chunks, "=", 1)));
		Assertions.assertFalse(stack.add(TestChunks.find(chunks, "=", 2)));
		Assertions.assertEquals(1, stack.getEvictedCount());
		stack.end();

		Assertions.assertEquals("a  = 1;\nbb = 2;\nxxxxxxxxx = 3;\n", ChunkRenderer.render(chunks));
	}

	@Test
	void testZeroThresholdIsUnlimited() {
		ChunkList chunks = TestChunks.lex("a = 1;\nxxxxxxxxx = 3;\n");
		AlignStack stack = new AlignStack(chunks);
		stack.start(3, 0);
		addRows(stack, chunks, "=", 2);
		stack.end();

		Assertions.assertEquals(0, stack.getEvictedCount());
		Assertions.assertEquals("a         = 1;\nxxxxxxxxx = 3;\n", ChunkRenderer.render(chunks));
	}

	@Test
	void testRightAlignLinesUpEndColumns() {
		ChunkList chunks = TestChunks.lex("a = 1;\nb = 100;\nc = 22;\n");
		AlignStack stack = new AlignStack(chunks);
		stack.start(3, 0);
		stack.setRightAlign(true);
		stack.add(TestChunks.find(chunks, "1"));
		stack.newLines(1);
		stack.add(TestChunks.find(chunks, "100"));
		stack.newLines(1);
		stack.add(TestChunks.find(chunks, "22"));
		stack.end();

		Assertions.assertEquals("a =   1;\nb = 100;\nc =  22;\n", ChunkRenderer.render(chunks));
	}

	@Test
	void testStartResetsState() {
		ChunkList chunks = TestChunks.lex(ASSIGNMENTS);
		AlignStack stack = new AlignStack(chunks);
		stack.start(3, 0);
		stack.setRightAlign(true);
		stack.add(TestChunks.find(chunks, "=", 0));

		stack.start(5, 2);

		Assertions.assertFalse(stack.isRightAlign());
		Assertions.assertTrue(stack.pendingRows().isEmpty());
		Assertions.assertEquals(5, stack.getSpanLimit());
		Assertions.assertEquals(2, stack.getThresholdLimit());
	}

	@Test
	void testAddBeforeStartFails() {
		ChunkList chunks = TestChunks.lex(ASSIGNMENTS);
		AlignStack stack = new AlignStack(chunks);
		Assertions.assertThrows(IllegalStateException.class, () -> stack.add(chunks.head()));
	}
}
