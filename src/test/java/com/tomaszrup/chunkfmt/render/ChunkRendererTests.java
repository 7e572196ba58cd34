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
package com.tomaszrup.chunkfmt.render;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.chunkfmt.TestChunks;
import com.tomaszrup.chunkfmt.chunk.Chunk;
import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.chunk.TokenType;

class ChunkRendererTests {

	private static Chunk at(TokenType type, String text, int column) {
		Chunk c = new Chunk(type, text);
		c.setColumn(column);
		return c;
	}

	private static Chunk newline(int count) {
		Chunk c = new Chunk(TokenType.NEWLINE, "\n");
		c.setNlCount(count);
		return c;
	}

	@Test
	void testPadsToRenderColumn() {
		ChunkList chunks = new ChunkList();
		chunks.append(at(TokenType.WORD, "a", 1));
		chunks.append(at(TokenType.WORD, "b", 5));
		Assertions.assertEquals("a   b", ChunkRenderer.render(chunks));
	}

	@Test
	void testNeverOverlapsPreviousChunk() {
		ChunkList chunks = new ChunkList();
		chunks.append(at(TokenType.WORD, "abc", 1));
		chunks.append(at(TokenType.WORD, "d", 2));
		Assertions.assertEquals("abcd", ChunkRenderer.render(chunks));
	}

	@Test
	void testNewlineEmitsItsCount() {
		ChunkList chunks = new ChunkList();
		chunks.append(at(TokenType.WORD, "a", 1));
		chunks.append(newline(2));
		chunks.append(at(TokenType.WORD, "b", 3));
		Assertions.assertEquals("a\n\n  b", ChunkRenderer.render(chunks));
	}

	@Test
	void testStripsTrailingBlanks() {
		ChunkList chunks = new ChunkList();
		chunks.append(at(TokenType.COMMENT, "// x  ", 1));
		chunks.append(newline(1));
		chunks.append(at(TokenType.STRING, "\"a\"  ", 1));
		Assertions.assertEquals("// x\n\"a\"", ChunkRenderer.render(chunks));
	}

	@Test
	void testIndentsWithTabsOnlyAtLineStart() {
		ChunkList chunks = new ChunkList();
		chunks.append(at(TokenType.WORD, "a", 11));
		chunks.append(at(TokenType.WORD, "b", 17));
		chunks.append(newline(1));
		chunks.append(at(TokenType.WORD, "c", 3));
		Assertions.assertEquals("\t\t  a     b\n  c", ChunkRenderer.render(chunks, 4, true));
		Assertions.assertEquals("          a     b\n  c", ChunkRenderer.render(chunks, 4, false));
	}

	@Test
	void testRendersMovedColumns() {
		ChunkList chunks = TestChunks.lex("foo(1, 2);\n");
		for (int id = TestChunks.find(chunks, "1"); id != ChunkList.NONE; id = chunks.next(id)) {
			Chunk c = chunks.get(id);
			c.setColumn(c.getColumn() + 2);
		}
		Assertions.assertEquals("foo(  1, 2);\n", ChunkRenderer.render(chunks));
	}
}
