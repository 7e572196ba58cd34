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
package com.tomaszrup.chunkfmt.lexer;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.chunkfmt.TestChunks;
import com.tomaszrup.chunkfmt.chunk.Chunk;
import com.tomaszrup.chunkfmt.chunk.ChunkFlag;
import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.chunk.TokenType;
import com.tomaszrup.chunkfmt.render.ChunkRenderer;

class ChunkLexerTests {

	private static Chunk chunk(ChunkList chunks, String text) {
		return chunks.get(TestChunks.find(chunks, text));
	}

	// --- Calls and levels ---

	@Test
	void testFunctionCallArgumentsAreOneLevelDeeper() {
		ChunkList chunks = TestChunks.lex("foo(a, b);\n");

		Chunk foo = chunk(chunks, "foo");
		Chunk open = chunk(chunks, "(");
		Chunk a = chunk(chunks, "a");
		Chunk close = chunk(chunks, ")");

		Assertions.assertEquals(TokenType.FUNC_CALL, foo.getType());
		Assertions.assertTrue(foo.hasFlag(ChunkFlag.STMT_START));
		Assertions.assertEquals(TokenType.FPAREN_OPEN, open.getType());
		Assertions.assertEquals(0, open.getLevel());
		Assertions.assertEquals(1, a.getLevel());
		Assertions.assertTrue(a.hasFlag(ChunkFlag.IN_FCN_CALL));
		Assertions.assertEquals(TokenType.FPAREN_CLOSE, close.getType());
		Assertions.assertEquals(0, close.getLevel());
		Assertions.assertFalse(close.hasFlag(ChunkFlag.IN_FCN_CALL));
		Assertions.assertEquals(5, a.getColumn());
		Assertions.assertEquals(8, chunk(chunks, "b").getColumn());
	}

	@Test
	void testFunctionDefinitionIsNotACall() {
		ChunkList chunks = TestChunks.lex("void foo(int a) {\n    bar(1);\n}\n");

		Assertions.assertEquals(TokenType.FUNC_DEF, chunk(chunks, "foo").getType());
		Assertions.assertFalse(chunk(chunks, "a").hasFlag(ChunkFlag.IN_FCN_CALL));

		Chunk bar = chunk(chunks, "bar");
		Assertions.assertEquals(TokenType.FUNC_CALL, bar.getType());
		Assertions.assertEquals(1, bar.getBraceLevel());
		Assertions.assertEquals(1, bar.getLevel());
		Assertions.assertEquals(0, chunk(chunks, "}").getBraceLevel());
	}

	@Test
	void testWordBeforeDoubleColonIsAType() {
		ChunkList chunks = TestChunks.lex("Ns::foo(1);");

		Assertions.assertEquals(TokenType.TYPE, chunk(chunks, "Ns").getType());
		Assertions.assertEquals(TokenType.DC_MEMBER, chunk(chunks, "::").getType());
		Assertions.assertEquals(TokenType.FUNC_CALL, chunk(chunks, "foo").getType());
	}

	// --- Statements ---

	@Test
	void testStatementParenthesesOfIf() {
		ChunkList chunks = TestChunks.lex("if (a == 1) x = 2;");

		Chunk open = chunk(chunks, "(");
		Chunk close = chunk(chunks, ")");
		Assertions.assertEquals(TokenType.SPAREN_OPEN, open.getType());
		Assertions.assertEquals(TokenType.IF, open.getParentType());
		Assertions.assertEquals(TokenType.SPAREN_CLOSE, close.getType());
		Assertions.assertEquals(TokenType.IF, close.getParentType());
		Assertions.assertTrue(chunk(chunks, "a").hasFlag(ChunkFlag.IN_SPAREN));
		Assertions.assertEquals(TokenType.COMPARE, chunk(chunks, "==").getType());
		Assertions.assertTrue(chunk(chunks, "x").hasFlag(ChunkFlag.STMT_START));
		Assertions.assertEquals(TokenType.ASSIGN, chunk(chunks, "=").getType());
	}

	@Test
	void testElseIfAndWhile() {
		ChunkList chunks = TestChunks.lex("if (a) x(); else if (b) y();\nwhile (c) z();");

		Assertions.assertEquals(TokenType.IF, chunk(chunks, "if").getType());
		Assertions.assertEquals(TokenType.ELSEIF, chunks.get(TestChunks.find(chunks, "if", 1)).getType());
		Assertions.assertEquals(TokenType.ELSEIF, chunks.get(TestChunks.find(chunks, "(", 2)).getParentType());
		Chunk whileOpen = chunks.get(chunks.next(TestChunks.find(chunks, "while")));
		Assertions.assertEquals(TokenType.SPAREN_OPEN, whileOpen.getType());
		Assertions.assertEquals(TokenType.WHILE, whileOpen.getParentType());
	}

	@Test
	void testTernaryColonAndSigns() {
		ChunkList chunks = TestChunks.lex("x = a ? -1 : b - 2;");

		Assertions.assertEquals(TokenType.QUESTION, chunk(chunks, "?").getType());
		Assertions.assertEquals(TokenType.COND_COLON, chunk(chunks, ":").getType());
		Assertions.assertEquals(TokenType.NEG, chunks.get(TestChunks.find(chunks, "-", 0)).getType());
		Assertions.assertEquals(TokenType.ARITH, chunks.get(TestChunks.find(chunks, "-", 1)).getType());
	}

	@Test
	void testNumberKinds() {
		ChunkList chunks = TestChunks.lex("f(1, 1.5, 0x1E, 1e5);");

		Assertions.assertEquals(TokenType.NUMBER, chunk(chunks, "1").getType());
		Assertions.assertEquals(TokenType.NUMBER_FP, chunk(chunks, "1.5").getType());
		Assertions.assertEquals(TokenType.NUMBER, chunk(chunks, "0x1E").getType());
		Assertions.assertEquals(TokenType.NUMBER_FP, chunk(chunks, "1e5").getType());
	}

	// --- Preprocessor ---

	@Test
	void testDirectiveLineIsFlagged() {
		ChunkList chunks = TestChunks.lex("#define X(a) (a + 1)\nint y;\n");

		Chunk define = chunk(chunks, "#define");
		Assertions.assertEquals(TokenType.PREPROC, define.getType());
		Assertions.assertTrue(define.hasFlag(ChunkFlag.IN_PREPROC));
		Assertions.assertTrue(chunk(chunks, "X").hasFlag(ChunkFlag.IN_PREPROC));
		Assertions.assertTrue(chunk(chunks, "+").hasFlag(ChunkFlag.IN_PREPROC));
		Assertions.assertFalse(chunks.get(chunks.next(TestChunks.find(chunks, ")", 1))).isPreproc(),
				"The newline ending a directive belongs to the code");
		Assertions.assertFalse(chunk(chunks, "int").hasFlag(ChunkFlag.IN_PREPROC));
	}

	@Test
	void testBackslashContinuationStaysInDirective() {
		ChunkList chunks = TestChunks.lex("#define M \\\n  foo\nbar;\n");

		Assertions.assertTrue(chunk(chunks, "\\").isPreproc());
		Assertions.assertTrue(chunk(chunks, "foo").isPreproc());
		Assertions.assertEquals(2, chunk(chunks, "foo").getOrigLine());
		Assertions.assertFalse(chunk(chunks, "bar").isPreproc());
	}

	@Test
	void testConditionalDirectivesTrackNesting() {
		ChunkList chunks = TestChunks.lex("#if A\nx = 1;\n#endif\ny = 2;\n");

		Assertions.assertEquals(0, chunk(chunks, "#if").getPpLevel());
		Assertions.assertEquals(1, chunk(chunks, "x").getPpLevel());
		Assertions.assertEquals(0, chunk(chunks, "#endif").getPpLevel());
		Assertions.assertEquals(0, chunk(chunks, "y").getPpLevel());
	}

	// --- Positions ---

	@Test
	void testConsecutiveNewlinesAreMerged() {
		ChunkList chunks = TestChunks.lex("a;\n\n\nb;");

		Chunk newline = chunks.get(chunks.next(TestChunks.find(chunks, ";")));
		Assertions.assertTrue(newline.isNewline());
		Assertions.assertEquals(3, newline.getNlCount());
		Assertions.assertEquals(4, chunk(chunks, "b").getOrigLine());
	}

	@Test
	void testTabsExpandWithInputTabSize() {
		Assertions.assertEquals(9, chunk(new ChunkLexer().lex("\tfoo();"), "foo").getColumn());
		Assertions.assertEquals(5, chunk(new ChunkLexer(4).lex("\tfoo();"), "foo").getColumn());
		Assertions.assertEquals(5, chunk(new ChunkLexer(4).lex("ab\tfoo();"), "foo").getColumn());
		Assertions.assertThrows(IllegalArgumentException.class, () -> new ChunkLexer(0));
	}

	@Test
	void testCrLfIsNormalized() {
		ChunkList chunks = TestChunks.lex("a;\r\nb;\r\n");
		Assertions.assertEquals(2, chunk(chunks, "b").getOrigLine());
		Assertions.assertEquals("a;\nb;\n", ChunkRenderer.render(chunks));
	}

	@Test
	void testRenderingUnmodifiedStreamReproducesSource() {
		String source = "#include <stdio.h>\n"
				+ "/* header\n"
				+ " * comment */\n"
				+ "int main(void) {\n"
				+ "    if (a == 1 || b > 2) {\n"
				+ "        foo(1, \"x, y\");   // note\n"
				+ "    }\n"
				+ "\n"
				+ "    return x ? y : -1;\n"
				+ "}\n";
		Assertions.assertEquals(source, ChunkRenderer.render(TestChunks.lex(source)));
	}

	@Test
	void testUnbalancedCloserIsTolerated() {
		ChunkList chunks = TestChunks.lex("a);\nb(1);");

		Chunk close = chunk(chunks, ")");
		Assertions.assertEquals(TokenType.PAREN_CLOSE, close.getType());
		Assertions.assertEquals(0, close.getLevel());
		Assertions.assertEquals(TokenType.FUNC_CALL, chunk(chunks, "b").getType());
		Assertions.assertEquals(1, chunk(chunks, "1").getLevel());
	}
}
