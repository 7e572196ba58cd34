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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.chunkfmt.chunk.Chunk;
import com.tomaszrup.chunkfmt.chunk.ChunkFlag;
import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.chunk.TokenType;
import com.tomaszrup.chunkfmt.config.FormatterOptions;

/**
 * Turns C-family source text into an annotated {@link ChunkList}.
 *
 * <p>Works in two phases:
 * <ol>
 *   <li>a character-level scanner that cuts the text into chunks and records
 *       positions, preprocessor membership and preprocessor nesting;</li>
 *   <li>a structure pass that computes bracket levels and classifies the
 *       chunks the formatting passes care about (statement parentheses,
 *       function calls, type qualifiers, ternary colons, numeric signs,
 *       statement starts).</li>
 * </ol>
 *
 * <p>This is not a parser. Input it does not understand is still cut into
 * chunks; unbalanced closers simply leave the levels unchanged.
 */
public class ChunkLexer {
	private static final Logger logger = LoggerFactory.getLogger(ChunkLexer.class);

	private static final Map<String, TokenType> KEYWORDS = Map.of(
			"if", TokenType.IF,
			"else", TokenType.ELSE,
			"switch", TokenType.SWITCH,
			"while", TokenType.WHILE,
			"for", TokenType.FOR,
			"do", TokenType.DO,
			"return", TokenType.RETURN);

	private static final Set<String> TYPE_KEYWORDS = Set.of(
			"void", "char", "short", "int", "long", "float", "double", "bool", "boolean",
			"signed", "unsigned", "auto", "const", "static", "struct", "enum", "class",
			"byte", "string", "var");

	// longest first
	private static final String[] OPERATORS = {
			"<<=", ">>=",
			"->", "::", "==", "!=", "<=", ">=", "&&", "||", "++", "--",
			"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<", ">>"
	};

	private final int tabSize;

	public ChunkLexer() {
		this(FormatterOptions.DEFAULT_INPUT_TAB_SIZE);
	}

	public ChunkLexer(int tabSize) {
		if (tabSize <= 0) {
			throw new IllegalArgumentException("tabSize must be positive: " + tabSize);
		}
		this.tabSize = tabSize;
	}

	public ChunkList lex(String source) {
		String text = source.replace("\r\n", "\n").replace("\r", "\n");
		ChunkList list = new ChunkList();
		new Scanner(text, list).run();
		annotateStructure(list);
		logger.debug("Lexed {} chunk(s) from {} character(s)", list.size(), text.length());
		return list;
	}

	// ------------------------------------------------------------------
	// Phase 1: character scanner
	// ------------------------------------------------------------------

	private final class Scanner {
		private final String text;
		private final ChunkList list;
		private int pos;
		private int line = 1;
		private int col = 1;
		private boolean atLineStart = true;
		private boolean inPreproc;
		private int ppLevel;
		private int pendingPpDelta;

		private Scanner(String text, ChunkList list) {
			this.text = text;
			this.list = list;
		}

		private void run() {
			while (pos < text.length()) {
				char c = text.charAt(pos);
				if (c == '\n') {
					scanNewline();
				} else if (c == ' ' || c == '\t' || c == '\f') {
					col = c == '\t' ? nextTabStop(col) : col + 1;
					pos++;
				} else if (inPreproc && c == '\\' && peek(1) == '\n') {
					scanContinuation();
				} else if (c == '#' && atLineStart) {
					scanDirective();
				} else {
					atLineStart = false;
					scanToken(c);
				}
			}
		}

		private void scanToken(char c) {
			int start = pos;
			if (c == '/' && peek(1) == '/') {
				while (pos < text.length() && text.charAt(pos) != '\n') {
					pos++;
				}
				emit(TokenType.COMMENT, start);
			} else if (c == '/' && peek(1) == '*') {
				int close = text.indexOf("*/", pos + 2);
				pos = close < 0 ? text.length() : close + 2;
				emit(TokenType.COMMENT, start);
			} else if (c == '"' || c == '\'') {
				scanString(c);
				emit(TokenType.STRING, start);
			} else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
				emit(scanNumber(), start);
			} else if (Character.isJavaIdentifierStart(c)) {
				while (pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos))) {
					pos++;
				}
				emit(classifyWord(text.substring(start, pos)), start);
			} else {
				emit(scanOperator(c), start);
			}
		}

		private void scanNewline() {
			int count = 0;
			int p = pos;
			int afterLastNewline = pos;
			while (p < text.length()) {
				char ch = text.charAt(p);
				if (ch == '\n') {
					count++;
					p++;
					afterLastNewline = p;
				} else if (ch == ' ' || ch == '\t' || ch == '\f') {
					p++;
				} else {
					break;
				}
			}
			if (inPreproc) {
				inPreproc = false;
				ppLevel = Math.max(0, ppLevel + pendingPpDelta);
				pendingPpDelta = 0;
			}
			Chunk nl = newChunk(TokenType.NEWLINE, "\n", col, col + 1);
			nl.setNlCount(count);
			list.append(nl);
			pos = afterLastNewline;
			line += count;
			col = 1;
			atLineStart = true;
		}

		private void scanContinuation() {
			pos++;
			emit(TokenType.OTHER, pos - 1);
			Chunk nl = newChunk(TokenType.NEWLINE, "\n", col, col + 1);
			nl.setNlCount(1);
			list.append(nl);
			pos++;
			line++;
			col = 1;
		}

		private void scanDirective() {
			int start = pos;
			pos++;
			while (pos < text.length() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
				pos++;
			}
			int nameStart = pos;
			while (pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos))) {
				pos++;
			}
			String directive = text.substring(nameStart, pos);
			if (directive.startsWith("if")) {
				pendingPpDelta = 1;
			} else if (directive.equals("endif")) {
				ppLevel = Math.max(0, ppLevel - 1);
			}
			inPreproc = true;
			atLineStart = false;
			emit(TokenType.PREPROC, start);
		}

		private void scanString(char quote) {
			pos++;
			while (pos < text.length()) {
				char ch = text.charAt(pos);
				if (ch == '\\') {
					pos += 2;
				} else if (ch == quote) {
					pos++;
					return;
				} else if (ch == '\n') {
					return;
				} else {
					pos++;
				}
			}
			pos = Math.min(pos, text.length());
		}

		private TokenType scanNumber() {
			int start = pos;
			boolean hex = text.startsWith("0x", pos) || text.startsWith("0X", pos);
			while (pos < text.length()) {
				char ch = text.charAt(pos);
				if (Character.isLetterOrDigit(ch) || ch == '.' || ch == '_') {
					pos++;
				} else if ((ch == '+' || ch == '-') && !hex && pos > start
						&& (text.charAt(pos - 1) == 'e' || text.charAt(pos - 1) == 'E')) {
					pos++;
				} else {
					break;
				}
			}
			String number = text.substring(start, pos);
			boolean fp = number.indexOf('.') >= 0
					|| (!hex && (number.indexOf('e') >= 0 || number.indexOf('E') >= 0));
			return fp ? TokenType.NUMBER_FP : TokenType.NUMBER;
		}

		private TokenType scanOperator(char c) {
			for (String op : OPERATORS) {
				if (text.startsWith(op, pos)) {
					pos += op.length();
					return classifyOperator(op);
				}
			}
			pos++;
			return classifyOperator(String.valueOf(c));
		}

		private void emit(TokenType type, int start) {
			String value = text.substring(start, pos);
			int startCol = col;
			int nl = value.lastIndexOf('\n');
			int endCol;
			if (nl < 0) {
				endCol = startCol + value.length();
			} else {
				endCol = 1 + value.length() - nl - 1;
			}
			Chunk chunk = newChunk(type, value, startCol, endCol);
			list.append(chunk);
			if (nl >= 0) {
				line += countNewlines(value);
			}
			col = endCol;
		}

		private Chunk newChunk(TokenType type, String value, int startCol, int endCol) {
			Chunk chunk = new Chunk(type, value);
			chunk.setOrigLine(line);
			chunk.setOrigCol(startCol);
			chunk.setOrigColEnd(endCol);
			chunk.setColumn(startCol);
			chunk.setPpLevel(ppLevel);
			if (inPreproc) {
				chunk.addFlag(ChunkFlag.IN_PREPROC);
			}
			return chunk;
		}

		private char peek(int offset) {
			int p = pos + offset;
			return p < text.length() ? text.charAt(p) : 0;
		}
	}

	private int nextTabStop(int col) {
		return ((col - 1) / tabSize + 1) * tabSize + 1;
	}

	private static int countNewlines(String value) {
		int n = 0;
		for (int i = 0; i < value.length(); i++) {
			if (value.charAt(i) == '\n') {
				n++;
			}
		}
		return n;
	}

	private static TokenType classifyWord(String word) {
		TokenType keyword = KEYWORDS.get(word);
		if (keyword != null) {
			return keyword;
		}
		return TYPE_KEYWORDS.contains(word) ? TokenType.TYPE : TokenType.WORD;
	}

	static TokenType classifyOperator(String op) {
		switch (op) {
			case "==":
			case "!=":
			case "<=":
			case ">=":
			case "<":
			case ">":
				return TokenType.COMPARE;
			case "&&":
			case "||":
				return TokenType.BOOL;
			case "->":
			case ".":
				return TokenType.MEMBER;
			case "::":
				return TokenType.DC_MEMBER;
			case "++":
			case "--":
				return TokenType.INCDEC;
			case "=":
			case "+=":
			case "-=":
			case "*=":
			case "/=":
			case "%=":
			case "&=":
			case "|=":
			case "^=":
			case "<<=":
			case ">>=":
				return TokenType.ASSIGN;
			case "(":
				return TokenType.PAREN_OPEN;
			case ")":
				return TokenType.PAREN_CLOSE;
			case "{":
				return TokenType.BRACE_OPEN;
			case "}":
				return TokenType.BRACE_CLOSE;
			case "[":
				return TokenType.SQUARE_OPEN;
			case "]":
				return TokenType.SQUARE_CLOSE;
			case ",":
				return TokenType.COMMA;
			case ";":
				return TokenType.SEMICOLON;
			case "?":
				return TokenType.QUESTION;
			case ":":
				return TokenType.COLON;
			case "!":
				return TokenType.NOT;
			case "+":
			case "-":
			case "*":
			case "/":
			case "%":
			case "&":
			case "|":
			case "^":
			case "~":
			case "<<":
			case ">>":
				return TokenType.ARITH;
			default:
				return TokenType.OTHER;
		}
	}

	// ------------------------------------------------------------------
	// Phase 2: structure
	// ------------------------------------------------------------------

	private static final Set<ChunkFlag> FRAME_FLAGS = EnumSet.of(ChunkFlag.IN_SPAREN, ChunkFlag.IN_FCN_CALL);

	private static final class Frame {
		private final TokenType rawClose;
		private final TokenType closeType;
		private final TokenType parentType;
		private final Set<ChunkFlag> innerFlags;
		private final int openLevel;
		private final int openBraceLevel;

		private Frame(TokenType rawClose, TokenType closeType, TokenType parentType,
				Set<ChunkFlag> innerFlags, int openLevel, int openBraceLevel) {
			this.rawClose = rawClose;
			this.closeType = closeType;
			this.parentType = parentType;
			this.innerFlags = innerFlags;
			this.openLevel = openLevel;
			this.openBraceLevel = openBraceLevel;
		}
	}

	private static final class StructureState {
		private final Deque<Frame> frames = new ArrayDeque<>();
		private final Deque<Integer> questionLevels = new ArrayDeque<>();
		private int level;
		private int braceLevel;
		private int prevSig = ChunkList.NONE;
		private int prevPrevSig = ChunkList.NONE;
		private TokenType pendingSparen = TokenType.NONE;
		private boolean stmtStart = true;
	}

	private void annotateStructure(ChunkList list) {
		StructureState st = new StructureState();
		for (int id = list.head(); id != ChunkList.NONE; id = list.next(id)) {
			Chunk c = list.get(id);
			c.setLevel(st.level);
			c.setBraceLevel(st.braceLevel);
			inheritFrameFlags(c, st);
			if (c.isNewline() || c.isComment() || c.isPreproc()) {
				continue;
			}

			TokenType sparenOwner = st.pendingSparen;
			st.pendingSparen = TokenType.NONE;
			if (st.stmtStart) {
				c.addFlag(ChunkFlag.STMT_START);
				st.stmtStart = false;
			}

			annotateSignificant(list, c, sparenOwner, st);

			st.prevPrevSig = st.prevSig;
			st.prevSig = id;
		}
		if (!st.frames.isEmpty()) {
			logger.debug("{} bracket(s) left open at end of input", st.frames.size());
		}
	}

	private void annotateSignificant(ChunkList list, Chunk c, TokenType sparenOwner, StructureState st) {
		Chunk prev = st.prevSig == ChunkList.NONE ? null : list.get(st.prevSig);
		switch (c.getType()) {
			case IF:
				if (prev != null && prev.is(TokenType.ELSE)) {
					c.setType(TokenType.ELSEIF);
				}
				st.pendingSparen = c.getType();
				break;
			case WHILE:
			case FOR:
			case SWITCH:
				st.pendingSparen = c.getType();
				break;
			case ELSE:
			case DO:
				st.stmtStart = true;
				break;
			case DC_MEMBER:
				if (prev != null && prev.is(TokenType.WORD)) {
					prev.setType(TokenType.TYPE);
				}
				break;
			case PAREN_OPEN:
				openParen(list, c, sparenOwner, st);
				break;
			case BRACE_OPEN:
				open(c, TokenType.BRACE_CLOSE, TokenType.BRACE_CLOSE, TokenType.NONE, EnumSet.noneOf(ChunkFlag.class), st);
				st.stmtStart = true;
				break;
			case SQUARE_OPEN:
				open(c, TokenType.SQUARE_CLOSE, TokenType.SQUARE_CLOSE, TokenType.NONE, EnumSet.noneOf(ChunkFlag.class), st);
				break;
			case PAREN_CLOSE:
			case BRACE_CLOSE:
			case SQUARE_CLOSE:
				close(c, st);
				break;
			case SEMICOLON:
				if (st.frames.isEmpty() || st.frames.peek().rawClose == TokenType.BRACE_CLOSE) {
					st.stmtStart = true;
				}
				break;
			case QUESTION:
				st.questionLevels.push(st.level);
				break;
			case COLON:
				if (!st.questionLevels.isEmpty() && st.questionLevels.peek() == st.level) {
					st.questionLevels.pop();
					c.setType(TokenType.COND_COLON);
				}
				break;
			case ARITH:
				markSign(list, c, prev);
				break;
			default:
				break;
		}
	}

	private void openParen(ChunkList list, Chunk c, TokenType sparenOwner, StructureState st) {
		if (sparenOwner != TokenType.NONE) {
			c.setType(TokenType.SPAREN_OPEN);
			c.setParentType(sparenOwner);
			open(c, TokenType.PAREN_CLOSE, TokenType.SPAREN_CLOSE, sparenOwner, EnumSet.of(ChunkFlag.IN_SPAREN), st);
			return;
		}
		Chunk prev = st.prevSig == ChunkList.NONE ? null : list.get(st.prevSig);
		if (prev != null && prev.is(TokenType.WORD)) {
			Chunk prevPrev = st.prevPrevSig == ChunkList.NONE ? null : list.get(st.prevPrevSig);
			boolean definition = prevPrev != null
					&& (prevPrev.is(TokenType.TYPE) || prevPrev.is(TokenType.WORD));
			TokenType owner = definition ? TokenType.FUNC_DEF : TokenType.FUNC_CALL;
			prev.setType(owner);
			c.setType(TokenType.FPAREN_OPEN);
			c.setParentType(owner);
			Set<ChunkFlag> inner = definition ? EnumSet.noneOf(ChunkFlag.class) : EnumSet.of(ChunkFlag.IN_FCN_CALL);
			open(c, TokenType.PAREN_CLOSE, TokenType.FPAREN_CLOSE, owner, inner, st);
			return;
		}
		open(c, TokenType.PAREN_CLOSE, TokenType.PAREN_CLOSE, TokenType.NONE, EnumSet.noneOf(ChunkFlag.class), st);
	}

	private void open(Chunk c, TokenType rawClose, TokenType closeType, TokenType parentType,
			Set<ChunkFlag> innerFlags, StructureState st) {
		st.frames.push(new Frame(rawClose, closeType, parentType, innerFlags, st.level, st.braceLevel));
		st.level++;
		if (rawClose == TokenType.BRACE_CLOSE) {
			st.braceLevel++;
		}
	}

	private void close(Chunk c, StructureState st) {
		Frame match = null;
		for (Frame f : st.frames) {
			if (f.rawClose == c.getType()) {
				match = f;
				break;
			}
		}
		if (match == null) {
			logger.debug("Unbalanced '{}' at line {}, col {}", c.getText(), c.getOrigLine(), c.getOrigCol());
			return;
		}
		Frame popped;
		do {
			popped = st.frames.pop();
		} while (popped != match);

		st.level = match.openLevel;
		st.braceLevel = match.openBraceLevel;
		c.setLevel(st.level);
		c.setBraceLevel(st.braceLevel);
		c.setType(match.closeType);
		c.setParentType(match.parentType);
		c.getFlags().removeAll(FRAME_FLAGS);
		inheritFrameFlags(c, st);
		if (match.closeType == TokenType.SPAREN_CLOSE || match.rawClose == TokenType.BRACE_CLOSE) {
			st.stmtStart = true;
		}
	}

	private void inheritFrameFlags(Chunk c, StructureState st) {
		Iterator<Frame> it = st.frames.iterator();
		while (it.hasNext()) {
			c.getFlags().addAll(it.next().innerFlags);
		}
	}

	private static void markSign(ChunkList list, Chunk c, Chunk prev) {
		boolean plus = "+".equals(c.getText());
		if (!plus && !"-".equals(c.getText())) {
			return;
		}
		int next = list.next(c.getId());
		if (next == ChunkList.NONE || !(list.get(next).is(TokenType.NUMBER) || list.get(next).is(TokenType.NUMBER_FP))) {
			return;
		}
		if (prev != null && isValue(prev)) {
			return;
		}
		c.setType(plus ? TokenType.POS : TokenType.NEG);
	}

	private static boolean isValue(Chunk c) {
		switch (c.getType()) {
			case WORD:
			case NUMBER:
			case NUMBER_FP:
			case STRING:
			case INCDEC:
			case PAREN_CLOSE:
			case FPAREN_CLOSE:
			case SQUARE_CLOSE:
				return true;
			default:
				return false;
		}
	}
}
