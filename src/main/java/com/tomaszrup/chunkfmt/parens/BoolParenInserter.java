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
package com.tomaszrup.chunkfmt.parens;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.chunkfmt.chunk.Chunk;
import com.tomaszrup.chunkfmt.chunk.ChunkFlag;
import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.chunk.Scope;
import com.tomaszrup.chunkfmt.chunk.TokenType;
import com.tomaszrup.chunkfmt.config.FormatterOptions;

/**
 * Adds optional parentheses around comparisons in boolean expressions.
 *
 * <p>Regions scanned:
 * <ul>
 *   <li>{@code if}, {@code else if} and {@code switch} conditions;</li>
 *   <li>the right-hand side of an assignment, up to its semicolon;</li>
 *   <li>the expression of a {@code return}, up to its semicolon.</li>
 * </ul>
 *
 * <p>Only very simple patterns are handled. A comparison is wrapped when it
 * sits between two boundaries ({@code &&}, {@code ||}, {@code ?}, ternary
 * {@code :}, comma or the region delimiters) and is not alone in the region:
 * <pre>
 *   (!a &amp;&amp; b)         =&gt; (!a &amp;&amp; b)          -- no change
 *   (a &amp;&amp; b == 1)     =&gt; (a &amp;&amp; (b == 1))
 *   (a == 1 || b &gt; 2) =&gt; ((a == 1) || (b &gt; 2))
 * </pre>
 * Regions touching a preprocessor directive are left alone. An instance
 * counts the pairs it inserted.
 */
public class BoolParenInserter {
	private static final Logger logger = LoggerFactory.getLogger(BoolParenInserter.class);

	private final FormatterOptions options;
	private int insertedPairs;

	public BoolParenInserter(FormatterOptions options) {
		this.options = Objects.requireNonNull(options, "options");
	}

	/**
	 * Runs every entry point enabled in the options.
	 *
	 * @return the number of pairs inserted by this call
	 */
	public int process(ChunkList chunks) {
		Objects.requireNonNull(chunks, "chunks");
		int before = insertedPairs;
		if (options.isModFullParenIfBool()) {
			parenthesizeConditions(chunks);
		}
		if (options.isModFullParenAssignBool()) {
			parenthesizeAssignments(chunks);
		}
		if (options.isModFullParenReturnBool()) {
			parenthesizeReturns(chunks);
		}
		return insertedPairs - before;
	}

	/** Total number of pairs this instance has inserted. */
	public int getInsertedPairs() {
		return insertedPairs;
	}

	/** Handles the conditions of {@code if}, {@code else if} and {@code switch}. */
	public void parenthesizeConditions(ChunkList chunks) {
		if (isExcluded()) {
			return;
		}
		ParenSplicer splicer = new ParenSplicer(chunks);
		int pc = firstNcNnl(chunks);
		while (pc != ChunkList.NONE) {
			Chunk chunk = chunks.get(pc);
			if (chunk.is(TokenType.SPAREN_OPEN) && isConditionOwner(chunk.getParentType())) {
				int close = chunks.nextOfType(pc, TokenType.SPAREN_CLOSE, chunk.getLevel(), Scope.PREPROC);
				if (close != ChunkList.NONE) {
					checkRegion(chunks, splicer, pc, close);
					pc = close;
				}
			}
			pc = chunks.nextNcNnl(pc);
		}
	}

	/** Handles assignment right-hand sides. */
	public void parenthesizeAssignments(ChunkList chunks) {
		parenthesizeStatements(chunks, TokenType.ASSIGN);
	}

	/** Handles {@code return} expressions. */
	public void parenthesizeReturns(ChunkList chunks) {
		parenthesizeStatements(chunks, TokenType.RETURN);
	}

	private void parenthesizeStatements(ChunkList chunks, TokenType trigger) {
		if (isExcluded()) {
			return;
		}
		ParenSplicer splicer = new ParenSplicer(chunks);
		int pc = firstNcNnl(chunks);
		while (pc != ChunkList.NONE) {
			Chunk chunk = chunks.get(pc);
			if (chunk.is(trigger)) {
				if (isInWhileCondition(chunks, pc)) {
					logger.debug("line {}: '{}' inside a while condition, skipped",
							chunk.getOrigLine(), chunk.getText());
				} else {
					int semicolon = chunks.nextOfType(pc, TokenType.SEMICOLON, chunk.getLevel(), Scope.PREPROC);
					if (semicolon != ChunkList.NONE) {
						checkRegion(chunks, splicer, pc, semicolon);
						pc = semicolon;
					}
				}
			}
			pc = chunks.nextNcNnl(pc);
		}
	}

	/**
	 * Walks back from {@code pc} to the start of its statement or to the
	 * enclosing statement parenthesis, and reports whether that belongs to a
	 * {@code while}.
	 */
	static boolean isInWhileCondition(ChunkList chunks, int pc) {
		int checkLevel = chunks.get(pc).getLevel();
		int p = chunks.prevNc(pc, Scope.PREPROC);
		while (p != ChunkList.NONE) {
			Chunk prev = chunks.get(p);
			if (prev.hasFlag(ChunkFlag.STMT_START)) {
				break;
			}
			if (prev.is(TokenType.PAREN_OPEN)) {
				checkLevel--;
			}
			if (prev.is(TokenType.SPAREN_OPEN)) {
				break;
			}
			p = chunks.prevNc(p, Scope.PREPROC);
			if (p != ChunkList.NONE && chunks.get(p).getLevel() < checkLevel - 1) {
				break;
			}
		}
		return p != ChunkList.NONE && chunks.get(p).getParentType() == TokenType.WHILE;
	}

	private void checkRegion(ChunkList chunks, ParenSplicer splicer, int open, int close) {
		for (int id = chunks.next(open); id != ChunkList.NONE && id != close; id = chunks.next(id)) {
			Chunk c = chunks.get(id);
			if (c.isPreproc()) {
				logger.debug("line {}: region starting at '{}' contains a preprocessor directive, skipped",
						chunks.get(open).getOrigLine(), chunks.get(open).getText());
				return;
			}
		}
		checkBoolParens(chunks, splicer, open, close, 0);
	}

	/**
	 * Scans between {@code popen} and {@code pclose} and wraps comparisons
	 * that sit between two boundaries. Recurses into nested parentheses.
	 */
	private void checkBoolParens(ChunkList chunks, ParenSplicer splicer, int popen, int pclose, int nest) {
		int ref = popen;
		boolean hitCompare = false;
		logger.trace("nest {}: scanning from line {} col {} to line {} col {}", nest,
				chunks.get(popen).getOrigLine(), chunks.get(popen).getOrigCol(),
				chunks.get(pclose).getOrigLine(), chunks.get(pclose).getOrigCol());

		int pc = popen;
		while ((pc = chunks.nextNcNnl(pc)) != ChunkList.NONE && pc != pclose) {
			Chunk chunk = chunks.get(pc);
			if (chunk.isPreproc()) {
				logger.debug("nest {}: bail on preprocessor '{}' at line {}", nest, chunk.getText(), chunk.getOrigLine());
				return;
			}
			switch (chunk.getType()) {
				case BOOL:
				case QUESTION:
				case COND_COLON:
				case COMMA:
					logger.trace("nest {}: boundary '{}' at line {} col {}",
							nest, chunk.getText(), chunk.getOrigLine(), chunk.getOrigCol());
					if (hitCompare) {
						hitCompare = false;
						insert(splicer, ref, pc);
					}
					ref = pc;
					break;
				case COMPARE:
					hitCompare = true;
					break;
				case SEMICOLON:
					ref = pc;
					hitCompare = false;
					break;
				case PAREN_OPEN:
				case SPAREN_OPEN:
				case FPAREN_OPEN: {
					int next = chunks.closingParen(pc);
					if (next != ChunkList.NONE) {
						checkBoolParens(chunks, splicer, pc, next, nest + 1);
						pc = next;
					}
					break;
				}
				case BRACE_OPEN:
				case SQUARE_OPEN:
				case ANGLE_OPEN: {
					int next = chunks.closingParen(pc);
					if (next == ChunkList.NONE) {
						logger.debug("nest {}: unmatched '{}' at line {}", nest, chunk.getText(), chunk.getOrigLine());
						return;
					}
					pc = next;
					break;
				}
				default:
					break;
			}
		}
		if (pc == ChunkList.NONE) {
			return;
		}

		if (hitCompare && ref != popen) {
			insert(splicer, ref, pclose);
		}
	}

	private void insert(ParenSplicer splicer, int first, int last) {
		if (splicer.insertBetween(first, last)) {
			insertedPairs++;
		}
	}

	private boolean isExcluded() {
		if (options.isParenTransformExcluded()) {
			logger.debug("parenthesis transform disabled for {}", options.getLanguage());
			return true;
		}
		return false;
	}

	private static boolean isConditionOwner(TokenType parent) {
		return parent == TokenType.IF || parent == TokenType.ELSEIF || parent == TokenType.SWITCH;
	}

	private static int firstNcNnl(ChunkList chunks) {
		int head = chunks.head();
		if (head == ChunkList.NONE) {
			return ChunkList.NONE;
		}
		Chunk first = chunks.get(head);
		return first.isComment() || first.isNewline() ? chunks.nextNcNnl(head) : head;
	}
}
