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

/**
 * Splices a synthetic parenthesis pair into a {@link ChunkList}.
 *
 * <p>{@code insertBetween(first, last)} wraps everything strictly between
 * {@code first} and {@code last}: {@code "&& b == 1 )"} becomes
 * {@code "&& ( b == 1 ) )"}. Columns of the rest of each affected line move
 * right by one, and the wrapped chunks go one level deeper.
 */
public final class ParenSplicer {
	private static final Logger logger = LoggerFactory.getLogger(ParenSplicer.class);

	private final ChunkList chunks;

	public ParenSplicer(ChunkList chunks) {
		this.chunks = Objects.requireNonNull(chunks, "chunks");
	}

	/**
	 * @return {@code true} when a pair was inserted, {@code false} when
	 *         {@code first} and {@code last} are already adjacent
	 */
	public boolean insertBetween(int first, int last) {
		int inner = chunks.nextNcNnl(first);
		if (inner == last || inner == ChunkList.NONE) {
			return false;
		}
		int tail = chunks.prevNcNnl(last, Scope.PREPROC);
		if (tail == ChunkList.NONE) {
			return false;
		}
		Chunk firstChunk = chunks.get(first);
		Chunk lastChunk = chunks.get(last);
		logger.debug("line {}: parens between '{}' [lvl {}] and '{}' [lvl {}]",
				firstChunk.getOrigLine(), firstChunk.getText(), firstChunk.getLevel(),
				lastChunk.getText(), lastChunk.getLevel());

		Chunk innerChunk = chunks.get(inner);
		Chunk open = synthesize(TokenType.PAREN_OPEN, "(", innerChunk);
		open.setColumn(innerChunk.getColumn());
		open.setOrigCol(innerChunk.getOrigCol());
		open.setOrigColEnd(innerChunk.getOrigCol() + 1);
		int openId = chunks.insertBefore(inner, open);
		shiftRestOfLine(inner);

		Chunk tailChunk = chunks.get(tail);
		Chunk close = synthesize(TokenType.PAREN_CLOSE, ")", tailChunk);
		close.setColumn(tailChunk.endColumn());
		close.setOrigCol(tailChunk.getOrigColEnd());
		close.setOrigColEnd(tailChunk.getOrigColEnd() + 1);
		int closeId = chunks.insertAfter(tail, close);
		shiftRestOfLine(chunks.next(closeId));

		for (int id = chunks.next(openId); id != closeId; id = chunks.next(id)) {
			Chunk c = chunks.get(id);
			c.setLevel(c.getLevel() + 1);
		}
		return true;
	}

	private static Chunk synthesize(TokenType type, String text, Chunk neighbour) {
		Chunk c = new Chunk(type, text);
		c.setOrigLine(neighbour.getOrigLine());
		c.setLevel(neighbour.getLevel());
		c.setBraceLevel(neighbour.getBraceLevel());
		c.setPpLevel(neighbour.getPpLevel());
		for (ChunkFlag flag : ChunkFlag.COPY_FLAGS) {
			if (neighbour.hasFlag(flag)) {
				c.addFlag(flag);
			}
		}
		return c;
	}

	/**
	 * Shifts {@code from} and everything after it up to the line break. A
	 * multi-line comment ends the visual line too.
	 */
	private void shiftRestOfLine(int from) {
		for (int id = from; id != ChunkList.NONE; id = chunks.next(id)) {
			Chunk c = chunks.get(id);
			c.shiftColumns(1);
			if (c.isNewline() || c.getText().indexOf('\n') >= 0) {
				break;
			}
		}
	}
}
