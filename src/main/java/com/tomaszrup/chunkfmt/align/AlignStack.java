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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.chunkfmt.chunk.Chunk;
import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.chunk.TokenType;

/**
 * Collects chunks that should share a column and moves them there.
 *
 * <p>Rows are buffered until {@link #end()}, which moves every row to the
 * largest column among them (or, with {@link #setRightAlign(boolean) right
 * alignment}, lines up their end columns). Moving a row shifts the rest of
 * its line by the same amount.
 *
 * <p>Two limits bound a batch:
 * <ul>
 *   <li>{@code spanLimit}: when more than this many lines were crossed since
 *       the last accepted row, the pending rows are finalized before the new
 *       row starts a fresh batch;</li>
 *   <li>{@code thresholdLimit}: a row whose column is more than this far from
 *       the batch column is evicted immediately and never aligned. Zero
 *       disables the check.</li>
 * </ul>
 * A threshold eviction does not depend on the span state.
 */
public class AlignStack {
	private static final Logger logger = LoggerFactory.getLogger(AlignStack.class);

	private final ChunkList chunks;
	private final List<Integer> rows = new ArrayList<>();
	private int spanLimit;
	private int thresholdLimit;
	private boolean rightAlign;
	private boolean started;
	private int lineSeq;
	private int lastRowSeq;
	private int evictedCount;

	public AlignStack(ChunkList chunks) {
		this.chunks = Objects.requireNonNull(chunks, "chunks");
	}

	public void start(int spanLimit, int thresholdLimit) {
		this.spanLimit = spanLimit;
		this.thresholdLimit = thresholdLimit;
		this.rightAlign = false;
		this.started = true;
		this.lineSeq = 0;
		this.lastRowSeq = 0;
		this.evictedCount = 0;
		rows.clear();
	}

	/**
	 * Offers a chunk as the next row.
	 *
	 * @return {@code false} when the row was evicted by the threshold
	 */
	public boolean add(int chunkId) {
		if (!started) {
			throw new IllegalStateException("start() must be called before add()");
		}
		if (!rows.isEmpty() && lineSeq - lastRowSeq > spanLimit) {
			logger.trace("span {} exceeded ({} lines), finalizing {} row(s)",
					spanLimit, lineSeq - lastRowSeq, rows.size());
			end();
		}
		Chunk chunk = chunks.get(chunkId);
		if (!rows.isEmpty() && thresholdLimit > 0) {
			int batchColumn = batchColumn();
			int column = anchorColumn(chunkId);
			if (Math.abs(column - batchColumn) > thresholdLimit) {
				evictedCount++;
				logger.debug("evict '{}' on line {}: column {} is more than {} away from {}",
						chunk.getText(), chunk.getOrigLine(), column, thresholdLimit, batchColumn);
				return false;
			}
		}
		rows.add(chunkId);
		lastRowSeq = lineSeq;
		return true;
	}

	/** Registers that {@code count} line breaks were crossed. */
	public void newLines(int count) {
		if (count > 0) {
			lineSeq += count;
		}
	}

	/** Discards the pending rows without moving anything. */
	public void flush() {
		rows.clear();
	}

	/** Moves the pending rows to their common column and clears them. */
	public void end() {
		if (rows.size() > 1) {
			apply();
		}
		rows.clear();
	}

	private void apply() {
		int target = batchColumn();
		for (int id : rows) {
			int delta = target - anchorColumn(id);
			if (delta > 0) {
				shiftLine(id, delta);
			}
		}
		logger.trace("aligned {} row(s) to column {}{}", rows.size(), target, rightAlign ? " (right)" : "");
	}

	/** Shifts the chunks up to the next line break, which may sit inside a comment. */
	private void shiftLine(int fromId, int delta) {
		for (int id = fromId; id != ChunkList.NONE; id = chunks.next(id)) {
			Chunk c = chunks.get(id);
			if (c.isNewline()) {
				break;
			}
			c.setColumn(c.getColumn() + delta);
			if (c.getText().indexOf('\n') >= 0) {
				break;
			}
		}
	}

	private int batchColumn() {
		int max = 0;
		for (int id : rows) {
			max = Math.max(max, anchorColumn(id));
		}
		return max;
	}

	private int anchorColumn(int id) {
		Chunk chunk = chunks.get(id);
		if (!rightAlign) {
			return chunk.getColumn();
		}
		// a sign ends where its number ends
		if (chunk.is(TokenType.POS) || chunk.is(TokenType.NEG)) {
			int number = chunks.next(id);
			if (number != ChunkList.NONE
					&& (chunks.get(number).is(TokenType.NUMBER) || chunks.get(number).is(TokenType.NUMBER_FP))) {
				return chunks.get(number).endColumn();
			}
		}
		return chunk.endColumn();
	}

	public boolean isRightAlign() {
		return rightAlign;
	}

	public void setRightAlign(boolean rightAlign) {
		this.rightAlign = rightAlign;
	}

	public int getSpanLimit() {
		return spanLimit;
	}

	public int getThresholdLimit() {
		return thresholdLimit;
	}

	/** Ids of the rows waiting for {@link #end()}. */
	public List<Integer> pendingRows() {
		return Collections.unmodifiableList(rows);
	}

	public int getEvictedCount() {
		return evictedCount;
	}
}
