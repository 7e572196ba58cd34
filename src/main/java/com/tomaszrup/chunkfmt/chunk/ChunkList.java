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
package com.tomaszrup.chunkfmt.chunk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Ordered, mutable sequence of {@link Chunk}s backed by an index-addressed
 * arena.
 *
 * <p>Chunks are stored in insertion order in one container and linked through
 * integer indices; {@link #NONE} is the sentinel for "no chunk" in both
 * directions. Inserting appends to the arena and splices the links, so ids
 * handed out earlier stay valid. Chunks are never removed.
 */
public final class ChunkList implements Iterable<Chunk> {

	public static final int NONE = -1;

	private static final int INITIAL_CAPACITY = 64;

	private final List<Chunk> arena = new ArrayList<>();
	private int[] next = new int[INITIAL_CAPACITY];
	private int[] prev = new int[INITIAL_CAPACITY];
	private int head = NONE;
	private int tail = NONE;

	public int head() {
		return head;
	}

	public int tail() {
		return tail;
	}

	public int size() {
		return arena.size();
	}

	public boolean isEmpty() {
		return arena.isEmpty();
	}

	public Chunk get(int id) {
		if (id == NONE) {
			throw new NoSuchElementException("sentinel has no chunk");
		}
		return arena.get(id);
	}

	/**
	 * Appends a chunk at the end of the sequence.
	 *
	 * @return the id assigned to the chunk
	 */
	public int append(Chunk chunk) {
		int id = register(chunk);
		prev[id] = tail;
		next[id] = NONE;
		if (tail == NONE) {
			head = id;
		} else {
			next[tail] = id;
		}
		tail = id;
		return id;
	}

	public int insertBefore(int anchor, Chunk chunk) {
		Objects.checkIndex(anchor, arena.size());
		int id = register(chunk);
		int before = prev[anchor];
		prev[id] = before;
		next[id] = anchor;
		prev[anchor] = id;
		if (before == NONE) {
			head = id;
		} else {
			next[before] = id;
		}
		return id;
	}

	public int insertAfter(int anchor, Chunk chunk) {
		Objects.checkIndex(anchor, arena.size());
		int id = register(chunk);
		int after = next[anchor];
		prev[id] = anchor;
		next[id] = after;
		next[anchor] = id;
		if (after == NONE) {
			tail = id;
		} else {
			prev[after] = id;
		}
		return id;
	}

	private int register(Chunk chunk) {
		Objects.requireNonNull(chunk, "chunk");
		if (chunk.getId() != NONE) {
			throw new IllegalArgumentException("chunk already belongs to a list: " + chunk);
		}
		int id = arena.size();
		if (id == next.length) {
			next = Arrays.copyOf(next, id * 2);
			prev = Arrays.copyOf(prev, id * 2);
		}
		arena.add(chunk);
		chunk.setId(id);
		return id;
	}

	public int next(int id) {
		return id == NONE ? NONE : next[id];
	}

	public int prev(int id) {
		return id == NONE ? NONE : prev[id];
	}

	public int next(int id, Scope scope) {
		return step(id, scope, true);
	}

	public int prev(int id, Scope scope) {
		return step(id, scope, false);
	}

	private int step(int id, Scope scope, boolean forward) {
		if (id == NONE) {
			return NONE;
		}
		int n = forward ? next[id] : prev[id];
		if (scope == Scope.ALL) {
			return n;
		}
		if (get(id).isPreproc()) {
			return (n != NONE && get(n).isPreproc()) ? n : NONE;
		}
		while (n != NONE && get(n).isPreproc()) {
			n = forward ? next[n] : prev[n];
		}
		return n;
	}

	/** Next chunk that is neither a comment nor a newline. */
	public int nextNcNnl(int id) {
		return nextNcNnl(id, Scope.ALL);
	}

	public int nextNcNnl(int id, Scope scope) {
		int n = next(id, scope);
		while (n != NONE && (get(n).isComment() || get(n).isNewline())) {
			n = next(n, scope);
		}
		return n;
	}

	public int prevNcNnl(int id) {
		return prevNcNnl(id, Scope.ALL);
	}

	public int prevNcNnl(int id, Scope scope) {
		int p = prev(id, scope);
		while (p != NONE && (get(p).isComment() || get(p).isNewline())) {
			p = prev(p, scope);
		}
		return p;
	}

	/** Previous chunk that is not a comment. */
	public int prevNc(int id, Scope scope) {
		int p = prev(id, scope);
		while (p != NONE && get(p).isComment()) {
			p = prev(p, scope);
		}
		return p;
	}

	/**
	 * Finds the next chunk of the given type.
	 *
	 * @param level required level, or a negative value for any level
	 */
	public int nextOfType(int id, TokenType type, int level, Scope scope) {
		int n = next(id, scope);
		while (n != NONE) {
			Chunk c = get(n);
			if (c.is(type) && (level < 0 || c.getLevel() == level)) {
				return n;
			}
			n = next(n, scope);
		}
		return NONE;
	}

	/**
	 * Finds the closer matching the opening bracket {@code openId}, or
	 * {@link #NONE} when the chunk is not an opener or the closer is missing.
	 */
	public int closingParen(int openId) {
		if (openId == NONE) {
			return NONE;
		}
		Chunk open = get(openId);
		TokenType closer = open.getType().closer();
		if (closer == TokenType.NONE) {
			return NONE;
		}
		return nextOfType(openId, closer, open.getLevel(), Scope.PREPROC);
	}

	/** Chunks in stream order. */
	public List<Chunk> toList() {
		List<Chunk> result = new ArrayList<>(arena.size());
		for (Chunk c : this) {
			result.add(c);
		}
		return result;
	}

	@Override
	public Iterator<Chunk> iterator() {
		return new Iterator<>() {
			private int cursor = head;

			@Override
			public boolean hasNext() {
				return cursor != NONE;
			}

			@Override
			public Chunk next() {
				if (cursor == NONE) {
					throw new NoSuchElementException();
				}
				Chunk c = arena.get(cursor);
				cursor = ChunkList.this.next[cursor];
				return c;
			}
		};
	}
}
