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

import java.util.EnumSet;
import java.util.Set;

/**
 * One lexical unit of the source plus its structural and position metadata.
 *
 * <p>A chunk is owned by exactly one {@link ChunkList}; its {@link #getId() id}
 * is the arena index assigned when it was added and never changes. Columns are
 * 1-based. {@code origColEnd} is exclusive.
 */
public final class Chunk {

	private int id = ChunkList.NONE;
	private TokenType type;
	private TokenType parentType = TokenType.NONE;
	private String text;

	private int origLine;
	private int origCol;
	private int origColEnd;
	private int column;

	private int level;
	private int braceLevel;
	private int ppLevel;
	private int nlCount;

	private final EnumSet<ChunkFlag> flags = EnumSet.noneOf(ChunkFlag.class);

	public Chunk(TokenType type, String text) {
		this.type = type;
		this.text = text;
	}

	public int getId() {
		return id;
	}

	void setId(int id) {
		this.id = id;
	}

	public TokenType getType() {
		return type;
	}

	public void setType(TokenType type) {
		this.type = type;
	}

	public TokenType getParentType() {
		return parentType;
	}

	public void setParentType(TokenType parentType) {
		this.parentType = parentType;
	}

	public String getText() {
		return text;
	}

	public int getOrigLine() {
		return origLine;
	}

	public void setOrigLine(int origLine) {
		this.origLine = origLine;
	}

	public int getOrigCol() {
		return origCol;
	}

	public void setOrigCol(int origCol) {
		this.origCol = origCol;
	}

	public int getOrigColEnd() {
		return origColEnd;
	}

	public void setOrigColEnd(int origColEnd) {
		this.origColEnd = origColEnd;
	}

	public int getColumn() {
		return column;
	}

	public void setColumn(int column) {
		this.column = column;
	}

	public int getLevel() {
		return level;
	}

	public void setLevel(int level) {
		this.level = level;
	}

	public int getBraceLevel() {
		return braceLevel;
	}

	public void setBraceLevel(int braceLevel) {
		this.braceLevel = braceLevel;
	}

	public int getPpLevel() {
		return ppLevel;
	}

	public void setPpLevel(int ppLevel) {
		this.ppLevel = ppLevel;
	}

	/** Number of line breaks a newline chunk stands for. */
	public int getNlCount() {
		return nlCount;
	}

	public void setNlCount(int nlCount) {
		this.nlCount = nlCount;
	}

	public Set<ChunkFlag> getFlags() {
		return flags;
	}

	public boolean hasFlag(ChunkFlag flag) {
		return flags.contains(flag);
	}

	public void addFlag(ChunkFlag flag) {
		flags.add(flag);
	}

	public boolean is(TokenType t) {
		return type == t;
	}

	public boolean isNot(TokenType t) {
		return type != t;
	}

	public boolean isNewline() {
		return type == TokenType.NEWLINE;
	}

	public boolean isComment() {
		return type == TokenType.COMMENT;
	}

	public boolean isPreproc() {
		return flags.contains(ChunkFlag.IN_PREPROC);
	}

	/**
	 * Rendered width of the chunk. For multi-line text (block comments) this
	 * is the width of the last line.
	 */
	public int width() {
		if (type == TokenType.NEWLINE) {
			return 0;
		}
		int nl = text.lastIndexOf('\n');
		return nl < 0 ? text.length() : text.length() - nl - 1;
	}

	/** Column just past the chunk on its last line. */
	public int endColumn() {
		return column + width();
	}

	/**
	 * Moves the render column and both original columns by {@code delta}.
	 */
	public void shiftColumns(int delta) {
		column += delta;
		origCol += delta;
		origColEnd += delta;
	}

	@Override
	public String toString() {
		String shown = type == TokenType.NEWLINE ? "<NL x" + nlCount + ">" : "'" + text + "'";
		return type + " " + shown + " @" + origLine + ":" + column + " lvl=" + level;
	}
}
