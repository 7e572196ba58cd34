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

/**
 * Lexical category of a {@link Chunk}.
 *
 * <p>Bracket kinds are split by role: {@code SPAREN_*} are the parentheses
 * owned by a statement keyword ({@code if (...)}), {@code FPAREN_*} belong to
 * a function call or definition, and {@code PAREN_*} are plain grouping
 * parentheses.
 */
public enum TokenType {
	NONE,
	WORD,
	TYPE,
	FUNC_CALL,
	FUNC_DEF,
	NUMBER,
	NUMBER_FP,
	POS,
	NEG,
	STRING,
	COMMENT,
	NEWLINE,
	COMMA,
	SEMICOLON,
	COMPARE,
	BOOL,
	NOT,
	ARITH,
	INCDEC,
	ASSIGN,
	QUESTION,
	COND_COLON,
	COLON,
	MEMBER,
	DC_MEMBER,
	PAREN_OPEN,
	PAREN_CLOSE,
	SPAREN_OPEN,
	SPAREN_CLOSE,
	FPAREN_OPEN,
	FPAREN_CLOSE,
	BRACE_OPEN,
	BRACE_CLOSE,
	SQUARE_OPEN,
	SQUARE_CLOSE,
	ANGLE_OPEN,
	ANGLE_CLOSE,
	IF,
	ELSE,
	ELSEIF,
	SWITCH,
	WHILE,
	FOR,
	DO,
	RETURN,
	PREPROC,
	OTHER;

	/**
	 * Returns the closer that matches this opener, or {@link #NONE} when this
	 * is not an opening bracket.
	 */
	public TokenType closer() {
		switch (this) {
			case PAREN_OPEN:
				return PAREN_CLOSE;
			case SPAREN_OPEN:
				return SPAREN_CLOSE;
			case FPAREN_OPEN:
				return FPAREN_CLOSE;
			case BRACE_OPEN:
				return BRACE_CLOSE;
			case SQUARE_OPEN:
				return SQUARE_CLOSE;
			case ANGLE_OPEN:
				return ANGLE_CLOSE;
			default:
				return NONE;
		}
	}

	/** Numeric literal or the sign token written in front of one. */
	public boolean isNumeric() {
		return this == NUMBER || this == NUMBER_FP || this == POS || this == NEG;
	}
}
