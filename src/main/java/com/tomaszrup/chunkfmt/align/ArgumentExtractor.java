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
import java.util.List;

import com.tomaszrup.chunkfmt.chunk.Chunk;
import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.chunk.Scope;
import com.tomaszrup.chunkfmt.chunk.TokenType;

/**
 * Finds the first chunk of every top-level argument of a function call.
 *
 * <p>Only arguments that start on the call's own line are reported. Chunks
 * nested deeper than the argument list (inner calls, brackets) are ignored,
 * so their commas never split an argument.
 */
final class ArgumentExtractor {

	private ArgumentExtractor() {
	}

	/**
	 * @param callId a {@link TokenType#FUNC_CALL} chunk
	 * @return anchor ids in argument order; empty when the call has no
	 *         argument list
	 */
	static List<Integer> extract(ChunkList chunks, int callId) {
		List<Integer> anchors = new ArrayList<>();
		Chunk call = chunks.get(callId);
		int callLevel = call.getLevel();
		int open = chunks.nextOfType(callId, TokenType.FPAREN_OPEN, callLevel, Scope.ALL);
		if (open == ChunkList.NONE) {
			return anchors;
		}

		boolean atArgumentStart = true;
		for (int id = chunks.next(open); id != ChunkList.NONE; id = chunks.next(id)) {
			Chunk pc = chunks.get(id);
			if (pc.isNewline()
					|| pc.is(TokenType.SEMICOLON)
					|| (pc.is(TokenType.FPAREN_CLOSE) && pc.getLevel() == callLevel)) {
				break;
			}
			if (pc.getLevel() != callLevel + 1) {
				continue;
			}
			if (atArgumentStart) {
				anchors.add(id);
				atArgumentStart = false;
			} else if (pc.is(TokenType.COMMA)) {
				atArgumentStart = true;
			}
		}
		return anchors;
	}
}
