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
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.chunkfmt.chunk.Chunk;
import com.tomaszrup.chunkfmt.chunk.ChunkList;
import com.tomaszrup.chunkfmt.chunk.TokenType;
import com.tomaszrup.chunkfmt.config.FormatterOptions;

/**
 * Aligns the arguments of consecutive calls to the same function.
 *
 * <p>A run of line-leading calls with the same qualified name, the same
 * {@code level} and the same {@code braceLevel} forms a group. Every argument
 * position of the group gets its own {@link AlignStack}; the call chunks share
 * one more. The group is finalized when a different call starts, when the
 * scan leaves the group's brace level, or at the end of the stream.
 *
 * <pre>
 * foo(1, bar);          foo( 1, bar);
 * foo(22, b);     =&gt;    foo(22, b);
 * foo(3, c);            foo( 3, c);
 * </pre>
 */
public class FuncCallAligner {
	private static final Logger logger = LoggerFactory.getLogger(FuncCallAligner.class);

	private final FormatterOptions options;

	public FuncCallAligner(FormatterOptions options) {
		this.options = Objects.requireNonNull(options, "options");
	}

	/**
	 * Runs the pass over the whole stream.
	 *
	 * @return the number of groups with more than one call that were aligned
	 */
	public int align(ChunkList chunks) {
		Objects.requireNonNull(chunks, "chunks");
		CallGroup group = new CallGroup(chunks);
		logger.debug("align same function call params: span={}, thresh={}",
				group.span, group.thresh);

		for (int pc = chunks.head(); pc != ChunkList.NONE; pc = chunks.next(pc)) {
			Chunk chunk = chunks.get(pc);
			if (chunk.isNot(TokenType.FUNC_CALL)) {
				if (chunk.isNewline()) {
					group.newLines(chunk.getNlCount());
				} else if (group.isActive() && group.braceLevel > chunk.getBraceLevel()) {
					logger.debug("left brace level {} at line {}, ending group of {}",
							group.braceLevel, chunk.getOrigLine(), group.count);
					group.finish();
				}
				continue;
			}

			int edge = lineLeadingEdge(chunks, pc);
			if (edge == ChunkList.NONE) {
				continue;
			}
			String name = qualifiedName(chunks, edge, pc);

			if (group.isActive()) {
				if (group.matches(chunk, name)) {
					group.extend(pc);
					logger.trace("add '{}' on line {}", name, chunk.getOrigLine());
					continue;
				}
				logger.debug("'{}' on line {} ends group '{}' of {}",
						name, chunk.getOrigLine(), group.name, group.count);
				group.finish();
			}
			group.begin(edge, pc, name);
			logger.trace("start '{}' on line {}", name, chunk.getOrigLine());
		}

		if (group.count > 1) {
			group.finish();
		} else {
			group.discard();
		}
		return group.alignedGroups;
	}

	/**
	 * Walks back over a qualifier chain ({@code A::B::foo}) and returns the
	 * first chunk of the call expression when it starts a line, or
	 * {@link ChunkList#NONE} otherwise. A member access on a plain operand
	 * ({@code obj.foo}) never starts a line.
	 */
	static int lineLeadingEdge(ChunkList chunks, int callId) {
		int prev = chunks.prev(callId);
		while (prev != ChunkList.NONE
				&& (chunks.get(prev).is(TokenType.MEMBER) || chunks.get(prev).is(TokenType.DC_MEMBER))) {
			int operand = chunks.prev(prev);
			if (operand == ChunkList.NONE || chunks.get(operand).isNot(TokenType.TYPE)) {
				prev = operand;
				break;
			}
			prev = chunks.prev(operand);
		}
		if (prev == ChunkList.NONE) {
			// start of the stream counts as a line start
			return chunks.head();
		}
		if (!chunks.get(prev).isNewline()) {
			return ChunkList.NONE;
		}
		return chunks.next(prev);
	}

	static String qualifiedName(ChunkList chunks, int edgeId, int callId) {
		StringBuilder name = new StringBuilder();
		for (int id = edgeId; id != ChunkList.NONE; id = chunks.next(id)) {
			name.append(chunks.get(id).getText());
			if (id == callId) {
				break;
			}
		}
		return name.toString();
	}

	private final class CallGroup {
		private final ChunkList chunks;
		private final int span;
		private final int thresh;
		private final List<AlignStack> argStacks = new ArrayList<>();
		private AlignStack callStack;
		private int root = ChunkList.NONE;
		private String name;
		private int level;
		private int braceLevel;
		private int count;
		private int alignedGroups;

		private CallGroup(ChunkList chunks) {
			this.chunks = chunks;
			this.span = options.getAlignSameFuncCallParamsSpan();
			this.thresh = options.getAlignSameFuncCallParamsThresh();
		}

		private boolean isActive() {
			return root != ChunkList.NONE;
		}

		private boolean matches(Chunk call, String callName) {
			return braceLevel == call.getBraceLevel()
					&& level == call.getLevel()
					&& name.equals(callName);
		}

		private void begin(int edge, int callId, String callName) {
			Chunk call = chunks.get(callId);
			root = edge;
			name = callName;
			level = call.getLevel();
			braceLevel = call.getBraceLevel();
			count = 1;
			callStack = new AlignStack(chunks);
			callStack.start(span, thresh);
			callStack.add(callId);
			addArguments(callId);
		}

		private void extend(int callId) {
			count++;
			callStack.add(callId);
			addArguments(callId);
		}

		private void addArguments(int callId) {
			List<Integer> anchors = ArgumentExtractor.extract(chunks, callId);
			for (int idx = 0; idx < anchors.size(); idx++) {
				int anchor = anchors.get(idx);
				if (idx >= argStacks.size()) {
					AlignStack stack = new AlignStack(chunks);
					stack.start(span, thresh);
					if (!options.isAlignNumberRight() && chunks.get(anchor).getType().isNumeric()) {
						stack.setRightAlign(!options.isAlignOnTabstop());
					}
					argStacks.add(stack);
				}
				argStacks.get(idx).add(anchor);
			}
		}

		private void newLines(int nlCount) {
			if (!isActive()) {
				return;
			}
			for (AlignStack stack : argStacks) {
				stack.newLines(nlCount);
			}
			callStack.newLines(nlCount);
		}

		private void finish() {
			if (count > 1) {
				alignedGroups++;
			}
			callStack.end();
			for (AlignStack stack : argStacks) {
				stack.end();
			}
			clear();
		}

		private void discard() {
			if (!isActive()) {
				return;
			}
			callStack.flush();
			for (AlignStack stack : argStacks) {
				stack.flush();
			}
			clear();
		}

		private void clear() {
			argStacks.clear();
			callStack = null;
			root = ChunkList.NONE;
			name = null;
			count = 0;
		}
	}
}
