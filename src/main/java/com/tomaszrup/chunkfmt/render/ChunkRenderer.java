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
package com.tomaszrup.chunkfmt.render;

import java.util.Objects;

import com.tomaszrup.chunkfmt.chunk.Chunk;
import com.tomaszrup.chunkfmt.chunk.ChunkList;

/**
 * Renders a {@link ChunkList} back into source text.
 *
 * <p>Every chunk is written at its render column. When an earlier chunk on
 * the same line already reaches past that column the chunk is written right
 * after it instead, so text is never overwritten. Leading indentation can
 * be written with tabs.
 */
public final class ChunkRenderer {

	private ChunkRenderer() {
	}

	/** Renders with space indentation. */
	public static String render(ChunkList chunks) {
		return render(chunks, 1, false);
	}

	/**
	 * @param tabSize width of a tab stop, used when {@code indentWithTabs}
	 *                is set
	 */
	public static String render(ChunkList chunks, int tabSize, boolean indentWithTabs) {
		Objects.requireNonNull(chunks, "chunks");
		if (tabSize <= 0) {
			throw new IllegalArgumentException("tabSize must be positive: " + tabSize);
		}
		StringBuilder out = new StringBuilder();
		int currentColumn = 1;
		boolean lineStart = true;
		for (Chunk chunk : chunks) {
			if (chunk.isNewline()) {
				stripTrailingBlanks(out);
				for (int i = 0; i < Math.max(1, chunk.getNlCount()); i++) {
					out.append('\n');
				}
				currentColumn = 1;
				lineStart = true;
				continue;
			}
			int pad = chunk.getColumn() - currentColumn;
			if (pad > 0) {
				if (lineStart && indentWithTabs) {
					appendIndent(out, pad, tabSize);
				} else {
					appendSpaces(out, pad);
				}
				currentColumn += pad;
			}
			lineStart = false;
			String text = chunk.getText();
			out.append(text);
			int nl = text.lastIndexOf('\n');
			currentColumn = nl < 0 ? currentColumn + text.length() : 1 + text.length() - nl - 1;
		}
		stripTrailingBlanks(out);
		return out.toString();
	}

	private static void appendIndent(StringBuilder out, int width, int tabSize) {
		for (int i = 0; i < width / tabSize; i++) {
			out.append('\t');
		}
		appendSpaces(out, width % tabSize);
	}

	private static void appendSpaces(StringBuilder out, int count) {
		for (int i = 0; i < count; i++) {
			out.append(' ');
		}
	}

	private static void stripTrailingBlanks(StringBuilder out) {
		int end = out.length();
		while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) {
			end--;
		}
		out.setLength(end);
	}
}
