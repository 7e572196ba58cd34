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
package com.tomaszrup.chunkfmt.providers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

import com.tomaszrup.chunkfmt.FormattingPipeline;
import com.tomaszrup.chunkfmt.config.FormatterOptions;
import com.tomaszrup.chunkfmt.config.FormatterOptionsParser;

/**
 * Provides textDocument/formatting support for C-family source files.
 *
 * <p>The document is run through a {@link FormattingPipeline} built from the
 * configured {@link FormatterOptions}, with the tab size and the choice of
 * tabs or spaces for indentation taken from the request. The result is returned as a single line-range edit covering the
 * lines that changed.
 */
public class FormattingProvider {

	private volatile FormatterOptions options;

	public FormattingProvider(FormatterOptions options) {
		this.options = Objects.requireNonNull(options, "options");
	}

	/**
	 * Applies client settings ({@code initializationOptions} or a
	 * {@code didChangeConfiguration} payload) on top of the current options.
	 */
	public void applySettings(Object settings) {
		options = FormatterOptionsParser.parse(settings, options);
	}

	public FormatterOptions getOptions() {
		return options;
	}

	public CompletableFuture<List<TextEdit>> provideFormatting(
			DocumentFormattingParams params, String sourceText) {
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}

		String formatted = format(sourceText, params.getOptions());

		// Compare against the normalized text so that \r\n vs \n differences
		// don't produce spurious edits.
		String normalizedSource = sourceText.replace("\r\n", "\n").replace("\r", "\n");

		if (formatted.equals(normalizedSource)) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}

		List<TextEdit> edits = computeMinimalEdits(normalizedSource, formatted);
		return CompletableFuture.completedFuture(edits);
	}

	String format(String sourceText, FormattingOptions requestOptions) {
		FormatterOptions effective = options;
		if (requestOptions != null) {
			FormatterOptions.Builder builder = options.toBuilder()
					.indentWithTabs(!requestOptions.isInsertSpaces());
			if (requestOptions.getTabSize() > 0) {
				builder.inputTabSize(requestOptions.getTabSize());
			}
			effective = builder.build();
		}
		return new FormattingPipeline(effective).format(sourceText);
	}

	/**
	 * Compute a single line-range TextEdit between the original and formatted
	 * text, covering the lines between their common first and last lines.
	 */
	public static List<TextEdit> computeMinimalEdits(String original, String formatted) {
		String[] origLines = original.split("\\n", -1);
		String[] fmtLines = formatted.split("\\n", -1);
		List<TextEdit> edits = new ArrayList<>();

		int top = 0;
		while (top < origLines.length && top < fmtLines.length && origLines[top].equals(fmtLines[top])) {
			top++;
		}
		if (top == origLines.length && top == fmtLines.length) {
			return edits;
		}
		int origBottom = origLines.length - 1;
		int fmtBottom = fmtLines.length - 1;
		while (origBottom >= top && fmtBottom >= top && origLines[origBottom].equals(fmtLines[fmtBottom])) {
			origBottom--;
			fmtBottom--;
		}

		List<String> changed = Arrays.asList(fmtLines).subList(top, fmtBottom + 1);
		edits.add(replaceLines(origLines, top, origBottom, changed));
		return edits;
	}

	/**
	 * Replaces original lines {@code top..origBottom} with {@code lines}.
	 * An empty line range is an insertion, an empty {@code lines} a deletion;
	 * both carry one line break along.
	 */
	private static TextEdit replaceLines(String[] origLines, int top, int origBottom, List<String> lines) {
		String text = String.join("\n", lines);
		Position start;
		Position end;
		if (top > origBottom) {
			if (top == 0) {
				start = new Position(0, 0);
				text = lines.isEmpty() ? text : text + "\n";
			} else {
				start = new Position(top - 1, origLines[top - 1].length());
				text = lines.isEmpty() ? text : "\n" + text;
			}
			end = start;
		} else if (lines.isEmpty()) {
			if (top > 0) {
				start = new Position(top - 1, origLines[top - 1].length());
				end = new Position(origBottom, origLines[origBottom].length());
			} else if (origBottom + 1 < origLines.length) {
				start = new Position(0, 0);
				end = new Position(origBottom + 1, 0);
			} else {
				start = new Position(0, 0);
				end = new Position(origBottom, origLines[origBottom].length());
			}
		} else {
			start = new Position(top, 0);
			end = new Position(origBottom, origLines[origBottom].length());
		}
		return new TextEdit(new Range(start, end), text);
	}
}
