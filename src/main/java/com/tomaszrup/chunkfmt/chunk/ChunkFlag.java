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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Structural flags carried by a {@link Chunk}.
 */
public enum ChunkFlag {
	/** Part of a preprocessor directive line. */
	IN_PREPROC,
	/** First token of a statement. */
	STMT_START,
	/** Inside the parentheses of a statement keyword. */
	IN_SPAREN,
	/** Inside the argument list of a function call. */
	IN_FCN_CALL;

	/** Flags a synthesized chunk inherits from its neighbour. */
	public static final Set<ChunkFlag> COPY_FLAGS =
			Collections.unmodifiableSet(EnumSet.of(IN_PREPROC, IN_SPAREN, IN_FCN_CALL));
}
