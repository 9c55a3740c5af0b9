package org.proclens.ip.processing.support;

/*
 * This file is part of ProcLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * ProcLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ProcLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ProcLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import lombok.Value;

/**
 * Text around a mention, clipped to the enclosing sentence or line and to a
 * character radius.
 */
@Value
public class ContextWindow {

	String before;
	String mention;
	String after;

	public String full() {
		return before + mention + after;
	}

	/**
	 * Window around {@code text[start, end)}.
	 */
	public static ContextWindow around(String text, int start, int end, int radius) {
		int from = Math.max(0, start - radius);
		int to = Math.min(text.length(), end + radius);

		for (int i = start - 1; i >= from; i--) {
			if (isBoundary(text, i)) {
				from = i + 1;
				break;
			}
		}
		for (int i = end; i < to; i++) {
			if (isBoundary(text, i)) {
				to = i;
				break;
			}
		}
		return new ContextWindow(text.substring(from, start), text.substring(start, end), text.substring(end, to));
	}

	/** Line breaks and sentence-ending punctuation followed by whitespace. */
	static boolean isBoundary(String text, int i) {
		char c = text.charAt(i);
		if (c == '\n' || c == '\r') {
			return true;
		}
		if (c == '.' || c == '!' || c == '?' || c == ';') {
			return i + 1 >= text.length() || Character.isWhitespace(text.charAt(i + 1));
		}
		return false;
	}
}
