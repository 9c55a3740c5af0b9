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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import lombok.Value;

/**
 * Line and sentence helpers that keep offsets into the original note.
 */
public final class NoteLines {

	/** Lines that open with a five digit CPT code, e.g. "31653 EBUS 3+ stations". */
	private static final Pattern CPT_HEADER_LINE = Pattern.compile("^\\s*\\+?\\d{5}\\b");

	private NoteLines() {
	}

	/** One line (or sentence) and where it starts in the note. */
	@Value
	public static class Segment {
		int start;
		int end;
		String text;
	}

	public static List<Segment> lines(String note) {
		List<Segment> out = new ArrayList<>();
		int start = 0;
		for (int i = 0; i <= note.length(); i++) {
			if (i == note.length() || note.charAt(i) == '\n') {
				int end = (i > start && note.charAt(i - 1) == '\r') ? i - 1 : i;
				out.add(new Segment(start, end, note.substring(start, end)));
				start = i + 1;
			}
		}
		return out;
	}

	/** Sentences inside lines; a sentence never crosses a line break. */
	public static List<Segment> sentences(String note) {
		List<Segment> out = new ArrayList<>();
		for (Segment line : lines(note)) {
			int s = line.getStart();
			for (int i = line.getStart(); i < line.getEnd(); i++) {
				if (ContextWindow.isBoundary(note, i)) {
					addTrimmed(note, s, i + 1, out);
					s = i + 1;
				}
			}
			addTrimmed(note, s, line.getEnd(), out);
		}
		return out;
	}

	public static int lineStart(String note, int offset) {
		int i = note.lastIndexOf('\n', Math.max(0, offset - 1));
		return i < 0 ? 0 : i + 1;
	}

	public static int lineEnd(String note, int offset) {
		int i = note.indexOf('\n', offset);
		return i < 0 ? note.length() : i;
	}

	/** Full line containing {@code offset}. */
	public static String lineAt(String note, int offset) {
		return note.substring(lineStart(note, offset), lineEnd(note, offset));
	}

	public static boolean isCptHeaderLine(String line) {
		return line != null && CPT_HEADER_LINE.matcher(line).find();
	}

	private static void addTrimmed(String note, int from, int to, List<Segment> out) {
		while (from < to && Character.isWhitespace(note.charAt(from)))
			from++;
		while (to > from && Character.isWhitespace(note.charAt(to - 1)))
			to--;
		if (to > from) {
			out.add(new Segment(from, to, note.substring(from, to)));
		}
	}
}
