package org.proclens.ip.processing.extract;

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

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.proclens.ip.processing.support.NoteLines;
import org.proclens.ip.processing.support.NoteLines.Segment;

/**
 * Blanks out code and modifier option lists ("menus") before extraction.
 * Masked characters become spaces, so the masked text has the same length
 * and every offset still points into the original note.
 */
public final class MenuBlockMasker {

	/** "31653 EBUS ...", "[ ] 31624", "- +31627" */
	private static final Pattern CODE_LINE = Pattern.compile(
			"^\\s*(?:[-*•]\\s*)?(?:\\[\\s*[xX✓ ]?\\s*\\]\\s*|[☐☑☒□]\\s*)?\\+?\\d{5}\\b");

	/** "Modifier 59", "mod -XS" */
	private static final Pattern MODIFIER_LINE = Pattern.compile(
			"^\\s*(?:[-*•]\\s*)?(?:modifiers?|mod)\\s*[-:#]?\\s*(?:\\d{2}|X[ESPU])\\b", Pattern.CASE_INSENSITIVE);

	/** Heading that opens a coding menu block; the block ends at the next blank line. */
	private static final Pattern MENU_HEADING = Pattern.compile(
			"^\\s*(?:CPT|HCPCS|billing|coding|charge)(?:\\s+(?:codes?|options?|menu|summary|selection))?\\s*:",
			Pattern.CASE_INSENSITIVE);

	private static final Pattern FIVE_DIGIT = Pattern.compile("\\b\\d{5}\\b");

	private static final int CODES_PER_LIST_LINE = 3;

	private MenuBlockMasker() {
	}

	/**
	 * @return {@code note} with menu lines replaced by spaces (line breaks kept)
	 */
	public static String mask(String note) {
		if (note == null || note.isEmpty()) {
			return note;
		}
		char[] out = note.toCharArray();
		boolean inBlock = false;
		for (Segment line : NoteLines.lines(note)) {
			String text = line.getText();
			if (text.isBlank()) {
				inBlock = false;
				continue;
			}
			if (MENU_HEADING.matcher(text).find()) {
				inBlock = true;
			}
			if (inBlock || isMenuLine(text)) {
				for (int i = line.getStart(); i < line.getEnd(); i++) {
					out[i] = ' ';
				}
			}
		}
		return new String(out);
	}

	/** True for a single line that lists codes or modifiers. */
	static boolean isMenuLine(String line) {
		if (CODE_LINE.matcher(line).find() || MODIFIER_LINE.matcher(line).find()) {
			return true;
		}
		int codes = 0;
		Matcher m = FIVE_DIGIT.matcher(line);
		while (m.find()) {
			if (++codes >= CODES_PER_LIST_LINE) {
				return true;
			}
		}
		return false;
	}

}
