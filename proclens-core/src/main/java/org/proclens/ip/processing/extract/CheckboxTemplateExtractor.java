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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.processing.support.NoteLines;
import org.proclens.ip.processing.support.NoteLines.Segment;

/**
 * Checkbox rows and "Label: none" template defaults. These are the weakest
 * evidence the pipeline knows: an unchecked box only says the template
 * offered the option.
 */
public class CheckboxTemplateExtractor extends AbstractPatternExtractor {

	public static final String NAME = "checkbox";
	public static final double CONFIDENCE = 0.85;

	private static final Pattern CHECKED = Pattern
			.compile("^\\s*(?:\\[\\s*[xX✓✔]\\s*\\]|[☒☑✓✔]|\\(\\s*[xX]\\s*\\)|1\\s*[-–—])\\s*(\\S.*)$");
	private static final Pattern UNCHECKED = Pattern
			.compile("^\\s*(?:\\[\\s*\\]|[☐□]|\\(\\s*\\)|0\\s*[-–—])\\s*(\\S.*)$");
	private static final Pattern TEMPLATE_DEFAULT = ProcedureLexicon
			.ci("^\\s*([A-Za-z][A-Za-z /()-]{2,60}?)\\s*:\\s*(?:none|no|not performed|n/?a)\\s*\\.?\\s*$");

	public CheckboxTemplateExtractor() {
		super(NAME, CONFIDENCE);
	}

	@Override
	public List<CandidateDetection> detect(String text) {
		List<CandidateDetection> out = new ArrayList<>();
		if (text == null || text.isBlank()) {
			return out;
		}
		for (Segment line : NoteLines.lines(text)) {
			Matcher m;
			if ((m = CHECKED.matcher(line.getText())).find()) {
				label(text, line, m, Boolean.TRUE, out);
			} else if ((m = UNCHECKED.matcher(line.getText())).find()) {
				label(text, line, m, Boolean.FALSE, out);
			} else if ((m = TEMPLATE_DEFAULT.matcher(line.getText())).find()) {
				label(text, line, m, Boolean.FALSE, out);
			}
		}
		return out;
	}

	private void label(String text, Segment line, Matcher row, Boolean value, List<CandidateDetection> out) {
		String label = row.group(1);
		int base = line.getStart() + row.start(1);
		for (ProcedureLexicon.Entry entry : ProcedureLexicon.entries().values()) {
			Matcher m = entry.mention().matcher(label);
			if (!m.find()) {
				continue;
			}
			if (entry.exclude() != null && entry.exclude().matcher(label).find()) {
				continue;
			}
			if (HeaderExtractor.VERB_REQUIRED.contains(entry.procedure()) && !entry.describesEvent(label)) {
				continue;
			}
			out.add(candidate(entry.procedure().performedPath(), value, text, base + m.start(), base + m.end(),
					PriorityClass.CHECKBOX_TEMPLATE));
		}
	}
}
