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

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.processing.support.ContextWindow;
import org.proclens.ip.processing.support.NegationCues;
import org.proclens.ip.processing.support.NoteLines;
import org.proclens.ip.processing.support.NoteLines.Segment;

/**
 * Explicit statements that a procedure did not happen: "No BAL was
 * performed", "stent placement was deferred". The negated mention itself is
 * the evidence.
 */
public class NegationExtractor extends AbstractPatternExtractor {

	public static final String NAME = "negation";
	public static final double CONFIDENCE = 0.95;

	public NegationExtractor() {
		super(NAME, CONFIDENCE);
	}

	@Override
	public List<CandidateDetection> detect(String text) {
		List<CandidateDetection> out = new ArrayList<>();
		if (text == null || text.isBlank()) {
			return out;
		}
		for (Segment sentence : NoteLines.sentences(text)) {
			String s = sentence.getText();
			for (ProcedureLexicon.Entry entry : ProcedureLexicon.entries().values()) {
				if (entry.exclude() != null && entry.exclude().matcher(s).find()) {
					continue;
				}
				if (HeaderExtractor.VERB_REQUIRED.contains(entry.procedure()) && !entry.describesEvent(s)) {
					continue;
				}
				Matcher m = entry.mention().matcher(s);
				while (m.find()) {
					if (NegationCues.negates(ContextWindow.around(s, m.start(), m.end(), s.length()))) {
						out.add(candidate(entry.procedure().performedPath(), Boolean.FALSE, text,
								sentence.getStart() + m.start(), sentence.getStart() + m.end(),
								PriorityClass.EXPLICIT_NEGATION));
						break;
					}
				}
			}
		}
		return out;
	}
}
