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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.proclens.ip.om.Attribute;
import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.processing.support.ContextWindow;
import org.proclens.ip.processing.support.NegationCues;
import org.proclens.ip.processing.support.NoteLines;
import org.proclens.ip.processing.support.NoteLines.Segment;

/**
 * Moderate sedation statement: whether it was given, by whom, for how long,
 * and whether an independent observer monitored the patient. Times and
 * roles are read only from lines that mention sedation.
 */
public class SedationExtractor extends AbstractPatternExtractor {

	public static final String NAME = "sedation";
	public static final double CONFIDENCE = 0.9;

	private static final Pattern SEDATION_LINE = ProcedureLexicon.ci("\\bsedation\\b");
	private static final Pattern MODERATE = ProcedureLexicon
			.ci("\\b(?:moderate|conscious|procedural)\\s+(?:\\(conscious\\)\\s+)?sedation\\b");
	private static final Pattern START = ProcedureLexicon
			.ci("\\b(?:start(?:ed)?|began|begin|initiated)\\b\\D{0,20}?\\b([01]?\\d|2[0-3]):?([0-5]\\d)\\b");
	private static final Pattern END = ProcedureLexicon
			.ci("\\b(?:end(?:ed)?|stop(?:ped)?|completed|finished)\\b\\D{0,20}?\\b([01]?\\d|2[0-3]):?([0-5]\\d)\\b");
	private static final Pattern DURATION = ProcedureLexicon
			.ci("\\b(?:for|time|duration|total)\\D{0,20}?(\\d{1,3})\\s*(?:min(?:ute)?s?)\\b");
	private static final Pattern OBSERVER = ProcedureLexicon
			.ci("\\b(?:independent(?:ly)?\\s+(?:trained\\s+)?observer|(?:RN|nurse)\\s+monitor\\w*|monitored by (?:an? )?(?:independent |trained )*(?:RN|nurse|observer))\\b");

	/** Role vocabulary, first match wins. */
	private static final Map<Pattern, String> ROLES = new LinkedHashMap<>();

	static {
		ROLES.put(ProcedureLexicon.ci("\\b(?:anesthesi\\w*|CRNA)\\b"), "anesthesia");
		ROLES.put(ProcedureLexicon.ci("\\b(?:performing|proceduralist|operator|pulmonologist|interventionalist|bronchoscopist)\\b"),
				"proceduralist");
		ROLES.put(ProcedureLexicon.ci("\\battending\\b"), "attending");
		ROLES.put(ProcedureLexicon.ci("\\bphysician\\b"), "physician");
		ROLES.put(ProcedureLexicon.ci("\\b(?:nurse|RN)\\b"), "nurse");
	}

	private static final Pattern ADMINISTERED = ProcedureLexicon
			.ci("\\b(?:administered|given|provided|directed|supervised|ordered)\\s+by\\b");

	public SedationExtractor() {
		super(NAME, CONFIDENCE);
	}

	@Override
	public List<CandidateDetection> detect(String text) {
		List<CandidateDetection> out = new ArrayList<>();
		if (text == null || text.isBlank()) {
			return out;
		}
		Procedure p = Procedure.MODERATE_SEDATION;
		boolean performed = false;
		for (Segment line : NoteLines.lines(text)) {
			String s = line.getText();
			if (!SEDATION_LINE.matcher(s).find()) {
				continue;
			}
			int base = line.getStart();
			Matcher m = MODERATE.matcher(s);
			if (m.find() && !performed) {
				boolean negated = NegationCues.negates(ContextWindow.around(s, m.start(), m.end(), s.length()));
				out.add(candidate(p.performedPath(), !negated, text, base + m.start(), base + m.end(),
						negated ? PriorityClass.EXPLICIT_NEGATION : PriorityClass.NARRATIVE));
				performed = !negated;
			}
			if ((m = START.matcher(s)).find()) {
				out.add(candidate(p.path(Attribute.START_TIME), clock(m), text, base + m.start(1), base + m.end(2),
						PriorityClass.NARRATIVE));
			}
			if ((m = END.matcher(s)).find()) {
				out.add(candidate(p.path(Attribute.END_TIME), clock(m), text, base + m.start(1), base + m.end(2),
						PriorityClass.NARRATIVE));
			}
			if ((m = DURATION.matcher(s)).find()) {
				out.add(candidate(p.path(Attribute.DURATION_MINUTES), Integer.parseInt(m.group(1)), text,
						base + m.start(), base + m.end(), PriorityClass.NARRATIVE));
			}
			role(text, line, out);
		}
		// the monitoring statement often stands on its own line
		Matcher observer = OBSERVER.matcher(text);
		if (performed && observer.find()) {
			out.add(candidate(p.path(Attribute.OBSERVER_PRESENT), Boolean.TRUE, text, observer.start(), observer.end(),
					PriorityClass.NARRATIVE));
		}
		return out;
	}

	private void role(String text, Segment line, List<CandidateDetection> out) {
		String s = line.getText();
		Matcher by = ADMINISTERED.matcher(s);
		int from = by.find() ? by.end() : 0;
		for (Map.Entry<Pattern, String> e : ROLES.entrySet()) {
			Matcher m = e.getKey().matcher(s);
			if (m.find(from)) {
				out.add(candidate(Procedure.MODERATE_SEDATION.path(Attribute.ADMINISTERED_BY), e.getValue(), text,
						line.getStart() + m.start(), line.getStart() + m.end(), PriorityClass.NARRATIVE));
				return;
			}
		}
	}

	/** "9:05" and "0905" both become "09:05". */
	static String clock(Matcher m) {
		return String.format("%02d:%s", Integer.parseInt(m.group(1)), m.group(2));
	}
}
