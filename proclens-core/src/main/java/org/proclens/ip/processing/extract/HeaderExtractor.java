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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.processing.support.NoteLines;
import org.proclens.ip.processing.support.NoteLines.Segment;
import org.proclens.ip.util.Logger;

/**
 * Reads the "PROCEDURES PERFORMED:" style header list. Headers are often
 * carried forward from an order or template, so each header claim is also
 * checked against the body: when the body narrates an alternative procedure
 * and never the listed one, a narrative {@code false} candidate is emitted
 * citing the alternative.
 */
public class HeaderExtractor extends AbstractPatternExtractor {

	public static final String NAME = "header";
	public static final String CONTRADICTION_ID = "pattern.narrative_contradiction";
	public static final double CONFIDENCE = 0.8;

	private static final Pattern HEADING = ProcedureLexicon.ci(
			"^\\s*(?:PROCEDURES?(?:\\s+PERFORMED)?|OPERATIONS?(?:\\s+PERFORMED)?|PROCEDURE\\s+NAME)\\s*:");
	private static final Pattern NEXT_HEADING = Pattern.compile("^\\s*[A-Z][A-Za-z /&()-]{2,40}:\\s*(?:$|\\S)");
	private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:\\d{1,2}[.)]|[-*•])\\s+");
	private static final Pattern FLEXIBLE_SCOPE = ProcedureLexicon.ci("\\bflexible (?:bronchoscop\\w*|scope)\\b");

	/** Removal procedures need their verb even in a header; "Chest tube" alone means insertion. */
	static final Set<Procedure> VERB_REQUIRED = Set.of(Procedure.AIRWAY_STENT_REMOVAL, Procedure.CHEST_TUBE_REMOVAL,
			Procedure.IPC_REMOVAL, Procedure.BLVR_VALVE_REMOVAL);

	private static final Map<Procedure, List<Procedure>> ALTERNATIVES = new EnumMap<>(Procedure.class);

	static {
		alternatives(Procedure.LINEAR_EBUS, Procedure.RADIAL_EBUS);
		alternatives(Procedure.RADIAL_EBUS, Procedure.LINEAR_EBUS);
		alternatives(Procedure.TRANSBRONCHIAL_BIOPSY, Procedure.TRANSBRONCHIAL_CRYOBIOPSY);
		alternatives(Procedure.TRANSBRONCHIAL_CRYOBIOPSY, Procedure.TRANSBRONCHIAL_BIOPSY);
		alternatives(Procedure.THORACENTESIS, Procedure.CHEST_TUBE_INSERTION, Procedure.IPC_PLACEMENT);
		alternatives(Procedure.CHEST_TUBE_INSERTION, Procedure.THORACENTESIS, Procedure.IPC_PLACEMENT,
				Procedure.CHEST_TUBE_REMOVAL);
		alternatives(Procedure.IPC_PLACEMENT, Procedure.THORACENTESIS, Procedure.CHEST_TUBE_INSERTION,
				Procedure.IPC_REMOVAL);
		alternatives(Procedure.AIRWAY_STENT_PLACEMENT, Procedure.AIRWAY_STENT_REMOVAL);
		alternatives(Procedure.AIRWAY_STENT_REMOVAL, Procedure.AIRWAY_STENT_PLACEMENT);
		alternatives(Procedure.CHEST_TUBE_REMOVAL, Procedure.CHEST_TUBE_INSERTION);
		alternatives(Procedure.IPC_REMOVAL, Procedure.IPC_PLACEMENT);
		alternatives(Procedure.BLVR_VALVE_PLACEMENT, Procedure.BLVR_VALVE_REMOVAL);
		alternatives(Procedure.BLVR_VALVE_REMOVAL, Procedure.BLVR_VALVE_PLACEMENT);
		alternatives(Procedure.THERMAL_ABLATION, Procedure.CRYOTHERAPY);
		alternatives(Procedure.CRYOTHERAPY, Procedure.THERMAL_ABLATION);
	}

	public HeaderExtractor() {
		super(NAME, CONFIDENCE);
	}

	@Override
	public List<CandidateDetection> detect(String text) {
		List<CandidateDetection> out = new ArrayList<>();
		if (text == null || text.isBlank()) {
			return out;
		}
		List<Segment> lines = NoteLines.lines(text);
		int bodyStart = 0;
		Map<Procedure, int[]> listed = new LinkedHashMap<>();
		for (int i = 0; i < lines.size(); i++) {
			Matcher heading = HEADING.matcher(lines.get(i).getText());
			if (!heading.find()) {
				continue;
			}
			// the heading line may itself carry the first item
			scan(text, lines.get(i), heading.end(), listed);
			int j = i + 1;
			for (; j < lines.size(); j++) {
				String line = lines.get(j).getText();
				if (line.isBlank() || (NEXT_HEADING.matcher(line).find() && !LIST_ITEM.matcher(line).find())) {
					break;
				}
				scan(text, lines.get(j), 0, listed);
			}
			bodyStart = j < lines.size() ? lines.get(j).getStart() : text.length();
			i = j - 1;
		}
		for (Map.Entry<Procedure, int[]> e : listed.entrySet()) {
			int[] span = e.getValue();
			out.add(candidate(e.getKey().performedPath(), Boolean.TRUE, text, span[0], span[1], PriorityClass.HEADER));
		}
		if (!listed.isEmpty()) {
			contradictions(text, bodyStart, listed.keySet(), out);
		}
		Logger.debug("{}: {} header procedures", id(), listed.size());
		return out;
	}

	private void scan(String text, Segment line, int from, Map<Procedure, int[]> listed) {
		String item = line.getText().substring(from);
		for (ProcedureLexicon.Entry entry : ProcedureLexicon.entries().values()) {
			Procedure p = entry.procedure();
			if (listed.containsKey(p)) {
				continue;
			}
			Matcher m = entry.mention().matcher(item);
			if (!m.find()) {
				continue;
			}
			if (entry.exclude() != null && entry.exclude().matcher(item).find()) {
				continue;
			}
			if (VERB_REQUIRED.contains(p) && !entry.describesEvent(item)) {
				continue;
			}
			int base = line.getStart() + from;
			listed.put(p, new int[] { base + m.start(), base + m.end() });
		}
	}

	/** Header procedures the body never narrates while it narrates an alternative. */
	private void contradictions(String text, int bodyStart, Set<Procedure> listed, List<CandidateDetection> out) {
		List<Segment> body = new ArrayList<>();
		for (Segment s : NoteLines.sentences(text)) {
			if (s.getStart() >= bodyStart) {
				body.add(s);
			}
		}
		for (Procedure x : listed) {
			if (narrated(x, body) != null) {
				continue;
			}
			int[] alt = null;
			if (x == Procedure.RIGID_BRONCHOSCOPY) {
				alt = find(FLEXIBLE_SCOPE, body);
			} else {
				for (Procedure y : ALTERNATIVES.getOrDefault(x, List.of())) {
					alt = narrated(y, body);
					if (alt != null) {
						break;
					}
				}
			}
			if (alt != null) {
				EvidenceSpan ev = EvidenceSpan.of(text, alt[0], alt[1], CONTRADICTION_ID, NarrativeProcedureExtractor.CONFIDENCE);
				out.add(CandidateDetection.of(x.performedPath(), Boolean.FALSE, ev, CONTRADICTION_ID,
						PriorityClass.NARRATIVE));
				Logger.debug("{}: header lists {} but the narrative describes '{}'", id(), x.key(), ev.getText());
			}
		}
	}

	private static int[] narrated(Procedure p, List<Segment> body) {
		ProcedureLexicon.Entry entry = ProcedureLexicon.get(p).orElse(null);
		if (entry == null) {
			return null;
		}
		for (Segment s : body) {
			Matcher m = entry.mention().matcher(s.getText());
			if (m.find() && entry.describesEvent(s.getText())) {
				return new int[] { s.getStart() + m.start(), s.getStart() + m.end() };
			}
		}
		return null;
	}

	private static int[] find(Pattern pattern, List<Segment> body) {
		for (Segment s : body) {
			Matcher m = pattern.matcher(s.getText());
			if (m.find()) {
				return new int[] { s.getStart() + m.start(), s.getStart() + m.end() };
			}
		}
		return null;
	}

	private static void alternatives(Procedure p, Procedure... alts) {
		ALTERNATIVES.put(p, List.of(alts));
	}
}
