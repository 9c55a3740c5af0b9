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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.proclens.ip.om.Attribute;
import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.processing.support.AnatomicSites;
import org.proclens.ip.processing.support.ContextWindow;
import org.proclens.ip.processing.support.NegationCues;
import org.proclens.ip.processing.support.NoteLines;
import org.proclens.ip.processing.support.NoteLines.Segment;
import org.proclens.ip.util.Logger;

/**
 * Reads the procedure narrative sentence by sentence. A procedure is claimed
 * when its name and its action verb share a sentence; details (sites, EBUS
 * stations, valve count, tube size, ultrasound guidance) come from the same
 * sentences.
 */
public class NarrativeProcedureExtractor extends AbstractPatternExtractor {

	public static final String NAME = "narrative";
	public static final double CONFIDENCE = 0.95;
	static final double DETAIL_CONFIDENCE = 0.9;

	private static final Pattern NOT_SAMPLED = ProcedureLexicon.ci(
			"\\b(?:not (?:sampled|biopsied|aspirated)|(?:inspected|visuali[sz]ed|examined|evaluated|measured) only|no sampling|without sampling|too small to sample)\\b");
	private static final Pattern VALVE_COUNT = ProcedureLexicon.ci(
			"\\b(\\d{1,2}|one|two|three|four|five|six)\\s+(?:(?:Zephyr|Spiration|endobronchial|one-way|EBV|IBV|[\\d.]+(?:\\s*mm)?(?:-LP)?)\\s+){0,3}valves?\\b");
	private static final Pattern TUBE_SIZE = ProcedureLexicon.ci("\\b(\\d{1,2})\\s*-?\\s*(?:Fr|French|F)\\b");
	private static final Pattern US_GUIDANCE = ProcedureLexicon.ci(
			"\\b(?:ultrasound|US|sonograph(?:ic|y))[- ]guid\\w*|\\bunder (?:real-time )?(?:ultrasound|US|sonographic) guidance\\b|\\b(?:ultrasound|sonography) was used to (?:identify|localize|mark|guide|confirm)\\b|\\bsite (?:was )?(?:marked|localized) (?:with|by|under) ultrasound\\b");
	private static final Map<String, Integer> NUMBER_WORDS = Map.of("one", 1, "two", 2, "three", 3, "four", 4,
			"five", 5, "six", 6);

	private static final Set<Procedure> GUIDED = Set.of(Procedure.THORACENTESIS, Procedure.CHEST_TUBE_INSERTION);

	public NarrativeProcedureExtractor() {
		super(NAME, CONFIDENCE);
	}

	@Override
	public List<CandidateDetection> detect(String text) {
		List<CandidateDetection> out = new ArrayList<>();
		if (text == null || text.isBlank()) {
			return out;
		}
		List<Segment> sentences = NoteLines.sentences(text);
		Set<Procedure> claimed = new LinkedHashSet<>();
		for (Segment sentence : sentences) {
			for (ProcedureLexicon.Entry entry : ProcedureLexicon.entries().values()) {
				Matcher m = entry.mention().matcher(sentence.getText());
				if (!m.find() || !entry.describesEvent(sentence.getText())) {
					continue;
				}
				int start = sentence.getStart() + m.start();
				int end = sentence.getStart() + m.end();
				if (NegationCues.negates(ContextWindow.around(sentence.getText(), m.start(), m.end(),
						sentence.getText().length()))) {
					continue;
				}
				Procedure p = entry.procedure();
				out.add(candidate(p.performedPath(), Boolean.TRUE, text, start, end, PriorityClass.NARRATIVE));
				claimed.add(p);
				if (p.has(Attribute.SITES)) {
					List<String> sites = entry.siteKind().extract(sentence.getText());
					if (!sites.isEmpty()) {
						out.add(detail(p.path(Attribute.SITES), sites, text, sentence));
					}
				}
			}
		}
		if (claimed.contains(Procedure.LINEAR_EBUS)) {
			stations(text, sentences, out);
		}
		if (claimed.contains(Procedure.BLVR_VALVE_PLACEMENT)) {
			valveCount(text, sentences, out);
		}
		if (claimed.contains(Procedure.CHEST_TUBE_INSERTION)) {
			tubeSize(text, sentences, out);
		}
		for (Procedure p : GUIDED) {
			if (claimed.contains(p)) {
				guidance(p, text, out);
			}
		}
		Logger.debug("{}: {} candidates from {} sentences", id(), out.size(), sentences.size());
		return out;
	}

	// ---- Details ----

	/** Stations named in sentences that describe sampling, not mere inspection. */
	private void stations(String text, List<Segment> sentences, List<CandidateDetection> out) {
		Set<String> stations = new LinkedHashSet<>();
		List<EvidenceSpan> evidence = new ArrayList<>();
		for (Segment s : sentences) {
			if (!ProcedureLexicon.SAMPLE_VERBS.matcher(s.getText()).find()
					|| NOT_SAMPLED.matcher(s.getText()).find()) {
				continue;
			}
			for (AnatomicSites.StationHit hit : AnatomicSites.stationHits(s.getText())) {
				if (stations.add(hit.getStation())) {
					evidence.add(EvidenceSpan.of(text, s.getStart() + hit.getStart(), s.getStart() + hit.getEnd(), id(),
							DETAIL_CONFIDENCE));
				}
			}
		}
		if (!stations.isEmpty()) {
			out.add(candidate(Procedure.LINEAR_EBUS.path(Attribute.STATIONS), new ArrayList<>(stations), evidence,
					PriorityClass.NARRATIVE));
		}
	}

	/** Valve counts are summed over sentences ("two valves in the RUL. One valve in RB6."). */
	private void valveCount(String text, List<Segment> sentences, List<CandidateDetection> out) {
		int total = 0;
		List<EvidenceSpan> evidence = new ArrayList<>();
		for (Segment s : sentences) {
			if (!ProcedureLexicon.PLACE_VERBS.matcher(s.getText()).find()) {
				continue;
			}
			Matcher m = VALVE_COUNT.matcher(s.getText());
			while (m.find()) {
				total += parseCount(m.group(1));
				evidence.add(EvidenceSpan.of(text, s.getStart() + m.start(), s.getStart() + m.end(), id(),
						DETAIL_CONFIDENCE));
			}
		}
		if (total > 0) {
			out.add(candidate(Procedure.BLVR_VALVE_PLACEMENT.path(Attribute.VALVE_COUNT), total, evidence,
					PriorityClass.NARRATIVE));
		}
	}

	private void tubeSize(String text, List<Segment> sentences, List<CandidateDetection> out) {
		ProcedureLexicon.Entry entry = ProcedureLexicon.get(Procedure.CHEST_TUBE_INSERTION).orElseThrow();
		for (Segment s : sentences) {
			if (!entry.mention().matcher(s.getText()).find()) {
				continue;
			}
			Matcher m = TUBE_SIZE.matcher(s.getText());
			if (m.find()) {
				out.add(detailAt(Procedure.CHEST_TUBE_INSERTION.path(Attribute.TUBE_SIZE_FR),
						Integer.parseInt(m.group(1)), text, s.getStart() + m.start(), s.getStart() + m.end()));
				return;
			}
		}
	}

	private void guidance(Procedure p, String text, List<CandidateDetection> out) {
		Matcher m = US_GUIDANCE.matcher(text);
		if (m.find()) {
			out.add(detailAt(p.path(Attribute.GUIDANCE), "ULTRASOUND", text, m.start(), m.end()));
		}
	}

	private CandidateDetection detail(String path, Object value, String text, Segment sentence) {
		return detailAt(path, value, text, sentence.getStart(), sentence.getEnd());
	}

	private CandidateDetection detailAt(String path, Object value, String text, int start, int end) {
		return CandidateDetection.of(path, value, EvidenceSpan.of(text, start, end, id(), DETAIL_CONFIDENCE), id(),
				PriorityClass.NARRATIVE);
	}

	static int parseCount(String token) {
		Integer word = NUMBER_WORDS.get(token.toLowerCase(Locale.ROOT));
		return word != null ? word : Integer.parseInt(token);
	}
}
