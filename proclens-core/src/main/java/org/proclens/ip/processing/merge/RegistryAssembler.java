package org.proclens.ip.processing.merge;

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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;
import java.util.regex.Pattern;

import org.proclens.ip.om.Attribute;
import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.ExtractorKind;
import org.proclens.ip.om.FieldType;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryField;
import org.proclens.ip.om.RegistryRecord;
import org.proclens.ip.om.RegistrySchema;
import org.proclens.ip.processing.support.NoteLines;
import org.proclens.ip.util.Logger;

/**
 * Builds the registry record from surviving candidates.
 *
 * <p>Per field: agreeing candidates are merged. On disagreement the highest
 * authority tier decides (narrative and explicit negation over headers over
 * template rows). Inside the top tier, more evidence spans win, then the
 * higher confidence, then extractor precedence with a {@code CONFLICT_TIE}
 * warning. List-valued details are unioned within the top tier. Details of a
 * procedure that did not resolve to performed are discarded.</p>
 *
 * <p>The result depends only on the candidate multiset, not on its order.</p>
 */
public class RegistryAssembler {

	public static final String CONFLICT_TIE = "CONFLICT_TIE";

	private static final Pattern BOX_ROW = Pattern.compile("^\\s*(?:\\[[^\\]]?\\]|[☐☒☑□✓✔]|\\([ xX]?\\)|[01]\\s*[-–—])");

	private static final Comparator<EvidenceSpan> BY_POSITION = Comparator.comparingInt(EvidenceSpan::getStart)
			.thenComparingInt(EvidenceSpan::getEnd).thenComparing(EvidenceSpan::getSource)
			.thenComparingDouble(EvidenceSpan::getConfidence);

	private static final Comparator<CandidateDetection> CANONICAL = Comparator
			.comparing(CandidateDetection::primaryEvidence, BY_POSITION)
			.thenComparing(CandidateDetection::getExtractorId)
			.thenComparing(c -> String.valueOf(c.getValue()))
			.thenComparing(c -> c.getPriorityClass().name());

	/**
	 * @param candidates surviving candidates, any order
	 * @param text       scanned note text, used to tell checkbox rows from template defaults
	 */
	public AssemblyResult assemble(List<CandidateDetection> candidates, String text) {
		List<String> warnings = new ArrayList<>();
		List<Resolution> resolutions = new ArrayList<>();
		Map<String, List<CandidateDetection>> byPath = new TreeMap<>();
		for (CandidateDetection c : candidates) {
			FieldType type = RegistrySchema.typeOf(c.getFieldPath()).orElse(null);
			if (type == null) {
				warnings.add("REJECTED_CANDIDATE: unknown field " + c.getFieldPath() + " from " + c.getExtractorId());
				continue;
			}
			if (!type.accepts(c.getValue())) {
				warnings.add("REJECTED_CANDIDATE: " + c.getFieldPath() + " expects " + type + " from "
						+ c.getExtractorId());
				continue;
			}
			byPath.computeIfAbsent(c.getFieldPath(), k -> new ArrayList<>()).add(c);
		}
		for (List<CandidateDetection> group : byPath.values()) {
			group.sort(CANONICAL);
		}

		RegistryRecord record = new RegistryRecord();
		// performed flags first: details depend on them
		for (Map.Entry<String, List<CandidateDetection>> e : byPath.entrySet()) {
			if (RegistrySchema.attributeOf(e.getKey()).orElse(null) == Attribute.PERFORMED) {
				resolve(e.getKey(), e.getValue(), text, record, resolutions, warnings);
			}
		}
		for (Map.Entry<String, List<CandidateDetection>> e : byPath.entrySet()) {
			String path = e.getKey();
			if (RegistrySchema.attributeOf(path).orElse(null) == Attribute.PERFORMED) {
				continue;
			}
			Procedure p = RegistrySchema.procedureOf(path).orElseThrow();
			if (!record.isPerformed(p)) {
				Logger.debug("Dropping {} detail candidates for {}: procedure not performed", e.getValue().size(), path);
				continue;
			}
			if (RegistrySchema.typeOf(path).orElseThrow() == FieldType.STRING_LIST) {
				unionList(path, e.getValue(), record, resolutions);
			} else {
				resolve(path, e.getValue(), text, record, resolutions, warnings);
			}
		}
		Logger.debug("Assembled {} fields from {} candidates ({} conflicts)", record.size(), candidates.size(),
				resolutions.size());
		return new AssemblyResult(record, List.copyOf(resolutions), List.copyOf(warnings));
	}

	private void resolve(String path, List<CandidateDetection> group, String text, RegistryRecord record,
			List<Resolution> resolutions, List<String> warnings) {
		Map<Object, List<CandidateDetection>> byValue = byValue(group);
		if (byValue.size() == 1) {
			Object value = byValue.keySet().iterator().next();
			record.put(path, field(value, group));
			return;
		}

		int topTier = 0;
		for (CandidateDetection c : group) {
			topTier = Math.max(topTier, c.getPriorityClass().tier());
		}
		List<CandidateDetection> top = new ArrayList<>();
		for (CandidateDetection c : group) {
			if (c.getPriorityClass().tier() == topTier) {
				top.add(c);
			}
		}
		Map<Object, List<CandidateDetection>> topByValue = byValue(top);
		Object winner;
		ConflictRule rule;
		if (topByValue.size() == 1) {
			winner = topByValue.keySet().iterator().next();
			rule = crossTierRule(winner, group, topTier, text);
		} else {
			winner = tieBreak(path, topByValue, warnings);
			rule = ConflictRule.SAME_TIER_TIEBREAK;
		}

		List<String> overruled = new ArrayList<>();
		for (CandidateDetection c : group) {
			if (!c.getValue().equals(winner)) {
				overruled.add(c.getExtractorId() + "=" + c.getValue());
			}
		}
		resolutions.add(new Resolution(path, winner, rule, overruled));
		record.put(path, field(winner, byValue.get(winner)));
		Logger.debug("Conflict on {} resolved to {} by {} (overruled {})", path, winner, rule, overruled);
	}

	/** Names the hierarchy step when one tier alone holds the winning value. */
	private ConflictRule crossTierRule(Object winner, List<CandidateDetection> group, int topTier, String text) {
		if (topTier != PriorityClass.NARRATIVE.tier()) {
			return ConflictRule.AUTHORITY_TIER;
		}
		boolean header = false;
		boolean uncheckedBox = false;
		boolean template = false;
		for (CandidateDetection c : group) {
			if (c.getValue().equals(winner)) {
				continue;
			}
			if (c.getPriorityClass() == PriorityClass.HEADER) {
				header = true;
			} else if (c.getPriorityClass() == PriorityClass.CHECKBOX_TEMPLATE) {
				if (Boolean.TRUE.equals(winner) && Boolean.FALSE.equals(c.getValue()) && isBoxRow(c, text)) {
					uncheckedBox = true;
				} else {
					template = true;
				}
			}
		}
		if (template) {
			return ConflictRule.NARRATIVE_OVER_TEMPLATE_DEFAULT;
		}
		if (header) {
			return ConflictRule.NARRATIVE_OVER_HEADER;
		}
		if (uncheckedBox) {
			return ConflictRule.NARRATIVE_OVER_UNCHECKED_BOX;
		}
		return ConflictRule.AUTHORITY_TIER;
	}

	private Object tieBreak(String path, Map<Object, List<CandidateDetection>> topByValue, List<String> warnings) {
		List<Object> best = new ArrayList<>(topByValue.keySet());

		best = keepMax(best, v -> spanCount(topByValue.get(v)));
		if (best.size() == 1) {
			return best.get(0);
		}
		best = keepMaxDouble(best, v -> maxConfidence(topByValue.get(v)));
		if (best.size() == 1) {
			return best.get(0);
		}
		warnings.add(CONFLICT_TIE + ": " + path + " values " + best + " tied on evidence and confidence");
		best = keepMax(best, v -> -bestKind(topByValue.get(v)).ordinal());
		if (best.size() == 1) {
			return best.get(0);
		}
		best.sort(Comparator.comparing(String::valueOf));
		return best.get(0);
	}

	/** Union of list values from the top tier, in order of first evidence. */
	private void unionList(String path, List<CandidateDetection> group, RegistryRecord record,
			List<Resolution> resolutions) {
		int topTier = 0;
		for (CandidateDetection c : group) {
			topTier = Math.max(topTier, c.getPriorityClass().tier());
		}
		Set<String> values = new LinkedHashSet<>();
		List<CandidateDetection> used = new ArrayList<>();
		List<String> overruled = new ArrayList<>();
		for (CandidateDetection c : group) {
			if (c.getPriorityClass().tier() == topTier) {
				for (Object o : (List<?>) c.getValue()) {
					values.add((String) o);
				}
				used.add(c);
			}
		}
		for (CandidateDetection c : group) {
			if (c.getPriorityClass().tier() != topTier && !values.containsAll((List<?>) c.getValue())) {
				overruled.add(c.getExtractorId() + "=" + c.getValue());
			}
		}
		List<String> value = new ArrayList<>(values);
		if (!overruled.isEmpty()) {
			resolutions.add(new Resolution(path, value, ConflictRule.AUTHORITY_TIER, overruled));
		}
		record.put(path, field(value, used));
	}

	// ---- helpers ----

	private static Map<Object, List<CandidateDetection>> byValue(List<CandidateDetection> group) {
		Map<Object, List<CandidateDetection>> out = new LinkedHashMap<>();
		for (CandidateDetection c : group) {
			out.computeIfAbsent(c.getValue(), k -> new ArrayList<>()).add(c);
		}
		return out;
	}

	private static RegistryField field(Object value, List<CandidateDetection> supporting) {
		Set<EvidenceSpan> evidence = new TreeSet<>(BY_POSITION);
		Set<String> ids = new TreeSet<>();
		for (CandidateDetection c : supporting) {
			evidence.addAll(c.getEvidence());
			ids.add(c.getExtractorId());
		}
		return RegistryField.assembled(value, new ArrayList<>(evidence), ids);
	}

	private static int spanCount(List<CandidateDetection> cs) {
		Set<EvidenceSpan> spans = new TreeSet<>(BY_POSITION);
		for (CandidateDetection c : cs) {
			spans.addAll(c.getEvidence());
		}
		return spans.size();
	}

	private static double maxConfidence(List<CandidateDetection> cs) {
		double max = 0.0;
		for (CandidateDetection c : cs) {
			max = Math.max(max, c.maxConfidence());
		}
		return max;
	}

	private static ExtractorKind bestKind(List<CandidateDetection> cs) {
		ExtractorKind best = ExtractorKind.CORRECTIVE;
		for (CandidateDetection c : cs) {
			if (c.kind().ordinal() < best.ordinal()) {
				best = c.kind();
			}
		}
		return best;
	}

	private static List<Object> keepMax(List<Object> values, ToIntFunction<Object> score) {
		int max = Integer.MIN_VALUE;
		for (Object v : values) {
			max = Math.max(max, score.applyAsInt(v));
		}
		List<Object> out = new ArrayList<>();
		for (Object v : values) {
			if (score.applyAsInt(v) == max) {
				out.add(v);
			}
		}
		return out;
	}

	private static List<Object> keepMaxDouble(List<Object> values, ToDoubleFunction<Object> score) {
		double max = Double.NEGATIVE_INFINITY;
		for (Object v : values) {
			max = Math.max(max, score.applyAsDouble(v));
		}
		List<Object> out = new ArrayList<>();
		for (Object v : values) {
			if (score.applyAsDouble(v) == max) {
				out.add(v);
			}
		}
		return out;
	}

	private static boolean isBoxRow(CandidateDetection c, String text) {
		if (text == null) {
			return false;
		}
		int start = c.primaryEvidence().getStart();
		return start <= text.length() && BOX_ROW.matcher(NoteLines.lineAt(text, start)).find();
	}
}
