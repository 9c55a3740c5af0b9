package org.proclens.ip.processing.learned;

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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.ExtractorKind;
import org.proclens.ip.processing.extract.CandidateExtractor;
import org.proclens.ip.processing.support.ExtractorUnavailableException;
import org.proclens.ip.processing.support.MalformedExtractorOutputException;
import org.proclens.ip.util.Logger;

/**
 * Turns tagged spans from a {@link SpanPredictor} into candidates through a
 * {@link LabelMapping}. Output is validated as a whole: one span with bad
 * offsets or confidence discards the run.
 */
public class LearnedExtractor implements CandidateExtractor {

	public static final String ID = ExtractorKind.LEARNED.id("ner");

	private final SpanPredictor predictor;
	private final LabelMapping mapping;

	public LearnedExtractor(SpanPredictor predictor, LabelMapping mapping) {
		this.predictor = predictor;
		this.mapping = mapping;
	}

	@Override
	public String id() {
		return ID;
	}

	/**
	 * @throws ExtractorUnavailableException when the predictor is unavailable or
	 *                                       its output is malformed
	 */
	public LearnedExtraction extract(String text) throws ExtractorUnavailableException {
		List<PredictedSpan> spans = predictor.predict(text);
		if (spans == null) {
			throw new MalformedExtractorOutputException("Predictor returned no span list");
		}
		for (PredictedSpan s : spans) {
			validate(s, text);
		}
		List<CandidateDetection> out = new ArrayList<>();
		Map<String, Double> raw = new TreeMap<>();
		int unknown = 0;
		for (PredictedSpan s : spans) {
			Optional<LabelMapping.Target> target = mapping.target(s.getLabel());
			if (target.isEmpty()) {
				unknown++;
				continue;
			}
			String spanText = text.substring(s.getStart(), s.getEnd());
			Optional<Object> value = LabelMapping.valueFor(target.get(), spanText);
			if (value.isEmpty()) {
				Logger.debug("{}: '{}' does not fit {}", ID, spanText, target.get().getFieldPath());
				continue;
			}
			EvidenceSpan ev = EvidenceSpan.of(text, s.getStart(), s.getEnd(), ID, s.getConfidence());
			String path = target.get().getFieldPath();
			out.add(CandidateDetection.of(path, value.get(), ev, ID, target.get().getPriorityClass()));
			if (Boolean.TRUE.equals(value.get())) {
				raw.merge(path, s.getConfidence(), Math::max);
			}
		}
		if (unknown > 0) {
			Logger.debug("{}: skipped {} spans with unmapped labels", ID, unknown);
		}
		return new LearnedExtraction(Collections.unmodifiableList(out), Collections.unmodifiableMap(raw));
	}

	/** Degrades to no candidates when the model is unavailable. */
	@Override
	public List<CandidateDetection> detect(String text) {
		try {
			return extract(text).getCandidates();
		} catch (ExtractorUnavailableException e) {
			Logger.warn("{} unavailable: {}", ID, e.getMessage());
			return List.of();
		}
	}

	private static void validate(PredictedSpan s, String text) throws MalformedExtractorOutputException {
		if (s == null || s.getLabel() == null) {
			throw new MalformedExtractorOutputException("Span without label");
		}
		if (s.getStart() < 0 || s.getEnd() <= s.getStart() || s.getEnd() > text.length()) {
			throw new MalformedExtractorOutputException(
					"Span " + s.getLabel() + " [" + s.getStart() + "," + s.getEnd() + ") outside note");
		}
		double c = s.getConfidence();
		if (Double.isNaN(c) || c < 0.0 || c > 1.0) {
			throw new MalformedExtractorOutputException("Span " + s.getLabel() + " has confidence " + c);
		}
	}
}
