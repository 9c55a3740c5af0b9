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

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.ExtractorKind;
import org.proclens.ip.om.PriorityClass;

/**
 * Shared plumbing of the rule-based extractors: id, confidence and candidate
 * construction with evidence cited straight from the scanned text.
 */
abstract class AbstractPatternExtractor implements CandidateExtractor {

	private final String id;
	private final double confidence;

	protected AbstractPatternExtractor(String name, double confidence) {
		this.id = ExtractorKind.PATTERN.id(name);
		this.confidence = confidence;
	}

	@Override
	public String id() {
		return id;
	}

	protected double confidence() {
		return confidence;
	}

	protected EvidenceSpan cite(String text, int start, int end) {
		return EvidenceSpan.of(text, start, end, id, confidence);
	}

	protected CandidateDetection candidate(String fieldPath, Object value, String text, int start, int end,
			PriorityClass priorityClass) {
		return CandidateDetection.of(fieldPath, value, cite(text, start, end), id, priorityClass);
	}

	protected CandidateDetection candidate(String fieldPath, Object value, List<EvidenceSpan> evidence,
			PriorityClass priorityClass) {
		return new CandidateDetection(fieldPath, value, evidence, id, priorityClass);
	}
}
