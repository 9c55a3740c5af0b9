package org.proclens.ip.om;

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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One extractor's claim about one registry field, with the evidence it read.
 * Several candidates may target the same field; the assembler resolves them.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CandidateDetection {

	/** Dotted path into the registry schema, e.g. {@code bal.performed}. */
	private final String fieldPath;

	/** Typed value (Boolean, Integer, String or List of String). */
	private final Object value;

	/** Never empty. */
	private final List<EvidenceSpan> evidence;

	/** Producer id, prefixed by its {@link ExtractorKind}. */
	private final String extractorId;

	private final PriorityClass priorityClass;

	public CandidateDetection(String fieldPath, Object value, List<EvidenceSpan> evidence, String extractorId,
			PriorityClass priorityClass) {
		if (fieldPath == null || fieldPath.isBlank()) {
			throw new IllegalArgumentException("Candidate needs a field path");
		}
		if (value == null) {
			throw new IllegalArgumentException("Candidate for " + fieldPath + " has no value");
		}
		if (evidence == null || evidence.isEmpty()) {
			throw new IllegalArgumentException("Candidate for " + fieldPath + " has no evidence");
		}
		if (extractorId == null || priorityClass == null) {
			throw new IllegalArgumentException("Candidate for " + fieldPath + " lacks extractor or priority");
		}
		this.fieldPath = fieldPath;
		this.value = value instanceof List ? List.copyOf((List<?>) value) : value;
		this.evidence = List.copyOf(evidence);
		this.extractorId = extractorId;
		this.priorityClass = priorityClass;
	}

	/** Convenience for a single evidence span. */
	public static CandidateDetection of(String fieldPath, Object value, EvidenceSpan evidence, String extractorId,
			PriorityClass priorityClass) {
		return new CandidateDetection(fieldPath, value, List.of(evidence), extractorId, priorityClass);
	}

	public CandidateDetection withFieldPath(String newPath) {
		return new CandidateDetection(newPath, value, evidence, extractorId, priorityClass);
	}

	public CandidateDetection withPriorityClass(PriorityClass newClass) {
		return new CandidateDetection(fieldPath, value, evidence, extractorId, newClass);
	}

	public ExtractorKind kind() {
		return ExtractorKind.of(extractorId);
	}

	/** True for a {@code performed=true} style claim. */
	public boolean isAffirmative() {
		return Boolean.TRUE.equals(value);
	}

	public double maxConfidence() {
		double max = 0.0;
		for (EvidenceSpan e : evidence) {
			max = Math.max(max, e.getConfidence());
		}
		return max;
	}

	/** First evidence span; candidates always carry at least one. */
	public EvidenceSpan primaryEvidence() {
		return evidence.get(0);
	}
}
