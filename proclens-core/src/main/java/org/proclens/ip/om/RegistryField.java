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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Resolved value of one registry leaf. Immutable: the record replaces whole
 * fields, so a write is never seen half-applied.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({ "value", "evidence", "extractor_ids", "corrective", "confidence" })
public final class RegistryField {

	private final Object value;

	private final List<EvidenceSpan> evidence;

	@JsonProperty("extractor_ids")
	private final SortedSet<String> extractorIds;

	/** Set by the corrective pass rather than the assembler. */
	private final boolean corrective;

	private final double confidence;

	public RegistryField(Object value, Collection<EvidenceSpan> evidence, Collection<String> extractorIds,
			boolean corrective, double confidence) {
		this.value = value instanceof List ? List.copyOf((List<?>) value) : value;
		this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
		this.extractorIds = new TreeSet<>(extractorIds == null ? List.of() : extractorIds);
		this.corrective = corrective;
		this.confidence = confidence;
	}

	public static RegistryField assembled(Object value, Collection<EvidenceSpan> evidence,
			Collection<String> extractorIds) {
		double max = 0.0;
		for (EvidenceSpan e : evidence) {
			max = Math.max(max, e.getConfidence());
		}
		return new RegistryField(value, evidence, extractorIds, false, max);
	}

	public static RegistryField corrective(Object value, Collection<EvidenceSpan> evidence, double confidence) {
		return new RegistryField(value, evidence, List.of(ExtractorKind.CORRECTIVE.prefix()), true, confidence);
	}

	public SortedSet<String> getExtractorIds() {
		return Collections.unmodifiableSortedSet(extractorIds);
	}
}
