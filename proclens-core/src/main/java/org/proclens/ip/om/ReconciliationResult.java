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

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Getter;
import lombok.ToString;

/**
 * Partition of derived codes against predicted codes plus the review
 * recommendation.
 */
@Getter
@ToString
@JsonPropertyOrder({ "matched", "derivation_only", "predictor_only", "recommendation", "predictor_available" })
public final class ReconciliationResult {

	private final SortedSet<String> matched;

	@JsonProperty("derivation_only")
	private final SortedSet<String> derivationOnly;

	@JsonProperty("predictor_only")
	private final SortedSet<String> predictorOnly;

	private final Recommendation recommendation;

	@JsonProperty("predictor_available")
	private final boolean predictorAvailable;

	public ReconciliationResult(SortedSet<String> matched, SortedSet<String> derivationOnly,
			SortedSet<String> predictorOnly, Recommendation recommendation, boolean predictorAvailable) {
		this.matched = Collections.unmodifiableSortedSet(new TreeSet<>(matched));
		this.derivationOnly = Collections.unmodifiableSortedSet(new TreeSet<>(derivationOnly));
		this.predictorOnly = Collections.unmodifiableSortedSet(new TreeSet<>(predictorOnly));
		this.recommendation = recommendation;
		this.predictorAvailable = predictorAvailable;
	}
}
