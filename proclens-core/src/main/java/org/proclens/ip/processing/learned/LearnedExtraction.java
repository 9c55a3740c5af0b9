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

import java.util.List;
import java.util.Map;

import org.proclens.ip.om.CandidateDetection;

import lombok.Value;

/**
 * Output of one learned-extractor run: its candidates plus the highest raw
 * confidence seen for each {@code performed=true} field, which the omission
 * scanner compares against the assembled record.
 */
@Value
public class LearnedExtraction {

	List<CandidateDetection> candidates;

	Map<String, Double> rawConfidences;

	public static LearnedExtraction empty() {
		return new LearnedExtraction(List.of(), Map.of());
	}
}
