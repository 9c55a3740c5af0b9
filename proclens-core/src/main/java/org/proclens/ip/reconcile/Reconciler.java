package org.proclens.ip.reconcile;

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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.proclens.ip.om.CodeEntry;
import org.proclens.ip.om.PredictedCode;
import org.proclens.ip.om.ReconciliationResult;
import org.proclens.ip.om.Recommendation;
import org.proclens.ip.util.Logger;

/**
 * Compares derived codes with predicted ones.
 * <ul>
 * <li>nothing predicted beyond the derived codes: auto-approve;</li>
 * <li>exactly one extra predicted code, below the low-confidence bound: review;</li>
 * <li>anything else: audit.</li>
 * </ul>
 */
public class Reconciler {

	private final double lowConfidence;

	public Reconciler(double lowConfidence) {
		this.lowConfidence = lowConfidence;
	}

	public ReconciliationResult reconcile(List<CodeEntry> derived, List<PredictedCode> predicted,
			boolean predictorAvailable) {
		SortedSet<String> derivedCodes = new TreeSet<>();
		for (CodeEntry c : derived) {
			derivedCodes.add(c.getCode());
		}
		Map<String, Double> predictedCodes = new HashMap<>();
		for (PredictedCode p : predicted) {
			predictedCodes.merge(p.getCode(), p.getConfidence(), Math::max);
		}

		SortedSet<String> matched = new TreeSet<>(derivedCodes);
		matched.retainAll(predictedCodes.keySet());
		SortedSet<String> derivationOnly = new TreeSet<>(derivedCodes);
		derivationOnly.removeAll(predictedCodes.keySet());
		SortedSet<String> predictorOnly = new TreeSet<>(predictedCodes.keySet());
		predictorOnly.removeAll(derivedCodes);

		Recommendation rec;
		if (predictorOnly.isEmpty()) {
			rec = Recommendation.AUTO_APPROVE;
		} else if (predictorOnly.size() == 1 && predictedCodes.get(predictorOnly.first()) < lowConfidence) {
			rec = Recommendation.REVIEW_NEEDED;
		} else {
			rec = Recommendation.FLAG_FOR_AUDIT;
		}
		Logger.debug("Reconciled: matched={} derivationOnly={} predictorOnly={} -> {}", matched, derivationOnly,
				predictorOnly, rec);
		return new ReconciliationResult(matched, derivationOnly, predictorOnly, rec, predictorAvailable);
	}
}
