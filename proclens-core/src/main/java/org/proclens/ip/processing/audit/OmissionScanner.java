package org.proclens.ip.processing.audit;

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
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.proclens.ip.om.OmissionWarning;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryField;
import org.proclens.ip.om.RegistryRecord;
import org.proclens.ip.om.RegistrySchema;
import org.proclens.ip.util.Logger;

/**
 * Flags watched procedures the learned extractor saw with high raw
 * confidence but the assembled record leaves absent or false.
 */
public class OmissionScanner {

	private final List<String> watchList;
	private final double threshold;

	public OmissionScanner(List<String> watchList, double threshold) {
		this.watchList = List.copyOf(watchList);
		this.threshold = threshold;
	}

	/**
	 * @param rawConfidences highest pre-guardrail learned confidence per field
	 */
	public List<OmissionWarning> scan(RegistryRecord record, Map<String, Double> rawConfidences) {
		List<OmissionWarning> out = new ArrayList<>();
		for (String path : watchList) {
			Double raw = rawConfidences.get(path);
			if (raw == null || raw <= threshold) {
				continue;
			}
			Optional<RegistryField> field = record.get(path);
			if (field.isPresent() && Boolean.TRUE.equals(field.get().getValue())) {
				continue;
			}
			String hint = RegistrySchema.procedureOf(path).map(Procedure::codeHint).orElse(null);
			String state = field.isPresent() ? "false" : "absent";
			out.add(new OmissionWarning(path, hint,
					String.format("learned confidence %.2f above %.2f but field is %s", raw, threshold, state), raw));
			Logger.info("Possible omission: {} ({}), learned confidence {}", path, hint, raw);
		}
		return out;
	}
}
