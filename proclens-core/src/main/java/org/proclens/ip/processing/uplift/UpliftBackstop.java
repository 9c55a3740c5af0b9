package org.proclens.ip.processing.uplift;

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
import java.util.Optional;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.Procedure;

/**
 * Recall safety net for one procedure the extractors are known to miss.
 * Runs after the guardrails, on the surviving candidates.
 */
public interface UpliftBackstop {

	Procedure procedure();

	/**
	 * @param text      scanned note text
	 * @param surviving candidates after guardrails
	 * @return a narrative {@code performed=true} candidate, or empty
	 */
	Optional<CandidateDetection> propose(String text, List<CandidateDetection> surviving);
}
