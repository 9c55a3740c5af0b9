package org.proclens.ip.processing.guard;

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

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.processing.support.ContextWindow;

/**
 * A deterministic check of one candidate against the text around its
 * evidence. Rules never see each other's output.
 */
public interface GuardrailRule {

	String name();

	/**
	 * @param candidate candidate as produced by its extractor
	 * @param window    context around the candidate's primary evidence
	 * @param text      the scanned note text
	 */
	GuardrailVerdict evaluate(CandidateDetection candidate, ContextWindow window, String text);
}
