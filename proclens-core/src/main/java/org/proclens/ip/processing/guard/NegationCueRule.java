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
import org.proclens.ip.processing.support.NegationCues;

/** Positive claims whose mention is directly negated are dropped. */
public class NegationCueRule implements GuardrailRule {

	@Override
	public String name() {
		return "negation_cue";
	}

	@Override
	public GuardrailVerdict evaluate(CandidateDetection c, ContextWindow window, String text) {
		if (c.isAffirmative() && NegationCues.negates(window)) {
			return GuardrailVerdict.drop("negated mention");
		}
		return GuardrailVerdict.keep();
	}
}
