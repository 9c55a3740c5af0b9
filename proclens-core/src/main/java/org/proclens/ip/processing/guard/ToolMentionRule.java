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

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.processing.support.ContextWindow;

/**
 * A tool named without acting on tissue ("APC was available", "a basket was
 * prepared") does not make an interventional procedure.
 */
public class ToolMentionRule implements GuardrailRule {

	private static final Set<Procedure> TARGETS = EnumSet.of(Procedure.THERMAL_ABLATION, Procedure.CRYOTHERAPY,
			Procedure.AIRWAY_DILATION, Procedure.FOREIGN_BODY_REMOVAL, Procedure.MECHANICAL_DEBULKING);

	private static final Pattern TISSUE_ACTION = GuardTerms.ci(
			"\\b(?:ablat|coagulat|fulgurat|vaporiz|debrid|debulk|resect|excis|cored|coring|remov|retriev|extract|dilat|inflat|destroy|destruct|treat|cauteriz|freez|froze|applied|appl(?:y|ication)|grasp|recanali[sz])\\w*");

	@Override
	public String name() {
		return "tool_mention";
	}

	@Override
	public GuardrailVerdict evaluate(CandidateDetection c, ContextWindow window, String text) {
		Procedure p = GuardTerms.procedure(c).orElse(null);
		if (p == null || !TARGETS.contains(p) || !GuardTerms.claims(c, p)) {
			return GuardrailVerdict.keep();
		}
		if (GuardTerms.found(TISSUE_ACTION, window.full())) {
			return GuardrailVerdict.keep();
		}
		return GuardrailVerdict.drop("tool mentioned without tissue action");
	}
}
