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

import java.util.regex.Pattern;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.processing.support.ContextWindow;
import org.proclens.ip.processing.support.NoteLines;

/** Evidence read off a checkbox or template row only carries template weight. */
public class TemplateLineRule implements GuardrailRule {

	private static final Pattern TEMPLATE_ROW = GuardTerms.ci(
			"^\\s*(?:\\[\\s*[xX✓✔]?\\s*\\]|[☐☒☑□✓✔]|\\(\\s*[xX]?\\s*\\)|[01]\\s*[-–—]\\s)|:\\s*(?:none|no|yes|not performed|n/?a)\\s*\\.?\\s*$");

	@Override
	public String name() {
		return "template_line";
	}

	@Override
	public GuardrailVerdict evaluate(CandidateDetection c, ContextWindow window, String text) {
		if (c.getPriorityClass() == PriorityClass.CHECKBOX_TEMPLATE) {
			return GuardrailVerdict.keep();
		}
		String line = NoteLines.lineAt(text, c.primaryEvidence().getStart());
		if (TEMPLATE_ROW.matcher(line).find()) {
			return GuardrailVerdict.downgrade(PriorityClass.CHECKBOX_TEMPLATE, "template row");
		}
		return GuardrailVerdict.keep();
	}
}
