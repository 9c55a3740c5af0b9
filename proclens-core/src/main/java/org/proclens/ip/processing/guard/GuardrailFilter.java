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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.processing.support.ContextWindow;
import org.proclens.ip.util.Logger;

/**
 * Runs every rule on every candidate and combines the verdicts: any DROP
 * wins; otherwise the first REWRITE and the lowest DOWNGRADE are applied.
 * Each rule judges the candidate as extracted, so the rule order does not
 * change the result.
 */
public class GuardrailFilter {

	private final List<GuardrailRule> rules;
	private final int windowChars;

	public GuardrailFilter(List<GuardrailRule> rules, int windowChars) {
		this.rules = List.copyOf(rules);
		this.windowChars = windowChars;
	}

	public static GuardrailFilter withDefaultRules(int windowChars) {
		return new GuardrailFilter(GuardrailRules.defaults(), windowChars);
	}

	public GuardrailOutcome apply(List<CandidateDetection> candidates, String text) {
		List<CandidateDetection> kept = new ArrayList<>();
		List<GuardrailEvent> events = new ArrayList<>();
		for (CandidateDetection c : candidates) {
			EvidenceSpan ev = c.primaryEvidence();
			ContextWindow window = ContextWindow.around(text, ev.getStart(), ev.getEnd(), windowChars);

			List<GuardrailEvent> dropped = new ArrayList<>();
			GuardrailVerdict rewrite = null;
			GuardrailVerdict downgrade = null;
			String rewriteRule = null;
			String downgradeRule = null;
			for (GuardrailRule rule : rules) {
				GuardrailVerdict v = rule.evaluate(c, window, text);
				switch (v.getAction()) {
				case DROP:
					dropped.add(event(rule.name(), c, v));
					break;
				case REWRITE:
					if (rewrite == null) {
						rewrite = v;
						rewriteRule = rule.name();
					}
					break;
				case DOWNGRADE:
					if (v.getPriorityClass().tier() < c.getPriorityClass().tier()
							&& (downgrade == null || v.getPriorityClass().tier() < downgrade.getPriorityClass().tier())) {
						downgrade = v;
						downgradeRule = rule.name();
					}
					break;
				default:
					break;
				}
			}
			if (!dropped.isEmpty()) {
				events.addAll(dropped);
				log(dropped.get(0));
				continue;
			}
			CandidateDetection out = c;
			if (rewrite != null) {
				out = out.withFieldPath(rewrite.getFieldPath());
				events.add(event(rewriteRule, c, rewrite));
				log(events.get(events.size() - 1));
			}
			if (downgrade != null) {
				out = out.withPriorityClass(downgrade.getPriorityClass());
				events.add(event(downgradeRule, c, downgrade));
				log(events.get(events.size() - 1));
			}
			kept.add(out);
		}
		return new GuardrailOutcome(Collections.unmodifiableList(kept), Collections.unmodifiableList(events));
	}

	private static GuardrailEvent event(String rule, CandidateDetection c, GuardrailVerdict v) {
		String detail = v.getReason();
		if (v.getAction() == GuardrailVerdict.Action.REWRITE) {
			detail = "-> " + v.getFieldPath() + (detail == null ? "" : " (" + detail + ")");
		} else if (v.getAction() == GuardrailVerdict.Action.DOWNGRADE) {
			detail = "-> " + v.getPriorityClass() + (detail == null ? "" : " (" + detail + ")");
		}
		return new GuardrailEvent(rule, c.getFieldPath(), v.getAction(), detail, c.primaryEvidence().getText());
	}

	private static void log(GuardrailEvent e) {
		Logger.debug("Guardrail {} {} {} on '{}': {}", e.getRule(), e.getAction(), e.getFieldPath(),
				e.getEvidenceText(), e.getDetail());
	}
}
