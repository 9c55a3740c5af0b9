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
import org.proclens.ip.processing.support.ContextWindow;

/**
 * History and plans are not today's procedure: "history of stent
 * placement", "s/p thoracentesis", "planned EBUS". A current-event verb right
 * after the mention ("prior stent was removed") keeps the claim.
 */
public class HistoricalContextRule implements GuardrailRule {

	private static final Pattern HISTORY_BEFORE = GuardTerms.ci(
			"\\b(?:history of|h/o|hx of|prior(?! to)|previous(?:ly)?|s/p|status post|planned|plan(?:s)? (?:for|to)|scheduled for|will (?:undergo|need|return for)|candidate for|consider(?:ing|ed)?|recommend(?:ed|ing)?|in the past|outside hospital)\\b");
	private static final Pattern HISTORY_AFTER = GuardTerms.ci(
			"^\\W*(?:(?:was|were)\\s+)?(?:previously|in the past|\\d+\\s+(?:days?|weeks?|months?|years?) ago|last (?:week|month|year)|at an outside)");
	private static final Pattern CURRENT_EVENT = GuardTerms.ci(
			"^\\W*(?:(?:was|were)\\s+)(?:then\\s+|successfully\\s+|subsequently\\s+|now\\s+|today\\s+)?(?:removed|placed|performed|inserted|deployed|obtained|retrieved|exchanged|extracted)\\b");

	@Override
	public String name() {
		return "historical_context";
	}

	@Override
	public GuardrailVerdict evaluate(CandidateDetection c, ContextWindow window, String text) {
		if (!c.isAffirmative()) {
			return GuardrailVerdict.keep();
		}
		boolean historical = GuardTerms.found(HISTORY_BEFORE, window.getBefore())
				|| GuardTerms.found(HISTORY_AFTER, window.getAfter());
		if (!historical || GuardTerms.found(CURRENT_EVENT, window.getAfter())) {
			return GuardrailVerdict.keep();
		}
		return GuardrailVerdict.drop("historical or planned");
	}
}
