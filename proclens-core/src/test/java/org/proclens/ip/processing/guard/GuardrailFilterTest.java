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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.PriorityClass;

class GuardrailFilterTest {

	private final GuardrailFilter filter = GuardrailFilter.withDefaultRules(120);

	// --- helpers -------------------------------------------------------------

	private static CandidateDetection claim(String note, String path, String needle) {
		int start = note.indexOf(needle);
		return CandidateDetection.of(path, Boolean.TRUE,
				EvidenceSpan.of(note, start, start + needle.length(), "pattern.narrative", 0.95), "pattern.narrative",
				PriorityClass.NARRATIVE);
	}

	private GuardrailOutcome run(String note, String path, String needle) {
		return filter.apply(List.of(claim(note, path, needle)), note);
	}

	private static boolean hasEvent(GuardrailOutcome o, String rule, GuardrailVerdict.Action action) {
		return o.getEvents().stream().anyMatch(e -> e.getRule().equals(rule) && e.getAction() == action);
	}

	// --- tests ---------------------------------------------------------------

	@Test
	@DisplayName("A discontinued chest tube is a removal")
	void discontinued_chest_tube_is_rewritten_to_removal() {
		String note = "The chest tube was discontinued and the site dressed.";

		GuardrailOutcome o = run(note, "chest_tube_insertion.performed", "chest tube");

		assertEquals(1, o.getCandidates().size());
		assertEquals("chest_tube_removal.performed", o.getCandidates().get(0).getFieldPath());
		assertTrue(hasEvent(o, "discontinuation", GuardrailVerdict.Action.REWRITE));
	}

	@Test
	void device_status_remark_is_dropped() {
		String note = "The stent remains in good position.";

		GuardrailOutcome o = run(note, "airway_stent_placement.performed", "stent");

		assertTrue(o.getCandidates().isEmpty());
		assertTrue(hasEvent(o, "device_status", GuardrailVerdict.Action.DROP));
	}

	@Test
	void stent_in_position_without_intervention_is_not_a_placement() {
		String note = "Stent in good position, no intervention performed.";

		GuardrailOutcome o = run(note, "airway_stent_placement.performed", "Stent");

		assertTrue(o.getCandidates().isEmpty());
	}

	@Test
	void tool_named_without_tissue_action_is_dropped() {
		String note = "APC probe was available on the cart.";

		GuardrailOutcome o = run(note, "thermal_ablation.performed", "APC");

		assertTrue(o.getCandidates().isEmpty());
		assertTrue(hasEvent(o, "tool_mention", GuardrailVerdict.Action.DROP));
	}

	@Test
	void negated_mention_is_dropped() {
		String note = "No BAL was done.";

		GuardrailOutcome o = run(note, "bal.performed", "BAL");

		assertTrue(o.getCandidates().isEmpty());
		assertTrue(hasEvent(o, "negation_cue", GuardrailVerdict.Action.DROP));
	}

	@Test
	void history_is_dropped_but_a_current_event_is_kept() {
		String history = "History of stent placement in 2019.";
		String current = "Prior stent was removed.";

		GuardrailOutcome dropped = run(history, "airway_stent_placement.performed", "stent placement");
		GuardrailOutcome kept = run(current, "airway_stent_removal.performed", "stent");

		assertTrue(dropped.getCandidates().isEmpty());
		assertTrue(hasEvent(dropped, "historical_context", GuardrailVerdict.Action.DROP));
		assertEquals(1, kept.getCandidates().size());
		assertTrue(kept.getEvents().isEmpty());
	}

	@Test
	void template_row_is_downgraded() {
		String note = "BAL: yes\n";

		GuardrailOutcome o = run(note, "bal.performed", "BAL");

		assertEquals(1, o.getCandidates().size());
		assertEquals(PriorityClass.CHECKBOX_TEMPLATE, o.getCandidates().get(0).getPriorityClass());
		assertTrue(hasEvent(o, "template_line", GuardrailVerdict.Action.DOWNGRADE));
	}

	@Test
	void radial_findings_move_a_linear_claim_to_radial() {
		String note = "Radial EBUS showed a concentric view.";

		GuardrailOutcome o = run(note, "linear_ebus.performed", "EBUS");

		assertEquals("radial_ebus.performed", o.getCandidates().get(0).getFieldPath());
		assertTrue(hasEvent(o, "distinct_procedure", GuardrailVerdict.Action.REWRITE));
	}

	@Test
	void rule_order_does_not_change_the_outcome() {
		String note = String.join("\n", "The chest tube was discontinued and the site dressed.",
				"The stent remains in good position.", "BAL: yes", "BAL was performed in the right upper lobe.");
		List<CandidateDetection> cs = List.of(claim(note, "chest_tube_insertion.performed", "chest tube"),
				claim(note, "airway_stent_placement.performed", "stent"), claim(note, "bal.performed", "BAL"),
				claim(note, "bal.performed", "BAL was performed"));

		List<GuardrailRule> reversed = new ArrayList<>(GuardrailRules.defaults());
		Collections.reverse(reversed);
		GuardrailOutcome forward = filter.apply(cs, note);
		GuardrailOutcome backward = new GuardrailFilter(reversed, 120).apply(cs, note);

		assertEquals(forward.getCandidates(), backward.getCandidates());
		assertEquals(3, forward.getCandidates().size());
	}
}
