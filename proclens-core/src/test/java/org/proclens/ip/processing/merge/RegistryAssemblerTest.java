package org.proclens.ip.processing.merge;

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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.proclens.ip.om.Attribute;
import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryRecord;

class RegistryAssemblerTest {

	private static final String NOTE = String.join("\n",
			"PROCEDURES PERFORMED: Airway stent placement",
			"[ ] BAL",
			"Cryotherapy: none",
			"BAL was performed in the right middle lobe.",
			"Cryotherapy was applied to the tumor.",
			"The stent was not placed given the anatomy.",
			"");

	private final RegistryAssembler assembler = new RegistryAssembler();

	private static CandidateDetection cand(String path, Object value, String needle, String id, PriorityClass pc,
			double conf) {
		int start = NOTE.indexOf(needle);
		if (start < 0) {
			throw new IllegalArgumentException(needle);
		}
		return CandidateDetection.of(path, value, EvidenceSpan.of(NOTE, start, start + needle.length(), id, conf),
				id, pc);
	}

	private static Resolution resolution(AssemblyResult r, String path) {
		return r.getResolutions().stream().filter(x -> x.getFieldPath().equals(path)).findFirst().orElseThrow();
	}

	@Test
	@DisplayName("Narrative negation overrides a header claim")
	void narrative_over_header() {
		List<CandidateDetection> cs = List.of(
				cand("airway_stent_placement.performed", true, "Airway stent placement", "pattern.header",
						PriorityClass.HEADER, 0.8),
				cand("airway_stent_placement.performed", false, "The stent was not placed", "pattern.negation",
						PriorityClass.EXPLICIT_NEGATION, 0.95));

		AssemblyResult r = assembler.assemble(cs, NOTE);

		assertFalse(r.getRecord().isPerformed(Procedure.AIRWAY_STENT_PLACEMENT));
		assertEquals(Boolean.FALSE, r.getRecord().get("airway_stent_placement.performed").orElseThrow().getValue());
		assertEquals(ConflictRule.NARRATIVE_OVER_HEADER, resolution(r, "airway_stent_placement.performed").getRule());
		assertEquals(List.of("pattern.header=true"), resolution(r, "airway_stent_placement.performed").getOverruled());
	}

	@Test
	void narrative_over_unchecked_box() {
		List<CandidateDetection> cs = List.of(
				cand("bal.performed", false, "BAL", "pattern.checkbox", PriorityClass.CHECKBOX_TEMPLATE, 0.85),
				cand("bal.performed", true, "BAL was performed", "pattern.narrative", PriorityClass.NARRATIVE, 0.95));

		AssemblyResult r = assembler.assemble(cs, NOTE);

		assertTrue(r.getRecord().isPerformed(Procedure.BAL));
		assertEquals(ConflictRule.NARRATIVE_OVER_UNCHECKED_BOX, resolution(r, "bal.performed").getRule());
	}

	@Test
	void narrative_over_template_default() {
		List<CandidateDetection> cs = List.of(
				cand("cryotherapy.performed", false, "Cryotherapy: none", "pattern.checkbox",
						PriorityClass.CHECKBOX_TEMPLATE, 0.85),
				cand("cryotherapy.performed", true, "Cryotherapy was applied", "pattern.narrative",
						PriorityClass.NARRATIVE, 0.95));

		AssemblyResult r = assembler.assemble(cs, NOTE);

		assertTrue(r.getRecord().isPerformed(Procedure.CRYOTHERAPY));
		assertEquals(ConflictRule.NARRATIVE_OVER_TEMPLATE_DEFAULT, resolution(r, "cryotherapy.performed").getRule());
	}

	@Test
	void header_outranks_checkbox_without_narrative() {
		List<CandidateDetection> cs = List.of(
				cand("airway_stent_placement.performed", true, "Airway stent placement", "pattern.header",
						PriorityClass.HEADER, 0.8),
				cand("airway_stent_placement.performed", false, "[ ] BAL", "pattern.checkbox",
						PriorityClass.CHECKBOX_TEMPLATE, 0.85));

		AssemblyResult r = assembler.assemble(cs, NOTE);

		assertTrue(r.getRecord().isPerformed(Procedure.AIRWAY_STENT_PLACEMENT));
		assertEquals(ConflictRule.AUTHORITY_TIER, resolution(r, "airway_stent_placement.performed").getRule());
	}

	@Test
	void same_tier_conflict_prefers_more_evidence_then_confidence() {
		List<CandidateDetection> moreSpans = List.of(
				cand("bal.performed", true, "BAL was performed", "pattern.narrative", PriorityClass.NARRATIVE, 0.9),
				cand("bal.performed", true, "right middle lobe", "learned.ner", PriorityClass.NARRATIVE, 0.7),
				cand("bal.performed", false, "[ ] BAL", "pattern.negation", PriorityClass.EXPLICIT_NEGATION, 0.99));

		AssemblyResult spans = assembler.assemble(moreSpans, NOTE);
		assertTrue(spans.getRecord().isPerformed(Procedure.BAL));
		assertEquals(ConflictRule.SAME_TIER_TIEBREAK, resolution(spans, "bal.performed").getRule());

		List<CandidateDetection> confident = List.of(
				cand("bal.performed", true, "BAL was performed", "pattern.narrative", PriorityClass.NARRATIVE, 0.9),
				cand("bal.performed", false, "[ ] BAL", "pattern.negation", PriorityClass.EXPLICIT_NEGATION, 0.95));

		AssemblyResult conf = assembler.assemble(confident, NOTE);
		assertFalse(conf.getRecord().isPerformed(Procedure.BAL));
		assertTrue(conf.getWarnings().isEmpty());
	}

	@Test
	void exact_tie_is_reported() {
		List<CandidateDetection> cs = List.of(
				cand("bal.performed", true, "BAL was performed", "pattern.narrative", PriorityClass.NARRATIVE, 0.9),
				cand("bal.performed", false, "[ ] BAL", "pattern.negation", PriorityClass.EXPLICIT_NEGATION, 0.9));

		AssemblyResult r = assembler.assemble(cs, NOTE);

		assertTrue(r.getWarnings().stream().anyMatch(w -> w.startsWith(RegistryAssembler.CONFLICT_TIE)));
	}

	@Test
	void agreeing_candidates_union_their_evidence() {
		List<CandidateDetection> cs = List.of(
				cand("bal.performed", true, "BAL was performed", "pattern.narrative", PriorityClass.NARRATIVE, 0.95),
				cand("bal.performed", true, "BAL was", "learned.ner", PriorityClass.NARRATIVE, 0.7));

		AssemblyResult r = assembler.assemble(cs, NOTE);

		assertEquals(2, r.getRecord().evidence("bal.performed").size());
		assertEquals(2, r.getRecord().get("bal.performed").orElseThrow().getExtractorIds().size());
		assertTrue(r.getResolutions().isEmpty());
	}

	@Test
	void unknown_paths_and_mistyped_values_are_rejected() {
		List<CandidateDetection> cs = List.of(
				cand("laser.performed", true, "BAL was performed", "pattern.narrative", PriorityClass.NARRATIVE, 0.9),
				cand("bal.performed", "yes", "BAL was performed", "pattern.narrative", PriorityClass.NARRATIVE, 0.9));

		AssemblyResult r = assembler.assemble(cs, NOTE);

		assertEquals(0, r.getRecord().size());
		assertEquals(2, r.getWarnings().size());
		assertTrue(r.getWarnings().stream().allMatch(w -> w.startsWith("REJECTED_CANDIDATE")));
	}

	@Test
	void details_need_a_performed_procedure() {
		List<CandidateDetection> cs = List.of(
				cand("endobronchial_biopsy.sites", List.of("RML"), "right middle lobe", "pattern.narrative",
						PriorityClass.NARRATIVE, 0.9),
				cand("bal.performed", true, "BAL was performed", "pattern.narrative", PriorityClass.NARRATIVE, 0.9));

		RegistryRecord record = assembler.assemble(cs, NOTE).getRecord();

		assertFalse(record.contains("endobronchial_biopsy.sites"));
		assertTrue(record.isPerformed(Procedure.BAL));
	}

	@Test
	void site_lists_from_the_top_tier_are_unioned() {
		List<CandidateDetection> cs = List.of(
				cand("cryotherapy.performed", true, "Cryotherapy was applied", "pattern.narrative",
						PriorityClass.NARRATIVE, 0.95),
				cand("cryotherapy.sites", List.of("RML"), "right middle lobe", "pattern.narrative",
						PriorityClass.NARRATIVE, 0.9),
				cand("cryotherapy.sites", List.of("TUMOR"), "tumor", "learned.ner", PriorityClass.NARRATIVE, 0.6),
				cand("cryotherapy.sites", List.of("LLL"), "Cryotherapy: none", "pattern.checkbox",
						PriorityClass.CHECKBOX_TEMPLATE, 0.85));

		AssemblyResult r = assembler.assemble(cs, NOTE);

		List<String> sites = r.getRecord().getList(Procedure.CRYOTHERAPY, Attribute.SITES);
		assertEquals(List.of("RML", "TUMOR"), sites);
		assertEquals(ConflictRule.AUTHORITY_TIER, resolution(r, "cryotherapy.sites").getRule());
	}

	@Test
	void result_does_not_depend_on_candidate_order() {
		List<CandidateDetection> cs = new ArrayList<>(List.of(
				cand("bal.performed", false, "BAL", "pattern.checkbox", PriorityClass.CHECKBOX_TEMPLATE, 0.85),
				cand("bal.performed", true, "BAL was performed", "pattern.narrative", PriorityClass.NARRATIVE, 0.95),
				cand("bal.performed", true, "BAL was", "learned.ner", PriorityClass.NARRATIVE, 0.7),
				cand("airway_stent_placement.performed", true, "Airway stent placement", "pattern.header",
						PriorityClass.HEADER, 0.8),
				cand("airway_stent_placement.performed", false, "The stent was not placed", "pattern.negation",
						PriorityClass.EXPLICIT_NEGATION, 0.95),
				cand("cryotherapy.performed", true, "Cryotherapy was applied", "pattern.narrative",
						PriorityClass.NARRATIVE, 0.95),
				cand("cryotherapy.sites", List.of("RML"), "right middle lobe", "pattern.narrative",
						PriorityClass.NARRATIVE, 0.9),
				cand("cryotherapy.sites", List.of("TUMOR"), "tumor", "learned.ner", PriorityClass.NARRATIVE, 0.6)));

		AssemblyResult first = assembler.assemble(cs, NOTE);
		Random rnd = new Random(7);
		for (int i = 0; i < 10; i++) {
			Collections.shuffle(cs, rnd);
			AssemblyResult again = assembler.assemble(cs, NOTE);
			assertEquals(first.getRecord().fields(), again.getRecord().fields());
			assertEquals(first.getResolutions(), again.getResolutions());
		}
	}
}
