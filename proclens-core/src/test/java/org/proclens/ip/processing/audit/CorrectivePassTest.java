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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.proclens.ip.conf.PipelineConfig;
import org.proclens.ip.om.OmissionWarning;
import org.proclens.ip.om.RegistryField;
import org.proclens.ip.om.RegistryRecord;
import org.proclens.ip.om.SkipReason;

class CorrectivePassTest {

	private static final String NOTE = "Bronchoscopy performed. Lavage of the lingula was sent for culture.";
	private static final OmissionWarning BAL_OMISSION = new OmissionWarning("bal.performed", "31624",
			"learned confidence 0.92 above 0.80 but field is absent", 0.92);

	private final KeywordGuard guard = new KeywordGuard(Map.of("bal.performed", List.of("BAL", "lavage")));

	private final List<CorrectivePass> passes = new ArrayList<>();
	private Adjudicator adjudicator;
	private RegistryRecord record;

	@BeforeEach
	void setUp() {
		adjudicator = mock(Adjudicator.class);
		record = new RegistryRecord();
	}

	@AfterEach
	void tearDown() {
		passes.forEach(CorrectivePass::close);
	}

	// --- helpers -------------------------------------------------------------

	private CorrectivePass pass(PipelineConfig config) {
		CorrectivePass pass = new CorrectivePass(config, adjudicator, guard);
		passes.add(pass);
		return pass;
	}

	private CorrectionOutcome run(CorrectivePass pass, String note) {
		return pass.run(record, List.of(BAL_OMISSION), note, note, true);
	}

	private void answer(FieldPatch... patches) {
		when(adjudicator.adjudicate(any())).thenReturn(new AdjudicationResponse(List.of(patches)));
	}

	private static boolean skipped(CorrectionOutcome o, SkipReason reason) {
		return o.getSkips().stream().anyMatch(s -> s.getReason() == reason);
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void grounded_patch_is_applied_below_the_ceiling() {
		answer(new FieldPatch("bal.performed", Boolean.TRUE, List.of("Lavage of the lingula"), 0.99));

		CorrectionOutcome o = run(pass(PipelineConfig.defaults()), NOTE);

		assertTrue(o.isCorrected());
		assertEquals(List.of("bal.performed"), o.getAppliedPaths());
		assertTrue(o.getWarnings().contains(CorrectivePass.AUTO_CORRECTED + "bal.performed"));
		RegistryField field = record.get("bal.performed").orElseThrow();
		assertEquals(Boolean.TRUE, field.getValue());
		assertTrue(field.isCorrective());
		assertTrue(field.getConfidence() < 0.9);
		assertEquals("Lavage of the lingula", field.getEvidence().get(0).getText());
		assertTrue(field.getEvidence().get(0).isVerbatimIn(NOTE));
	}

	@Test
	void disabled_pass_never_calls_out() {
		CorrectionOutcome o = pass(PipelineConfig.defaults()).run(record, List.of(BAL_OMISSION), NOTE, NOTE, false);

		assertFalse(o.isCorrected());
		assertTrue(skipped(o, SkipReason.DISABLED));
		verify(adjudicator, never()).adjudicate(any());
	}

	@Test
	void nothing_flagged_means_nothing_to_do() {
		CorrectionOutcome o = pass(PipelineConfig.defaults()).run(record, List.of(), NOTE, NOTE, true);

		assertTrue(skipped(o, SkipReason.NO_OMISSION));
		verify(adjudicator, never()).adjudicate(any());
	}

	@Test
	@DisplayName("Notes without any guard term are not sent for adjudication")
	void keyword_guard_blocks_the_call() {
		CorrectionOutcome o = run(pass(PipelineConfig.defaults()), "The airways were inspected.");

		assertTrue(skipped(o, SkipReason.KEYWORD_GUARD_FAILED));
		assertTrue(o.getWarnings().get(0).startsWith(CorrectivePass.SKIPPED + "bal.performed"));
		verify(adjudicator, never()).adjudicate(any());
	}

	@Test
	void quote_missing_from_the_note_is_rejected() {
		answer(new FieldPatch("bal.performed", Boolean.TRUE, List.of("BAL returned clear fluid"), 0.8));

		CorrectionOutcome o = run(pass(PipelineConfig.defaults()), NOTE);

		assertFalse(o.isCorrected());
		assertTrue(skipped(o, SkipReason.REJECTED_PATCH));
		assertFalse(record.contains("bal.performed"));
	}

	@Test
	void patch_without_evidence_is_rejected() {
		answer(new FieldPatch("bal.performed", Boolean.TRUE, List.of(), 0.8));

		CorrectionOutcome o = run(pass(PipelineConfig.defaults()), NOTE);

		assertTrue(skipped(o, SkipReason.NO_EVIDENCE));
		assertFalse(record.contains("bal.performed"));
	}

	@Test
	void patch_outside_the_flagged_procedure_is_rejected() {
		answer(new FieldPatch("linear_ebus.performed", Boolean.TRUE, List.of("Lavage of the lingula"), 0.8));

		CorrectionOutcome o = run(pass(PipelineConfig.defaults()), NOTE);

		assertTrue(skipped(o, SkipReason.REJECTED_PATCH));
		assertEquals(0, record.size());
	}

	@Test
	void mistyped_patch_value_is_rejected() {
		answer(new FieldPatch("bal.performed", "yes", List.of("Lavage of the lingula"), 0.8));

		CorrectionOutcome o = run(pass(PipelineConfig.defaults()), NOTE);

		assertTrue(skipped(o, SkipReason.REJECTED_PATCH));
		assertTrue(o.getWarnings().stream().anyMatch(w -> w.startsWith(CorrectivePass.SKIPPED + "bal.performed")));
	}

	@Test
	void patch_with_non_numeric_confidence_is_rejected() {
		answer(new FieldPatch("bal.performed", Boolean.TRUE, List.of("Lavage of the lingula"), Double.NaN));

		CorrectionOutcome o = run(pass(PipelineConfig.defaults()), NOTE);

		assertFalse(o.isCorrected());
		assertTrue(skipped(o, SkipReason.REJECTED_PATCH));
		assertFalse(record.contains("bal.performed"));
	}

	@Test
	void repeated_question_is_answered_from_cache() {
		answer(new FieldPatch("bal.performed", Boolean.TRUE, List.of("Lavage of the lingula"), 0.8));
		CorrectivePass pass = pass(PipelineConfig.defaults());

		run(pass, NOTE);
		record = new RegistryRecord();
		CorrectionOutcome second = run(pass, NOTE);

		assertTrue(second.isCorrected());
		verify(adjudicator, times(1)).adjudicate(any());
	}

	@Test
	void failing_adjudicator_is_a_skip() {
		when(adjudicator.adjudicate(any())).thenThrow(new IllegalStateException("service down"));

		CorrectionOutcome o = run(pass(PipelineConfig.defaults()), NOTE);

		assertFalse(o.isCorrected());
		assertTrue(skipped(o, SkipReason.FAILURE));
	}

	@Test
	void slow_adjudicator_times_out() {
		when(adjudicator.adjudicate(any())).thenAnswer(inv -> {
			Thread.sleep(2_000);
			return AdjudicationResponse.none();
		});
		PipelineConfig config = PipelineConfig.defaults().toBuilder().correctiveTimeoutMs(50).build();

		CorrectionOutcome o = run(pass(config), NOTE);

		assertTrue(skipped(o, SkipReason.TIMEOUT));
		assertEquals(0, record.size());
	}

	@Test
	@DisplayName("A timed-out call is interrupted and later calls still get an answer")
	void timed_out_calls_are_interrupted_and_the_pass_recovers() throws Exception {
		CountDownLatch interrupted = new CountDownLatch(2);
		AtomicBoolean hang = new AtomicBoolean(true);
		when(adjudicator.adjudicate(any())).thenAnswer(inv -> {
			if (hang.get()) {
				try {
					Thread.sleep(30_000);
				} catch (InterruptedException e) {
					interrupted.countDown();
					throw e;
				}
			}
			return new AdjudicationResponse(
					List.of(new FieldPatch("bal.performed", Boolean.TRUE, List.of("Lavage of the lingula"), 0.8)));
		});
		PipelineConfig config = PipelineConfig.defaults().toBuilder().correctiveTimeoutMs(50)
				.correctiveMaxConcurrent(1).build();
		CorrectivePass pass = pass(config);

		assertTrue(skipped(run(pass, NOTE), SkipReason.TIMEOUT));
		assertTrue(skipped(run(pass, NOTE), SkipReason.TIMEOUT));
		assertTrue(interrupted.await(2, TimeUnit.SECONDS));

		hang.set(false);
		CorrectionOutcome after = run(pass, NOTE);

		assertTrue(after.isCorrected());
		assertTrue(record.contains("bal.performed"));
	}
}
