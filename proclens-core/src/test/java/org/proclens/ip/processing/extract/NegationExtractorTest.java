package org.proclens.ip.processing.extract;

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

import java.util.List;

import org.junit.jupiter.api.Test;
import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.PriorityClass;

class NegationExtractorTest {

	private final NegationExtractor extractor = new NegationExtractor();

	@Test
	void negated_stent_placement_is_an_explicit_false() {
		List<CandidateDetection> cs = extractor.detect("The stent was not placed given the anatomy.");

		assertEquals(1, cs.size());
		CandidateDetection c = cs.get(0);
		assertEquals("airway_stent_placement.performed", c.getFieldPath());
		assertEquals(Boolean.FALSE, c.getValue());
		assertEquals(PriorityClass.EXPLICIT_NEGATION, c.getPriorityClass());
		assertEquals("stent", c.primaryEvidence().getText());
	}

	@Test
	void leading_cue_negates() {
		List<CandidateDetection> cs = extractor.detect("No BAL was performed.");

		assertEquals(1, cs.size());
		assertEquals("bal.performed", cs.get(0).getFieldPath());
	}

	@Test
	void distant_cue_does_not_negate() {
		assertTrue(extractor.detect("There were no complications from the BAL.").isEmpty());
	}
}
