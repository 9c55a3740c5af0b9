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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.PriorityClass;

class HeaderExtractorTest {

	private final HeaderExtractor extractor = new HeaderExtractor();

	@Test
	void listed_procedures_become_header_claims() {
		String note = String.join("\n", "PROCEDURES PERFORMED:", "1. Flexible bronchoscopy", "2. BAL", "",
				"The bronchoscope was introduced through the mouth.", "BAL was performed in the lingula.");

		List<CandidateDetection> cs = extractor.detect(note);

		assertTrue(cs.stream().allMatch(c -> c.getPriorityClass() == PriorityClass.HEADER));
		assertTrue(cs.stream().anyMatch(c -> c.getFieldPath().equals("bal.performed") && c.isAffirmative()));
		assertTrue(cs.stream().anyMatch(c -> c.getFieldPath().equals("diagnostic_bronchoscopy.performed")));
	}

	@Test
	@DisplayName("Header EBUS contradicted by a radial-only narrative")
	void header_claim_contradicted_by_the_narrated_alternative() {
		String note = String.join("\n", "PROCEDURES PERFORMED:", "1. Linear EBUS", "",
				"Radial EBUS was used to localize the lesion in the RUL.");

		List<CandidateDetection> cs = extractor.detect(note);

		assertEquals(2, cs.size());
		CandidateDetection header = cs.get(0);
		assertEquals("linear_ebus.performed", header.getFieldPath());
		assertEquals(Boolean.TRUE, header.getValue());
		assertEquals("Linear EBUS", header.primaryEvidence().getText());

		CandidateDetection contradiction = cs.get(1);
		assertEquals("linear_ebus.performed", contradiction.getFieldPath());
		assertEquals(Boolean.FALSE, contradiction.getValue());
		assertEquals(HeaderExtractor.CONTRADICTION_ID, contradiction.getExtractorId());
		assertEquals(PriorityClass.NARRATIVE, contradiction.getPriorityClass());
		assertEquals("Radial EBUS", contradiction.primaryEvidence().getText());
	}

	@Test
	void note_without_header_yields_nothing() {
		assertTrue(extractor.detect("BAL was performed in the lingula.").isEmpty());
	}
}
