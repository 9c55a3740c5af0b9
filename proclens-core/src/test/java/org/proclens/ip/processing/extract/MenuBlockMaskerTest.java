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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MenuBlockMaskerTest {

	private static final String NOTE = String.join("\n",
			"Findings: BAL was performed in the right middle lobe.",
			"",
			"CPT codes:",
			"31624 BAL",
			"31653 EBUS 3+ stations",
			"",
			"[x] 31627 Navigation",
			"Modifier 59",
			"Codes considered 31622, 31624, 31628",
			"The patient tolerated the procedure well.");

	@Test
	void masked_text_keeps_length_and_line_breaks() {
		String masked = MenuBlockMasker.mask(NOTE);

		assertEquals(NOTE.length(), masked.length());
		assertEquals(NOTE.chars().filter(c -> c == '\n').count(), masked.chars().filter(c -> c == '\n').count());
	}

	@Test
	void menu_lines_are_blanked_and_narrative_survives() {
		String masked = MenuBlockMasker.mask(NOTE);

		assertFalse(masked.contains("31624"));
		assertFalse(masked.contains("31627"));
		assertFalse(masked.contains("Modifier"));
		assertFalse(masked.contains("CPT codes"));
		assertTrue(masked.contains("BAL was performed in the right middle lobe."));
		assertTrue(masked.contains("The patient tolerated the procedure well."));
		int offset = NOTE.indexOf("The patient");
		assertEquals(offset, masked.indexOf("The patient"));
	}

	@Test
	void single_line_classification() {
		assertTrue(MenuBlockMasker.isMenuLine("[x] 31627 Navigation"));
		assertTrue(MenuBlockMasker.isMenuLine("- +31654 Radial EBUS"));
		assertTrue(MenuBlockMasker.isMenuLine("mod XS"));
		assertFalse(MenuBlockMasker.isMenuLine("Station 4R was sampled with 4 passes."));
		assertFalse(MenuBlockMasker.isMenuLine("Chest tube of 14 Fr placed."));
	}

	@Test
	void empty_input_is_returned_unchanged() {
		assertNull(MenuBlockMasker.mask(null));
		assertEquals("", MenuBlockMasker.mask(""));
	}
}
