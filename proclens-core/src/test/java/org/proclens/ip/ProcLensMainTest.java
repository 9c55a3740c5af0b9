package org.proclens.ip;

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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcLensMainTest {

	@TempDir
	Path tmp;

	@Test
	void codes_a_note_and_writes_the_registry() throws Exception {
		Path note = tmp.resolve("note.txt");
		Files.writeString(note, "BAL was performed in the right middle lobe.\n", StandardCharsets.UTF_8);
		Path registry = tmp.resolve("registry.json");

		int rc = new ProcLensMain().run(new String[] { note.toString(), "--no-corrective", "--registry-out",
				registry.toString() });

		assertEquals(0, rc);
		String json = Files.readString(registry, StandardCharsets.UTF_8);
		assertTrue(json.contains("bal.performed"));
		assertTrue(json.contains("schema_version"));
	}

	@Test
	void missing_note_file_is_an_error() {
		int rc = new ProcLensMain().run(new String[] { tmp.resolve("absent.txt").toString() });

		assertEquals(1, rc);
	}

	@Test
	void unknown_option_is_a_usage_error() throws Exception {
		Path note = tmp.resolve("note.txt");
		Files.writeString(note, "BAL was performed.\n", StandardCharsets.UTF_8);

		assertEquals(2, new ProcLensMain().run(new String[] { note.toString(), "--fast" }));
	}
}
