package org.proclens.ip.schema;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.proclens.ip.RecordFixture;
import org.proclens.ip.om.Attribute;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryRecord;

class RegistryRecordAdapterTest {

	private final RegistryRecordAdapter adapter = new RegistryRecordAdapter();

	private static final String LEGACY = "{"
			+ "\"schema_version\":\"2\","
			+ "\"procedures_performed\":{"
			+ "  \"bal\":{\"performed\":true},"
			+ "  \"ebus\":{\"performed\":true,\"stations_sampled\":[\"4R\",\"7\"]},"
			+ "  \"airway_stent\":{\"performed\":true,\"action\":\"removal\"},"
			+ "  \"laser\":{\"performed\":true}"
			+ "},"
			+ "\"pleural_procedures\":{"
			+ "  \"chest_tube\":{\"performed\":true,\"action\":\"insertion\",\"tube_size_fr\":14},"
			+ "  \"thoracentesis\":{\"performed\":true}"
			+ "},"
			+ "\"evidence\":{"
			+ "  \"procedures_performed.bal.performed\":[{\"text\":\"BAL\",\"start\":0,\"end\":3}],"
			+ "  \"procedures_performed.ebus.performed\":{\"text\":\"EBUS\",\"start\":10,\"end\":14},"
			+ "  \"procedures_performed.ebus.stations_sampled\":[{\"text\":\"4R\",\"start\":20,\"end\":22}],"
			+ "  \"procedures_performed.airway_stent.performed\":[{\"text\":\"stent\",\"start\":30,\"end\":35}],"
			+ "  \"pleural_procedures.chest_tube.performed\":[{\"text\":\"chest tube\",\"start\":40,\"end\":50}]"
			+ "}}";

	@Test
	void current_layout_survives_write_and_read() throws Exception {
		RegistryRecord record = RecordFixture.record().performed(Procedure.LINEAR_EBUS, Procedure.BAL)
				.set(Procedure.LINEAR_EBUS, Attribute.STATIONS, List.of("4R", "7"))
				.notPerformed(Procedure.CRYOTHERAPY).frozen();

		String json = adapter.write(record);
		RegistryRecord back = adapter.read(json);

		assertTrue(json.contains("\"schema_version\" : \"3\""));
		assertEquals(record.fields(), back.fields());
	}

	@Test
	void legacy_layout_is_mapped_onto_current_fields() throws Exception {
		RegistryRecord record = adapter.read(LEGACY);

		assertTrue(record.isPerformed(Procedure.BAL));
		assertTrue(record.isPerformed(Procedure.LINEAR_EBUS));
		assertEquals(List.of("4R", "7"), record.getList(Procedure.LINEAR_EBUS, Attribute.STATIONS));
		assertTrue(record.isPerformed(Procedure.AIRWAY_STENT_REMOVAL));
		assertFalse(record.contains("airway_stent_placement.performed"));
		assertTrue(record.isPerformed(Procedure.CHEST_TUBE_INSERTION));
		assertEquals(Optional.of(14), record.getInt(Procedure.CHEST_TUBE_INSERTION, Attribute.TUBE_SIZE_FR));

		EvidenceSpan ebus = record.evidence("linear_ebus.performed").get(0);
		assertEquals(RegistryRecordAdapter.LEGACY_SOURCE, ebus.getSource());
		assertEquals("EBUS", ebus.getText());
		assertEquals(10, ebus.getStart());
	}

	@Test
	void legacy_true_without_evidence_is_skipped() throws Exception {
		RegistryRecord record = adapter.read(LEGACY);

		assertFalse(record.contains("thoracentesis.performed"));
	}

	@Test
	void unknown_version_and_bad_values_are_rejected() {
		assertThrows(IOException.class, () -> adapter.read("{\"schema_version\":\"9\",\"fields\":{}}"));
		assertThrows(IOException.class, () -> adapter.read("[1,2]"));
		assertThrows(IOException.class, () -> adapter
				.read("{\"schema_version\":\"3\",\"fields\":{\"bal.performed\":{\"value\":\"yes\"}}}"));
		assertThrows(IOException.class, () -> adapter
				.read("{\"schema_version\":\"3\",\"fields\":{\"laser.performed\":{\"value\":true}}}"));
	}
}
