package org.proclens.ip.om;

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

import static org.proclens.ip.om.Attribute.ADMINISTERED_BY;
import static org.proclens.ip.om.Attribute.DURATION_MINUTES;
import static org.proclens.ip.om.Attribute.END_TIME;
import static org.proclens.ip.om.Attribute.GUIDANCE;
import static org.proclens.ip.om.Attribute.OBSERVER_PRESENT;
import static org.proclens.ip.om.Attribute.SITES;
import static org.proclens.ip.om.Attribute.START_TIME;
import static org.proclens.ip.om.Attribute.STATIONS;
import static org.proclens.ip.om.Attribute.TUBE_SIZE_FR;
import static org.proclens.ip.om.Attribute.VALVE_COUNT;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Clinical actions tracked by the registry (schema version 3). Each procedure
 * carries a {@code performed} flag plus the structured details listed here.
 * {@code codeHint} is the code a reviewer would expect when the procedure is
 * present; it is informational only, derivation lives in the coding package.
 */
public enum Procedure {

	// ---- Bronchoscopy: diagnostic ----
	DIAGNOSTIC_BRONCHOSCOPY("diagnostic_bronchoscopy", "31622"),
	BRUSHINGS("brushings", "31623"),
	BAL("bal", "31624"),
	ENDOBRONCHIAL_BIOPSY("endobronchial_biopsy", "31625", SITES),
	TRANSBRONCHIAL_BIOPSY("transbronchial_biopsy", "31628", SITES),
	TRANSBRONCHIAL_CRYOBIOPSY("transbronchial_cryobiopsy", "31628", SITES),
	TBNA_CONVENTIONAL("tbna_conventional", "31629", SITES),
	LINEAR_EBUS("linear_ebus", "31653", STATIONS),
	RADIAL_EBUS("radial_ebus", "31654"),
	NAVIGATIONAL_BRONCHOSCOPY("navigational_bronchoscopy", "31627"),
	FIDUCIAL_PLACEMENT("fiducial_placement", "31626"),

	// ---- Bronchoscopy: therapeutic ----
	THERAPEUTIC_ASPIRATION("therapeutic_aspiration", "31645"),
	FOREIGN_BODY_REMOVAL("foreign_body_removal", "31635"),
	AIRWAY_DILATION("airway_dilation", "31630", SITES),
	AIRWAY_STENT_PLACEMENT("airway_stent_placement", "31636", SITES),
	AIRWAY_STENT_REMOVAL("airway_stent_removal", "31638", SITES),
	MECHANICAL_DEBULKING("mechanical_debulking", "31640", SITES),
	THERMAL_ABLATION("thermal_ablation", "31641", SITES),
	CRYOTHERAPY("cryotherapy", "31641", SITES),
	BLVR_VALVE_PLACEMENT("blvr_valve_placement", "31647", SITES, VALVE_COUNT),
	BLVR_VALVE_REMOVAL("blvr_valve_removal", "31648", SITES),
	BRONCHIAL_THERMOPLASTY("bronchial_thermoplasty", "31660", SITES),
	RIGID_BRONCHOSCOPY("rigid_bronchoscopy", null),

	// ---- Airway access ----
	ESTABLISHED_TRACHEOSTOMY_ROUTE("established_tracheostomy_route", "31615"),
	PERCUTANEOUS_TRACHEOSTOMY("percutaneous_tracheostomy", "31600"),

	// ---- Imaging ----
	NECK_ULTRASOUND("neck_ultrasound", "76536"),
	CHEST_ULTRASOUND("chest_ultrasound", "76604"),
	EUS_B("eus_b", "43238"),

	// ---- Pleural ----
	THORACENTESIS("thoracentesis", "32555", SITES, GUIDANCE),
	CHEST_TUBE_INSERTION("chest_tube_insertion", "32557", SITES, GUIDANCE, TUBE_SIZE_FR),
	CHEST_TUBE_REMOVAL("chest_tube_removal", null, SITES),
	IPC_PLACEMENT("ipc_placement", "32550", SITES),
	IPC_REMOVAL("ipc_removal", "32552", SITES),
	MEDICAL_THORACOSCOPY("medical_thoracoscopy", "32601", SITES),
	PLEURODESIS("pleurodesis", "32560"),
	FIBRINOLYTIC_THERAPY("fibrinolytic_therapy", "32561"),

	// ---- Sedation ----
	MODERATE_SEDATION("moderate_sedation", "99152", DURATION_MINUTES, START_TIME, END_TIME, ADMINISTERED_BY,
			OBSERVER_PRESENT);

	private final String key;
	private final String codeHint;
	private final Set<Attribute> attributes;

	Procedure(String key, String codeHint, Attribute... details) {
		this.key = key;
		this.codeHint = codeHint;
		EnumSet<Attribute> attrs = EnumSet.of(Attribute.PERFORMED);
		Collections.addAll(attrs, details);
		this.attributes = Collections.unmodifiableSet(attrs);
	}

	public String key() {
		return key;
	}

	/** Code usually expected for this procedure, or {@code null} when it is not billable. */
	public String codeHint() {
		return codeHint;
	}

	public Set<Attribute> attributes() {
		return attributes;
	}

	public boolean has(Attribute attribute) {
		return attributes.contains(attribute);
	}

	/** Dotted field path of one of this procedure's leaves. */
	public String path(Attribute attribute) {
		if (!has(attribute)) {
			throw new IllegalArgumentException(key + " has no attribute " + attribute.key());
		}
		return key + "." + attribute.key();
	}

	public String performedPath() {
		return path(Attribute.PERFORMED);
	}

	public static Optional<Procedure> fromKey(String key) {
		for (Procedure p : values()) {
			if (p.key.equals(key)) {
				return Optional.of(p);
			}
		}
		return Optional.empty();
	}
}
