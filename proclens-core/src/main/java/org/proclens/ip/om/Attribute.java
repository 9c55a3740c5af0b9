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

/**
 * Leaf attributes of a procedure in the registry schema. The dotted field
 * path of a leaf is {@code <procedure key>.<attribute key>}.
 */
public enum Attribute {
	PERFORMED("performed", FieldType.BOOLEAN),
	SITES("sites", FieldType.STRING_LIST),
	STATIONS("stations", FieldType.STRING_LIST),
	VALVE_COUNT("valve_count", FieldType.INTEGER),
	GUIDANCE("guidance", FieldType.STRING),
	TUBE_SIZE_FR("tube_size_fr", FieldType.INTEGER),
	DURATION_MINUTES("duration_minutes", FieldType.INTEGER),
	START_TIME("start_time", FieldType.STRING),
	END_TIME("end_time", FieldType.STRING),
	ADMINISTERED_BY("administered_by", FieldType.STRING),
	OBSERVER_PRESENT("observer_present", FieldType.BOOLEAN);

	private final String key;
	private final FieldType type;

	Attribute(String key, FieldType type) {
		this.key = key;
		this.type = type;
	}

	public String key() {
		return key;
	}

	public FieldType type() {
		return type;
	}

	public static Attribute fromKey(String key) {
		for (Attribute a : values()) {
			if (a.key.equals(key)) {
				return a;
			}
		}
		return null;
	}
}
