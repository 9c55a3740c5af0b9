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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup over the fixed field paths of the current registry schema.
 */
public final class RegistrySchema {

	/** Version written to every serialized record. */
	public static final String VERSION = "3";

	private static final Map<String, FieldType> TYPES;

	static {
		Map<String, FieldType> m = new LinkedHashMap<>();
		for (Procedure p : Procedure.values()) {
			for (Attribute a : p.attributes()) {
				m.put(p.path(a), a.type());
			}
		}
		TYPES = Collections.unmodifiableMap(m);
	}

	private RegistrySchema() {
	}

	public static boolean isKnown(String fieldPath) {
		return fieldPath != null && TYPES.containsKey(fieldPath);
	}

	public static Optional<FieldType> typeOf(String fieldPath) {
		return Optional.ofNullable(fieldPath == null ? null : TYPES.get(fieldPath));
	}

	/** All field paths in schema order. */
	public static Map<String, FieldType> fields() {
		return TYPES;
	}

	/** Procedure owning the field path, if the path is part of the schema. */
	public static Optional<Procedure> procedureOf(String fieldPath) {
		if (!isKnown(fieldPath)) {
			return Optional.empty();
		}
		return Procedure.fromKey(fieldPath.substring(0, fieldPath.indexOf('.')));
	}

	/** Attribute of the field path, if the path is part of the schema. */
	public static Optional<Attribute> attributeOf(String fieldPath) {
		if (!isKnown(fieldPath)) {
			return Optional.empty();
		}
		return Optional.ofNullable(Attribute.fromKey(fieldPath.substring(fieldPath.indexOf('.') + 1)));
	}

	/**
	 * Fail when {@code value} cannot be stored at {@code fieldPath}.
	 *
	 * @throws IllegalArgumentException for unknown paths or mistyped values
	 */
	public static void requireValid(String fieldPath, Object value) {
		FieldType type = TYPES.get(fieldPath);
		if (type == null) {
			throw new IllegalArgumentException("Unknown registry field: " + fieldPath);
		}
		if (!type.accepts(value)) {
			throw new IllegalArgumentException("Field " + fieldPath + " expects " + type + " but got "
					+ (value == null ? "null" : value.getClass().getSimpleName()));
		}
	}
}
