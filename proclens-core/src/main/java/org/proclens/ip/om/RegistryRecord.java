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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structured description of what was done during one procedure note.
 *
 * <p>Created empty by the assembler, written by the assembler and the corrective
 * pass, then {@link #freeze() frozen} before code derivation. Owned by one
 * pipeline execution; not thread-safe.</p>
 */
public class RegistryRecord {

	private final Map<String, RegistryField> fields = new TreeMap<>();
	private boolean frozen;

	/**
	 * Store a field, replacing any previous value.
	 *
	 * @throws IllegalStateException    after {@link #freeze()}
	 * @throws IllegalArgumentException for unknown paths, mistyped values, or a
	 *                                  {@code true} flag with no evidence
	 */
	public void put(String fieldPath, RegistryField field) {
		if (frozen) {
			throw new IllegalStateException("Registry record is frozen; cannot write " + fieldPath);
		}
		RegistrySchema.requireValid(fieldPath, field.getValue());
		if (Boolean.TRUE.equals(field.getValue()) && field.getEvidence().isEmpty()) {
			throw new IllegalArgumentException("performed=true without evidence at " + fieldPath);
		}
		if (field.isCorrective() && field.getConfidence() >= 1.0) {
			throw new IllegalArgumentException("Corrective value at " + fieldPath + " cannot be certain");
		}
		fields.put(fieldPath, field);
	}

	public void freeze() {
		frozen = true;
	}

	public boolean isFrozen() {
		return frozen;
	}

	public Optional<RegistryField> get(String fieldPath) {
		return Optional.ofNullable(fields.get(fieldPath));
	}

	public boolean contains(String fieldPath) {
		return fields.containsKey(fieldPath);
	}

	public boolean isPerformed(Procedure procedure) {
		RegistryField f = fields.get(procedure.performedPath());
		return f != null && Boolean.TRUE.equals(f.getValue());
	}

	public List<String> getList(Procedure procedure, Attribute attribute) {
		if (!procedure.has(attribute)) {
			return List.of();
		}
		RegistryField f = fields.get(procedure.path(attribute));
		if (f == null || !(f.getValue() instanceof List)) {
			return List.of();
		}
		List<String> out = new ArrayList<>();
		for (Object o : (List<?>) f.getValue()) {
			out.add((String) o);
		}
		return out;
	}

	public Optional<Integer> getInt(Procedure procedure, Attribute attribute) {
		return typed(procedure, attribute, Integer.class);
	}

	public Optional<String> getString(Procedure procedure, Attribute attribute) {
		return typed(procedure, attribute, String.class);
	}

	public Optional<Boolean> getBoolean(Procedure procedure, Attribute attribute) {
		return typed(procedure, attribute, Boolean.class);
	}

	/** Evidence attached to a field, empty when absent. */
	public List<EvidenceSpan> evidence(String fieldPath) {
		RegistryField f = fields.get(fieldPath);
		return f == null ? List.of() : f.getEvidence();
	}

	/** Field paths of a procedure currently present in the record. */
	public Set<String> presentPaths(Procedure procedure) {
		Set<String> out = new LinkedHashSet<>();
		for (Attribute a : procedure.attributes()) {
			String p = procedure.path(a);
			if (fields.containsKey(p)) {
				out.add(p);
			}
		}
		return out;
	}

	public Map<String, RegistryField> fields() {
		return Collections.unmodifiableMap(fields);
	}

	public int size() {
		return fields.size();
	}

	/** Current storage layout: {@code {schema_version, fields:{path:field}}}. */
	@JsonValue
	public Map<String, Object> toLayout() {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put("schema_version", RegistrySchema.VERSION);
		m.put("fields", fields());
		return m;
	}

	private <T> Optional<T> typed(Procedure procedure, Attribute attribute, Class<T> type) {
		if (!procedure.has(attribute)) {
			return Optional.empty();
		}
		RegistryField f = fields.get(procedure.path(attribute));
		if (f == null || !type.isInstance(f.getValue())) {
			return Optional.empty();
		}
		return Optional.of(type.cast(f.getValue()));
	}

	@Override
	public String toString() {
		return "RegistryRecord" + fields.keySet();
	}
}
