package org.proclens.ip.processing.learned;

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

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.csv.CSVRecord;
import org.proclens.ip.om.FieldType;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.om.RegistrySchema;
import org.proclens.ip.util.CsvResources;
import org.proclens.ip.util.Logger;

import lombok.Value;

/**
 * Maps model entity labels onto registry fields. Table columns:
 * {@code label,field_path,value,priority_class}. A value of {@code @text}
 * takes the value from the tagged span itself (stations, sizes).
 */
public class LabelMapping {

	public static final String SPAN_TEXT = "@text";

	/** One row of the table. */
	@Value
	public static class Target {
		String fieldPath;
		String value;
		PriorityClass priorityClass;

		public boolean fromSpanText() {
			return SPAN_TEXT.equals(value);
		}
	}

	private final Map<String, Target> targets;

	public LabelMapping(Map<String, Target> targets) {
		this.targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
	}

	public static LabelMapping load(String path) throws IOException {
		Map<String, Target> targets = new LinkedHashMap<>();
		List<CSVRecord> rows = CsvResources.read(path, "label", "field_path", "value", "priority_class");
		for (CSVRecord row : rows) {
			String fieldPath = row.get("field_path");
			if (!RegistrySchema.isKnown(fieldPath)) {
				Logger.warn("Label map {}: skipping {} -> unknown field {}", path, row.get("label"), fieldPath);
				continue;
			}
			PriorityClass pc = PriorityClass.valueOf(row.get("priority_class").toUpperCase(Locale.ROOT));
			targets.put(row.get("label"), new Target(fieldPath, row.get("value"), pc));
		}
		Logger.debug("Label map {}: {} labels", path, targets.size());
		return new LabelMapping(targets);
	}

	public Optional<Target> target(String label) {
		return Optional.ofNullable(targets.get(label));
	}

	public int size() {
		return targets.size();
	}

	/**
	 * Typed field value for a tagged span, or empty when the text does not
	 * fit the field type.
	 */
	public static Optional<Object> valueFor(Target target, String spanText) {
		FieldType type = RegistrySchema.typeOf(target.getFieldPath()).orElse(null);
		if (type == null) {
			return Optional.empty();
		}
		String raw = target.fromSpanText() ? spanText.trim() : target.getValue();
		switch (type) {
		case BOOLEAN:
			if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) {
				return Optional.of(Boolean.valueOf(raw.toLowerCase(Locale.ROOT)));
			}
			return Optional.empty();
		case INTEGER:
			String digits = raw.replaceAll("\\D+", "");
			if (digits.isEmpty() || digits.length() > 4) {
				return Optional.empty();
			}
			return Optional.of(Integer.valueOf(digits));
		case STRING_LIST:
			return Optional.of(List.of(raw.toUpperCase(Locale.ROOT)));
		default:
			return Optional.of(raw);
		}
	}
}
