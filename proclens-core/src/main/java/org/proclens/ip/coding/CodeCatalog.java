package org.proclens.ip.coding;

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
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.proclens.ip.util.CsvResources;
import org.proclens.ip.util.Logger;

import lombok.Value;

/**
 * Code descriptions and add-on eligibility. Table columns:
 * {@code code,description,add_on,requires}; {@code requires} lists the
 * primaries an add-on may ride on, separated by {@code |}.
 */
public class CodeCatalog {

	@Value
	public static class Entry {
		String code;
		String description;
		boolean addOn;
		Set<String> requires;
	}

	private final Map<String, Entry> entries;

	public CodeCatalog(Map<String, Entry> entries) {
		this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
	}

	public static CodeCatalog load(String path) throws IOException {
		Map<String, Entry> entries = new TreeMap<>();
		for (CSVRecord row : CsvResources.read(path, "code", "description", "add_on", "requires")) {
			Set<String> requires = new LinkedHashSet<>();
			for (String r : StringUtils.split(row.get("requires"), '|')) {
				if (StringUtils.isNotBlank(r)) {
					requires.add(r.trim());
				}
			}
			String code = row.get("code");
			entries.put(code, new Entry(code, row.get("description"), Boolean.parseBoolean(row.get("add_on")),
					Collections.unmodifiableSet(requires)));
		}
		Logger.debug("Code catalog {}: {} codes", path, entries.size());
		return new CodeCatalog(entries);
	}

	public boolean contains(String code) {
		return entries.containsKey(code);
	}

	public String description(String code) {
		Entry e = entries.get(code);
		return e == null ? "" : e.getDescription();
	}

	public boolean isAddOn(String code) {
		Entry e = entries.get(code);
		return e != null && e.isAddOn();
	}

	/** Primaries that make {@code code} billable; empty for primaries. */
	public Set<String> requires(String code) {
		Entry e = entries.get(code);
		return e == null ? Set.of() : e.getRequires();
	}

	public int size() {
		return entries.size();
	}
}
