package org.proclens.ip.processing.audit;

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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.proclens.ip.util.CsvResources;
import org.proclens.ip.util.Logger;

/**
 * Curated terms per field; the corrective pass only asks about a field when
 * the note contains at least one of them. Table columns: {@code field_path,term}.
 */
public class KeywordGuard {

	private final Map<String, List<String>> terms;
	private final Map<String, List<Pattern>> patterns = new LinkedHashMap<>();

	public KeywordGuard(Map<String, List<String>> terms) {
		Map<String, List<String>> copy = new LinkedHashMap<>();
		for (Map.Entry<String, List<String>> e : terms.entrySet()) {
			copy.put(e.getKey(), List.copyOf(e.getValue()));
			List<Pattern> ps = new ArrayList<>();
			for (String t : e.getValue()) {
				ps.add(Pattern.compile("\\b" + Pattern.quote(t) + "\\b", Pattern.CASE_INSENSITIVE));
			}
			patterns.put(e.getKey(), ps);
		}
		this.terms = Collections.unmodifiableMap(copy);
	}

	public static KeywordGuard load(String path) throws IOException {
		Map<String, List<String>> terms = new LinkedHashMap<>();
		for (CSVRecord row : CsvResources.read(path, "field_path", "term")) {
			String term = row.get("term");
			if (StringUtils.isNotBlank(term)) {
				terms.computeIfAbsent(row.get("field_path"), k -> new ArrayList<>()).add(term);
			}
		}
		Logger.debug("Keyword guard {}: {} fields", path, terms.size());
		return new KeywordGuard(terms);
	}

	/** True when {@code text} holds one of the field's terms. Fields without terms never pass. */
	public boolean passes(String fieldPath, String text) {
		if (text == null) {
			return false;
		}
		for (Pattern p : patterns.getOrDefault(fieldPath, List.of())) {
			if (p.matcher(text).find()) {
				return true;
			}
		}
		return false;
	}

	public List<String> terms(String fieldPath) {
		return terms.getOrDefault(fieldPath, List.of());
	}
}
