package org.proclens.ip.util;

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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads the small headed CSV tables shipped with ProcLens (code catalog,
 * label map, keyword guard). Lines starting with {@code #} are comments.
 */
public final class CsvResources {

	private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader()
			.setSkipHeaderRecord(true)
			.setCommentMarker('#')
			.setIgnoreEmptyLines(true)
			.setIgnoreSurroundingSpaces(true)
			.setTrim(true)
			.build();

	private CsvResources() {
	}

	/**
	 * @param path filesystem path or classpath resource
	 * @throws IOException when the table is missing, unreadable, or lacks a required column
	 */
	public static List<CSVRecord> read(String path, String... requiredColumns) throws IOException {
		InputStream in = ModelResources.tryOpen(path);
		if (in == null) {
			throw new IOException("CSV resource not found: " + path);
		}
		try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8); CSVParser parser = FORMAT.parse(r)) {
			for (String col : requiredColumns) {
				if (!parser.getHeaderMap().containsKey(col)) {
					throw new IOException(path + " lacks column '" + col + "'");
				}
			}
			return parser.getRecords();
		}
	}
}
