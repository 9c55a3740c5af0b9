package org.proclens.ip.processing.support;

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
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Value;

/**
 * Normalizes anatomic site mentions (lobes, central airways, pleural sides,
 * mediastinal lymph node stations) into the registry's site tokens.
 */
public final class AnatomicSites {

	private static final Map<String, Pattern> LOBES = new LinkedHashMap<>();
	private static final Map<String, Pattern> AIRWAYS = new LinkedHashMap<>();
	private static final Map<String, Pattern> SIDES = new LinkedHashMap<>();

	static {
		LOBES.put("RUL", ci("\\b(?:RUL|right upper lobe)\\b"));
		LOBES.put("RML", ci("\\b(?:RML|right middle lobe)\\b"));
		LOBES.put("RLL", ci("\\b(?:RLL|right lower lobe)\\b"));
		LOBES.put("LUL", ci("\\b(?:LUL|left upper lobe)\\b"));
		LOBES.put("LLL", ci("\\b(?:LLL|left lower lobe)\\b"));
		LOBES.put("LINGULA", ci("\\blingula(?:r)?\\b"));

		AIRWAYS.put("TRACHEA", ci("\\btrache(?:a|al)\\b"));
		AIRWAYS.put("RMS", ci("\\b(?:RMS|right main\\s?stem(?: bronchus)?|right main bronchus)\\b"));
		AIRWAYS.put("LMS", ci("\\b(?:LMS|left main\\s?stem(?: bronchus)?|left main bronchus)\\b"));
		AIRWAYS.put("BI", Pattern.compile("\\b(?:BI|[Bb]ronchus intermedius)\\b"));

		SIDES.put("LEFT", ci("\\bleft\\b"));
		SIDES.put("RIGHT", ci("\\bright\\b"));
	}

	private static final String STATION = "(?:2R|2L|3P|4R|4L|7|10R|10L|11Rs|11Ri|11R|11L|12R|12L)";

	/** "station(s) 4R, 7 and 11L" */
	private static final Pattern STATION_LIST = ci(
			"\\b(?:stations?|stn|LN)\\s*#?\\s*(" + STATION + "(?:\\s*(?:,|and|&|/)\\s*#?\\s*" + STATION + ")*)\\b");

	/** Lateralized stations are unambiguous even without the word "station". */
	private static final Pattern BARE_STATION = Pattern.compile("\\b(2R|2L|4R|4L|10R|10L|11Rs|11Ri|11R|11L|12R|12L)\\b");

	private static final Pattern STATION_TOKEN = ci(STATION + "(?![0-9A-Za-z])");

	private AnatomicSites() {
	}

	/** Lobes mentioned in {@code text}, in canonical order. */
	public static List<String> lobes(String text) {
		return match(LOBES, text);
	}

	/**
	 * Lobe tokens among already-normalized {@code sites}, without duplicates and
	 * in canonical order. Central airway tokens and anything unknown are left out.
	 */
	public static List<String> lobeTokens(Collection<String> sites) {
		List<String> out = new ArrayList<>();
		for (String lobe : LOBES.keySet()) {
			for (String site : sites) {
				if (site != null && lobe.equalsIgnoreCase(site.trim())) {
					out.add(lobe);
					break;
				}
			}
		}
		return out;
	}

	/** Lobes and central airway segments. */
	public static List<String> airwaySites(String text) {
		Set<String> out = new LinkedHashSet<>(match(AIRWAYS, text));
		out.addAll(match(LOBES, text));
		return List.copyOf(out);
	}

	public static List<String> sides(String text) {
		return match(SIDES, text);
	}

	/** A station token and where it sits in the searched text. */
	@Value
	public static class StationHit {
		String station;
		int start;
		int end;
	}

	/** Mediastinal/hilar stations, upper-cased and de-duplicated in order of mention. */
	public static List<String> stations(String text) {
		Set<String> out = new LinkedHashSet<>();
		for (StationHit h : stationHits(text)) {
			out.add(h.getStation());
		}
		return List.copyOf(out);
	}

	/** Every station mention with offsets relative to {@code text}. */
	public static List<StationHit> stationHits(String text) {
		List<StationHit> hits = new ArrayList<>();
		if (text == null) {
			return hits;
		}
		Set<Integer> seen = new HashSet<>();
		Matcher list = STATION_LIST.matcher(text);
		while (list.find()) {
			int base = list.start(1);
			Matcher tok = STATION_TOKEN.matcher(list.group(1));
			while (tok.find()) {
				if (seen.add(base + tok.start())) {
					hits.add(new StationHit(tok.group().toUpperCase(Locale.ROOT), base + tok.start(), base + tok.end()));
				}
			}
		}
		Matcher bare = BARE_STATION.matcher(text);
		while (bare.find()) {
			if (seen.add(bare.start(1))) {
				hits.add(new StationHit(bare.group(1).toUpperCase(Locale.ROOT), bare.start(1), bare.end(1)));
			}
		}
		hits.sort((a, b) -> Integer.compare(a.getStart(), b.getStart()));
		return hits;
	}

	private static List<String> match(Map<String, Pattern> table, String text) {
		if (text == null || text.isBlank()) {
			return List.of();
		}
		Set<String> out = new LinkedHashSet<>();
		for (Map.Entry<String, Pattern> e : table.entrySet()) {
			if (e.getValue().matcher(text).find()) {
				out.add(e.getKey());
			}
		}
		return List.copyOf(out);
	}

	private static Pattern ci(String regex) {
		return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}
}
