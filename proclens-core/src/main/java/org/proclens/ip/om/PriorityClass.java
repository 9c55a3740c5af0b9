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

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of textual evidence a candidate was read from. The tier drives the
 * assembler's authority ordering: narrative statements (positive or negated)
 * outrank procedure headers, which outrank template and checkbox defaults.
 */
public enum PriorityClass {
	HEADER(2),
	CHECKBOX_TEMPLATE(1),
	NARRATIVE(3),
	EXPLICIT_NEGATION(3);

	private final int tier;

	PriorityClass(int tier) {
		this.tier = tier;
	}

	public int tier() {
		return tier;
	}

	public boolean isNarrativeTier() {
		return tier == NARRATIVE.tier;
	}

	@JsonValue
	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
