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

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * A code under construction: the fields it comes from, the sites it
 * concerns (for bundling), modifiers and quantity.
 */
final class Derivation {

	private final String code;
	private final Set<String> derivedFrom = new LinkedHashSet<>();
	private final Set<String> sites = new TreeSet<>();
	private final Set<String> modifiers = new TreeSet<>();
	private int quantity = 1;

	Derivation(String code) {
		this.code = code;
	}

	String code() {
		return code;
	}

	Derivation from(String fieldPath) {
		derivedFrom.add(fieldPath);
		return this;
	}

	Derivation sites(Iterable<String> values) {
		for (String s : values) {
			sites.add(s);
		}
		return this;
	}

	Derivation quantity(int q) {
		this.quantity = q;
		return this;
	}

	Derivation modifier(String m) {
		modifiers.add(m);
		return this;
	}

	Set<String> derivedFrom() {
		return derivedFrom;
	}

	Set<String> sites() {
		return sites;
	}

	Set<String> modifiers() {
		return modifiers;
	}

	int quantity() {
		return quantity;
	}
}
