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
 * Families of candidate producers. Declaration order is the precedence used
 * for the last-resort tie-break in the assembler.
 */
public enum ExtractorKind {
	PATTERN("pattern"),
	UPLIFT("uplift"),
	LEARNED("learned"),
	CORRECTIVE("corrective");

	private final String prefix;

	ExtractorKind(String prefix) {
		this.prefix = prefix;
	}

	public String prefix() {
		return prefix;
	}

	/** Build an extractor id such as {@code pattern.header}. */
	public String id(String name) {
		return name == null || name.isBlank() ? prefix : prefix + "." + name;
	}

	/**
	 * Resolve the kind of an extractor id. Unknown ids rank last.
	 */
	public static ExtractorKind of(String extractorId) {
		if (extractorId != null) {
			for (ExtractorKind k : values()) {
				if (extractorId.equals(k.prefix) || extractorId.startsWith(k.prefix + ".")) {
					return k;
				}
			}
		}
		return CORRECTIVE;
	}
}
