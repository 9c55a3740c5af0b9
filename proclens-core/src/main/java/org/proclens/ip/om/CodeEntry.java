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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A billing code derived from the registry, with the fields and text that
 * justify it.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({ "code", "description", "derived_from", "evidence", "modifiers", "quantity" })
public final class CodeEntry {

	private final String code;

	private final String description;

	/** Registry field paths the code was derived from; never empty. */
	@JsonProperty("derived_from")
	private final List<String> derivedFrom;

	/** Union of the evidence of {@link #derivedFrom}. */
	private final List<EvidenceSpan> evidence;

	private final List<String> modifiers;

	private final int quantity;

	public CodeEntry(String code, String description, List<String> derivedFrom, List<EvidenceSpan> evidence,
			List<String> modifiers, int quantity) {
		if (derivedFrom == null || derivedFrom.isEmpty()) {
			throw new IllegalArgumentException("Code " + code + " has no derived_from fields");
		}
		if (quantity < 1) {
			throw new IllegalArgumentException("Code " + code + " has quantity " + quantity);
		}
		this.code = code;
		this.description = description;
		this.derivedFrom = List.copyOf(derivedFrom);
		this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
		this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
		this.quantity = quantity;
	}
}
