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

/** Why the corrective pass did not patch a flagged field. */
public enum SkipReason {
	DISABLED,
	NO_OMISSION,
	KEYWORD_GUARD_FAILED,
	CONCURRENCY_LIMIT,
	TIMEOUT,
	FAILURE,
	CANCELLED,
	NO_EVIDENCE,
	REJECTED_PATCH,
	NO_CHANGE;

	@JsonValue
	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
