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

/** Value types a registry field can hold. */
public enum FieldType {
	BOOLEAN,
	INTEGER,
	STRING,
	STRING_LIST;

	/** True when {@code value} is an acceptable instance of this type. */
	public boolean accepts(Object value) {
		switch (this) {
		case BOOLEAN:
			return value instanceof Boolean;
		case INTEGER:
			return value instanceof Integer;
		case STRING:
			return value instanceof String;
		case STRING_LIST:
			return value instanceof List && ((List<?>) value).stream().allMatch(String.class::isInstance);
		default:
			return false;
		}
	}
}
