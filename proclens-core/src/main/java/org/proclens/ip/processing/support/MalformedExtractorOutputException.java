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

/**
 * Learned output could not be mapped onto the registry schema. Handled like
 * {@link ExtractorUnavailableException} for the call that produced it.
 */
public class MalformedExtractorOutputException extends ExtractorUnavailableException {

	private static final long serialVersionUID = 1L;

	public MalformedExtractorOutputException(String message) {
		super(message);
	}
}
