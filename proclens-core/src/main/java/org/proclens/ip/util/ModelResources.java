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
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Opens model and data files by path: filesystem first, classpath next.
 */
public final class ModelResources {

	private ModelResources() {
	}

	/**
	 * @return an open stream, or {@code null} when the path exists in neither place
	 */
	public static InputStream tryOpen(String path) {
		if (path == null || path.isBlank()) {
			return null;
		}
		try {
			Path p = Paths.get(path);
			if (Files.isRegularFile(p)) {
				return Files.newInputStream(p);
			}
		} catch (IOException | RuntimeException e) {
			Logger.debug("Not readable from filesystem: {} ({})", path, e.getMessage());
		}
		return ModelResources.class.getClassLoader().getResourceAsStream(path);
	}
}
