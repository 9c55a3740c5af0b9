package org.proclens.ip.processing.audit;

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

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bounds concurrent external calls with a fair semaphore. Callers that cannot
 * get a permit within the acquire timeout get the fallback instead of
 * waiting.
 */
public class PermitGate {

	private final Semaphore permits;

	public PermitGate(int maxConcurrent) {
		this.permits = new Semaphore(Math.max(1, maxConcurrent), true);
	}

	public <T> T tryWithPermit(Supplier<T> critical, Supplier<T> fallback, long timeoutMs) {
		boolean acquired = false;
		try {
			acquired = permits.tryAcquire(Math.max(0, timeoutMs), TimeUnit.MILLISECONDS);
			return acquired ? critical.get() : fallback.get();
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			return fallback.get();
		} finally {
			if (acquired) {
				permits.release();
			}
		}
	}

	public int availablePermits() {
		return permits.availablePermits();
	}
}
