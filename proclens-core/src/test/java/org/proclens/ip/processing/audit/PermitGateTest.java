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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

class PermitGateTest {

	@Test
	void permit_is_released_after_the_call() {
		PermitGate gate = new PermitGate(1);

		String out = gate.tryWithPermit(() -> "called", () -> "fallback", 10);

		assertEquals("called", out);
		assertEquals(1, gate.availablePermits());
	}

	@Test
	void busy_gate_returns_the_fallback() throws Exception {
		PermitGate gate = new PermitGate(1);
		CountDownLatch holding = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		ExecutorService pool = Executors.newSingleThreadExecutor();
		try {
			pool.submit(() -> gate.tryWithPermit(() -> {
				holding.countDown();
				try {
					release.await(5, TimeUnit.SECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return "held";
			}, () -> "fallback", 1_000));
			holding.await(5, TimeUnit.SECONDS);

			assertEquals("fallback", gate.tryWithPermit(() -> "called", () -> "fallback", 20));
		} finally {
			release.countDown();
			pool.shutdownNow();
		}
	}
}
