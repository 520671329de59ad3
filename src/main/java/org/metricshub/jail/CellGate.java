package org.metricshub.jail;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jail
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.metricshub.jail.util.JailLogger;
import org.slf4j.Logger;

/**
 * Serializes calls into one cell: at most one thread runs script code in
 * the cell at any time.
 * <p>
 * The gate is reentrant so that the bridge, invoked by script code already
 * holding the gate, passes through. A thread that cannot enter within the
 * timeout is rejected with a {@link CellBusyException}.
 */
public final class CellGate {

	private static final Logger LOG = JailLogger.getLogger(CellGate.class);

	private final ReentrantLock lock = new ReentrantLock(true);
	private final String cellId;
	private final long timeoutMillis;

	/**
	 * @param cellId identifier of the guarded cell, for error messages
	 * @param timeoutMillis maximum time to wait in {@link #acquire()}
	 */
	public CellGate(String cellId, long timeoutMillis) {
		this.cellId = cellId;
		this.timeoutMillis = timeoutMillis;
	}

	/**
	 * Enters the cell, waiting at most the configured timeout.
	 * Every successful call must be paired with {@link #release()}.
	 *
	 * @throws CellBusyException when the cell stays busy or the wait is interrupted
	 */
	public void acquire() {
		boolean acquired;
		try {
			acquired = lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CellBusyException(cellId, e);
		}
		if (!acquired) {
			LOG.warn("Cell[{}] still busy after {} ms, rejecting request", cellId, timeoutMillis);
			throw new CellBusyException(cellId, timeoutMillis);
		}
	}

	/**
	 * Leaves the cell.
	 */
	public void release() {
		lock.unlock();
	}

	/**
	 * @return {@code true} when some thread is inside the cell
	 */
	public boolean isBusy() {
		return lock.isLocked();
	}
}
