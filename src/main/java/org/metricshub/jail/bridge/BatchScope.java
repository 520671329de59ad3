package org.metricshub.jail.bridge;

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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.jail.util.JailLogger;
import org.slf4j.Logger;

/**
 * Collects the post-processing hooks of one batch and runs them when the
 * batch is over, in registration order, whatever happened to the calls.
 * <p>
 * A failing action is logged and does not prevent the remaining ones from
 * running.
 */
final class BatchScope implements AutoCloseable {

	private static final Logger LOG = JailLogger.getLogger(BatchScope.class);

	private final List<Runnable> deferred = new ArrayList<Runnable>();
	private boolean closed;

	/**
	 * Registers an action to run on {@link #close()}.
	 *
	 * @param action action to defer
	 */
	void defer(Runnable action) {
		if (closed) {
			throw new IllegalStateException("batch scope is already closed");
		}
		deferred.add(action);
	}

	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		for (Runnable action : deferred) {
			try {
				action.run();
			} catch (RuntimeException e) {
				LOG.warn("Deferred request post-processing failed: {}", e.getMessage(), e);
			}
		}
		deferred.clear();
	}
}
