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

/**
 * Raised when a cell stays in use by another caller for longer than the
 * configured request timeout.
 */
public class CellBusyException extends JailException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param cellId identifier of the busy cell
	 * @param timeoutMillis how long the caller waited
	 */
	public CellBusyException(String cellId, long timeoutMillis) {
		super("Cell[" + cellId + "] is busy: request timed out after " + timeoutMillis + " ms");
	}

	/**
	 * @param cellId identifier of the busy cell
	 * @param cause interruption that aborted the wait
	 */
	public CellBusyException(String cellId, InterruptedException cause) {
		super("Interrupted while waiting for Cell[" + cellId + "]", cause);
	}
}
