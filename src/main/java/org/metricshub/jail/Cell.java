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

import org.metricshub.jail.vm.ScriptVm;

/**
 * One isolated script execution context of a {@link Jail}, identified by a
 * session identifier.
 */
public final class Cell {

	private final String id;
	private final ScriptVm vm;
	private final CellGate gate;

	Cell(String id, ScriptVm vm, long requestTimeoutMillis) {
		this.id = id;
		this.vm = vm;
		this.gate = new CellGate(id, requestTimeoutMillis);
	}

	public String getId() {
		return id;
	}

	public ScriptVm getVm() {
		return vm;
	}

	public CellGate getGate() {
		return gate;
	}

	@Override
	public String toString() {
		return "Cell[" + id + "]";
	}
}
