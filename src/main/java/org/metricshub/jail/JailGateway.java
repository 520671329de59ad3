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

import org.metricshub.jail.util.Jsons;
import org.metricshub.jail.vm.ScriptVm;

/**
 * Host-facing entry points of a {@link Jail} that may not exist.
 * <p>
 * Embedding layers (native bindings, RPC front ends) hold a jail reference
 * that is only set once the host has initialized it. Going through this
 * gateway turns a missing jail into an in-band error envelope instead of a
 * host-level failure.
 */
public final class JailGateway {

	private final Jail jail;

	/**
	 * @param jail the jail to serve, {@code null} when not initialized
	 */
	public JailGateway(Jail jail) {
		this.jail = jail;
	}

	/**
	 * @return a gateway to the current process-wide jail
	 */
	public static JailGateway global() {
		return new JailGateway(Jail.getInstance());
	}

	/**
	 * @see Jail#bootstrapCell(String, String)
	 * @param cellId session identifier
	 * @param script session script
	 * @return the result or error envelope
	 */
	public String parse(String cellId, String script) {
		if (jail == null) {
			return Jsons.errorEnvelope(JailNotInitializedException.MESSAGE);
		}
		return jail.bootstrapCell(cellId, script);
	}

	/**
	 * @see Jail#dispatchCall(String, String, String)
	 * @param cellId session identifier
	 * @param path catalog path
	 * @param args JSON arguments
	 * @return the result or error envelope
	 */
	public String call(String cellId, String path, String args) {
		if (jail == null) {
			return Jsons.errorEnvelope(JailNotInitializedException.MESSAGE);
		}
		return jail.dispatchCall(cellId, path, args);
	}

	/**
	 * @see Jail#getVm(String)
	 * @param cellId session identifier
	 * @return the VM of the cell
	 * @throws JailNotInitializedException when there is no jail
	 * @throws CellNotFoundException when the cell does not exist
	 */
	public ScriptVm getVm(String cellId) {
		if (jail == null) {
			throw new JailNotInitializedException();
		}
		return jail.getVm(cellId);
	}
}
