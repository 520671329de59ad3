package org.metricshub.jail.node;

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

import org.metricshub.jail.NodeUnavailableException;

/**
 * Owner of the node lifecycle, as seen by the jail.
 */
public interface NodeManager {

	/** Manager of a node that never runs. */
	NodeManager NONE = new NodeManager() {
		@Override
		public boolean hasNode() {
			return false;
		}

		@Override
		public ClientHandle clientHandle() {
			throw new NodeUnavailableException();
		}

		@Override
		public RequestHooks requestHooks() {
			throw new NodeUnavailableException();
		}
	};

	/**
	 * @return {@code true} when a node is currently running
	 */
	boolean hasNode();

	/**
	 * @return a handle that survives node restarts
	 * @throws NodeUnavailableException when no node is running
	 */
	ClientHandle clientHandle();

	/**
	 * @return the hooks to run around every dispatched call
	 * @throws NodeUnavailableException when no node is running
	 */
	RequestHooks requestHooks();
}
