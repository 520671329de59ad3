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

import org.metricshub.jail.NodeUnavailableException;
import org.metricshub.jail.node.ClientHandle;
import org.metricshub.jail.node.RequestHooks;

/**
 * What the bridge needs from its owner to reach the node.
 */
public interface RpcBackend {

	/**
	 * @return the shared restart-tolerant client handle
	 * @throws NodeUnavailableException when no node is running
	 */
	ClientHandle clientHandle();

	/**
	 * @return the shared request hooks
	 * @throws NodeUnavailableException when no node is running
	 */
	RequestHooks requestHooks();
}
