package org.metricshub.jail.rpc;

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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Network-facing client of the node.
 * <p>
 * Implementations must be thread-safe: one client is shared by every cell.
 */
public interface RpcClient {

	/**
	 * Sends one JSON-RPC call and waits for its outcome.
	 *
	 * @param method JSON-RPC method name, e.g. <code>eth_blockNumber</code>
	 * @param params positional parameters
	 * @return the raw JSON text of the <code>result</code> member, or {@code null}
	 *         when the node answered with a null or absent result
	 * @throws RpcErrorException when the node answered with an error object
	 * @throws RpcException when the call could not be completed
	 */
	String call(String method, List<JsonNode> params) throws RpcException;
}
