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

import java.util.concurrent.atomic.AtomicReference;
import org.metricshub.jail.NodeUnavailableException;
import org.metricshub.jail.rpc.RpcClient;
import org.metricshub.jail.util.JailLogger;
import org.slf4j.Logger;

/**
 * In-process {@link NodeManager} for a node reached through an
 * {@link RpcClient}.
 * <p>
 * The {@link ClientHandle} it hands out reads the current client on every
 * call, so a jail holding on to it keeps working after {@link #restart(RpcClient)}.
 */
public class DefaultNodeManager implements NodeManager {

	private static final Logger LOG = JailLogger.getLogger(DefaultNodeManager.class);

	private final AtomicReference<RpcClient> current = new AtomicReference<RpcClient>();
	private final RequestHooks requestHooks;
	private final ClientHandle handle = new ClientHandle() {
		@Override
		public RpcClient client() {
			RpcClient client = current.get();
			if (client == null) {
				throw new NodeUnavailableException();
			}
			return client;
		}
	};

	/**
	 * Creates a manager with no node running and no-op request hooks.
	 */
	public DefaultNodeManager() {
		this(RequestHooks.NOOP);
	}

	/**
	 * Creates a manager with no node running.
	 *
	 * @param requestHooks hooks handed out by {@link #requestHooks()}
	 */
	public DefaultNodeManager(RequestHooks requestHooks) {
		if (requestHooks == null) {
			throw new IllegalArgumentException("Request hooks must not be null");
		}
		this.requestHooks = requestHooks;
	}

	/**
	 * Starts serving calls through <code>client</code>.
	 *
	 * @param client client of the started node
	 * @throws IllegalStateException when a node is already running
	 */
	public void start(RpcClient client) {
		if (client == null) {
			throw new IllegalArgumentException("RPC client must not be null");
		}
		if (!current.compareAndSet(null, client)) {
			throw new IllegalStateException("node is already running");
		}
		LOG.info("Node started");
	}

	/**
	 * Replaces the running node's client. Handles already given out switch to
	 * the new client.
	 *
	 * @param client client of the restarted node
	 */
	public void restart(RpcClient client) {
		if (client == null) {
			throw new IllegalArgumentException("RPC client must not be null");
		}
		current.set(client);
		LOG.info("Node restarted");
	}

	/**
	 * Stops serving calls; handles fail with {@link NodeUnavailableException}
	 * until the next {@link #start(RpcClient)}.
	 */
	public void stop() {
		if (current.getAndSet(null) != null) {
			LOG.info("Node stopped");
		}
	}

	@Override
	public boolean hasNode() {
		return current.get() != null;
	}

	@Override
	public ClientHandle clientHandle() {
		if (!hasNode()) {
			throw new NodeUnavailableException();
		}
		return handle;
	}

	@Override
	public RequestHooks requestHooks() {
		if (!hasNode()) {
			throw new NodeUnavailableException();
		}
		return requestHooks;
	}
}
