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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.script.ScriptException;
import org.metricshub.jail.bridge.RpcBackend;
import org.metricshub.jail.bridge.RpcBridge;
import org.metricshub.jail.node.ClientHandle;
import org.metricshub.jail.node.NodeManager;
import org.metricshub.jail.node.RequestHooks;
import org.metricshub.jail.util.JailLogger;
import org.metricshub.jail.util.JailSettings;
import org.metricshub.jail.util.Jsons;
import org.metricshub.jail.util.ScriptSource;
import org.metricshub.jail.vm.SandboxContextFactory;
import org.metricshub.jail.vm.ScriptVm;
import org.mozilla.javascript.Undefined;
import org.slf4j.Logger;

/**
 * Registry of the sandboxed JavaScript cells of a process.
 * <p>
 * Each cell runs the scripts of one session in its own VM. All cells share
 * the node client and the request hooks of this jail, both resolved lazily
 * from the {@link NodeManager} the first time a node is available, then
 * cached for the lifetime of the jail.
 * <p>
 * The overall process to serve a session is as follows:
 * <ul>
 * <li>{@link #bootstrapCell(String, String)} creates the cell, evaluates the
 * base script, binds the bridge object, wires web3 to it, evaluates the
 * session script and returns its catalog.
 * <li>{@link #dispatchCall(String, String, String)} invokes the entry point
 * function of the cell, which may in turn issue RPC calls through the bridge.
 * </ul>
 * Both methods return a JSON envelope and never throw: failures come back as
 * <code>{"error": "message"}</code>.
 * <p>
 * A jail is usually created explicitly and held by the owning service.
 * {@link #init(String)} and {@link #getInstance()} maintain a process-wide
 * default instance for hosts that need one.
 */
public class Jail implements RpcBackend {

	private static final Logger LOG = JailLogger.getLogger(Jail.class);

	private static final String BASE_SCRIPT_DESCRIPTION = "<base-script>";
	private static final String PREAMBLE_DESCRIPTION = "<web3-preamble>";

	private static Jail instance;

	private final Map<String, Cell> cells = new ConcurrentHashMap<String, Cell>();
	private final JailSettings settings;
	private final NodeManager nodeManager;
	private final SandboxContextFactory contextFactory = new SandboxContextFactory();

	private ClientHandle clientHandle;
	private RequestHooks requestHooks;

	/**
	 * Creates a jail with no cell.
	 *
	 * @param settings base script and tuning of the cells
	 * @param nodeManager provider of the node client and request hooks
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Jail(JailSettings settings, NodeManager nodeManager) {
		if (settings == null) {
			throw new IllegalArgumentException("Jail settings must not be null");
		}
		if (nodeManager == null) {
			throw new IllegalArgumentException("Node manager must not be null");
		}
		this.settings = settings;
		this.nodeManager = nodeManager;
	}

	/**
	 * Returns the process-wide jail, creating it with default settings and
	 * no node if needed.
	 *
	 * @return the process-wide jail
	 */
	public static synchronized Jail getInstance() {
		if (instance == null) {
			instance = new Jail(new JailSettings(), NodeManager.NONE);
		}
		return instance;
	}

	/**
	 * Sets the base script of the process-wide jail. The instance itself is
	 * kept: calling this twice returns the same jail.
	 *
	 * @param baseScript script evaluated first in every new cell
	 * @return the process-wide jail
	 */
	public static synchronized Jail init(String baseScript) {
		Jail jail = getInstance();
		jail.settings.setBaseScript(baseScript);
		return jail;
	}

	/**
	 * Replaces the process-wide jail with a new one. Cells of the previous
	 * instance are not carried over.
	 *
	 * @param settings base script and tuning of the cells
	 * @param nodeManager provider of the node client and request hooks
	 * @return the new process-wide jail
	 */
	public static synchronized Jail init(JailSettings settings, NodeManager nodeManager) {
		instance = new Jail(settings, nodeManager);
		return instance;
	}

	/**
	 * Forgets the process-wide jail.
	 */
	static synchronized void resetInstance() {
		instance = null;
	}

	/**
	 * Returns the settings of this jail. Changes apply to cells created afterwards.
	 *
	 * @return the mutable settings
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JailSettings getSettings() {
		return settings;
	}

	public NodeManager getNodeManager() {
		return nodeManager;
	}

	/**
	 * Creates the cell of a session, replacing any previous cell with the same
	 * identifier, and evaluates the session script in it.
	 *
	 * @param cellId session identifier
	 * @param script session script, expected to define the catalog object
	 * @return <code>{"result": catalog}</code> or <code>{"error": "message"}</code>
	 */
	public String bootstrapCell(String cellId, String script) {
		if (cellId == null) {
			return Jsons.errorEnvelope("cell identifier must not be null");
		}
		Cell cell;
		try {
			cell = new Cell(cellId, new ScriptVm(contextFactory), settings.getRequestTimeoutMillis());
		} catch (RuntimeException e) {
			LOG.error("Cannot create the VM of Cell[{}]", cellId, e);
			return Jsons.errorEnvelope(e.getMessage());
		}

		// the cell is published already held, so no call runs before its scripts
		CellGate gate = cell.getGate();
		try {
			gate.acquire();
		} catch (CellBusyException e) {
			return Jsons.errorEnvelope(e.getMessage());
		}
		try {
			if (cells.put(cellId, cell) != null) {
				LOG.info("Replacing Cell[{}]", cellId);
			} else {
				LOG.info("Creating Cell[{}]", cellId);
			}
			ScriptVm vm = cell.getVm();
			vm.run(new ScriptSource(BASE_SCRIPT_DESCRIPTION, settings.getBaseScript() + ";"));
			new RpcBridge(vm, gate, this).install(settings.getBridgeName());
			if (settings.getWeb3Library() != null) {
				vm.run(settings.getWeb3Library());
			}
			vm.run(new ScriptSource(PREAMBLE_DESCRIPTION, settings.loadWeb3Preamble()));
			vm.run(new ScriptSource("Cell[" + cellId + "]", script));

			String catalog = vm.has(settings.getCatalogName())
					? vm.stringify(vm.get(settings.getCatalogName()))
					: null;
			return Jsons.resultEnvelope(catalog);
		} catch (ScriptException e) {
			LOG.warn("Bootstrap of Cell[{}] failed: {}", cellId, e.getMessage());
			return Jsons.errorEnvelope(e.getMessage());
		} catch (RuntimeException e) {
			LOG.warn("Bootstrap of Cell[{}] failed", cellId, e);
			return Jsons.errorEnvelope(e.getMessage());
		} finally {
			gate.release();
		}
	}

	/**
	 * Invokes the entry point function of a cell with <code>(path, args)</code>.
	 *
	 * @param cellId session identifier
	 * @param path first argument of the entry point, typically a catalog path
	 * @param args second argument of the entry point, typically JSON text
	 * @return <code>{"result": value}</code> or <code>{"error": "message"}</code>
	 */
	public String dispatchCall(String cellId, String path, String args) {
		Cell cell = cellId == null ? null : cells.get(cellId);
		if (cell == null) {
			return Jsons.errorEnvelope(new CellNotFoundException(cellId).getMessage());
		}
		try {
			clientHandle();
		} catch (NodeUnavailableException e) {
			return Jsons.errorEnvelope(e.getMessage());
		}

		CellGate gate = cell.getGate();
		try {
			gate.acquire();
		} catch (CellBusyException e) {
			return Jsons.errorEnvelope(e.getMessage());
		}
		try {
			ScriptVm vm = cell.getVm();
			Object value = vm.call(settings.getEntryPointName(), path, args);
			return Jsons.resultEnvelope(toResultJson(vm, value));
		} catch (ScriptException e) {
			LOG.debug("Call {} in Cell[{}] failed: {}", path, cellId, e.getMessage());
			return Jsons.errorEnvelope(e.getMessage());
		} catch (RuntimeException e) {
			LOG.warn("Call {} in Cell[{}] failed", path, cellId, e);
			return Jsons.errorEnvelope(e.getMessage());
		} finally {
			gate.release();
		}
	}

	/**
	 * JSON text of the value returned by an entry point. Strings are expected
	 * to hold JSON already; a string that does not is returned as a JSON string.
	 */
	private static String toResultJson(ScriptVm vm, Object value) {
		if (value == null || value == Undefined.instance) {
			return null;
		}
		if (value instanceof CharSequence) {
			String text = value.toString();
			return isJson(text) ? text : Jsons.toJson(text);
		}
		return vm.stringify(value);
	}

	private static boolean isJson(String text) {
		try {
			JsonNode node = Jsons.mapper().readTree(text);
			return node != null && !node.isMissingNode();
		} catch (JsonProcessingException e) {
			return false;
		}
	}

	/**
	 * Returns the VM of a cell, for collaborators that need to interact with
	 * the scripts directly. Callers must not use it concurrently with the cell.
	 *
	 * @param cellId session identifier
	 * @return the VM of the cell
	 * @throws CellNotFoundException when no cell has this identifier
	 */
	public ScriptVm getVm(String cellId) {
		Cell cell = cellId == null ? null : cells.get(cellId);
		if (cell == null) {
			throw new CellNotFoundException(cellId);
		}
		return cell.getVm();
	}

	/**
	 * @param cellId session identifier
	 * @return {@code true} when a cell exists for this identifier
	 */
	public boolean hasCell(String cellId) {
		return cellId != null && cells.containsKey(cellId);
	}

	/**
	 * Returns the node client handle, resolving it on first use. A failed
	 * resolution is not cached: the next call tries again.
	 *
	 * @return the shared restart-tolerant client handle
	 * @throws NodeUnavailableException when no node is running
	 */
	@Override
	public synchronized ClientHandle clientHandle() {
		if (clientHandle != null) {
			return clientHandle;
		}
		if (!nodeManager.hasNode()) {
			throw new NodeUnavailableException();
		}
		clientHandle = nodeManager.clientHandle();
		LOG.debug("Resolved node client handle");
		return clientHandle;
	}

	/**
	 * Returns the request hooks, resolving them on first use. A failed
	 * resolution is not cached: the next call tries again.
	 *
	 * @return the shared request hooks
	 * @throws NodeUnavailableException when no node is running
	 */
	@Override
	public synchronized RequestHooks requestHooks() {
		if (requestHooks != null) {
			return requestHooks;
		}
		if (!nodeManager.hasNode()) {
			throw new NodeUnavailableException();
		}
		requestHooks = nodeManager.requestHooks();
		return requestHooks;
	}
}
