package org.metricshub.jail.util;

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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * A simple container for the parameters of a {@link org.metricshub.jail.Jail}.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when embedding the jail programmatically, from within Java code.
 */
public class JailSettings {

	/** Default time a caller waits for a busy cell, in milliseconds. */
	public static final long DEFAULT_REQUEST_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(60);

	/** Default deadline of one HTTP round trip to the node, in milliseconds. */
	public static final long DEFAULT_RPC_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(30);

	/** Classpath location of the script wiring web3 to the bridge object. */
	public static final String WEB3_PREAMBLE_RESOURCE = "/org/metricshub/jail/web3-preamble.js";

	/**
	 * Script evaluated first in every new cell.
	 * Empty by default.
	 */
	private String baseScript = "";

	/**
	 * web3/bignumber bundle evaluated right before the preamble.
	 * <code>null</code> means no bundle: the preamble then leaves
	 * <code>web3</code> and <code>bn()</code> undefined.
	 */
	private ScriptSource web3Library = null;

	/**
	 * Maximum time a caller waits to enter a cell already in use.
	 */
	private long requestTimeoutMillis = DEFAULT_REQUEST_TIMEOUT_MILLIS;

	/**
	 * Deadline of one round trip to the node, used by
	 * {@link org.metricshub.jail.rpc.HttpRpcClient}.
	 */
	private long rpcTimeoutMillis = DEFAULT_RPC_TIMEOUT_MILLIS;

	/**
	 * Global name of the bridge object; <code>jeth</code> by default.
	 */
	private String bridgeName = "jeth";

	/**
	 * Global object serialized once the cell script has been evaluated.
	 */
	private String catalogName = "_status_catalog";

	/**
	 * Global function invoked by {@link org.metricshub.jail.Jail#dispatchCall}.
	 */
	private String entryPointName = "call";

	/**
	 * Provides a human readable representation of the settings.
	 *
	 * @return one <code>name = value</code> line per setting
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("baseScript = ").append(baseScript.length()).append(" chars").append(newLine);
		desc.append("web3Library = ").append(web3Library).append(newLine);
		desc.append("requestTimeoutMillis = ").append(requestTimeoutMillis).append(newLine);
		desc.append("rpcTimeoutMillis = ").append(rpcTimeoutMillis).append(newLine);
		desc.append("bridgeName = ").append(bridgeName).append(newLine);
		desc.append("catalogName = ").append(catalogName).append(newLine);
		desc.append("entryPointName = ").append(entryPointName).append(newLine);

		return desc.toString();
	}

	/**
	 * Loads the script binding the web3 client and the <code>bn()</code>
	 * helper to the bridge object.
	 *
	 * @return the preamble text, bound to {@link #getBridgeName()}
	 */
	public String loadWeb3Preamble() {
		try (InputStream in = JailSettings.class.getResourceAsStream(WEB3_PREAMBLE_RESOURCE)) {
			if (in == null) {
				throw new IllegalStateException("Missing classpath resource " + WEB3_PREAMBLE_RESOURCE);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8).replace("{{bridge}}", bridgeName);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + WEB3_PREAMBLE_RESOURCE, e);
		}
	}

	public String getBaseScript() {
		return baseScript;
	}

	/**
	 * Sets the script evaluated first in every new cell.
	 *
	 * @param baseScript script text, {@code null} being treated as empty
	 */
	public void setBaseScript(String baseScript) {
		this.baseScript = baseScript == null ? "" : baseScript;
	}

	public ScriptSource getWeb3Library() {
		return web3Library;
	}

	/**
	 * Sets the bundle defining <code>require('web3')</code> and
	 * <code>require('bignumber.js')</code>, evaluated right before the preamble.
	 * <p>
	 * Without a bundle (or with one that does not define <code>require</code>)
	 * the preamble wires nothing: <code>web3</code> and the <code>bn(value)</code>
	 * helper stay undefined in the cells, and scripts must not rely on them.
	 *
	 * @param web3Library the bundle, {@code null} for none
	 */
	public void setWeb3Library(ScriptSource web3Library) {
		this.web3Library = web3Library;
	}

	public long getRequestTimeoutMillis() {
		return requestTimeoutMillis;
	}

	/**
	 * Sets how long a caller waits to enter a busy cell.
	 *
	 * @param requestTimeoutMillis positive number of milliseconds
	 */
	public void setRequestTimeoutMillis(long requestTimeoutMillis) {
		if (requestTimeoutMillis <= 0) {
			throw new IllegalArgumentException("Request timeout must be positive: " + requestTimeoutMillis);
		}
		this.requestTimeoutMillis = requestTimeoutMillis;
	}

	public long getRpcTimeoutMillis() {
		return rpcTimeoutMillis;
	}

	public void setRpcTimeoutMillis(long rpcTimeoutMillis) {
		if (rpcTimeoutMillis <= 0) {
			throw new IllegalArgumentException("RPC timeout must be positive: " + rpcTimeoutMillis);
		}
		this.rpcTimeoutMillis = rpcTimeoutMillis;
	}

	public String getBridgeName() {
		return bridgeName;
	}

	public void setBridgeName(String bridgeName) {
		this.bridgeName = bridgeName;
	}

	public String getCatalogName() {
		return catalogName;
	}

	public void setCatalogName(String catalogName) {
		this.catalogName = catalogName;
	}

	public String getEntryPointName() {
		return entryPointName;
	}

	public void setEntryPointName(String entryPointName) {
		this.entryPointName = entryPointName;
	}
}
