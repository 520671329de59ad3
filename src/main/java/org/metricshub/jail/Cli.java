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
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.concurrent.TimeUnit;
import org.metricshub.jail.node.DefaultNodeManager;
import org.metricshub.jail.node.NodeManager;
import org.metricshub.jail.rpc.HttpRpcClient;
import org.metricshub.jail.util.JailSettings;
import org.metricshub.jail.util.Jsons;
import org.metricshub.jail.util.ScriptFileSource;
import org.metricshub.jail.util.ScriptSource;

/**
 * Command-line interface for the jail: bootstraps one cell against a node
 * reachable over HTTP and optionally invokes one catalog path in it.
 */
public final class Cli {

	/** Identifier of the cell created by the command line. */
	public static final String CELL_ID = "cli";

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "jail.jar";
		}
		JAR_NAME = myName;
	}

	private final JailSettings settings = new JailSettings();
	private final PrintStream out;
	private NodeManager nodeManager;

	private URI endpoint;
	private ScriptSource cellScript;
	private String path;
	private String callArgs = "[]";
	private boolean printUsage;

	/**
	 * Creates a CLI instance printing to the standard output and reaching
	 * the node given with <code>-u</code>.
	 */
	public Cli() {
		this(System.out, null);
	}

	/**
	 * Creates a CLI instance using the supplied stream and node manager.
	 *
	 * @param out stream where envelopes and usage are written
	 * @param nodeManager node manager to use instead of the <code>-u</code> endpoint,
	 *        {@code null} to build one from the endpoint
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, NodeManager nodeManager) {
		this.out = out;
		this.nodeManager = nodeManager;
	}

	/**
	 * Returns the mutable {@link JailSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JailSettings getSettings() {
		return settings;
	}

	public URI getEndpoint() {
		return endpoint;
	}

	public String getPath() {
		return path;
	}

	public String getCallArgs() {
		return callArgs;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: remaining args are the path and its arguments
				break;
			} else if (arg.equals("-u") || arg.equals("--url")) {
				// -u url : JSON-RPC endpoint of the node
				checkParameterHasArgument(args, argIdx);
				endpoint = parseEndpoint(args[++argIdx]);
			} else if (arg.equals("-b")) {
				// -b filename : base script evaluated first in the cell
				checkParameterHasArgument(args, argIdx);
				settings.setBaseScript(readScript(new ScriptFileSource(args[++argIdx])));
			} else if (arg.equals("-w")) {
				// -w filename : web3 bundle providing require('web3')
				checkParameterHasArgument(args, argIdx);
				ScriptFileSource web3 = new ScriptFileSource(args[++argIdx]);
				readScript(web3);
				settings.setWeb3Library(web3);
			} else if (arg.equals("-f")) {
				// -f filename : session script defining the catalog
				checkParameterHasArgument(args, argIdx);
				cellScript = new ScriptFileSource(args[++argIdx]);
				readScript(cellScript);
			} else if (arg.equals("-t")) {
				// -t seconds : how long a call waits for a busy cell, and for the node
				checkParameterHasArgument(args, argIdx);
				long millis = TimeUnit.SECONDS.toMillis(parsePositiveLong(args[++argIdx]));
				settings.setRequestTimeoutMillis(millis);
				settings.setRpcTimeoutMillis(millis);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (cellScript == null) {
			throw new IllegalArgumentException("Cell script not provided (-f).");
		}
		if (endpoint == null && nodeManager == null) {
			throw new IllegalArgumentException("Node endpoint not provided (-u).");
		}
		if (argIdx < args.length) {
			path = args[argIdx++];
		}
		if (argIdx < args.length) {
			callArgs = args[argIdx++];
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static URI parseEndpoint(String value) {
		try {
			URI uri = new URI(value);
			if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
				throw new IllegalArgumentException("Node endpoint must be an http(s) URL: " + value);
			}
			return uri;
		} catch (URISyntaxException e) {
			throw new IllegalArgumentException("Invalid node endpoint '" + value + "': " + e.getMessage(), e);
		}
	}

	private static long parsePositiveLong(String value) {
		try {
			long parsed = Long.parseLong(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException("Timeout must be positive: " + value);
			}
			return parsed;
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid timeout '" + value + "'", e);
		}
	}

	private static String readScript(ScriptSource source) {
		try {
			return source.getText();
		} catch (IOException ex) {
			throw new IllegalArgumentException(
					"Failed to read script '" + source.getDescription() + "': " + ex.getMessage(),
					ex);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return 0 when every envelope printed holds a result, 1 otherwise
	 */
	public int run() {
		if (printUsage) {
			usage(out);
			return 0;
		}
		if (nodeManager == null) {
			DefaultNodeManager manager = new DefaultNodeManager();
			manager.start(new HttpRpcClient(endpoint, settings.getRpcTimeoutMillis()));
			nodeManager = manager;
		}

		Jail jail = new Jail(settings, nodeManager);
		String catalog = jail.bootstrapCell(CELL_ID, readScript(cellScript));
		out.println(catalog);
		if (isError(catalog)) {
			return 1;
		}
		if (path != null) {
			String result = jail.dispatchCall(CELL_ID, path, callArgs);
			out.println(result);
			if (isError(result)) {
				return 1;
			}
		}
		return 0;
	}

	private static boolean isError(String envelope) {
		try {
			JsonNode node = Jsons.mapper().readTree(envelope);
			return node == null || node.has("error");
		} catch (JsonProcessingException e) {
			return true;
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" -u url" +
								" -f script-filename" +
								" [-b base-script-filename]" +
								" [-w web3-filename]" +
								" [-t seconds]" +
								" [path [args-json]]");
		dest.println();
		dest.println(" -u, --url url = JSON-RPC endpoint of the node, e.g. http://localhost:8545.");
		dest.println(" -f filename = Session script, expected to define " + new JailSettings().getCatalogName() + ".");
		dest.println(" -b filename = Base script evaluated first in the cell.");
		dest.println(" -w filename = web3 bundle providing require('web3') and require('bignumber.js').");
		dest.println(" -t seconds = Time to wait for a busy cell and for each node round trip.");
		dest.println(" path = Catalog path handed to the entry point function, with optional JSON args (default []).");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}
}
