package org.metricshub.jail;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.jail.node.DefaultNodeManager;

public class CliTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final ByteArrayOutputStream output = new ByteArrayOutputStream();
	private DefaultNodeManager nodeManager;
	private String base;
	private String script;

	@Before
	public void setUp() throws IOException {
		nodeManager = new DefaultNodeManager();
		nodeManager.start(new StubRpcClient().answer("eth_blockNumber", "\"0x10\""));
		base = write("base.js", JailTest.ENTRY_POINT);
		script = write("cell.js", "var _status_catalog = {\n" +
				"  name: 'cli',\n" +
				"  block: function() { return jeth.send({id: 1, method: 'eth_blockNumber', params: []}).result; },\n" +
				"  echo: function(value) { return value; }\n" +
				"};\n");
	}

	private String write(String name, String content) throws IOException {
		File file = folder.newFile(name);
		Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
		return file.getPath();
	}

	private Cli cli(String... args) {
		Cli cli = new Cli(new PrintStream(output, true), nodeManager);
		cli.parse(args);
		return cli;
	}

	private String[] lines() throws IOException {
		return output.toString("UTF-8").trim().split("\\R");
	}

	@Test
	public void testBootstrapOnly() throws Exception {
		assertEquals(0, cli("-b", base, "-f", script).run());
		assertEquals("{\"result\":{\"name\":\"cli\"}}", lines()[0]);
		assertEquals(1, lines().length);
	}

	@Test
	public void testBootstrapAndCall() throws Exception {
		assertEquals(0, cli("-b", base, "-f", script, "block").run());
		assertEquals("{\"result\":\"0x10\"}", lines()[1]);
	}

	@Test
	public void testCallWithArguments() throws Exception {
		Cli cli = cli("-b", base, "-f", script, "-t", "5", "echo", "[{\"a\":1}]");
		assertEquals("echo", cli.getPath());
		assertEquals("[{\"a\":1}]", cli.getCallArgs());
		assertEquals(5000L, cli.getSettings().getRequestTimeoutMillis());
		assertEquals(0, cli.run());
		assertEquals("{\"result\":{\"a\":1}}", lines()[1]);
	}

	@Test
	public void testFailingCallExitCode() throws Exception {
		assertEquals(1, cli("-b", base, "-f", script, "missing").run());
		assertTrue(lines()[1].startsWith("{\"error\":"));
	}

	@Test
	public void testBrokenScriptExitCode() throws Exception {
		String broken = write("broken.js", "var _status_catalog = {;");
		assertEquals(1, cli("-f", broken, "block").run());
		assertEquals(1, lines().length);
	}

	@Test
	public void testUsage() throws Exception {
		assertEquals(0, cli("-h").run());
		assertEquals("Usage:", lines()[0]);
		output.reset();
		assertEquals(0, cli().run());
		assertEquals("Usage:", lines()[0]);
	}

	@Test
	public void testEndpoint() {
		Cli cli = Cli.parseCommandLineArguments(new String[] { "-u", "http://localhost:8545", "-f", script });
		assertEquals("localhost", cli.getEndpoint().getHost());
		assertEquals(8545, cli.getEndpoint().getPort());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingScript() {
		cli("-b", base);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingEndpoint() {
		Cli.parseCommandLineArguments(new String[] { "-f", script });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnsupportedEndpoint() {
		Cli.parseCommandLineArguments(new String[] { "-u", "ftp://localhost", "-f", script });
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMissingOptionValue() {
		cli("-f");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidTimeout() {
		cli("-f", script, "-t", "0");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownOption() {
		cli("-f", script, "-x");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnreadableScript() {
		cli("-f", new File(folder.getRoot(), "absent.js").getPath());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTooManyArguments() {
		cli("-f", script, "echo", "[]", "extra");
	}
}
