package org.metricshub.jail;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jail.node.DefaultNodeManager;
import org.metricshub.jail.node.NodeManager;
import org.metricshub.jail.util.JailSettings;
import org.metricshub.jail.util.Jsons;
import org.metricshub.jail.vm.ScriptVm;

public class JailTest {

	static final String ENTRY_POINT = "function call(path, args) {\n" +
			"  return _status_catalog[path].apply(null, JSON.parse(args));\n" +
			"}\n";

	private StubRpcClient client;
	private DefaultNodeManager nodeManager;
	private Jail jail;

	@Before
	public void setUp() {
		client = new StubRpcClient().answer("eth_blockNumber", "\"0x10\"");
		nodeManager = new DefaultNodeManager();
		nodeManager.start(client);
		JailSettings settings = new JailSettings();
		settings.setBaseScript(ENTRY_POINT);
		jail = new Jail(settings, nodeManager);
	}

	@After
	public void tearDown() {
		Jail.resetInstance();
	}

	static JsonNode json(String text) throws Exception {
		return Jsons.mapper().readTree(text);
	}

	@Test
	public void testPingPong() {
		assertEquals("{\"result\":{}}", jail.bootstrapCell("s1", "var _status_catalog = {ping: function(){return \"pong\"}};"));
		assertEquals("{\"result\":\"pong\"}", jail.dispatchCall("s1", "ping", "[]"));
	}

	@Test
	public void testBootstrapReturnsCatalog() throws Exception {
		String envelope = jail.bootstrapCell("s1", "var _status_catalog = {version: '1.0', tags: ['a', 'b'], ping: function(){}};");
		assertEquals(json("{\"result\":{\"version\":\"1.0\",\"tags\":[\"a\",\"b\"]}}"), json(envelope));
	}

	@Test
	public void testMissingCatalogIsNull() {
		assertEquals("{\"result\":null}", jail.bootstrapCell("s1", "var x = 1;"));
		assertTrue(jail.hasCell("s1"));
	}

	@Test
	public void testArgumentsAreHandedToEntryPoint() {
		jail.bootstrapCell("s1", "var _status_catalog = {add: function(a, b){return a + b}};");
		assertEquals("{\"result\":5}", jail.dispatchCall("s1", "add", "[2,3]"));
	}

	@Test
	public void testJsonStringResultIsNotQuotedTwice() throws Exception {
		jail.bootstrapCell("s1", "var _status_catalog = {obj: function(){return JSON.stringify({a: 1})}};");
		assertEquals(json("{\"result\":{\"a\":1}}"), json(jail.dispatchCall("s1", "obj", "[]")));
	}

	@Test
	public void testTextStartingWithJsonIsQuoted() {
		jail.bootstrapCell("s1", "var _status_catalog = {\n" +
				"  a: function(){return 'true story'},\n" +
				"  b: function(){return '{\"x\":1} trailing'},\n" +
				"  c: function(){return 'null and void'}\n" +
				"};");
		assertEquals("{\"result\":\"true story\"}", jail.dispatchCall("s1", "a", "[]"));
		assertEquals("{\"result\":\"{\\\"x\\\":1} trailing\"}", jail.dispatchCall("s1", "b", "[]"));
		assertEquals("{\"result\":\"null and void\"}", jail.dispatchCall("s1", "c", "[]"));
	}

	@Test
	public void testUndefinedResultIsNull() {
		jail.bootstrapCell("s1", "var _status_catalog = {nothing: function(){}};");
		assertEquals("{\"result\":null}", jail.dispatchCall("s1", "nothing", "[]"));
	}

	@Test
	public void testUnknownCell() {
		assertEquals("{\"error\":\"Cell[nope] doesn't exist.\"}", jail.dispatchCall("nope", "ping", "[]"));
		assertFalse(jail.hasCell("nope"));
	}

	@Test
	public void testRebootstrapDiscardsPreviousGlobals() {
		jail.bootstrapCell("s1", "var leftover = 1; var _status_catalog = {};");
		jail.bootstrapCell("s1", "var _status_catalog = {probe: function(){return typeof leftover}};");
		assertEquals("{\"result\":\"undefined\"}", jail.dispatchCall("s1", "probe", "[]"));
	}

	@Test
	public void testCellsAreIsolated() {
		jail.bootstrapCell("a", "var secret = 'a'; var _status_catalog = {probe: function(){return typeof secret}};");
		jail.bootstrapCell("b", "var _status_catalog = {probe: function(){return typeof secret}};");
		assertEquals("{\"result\":\"string\"}", jail.dispatchCall("a", "probe", "[]"));
		assertEquals("{\"result\":\"undefined\"}", jail.dispatchCall("b", "probe", "[]"));
	}

	@Test
	public void testScriptErrorDuringBootstrap() throws Exception {
		JsonNode envelope = json(jail.bootstrapCell("s1", "var _status_catalog = {;"));
		assertTrue(envelope.has("error"));
		assertFalse(envelope.has("result"));
	}

	@Test
	public void testScriptErrorDuringCall() throws Exception {
		jail.bootstrapCell("s1", "var _status_catalog = {boom: function(){throw new Error('boom')}};");
		JsonNode envelope = json(jail.dispatchCall("s1", "boom", "[]"));
		assertTrue(envelope.get("error").asText().contains("boom"));
	}

	@Test
	public void testMissingEntryPoint() throws Exception {
		Jail bare = new Jail(new JailSettings(), nodeManager);
		bare.bootstrapCell("s1", "var _status_catalog = {};");
		JsonNode envelope = json(bare.dispatchCall("s1", "ping", "[]"));
		assertTrue(envelope.get("error").asText().contains("call is not a function"));
	}

	@Test
	public void testNoNode() {
		Jail offline = new Jail(jail.getSettings(), NodeManager.NONE);
		assertEquals("{\"result\":{}}", offline.bootstrapCell("s1", "var _status_catalog = {ping: function(){return 'pong'}};"));
		assertEquals("{\"error\":\"no running node detected\"}", offline.dispatchCall("s1", "ping", "[]"));
	}

	@Test
	public void testNodeStartedAfterFailedResolution() {
		DefaultNodeManager later = new DefaultNodeManager();
		Jail waiting = new Jail(jail.getSettings(), later);
		waiting.bootstrapCell("s1", "var _status_catalog = {ping: function(){return 'pong'}};");
		assertEquals("{\"error\":\"no running node detected\"}", waiting.dispatchCall("s1", "ping", "[]"));
		later.start(client);
		assertEquals("{\"result\":\"pong\"}", waiting.dispatchCall("s1", "ping", "[]"));
	}

	@Test
	public void testBridgeCallThroughDispatch() throws Exception {
		jail.bootstrapCell("s1", "var _status_catalog = {block: function(){" +
				"return jeth.send({id: 7, method: 'eth_blockNumber', params: []});}};");
		assertEquals(
				json("{\"result\":{\"jsonrpc\":\"2.0\",\"id\":7,\"result\":\"0x10\"}}"),
				json(jail.dispatchCall("s1", "block", "[]")));
		assertEquals(1, client.getMethods().size());
	}

	@Test
	public void testNodeRestartIsTransparent() throws Exception {
		jail.bootstrapCell("s1", "var _status_catalog = {block: function(){" +
				"return jeth.send({id: 1, method: 'eth_blockNumber', params: []}).result;}};");
		assertEquals("{\"result\":\"0x10\"}", jail.dispatchCall("s1", "block", "[]"));

		StubRpcClient restarted = new StubRpcClient().answer("eth_blockNumber", "\"0x11\"");
		nodeManager.restart(restarted);
		assertEquals("{\"result\":\"0x11\"}", jail.dispatchCall("s1", "block", "[]"));
		assertEquals(1, restarted.getMethods().size());
	}

	@Test
	public void testNodeStoppedInsideBridge() throws Exception {
		jail.bootstrapCell("s1", "var _status_catalog = {block: function(){" +
				"return jeth.send({id: 1, method: 'eth_blockNumber', params: []});}};");
		assertEquals("0x10", json(jail.dispatchCall("s1", "block", "[]")).get("result").get("result").asText());

		nodeManager.stop();
		JsonNode response = json(jail.dispatchCall("s1", "block", "[]")).get("result");
		assertTrue(response.get("id").isNull());
		assertEquals(-32603, response.get("error").get("code").asInt());
		assertEquals("no running node detected", response.get("error").get("message").asText());
	}

	@Test
	public void testWeb3IsWiredToBridge() {
		JailSettings settings = new JailSettings();
		settings.setBaseScript(ENTRY_POINT +
				"function require(name) {\n" +
				"  if (name === 'web3') { return function(provider) { this.currentProvider = provider; }; }\n" +
				"  return function(val) { this.value = val; };\n" +
				"}\n");
		Jail withWeb3 = new Jail(settings, nodeManager);
		withWeb3.bootstrapCell("s1", "var _status_catalog = {wired: function(){" +
				"return web3.currentProvider === jeth && bn(5).value === 5;}};");
		assertEquals("{\"result\":true}", withWeb3.dispatchCall("s1", "wired", "[]"));
	}

	@Test
	public void testNoWeb3WithoutRequire() {
		jail.bootstrapCell("s1", "var _status_catalog = {probe: function(){return typeof web3 + ',' + typeof bn}};");
		assertEquals("{\"result\":\"undefined,undefined\"}", jail.dispatchCall("s1", "probe", "[]"));
	}

	@Test
	public void testGetVm() throws Exception {
		jail.bootstrapCell("s1", "var answer = 42;");
		ScriptVm vm = jail.getVm("s1");
		assertEquals("42", vm.stringify(vm.get("answer")));
		try {
			jail.getVm("missing");
			fail("CellNotFoundException expected");
		} catch (CellNotFoundException e) {
			assertEquals("missing", e.getCellId());
		}
	}

	@Test
	public void testInitKeepsInstance() {
		Jail.resetInstance();
		Jail first = Jail.init("var a = 1;");
		Jail second = Jail.init("var b = 2;");
		assertSame(first, second);
		assertSame(first, Jail.getInstance());
		assertEquals("var b = 2;", first.getSettings().getBaseScript());
	}

	@Test
	public void testInitWithCollaboratorsReplacesInstance() {
		Jail.resetInstance();
		Jail previous = Jail.getInstance();
		Jail replaced = Jail.init(new JailSettings(), nodeManager);
		assertNotSame(previous, replaced);
		assertSame(replaced, Jail.getInstance());
		assertSame(nodeManager, replaced.getNodeManager());
	}

	@Test
	public void testGatewayWithoutJail() {
		JailGateway gateway = new JailGateway(null);
		assertEquals("{\"error\":\"jail environment is not properly initialized\"}", gateway.parse("s1", "var x;"));
		assertEquals("{\"error\":\"jail environment is not properly initialized\"}", gateway.call("s1", "ping", "[]"));
		try {
			gateway.getVm("s1");
			fail("JailNotInitializedException expected");
		} catch (JailNotInitializedException e) {
			assertEquals(JailNotInitializedException.MESSAGE, e.getMessage());
		}
	}

	@Test
	public void testGatewayDelegates() {
		JailGateway gateway = new JailGateway(jail);
		gateway.parse("s1", "var _status_catalog = {ping: function(){return 'pong'}};");
		assertEquals("{\"result\":\"pong\"}", gateway.call("s1", "ping", "[]"));
		assertSame(jail.getVm("s1"), gateway.getVm("s1"));
	}
}
