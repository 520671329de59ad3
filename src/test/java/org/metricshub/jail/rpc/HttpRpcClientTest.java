package org.metricshub.jail.rpc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jail.util.Jsons;

public class HttpRpcClientTest {

	private HttpServer server;
	private ExecutorService executor;
	private URI endpoint;
	private volatile JsonNode lastRequest;

	@Before
	public void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/", new HttpHandler() {
			@Override
			public void handle(HttpExchange exchange) throws IOException {
				serve(exchange);
			}
		});
		executor = Executors.newCachedThreadPool();
		server.setExecutor(executor);
		server.start();
		endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/");
	}

	@After
	public void tearDown() {
		server.stop(0);
		executor.shutdownNow();
	}

	private void serve(HttpExchange exchange) throws IOException {
		JsonNode request;
		try (InputStream in = exchange.getRequestBody()) {
			request = Jsons.mapper().readTree(in);
		}
		lastRequest = request;
		String method = request.path("method").asText();
		String id = Jsons.toJson(request.get("id"));
		int status = 200;
		String body;
		if ("eth_blockNumber".equals(method)) {
			body = "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":\"0x2a\"}";
		} else if ("eth_getTransactionReceipt".equals(method)) {
			body = "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":null}";
		} else if ("slow".equals(method)) {
			try {
				Thread.sleep(2000);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			body = "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":true}";
		} else if ("broken".equals(method)) {
			status = 500;
			body = "internal failure";
		} else {
			body = "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"error\":{\"code\":-32601,\"message\":\"the method " + method + " does not exist\"}}";
		}
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "application/json");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	@Test
	public void testResult() throws Exception {
		HttpRpcClient client = new HttpRpcClient(endpoint, 5000);
		assertEquals("\"0x2a\"", client.call("eth_blockNumber", Collections.<JsonNode>emptyList()));
		assertEquals("2.0", lastRequest.get("jsonrpc").asText());
		assertEquals("eth_blockNumber", lastRequest.get("method").asText());
		assertTrue(lastRequest.get("params").isArray());
	}

	@Test
	public void testParamsAreSent() throws Exception {
		HttpRpcClient client = new HttpRpcClient(endpoint, 5000);
		client.call("eth_getTransactionReceipt", Arrays.<JsonNode>asList(new TextNode("0xabc")));
		assertEquals("0xabc", lastRequest.get("params").get(0).asText());
	}

	@Test
	public void testIdsIncrease() throws Exception {
		HttpRpcClient client = new HttpRpcClient(endpoint, 5000);
		client.call("eth_blockNumber", null);
		long first = lastRequest.get("id").asLong();
		client.call("eth_blockNumber", null);
		assertEquals(first + 1, lastRequest.get("id").asLong());
	}

	@Test
	public void testNullResult() throws Exception {
		HttpRpcClient client = new HttpRpcClient(endpoint, 5000);
		assertNull(client.call("eth_getTransactionReceipt", null));
	}

	@Test
	public void testErrorObject() throws Exception {
		HttpRpcClient client = new HttpRpcClient(endpoint, 5000);
		try {
			client.call("bogus_method", null);
			fail("RpcErrorException expected");
		} catch (RpcErrorException e) {
			assertEquals(-32601, e.getCode());
			assertEquals("the method bogus_method does not exist", e.getMessage());
		}
	}

	@Test
	public void testHttpStatus() throws Exception {
		HttpRpcClient client = new HttpRpcClient(endpoint, 5000);
		try {
			client.call("broken", null);
			fail("RpcException expected");
		} catch (RpcException e) {
			assertTrue(e.getMessage().contains("500"));
		}
	}

	@Test
	public void testDeadline() throws Exception {
		HttpRpcClient client = new HttpRpcClient(endpoint, 300);
		try {
			client.call("slow", null);
			fail("RpcException expected");
		} catch (RpcException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("timed out"));
		}
	}

	@Test
	public void testReadResult() throws Exception {
		assertEquals("{\"a\":[1,2]}", HttpRpcClient.readResult("m", "{\"id\":1,\"result\":{\"a\":[1,2]}}"));
		assertNull(HttpRpcClient.readResult("m", "{\"id\":1}"));
		try {
			HttpRpcClient.readResult("m", "[1]");
			fail("RpcException expected");
		} catch (RpcException e) {
			assertTrue(e.getMessage().startsWith("m returned an unexpected response"));
		}
		try {
			HttpRpcClient.readResult("m", "{\"error\":{\"message\":\"no code\"}}");
			fail("RpcErrorException expected");
		} catch (RpcErrorException e) {
			assertEquals(RpcErrorCodes.INTERNAL_ERROR, e.getCode());
		}
	}
}
