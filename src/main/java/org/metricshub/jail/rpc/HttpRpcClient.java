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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.metricshub.jail.util.JailLogger;
import org.metricshub.jail.util.Jsons;
import org.slf4j.Logger;

/**
 * {@link RpcClient} speaking JSON-RPC 2.0 over HTTP POST.
 * <p>
 * Every call carries its own deadline: a node that does not answer in time
 * fails the call with an {@link RpcException}.
 */
public class HttpRpcClient implements RpcClient {

	private static final Logger LOG = JailLogger.getLogger(HttpRpcClient.class);

	private final URI endpoint;
	private final Duration timeout;
	private final HttpClient httpClient;
	private final AtomicLong nextId = new AtomicLong(1);

	/**
	 * @param endpoint URL of the node, e.g. <code>http://localhost:8545</code>
	 * @param timeoutMillis deadline of one round trip
	 */
	public HttpRpcClient(URI endpoint, long timeoutMillis) {
		this(endpoint, timeoutMillis, HttpClient.newBuilder().connectTimeout(Duration.ofMillis(timeoutMillis)).build());
	}

	HttpRpcClient(URI endpoint, long timeoutMillis, HttpClient httpClient) {
		if (endpoint == null) {
			throw new IllegalArgumentException("RPC endpoint must not be null");
		}
		this.endpoint = endpoint;
		this.timeout = Duration.ofMillis(timeoutMillis);
		this.httpClient = httpClient;
	}

	public URI getEndpoint() {
		return endpoint;
	}

	@Override
	public String call(String method, List<JsonNode> params) throws RpcException {
		long id = nextId.getAndIncrement();
		ObjectNode request = Jsons.mapper().createObjectNode();
		request.put("jsonrpc", "2.0");
		request.put("id", id);
		request.put("method", method);
		ArrayNode paramArray = request.putArray("params");
		if (params != null) {
			paramArray.addAll(params);
		}

		HttpRequest httpRequest = HttpRequest
				.newBuilder(endpoint)
				.timeout(timeout)
				.header("Content-Type", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(Jsons.toJson(request), StandardCharsets.UTF_8))
				.build();

		LOG.debug("-> {} {} (id={})", endpoint, method, id);
		HttpResponse<String> httpResponse;
		try {
			httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
		} catch (HttpTimeoutException e) {
			throw new RpcException(method + " timed out after " + timeout.toMillis() + " ms", e);
		} catch (IOException e) {
			throw new RpcException(method + " failed: " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RpcException(method + " was interrupted", e);
		}

		if (httpResponse.statusCode() / 100 != 2) {
			throw new RpcException(method + " failed with HTTP status " + httpResponse.statusCode());
		}
		return readResult(method, httpResponse.body());
	}

	/**
	 * Extracts the <code>result</code> member of a JSON-RPC response.
	 *
	 * @param method method name, for error messages
	 * @param body HTTP response body
	 * @return raw JSON text of the result, {@code null} for a null or absent result
	 * @throws RpcException when the body is not a JSON-RPC response or carries an error
	 */
	static String readResult(String method, String body) throws RpcException {
		JsonNode response;
		try {
			response = Jsons.mapper().readTree(body);
		} catch (JsonProcessingException e) {
			throw new RpcException(method + " returned invalid JSON: " + e.getOriginalMessage(), e);
		}
		if (response == null || !response.isObject()) {
			throw new RpcException(method + " returned an unexpected response: " + body);
		}

		JsonNode error = response.get("error");
		if (error != null && !error.isNull()) {
			int code = error.path("code").asInt(RpcErrorCodes.INTERNAL_ERROR);
			String message = error.path("message").asText("");
			throw new RpcErrorException(code, message);
		}

		JsonNode result = response.get("result");
		if (result == null || result.isNull()) {
			return null;
		}
		return Jsons.toJson(result);
	}
}
