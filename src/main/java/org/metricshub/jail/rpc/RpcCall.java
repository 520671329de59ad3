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
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jail.MalformedRequestException;

/**
 * One JSON-RPC call issued by a script.
 * <p>
 * The identifier is echoed back untouched, whatever its JSON type.
 * Identifiers are neither validated nor deduplicated.
 */
public final class RpcCall {

	private final JsonNode id;
	private final String method;
	private final List<JsonNode> params;

	/**
	 * @param id request identifier, {@code null} meaning JSON null
	 * @param method JSON-RPC method name
	 * @param params positional parameters, {@code null} meaning none
	 */
	public RpcCall(JsonNode id, String method, List<JsonNode> params) {
		this.id = id == null ? NullNode.getInstance() : id;
		this.method = method == null ? "" : method;
		this.params = params == null
				? Collections.<JsonNode>emptyList()
				: Collections.unmodifiableList(new ArrayList<JsonNode>(params));
	}

	/**
	 * Decodes one <code>{id, method, params}</code> object.
	 *
	 * @param node JSON value supplied by the script
	 * @return the decoded call
	 * @throws MalformedRequestException when <code>node</code> is not a call object
	 */
	public static RpcCall fromJson(JsonNode node) {
		if (node == null || !node.isObject()) {
			throw new MalformedRequestException("JSON-RPC call must be an object, got: " + node);
		}
		JsonNode method = node.get("method");
		if (method != null && !method.isNull() && !method.isTextual()) {
			throw new MalformedRequestException("JSON-RPC method must be a string, got: " + method);
		}
		JsonNode params = node.get("params");
		List<JsonNode> paramList = new ArrayList<JsonNode>();
		if (params != null && !params.isNull()) {
			if (!params.isArray()) {
				throw new MalformedRequestException("JSON-RPC params must be an array, got: " + params);
			}
			for (JsonNode param : params) {
				paramList.add(param);
			}
		}
		return new RpcCall(node.get("id"), method == null ? null : method.asText(null), paramList);
	}

	public JsonNode getId() {
		return id;
	}

	public String getMethod() {
		return method;
	}

	public List<JsonNode> getParams() {
		return params;
	}

	@Override
	public String toString() {
		return "RpcCall[id=" + id + ", method=" + method + ", params=" + params.size() + "]";
	}
}
