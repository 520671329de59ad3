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
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.metricshub.jail.util.Jsons;

/**
 * JSON-RPC 2.0 response handed back to a script: either a result or an
 * error object, never both.
 */
public final class RpcResponse {

	private final JsonNode id;
	private final JsonNode result;
	private final int errorCode;
	private final String errorMessage;

	private RpcResponse(JsonNode id, JsonNode result, int errorCode, String errorMessage) {
		this.id = id == null ? NullNode.getInstance() : id;
		this.result = result;
		this.errorCode = errorCode;
		this.errorMessage = errorMessage;
	}

	/**
	 * @param id identifier of the call
	 * @param result result value, {@code null} meaning JSON null
	 * @return a successful response
	 */
	public static RpcResponse success(JsonNode id, JsonNode result) {
		return new RpcResponse(id, result == null ? NullNode.getInstance() : result, 0, null);
	}

	/**
	 * @param id identifier of the call
	 * @param code JSON-RPC error code
	 * @param message error message
	 * @return an error response
	 */
	public static RpcResponse error(JsonNode id, int code, String message) {
		return new RpcResponse(id, null, code, message == null ? "" : message);
	}

	/**
	 * @param id identifier of the call
	 * @param message error message
	 * @return an error response with code {@link RpcErrorCodes#INTERNAL_ERROR}
	 */
	public static RpcResponse internalError(JsonNode id, String message) {
		return error(id, RpcErrorCodes.INTERNAL_ERROR, message);
	}

	public JsonNode getId() {
		return id;
	}

	public boolean isError() {
		return result == null;
	}

	/**
	 * @return the result, {@code null} for an error response
	 */
	public JsonNode getResult() {
		return result;
	}

	public int getErrorCode() {
		return errorCode;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	/**
	 * @return <code>{"jsonrpc":"2.0","id":...,"result":...}</code> or
	 *         <code>{"jsonrpc":"2.0","id":...,"error":{"code":...,"message":...}}</code>
	 */
	public ObjectNode toJson() {
		ObjectNode node = Jsons.mapper().createObjectNode();
		node.put("jsonrpc", "2.0");
		node.set("id", id);
		if (isError()) {
			ObjectNode error = node.putObject("error");
			error.put("code", errorCode);
			error.put("message", errorMessage);
		} else {
			node.set("result", result);
		}
		return node;
	}

	@Override
	public String toString() {
		return Jsons.toJson(toJson());
	}
}
