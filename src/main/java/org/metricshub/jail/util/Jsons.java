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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson mapper and the envelope helpers used at every public
 * boundary of the jail.
 */
public final class Jsons {
	// a text holds one JSON value or is not JSON at all
	private static final ObjectMapper MAPPER = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

	private Jsons() {}

	public static ObjectMapper mapper() {
		return MAPPER;
	}

	/**
	 * Serializes the supplied value as compact JSON.
	 *
	 * @param value value to serialize
	 * @return JSON text
	 */
	public static String toJson(Object value) {
		try {
			return MAPPER.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize JSON", e);
		}
	}

	/**
	 * Builds <code>{"result": ...}</code> around JSON text.
	 * The literal <code>undefined</code> and {@code null} become JSON null.
	 *
	 * @param json JSON text of the result
	 * @return the envelope, or an error envelope when <code>json</code> is not valid JSON
	 */
	public static String resultEnvelope(String json) {
		if (json == null || "undefined".equals(json)) {
			json = "null";
		}
		JsonNode result;
		try {
			result = MAPPER.readTree(json);
		} catch (JsonProcessingException e) {
			return errorEnvelope("Invalid JSON result: " + e.getOriginalMessage());
		}
		ObjectNode envelope = MAPPER.createObjectNode();
		envelope.set("result", result.isMissingNode() ? NullNode.getInstance() : result);
		return toJson(envelope);
	}

	/**
	 * Builds <code>{"error": "message"}</code>.
	 *
	 * @param message error description
	 * @return the envelope
	 */
	public static String errorEnvelope(String message) {
		ObjectNode envelope = MAPPER.createObjectNode();
		envelope.put("error", message == null ? "unknown error" : message);
		return toJson(envelope);
	}
}
