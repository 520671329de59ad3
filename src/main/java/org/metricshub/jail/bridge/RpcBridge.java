package org.metricshub.jail.bridge;

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
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jail.CellBusyException;
import org.metricshub.jail.CellGate;
import org.metricshub.jail.MalformedRequestException;
import org.metricshub.jail.NodeUnavailableException;
import org.metricshub.jail.node.ClientHandle;
import org.metricshub.jail.node.RequestHooks;
import org.metricshub.jail.rpc.RpcCall;
import org.metricshub.jail.rpc.RpcClient;
import org.metricshub.jail.rpc.RpcErrorException;
import org.metricshub.jail.rpc.RpcException;
import org.metricshub.jail.rpc.RpcResponse;
import org.metricshub.jail.util.JailLogger;
import org.metricshub.jail.util.Jsons;
import org.metricshub.jail.vm.ScriptVm;
import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.slf4j.Logger;

/**
 * Host side of the bridge object scripts use to reach the node.
 * <p>
 * The bridge object exposes <code>send(request[, callback])</code> and
 * <code>sendAsync(request[, callback])</code>, both backed by the same
 * function. The request is either one <code>{id, method, params}</code> call
 * or an array of them. Each call is dispatched to the node in order,
 * between the pre- and post-processing {@link RequestHooks}, and answered
 * with a JSON-RPC 2.0 response in the script's own value space. When a
 * callback is supplied, it receives <code>(null, response)</code> and the
 * function returns <code>undefined</code>.
 */
public class RpcBridge {

	private static final Logger LOG = JailLogger.getLogger(RpcBridge.class);

	private final ScriptVm vm;
	private final CellGate gate;
	private final RpcBackend backend;

	/**
	 * @param vm VM the bridge object lives in
	 * @param gate gate of the cell owning <code>vm</code>
	 * @param backend source of the node client and request hooks
	 */
	public RpcBridge(ScriptVm vm, CellGate gate, RpcBackend backend) {
		this.vm = vm;
		this.gate = gate;
		this.backend = backend;
	}

	/**
	 * Defines the bridge object as a global variable of the VM.
	 *
	 * @param name global name of the bridge object, e.g. <code>jeth</code>
	 * @return the bridge object
	 */
	public Scriptable install(String name) {
		Context cx = vm.enter();
		try {
			ScriptableObject scope = vm.getScope();
			Scriptable bridge = cx.newObject(scope);
			SendFunction send = new SendFunction();
			send.setParentScope(scope);
			send.setPrototype(ScriptableObject.getFunctionPrototype(scope));
			ScriptableObject.putProperty(bridge, "send", send);
			ScriptableObject.putProperty(bridge, "sendAsync", send);
			ScriptableObject.putProperty(scope, name, bridge);
			return bridge;
		} finally {
			Context.exit();
		}
	}

	/**
	 * Parsed request: the calls, and whether they came as a batch.
	 */
	static final class Request {
		private final List<RpcCall> calls;
		private final boolean batch;

		Request(List<RpcCall> calls, boolean batch) {
			this.calls = calls;
			this.batch = batch;
		}

		List<RpcCall> getCalls() {
			return calls;
		}

		boolean isBatch() {
			return batch;
		}
	}

	/**
	 * Decodes the JSON text of a request. A text starting with <code>[</code>
	 * is a batch, anything else a single call.
	 *
	 * @param json request as serialized by the VM
	 * @return the decoded request
	 * @throws MalformedRequestException when the text is not a call or a batch of calls
	 */
	static Request decode(String json) {
		if (json == null) {
			throw new MalformedRequestException("request has no JSON representation");
		}
		JsonNode tree;
		try {
			tree = Jsons.mapper().readTree(json);
		} catch (JsonProcessingException e) {
			throw new MalformedRequestException("invalid request JSON: " + e.getOriginalMessage(), e);
		}
		if (firstNonWhitespace(json) == '[') {
			List<RpcCall> calls = new ArrayList<RpcCall>(tree.size());
			for (JsonNode element : tree) {
				calls.add(RpcCall.fromJson(element));
			}
			return new Request(calls, true);
		}
		return new Request(Collections.singletonList(RpcCall.fromJson(tree)), false);
	}

	private static char firstNonWhitespace(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (!Character.isWhitespace(c)) {
				return c;
			}
		}
		return 0;
	}

	/**
	 * Dispatches every call of <code>request</code>, in order.
	 * <p>
	 * Post-processing hooks are deferred to the end of the whole batch.
	 *
	 * @param request decoded request
	 * @return one response per call, in request order
	 * @throws NodeUnavailableException when the node is gone, before or in the
	 *         middle of the batch; no further call is dispatched
	 */
	List<RpcResponse> execute(Request request) {
		final ClientHandle handle = backend.clientHandle();
		final RequestHooks hooks = backend.requestHooks();

		List<RpcResponse> responses = new ArrayList<RpcResponse>(request.getCalls().size());
		try (BatchScope scope = new BatchScope()) {
			for (final RpcCall call : request.getCalls()) {
				try {
					hooks.preProcessRequest(vm, call);
				} catch (RuntimeException e) {
					LOG.warn("Request pre-processing failed for {}: {}", call, e.getMessage(), e);
				}
				scope.defer(new Runnable() {
					@Override
					public void run() {
						hooks.postProcessRequest(vm, call);
					}
				});

				RpcClient client = handle.client();
				responses.add(dispatch(client, call));
			}
		}
		return responses;
	}

	/**
	 * Serves a decoded request.
	 *
	 * @param request decoded request
	 * @return JSON text of the value handed back to the script: the response
	 *         array for a batch, the only response otherwise, or a single
	 *         internal error response when the node is not available
	 */
	String respond(Request request) {
		try {
			return encode(request, execute(request));
		} catch (NodeUnavailableException e) {
			LOG.debug("Node unavailable, failing request: {}", e.getMessage());
			return Jsons.toJson(RpcResponse.internalError(null, e.getMessage()).toJson());
		}
	}

	/**
	 * Sends one call to the node and classifies the outcome.
	 *
	 * @param client node client
	 * @param call call to send
	 * @return the response for <code>call</code>
	 */
	static RpcResponse dispatch(RpcClient client, RpcCall call) {
		LOG.debug("Dispatching {}", call);
		String raw;
		try {
			raw = client.call(call.getMethod(), call.getParams());
		} catch (RpcErrorException e) {
			return RpcResponse.error(call.getId(), e.getCode(), e.getMessage());
		} catch (RpcException e) {
			return RpcResponse.internalError(call.getId(), e.getMessage());
		} catch (RuntimeException e) {
			LOG.debug("Unexpected failure dispatching {}", call, e);
			return RpcResponse.internalError(call.getId(), String.valueOf(e.getMessage()));
		}

		if (raw == null || raw.trim().isEmpty()) {
			return RpcResponse.success(call.getId(), NullNode.getInstance());
		}
		try {
			return RpcResponse.success(call.getId(), Jsons.mapper().readTree(raw));
		} catch (JsonProcessingException e) {
			return RpcResponse.internalError(call.getId(), e.getOriginalMessage());
		}
	}

	/**
	 * Converts the responses into the script value handed back: the array for
	 * a batch, the only response otherwise.
	 *
	 * @param request decoded request
	 * @param responses responses of {@link #execute(Request)}
	 * @return JSON text of the value to hand back to the script
	 */
	static String encode(Request request, List<RpcResponse> responses) {
		if (request.isBatch()) {
			ArrayNode array = Jsons.mapper().createArrayNode();
			for (RpcResponse response : responses) {
				array.add(response.toJson());
			}
			return Jsons.toJson(array);
		}
		return Jsons.toJson(responses.get(0).toJson());
	}

	/**
	 * The <code>send</code>/<code>sendAsync</code> function bound into the VM.
	 */
	private final class SendFunction extends BaseFunction {

		private static final long serialVersionUID = 1L;

		@Override
		public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
			try {
				gate.acquire();
			} catch (CellBusyException e) {
				throw Context.reportRuntimeError(e.getMessage());
			}
			try {
				Object response = send(args.length > 0 ? args[0] : Undefined.instance);
				Object callback = args.length > 1 ? args[1] : Undefined.instance;
				if (callback instanceof Function) {
					((Function) callback).call(cx, scope, vm.getScope(), new Object[] { null, response });
					return Undefined.instance;
				}
				return response;
			} finally {
				gate.release();
			}
		}

		private Object send(Object argument) {
			Request request;
			try {
				request = decode(vm.stringify(argument));
			} catch (MalformedRequestException e) {
				throw Context.reportRuntimeError(e.getMessage());
			}
			return vm.parseJson(respond(request));
		}

		@Override
		public String getFunctionName() {
			return "send";
		}

		@Override
		public int getArity() {
			return 2;
		}
	}
}
