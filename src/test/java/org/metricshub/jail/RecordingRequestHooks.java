package org.metricshub.jail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jail.node.RequestHooks;
import org.metricshub.jail.rpc.RpcCall;
import org.metricshub.jail.vm.ScriptVm;

/**
 * Hooks recording <code>pre:method</code> and <code>post:method</code> events,
 * optionally failing on each invocation.
 */
public class RecordingRequestHooks implements RequestHooks {

	private final List<String> events = Collections.synchronizedList(new ArrayList<String>());
	private volatile boolean failing;

	public RecordingRequestHooks failing() {
		failing = true;
		return this;
	}

	@Override
	public void preProcessRequest(ScriptVm vm, RpcCall call) {
		events.add("pre:" + call.getMethod());
		if (failing) {
			throw new IllegalStateException("pre hook failure");
		}
	}

	@Override
	public void postProcessRequest(ScriptVm vm, RpcCall call) {
		events.add("post:" + call.getMethod());
		if (failing) {
			throw new IllegalStateException("post hook failure");
		}
	}

	public List<String> getEvents() {
		synchronized (events) {
			return new ArrayList<String>(events);
		}
	}
}
