package org.metricshub.jail.node;

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

import org.metricshub.jail.rpc.RpcCall;
import org.metricshub.jail.vm.ScriptVm;

/**
 * Notifications sent around every call a script dispatches to the node,
 * letting the node side keep request context (e.g. which session a pending
 * transaction belongs to) across the script/network boundary.
 * <p>
 * Exceptions thrown by hooks are logged and otherwise ignored: they never
 * change the outcome of the call.
 */
public interface RequestHooks {

	/** Hooks doing nothing. */
	RequestHooks NOOP = new RequestHooks() {
		@Override
		public void preProcessRequest(ScriptVm vm, RpcCall call) {
			// nothing to track
		}

		@Override
		public void postProcessRequest(ScriptVm vm, RpcCall call) {
			// nothing to track
		}
	};

	/**
	 * Invoked right before <code>call</code> is dispatched.
	 *
	 * @param vm VM of the cell issuing the call
	 * @param call the call about to be dispatched
	 */
	void preProcessRequest(ScriptVm vm, RpcCall call);

	/**
	 * Invoked once the batch containing <code>call</code> has been processed,
	 * whether the call succeeded or not.
	 *
	 * @param vm VM of the cell issuing the call
	 * @param call the dispatched call
	 */
	void postProcessRequest(ScriptVm vm, RpcCall call);
}
