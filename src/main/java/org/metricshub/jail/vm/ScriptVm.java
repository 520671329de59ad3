package org.metricshub.jail.vm;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import javax.script.ScriptException;
import org.metricshub.jail.util.ScriptSource;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.NativeJSON;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.json.JsonParser;

/**
 * One isolated JavaScript execution environment: a Rhino top-level scope
 * holding the safe standard objects only.
 * <p>
 * Rhino scopes are not thread-safe. A {@code ScriptVm} must only be used by
 * one thread at a time, which the owning cell guarantees through its gate.
 * Every method enters a {@link Context} on the calling thread and leaves it
 * before returning; nested entries from code already running in the VM are
 * allowed.
 */
public class ScriptVm {

	private final ContextFactory contextFactory;
	private final ScriptableObject scope;

	/**
	 * Creates a fresh VM with its own global scope.
	 *
	 * @param contextFactory factory configuring every context used on this VM
	 */
	public ScriptVm(ContextFactory contextFactory) {
		this.contextFactory = contextFactory;
		Context cx = contextFactory.enterContext();
		try {
			this.scope = cx.initSafeStandardObjects();
		} finally {
			Context.exit();
		}
	}

	/**
	 * Returns the global scope, for host objects that must be bound into it.
	 *
	 * @return the top-level scope of this VM
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ScriptableObject getScope() {
		return scope;
	}

	/**
	 * Enters a context for this VM on the calling thread. Callers must
	 * invoke {@link Context#exit()} in a <code>finally</code> block.
	 *
	 * @return the entered context
	 */
	public Context enter() {
		return contextFactory.enterContext();
	}

	/**
	 * Evaluates a script in the global scope.
	 *
	 * @param source script to evaluate
	 * @return the completion value of the script
	 * @throws ScriptException when the script fails to compile or throws
	 */
	public Object run(ScriptSource source) throws ScriptException {
		String text;
		try {
			text = source.getText();
		} catch (IOException e) {
			ScriptException se = new ScriptException("Cannot read " + source.getDescription() + ": " + e.getMessage());
			se.initCause(e);
			throw se;
		}
		Context cx = enter();
		try {
			return cx.evaluateString(scope, text, source.getDescription(), 1, null);
		} catch (RhinoException e) {
			throw toScriptException(e);
		} finally {
			Context.exit();
		}
	}

	/**
	 * Evaluates inline script text in the global scope.
	 *
	 * @param script script text
	 * @return the completion value of the script
	 * @throws ScriptException when the script fails to compile or throws
	 */
	public Object run(String script) throws ScriptException {
		return run(ScriptSource.inline(script));
	}

	/**
	 * @param name global variable name
	 * @return {@code true} when the global scope (or its prototype chain) defines <code>name</code>
	 */
	public boolean has(String name) {
		return ScriptableObject.hasProperty(scope, name);
	}

	/**
	 * Reads a global variable.
	 *
	 * @param name global variable name
	 * @return the raw script value, {@link Undefined#instance} when not defined
	 */
	public Object get(String name) {
		enter();
		try {
			Object value = ScriptableObject.getProperty(scope, name);
			return value == Scriptable.NOT_FOUND ? Undefined.instance : value;
		} finally {
			Context.exit();
		}
	}

	/**
	 * Defines or replaces a global variable. Strings, numbers, booleans and
	 * script values are stored as-is.
	 *
	 * @param name global variable name
	 * @param value value to store
	 */
	public void set(String name, Object value) {
		enter();
		try {
			ScriptableObject.putProperty(scope, name, Context.javaToJS(value, scope));
		} finally {
			Context.exit();
		}
	}

	/**
	 * Calls a global function with <code>this</code> bound to the global scope.
	 *
	 * @param functionName name of the global function
	 * @param args arguments, converted with {@link Context#javaToJS(Object, Scriptable)}
	 * @return the raw script value returned by the function
	 * @throws ScriptException when the function is not defined or throws
	 */
	public Object call(String functionName, Object... args) throws ScriptException {
		Object fn = get(functionName);
		if (!(fn instanceof Function)) {
			throw new ScriptException("TypeError: " + functionName + " is not a function");
		}
		Context cx = enter();
		try {
			Object[] jsArgs = new Object[args.length];
			for (int i = 0; i < args.length; i++) {
				jsArgs[i] = Context.javaToJS(args[i], scope);
			}
			return ((Function) fn).call(cx, scope, scope, jsArgs);
		} catch (RhinoException e) {
			throw toScriptException(e);
		} finally {
			Context.exit();
		}
	}

	/**
	 * Serializes a script value with the VM's own <code>JSON.stringify</code>.
	 *
	 * @param value script value
	 * @return JSON text, or {@code null} when the value has no JSON form (undefined, functions)
	 */
	public String stringify(Object value) {
		Context cx = enter();
		try {
			Object json = NativeJSON.stringify(cx, scope, value, null, null);
			return json instanceof CharSequence ? json.toString() : null;
		} finally {
			Context.exit();
		}
	}

	/**
	 * Parses JSON text into a script value with the VM's own <code>JSON.parse</code>.
	 *
	 * @param json JSON text
	 * @return the script value
	 * @throws org.mozilla.javascript.EvaluatorException (a script-visible <code>SyntaxError</code>) when the text is not valid JSON
	 */
	public Object parseJson(String json) {
		Context cx = enter();
		try {
			return new JsonParser(cx, scope).parseValue(json);
		} catch (JsonParser.ParseException e) {
			throw Context.reportRuntimeError("SyntaxError: " + e.getMessage());
		} finally {
			Context.exit();
		}
	}

	/**
	 * Converts a Rhino failure into the {@link ScriptException} the host sees.
	 *
	 * @param e Rhino failure
	 * @return exception carrying the script message and position
	 */
	public static ScriptException toScriptException(RhinoException e) {
		ScriptException se = new ScriptException(e.details(), e.sourceName(), e.lineNumber(), e.columnNumber());
		se.initCause(e);
		return se;
	}
}
