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

import org.mozilla.javascript.ClassShutter;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ContextFactory;

/**
 * {@link ContextFactory} producing the restricted Rhino contexts cells run
 * in: interpreted mode, ES6 language level, and no access to any Java class.
 */
public class SandboxContextFactory extends ContextFactory {

	private static final ClassShutter DENY_ALL = new ClassShutter() {
		@Override
		public boolean visibleToScripts(String fullClassName) {
			return false;
		}
	};

	@Override
	protected Context makeContext() {
		Context cx = super.makeContext();
		cx.setLanguageVersion(Context.VERSION_ES6);
		// interpreted mode: no bytecode generation for untrusted scripts
		cx.setOptimizationLevel(-1);
		cx.setClassShutter(DENY_ALL);
		return cx;
	}
}
