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

import java.io.IOException;

/**
 * Represents one JavaScript content source loaded into a cell.
 * This is usually either a string handed over by the host,
 * or a "*.js" file given as a path on the command line.
 */
public class ScriptSource {

	/** Constant <code>DESCRIPTION_INLINE_SCRIPT="&lt;inline-script&gt;"</code> */
	public static final String DESCRIPTION_INLINE_SCRIPT = "<inline-script>";

	private final String description;
	private final String text;

	/**
	 * Creates a source backed by the supplied text.
	 *
	 * @param description name reported in script error messages
	 * @param text script contents, {@code null} being treated as empty
	 */
	public ScriptSource(String description, String text) {
		this.description = description;
		this.text = text == null ? "" : text;
	}

	/**
	 * Creates a source for text handed over without any file name.
	 *
	 * @param text script contents
	 * @return a new source described as {@link #DESCRIPTION_INLINE_SCRIPT}
	 */
	public static ScriptSource inline(String text) {
		return new ScriptSource(DESCRIPTION_INLINE_SCRIPT, text);
	}

	/**
	 * Getter for the field <code>description</code>.
	 *
	 * @return the name reported in script error messages
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the script contents.
	 *
	 * @return the full text of the script
	 * @throws java.io.IOException if the contents cannot be read
	 */
	public String getText() throws IOException {
		return text;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
