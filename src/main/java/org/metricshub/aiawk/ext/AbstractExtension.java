package org.metricshub.aiawk.ext;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * AiAwk
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.aiawk.ext.annotations.AwkFunction;

/**
 * Base class of extensions whose functions are the methods annotated with
 * {@link AwkFunction}.
 * <p>
 * Example:
 *
 * <pre>
 * public class MyExtension extends AbstractExtension {
 * 	&#64;AwkFunction("shout")
 * 	public String shout(String text) {
 * 		return text.toUpperCase() + "!";
 * 	}
 * }
 * </pre>
 */
public abstract class AbstractExtension implements AwkExtension {

	private Map<String, ExtensionFunction> functions;

	/**
	 * The simple class name by default.
	 */
	@Override
	public String getExtensionName() {
		return getClass().getSimpleName();
	}

	/**
	 * Scans the public methods of the extension for {@link AwkFunction}
	 * annotations, the first time it is called.
	 *
	 * @throws IllegalStateException when two methods declare the same name
	 *         or an annotated method cannot be exposed
	 */
	@Override
	public final synchronized Map<String, ExtensionFunction> getFunctions() {
		if (functions == null) {
			Map<String, ExtensionFunction> found = new LinkedHashMap<String, ExtensionFunction>();
			for (Method method : getClass().getMethods()) {
				AwkFunction annotation = method.getAnnotation(AwkFunction.class);
				if (annotation == null) {
					continue;
				}
				ExtensionFunction function = new ExtensionFunction(annotation.value(), method, this);
				if (found.put(function.getKeyword(), function) != null) {
					throw new IllegalStateException(
							"Function '" + function.getKeyword() + "' is declared twice in " + getClass().getName());
				}
			}
			functions = Collections.unmodifiableMap(found);
		}
		return functions;
	}
}
