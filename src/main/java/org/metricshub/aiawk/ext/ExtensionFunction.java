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

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Locale;
import java.util.Objects;
import org.metricshub.aiawk.jrt.AwkValue;
import org.metricshub.aiawk.jrt.IllegalAwkArgumentException;
import org.metricshub.aiawk.ext.annotations.AwkFunction;

/**
 * A single annotated extension method, bound to the extension instance that
 * declares it.
 * <p>
 * Arguments are converted from {@link AwkValue} to the declared parameter
 * types: {@link String}, <code>double</code>/{@link Double},
 * <code>int</code>/{@link Integer}, <code>long</code>/{@link Long},
 * {@link Number} and {@link AwkValue}, including a trailing varargs
 * parameter of one of these types. The result is converted to a string:
 * numbers the way AWK prints them, <code>null</code> as the empty string.
 */
public final class ExtensionFunction implements ForeignFunction {

	private final String keyword;
	private final Method method;
	private final AbstractExtension target;
	private final Class<?>[] parameterTypes;
	private final boolean varArgs;
	private final int mandatoryParameterCount;

	ExtensionFunction(String keywordParam, Method methodParam, AbstractExtension targetParam) {
		this.keyword = validateKeyword(keywordParam, methodParam);
		this.target = Objects.requireNonNull(targetParam, "target");
		this.method = prepareMethod(methodParam);
		this.parameterTypes = methodParam.getParameterTypes();
		this.varArgs = methodParam.isVarArgs();
		this.mandatoryParameterCount = varArgs ? parameterTypes.length - 1 : parameterTypes.length;
		for (int idx = 0; idx < parameterTypes.length; idx++) {
			Class<?> type = parameterTypes[idx];
			if (varArgs && idx == parameterTypes.length - 1) {
				type = type.getComponentType();
			}
			if (!isSupported(type)) {
				throw new IllegalStateException(
						"Parameter " + idx + " of " + methodParam + " has unsupported type " + type.getName());
			}
		}
	}

	private static String validateKeyword(String keyword, Method method) {
		Objects.requireNonNull(method, "method");
		if (keyword == null || keyword.trim().isEmpty()) {
			throw new IllegalStateException(
					"@" + AwkFunction.class.getSimpleName()
							+ " on " + method + " must declare a non-empty name");
		}
		return keyword;
	}

	private static Method prepareMethod(Method method) {
		if (Modifier.isStatic(method.getModifiers())) {
			throw new IllegalStateException(
					"@" + AwkFunction.class.getSimpleName()
							+ " does not support static methods: " + method.toGenericString());
		}
		method.setAccessible(true);
		return method;
	}

	private static boolean isSupported(Class<?> type) {
		return type == String.class
				|| type == double.class
				|| type == Double.class
				|| type == int.class
				|| type == Integer.class
				|| type == long.class
				|| type == Long.class
				|| type == Number.class
				|| type == AwkValue.class;
	}

	/**
	 * Returns the Awk keyword mapped to this extension function.
	 *
	 * @return the keyword exposed by the annotated method
	 */
	public String getKeyword() {
		return keyword;
	}

	/**
	 * Returns the minimum number of arguments required to invoke the function.
	 *
	 * @return required argument count before considering varargs
	 */
	public int getArity() {
		return mandatoryParameterCount;
	}

	/**
	 * @return true when the method accepts extra arguments
	 */
	public boolean isVarArgs() {
		return varArgs;
	}

	/**
	 * Verifies that the provided argument count satisfies the arity constraints
	 * encoded in the metadata.
	 *
	 * @param argCount number of arguments the caller supplied
	 * @throws IllegalAwkArgumentException when the count violates the signature
	 */
	@Override
	public void verifyArgCount(int argCount) {
		if (!varArgs) {
			if (argCount != mandatoryParameterCount) {
				throw new IllegalAwkArgumentException(
						"Extension function '" + keyword + "' expects " + mandatoryParameterCount
								+ " argument(s), not " + argCount);
			}
			return;
		}
		if (argCount < mandatoryParameterCount) {
			throw new IllegalAwkArgumentException(
					"Extension function '" + keyword + "' expects at least " + getArity()
							+ " argument(s), not " + argCount);
		}
	}

	/**
	 * Invokes the underlying Java method with the default number format.
	 *
	 * @param args arguments evaluated by the interpreter
	 * @return result of the Java invocation, as a string
	 * @throws IllegalAwkArgumentException when the arguments violate the metadata
	 * @throws Exception what the extension method throws
	 */
	@Override
	public String invoke(AwkValue... args) throws Exception {
		return invoke(AwkValue.DEFAULT_CONVFMT, Locale.US, args);
	}

	/**
	 * Invokes the underlying Java method. Numbers passed to
	 * {@link String} parameters, and numbers returned, are formatted with
	 * the specified CONVFMT.
	 *
	 * @param convfmt format used to turn numbers into strings
	 * @param locale locale for number formatting
	 * @param args arguments evaluated by the interpreter
	 * @return result of the Java invocation, as a string
	 * @throws IllegalAwkArgumentException when the arguments violate the metadata
	 * @throws Exception what the extension method throws
	 */
	@Override
	public String invoke(String convfmt, Locale locale, AwkValue... args) throws Exception {
		AwkValue[] actual = args == null ? new AwkValue[0] : args;
		verifyArgCount(actual.length);
		Object result;
		try {
			result = method.invoke(target, prepareArguments(actual, convfmt, locale));
		} catch (IllegalAccessException ex) {
			throw new IllegalStateException(
					"Unable to access extension function method for keyword '" + keyword + "'",
					ex);
		} catch (InvocationTargetException ex) {
			Throwable cause = ex.getCause();
			if (cause instanceof Exception) {
				throw (Exception) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException(
					"Invocation of extension function '" + keyword + "' failed",
					cause);
		}
		return toResult(result, convfmt, locale);
	}

	private Object[] prepareArguments(AwkValue[] args, String convfmt, Locale locale) {
		Object[] invocationArgs = new Object[parameterTypes.length];
		for (int idx = 0; idx < mandatoryParameterCount; idx++) {
			invocationArgs[idx] = convert(args[idx], parameterTypes[idx], convfmt, locale);
		}
		if (varArgs) {
			int varArgCount = args.length - mandatoryParameterCount;
			Class<?> componentType = parameterTypes[parameterTypes.length - 1].getComponentType();
			Object varArgArray = Array.newInstance(componentType, varArgCount);
			for (int idx = 0; idx < varArgCount; idx++) {
				Array.set(varArgArray, idx, convert(args[mandatoryParameterCount + idx], componentType, convfmt, locale));
			}
			invocationArgs[mandatoryParameterCount] = varArgArray;
		}
		return invocationArgs;
	}

	private static Object convert(AwkValue value, Class<?> type, String convfmt, Locale locale) {
		if (type == AwkValue.class) {
			return value;
		}
		if (type == String.class) {
			return value.toString(convfmt, locale);
		}
		double number = value.toNumber();
		if (type == int.class || type == Integer.class) {
			return Integer.valueOf((int) number);
		}
		if (type == long.class || type == Long.class) {
			return Long.valueOf((long) number);
		}
		// double, Double and Number
		return Double.valueOf(number);
	}

	private static String toResult(Object result, String convfmt, Locale locale) {
		if (result == null) {
			return "";
		}
		if (result instanceof Double || result instanceof Float) {
			return AwkValue.formatNumber(((Number) result).doubleValue(), convfmt, locale);
		}
		if (result instanceof AwkValue) {
			return ((AwkValue) result).toString(convfmt, locale);
		}
		return String.valueOf(result);
	}

	@Override
	public String toString() {
		return keyword + " -> " + method.toGenericString();
	}
}
