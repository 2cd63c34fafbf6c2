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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.metricshub.aiawk.jrt.AwkValue;
import org.metricshub.aiawk.jrt.ForeignCallException;
import org.metricshub.aiawk.util.AwkLogger;
import org.metricshub.aiawk.util.AwkSettings;
import org.slf4j.Logger;

/**
 * The foreign functions available to AWK programs, by name.
 * <p>
 * Functions returned by {@link #resolve(String)} are guarded: the argument
 * count is checked first (a mismatch is a fatal error of the program), then
 * the call runs on a daemon worker thread and is abandoned after the call
 * timeout. A call that fails or times out is logged and yields the empty
 * string, so that processing goes on with the next records.
 */
public final class ExtensionRegistry {

	private static final Logger LOG = AwkLogger.getLogger(ExtensionRegistry.class);

	/** Value of a failed foreign call */
	public static final String FAILED_CALL_RESULT = "";

	private final Map<String, ForeignFunction> functions = new LinkedHashMap<String, ForeignFunction>();
	private long callTimeout = AwkSettings.DEFAULT_FOREIGN_CALL_TIMEOUT;
	private ExecutorService executor;

	/**
	 * Registers all the functions of an extension.
	 *
	 * @param extension the extension
	 * @throws IllegalStateException when one of its functions is already
	 *         registered
	 */
	public void register(AwkExtension extension) {
		Objects.requireNonNull(extension, "Extension instance must not be null");
		for (Map.Entry<String, ? extends ForeignFunction> entry : extension.getFunctions().entrySet()) {
			register(entry.getKey(), entry.getValue());
		}
		LOG.debug("Registered extension {}", extension.getExtensionName());
	}

	/**
	 * Registers one function.
	 *
	 * @param name AWK name of the function
	 * @param function the implementation
	 * @throws IllegalStateException when the name is already registered
	 */
	public void register(String name, ForeignFunction function) {
		Objects.requireNonNull(name, "Function name must not be null");
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Function name must not be empty");
		}
		Objects.requireNonNull(function, "Function must not be null");
		ForeignFunction existing = functions.putIfAbsent(name, function);
		if (existing != null && existing != function) {
			throw new IllegalStateException("Foreign function '" + name + "' is already registered");
		}
	}

	/**
	 * @return the registered functions, by name
	 */
	public Map<String, ForeignFunction> getFunctions() {
		return Collections.unmodifiableMap(functions);
	}

	/**
	 * @param timeout maximum duration of a foreign call, in milliseconds
	 */
	public void setCallTimeout(long timeout) {
		if (timeout <= 0) {
			throw new IllegalArgumentException("Foreign call timeout must be positive: " + timeout);
		}
		this.callTimeout = timeout;
	}

	public long getCallTimeout() {
		return callTimeout;
	}

	/**
	 * Looks up a function.
	 *
	 * @param name AWK name of the function
	 * @return the guarded function, or empty when no function has that name
	 */
	public Optional<ForeignFunction> resolve(String name) {
		ForeignFunction function = functions.get(name);
		if (function == null) {
			return Optional.empty();
		}
		return Optional.of(new GuardedFunction(name, function));
	}

	private synchronized ExecutorService executor() {
		if (executor == null) {
			executor = Executors.newSingleThreadExecutor(new ThreadFactory() {
				@Override
				public Thread newThread(Runnable r) {
					Thread thread = new Thread(r, "aiawk-foreign-call");
					thread.setDaemon(true);
					return thread;
				}
			});
		}
		return executor;
	}

	private synchronized void abandonExecutor() {
		if (executor != null) {
			executor.shutdownNow();
			executor = null;
		}
	}

	/**
	 * Stops the worker thread, if any.
	 */
	public synchronized void shutdown() {
		abandonExecutor();
	}

	/**
	 * Applies the failure policy around a foreign function.
	 */
	private final class GuardedFunction implements ForeignFunction {

		private final String name;
		private final ForeignFunction delegate;

		private GuardedFunction(String name, ForeignFunction delegate) {
			this.name = name;
			this.delegate = delegate;
		}

		@Override
		public void verifyArgCount(int argCount) {
			delegate.verifyArgCount(argCount);
		}

		@Override
		public String invoke(AwkValue... args) {
			return invoke(AwkValue.DEFAULT_CONVFMT, Locale.US, args);
		}

		@Override
		public String invoke(String convfmt, Locale locale, AwkValue... args) {
			verifyArgCount(args.length);
			Future<String> future = executor().submit(() -> delegate.invoke(convfmt, locale, args));
			try {
				String result = future.get(callTimeout, TimeUnit.MILLISECONDS);
				return result == null ? FAILED_CALL_RESULT : result;
			} catch (TimeoutException e) {
				future.cancel(true);
				// the worker may be stuck, later calls get a fresh one
				abandonExecutor();
				return failed(new ForeignCallException(name, "timed out after " + callTimeout + " ms", e));
			} catch (ExecutionException e) {
				Throwable cause = e.getCause() == null ? e : e.getCause();
				return failed(new ForeignCallException(name, String.valueOf(cause.getMessage()), cause));
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				future.cancel(true);
				return failed(new ForeignCallException(name, "interrupted", e));
			}
		}

		private String failed(ForeignCallException e) {
			LOG.warn("Foreign function {} failed ({}), using an empty result", e.getFunctionName(), e.getMessage(), e);
			return FAILED_CALL_RESULT;
		}
	}
}
