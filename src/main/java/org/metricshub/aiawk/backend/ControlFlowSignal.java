package org.metricshub.aiawk.backend;

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

import org.metricshub.aiawk.jrt.AwkValue;

/**
 * Unwinds the evaluation for <code>break</code>, <code>continue</code>,
 * <code>next</code>, <code>return</code> and <code>exit</code>. Caught by the
 * loop, the record loop, the function call or the run that handles it.
 */
final class ControlFlowSignal extends RuntimeException {

	private static final long serialVersionUID = 1L;

	enum Kind {
		BREAK,
		CONTINUE,
		NEXT,
		RETURN,
		EXIT
	}

	static final ControlFlowSignal BREAK = new ControlFlowSignal(Kind.BREAK, null);
	static final ControlFlowSignal CONTINUE = new ControlFlowSignal(Kind.CONTINUE, null);
	static final ControlFlowSignal NEXT = new ControlFlowSignal(Kind.NEXT, null);
	static final ControlFlowSignal EXIT = new ControlFlowSignal(Kind.EXIT, null);

	private final Kind kind;
	private final transient AwkValue value;

	private ControlFlowSignal(Kind kind, AwkValue value) {
		super(kind.name(), null, false, false);
		this.kind = kind;
		this.value = value;
	}

	static ControlFlowSignal returning(AwkValue value) {
		return new ControlFlowSignal(Kind.RETURN, value);
	}

	Kind getKind() {
		return kind;
	}

	/**
	 * @return the returned value of a RETURN signal
	 */
	AwkValue getValue() {
		return value;
	}
}
