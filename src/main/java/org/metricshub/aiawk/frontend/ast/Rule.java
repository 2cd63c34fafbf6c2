package org.metricshub.aiawk.frontend.ast;

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

/**
 * A pattern and its action. The action is null when the source only gave a
 * pattern, which means <code>{ print }</code>.
 */
public final class Rule extends AstNode {

	private final Pattern pattern;
	private final Block action;
	private final int index;

	/**
	 * @param lineNumber source line of the rule
	 * @param index position of the rule in the program, starting at 0
	 * @param pattern the pattern
	 * @param action the action, may be null
	 */
	public Rule(int lineNumber, int index, Pattern pattern, Block action) {
		super(lineNumber);
		this.index = index;
		this.pattern = pattern;
		this.action = action;
	}

	public Pattern getPattern() {
		return pattern;
	}

	public Block getAction() {
		return action;
	}

	public int getIndex() {
		return index;
	}

	public boolean isBegin() {
		return pattern.getKind() == Pattern.Kind.BEGIN;
	}

	public boolean isEnd() {
		return pattern.getKind() == Pattern.Kind.END;
	}
}
