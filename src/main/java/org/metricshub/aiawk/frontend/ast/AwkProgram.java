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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A parsed program: the rules in source order and the user-defined
 * functions. A program is immutable and can be run any number of times.
 */
public final class AwkProgram {

	private final List<Rule> rules;
	private final Map<String, FunctionDefinition> functions;

	public AwkProgram(List<Rule> rules, Map<String, FunctionDefinition> functions) {
		this.rules = Collections.unmodifiableList(rules);
		this.functions = Collections.unmodifiableMap(functions);
	}

	public List<Rule> getRules() {
		return rules;
	}

	public Map<String, FunctionDefinition> getFunctions() {
		return functions;
	}

	public FunctionDefinition getFunction(String name) {
		return functions.get(name);
	}

	public List<Rule> getBeginRules() {
		return select(Pattern.Kind.BEGIN, true);
	}

	public List<Rule> getEndRules() {
		return select(Pattern.Kind.END, true);
	}

	/**
	 * @return the rules applied to each record, in source order
	 */
	public List<Rule> getMainRules() {
		List<Rule> main = new ArrayList<Rule>(select(Pattern.Kind.BEGIN, false));
		main.removeIf(Rule::isEnd);
		return main;
	}

	private List<Rule> select(Pattern.Kind kind, boolean equal) {
		List<Rule> selected = new ArrayList<Rule>();
		for (Rule rule : rules) {
			if ((rule.getPattern().getKind() == kind) == equal) {
				selected.add(rule);
			}
		}
		return selected;
	}
}
