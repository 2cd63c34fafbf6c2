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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.aiawk.ext.ExtensionRegistry;
import org.metricshub.aiawk.frontend.ast.ArrayElement;
import org.metricshub.aiawk.frontend.ast.Assignment;
import org.metricshub.aiawk.frontend.ast.AssignmentOperator;
import org.metricshub.aiawk.frontend.ast.AwkProgram;
import org.metricshub.aiawk.frontend.ast.BinaryExpression;
import org.metricshub.aiawk.frontend.ast.BinaryOperator;
import org.metricshub.aiawk.frontend.ast.Block;
import org.metricshub.aiawk.frontend.ast.BreakStatement;
import org.metricshub.aiawk.frontend.ast.ContinueStatement;
import org.metricshub.aiawk.frontend.ast.DeleteStatement;
import org.metricshub.aiawk.frontend.ast.DoWhileStatement;
import org.metricshub.aiawk.frontend.ast.ExitStatement;
import org.metricshub.aiawk.frontend.ast.Expression;
import org.metricshub.aiawk.frontend.ast.ExpressionStatement;
import org.metricshub.aiawk.frontend.ast.ExpressionVisitor;
import org.metricshub.aiawk.frontend.ast.FieldReference;
import org.metricshub.aiawk.frontend.ast.ForInStatement;
import org.metricshub.aiawk.frontend.ast.ForStatement;
import org.metricshub.aiawk.frontend.ast.FunctionCall;
import org.metricshub.aiawk.frontend.ast.FunctionDefinition;
import org.metricshub.aiawk.frontend.ast.GetlineExpression;
import org.metricshub.aiawk.frontend.ast.GroupingExpression;
import org.metricshub.aiawk.frontend.ast.IfStatement;
import org.metricshub.aiawk.frontend.ast.InExpression;
import org.metricshub.aiawk.frontend.ast.IncrementDecrement;
import org.metricshub.aiawk.frontend.ast.NextStatement;
import org.metricshub.aiawk.frontend.ast.NumberLiteral;
import org.metricshub.aiawk.frontend.ast.OutputRedirection;
import org.metricshub.aiawk.frontend.ast.PrintStatement;
import org.metricshub.aiawk.frontend.ast.RegexLiteral;
import org.metricshub.aiawk.frontend.ast.ReturnStatement;
import org.metricshub.aiawk.frontend.ast.Rule;
import org.metricshub.aiawk.frontend.ast.Statement;
import org.metricshub.aiawk.frontend.ast.StatementVisitor;
import org.metricshub.aiawk.frontend.ast.StringLiteral;
import org.metricshub.aiawk.frontend.ast.TernaryExpression;
import org.metricshub.aiawk.frontend.ast.UnaryExpression;
import org.metricshub.aiawk.frontend.ast.VariableReference;
import org.metricshub.aiawk.frontend.ast.WhileStatement;
import org.metricshub.aiawk.jrt.AssocArray;
import org.metricshub.aiawk.jrt.AwkNameException;
import org.metricshub.aiawk.jrt.AwkRuntimeException;
import org.metricshub.aiawk.jrt.AwkSession;
import org.metricshub.aiawk.jrt.AwkTypeException;
import org.metricshub.aiawk.jrt.AwkValue;
import org.metricshub.aiawk.jrt.FieldSplitter;
import org.metricshub.aiawk.jrt.SprintfFormatter;
import org.metricshub.aiawk.util.AwkLogger;
import org.slf4j.Logger;

/**
 * Walks the syntax tree of a program and executes it against an
 * {@link AwkSession}.
 * <p>
 * Expressions evaluate to {@link AwkValue}s. Statements are executed for
 * their effects; <code>break</code>, <code>continue</code>,
 * <code>next</code>, <code>return</code> and <code>exit</code> unwind the
 * Java stack with a {@link ControlFlowSignal}.
 * <p>
 * Function calls are resolved the first time each call site runs, and the
 * result is kept for the following executions of that call site.
 * <p>
 * Variables of a function call live in a frame that only holds the
 * function parameters. Scalars are passed by value and arrays by reference.
 * When a parameter is used as an array in the function body and the caller
 * passes a variable that is not set yet, that variable becomes a new array
 * shared with the function.
 */
public class Evaluator implements AwkInterpreter, ExpressionVisitor<AwkValue>, StatementVisitor {

	private static final Logger LOG = AwkLogger.getLogger(Evaluator.class);

	private final AwkSession session;
	private final ExtensionRegistry registry;
	private final Map<FunctionCall, CallTarget> callSites = new IdentityHashMap<FunctionCall, CallTarget>();

	private FunctionResolver resolver;
	private Map<String, Object> frame;
	private boolean[] activeRanges;
	private int exitCode;

	/**
	 * @param session state of the run
	 * @param registry foreign functions available to the program
	 */
	public Evaluator(AwkSession session, ExtensionRegistry registry) {
		this.session = session;
		this.registry = registry;
	}

	// RUN

	/** {@inheritDoc} */
	@Override
	public int interpret(AwkProgram program) {
		resolver = new FunctionResolver(program, registry);
		activeRanges = new boolean[program.getRules().size()];
		exitCode = 0;
		List<Rule> mainRules = program.getMainRules();
		List<Rule> endRules = program.getEndRules();
		try {
			boolean exiting = false;
			try {
				LOG.debug("Running BEGIN rules");
				runRules(program.getBeginRules(), "BEGIN");
			} catch (ControlFlowSignal signal) {
				checkExit(signal);
				exiting = true;
			}
			if (!exiting && (!mainRules.isEmpty() || !endRules.isEmpty())) {
				try {
					LOG.debug("Processing input records");
					processRecords(mainRules);
				} catch (ControlFlowSignal signal) {
					checkExit(signal);
				}
			}
			try {
				LOG.debug("Running END rules");
				runRules(endRules, "END");
			} catch (ControlFlowSignal signal) {
				checkExit(signal);
			}
			return exitCode;
		} finally {
			session.finish();
		}
	}

	private static void checkExit(ControlFlowSignal signal) {
		if (signal.getKind() != ControlFlowSignal.Kind.EXIT) {
			throw signal;
		}
	}

	private void runRules(List<Rule> rules, String phase) {
		for (Rule rule : rules) {
			try {
				execute(rule.getAction());
			} catch (ControlFlowSignal signal) {
				if (signal.getKind() == ControlFlowSignal.Kind.NEXT) {
					throw new AwkRuntimeException(rule.getLineNumber(), "next cannot be used from a " + phase + " action");
				}
				throw signal;
			}
		}
	}

	private void processRecords(List<Rule> mainRules) {
		String text;
		while ((text = session.nextMainRecord()) != null) {
			session.getRecord().setRecord(text);
			try {
				for (Rule rule : mainRules) {
					if (matches(rule)) {
						runAction(rule);
					}
				}
			} catch (ControlFlowSignal signal) {
				if (signal.getKind() != ControlFlowSignal.Kind.NEXT) {
					throw signal;
				}
			}
		}
	}

	private boolean matches(Rule rule) {
		try {
			switch (rule.getPattern().getKind()) {
			case ALWAYS:
				return true;
			case REGEX:
			case EXPRESSION:
				return condition(rule.getPattern().getFirst());
			case RANGE:
				return matchesRange(rule);
			default:
				return false;
			}
		} catch (AwkRuntimeException e) {
			e.attachLineNumber(rule.getLineNumber());
			throw e;
		}
	}

	private boolean matchesRange(Rule rule) {
		int index = rule.getIndex();
		if (!activeRanges[index]) {
			if (!condition(rule.getPattern().getFirst())) {
				return false;
			}
			activeRanges[index] = true;
		}
		if (condition(rule.getPattern().getSecond())) {
			activeRanges[index] = false;
		}
		return true;
	}

	private void runAction(Rule rule) {
		if (rule.getAction() == null) {
			session.write(session.getRecord().getText() + session.getOrs(), null, false);
		} else {
			execute(rule.getAction());
		}
	}

	// STATEMENTS

	private void execute(Statement statement) {
		try {
			statement.accept(this);
		} catch (AwkRuntimeException e) {
			e.attachLineNumber(statement.getLineNumber());
			throw e;
		}
	}

	@Override
	public void visit(Block node) {
		for (Statement statement : node.getStatements()) {
			execute(statement);
		}
	}

	@Override
	public void visit(ExpressionStatement node) {
		evaluate(node.getExpression());
	}

	@Override
	public void visit(PrintStatement node) {
		String text;
		List<Expression> arguments = node.getArguments();
		if (node.isFormatted()) {
			String format = session.toStr(evaluate(arguments.get(0)));
			text = SprintfFormatter.format(session.getLocale(), format, evaluateAll(arguments.subList(1, arguments.size())), session.getConvfmt());
		} else if (arguments.isEmpty()) {
			text = session.getRecord().getText() + session.getOrs();
		} else {
			StringBuilder sb = new StringBuilder();
			String ofs = session.getOfs();
			for (int i = 0; i < arguments.size(); i++) {
				if (i > 0) {
					sb.append(ofs);
				}
				sb.append(session.toOutputStr(evaluate(arguments.get(i))));
			}
			text = sb.append(session.getOrs()).toString();
		}
		String destination = null;
		if (node.getRedirection() != OutputRedirection.NONE) {
			destination = session.toStr(evaluate(node.getDestination()));
		}
		session.write(text, destination, node.getRedirection() == OutputRedirection.APPEND);
	}

	@Override
	public void visit(IfStatement node) {
		if (condition(node.getCondition())) {
			execute(node.getThenBranch());
		} else if (node.getElseBranch() != null) {
			execute(node.getElseBranch());
		}
	}

	@Override
	public void visit(WhileStatement node) {
		while (condition(node.getCondition())) {
			if (!runLoopBody(node.getBody())) {
				break;
			}
		}
	}

	@Override
	public void visit(DoWhileStatement node) {
		do {
			if (!runLoopBody(node.getBody())) {
				break;
			}
		} while (condition(node.getCondition()));
	}

	@Override
	public void visit(ForStatement node) {
		if (node.getInitializer() != null) {
			evaluate(node.getInitializer());
		}
		while (node.getCondition() == null || condition(node.getCondition())) {
			if (!runLoopBody(node.getBody())) {
				break;
			}
			if (node.getUpdate() != null) {
				evaluate(node.getUpdate());
			}
		}
	}

	@Override
	public void visit(ForInStatement node) {
		AssocArray array = getArray(node.getArrayName());
		for (String key : array.keySet()) {
			setVariable(node.getVariable(), AwkValue.fromInput(key));
			if (!runLoopBody(node.getBody())) {
				break;
			}
		}
	}

	/**
	 * @return false when the loop must stop
	 */
	private boolean runLoopBody(Statement body) {
		try {
			execute(body);
			return true;
		} catch (ControlFlowSignal signal) {
			if (signal.getKind() == ControlFlowSignal.Kind.BREAK) {
				return false;
			}
			if (signal.getKind() == ControlFlowSignal.Kind.CONTINUE) {
				return true;
			}
			throw signal;
		}
	}

	@Override
	public void visit(NextStatement node) {
		throw ControlFlowSignal.NEXT;
	}

	@Override
	public void visit(BreakStatement node) {
		throw ControlFlowSignal.BREAK;
	}

	@Override
	public void visit(ContinueStatement node) {
		throw ControlFlowSignal.CONTINUE;
	}

	@Override
	public void visit(ExitStatement node) {
		if (node.getStatus() != null) {
			exitCode = (int) evaluate(node.getStatus()).toNumber();
		}
		throw ControlFlowSignal.EXIT;
	}

	@Override
	public void visit(ReturnStatement node) {
		AwkValue value = node.getValue() == null ? AwkValue.UNINITIALIZED : evaluate(node.getValue());
		throw ControlFlowSignal.returning(value);
	}

	@Override
	public void visit(DeleteStatement node) {
		AssocArray array = getArray(node.getArrayName());
		if (node.getSubscripts() == null) {
			array.clear();
		} else {
			array.remove(subscript(node.getSubscripts()));
		}
	}

	// EXPRESSIONS

	private AwkValue evaluate(Expression expression) {
		return expression.accept(this);
	}

	private AwkValue[] evaluateAll(List<Expression> expressions) {
		AwkValue[] values = new AwkValue[expressions.size()];
		for (int i = 0; i < values.length; i++) {
			values[i] = evaluate(expressions.get(i));
		}
		return values;
	}

	private boolean condition(Expression expression) {
		return evaluate(expression).toBoolean();
	}

	private String subscript(List<Expression> subscripts) {
		List<AwkValue> values = new ArrayList<AwkValue>(subscripts.size());
		for (Expression expression : subscripts) {
			values.add(evaluate(expression));
		}
		return session.subscript(values);
	}

	@Override
	public AwkValue visit(NumberLiteral node) {
		return AwkValue.of(node.getValue());
	}

	@Override
	public AwkValue visit(StringLiteral node) {
		return AwkValue.of(node.getValue());
	}

	/**
	 * A regular expression used as a value matches against $0.
	 */
	@Override
	public AwkValue visit(RegexLiteral node) {
		return AwkValue.of(session.regex(node.getRegex()).matcher(session.getRecord().getText()).find());
	}

	@Override
	public AwkValue visit(VariableReference node) {
		return getVariable(node.getName());
	}

	@Override
	public AwkValue visit(ArrayElement node) {
		AssocArray array = getArray(node.getArrayName());
		return array.ensure(subscript(node.getSubscripts()));
	}

	@Override
	public AwkValue visit(FieldReference node) {
		return session.getField(fieldIndex(node));
	}

	private int fieldIndex(FieldReference node) {
		double index = evaluate(node.getIndex()).toNumber();
		if (index < 0) {
			throw new AwkRuntimeException("Attempt to access field " + (long) index);
		}
		return (int) index;
	}

	@Override
	public AwkValue visit(Assignment node) {
		Reference target = reference(node.getTarget());
		AwkValue value;
		if (node.getOperator() == AssignmentOperator.ASSIGN) {
			value = evaluate(node.getValue());
		} else {
			AwkValue current = target.get();
			value = arithmetic(node.getOperator().getArithmetic(), current, evaluate(node.getValue()));
		}
		target.set(value);
		return value;
	}

	@Override
	public AwkValue visit(IncrementDecrement node) {
		Reference target = reference(node.getTarget());
		double old = target.get().toNumber();
		AwkValue updated = AwkValue.of(node.isIncrement() ? old + 1 : old - 1);
		target.set(updated);
		return node.isPrefix() ? updated : AwkValue.of(old);
	}

	@Override
	public AwkValue visit(BinaryExpression node) {
		BinaryOperator operator = node.getOperator();
		switch (operator) {
		case AND:
			return AwkValue.of(condition(node.getLeft()) && condition(node.getRight()));
		case OR:
			return AwkValue.of(condition(node.getLeft()) || condition(node.getRight()));
		case MATCHES:
		case NOT_MATCHES: {
			String text = session.toStr(evaluate(node.getLeft()));
			boolean found = regex(node.getRight()).matcher(text).find();
			return AwkValue.of(operator == BinaryOperator.MATCHES ? found : !found);
		}
		case CONCATENATE: {
			String left = session.toStr(evaluate(node.getLeft()));
			return AwkValue.of(left + session.toStr(evaluate(node.getRight())));
		}
		case LESS_THAN:
		case LESS_OR_EQUAL:
		case GREATER_THAN:
		case GREATER_OR_EQUAL:
		case EQUAL:
		case NOT_EQUAL:
			return AwkValue.of(compare(operator, evaluate(node.getLeft()), evaluate(node.getRight())));
		default:
			AwkValue left = evaluate(node.getLeft());
			return arithmetic(operator, left, evaluate(node.getRight()));
		}
	}

	private boolean compare(BinaryOperator operator, AwkValue left, AwkValue right) {
		int c = session.compare(left, right);
		switch (operator) {
		case LESS_THAN:
			return c < 0;
		case LESS_OR_EQUAL:
			return c <= 0;
		case GREATER_THAN:
			return c > 0;
		case GREATER_OR_EQUAL:
			return c >= 0;
		case EQUAL:
			return c == 0;
		default:
			return c != 0;
		}
	}

	private static AwkValue arithmetic(BinaryOperator operator, AwkValue left, AwkValue right) {
		double l = left.toNumber();
		double r = right.toNumber();
		switch (operator) {
		case ADD:
			return AwkValue.of(l + r);
		case SUBTRACT:
			return AwkValue.of(l - r);
		case MULTIPLY:
			return AwkValue.of(l * r);
		case DIVIDE:
			if (r == 0) {
				throw new AwkRuntimeException("division by zero");
			}
			return AwkValue.of(l / r);
		case MODULO:
			if (r == 0) {
				throw new AwkRuntimeException("division by zero in %");
			}
			return AwkValue.of(l % r);
		case POWER:
			return AwkValue.of(Math.pow(l, r));
		default:
			throw new IllegalStateException("Not an arithmetic operator: " + operator);
		}
	}

	/**
	 * The regular expression of the right operand of <code>~</code>, of
	 * <code>split</code>, <code>sub</code>, <code>gsub</code> and
	 * <code>match</code>: a regex literal as is, anything else converted to a
	 * string.
	 */
	private Pattern regex(Expression expression) {
		if (expression instanceof RegexLiteral) {
			return session.regex(((RegexLiteral) expression).getRegex());
		}
		return session.regex(session.toStr(evaluate(expression)));
	}

	@Override
	public AwkValue visit(UnaryExpression node) {
		AwkValue operand = evaluate(node.getOperand());
		switch (node.getOperator()) {
		case NEGATE:
			return AwkValue.of(-operand.toNumber());
		case PLUS:
			return AwkValue.of(operand.toNumber());
		default:
			return AwkValue.of(!operand.toBoolean());
		}
	}

	@Override
	public AwkValue visit(TernaryExpression node) {
		return condition(node.getCondition()) ? evaluate(node.getIfTrue()) : evaluate(node.getIfFalse());
	}

	@Override
	public AwkValue visit(InExpression node) {
		String key = subscript(node.getSubscripts());
		return AwkValue.of(getArray(node.getArrayName()).isIn(key));
	}

	@Override
	public AwkValue visit(GetlineExpression node) {
		Reference target = node.getTarget() == null ? null : reference(node.getTarget());
		String text;
		if (node.getFile() == null) {
			text = session.nextMainRecord();
		} else {
			String fileName = session.toStr(evaluate(node.getFile()));
			try {
				text = session.nextFileRecord(fileName);
			} catch (IOException e) {
				LOG.debug("getline < {} failed: {}", fileName, e.getMessage());
				return AwkValue.of(-1);
			}
		}
		if (text == null) {
			return AwkValue.ZERO;
		}
		if (target == null) {
			session.getRecord().setRecord(text);
		} else {
			target.set(AwkValue.fromInput(text));
		}
		return AwkValue.ONE;
	}

	@Override
	public AwkValue visit(GroupingExpression node) {
		throw new AwkRuntimeException("A parenthesized list of expressions can only be used with 'in' or print");
	}

	// FUNCTION CALLS

	@Override
	public AwkValue visit(FunctionCall node) {
		CallTarget target = callSites.get(node);
		if (target == null) {
			target = resolver.resolve(node.getName());
			callSites.put(node, target);
		}
		switch (target.getKind()) {
		case BUILTIN:
			if (!target.getBuiltin().acceptsArgumentCount(node.getArguments().size())) {
				throw new AwkNameException(
						node.getName() + "() does not accept " + node.getArguments().size() + " argument(s)");
			}
			return callBuiltin(target.getBuiltin(), node.getArguments());
		case USER_DEFINED:
			return callUserDefined(target.getDefinition(), node.getArguments());
		default:
			return callForeign(node.getName(), target, node.getArguments());
		}
	}

	private AwkValue callUserDefined(FunctionDefinition function, List<Expression> arguments) {
		List<String> parameters = function.getParameters();
		if (arguments.size() > parameters.size()) {
			throw new AwkNameException(
					"function " + function.getName() + " called with " + arguments.size()
							+ " arguments, accepts only " + parameters.size());
		}
		Map<String, Object> calleeFrame = new HashMap<String, Object>();
		for (int i = 0; i < parameters.size(); i++) {
			String parameter = parameters.get(i);
			Object binding = null;
			if (i < arguments.size()) {
				binding = argumentBinding(arguments.get(i), function.isArrayParameter(parameter));
			}
			calleeFrame.put(parameter, binding);
		}
		Map<String, Object> callerFrame = frame;
		frame = calleeFrame;
		try {
			execute(function.getBody());
			return AwkValue.UNINITIALIZED;
		} catch (ControlFlowSignal signal) {
			if (signal.getKind() == ControlFlowSignal.Kind.RETURN) {
				return signal.getValue();
			}
			throw signal;
		} finally {
			frame = callerFrame;
		}
	}

	/**
	 * @return the array, the value, or null for a variable that is not set
	 */
	private Object argumentBinding(Expression argument, boolean arrayParameter) {
		if (argument instanceof VariableReference) {
			String name = ((VariableReference) argument).getName();
			if (isArray(name)) {
				return getArray(name);
			}
			if (isUnset(name)) {
				return arrayParameter ? getArray(name) : null;
			}
		}
		return evaluate(argument);
	}

	private AwkValue callForeign(String name, CallTarget target, List<Expression> arguments) {
		AwkValue[] values = new AwkValue[arguments.size()];
		for (int i = 0; i < values.length; i++) {
			Expression argument = arguments.get(i);
			if (argument instanceof VariableReference && isArray(((VariableReference) argument).getName())) {
				throw new AwkTypeException("Cannot pass array " + ((VariableReference) argument).getName() + " to " + name);
			}
			values[i] = evaluate(argument);
		}
		try {
			return AwkValue.fromInput(target.getForeign().invoke(session.getConvfmt(), session.getLocale(), values));
		} catch (AwkRuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new AwkRuntimeException("Foreign function " + name + " failed: " + e.getMessage(), e);
		}
	}

	private AwkValue callBuiltin(BuiltinFunction function, List<Expression> args) {
		switch (function) {
		case LENGTH:
			return length(args);
		case SUBSTR:
			return substr(args);
		case INDEX: {
			String s = string(args.get(0));
			String target = string(args.get(1));
			return AwkValue.of(target.isEmpty() ? 0 : s.indexOf(target) + 1);
		}
		case SPLIT:
			return split(args);
		case SUB:
			return substitute(args, false);
		case GSUB:
			return substitute(args, true);
		case MATCH:
			return match(args);
		case SPRINTF: {
			String format = string(args.get(0));
			return AwkValue.of(SprintfFormatter.format(session.getLocale(), format, evaluateAll(args.subList(1, args.size())), session.getConvfmt()));
		}
		case TOLOWER:
			return AwkValue.of(string(args.get(0)).toLowerCase(Locale.ROOT));
		case TOUPPER:
			return AwkValue.of(string(args.get(0)).toUpperCase(Locale.ROOT));
		case SIN:
			return AwkValue.of(Math.sin(number(args.get(0))));
		case COS:
			return AwkValue.of(Math.cos(number(args.get(0))));
		case ATAN2: {
			double y = number(args.get(0));
			return AwkValue.of(Math.atan2(y, number(args.get(1))));
		}
		case EXP:
			return AwkValue.of(Math.exp(number(args.get(0))));
		case LOG:
			return AwkValue.of(Math.log(number(args.get(0))));
		case SQRT:
			return AwkValue.of(Math.sqrt(number(args.get(0))));
		case INT: {
			double d = number(args.get(0));
			return AwkValue.of(d < 0 ? Math.ceil(d) : Math.floor(d));
		}
		case RAND:
			return AwkValue.of(session.rand());
		case SRAND: {
			double seed = args.isEmpty() ? (double) (System.currentTimeMillis() / 1000L) : number(args.get(0));
			return AwkValue.of(session.srand(seed));
		}
		case CLOSE:
			return AwkValue.of(session.close(string(args.get(0))));
		case ASORT:
			return AwkValue.of(arrayArgument(function, args.get(0)).sortValues(session.getConvfmt(), session.getLocale()));
		case ASORTI:
			return AwkValue.of(arrayArgument(function, args.get(0)).sortKeys());
		case FIELD:
			return session.getField((int) number(args.get(0)));
		default:
			throw new IllegalStateException("Unhandled built-in function " + function);
		}
	}

	private String string(Expression expression) {
		return session.toStr(evaluate(expression));
	}

	private double number(Expression expression) {
		return evaluate(expression).toNumber();
	}

	private AwkValue length(List<Expression> args) {
		if (args.isEmpty()) {
			return AwkValue.of(session.getRecord().getText().length());
		}
		Expression argument = args.get(0);
		if (argument instanceof VariableReference && isArray(((VariableReference) argument).getName())) {
			return AwkValue.of(getArray(((VariableReference) argument).getName()).size());
		}
		return AwkValue.of(string(argument).length());
	}

	/**
	 * <code>substr(s, m[, n])</code>: the characters of s from position m
	 * (1-based), n of them or up to the end. Positions are rounded to the
	 * nearest integer and clamped to the string.
	 */
	private AwkValue substr(List<Expression> args) {
		String s = string(args.get(0));
		double start = roundHalfUp(number(args.get(1)));
		double end;
		if (args.size() > 2) {
			double length = number(args.get(2));
			if (Double.isNaN(length)) {
				return AwkValue.EMPTY;
			}
			end = start + roundHalfUp(length);
		} else {
			end = s.length() + 1;
		}
		if (Double.isNaN(start)) {
			return AwkValue.EMPTY;
		}
		if (start < 1) {
			start = 1;
		}
		if (end > s.length() + 1) {
			end = s.length() + 1;
		}
		if (end <= start) {
			return AwkValue.EMPTY;
		}
		return AwkValue.of(s.substring((int) start - 1, (int) end - 1));
	}

	private static double roundHalfUp(double d) {
		return Math.floor(d + 0.5);
	}

	private AssocArray arrayArgument(BuiltinFunction function, Expression argument) {
		String name = ((VariableReference) argument).getName();
		if (!isArray(name) && !isUnset(name)) {
			throw new AwkTypeException(function.getFunctionName() + ": argument " + name + " is not an array");
		}
		return getArray(name);
	}

	private AwkValue split(List<Expression> args) {
		String text = string(args.get(0));
		String arrayName = ((VariableReference) args.get(1)).getName();
		String fs;
		if (args.size() > 2) {
			Expression separator = args.get(2);
			if (separator instanceof RegexLiteral) {
				String regex = ((RegexLiteral) separator).getRegex();
				// a one-character regular expression is still a regular expression
				if (" ".equals(regex)) {
					fs = "[ ]";
				} else {
					fs = regex.length() == 1 ? "(" + regex + ")" : regex;
				}
			} else {
				fs = string(separator);
			}
		} else {
			fs = session.toStr(session.getVariable("FS"));
		}
		if (!isArray(arrayName) && !isUnset(arrayName)) {
			throw new AwkTypeException("split: second argument " + arrayName + " is not an array");
		}
		List<String> pieces = FieldSplitter.split(text, fs, false, session.getRegexCache());
		AssocArray array = getArray(arrayName);
		array.clear();
		for (int i = 0; i < pieces.size(); i++) {
			array.put(String.valueOf(i + 1), AwkValue.fromInput(pieces.get(i)));
		}
		return AwkValue.of(pieces.size());
	}

	/**
	 * <code>sub</code> and <code>gsub</code>. In the replacement,
	 * <code>&amp;</code> stands for the matched text, <code>\&amp;</code> for a
	 * literal ampersand and <code>\\</code> for a backslash.
	 */
	private AwkValue substitute(List<Expression> args, boolean global) {
		Pattern pattern = regex(args.get(0));
		String replacement = string(args.get(1));
		Reference target = args.size() > 2 ? reference(args.get(2)) : new FieldSlot(0);
		String text = session.toStr(target.get());

		Matcher matcher = pattern.matcher(text);
		StringBuilder result = new StringBuilder();
		int copied = 0;
		int searchFrom = 0;
		int lastEnd = -1;
		int count = 0;
		while (searchFrom <= text.length() && matcher.find(searchFrom)) {
			int start = matcher.start();
			int end = matcher.end();
			if (start == end && start == lastEnd) {
				// an empty match right after the previous match does not count
				searchFrom = start + 1;
				continue;
			}
			result.append(text, copied, start);
			appendReplacement(result, replacement, matcher.group());
			copied = end;
			lastEnd = end;
			count++;
			if (!global) {
				break;
			}
			searchFrom = start == end ? end + 1 : end;
		}
		if (count > 0) {
			result.append(text, copied, text.length());
			target.set(AwkValue.of(result.toString()));
		}
		return AwkValue.of(count);
	}

	private static void appendReplacement(StringBuilder sb, String replacement, String matched) {
		for (int i = 0; i < replacement.length(); i++) {
			char c = replacement.charAt(i);
			if (c == '\\' && i + 1 < replacement.length()) {
				char next = replacement.charAt(i + 1);
				if (next == '&' || next == '\\') {
					sb.append(next);
					i++;
					continue;
				}
			}
			if (c == '&') {
				sb.append(matched);
			} else {
				sb.append(c);
			}
		}
	}

	private AwkValue match(List<Expression> args) {
		String text = string(args.get(0));
		Matcher matcher = regex(args.get(1)).matcher(text);
		if (matcher.find()) {
			session.setMatch(matcher.start() + 1, matcher.end() - matcher.start());
		} else {
			session.setMatch(0, -1);
		}
		return session.getVariable("RSTART");
	}

	// VARIABLES

	private boolean isLocal(String name) {
		return frame != null && frame.containsKey(name);
	}

	private AwkValue getVariable(String name) {
		if (!isLocal(name)) {
			return session.getVariable(name);
		}
		Object binding = frame.get(name);
		if (binding == null) {
			return AwkValue.UNINITIALIZED;
		}
		if (binding instanceof AssocArray) {
			throw new AwkTypeException("Attempt to use array " + name + " in a scalar context");
		}
		return (AwkValue) binding;
	}

	private void setVariable(String name, AwkValue value) {
		if (!isLocal(name)) {
			session.setVariable(name, value);
			return;
		}
		if (frame.get(name) instanceof AssocArray) {
			throw new AwkNameException("Cannot assign to " + name + ": it is an array name");
		}
		frame.put(name, value);
	}

	private AssocArray getArray(String name) {
		if (!isLocal(name)) {
			return session.getArray(name);
		}
		Object binding = frame.get(name);
		if (binding == null) {
			AssocArray array = session.newArray();
			frame.put(name, array);
			return array;
		}
		if (binding instanceof AssocArray) {
			return (AssocArray) binding;
		}
		throw new AwkNameException("Cannot use scalar " + name + " as an array");
	}

	private boolean isArray(String name) {
		if (isLocal(name)) {
			return frame.get(name) instanceof AssocArray;
		}
		return session.isArray(name);
	}

	private boolean isUnset(String name) {
		if (isLocal(name)) {
			return frame.get(name) == null;
		}
		return !session.isArray(name) && session.getVariable(name).isUninitialized();
	}

	// LVALUES

	/**
	 * Something that can be read and assigned: a variable, an array element
	 * or a field. Subscripts and field indexes are evaluated once, when the
	 * reference is created.
	 */
	private interface Reference {
		AwkValue get();

		void set(AwkValue value);
	}

	private Reference reference(Expression target) {
		if (target instanceof VariableReference) {
			return new VariableSlot(((VariableReference) target).getName());
		}
		if (target instanceof ArrayElement) {
			ArrayElement element = (ArrayElement) target;
			return new ElementSlot(getArray(element.getArrayName()), subscript(element.getSubscripts()));
		}
		if (target instanceof FieldReference) {
			return new FieldSlot(fieldIndex((FieldReference) target));
		}
		throw new AwkRuntimeException("Cannot assign to a non-lvalue");
	}

	private final class VariableSlot implements Reference {
		private final String name;

		VariableSlot(String name) {
			this.name = name;
		}

		@Override
		public AwkValue get() {
			return getVariable(name);
		}

		@Override
		public void set(AwkValue value) {
			setVariable(name, value);
		}
	}

	private static final class ElementSlot implements Reference {
		private final AssocArray array;
		private final String key;

		ElementSlot(AssocArray array, String key) {
			this.array = array;
			this.key = key;
		}

		@Override
		public AwkValue get() {
			return array.ensure(key);
		}

		@Override
		public void set(AwkValue value) {
			array.put(key, value);
		}
	}

	private final class FieldSlot implements Reference {
		private final int index;

		FieldSlot(int index) {
			this.index = index;
		}

		@Override
		public AwkValue get() {
			return session.getField(index);
		}

		@Override
		public void set(AwkValue value) {
			session.setField(index, value);
		}
	}
}
