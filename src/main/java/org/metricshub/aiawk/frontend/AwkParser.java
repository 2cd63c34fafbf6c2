package org.metricshub.aiawk.frontend;

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
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.aiawk.backend.BuiltinFunction;
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
import org.metricshub.aiawk.frontend.ast.ParserException;
import org.metricshub.aiawk.frontend.ast.Pattern;
import org.metricshub.aiawk.frontend.ast.PrintStatement;
import org.metricshub.aiawk.frontend.ast.RegexLiteral;
import org.metricshub.aiawk.frontend.ast.ReturnStatement;
import org.metricshub.aiawk.frontend.ast.Rule;
import org.metricshub.aiawk.frontend.ast.Statement;
import org.metricshub.aiawk.frontend.ast.StringLiteral;
import org.metricshub.aiawk.frontend.ast.TernaryExpression;
import org.metricshub.aiawk.frontend.ast.UnaryExpression;
import org.metricshub.aiawk.frontend.ast.UnaryOperator;
import org.metricshub.aiawk.frontend.ast.VariableReference;
import org.metricshub.aiawk.frontend.ast.WhileStatement;
import org.metricshub.aiawk.util.AwkLogger;
import org.slf4j.Logger;

/**
 * Converts the tokens of an AWK program into an {@link AwkProgram}.
 * <p>
 * This is a recursive descent parser, with one method per grammar
 * production and per level of operator precedence (lowest first):
 * assignment, ternary, <code>||</code>, <code>&amp;&amp;</code>,
 * <code>in</code>, <code>~ !~</code>, comparison, concatenation, additive,
 * multiplicative, unary, exponentiation, increment and decrement, and
 * finally the primary expressions.
 * <p>
 * A few errors that could be detected later are reported here, before
 * anything runs: wrong argument counts for built-in functions,
 * <code>next</code> in BEGIN or END, <code>return</code> outside of a
 * function, <code>break</code> and <code>continue</code> outside of a loop,
 * and functions defined twice.
 *
 * @author Danny Daglas
 */
public class AwkParser {

	private static final Logger LOG = AwkLogger.getLogger(AwkParser.class);

	/** What kind of code is being parsed, for context-dependent checks */
	private enum Context {
		BEGIN,
		END,
		MAIN,
		FUNCTION
	}

	private final Iterator<Token> tokens;
	private final LinkedList<Token> lookahead = new LinkedList<Token>();

	private Token current;
	private TokenType token;
	private String text;

	private Context context = Context.MAIN;
	private int loopDepth;
	private Set<String> functionParameters;
	private Set<String> functionArrayParameters;
	private boolean groupingAllowed;

	/**
	 * @param lexer the tokens to parse
	 */
	public AwkParser(Iterable<Token> lexer) {
		this.tokens = lexer.iterator();
		lexer();
	}

	/**
	 * Parses the whole program.
	 *
	 * @return the program
	 * @throws ParserException when the program is not valid
	 * @throws org.metricshub.aiawk.frontend.ast.LexerException when the text
	 *         cannot be split into tokens
	 */
	public AwkProgram parse() {
		AwkProgram program = SCRIPT();
		LOG.debug("Parsed {} rules and {} functions", program.getRules().size(), program.getFunctions().size());
		return program;
	}

	// TOKEN HANDLING

	private Token fetch() {
		if (!lookahead.isEmpty()) {
			return lookahead.removeFirst();
		}
		if (!tokens.hasNext()) {
			// EOF was already returned, keep returning it
			return current;
		}
		return tokens.next();
	}

	/**
	 * @param ahead 1 for the token after the current one
	 * @return the type of that token
	 */
	private TokenType peek(int ahead) {
		while (lookahead.size() < ahead) {
			if (!tokens.hasNext()) {
				return TokenType.EOF;
			}
			lookahead.addLast(tokens.next());
		}
		return lookahead.get(ahead - 1).getType();
	}

	private void lexer() {
		current = fetch();
		token = current.getType();
		text = current.getText();
	}

	private void lexer(TokenType expected) {
		if (token != expected) {
			throw parserException("Expecting " + expected.name() + ". Got " + token.name() + ": " + printable(text));
		}
		lexer();
	}

	private static String printable(String s) {
		return s.replace("\n", "\\n");
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, current.getSource(), current.getLine(), current.getColumn());
	}

	// SUPPORTING FUNCTIONS/METHODS

	private void terminator() {
		// like optTerminator, except error if no terminator was found
		if (!optTerminator()) {
			if (token == TokenType.PIPE) {
				throw parserException("Pipes to and from commands are not supported");
			}
			throw parserException("Expecting statement terminator. Got " + token.name() + ": " + printable(text));
		}
	}

	private boolean optTerminator() {
		if (optNewline()) {
			return true;
		} else if (token == TokenType.EOF || token == TokenType.CLOSE_BRACE) {
			return true; // do nothing
		} else if (token == TokenType.SEMICOLON) {
			lexer();
			optNewline();
			return true;
		} else {
			// no terminator consumed
			return false;
		}
	}

	private boolean optNewline() {
		if (token == TokenType.NEWLINE) {
			lexer();
			return true;
		} else {
			return false;
		}
	}

	private boolean isTerminator() {
		return token == TokenType.NEWLINE
				|| token == TokenType.SEMICOLON
				|| token == TokenType.CLOSE_BRACE
				|| token == TokenType.EOF;
	}

	private void markArray(String name) {
		if (functionParameters != null && functionParameters.contains(name)) {
			functionArrayParameters.add(name);
		}
	}

	// RECURSIVE DECENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// SCRIPT : \n [ ( RULE | FUNCTION ) optTerminator ]... EOF
	AwkProgram SCRIPT() {
		List<Rule> rules = new ArrayList<Rule>();
		Map<String, FunctionDefinition> functions = new LinkedHashMap<String, FunctionDefinition>();
		optNewline();
		while (token != TokenType.EOF) {
			if (token == TokenType.KW_FUNCTION) {
				FunctionDefinition function = FUNCTION();
				if (functions.containsKey(function.getName())) {
					throw new ParserException(
							"function " + function.getName() + " already defined",
							current.getSource(),
							function.getLineNumber(),
							1);
				}
				functions.put(function.getName(), function);
			} else {
				rules.add(RULE(rules.size()));
			}
			optTerminator();
			while (token == TokenType.SEMICOLON) {
				lexer();
				optNewline();
			}
		}
		return new AwkProgram(rules, functions);
	}

	// FUNCTION: function functionName( [FORMAL_PARAM_LIST] ) \n BLOCK
	FunctionDefinition FUNCTION() {
		int line = current.getLine();
		lexer(TokenType.KW_FUNCTION);
		String functionName;
		if (token == TokenType.FUNC_NAME || token == TokenType.NAME) {
			functionName = text;
			lexer();
		} else if (token == TokenType.BUILTIN_FUNC_NAME) {
			throw parserException("cannot redefine built-in function " + text);
		} else {
			throw parserException("Expecting function name. Got " + token.name() + ": " + printable(text));
		}
		lexer(TokenType.OPEN_PAREN);
		List<String> parameters = FORMAL_PARAM_LIST(functionName);
		lexer(TokenType.CLOSE_PAREN);
		optNewline();

		Context saved = context;
		context = Context.FUNCTION;
		functionParameters = new HashSet<String>(parameters);
		functionArrayParameters = new HashSet<String>();
		try {
			Block body = BLOCK();
			return new FunctionDefinition(line, functionName, parameters, functionArrayParameters, body);
		} finally {
			context = saved;
			functionParameters = null;
			functionArrayParameters = null;
		}
	}

	// FORMAL_PARAM_LIST: [ NAME [, \n NAME]... ]
	List<String> FORMAL_PARAM_LIST(String functionName) {
		List<String> parameters = new ArrayList<String>();
		while (token == TokenType.NAME) {
			if (parameters.contains(text)) {
				throw parserException("multiply defined parameter " + text + " in function " + functionName);
			}
			if (text.equals(functionName)) {
				throw parserException("function " + functionName + " cannot use its own name as a parameter");
			}
			parameters.add(text);
			lexer();
			if (token != TokenType.COMMA) {
				break;
			}
			lexer();
			optNewline();
			if (token != TokenType.NAME) {
				throw parserException("Cannot terminate a formal parameter list with a comma.");
			}
		}
		return parameters;
	}

	// RULE : BEGIN BLOCK | END BLOCK | [EXPRESSION [, EXPRESSION]] [BLOCK]
	Rule RULE(int index) {
		int line = current.getLine();
		if (token == TokenType.KW_BEGIN || token == TokenType.KW_END) {
			boolean begin = token == TokenType.KW_BEGIN;
			lexer();
			optNewline();
			if (token != TokenType.OPEN_BRACE) {
				throw parserException((begin ? "BEGIN" : "END") + " blocks must have an action part");
			}
			context = begin ? Context.BEGIN : Context.END;
			try {
				return new Rule(line, index, begin ? Pattern.begin() : Pattern.end(), BLOCK());
			} finally {
				context = Context.MAIN;
			}
		}
		Pattern pattern;
		if (token == TokenType.OPEN_BRACE) {
			pattern = Pattern.always();
		} else {
			Expression first = EXPRESSION(true);
			if (token == TokenType.COMMA) {
				// for ranges, like conditionStart, conditionEnd
				lexer();
				optNewline();
				pattern = Pattern.range(first, EXPRESSION(true));
			} else {
				pattern = Pattern.of(first);
			}
		}
		Block action = null;
		if (token == TokenType.OPEN_BRACE) {
			action = BLOCK();
		} else if (!isTerminator()) {
			throw parserException("Expecting { or end of the rule. Got " + token.name() + ": " + printable(text));
		}
		return new Rule(line, index, pattern, action);
	}

	// BLOCK : { STATEMENT_LIST }
	Block BLOCK() {
		int line = current.getLine();
		lexer(TokenType.OPEN_BRACE);
		List<Statement> statements = STATEMENT_LIST();
		lexer(TokenType.CLOSE_BRACE);
		return new Block(line, statements);
	}

	// STATEMENT_LIST : [ STATEMENT | ; | \n ]...
	List<Statement> STATEMENT_LIST() {
		List<Statement> statements = new ArrayList<Statement>();
		while (true) {
			if (token == TokenType.NEWLINE || token == TokenType.SEMICOLON) {
				// empty statement
				lexer();
				continue;
			}
			if (token == TokenType.CLOSE_BRACE || token == TokenType.EOF) {
				return statements;
			}
			statements.add(STATEMENT());
		}
	}

	// STATEMENT : BLOCK | IF | WHILE | DO | FOR | SIMPLE_STATEMENT terminator
	Statement STATEMENT() {
		switch (token) {
		case OPEN_BRACE: {
			Block block = BLOCK();
			optTerminator();
			return block;
		}
		case KW_IF:
			return IF_STATEMENT();
		case KW_WHILE:
			return WHILE_STATEMENT();
		case KW_DO:
			return DO_STATEMENT();
		case KW_FOR:
			return FOR_STATEMENT();
		case SEMICOLON: {
			// empty body, as in: while (x--) ;
			int line = current.getLine();
			lexer();
			return new Block(line, new ArrayList<Statement>());
		}
		default: {
			Statement statement = SIMPLE_STATEMENT();
			terminator();
			return statement;
		}
		}
	}

	// BODY : \n STATEMENT, the body of a control statement
	private Statement BODY() {
		optNewline();
		return STATEMENT();
	}

	// LOOP_BODY : BODY, where break and continue are allowed
	private Statement LOOP_BODY() {
		loopDepth++;
		try {
			return BODY();
		} finally {
			loopDepth--;
		}
	}

	// IF_STATEMENT : if ( EXPRESSION ) BODY [ \n else BODY ]
	Statement IF_STATEMENT() {
		int line = current.getLine();
		lexer(TokenType.KW_IF);
		lexer(TokenType.OPEN_PAREN);
		Expression condition = EXPRESSION(true);
		lexer(TokenType.CLOSE_PAREN);
		Statement thenBranch = BODY();
		Statement elseBranch = null;
		if (token == TokenType.NEWLINE && peek(1) == TokenType.KW_ELSE) {
			lexer();
		}
		if (token == TokenType.KW_ELSE) {
			lexer();
			elseBranch = BODY();
		}
		return new IfStatement(line, condition, thenBranch, elseBranch);
	}

	// WHILE_STATEMENT : while ( EXPRESSION ) LOOP_BODY
	Statement WHILE_STATEMENT() {
		int line = current.getLine();
		lexer(TokenType.KW_WHILE);
		lexer(TokenType.OPEN_PAREN);
		Expression condition = EXPRESSION(true);
		lexer(TokenType.CLOSE_PAREN);
		return new WhileStatement(line, condition, LOOP_BODY());
	}

	// DO_STATEMENT : do LOOP_BODY \n while ( EXPRESSION ) terminator
	Statement DO_STATEMENT() {
		int line = current.getLine();
		lexer(TokenType.KW_DO);
		Statement body = LOOP_BODY();
		optNewline();
		lexer(TokenType.KW_WHILE);
		lexer(TokenType.OPEN_PAREN);
		Expression condition = EXPRESSION(true);
		lexer(TokenType.CLOSE_PAREN);
		terminator();
		return new DoWhileStatement(line, body, condition);
	}

	// FOR_STATEMENT : for ( NAME in NAME ) LOOP_BODY
	// | for ( [EXPRESSION] ; \n [EXPRESSION] ; \n [EXPRESSION] ) LOOP_BODY
	Statement FOR_STATEMENT() {
		int line = current.getLine();
		lexer(TokenType.KW_FOR);
		lexer(TokenType.OPEN_PAREN);
		if (token == TokenType.NAME
				&& peek(1) == TokenType.KW_IN
				&& peek(2) == TokenType.NAME
				&& peek(3) == TokenType.CLOSE_PAREN) {
			String variable = text;
			lexer();
			lexer(TokenType.KW_IN);
			String arrayName = text;
			markArray(arrayName);
			lexer(TokenType.NAME);
			lexer(TokenType.CLOSE_PAREN);
			return new ForInStatement(line, variable, arrayName, LOOP_BODY());
		}
		Expression initializer = token == TokenType.SEMICOLON ? null : EXPRESSION(true);
		lexer(TokenType.SEMICOLON);
		optNewline();
		Expression condition = token == TokenType.SEMICOLON ? null : EXPRESSION(true);
		lexer(TokenType.SEMICOLON);
		optNewline();
		Expression update = token == TokenType.CLOSE_PAREN ? null : EXPRESSION(true);
		lexer(TokenType.CLOSE_PAREN);
		return new ForStatement(line, initializer, condition, update, LOOP_BODY());
	}

	// SIMPLE_STATEMENT : PRINT | next | exit [EXPRESSION] | return [EXPRESSION]
	// | break | continue | DELETE | EXPRESSION
	Statement SIMPLE_STATEMENT() {
		int line = current.getLine();
		switch (token) {
		case KW_PRINT:
		case KW_PRINTF:
			return PRINT_STATEMENT();
		case KW_NEXT:
			if (context == Context.BEGIN || context == Context.END) {
				throw parserException("next used in " + context.name() + " action");
			}
			lexer();
			return new NextStatement(line);
		case KW_EXIT:
			lexer();
			return new ExitStatement(line, isTerminator() ? null : EXPRESSION(true));
		case KW_RETURN:
			if (context != Context.FUNCTION) {
				throw parserException("return used outside of a function");
			}
			lexer();
			return new ReturnStatement(line, isTerminator() ? null : EXPRESSION(true));
		case KW_BREAK:
			if (loopDepth == 0) {
				throw parserException("break used outside of a loop");
			}
			lexer();
			return new BreakStatement(line);
		case KW_CONTINUE:
			if (loopDepth == 0) {
				throw parserException("continue used outside of a loop");
			}
			lexer();
			return new ContinueStatement(line);
		case KW_DELETE:
			return DELETE_STATEMENT();
		default:
			return new ExpressionStatement(line, EXPRESSION(true));
		}
	}

	// PRINT_STATEMENT : (print | printf) [EXPRESSION_LIST | ( EXPRESSION_LIST )] [(> | >>) CONCAT_EXPRESSION]
	Statement PRINT_STATEMENT() {
		int line = current.getLine();
		boolean formatted = token == TokenType.KW_PRINTF;
		lexer();
		List<Expression> arguments = new ArrayList<Expression>();
		if (!isTerminator() && token != TokenType.GT && token != TokenType.APPEND && token != TokenType.PIPE) {
			groupingAllowed = token == TokenType.OPEN_PAREN;
			arguments = EXPRESSION_LIST(false);
			if (arguments.size() == 1 && arguments.get(0) instanceof GroupingExpression) {
				arguments = new ArrayList<Expression>(((GroupingExpression) arguments.get(0)).getExpressions());
			}
		}
		if (formatted && arguments.isEmpty()) {
			throw parserException("printf requires at least a format argument");
		}
		OutputRedirection redirection = OutputRedirection.NONE;
		Expression destination = null;
		if (token == TokenType.GT || token == TokenType.APPEND) {
			redirection = token == TokenType.GT ? OutputRedirection.WRITE : OutputRedirection.APPEND;
			lexer();
			destination = CONCATENATION_EXPRESSION(false);
		} else if (token == TokenType.PIPE) {
			throw parserException("Pipes to and from commands are not supported");
		}
		return new PrintStatement(line, formatted, arguments, redirection, destination);
	}

	// DELETE_STATEMENT : delete NAME [ [ EXPRESSION_LIST ] ]
	Statement DELETE_STATEMENT() {
		int line = current.getLine();
		lexer(TokenType.KW_DELETE);
		if (token != TokenType.NAME) {
			throw parserException("Expecting an array name after delete. Got " + token.name() + ": " + printable(text));
		}
		String arrayName = text;
		markArray(arrayName);
		lexer();
		List<Expression> subscripts = null;
		if (token == TokenType.OPEN_BRACKET) {
			lexer();
			subscripts = EXPRESSION_LIST(true);
			lexer(TokenType.CLOSE_BRACKET);
		}
		return new DeleteStatement(line, arrayName, subscripts);
	}

	/**
	 * Parse a comma-separated list of expressions.
	 *
	 * @param allowGreaterThan false in print argument lists, where
	 *        <code>&gt;</code> is an output redirection
	 */
	List<Expression> EXPRESSION_LIST(boolean allowGreaterThan) {
		List<Expression> expressions = new ArrayList<Expression>();
		expressions.add(EXPRESSION(allowGreaterThan));
		while (token == TokenType.COMMA) {
			lexer();
			optNewline();
			expressions.add(EXPRESSION(allowGreaterThan));
		}
		return expressions;
	}

	// EXPRESSION : ASSIGNMENT_EXPRESSION
	Expression EXPRESSION(boolean allowGreaterThan) {
		return ASSIGNMENT_EXPRESSION(allowGreaterThan);
	}

	// ASSIGNMENT_EXPRESSION = TERNARY_EXPRESSION [ (=,+=,-=,*=,/=,%=,^=) ASSIGNMENT_EXPRESSION ]
	Expression ASSIGNMENT_EXPRESSION(boolean allowGreaterThan) {
		Expression target = TERNARY_EXPRESSION(allowGreaterThan);
		AssignmentOperator operator = assignmentOperator(token);
		if (operator == null) {
			return target;
		}
		if (!target.isLvalue()) {
			throw parserException("Cannot assign to a non-lvalue (operator " + text + ")");
		}
		int line = current.getLine();
		lexer();
		optNewline();
		Expression value = ASSIGNMENT_EXPRESSION(allowGreaterThan);
		return new Assignment(line, target, operator, value);
	}

	private static AssignmentOperator assignmentOperator(TokenType type) {
		switch (type) {
		case EQUALS:
			return AssignmentOperator.ASSIGN;
		case PLUS_EQ:
			return AssignmentOperator.ADD;
		case MINUS_EQ:
			return AssignmentOperator.SUBTRACT;
		case MULT_EQ:
			return AssignmentOperator.MULTIPLY;
		case DIV_EQ:
			return AssignmentOperator.DIVIDE;
		case MOD_EQ:
			return AssignmentOperator.MODULO;
		case POW_EQ:
			return AssignmentOperator.POWER;
		default:
			return null;
		}
	}

	// TERNARY_EXPRESSION = LOGICAL_OR_EXPRESSION [ ? \n ASSIGNMENT_EXPRESSION : \n TERNARY_EXPRESSION ]
	Expression TERNARY_EXPRESSION(boolean allowGreaterThan) {
		Expression condition = LOGICAL_OR_EXPRESSION(allowGreaterThan);
		if (token != TokenType.QUESTION_MARK) {
			return condition;
		}
		int line = current.getLine();
		lexer();
		optNewline();
		Expression ifTrue = ASSIGNMENT_EXPRESSION(allowGreaterThan);
		optNewline();
		lexer(TokenType.COLON);
		optNewline();
		Expression ifFalse = TERNARY_EXPRESSION(allowGreaterThan);
		return new TernaryExpression(line, condition, ifTrue, ifFalse);
	}

	// LOGICAL_OR_EXPRESSION = LOGICAL_AND_EXPRESSION [ || \n LOGICAL_AND_EXPRESSION ]...
	Expression LOGICAL_OR_EXPRESSION(boolean allowGreaterThan) {
		Expression left = LOGICAL_AND_EXPRESSION(allowGreaterThan);
		while (token == TokenType.OR) {
			int line = current.getLine();
			lexer();
			optNewline();
			left = new BinaryExpression(line, BinaryOperator.OR, left, LOGICAL_AND_EXPRESSION(allowGreaterThan));
		}
		return left;
	}

	// LOGICAL_AND_EXPRESSION = IN_EXPRESSION [ && \n IN_EXPRESSION ]...
	Expression LOGICAL_AND_EXPRESSION(boolean allowGreaterThan) {
		Expression left = IN_EXPRESSION(allowGreaterThan);
		while (token == TokenType.AND) {
			int line = current.getLine();
			lexer();
			optNewline();
			left = new BinaryExpression(line, BinaryOperator.AND, left, IN_EXPRESSION(allowGreaterThan));
		}
		return left;
	}

	// IN_EXPRESSION = MATCHING_EXPRESSION [ in NAME ]...
	Expression IN_EXPRESSION(boolean allowGreaterThan) {
		Expression left = MATCHING_EXPRESSION(allowGreaterThan);
		while (token == TokenType.KW_IN) {
			int line = current.getLine();
			lexer();
			if (token != TokenType.NAME) {
				throw parserException("Expecting an array name after 'in'. Got " + token.name() + ": " + printable(text));
			}
			String arrayName = text;
			markArray(arrayName);
			lexer();
			List<Expression> subscripts;
			if (left instanceof GroupingExpression) {
				subscripts = new ArrayList<Expression>(((GroupingExpression) left).getExpressions());
			} else {
				subscripts = new ArrayList<Expression>();
				subscripts.add(left);
			}
			left = new InExpression(line, subscripts, arrayName);
		}
		return left;
	}

	// MATCHING_EXPRESSION = COMPARISON_EXPRESSION [ (~,!~) COMPARISON_EXPRESSION ]...
	Expression MATCHING_EXPRESSION(boolean allowGreaterThan) {
		Expression left = COMPARISON_EXPRESSION(allowGreaterThan);
		while (token == TokenType.MATCHES || token == TokenType.NOT_MATCHES) {
			BinaryOperator operator = token == TokenType.MATCHES ? BinaryOperator.MATCHES : BinaryOperator.NOT_MATCHES;
			int line = current.getLine();
			lexer();
			left = new BinaryExpression(line, operator, left, COMPARISON_EXPRESSION(allowGreaterThan));
		}
		return left;
	}

	// COMPARISON_EXPRESSION = CONCATENATION_EXPRESSION [ (==,<,<=,>,>=,!=) CONCATENATION_EXPRESSION ]
	// (not associative)
	Expression COMPARISON_EXPRESSION(boolean allowGreaterThan) {
		Expression left = CONCATENATION_EXPRESSION(allowGreaterThan);
		BinaryOperator operator;
		switch (token) {
		case EQ:
			operator = BinaryOperator.EQUAL;
			break;
		case NE:
			operator = BinaryOperator.NOT_EQUAL;
			break;
		case LT:
			operator = BinaryOperator.LESS_THAN;
			break;
		case LE:
			operator = BinaryOperator.LESS_OR_EQUAL;
			break;
		case GE:
			operator = BinaryOperator.GREATER_OR_EQUAL;
			break;
		case GT:
			if (!allowGreaterThan) {
				return left;
			}
			operator = BinaryOperator.GREATER_THAN;
			break;
		default:
			return left;
		}
		int line = current.getLine();
		lexer();
		return new BinaryExpression(line, operator, left, CONCATENATION_EXPRESSION(allowGreaterThan));
	}

	// CONCATENATION_EXPRESSION = ADDITIVE_EXPRESSION [ ADDITIVE_EXPRESSION ]...
	Expression CONCATENATION_EXPRESSION(boolean allowGreaterThan) {
		Expression left = ADDITIVE_EXPRESSION(allowGreaterThan);
		while (startsConcatenatedOperand()) {
			int line = current.getLine();
			left = new BinaryExpression(line, BinaryOperator.CONCATENATE, left, ADDITIVE_EXPRESSION(allowGreaterThan));
		}
		return left;
	}

	private boolean startsConcatenatedOperand() {
		switch (token) {
		case NUMBER:
		case STRING:
		case ERE:
		case NAME:
		case FUNC_NAME:
		case BUILTIN_FUNC_NAME:
		case DOLLAR:
		case OPEN_PAREN:
		case INC:
		case DEC:
			return true;
		default:
			return false;
		}
	}

	// ADDITIVE_EXPRESSION = MULTIPLICATIVE_EXPRESSION [ (+,-) MULTIPLICATIVE_EXPRESSION ]...
	Expression ADDITIVE_EXPRESSION(boolean allowGreaterThan) {
		Expression left = MULTIPLICATIVE_EXPRESSION(allowGreaterThan);
		while (token == TokenType.PLUS || token == TokenType.MINUS) {
			BinaryOperator operator = token == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
			int line = current.getLine();
			lexer();
			left = new BinaryExpression(line, operator, left, MULTIPLICATIVE_EXPRESSION(allowGreaterThan));
		}
		return left;
	}

	// MULTIPLICATIVE_EXPRESSION = UNARY_EXPRESSION [ (*,/,%) UNARY_EXPRESSION ]...
	Expression MULTIPLICATIVE_EXPRESSION(boolean allowGreaterThan) {
		Expression left = UNARY_EXPRESSION(allowGreaterThan);
		while (token == TokenType.MULT || token == TokenType.DIVIDE || token == TokenType.MOD) {
			BinaryOperator operator;
			if (token == TokenType.MULT) {
				operator = BinaryOperator.MULTIPLY;
			} else if (token == TokenType.DIVIDE) {
				operator = BinaryOperator.DIVIDE;
			} else {
				operator = BinaryOperator.MODULO;
			}
			int line = current.getLine();
			lexer();
			left = new BinaryExpression(line, operator, left, UNARY_EXPRESSION(allowGreaterThan));
		}
		return left;
	}

	// UNARY_EXPRESSION = (!,-,+) UNARY_EXPRESSION | POWER_EXPRESSION
	Expression UNARY_EXPRESSION(boolean allowGreaterThan) {
		UnaryOperator operator;
		switch (token) {
		case NOT:
			operator = UnaryOperator.NOT;
			break;
		case MINUS:
			operator = UnaryOperator.NEGATE;
			break;
		case PLUS:
			operator = UnaryOperator.PLUS;
			break;
		default:
			return POWER_EXPRESSION(allowGreaterThan);
		}
		int line = current.getLine();
		lexer();
		return new UnaryExpression(line, operator, UNARY_EXPRESSION(allowGreaterThan));
	}

	// POWER_EXPRESSION = INCDEC_EXPRESSION [ ^ UNARY_EXPRESSION ] (right associative)
	Expression POWER_EXPRESSION(boolean allowGreaterThan) {
		Expression base = INCDEC_EXPRESSION(allowGreaterThan);
		if (token != TokenType.POW) {
			return base;
		}
		int line = current.getLine();
		lexer();
		return new BinaryExpression(line, BinaryOperator.POWER, base, UNARY_EXPRESSION(allowGreaterThan));
	}

	// INCDEC_EXPRESSION = (++,--) LVALUE | PRIMARY [ (++,--) ]
	Expression INCDEC_EXPRESSION(boolean allowGreaterThan) {
		if (token == TokenType.INC || token == TokenType.DEC) {
			boolean increment = token == TokenType.INC;
			int line = current.getLine();
			lexer();
			Expression target = PRIMARY(allowGreaterThan);
			if (!target.isLvalue()) {
				throw parserException("Cannot pre inc/dec a non-lvalue");
			}
			return new IncrementDecrement(line, target, increment, true);
		}
		Expression primary = PRIMARY(allowGreaterThan);
		if (primary.isLvalue() && (token == TokenType.INC || token == TokenType.DEC)) {
			boolean increment = token == TokenType.INC;
			int line = current.getLine();
			lexer();
			return new IncrementDecrement(line, primary, increment, false);
		}
		return primary;
	}

	// PRIMARY = NUMBER | STRING | ERE | $ PRIMARY | ( EXPRESSION_LIST ) | NAME [ [ EXPRESSION_LIST ] ]
	// | FUNC_NAME ( [EXPRESSION_LIST] ) | BUILTIN_CALL | GETLINE
	Expression PRIMARY(boolean allowGreaterThan) {
		boolean allowGrouping = groupingAllowed;
		groupingAllowed = false;
		int line = current.getLine();
		switch (token) {
		case NUMBER: {
			double value = Double.parseDouble(text);
			lexer();
			return new NumberLiteral(line, value);
		}
		case STRING: {
			String value = text;
			lexer();
			return new StringLiteral(line, value);
		}
		case ERE: {
			String regex = text;
			lexer();
			return new RegexLiteral(line, regex);
		}
		case DOLLAR: {
			lexer();
			Expression index;
			if (token == TokenType.INC || token == TokenType.DEC) {
				index = INCDEC_EXPRESSION(allowGreaterThan);
			} else if (token == TokenType.MINUS || token == TokenType.NOT || token == TokenType.PLUS) {
				index = UNARY_EXPRESSION(allowGreaterThan);
			} else {
				index = PRIMARY(allowGreaterThan);
			}
			return new FieldReference(line, index);
		}
		case OPEN_PAREN: {
			lexer();
			List<Expression> expressions = EXPRESSION_LIST(true);
			lexer(TokenType.CLOSE_PAREN);
			if (expressions.size() == 1) {
				return expressions.get(0);
			}
			if (token != TokenType.KW_IN && !allowGrouping) {
				throw parserException("Expecting 'in' after a parenthesized expression list. Got " + token.name());
			}
			return new GroupingExpression(line, expressions);
		}
		case NAME: {
			String name = text;
			lexer();
			if (token == TokenType.OPEN_BRACKET) {
				lexer();
				List<Expression> subscripts = EXPRESSION_LIST(true);
				lexer(TokenType.CLOSE_BRACKET);
				markArray(name);
				return new ArrayElement(line, name, subscripts);
			}
			return new VariableReference(line, name);
		}
		case FUNC_NAME: {
			String name = text;
			lexer();
			return new FunctionCall(line, name, ARGUMENTS());
		}
		case BUILTIN_FUNC_NAME:
			return BUILTIN_FUNCTION_CALL();
		case KW_GETLINE:
			return GETLINE_EXPRESSION();
		default:
			throw parserException("Unexpected token " + token.name() + ": " + printable(text));
		}
	}

	// ARGUMENTS = ( [ EXPRESSION_LIST ] )
	List<Expression> ARGUMENTS() {
		lexer(TokenType.OPEN_PAREN);
		optNewline();
		List<Expression> arguments;
		if (token == TokenType.CLOSE_PAREN) {
			arguments = new ArrayList<Expression>();
		} else {
			arguments = EXPRESSION_LIST(true);
			optNewline();
		}
		lexer(TokenType.CLOSE_PAREN);
		return arguments;
	}

	// BUILTIN_CALL = BUILTIN_FUNC_NAME ( [ EXPRESSION_LIST ] ) | length
	Expression BUILTIN_FUNCTION_CALL() {
		int line = current.getLine();
		String name = text;
		BuiltinFunction function = BuiltinFunction.forName(name);
		lexer();
		List<Expression> arguments;
		if (function == BuiltinFunction.LENGTH && token != TokenType.OPEN_PAREN) {
			arguments = new ArrayList<Expression>();
		} else {
			arguments = ARGUMENTS();
		}
		if (!function.acceptsArgumentCount(arguments.size())) {
			throw new ParserException(
					name + "() does not accept " + arguments.size() + " argument(s)",
					current.getSource(),
					line,
					current.getColumn());
		}
		switch (function) {
		case SPLIT:
			if (!(arguments.get(1) instanceof VariableReference)) {
				throw parserException("split(): second argument must be an array name");
			}
			markArray(((VariableReference) arguments.get(1)).getName());
			break;
		case ASORT:
		case ASORTI:
			if (!(arguments.get(0) instanceof VariableReference)) {
				throw parserException(name + "(): argument must be an array name");
			}
			markArray(((VariableReference) arguments.get(0)).getName());
			break;
		case SUB:
		case GSUB:
			if (arguments.size() == 3 && !arguments.get(2).isLvalue()) {
				throw parserException(name + "(): third argument must be a variable, an array element or a field");
			}
			break;
		default:
			break;
		}
		return new FunctionCall(line, name, arguments);
	}

	// GETLINE = getline [ LVALUE ] [ < INCDEC_EXPRESSION ]
	Expression GETLINE_EXPRESSION() {
		int line = current.getLine();
		lexer(TokenType.KW_GETLINE);
		Expression target = null;
		if (token == TokenType.NAME || token == TokenType.DOLLAR) {
			target = PRIMARY(true);
		}
		Expression file = null;
		if (token == TokenType.LT) {
			lexer();
			file = INCDEC_EXPRESSION(true);
		}
		return new GetlineExpression(line, target, file);
	}

	// CHECKSTYLE.ON MethodName
}
