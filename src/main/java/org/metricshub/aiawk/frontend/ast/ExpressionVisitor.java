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
 * Operations over expression nodes.
 *
 * @param <R> result of the operation
 */
public interface ExpressionVisitor<R> {

	R visit(NumberLiteral node);

	R visit(StringLiteral node);

	R visit(RegexLiteral node);

	R visit(VariableReference node);

	R visit(ArrayElement node);

	R visit(FieldReference node);

	R visit(Assignment node);

	R visit(IncrementDecrement node);

	R visit(BinaryExpression node);

	R visit(UnaryExpression node);

	R visit(TernaryExpression node);

	R visit(InExpression node);

	R visit(FunctionCall node);

	R visit(GetlineExpression node);

	R visit(GroupingExpression node);
}
