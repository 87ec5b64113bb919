/*
 * Copyright 2026 The Noirfmt Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.noirfmt.fragments;

import dev.noirfmt.ast.Expression;
import dev.noirfmt.chunks.ChunkGroup;

/**
 * Renders initializer expressions. Calls, arrays and tuples break one element per line; a binary
 * expression breaks before its right operand. Everything else stays on one line.
 */
public class StandardExpressionFormatter implements ExpressionFormatter {
  @Override
  public ChunkGroup formatExpression(Expression expression) {
    switch (expression.getKind()) {
      case LITERAL:
        String literal = ((Expression.Literal) expression).text();
        if (literal.isEmpty() || literal.indexOf('\n') >= 0) {
          throw MalformedNodeException.create("malformed literal: '%s'", literal);
        }
        return new ChunkGroup().text(literal);
      case PATH:
        return new ChunkGroup()
            .text(FragmentSupport.checkPath(((Expression.Path) expression).text()));
      case CALL:
        Expression.Call call = (Expression.Call) expression;
        return new ChunkGroup()
            .group(formatExpression(call.callee()))
            .group(
                FragmentSupport.delimited(
                    "(", call.arguments(), ")", false, this::formatExpression));
      case ARRAY:
        return FragmentSupport.delimited(
            "[",
            ((Expression.ArrayLiteral) expression).elements(),
            "]",
            false,
            this::formatExpression);
      case REPEATED_ARRAY:
        Expression.RepeatedArray repeated = (Expression.RepeatedArray) expression;
        return new ChunkGroup()
            .text("[")
            .group(formatExpression(repeated.element()))
            .text("; ")
            .group(formatExpression(repeated.length()))
            .text("]");
      case TUPLE:
        return FragmentSupport.delimited(
            "(", ((Expression.Tuple) expression).elements(), ")", true, this::formatExpression);
      case PARENTHESIZED:
        return new ChunkGroup()
            .text("(")
            .group(formatExpression(((Expression.Parenthesized) expression).inner()))
            .text(")");
      case UNARY:
        Expression.Unary unary = (Expression.Unary) expression;
        return new ChunkGroup().text(unary.operator()).group(formatExpression(unary.operand()));
      case BINARY:
        Expression.Binary binary = (Expression.Binary) expression;
        return new ChunkGroup()
            .group(formatExpression(binary.lhs()))
            .text(" " + binary.operator())
            .line()
            .group(formatExpression(binary.rhs()));
      case MEMBER:
        Expression.Member member = (Expression.Member) expression;
        return new ChunkGroup()
            .group(formatExpression(member.base()))
            .text("." + FragmentSupport.checkMemberName(member.name()));
      case INDEX:
        Expression.Index index = (Expression.Index) expression;
        return new ChunkGroup()
            .group(formatExpression(index.base()))
            .text("[")
            .group(formatExpression(index.index()))
            .text("]");
    }
    throw new AssertionError(expression.getKind());
  }
}
