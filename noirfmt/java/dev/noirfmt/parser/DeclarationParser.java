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

package dev.noirfmt.parser;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.noirfmt.ast.Attribute;
import dev.noirfmt.ast.Declaration;
import dev.noirfmt.ast.Expression;
import dev.noirfmt.ast.Keyword;
import dev.noirfmt.ast.Pattern;
import dev.noirfmt.ast.SourceFile;
import dev.noirfmt.ast.TypeNode;
import dev.noirfmt.ast.Visibility;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for files made of let and global declarations:
 *
 * <pre>
 *   comment* attribute* [pub [(crate)]] [comptime] [mut] (global|let) pattern
 *       [: type] [= [comment] expression] ; [comment]
 * </pre>
 *
 * <p>A global binds a single identifier; {@code mut global x} is stored as a {@link
 * Pattern.MutWrapped} around it. A let binds any pattern and keeps {@code mut} inside it. Line
 * comments are accepted on their own lines above a declaration, after an attribute, after the
 * {@code =} and after the {@code ;}; anywhere else they are a syntax error.
 */
public final class DeclarationParser {
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of("pub", "crate", "comptime", "mut", "global", "let", "true", "false");

  private static final ImmutableMap<String, Integer> BINARY_PRECEDENCE =
      ImmutableMap.<String, Integer>builder()
          .put("||", 1)
          .put("&&", 2)
          .put("==", 3)
          .put("!=", 3)
          .put("<", 3)
          .put(">", 3)
          .put("<=", 3)
          .put(">=", 3)
          .put("|", 4)
          .put("^", 5)
          .put("&", 6)
          .put("<<", 7)
          .put(">>", 7)
          .put("+", 8)
          .put("-", 8)
          .put("*", 9)
          .put("/", 9)
          .put("%", 9)
          .buildOrThrow();

  private final String source;
  private final ImmutableList<Token> tokens;
  private int index;

  private DeclarationParser(String source, ImmutableList<Token> tokens) {
    this.source = source;
    this.tokens = tokens;
  }

  /** Parses a whole file. */
  public static SourceFile parseFile(String source) throws ParseException {
    return new DeclarationParser(source, Lexer.tokenize(source)).file();
  }

  /** Parses {@code source}, which must contain exactly one declaration and nothing else. */
  public static SourceFile.Entry parseDeclaration(String source) throws ParseException {
    SourceFile file = parseFile(source);
    if (file.entries().size() != 1 || !file.trailingComments().isEmpty()) {
      throw new ParseException(
          "expected exactly one declaration, found " + file.entries().size(),
          Lexer.tokenize(source).get(0).span());
    }
    return file.entries().get(0);
  }

  private SourceFile file() throws ParseException {
    List<SourceFile.Entry> entries = new ArrayList<>();
    while (true) {
      Token first = tokens.get(index);
      boolean blankLine = !entries.isEmpty() && first.followsBlankLine();
      List<String> comments = new ArrayList<>();
      while (tokens.get(index).kind() == Token.Kind.COMMENT) {
        comments.add(tokens.get(index++).text());
      }
      if (tokens.get(index).kind() == Token.Kind.EOF) {
        return SourceFile.create(entries, comments);
      }
      entries.add(entry(comments, blankLine));
    }
  }

  private SourceFile.Entry entry(List<String> leadingComments, boolean blankLine)
      throws ParseException {
    Declaration.Builder declaration = Declaration.builder().setLeadingComments(leadingComments);

    List<Attribute> attributes = new ArrayList<>();
    while (peek().is("#")) {
      attributes.add(attribute());
    }
    declaration.setAttributes(attributes);

    Visibility visibility = Visibility.PRIVATE;
    Token first = peek();
    if (first.is("pub")) {
      take();
      visibility = Visibility.PUBLIC;
      if (peek().is("(")) {
        expect("(");
        expect("crate");
        expect(")");
        visibility = Visibility.PUBLIC_CRATE;
      }
    }
    declaration.setVisibility(visibility);

    if (peek().is("comptime")) {
      take();
      declaration.setComptime(true);
    }
    boolean mutGlobal = false;
    if (peek().is("mut")) {
      take();
      mutGlobal = true;
    }

    Keyword keyword;
    Token keywordToken = take();
    if (keywordToken.is("global")) {
      keyword = Keyword.GLOBAL;
      Pattern name = Pattern.identifier(identifier());
      declaration.setPattern(mutGlobal ? Pattern.mutWrapped(name) : name);
    } else if (keywordToken.is("let")) {
      keyword = Keyword.LET;
      if (visibility != Visibility.PRIVATE) {
        throw error(first, "a let binding cannot have a visibility");
      }
      if (mutGlobal) {
        throw error(keywordToken, "'mut' of a let binding goes after 'let'");
      }
      declaration.setPattern(pattern());
    } else {
      throw error(
          keywordToken, "expected 'global' or 'let' but found '" + describe(keywordToken) + "'");
    }

    if (peek().is(":")) {
      take();
      declaration.setTypeAnnotation(type());
    }
    if (peek().is("=")) {
      take();
      Optional<String> comment = comment();
      comment.ifPresent(declaration::setAssignmentComment);
      declaration.setInitializer(expression());
    }
    expect(";");
    sameLineComment().ifPresent(declaration::setTrailingComment);

    return SourceFile.Entry.create(keyword, declaration.build(), blankLine);
  }

  private Attribute attribute() throws ParseException {
    expect("#");
    Token open = expect("[");
    List<String> content = new ArrayList<>();
    int depth = 0;
    while (true) {
      Token token = peek();
      if (token.kind() == Token.Kind.EOF) {
        throw error(open, "unterminated attribute");
      }
      take();
      if (token.is("[")) {
        depth++;
      } else if (token.is("]")) {
        if (depth == 0) {
          break;
        }
        depth--;
      }
      content.add(token.text());
    }
    if (content.isEmpty()) {
      throw error(open, "empty attribute");
    }
    return Attribute.create(content, sameLineComment());
  }

  private Pattern pattern() throws ParseException {
    Token token = peek();
    if (token.is("mut")) {
      take();
      Pattern inner = pattern();
      if (inner.getKind() == Pattern.Kind.IDENTIFIER && !inner.asIdentifier().isMut()) {
        return Pattern.identifier(inner.asIdentifier().name(), true);
      }
      return Pattern.mutWrapped(inner);
    }
    if (token.is("(")) {
      take();
      if (peek().is(")")) {
        take();
        return Pattern.tuple(ImmutableList.of());
      }
      Pattern first = pattern();
      if (peek().is(")")) {
        take();
        return Pattern.parenthesized(first);
      }
      List<Pattern> elements = new ArrayList<>();
      elements.add(first);
      while (peek().is(",")) {
        take();
        if (peek().is(")")) {
          break;
        }
        elements.add(pattern());
      }
      expect(")");
      return Pattern.tuple(elements);
    }
    String path = path();
    if (peek().is("{")) {
      take();
      List<Pattern.StructField> fields = new ArrayList<>();
      while (!peek().is("}")) {
        String name = identifier();
        Pattern fieldPattern = Pattern.identifier(name);
        if (peek().is(":")) {
          take();
          fieldPattern = pattern();
        }
        fields.add(Pattern.StructField.create(name, fieldPattern));
        if (!peek().is(",")) {
          break;
        }
        take();
      }
      expect("}");
      return Pattern.struct(path, fields);
    }
    if (path.contains("::")) {
      throw error(token, "expected a binding name but found path '" + path + "'");
    }
    return Pattern.identifier(path);
  }

  private TypeNode type() throws ParseException {
    Token token = peek();
    if (token.is("&")) {
      take();
      boolean isMut = false;
      if (peek().is("mut")) {
        take();
        isMut = true;
      }
      return TypeNode.reference(isMut, type());
    }
    if (token.is("[")) {
      take();
      TypeNode element = type();
      if (peek().is(";")) {
        take();
        Token length = take();
        if (length.kind() != Token.Kind.INTEGER && length.kind() != Token.Kind.IDENTIFIER) {
          throw error(length, "expected an array length but found '" + describe(length) + "'");
        }
        expect("]");
        return TypeNode.array(element, length.text());
      }
      expect("]");
      return TypeNode.slice(element);
    }
    if (token.is("(")) {
      take();
      List<TypeNode> elements = new ArrayList<>();
      boolean trailingComma = false;
      while (!peek().is(")")) {
        elements.add(type());
        trailingComma = peek().is(",");
        if (!trailingComma) {
          break;
        }
        take();
      }
      expect(")");
      if (elements.size() == 1 && !trailingComma) {
        // `(T)` is only grouping.
        return elements.get(0);
      }
      return TypeNode.tuple(elements);
    }
    String path = path();
    List<TypeNode> arguments = new ArrayList<>();
    if (peek().is("<")) {
      take();
      while (!peek().is(">")) {
        if (peek().kind() == Token.Kind.INTEGER) {
          arguments.add(TypeNode.named(take().text()));
        } else {
          arguments.add(type());
        }
        if (!peek().is(",")) {
          break;
        }
        take();
      }
      expect(">");
    }
    return TypeNode.named(path, arguments);
  }

  private Expression expression() throws ParseException {
    return binary(1);
  }

  /** Precedence climbing over left-associative binary operators. */
  private Expression binary(int minPrecedence) throws ParseException {
    Expression lhs = unary();
    while (true) {
      Optional<String> operator = peekBinaryOperator();
      if (!operator.isPresent() || BINARY_PRECEDENCE.get(operator.get()) < minPrecedence) {
        return lhs;
      }
      // One token per operator character.
      index += operator.get().length();
      int precedence = BINARY_PRECEDENCE.get(operator.get());
      lhs = Expression.binary(lhs, operator.get(), binary(precedence + 1));
    }
  }

  /** Joins adjacent punctuation into the longest binary operator starting at the next token. */
  private Optional<String> peekBinaryOperator() throws ParseException {
    Token first = peek();
    if (first.kind() != Token.Kind.PUNCTUATION) {
      return Optional.empty();
    }
    Token second = tokens.get(index + 1);
    if (second.kind() == Token.Kind.PUNCTUATION && first.span().isFollowedBy(second.span())) {
      String pair = first.text() + second.text();
      if (BINARY_PRECEDENCE.containsKey(pair)) {
        return Optional.of(pair);
      }
    }
    return BINARY_PRECEDENCE.containsKey(first.text())
        ? Optional.of(first.text())
        : Optional.empty();
  }

  private Expression unary() throws ParseException {
    if (peek().is("-") || peek().is("!")) {
      return Expression.unary(take().text(), unary());
    }
    return postfix(primary());
  }

  private Expression postfix(Expression base) throws ParseException {
    while (true) {
      if (peek().is("(")) {
        take();
        base = Expression.call(base, expressionList(")"));
      } else if (peek().is(".")) {
        take();
        Token name = take();
        if (name.kind() != Token.Kind.IDENTIFIER && name.kind() != Token.Kind.INTEGER) {
          throw error(name, "expected a field name but found '" + describe(name) + "'");
        }
        base = Expression.member(base, name.text());
      } else if (peek().is("[")) {
        take();
        Expression index = expression();
        expect("]");
        base = Expression.index(base, index);
      } else {
        return base;
      }
    }
  }

  private Expression primary() throws ParseException {
    Token token = peek();
    switch (token.kind()) {
      case INTEGER:
      case STRING:
        return Expression.literal(take().text());
      case IDENTIFIER:
        if (token.is("true") || token.is("false")) {
          return Expression.literal(take().text());
        }
        return Expression.path(path());
      default:
        break;
    }
    if (token.is("[")) {
      take();
      if (peek().is("]")) {
        take();
        return Expression.array(ImmutableList.of());
      }
      Expression first = expression();
      if (peek().is(";")) {
        take();
        Expression length = expression();
        expect("]");
        return Expression.repeatedArray(first, length);
      }
      List<Expression> elements = new ArrayList<>();
      elements.add(first);
      if (peek().is(",")) {
        take();
        elements.addAll(expressionList("]"));
      } else {
        expect("]");
      }
      return Expression.array(elements);
    }
    if (token.is("(")) {
      take();
      if (peek().is(")")) {
        take();
        return Expression.tuple(ImmutableList.of());
      }
      Expression first = expression();
      if (peek().is(")")) {
        take();
        return Expression.parenthesized(first);
      }
      expect(",");
      List<Expression> elements = new ArrayList<>();
      elements.add(first);
      elements.addAll(expressionList(")"));
      return Expression.tuple(elements);
    }
    throw error(token, "expected an expression but found '" + describe(token) + "'");
  }

  /** Parses {@code expr, expr, ...} up to and including {@code close}; a trailing comma is fine. */
  private List<Expression> expressionList(String close) throws ParseException {
    List<Expression> elements = new ArrayList<>();
    while (!peek().is(close)) {
      elements.add(expression());
      if (!peek().is(",")) {
        break;
      }
      take();
    }
    expect(close);
    return elements;
  }

  private String path() throws ParseException {
    StringBuilder path = new StringBuilder(identifier());
    while (peek().is("::")) {
      take();
      path.append("::").append(identifier());
    }
    return path.toString();
  }

  private String identifier() throws ParseException {
    Token token = take();
    if (token.kind() != Token.Kind.IDENTIFIER || RESERVED.contains(token.text())) {
      throw error(token, "expected an identifier but found '" + describe(token) + "'");
    }
    return token.text();
  }

  /** Takes a comment at the current position, whether or not it starts a new line. */
  private Optional<String> comment() {
    Token token = tokens.get(index);
    if (token.kind() != Token.Kind.COMMENT) {
      return Optional.empty();
    }
    index++;
    return Optional.of(token.text());
  }

  /** Takes a comment only if it continues the current line. */
  private Optional<String> sameLineComment() {
    Token token = tokens.get(index);
    if (token.kind() != Token.Kind.COMMENT || token.newlinesBefore() > 0) {
      return Optional.empty();
    }
    index++;
    return Optional.of(token.text());
  }

  /** Returns the next token, rejecting comments in places that cannot hold one. */
  private Token peek() throws ParseException {
    Token token = tokens.get(index);
    if (token.kind() == Token.Kind.COMMENT) {
      throw error(token, "comments are not supported inside a declaration");
    }
    return token;
  }

  private Token take() throws ParseException {
    Token token = peek();
    if (token.kind() != Token.Kind.EOF) {
      index++;
    }
    return token;
  }

  private Token expect(String text) throws ParseException {
    Token token = take();
    if (!token.is(text)) {
      throw error(token, "expected '" + text + "' but found '" + describe(token) + "'");
    }
    return token;
  }

  private static String describe(Token token) {
    return token.kind() == Token.Kind.EOF ? "end of input" : token.text();
  }

  private ParseException error(Token token, String message) {
    return ParseException.at(source, token.span(), message);
  }
}
