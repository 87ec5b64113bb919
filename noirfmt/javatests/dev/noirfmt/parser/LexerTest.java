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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import dev.noirfmt.util.Span;
import java.util.List;
import java.util.stream.Collectors;
import junit.framework.TestCase;

/** Unit tests for {@link Lexer}. */
public final class LexerTest extends TestCase {

  private static List<String> texts(String source) throws ParseException {
    return Lexer.tokenize(source).stream().map(Token::text).collect(Collectors.toList());
  }

  public void testDeclaration() throws ParseException {
    assertThat(texts("pub global x: Field = 0x1F;"))
        .containsExactly("pub", "global", "x", ":", "Field", "=", "0x1F", ";", "")
        .inOrder();
  }

  public void testKinds() throws ParseException {
    ImmutableList<Token> tokens = Lexer.tokenize("a 1 \"s\" ; // c");
    assertThat(tokens.stream().map(Token::kind).collect(Collectors.toList()))
        .containsExactly(
            Token.Kind.IDENTIFIER,
            Token.Kind.INTEGER,
            Token.Kind.STRING,
            Token.Kind.PUNCTUATION,
            Token.Kind.COMMENT,
            Token.Kind.EOF)
        .inOrder();
    assertThat(tokens.get(0).span()).isEqualTo(new Span(0, 1));
  }

  public void testOperatorsAreSingleCharacters() throws ParseException {
    assertThat(texts("a>>b::c")).containsExactly("a", ">", ">", "b", "::", "c", "").inOrder();
  }

  public void testCommentsAreTrimmed() throws ParseException {
    assertThat(texts("// hello  \t\nx")).containsExactly("// hello", "x", "").inOrder();
  }

  public void testNewlinesBefore() throws ParseException {
    ImmutableList<Token> tokens = Lexer.tokenize("a\nb\n\n  c");
    assertThat(tokens.get(0).newlinesBefore()).isEqualTo(0);
    assertThat(tokens.get(1).newlinesBefore()).isEqualTo(1);
    assertThat(tokens.get(2).newlinesBefore()).isEqualTo(2);
    assertThat(tokens.get(2).followsBlankLine()).isTrue();
    assertThat(tokens.get(1).followsBlankLine()).isFalse();
  }

  public void testStringEscapes() throws ParseException {
    assertThat(texts("\"a\\\"b\"")).containsExactly("\"a\\\"b\"", "").inOrder();
    assertThat(Lexer.tokenize("\"let\"").get(0).is("let")).isFalse();
  }

  public void testErrors() {
    ParseException e = assertThrows(ParseException.class, () -> Lexer.tokenize("x = @;"));
    assertThat(e).hasMessageThat().isEqualTo("1:5: unexpected character '@'");
    assertThat(e.getSpan().getStart()).isEqualTo(4);

    e = assertThrows(ParseException.class, () -> Lexer.tokenize("x\n/* c */"));
    assertThat(e).hasMessageThat().isEqualTo("2:1: block comments are not supported");

    e = assertThrows(ParseException.class, () -> Lexer.tokenize("\"open\n\""));
    assertThat(e).hasMessageThat().contains("unterminated string literal");
  }
}
