// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.optmodel.parsing;

import com.google.common.collect.ImmutableList;
import com.google.optmodel.ModelException;
import com.google.optmodel.parsing.tokenization.TokenManager;

/** Splits expression text into tokens. Placeholders of the tokenization pipeline are one token. */
public final class ExpressionLexer {
  /** Token kinds. */
  public enum Kind {
    NUMBER,
    STRING,
    IDENT,
    PLACEHOLDER,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    LT,
    LE,
    GT,
    GE,
    EQ,
    NE,
    ASSIGN,
    AND,
    OR,
    NOT,
    QUESTION,
    COLON,
    COMMA,
    SEMICOLON,
    DOT,
    DOTDOT,
    EOF
  }

  /** A token and its offset in the text. */
  public static final class Token {
    private final Kind kind;
    private final String text;
    private final int offset;

    Token(Kind kind, String text, int offset) {
      this.kind = kind;
      this.text = text;
      this.offset = offset;
    }

    public Kind kind() {
      return kind;
    }

    public String text() {
      return text;
    }

    public int offset() {
      return offset;
    }

    public boolean is(Kind other) {
      return kind == other;
    }

    /** Returns true for an identifier spelled {@code word}. */
    public boolean isWord(String word) {
      return kind == Kind.IDENT && text.equals(word);
    }

    @Override
    public String toString() {
      return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
  }

  private final String text;
  private int pos;

  private ExpressionLexer(String text) {
    this.text = text;
  }

  /** Returns the tokens of {@code text}, terminated by an {@link Kind#EOF} token. */
  public static ImmutableList<Token> tokenize(String text) {
    return new ExpressionLexer(text).run();
  }

  private ImmutableList<Token> run() {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (true) {
      skipWhitespace();
      if (pos >= text.length()) {
        tokens.add(new Token(Kind.EOF, "", pos));
        return tokens.build();
      }
      tokens.add(next());
    }
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
  }

  private Token next() {
    int start = pos;
    char c = text.charAt(pos);
    if (Character.isDigit(c)) {
      return number(start);
    }
    if (c == '"') {
      return string(start);
    }
    if (Character.isLetter(c) || c == '_') {
      while (pos < text.length()
          && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
        pos++;
      }
      String word = text.substring(start, pos);
      Kind kind = TokenManager.isPlaceholder(word) ? Kind.PLACEHOLDER : Kind.IDENT;
      return new Token(kind, word, start);
    }
    pos++;
    switch (c) {
      case '+':
        return new Token(Kind.PLUS, "+", start);
      case '-':
        return new Token(Kind.MINUS, "-", start);
      case '*':
        return new Token(Kind.STAR, "*", start);
      case '/':
        return new Token(Kind.SLASH, "/", start);
      case '(':
        return new Token(Kind.LPAREN, "(", start);
      case ')':
        return new Token(Kind.RPAREN, ")", start);
      case '[':
        return new Token(Kind.LBRACKET, "[", start);
      case ']':
        return new Token(Kind.RBRACKET, "]", start);
      case '{':
        return new Token(Kind.LBRACE, "{", start);
      case '}':
        return new Token(Kind.RBRACE, "}", start);
      case '?':
        return new Token(Kind.QUESTION, "?", start);
      case ':':
        return new Token(Kind.COLON, ":", start);
      case ',':
        return new Token(Kind.COMMA, ",", start);
      case ';':
        return new Token(Kind.SEMICOLON, ";", start);
      case '.':
        return match('.') ? new Token(Kind.DOTDOT, "..", start) : new Token(Kind.DOT, ".", start);
      case '<':
        return match('=') ? new Token(Kind.LE, "<=", start) : new Token(Kind.LT, "<", start);
      case '>':
        return match('=') ? new Token(Kind.GE, ">=", start) : new Token(Kind.GT, ">", start);
      case '=':
        return match('=') ? new Token(Kind.EQ, "==", start) : new Token(Kind.ASSIGN, "=", start);
      case '!':
        return match('=') ? new Token(Kind.NE, "!=", start) : new Token(Kind.NOT, "!", start);
      case '&':
        if (match('&')) {
          return new Token(Kind.AND, "&&", start);
        }
        break;
      case '|':
        if (match('|')) {
          return new Token(Kind.OR, "||", start);
        }
        break;
      default:
        break;
    }
    throw new ModelException.MalformedExpression(
        "lex", "unexpected character '" + c + "' at offset " + start + " in \"" + text + "\"");
  }

  private boolean match(char expected) {
    if (pos < text.length() && text.charAt(pos) == expected) {
      pos++;
      return true;
    }
    return false;
  }

  private Token number(int start) {
    while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
      pos++;
    }
    // Only a dot followed by a digit belongs to the number; 1..3 is a range.
    if (pos + 1 < text.length()
        && text.charAt(pos) == '.'
        && Character.isDigit(text.charAt(pos + 1))) {
      pos++;
      while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
        pos++;
      }
    }
    if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
      int mark = pos;
      pos++;
      if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
        pos++;
      }
      if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
          pos++;
        }
      } else {
        pos = mark;
      }
    }
    return new Token(Kind.NUMBER, text.substring(start, pos), start);
  }

  private Token string(int start) {
    pos++;
    while (pos < text.length() && text.charAt(pos) != '"') {
      pos++;
    }
    if (pos >= text.length()) {
      throw new ModelException.MalformedExpression(
          "lex", "unterminated string at offset " + start + " in \"" + text + "\"");
    }
    pos++;
    return new Token(Kind.STRING, text.substring(start + 1, pos - 1), start);
  }
}
