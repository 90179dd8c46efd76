package sid.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recursive-descent parser for the expression grammar:
 *
 * <pre>
 * Expr := Word '(' Expr (',' Expr)* ')' | Word
 * Word := '$'? (letter | '_') (letter | digit | '_')* | 'S+' | 'S-'
 * </pre>
 *
 * <p>A word followed by {@code (} must name an {@link OperatorKind}; any other word is an atom.
 * Nesting deeper than {@link #MAX_DEPTH} operators is rejected.
 */
public final class ExprParser {
  public static final int MAX_DEPTH = 1000;

  private final String text;
  private final List<Token> tokens;
  private int index;
  private int depth;

  private ExprParser(String text, List<Token> tokens) {
    this.text = text;
    this.tokens = tokens;
  }

  public static Expr parse(String text) throws ParseException {
    Objects.requireNonNull(text, "text");
    ExprParser parser = new ExprParser(text, tokenize(text));
    return parser.parseAll();
  }

  private Expr parseAll() throws ParseException {
    if (tokens.isEmpty()) {
      throw new ParseException("Empty expression", 0);
    }
    Expr expr = parseExpr();
    Token trailing = peek();
    if (trailing != null) {
      throw new ParseException(
          "Unexpected trailing input '" + trailing.text() + "'", trailing.pos());
    }
    return expr;
  }

  private Expr parseExpr() throws ParseException {
    Token token = peek();
    if (token == null) {
      throw new ParseException("Unexpected end of input", text.length());
    }
    if (token.kind() != TokenKind.WORD) {
      throw new ParseException("Expected expression but found '" + token.text() + "'", token.pos());
    }
    index++;
    String word = token.text();
    Optional<OperatorKind> operator = OperatorKind.applicable(word);
    Token next = peek();
    if (next == null || next.kind() != TokenKind.LPAREN) {
      if (operator.isPresent()) {
        throw arityError(operator.get(), 0, token.pos());
      }
      return new Atom(word);
    }
    if (operator.isEmpty()) {
      throw new ParseException("Unknown operator '" + word + "'", token.pos());
    }
    index++;
    if (++depth > MAX_DEPTH) {
      throw new ParseException(
          "Expression nested deeper than " + MAX_DEPTH + " operators", token.pos());
    }
    List<Expr> args = new ArrayList<>();
    if (peekKind() != TokenKind.RPAREN) {
      args.add(parseExpr());
      while (peekKind() == TokenKind.COMMA) {
        index++;
        args.add(parseExpr());
      }
    }
    depth--;
    Token close = peek();
    if (close == null) {
      throw new ParseException("Unbalanced parentheses: missing ')'", text.length());
    }
    if (close.kind() != TokenKind.RPAREN) {
      throw new ParseException("Expected ')' but found '" + close.text() + "'", close.pos());
    }
    index++;
    OperatorKind kind = operator.get();
    if (!kind.accepts(args.size())) {
      throw arityError(kind, args.size(), token.pos());
    }
    return new Op(kind, args);
  }

  private static ParseException arityError(OperatorKind kind, int count, int pos) {
    return new ParseException(
        kind.symbol() + " requires " + kind.arityDescription() + ", got " + count, pos);
  }

  private Token peek() {
    return index < tokens.size() ? tokens.get(index) : null;
  }

  private TokenKind peekKind() {
    Token token = peek();
    return token == null ? null : token.kind();
  }

  private static List<Token> tokenize(String text) throws ParseException {
    List<Token> tokens = new ArrayList<>();
    int pos = 0;
    while (pos < text.length()) {
      char ch = text.charAt(pos);
      if (Character.isWhitespace(ch)) {
        pos++;
        continue;
      }
      switch (ch) {
        case '(' -> tokens.add(new Token(TokenKind.LPAREN, "(", pos++));
        case ')' -> tokens.add(new Token(TokenKind.RPAREN, ")", pos++));
        case ',' -> tokens.add(new Token(TokenKind.COMMA, ",", pos++));
        default -> {
          if (!isWordStart(ch)) {
            throw new ParseException("Unexpected character '" + ch + "'", pos);
          }
          int start = pos;
          pos++;
          if (ch == '$') {
            if (pos >= text.length() || !isIdentifierStart(text.charAt(pos))) {
              throw new ParseException("Incomplete variable name", start);
            }
            pos++;
          }
          while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
          }
          if (pos - start == 1
              && ch == 'S'
              && pos < text.length()
              && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
            pos++;
          }
          tokens.add(new Token(TokenKind.WORD, text.substring(start, pos), start));
        }
      }
    }
    return tokens;
  }

  private static boolean isWordStart(char ch) {
    return ch == '$' || isIdentifierStart(ch);
  }

  private static boolean isIdentifierStart(char ch) {
    return Character.isLetter(ch) || ch == '_';
  }

  private static boolean isIdentifierPart(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_';
  }

  private enum TokenKind {
    WORD,
    LPAREN,
    RPAREN,
    COMMA
  }

  private record Token(TokenKind kind, String text, int pos) {}
}
