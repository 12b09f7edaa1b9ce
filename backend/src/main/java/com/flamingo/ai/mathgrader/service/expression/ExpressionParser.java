package com.flamingo.ai.mathgrader.service.expression;

import com.flamingo.ai.mathgrader.exception.ExpressionParseException;
import com.flamingo.ai.mathgrader.service.normalize.DecoratedIdentifier;
import com.flamingo.ai.mathgrader.service.symbol.SymbolSpec;
import com.flamingo.ai.mathgrader.service.symbol.SymbolTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Parses canonical expression text into an {@link Expr} under a symbol table.
 *
 * <p>Accepts implicit multiplication ({@code 2x}, {@code x y}, {@code m(x+1)}) and implicit
 * function application ({@code sin x}). An undeclared alphabetic name of several letters that is
 * not a known function, constant or Greek letter is read as a product of single-letter symbols.
 * A top-level {@code =} keeps only its right-hand side; a top-level comma keeps only the first part.
 */
@Component
public class ExpressionParser {

  private static final Set<String> GREEK_LETTERS =
      Set.of(
          "alpha", "beta", "gamma", "delta", "epsilon", "varepsilon", "zeta", "eta", "theta",
          "vartheta", "iota", "kappa", "lambda", "mu", "nu", "xi", "omicron", "rho", "varrho",
          "sigma", "varsigma", "tau", "upsilon", "phi", "varphi", "chi", "psi", "omega", "Gamma",
          "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi", "Omega");

  /**
   * Parses one canonical sub-answer.
   *
   * @throws ExpressionParseException if the text is not a well-formed expression
   */
  public Expr parse(String canonicalText, SymbolTable table) {
    String text = selectExpression(canonicalText);
    return new Parser(text, Lexer.tokenize(text), table).parseAll();
  }

  /** Applies the {@code =} and comma rules to the top level of {@code text}. */
  static String selectExpression(String text) {
    List<String> sides = splitTopLevel(text, '=');
    if (sides.size() > 2) {
      throw new ExpressionParseException("Multiple '=' signs found in '" + text + "'");
    }
    String expression = sides.get(sides.size() - 1);
    List<String> parts = splitTopLevel(expression, ',');
    if (parts.size() > 2) {
      throw new ExpressionParseException("Too many comma-separated parts in '" + text + "'");
    }
    String selected = parts.get(0).trim();
    if (selected.isEmpty()) {
      throw new ExpressionParseException("Empty expression in '" + text + "'");
    }
    return selected;
  }

  private static List<String> splitTopLevel(String text, char separator) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == separator && depth == 0) {
        parts.add(text.substring(start, i));
        start = i + 1;
      }
    }
    parts.add(text.substring(start));
    return parts;
  }

  /** Recursive-descent parser over one token list. */
  private static final class Parser {

    private final String text;
    private final List<Token> tokens;
    private final SymbolTable table;
    private int pos;

    Parser(String text, List<Token> tokens, SymbolTable table) {
      this.text = text;
      this.tokens = tokens;
      this.table = table;
    }

    Expr parseAll() {
      Expr expr = parseSum();
      if (!peek().is(Token.Type.EOF)) {
        throw error("Unexpected '" + peek().text() + "'");
      }
      return expr;
    }

    private Expr parseSum() {
      List<Expr> terms = new ArrayList<>();
      terms.add(parseProduct());
      while (peek().is(Token.Type.PLUS) || peek().is(Token.Type.MINUS)) {
        boolean minus = next().is(Token.Type.MINUS);
        Expr term = parseProduct();
        terms.add(minus ? Mul.negate(term) : term);
      }
      return terms.size() == 1 ? terms.get(0) : new Add(terms);
    }

    private Expr parseProduct() {
      List<Expr> factors = new ArrayList<>();
      factors.add(parseUnary());
      while (true) {
        Token t = peek();
        if (t.is(Token.Type.STAR)) {
          next();
          factors.add(parseUnary());
        } else if (t.is(Token.Type.SLASH)) {
          next();
          factors.add(new Pow(parseUnary(), Num.of(-1)));
        } else if (t.startsFactor()) {
          factors.add(parsePower());
        } else {
          break;
        }
      }
      return factors.size() == 1 ? factors.get(0) : new Mul(factors);
    }

    private Expr parseUnary() {
      if (peek().is(Token.Type.MINUS)) {
        next();
        return Mul.negate(parseUnary());
      }
      if (peek().is(Token.Type.PLUS)) {
        next();
        return parseUnary();
      }
      return parsePower();
    }

    private Expr parsePower() {
      Expr base = parsePrimary();
      if (peek().is(Token.Type.CARET)) {
        next();
        return new Pow(base, parseUnary());
      }
      return base;
    }

    private Expr parsePrimary() {
      Token t = next();
      switch (t.type()) {
        case NUMBER:
          return new Num(Rational.parse(t.text()));
        case LPAREN:
          Expr inner = parseSum();
          expect(Token.Type.RPAREN);
          return inner;
        case IDENT:
          return parseIdentifier(t);
        case EOF:
          throw error("Unexpected end of expression");
        default:
          throw new ExpressionParseException("Unexpected '" + t.text() + "'", text, t.position());
      }
    }

    private Expr parseIdentifier(Token token) {
      String name = token.text();
      boolean dagger = false;
      while (name.endsWith(DecoratedIdentifier.DAGGER)) {
        name = name.substring(0, name.length() - DecoratedIdentifier.DAGGER.length());
        dagger = !dagger;
      }
      if (dagger && name.isEmpty()) {
        throw new ExpressionParseException("Dagger without operand", text, token.position());
      }

      List<Object> pieces = resolve(name, token.text());
      List<Expr> factors = new ArrayList<>();
      for (int i = 0; i < pieces.size(); i++) {
        Object piece = pieces.get(i);
        boolean last = i == pieces.size() - 1;
        Expr expr;
        if (piece instanceof FunctionRef ref) {
          if (!last && ref.builtin() != null) {
            throw new ExpressionParseException(
                "Function '" + ref.name() + "' needs an argument", text, token.position());
          }
          expr = last ? applyFunction(ref) : call(ref, List.of());
        } else {
          expr = (Expr) piece;
        }
        if (last && dagger) {
          expr = new Dagger(expr);
        }
        factors.add(expr);
      }
      return factors.size() == 1 ? factors.get(0) : new Mul(factors);
    }

    private Expr applyFunction(FunctionRef ref) {
      if (peek().is(Token.Type.LPAREN)) {
        next();
        List<Expr> args = new ArrayList<>();
        args.add(parseSum());
        while (peek().is(Token.Type.COMMA)) {
          next();
          args.add(parseSum());
        }
        expect(Token.Type.RPAREN);
        if (ref.builtin() != null && args.size() != 1) {
          throw error("Function '" + ref.name() + "' takes one argument");
        }
        return call(ref, args);
      }
      if (ref.builtin() != null) {
        if (!peek().startsFactor() && !peek().is(Token.Type.MINUS)) {
          throw error("Function '" + ref.name() + "' needs an argument");
        }
        return call(ref, List.of(parseUnary()));
      }
      return call(ref, List.of());
    }

    private static Expr call(FunctionRef ref, List<Expr> args) {
      return new Call(ref.name(), args, ref.builtin(), ref.commutative());
    }

    /** Resolves a name to symbols, constants and function references. */
    private List<Object> resolve(String name, String original) {
      Object single = resolveWhole(name, original);
      if (single != null) {
        return List.of(single);
      }
      List<Object> pieces = new ArrayList<>();
      int i = 0;
      while (i < name.length()) {
        int end = i + 1;
        Object found = null;
        for (int j = name.length(); j > i + 1; j--) {
          Object candidate = resolveKnown(name.substring(i, j));
          if (candidate != null) {
            found = candidate;
            end = j;
            break;
          }
        }
        if (found == null) {
          String letter = name.substring(i, i + 1);
          found = Optional.ofNullable(resolveKnown(letter)).orElse(new Sym(letter, true));
        }
        pieces.add(found);
        i = end;
      }
      return pieces;
    }

    private Object resolveWhole(String name, String original) {
      Object known = resolveKnown(name);
      if (known != null) {
        return known;
      }
      // the full token, dagger included, may itself be declared
      if (!original.equals(name) && table.contains(original)) {
        SymbolSpec spec = table.lookup(original).orElseThrow();
        return spec.isFunction()
            ? new FunctionRef(name, null, spec.commuting())
            : new Sym(name, spec.commuting());
      }
      boolean splittable = name.length() > 1 && name.chars().allMatch(Character::isLetter);
      return splittable ? null : new Sym(name, true);
    }

    private Object resolveKnown(String name) {
      Optional<SymbolSpec> spec = table.lookup(name);
      if (spec.isPresent()) {
        return spec.get().isFunction()
            ? new FunctionRef(name, null, spec.get().commuting())
            : new Sym(name, spec.get().commuting());
      }
      BuiltinFunction builtin = BuiltinFunction.byName(name);
      if (builtin != null) {
        return new FunctionRef(name, builtin, true);
      }
      Constant constant = Constant.bySymbol(name);
      if (constant != null) {
        return constant;
      }
      if (GREEK_LETTERS.contains(name)) {
        return new Sym(name, true);
      }
      return null;
    }

    private Token peek() {
      return tokens.get(pos);
    }

    private Token next() {
      Token t = tokens.get(pos);
      if (!t.is(Token.Type.EOF)) {
        pos++;
      }
      return t;
    }

    private void expect(Token.Type type) {
      Token t = next();
      if (!t.is(type)) {
        throw new ExpressionParseException(
            "Expected " + type + " but found '" + t.text() + "'", text, t.position());
      }
    }

    private ExpressionParseException error(String message) {
      return new ExpressionParseException(message, text, peek().position());
    }
  }

  private record FunctionRef(String name, BuiltinFunction builtin, boolean commutative) {}
}
