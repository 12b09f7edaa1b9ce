package com.flamingo.ai.mathgrader.service.equivalence;

import java.util.List;
import java.util.stream.Collectors;

/** A numeric literal answer: a number or a tuple, list or set of literals. */
public interface LiteralValue {

  /** A real number. */
  record Number(double value) implements LiteralValue {
    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  /** Parenthesized or bare comma-separated values. */
  record Tuple(List<LiteralValue> elements) implements LiteralValue {
    public Tuple {
      elements = List.copyOf(elements);
    }

    @Override
    public String toString() {
      return join("(", elements, ")");
    }
  }

  /** Values in square brackets. */
  record Sequence(List<LiteralValue> elements) implements LiteralValue {
    public Sequence {
      elements = List.copyOf(elements);
    }

    @Override
    public String toString() {
      return join("[", elements, "]");
    }
  }

  /** Values in braces; members are kept in written order and may repeat. */
  record Set(List<LiteralValue> elements) implements LiteralValue {
    public Set {
      elements = List.copyOf(elements);
    }

    @Override
    public String toString() {
      return join("{", elements, "}");
    }
  }

  private static String join(String open, List<LiteralValue> elements, String close) {
    return elements.stream().map(Object::toString).collect(Collectors.joining(", ", open, close));
  }
}
