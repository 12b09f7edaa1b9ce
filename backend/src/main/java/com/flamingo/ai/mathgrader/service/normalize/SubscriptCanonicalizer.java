package com.flamingo.ai.mathgrader.service.normalize;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Rewrites decorated identifiers into one canonical token.
 *
 * <p>{@code c^\dagger_i}, {@code c_i^{\dagger}} and {@code c_{i}^\dag} all become {@code c_i†};
 * <code>c_{R_i,&#92;uparrow}</code> becomes {@code c_R_i_uparrow}. Subscripts come first, then
 * primes, then the dagger. A superscript that is not an annotation stays attached as a power.
 * Identifiers without subscripts or annotations are left exactly as written.
 */
@Component
public class SubscriptCanonicalizer {

  private static final Set<String> DAGGER_MARKS = Set.of("\\dagger", "\\dag", "†");
  private static final Set<String> PRIME_MARKS = Set.of("\\prime", "'");

  /** Canonicalizes every decorated identifier in {@code text}. */
  public String canonicalize(String text) {
    StringBuilder out = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      int baseEnd = baseEnd(text, i);
      if (baseEnd < 0) {
        out.append(text.charAt(i));
        i++;
        continue;
      }
      Scan scan = scanModifiers(text, text.substring(i, baseEnd), baseEnd);
      if (scan == null || !scan.identifier.isDecorated()) {
        out.append(text, i, baseEnd);
        i = baseEnd;
        continue;
      }
      out.append(scan.identifier.render());
      i = scan.end;
      if (i < text.length() && Character.isLetterOrDigit(text.charAt(i))) {
        out.append(' ');
      }
    }
    return out.toString();
  }

  /**
   * Parses a whole declaration token as one identifier.
   *
   * @return the identifier, or empty when the token is not a single (possibly decorated) identifier
   */
  public Optional<DecoratedIdentifier> parseIdentifier(String token) {
    String text = token.trim();
    if (text.isEmpty()) {
      return Optional.empty();
    }
    int baseEnd = baseEnd(text, 0);
    if (baseEnd < 0) {
      return Optional.empty();
    }
    String base = text.substring(0, baseEnd);
    // multi-letter bases such as "psi" or "R" are allowed in declarations
    while (baseEnd < text.length()
        && (Character.isLetterOrDigit(text.charAt(baseEnd)))
        && !base.startsWith("\\")) {
      baseEnd++;
      base = text.substring(0, baseEnd);
    }
    Scan scan = scanModifiers(text, base, baseEnd);
    if (scan == null) {
      return baseEnd == text.length()
          ? Optional.of(new DecoratedIdentifier(base, List.of(), 0, false, null))
          : Optional.empty();
    }
    return scan.end == text.length() ? Optional.of(scan.identifier) : Optional.empty();
  }

  /** End of a base at {@code i}: a markup command or a single letter; -1 if there is none. */
  private static int baseEnd(String text, int i) {
    char c = text.charAt(i);
    if (c == '\\') {
      int j = i + 1;
      while (j < text.length() && Character.isLetter(text.charAt(j))) {
        j++;
      }
      return j > i + 1 ? j : -1;
    }
    return isAsciiLetter(c) ? i + 1 : -1;
  }

  private Scan scanModifiers(String text, String base, int start) {
    Set<String> subscripts = new LinkedHashSet<>();
    int primes = 0;
    boolean dagger = false;
    String exponent = null;
    int i = start;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '\'') {
        primes++;
        i++;
      } else if (text.startsWith(DecoratedIdentifier.DAGGER, i)) {
        dagger = !dagger;
        i += DecoratedIdentifier.DAGGER.length();
      } else if (c == '_') {
        Group group = readGroup(text, i + 1, true);
        if (group == null) {
          break;
        }
        for (String segment : splitSegments(group.content)) {
          String clean = sanitize(segment);
          if (!clean.isEmpty()) {
            subscripts.add(clean);
          }
        }
        i = group.end;
      } else if (c == '^') {
        Group group = readGroup(text, i + 1, false);
        if (group == null) {
          break;
        }
        List<String> marks = annotationMarks(group.content);
        if (marks != null) {
          for (String mark : marks) {
            if (PRIME_MARKS.contains(mark)) {
              primes++;
            } else {
              dagger = !dagger;
            }
          }
        } else if (exponent == null) {
          exponent = group.content.trim();
        } else {
          break;
        }
        i = group.end;
      } else {
        break;
      }
    }
    if (i == start) {
      return null;
    }
    return new Scan(
        new DecoratedIdentifier(base, new ArrayList<>(subscripts), primes, dagger, exponent), i);
  }

  /**
   * Reads a sub/superscript argument: a braced group, a markup command, or (for subscripts) a run
   * of letters and digits joined by underscores, or (for superscripts) one character.
   */
  private static Group readGroup(String text, int start, boolean subscript) {
    if (start >= text.length()) {
      return null;
    }
    char c = text.charAt(start);
    if (c == '{') {
      int depth = 0;
      for (int j = start; j < text.length(); j++) {
        char d = text.charAt(j);
        if (d == '{') {
          depth++;
        } else if (d == '}') {
          depth--;
          if (depth == 0) {
            return new Group(text.substring(start + 1, j), j + 1);
          }
        }
      }
      return null;
    }
    if (c == '\\') {
      int j = start + 1;
      while (j < text.length() && Character.isLetter(text.charAt(j))) {
        j++;
      }
      return j > start + 1 ? new Group(text.substring(start, j), j) : null;
    }
    if (subscript) {
      int j = start;
      while (j < text.length()) {
        char d = text.charAt(j);
        if (isAsciiLetter(d) || Character.isDigit(d)) {
          j++;
        } else if (d == '_'
            && j + 1 < text.length()
            && j > start
            && (isAsciiLetter(text.charAt(j + 1)) || Character.isDigit(text.charAt(j + 1)))) {
          j++;
        } else {
          break;
        }
      }
      return j > start ? new Group(text.substring(start, j), j) : null;
    }
    if (c == '(' || Character.isWhitespace(c)) {
      return null;
    }
    if (c == '-' && start + 1 < text.length() && Character.isDigit(text.charAt(start + 1))) {
      return new Group(text.substring(start, start + 2), start + 2);
    }
    if (text.startsWith(DecoratedIdentifier.DAGGER, start)) {
      return new Group(DecoratedIdentifier.DAGGER, start + DecoratedIdentifier.DAGGER.length());
    }
    return new Group(String.valueOf(c), start + 1);
  }

  /** Splits a superscript into annotation marks, or returns null if it holds anything else. */
  private static List<String> annotationMarks(String content) {
    List<String> marks = new ArrayList<>();
    String rest = content.replace(" ", "");
    while (!rest.isEmpty()) {
      String found = null;
      for (String mark : List.of("\\dagger", "\\dag", "†", "\\prime", "'")) {
        if (rest.startsWith(mark)) {
          found = mark;
          break;
        }
      }
      if (found == null || (found.startsWith("\\") && continuesCommand(rest, found.length()))) {
        return null;
      }
      marks.add(found);
      rest = rest.substring(found.length());
    }
    return marks.isEmpty() ? null : marks;
  }

  private static boolean continuesCommand(String text, int at) {
    return at < text.length() && Character.isLetter(text.charAt(at));
  }

  private static List<String> splitSegments(String content) {
    List<String> segments = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < content.length(); i++) {
      char c = content.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
      } else if (c == ',' && depth == 0) {
        segments.add(content.substring(start, i));
        start = i + 1;
      }
    }
    segments.add(content.substring(start));
    return segments;
  }

  /** Reduces a subscript segment to identifier characters. */
  public static String sanitize(String segment) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < segment.length(); i++) {
      char c = segment.charAt(i);
      if (isAsciiLetter(c) || Character.isDigit(c) || c == '_') {
        sb.append(c);
      } else if (c == '+') {
        sb.append('p');
      } else if (c == '-') {
        sb.append('m');
      }
    }
    String result = sb.toString();
    while (result.startsWith("_")) {
      result = result.substring(1);
    }
    while (result.endsWith("_")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private record Group(String content, int end) {}

  private record Scan(DecoratedIdentifier identifier, int end) {}
}
