package com.flamingo.ai.mathgrader.service.normalize;

import java.util.List;

/**
 * An identifier with its subscripts and annotations separated out.
 *
 * @param base letter or markup command the decorations attach to, e.g. {@code c} or {@code \psi}
 * @param subscripts subscript segments in written order, without duplicates
 * @param primes number of prime marks
 * @param dagger whether the identifier carries an adjoint annotation
 * @param exponent superscript that is not an annotation (kept as a power), or {@code null}
 */
public record DecoratedIdentifier(
    String base, List<String> subscripts, int primes, boolean dagger, String exponent) {

  /** Marker appended to canonical names of adjoint operators. */
  public static final String DAGGER = "†";

  public DecoratedIdentifier {
    subscripts = List.copyOf(subscripts);
  }

  /** True when there is anything to fold into the name. */
  public boolean isDecorated() {
    return !subscripts.isEmpty() || primes > 0 || dagger;
  }

  /** Canonical name without the exponent, e.g. {@code c_R_i_up†}. */
  public String name() {
    StringBuilder sb = new StringBuilder(base);
    for (String subscript : subscripts) {
      sb.append('_').append(subscript);
    }
    sb.append("'".repeat(primes));
    if (dagger) {
      sb.append(DAGGER);
    }
    return sb.toString();
  }

  /** Canonical text: the name followed by the exponent, if any. */
  public String render() {
    return exponent == null ? name() : name() + "^{" + exponent + "}";
  }

  public DecoratedIdentifier withSubscripts(List<String> newSubscripts) {
    return new DecoratedIdentifier(base, newSubscripts, primes, dagger, exponent);
  }

  public DecoratedIdentifier withoutDagger() {
    return new DecoratedIdentifier(base, subscripts, primes, false, exponent);
  }
}
