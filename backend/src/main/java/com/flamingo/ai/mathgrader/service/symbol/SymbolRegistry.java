package com.flamingo.ai.mathgrader.service.symbol;

import com.flamingo.ai.mathgrader.exception.RegistryException;
import com.flamingo.ai.mathgrader.service.normalize.DecoratedIdentifier;
import com.flamingo.ai.mathgrader.service.normalize.SubscriptCanonicalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link SymbolTable} from the parameter and function declaration strings.
 *
 * <p>Identifiers are canonicalized the same way as answers, so {@code c_{s}^{\dagger}} in a
 * declaration and {@code c_s^\dagger} in an answer name the same symbol. A subscript segment equal
 * to a declared index letter is replaced by each value of its domain; tokens with several indices
 * expand to the Cartesian product. Declaring an adjoint also declares its base operator.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SymbolRegistry {

  private final SubscriptCanonicalizer canonicalizer;

  /**
   * Builds the symbol table.
   *
   * @param parameterDeclaration parameter string, may be blank
   * @param functionDeclaration function string, may be blank
   * @throws RegistryException on malformed grammar or a name declared in both strings
   */
  public SymbolTable build(String parameterDeclaration, String functionDeclaration) {
    Map<String, SymbolSpec> symbols = new LinkedHashMap<>();
    register(symbols, parameterDeclaration, SymbolRole.PARAMETER);
    register(symbols, functionDeclaration, SymbolRole.FUNCTION);
    SymbolTable table = new SymbolTable(symbols);
    log.debug("Built symbol table with {} symbol(s)", table.size());
    return table;
  }

  private void register(Map<String, SymbolSpec> symbols, String declaration, SymbolRole role) {
    Declaration parsed = DeclarationParser.parse(declaration);

    Set<String> nonCommuting = new HashSet<>();
    for (String token : parsed.nonCommuting()) {
      for (DecoratedIdentifier id : expand(token, parsed)) {
        nonCommuting.add(plainName(id));
        nonCommuting.add(plainName(id.withoutDagger()));
      }
    }

    List<String> tokens = new ArrayList<>(parsed.identifiers());
    tokens.addAll(parsed.nonCommuting());
    for (String token : tokens) {
      for (DecoratedIdentifier id : expand(token, parsed)) {
        String name = plainName(id);
        put(symbols, new SymbolSpec(name, role, !nonCommuting.contains(name)));
        if (id.dagger()) {
          String base = plainName(id.withoutDagger());
          put(symbols, new SymbolSpec(base, role, !nonCommuting.contains(base)));
        }
      }
    }
  }

  private static void put(Map<String, SymbolSpec> symbols, SymbolSpec spec) {
    SymbolSpec existing = symbols.get(spec.name());
    if (existing == null) {
      symbols.put(spec.name(), spec);
    } else if (existing.role() != spec.role()) {
      throw new RegistryException(
          "Symbol '" + spec.name() + "' is declared both as parameter and as function");
    }
  }

  private List<DecoratedIdentifier> expand(String token, Declaration declaration) {
    DecoratedIdentifier id =
        canonicalizer
            .parseIdentifier(token)
            .orElseThrow(() -> new RegistryException("Malformed identifier '" + token + "'"));
    if (id.exponent() != null) {
      throw new RegistryException("Identifier '" + token + "' must not carry an exponent");
    }

    List<List<String>> combinations = new ArrayList<>();
    combinations.add(id.subscripts());
    for (int position = 0; position < id.subscripts().size(); position++) {
      IndexDomain domain = declaration.domains().get(id.subscripts().get(position));
      if (domain == null) {
        continue;
      }
      List<List<String>> next = new ArrayList<>();
      for (List<String> combination : combinations) {
        for (String value : domain.values()) {
          List<String> substituted = new ArrayList<>(combination);
          substituted.set(position, value);
          next.add(substituted);
        }
      }
      combinations = next;
    }
    return combinations.stream().map(id::withSubscripts).toList();
  }

  /** Canonical name with markup backslashes removed, as it appears after normalization. */
  private static String plainName(DecoratedIdentifier id) {
    return id.name().replace("\\", "");
  }
}
