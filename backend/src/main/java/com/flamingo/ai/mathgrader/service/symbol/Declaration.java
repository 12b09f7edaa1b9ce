package com.flamingo.ai.mathgrader.service.symbol;

import java.util.List;
import java.util.Map;

/**
 * One declaration string split into its parts.
 *
 * @param identifiers plain identifier tokens in written order
 * @param nonCommuting identifier tokens marked {@code (name, NC)}, in written order
 * @param domains index domains by letter
 */
record Declaration(
    List<String> identifiers, List<String> nonCommuting, Map<String, IndexDomain> domains) {}
