// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.msg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/// Holder of the single shared `ObjectMapper`. Payload records use Java camel case and the wire uses snake case
/// so `nodeIds` is read from and written to `node_ids`. Missing record components and fractional numbers bound
/// to integral components are binding failures rather than silent defaults.
public final class Jsons {
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
      .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
      .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
      .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .build();

  private Jsons() {
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /// Returns a private copy of the node as the parser would have produced it from the encoded text. This makes
  /// value equality independent of whether a number was built as an int node or a long node.
  static ObjectNode normalize(ObjectNode node) {
    try {
      return (ObjectNode) MAPPER.readTree(MAPPER.writeValueAsString(node));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to copy JSON object", e);
    }
  }
}
