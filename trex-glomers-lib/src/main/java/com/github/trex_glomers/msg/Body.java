// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.msg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.With;

import java.util.Objects;
import java.util.Set;

/// The body of a message: a type tag, the optional correlation ids and the type specific fields.
///
/// The fields are held as a private JSON object so that the runtime can route and relay bodies it has no record
/// type for. Handlers bind the fields to a payload record with [#payload(Class)] and build replies with
/// [#of(String, Object)].
///
/// @param type      The message type tag such as `broadcast` or `read_ok`.
/// @param msgId     The sender assigned id, unique per sender for the lifetime of its process.
/// @param inReplyTo The `msgId` of the request this body answers.
/// @param fields    Every other field of the body.
@With
public record Body(String type, Long msgId, Long inReplyTo, ObjectNode fields) {
  public static final String TYPE = "type";
  public static final String MSG_ID = "msg_id";
  public static final String IN_REPLY_TO = "in_reply_to";

  static final Set<String> RESERVED = Set.of(TYPE, MSG_ID, IN_REPLY_TO);

  public Body {
    Objects.requireNonNull(type, "type cannot be null");
    if (type.isBlank()) {
      throw new IllegalArgumentException("type cannot be blank");
    }
    if (fields == null) {
      fields = Jsons.mapper().createObjectNode();
    } else {
      for (var name : RESERVED) {
        if (fields.has(name)) {
          throw new IllegalArgumentException("field name is reserved for the envelope: " + name);
        }
      }
      fields = Jsons.normalize(fields);
    }
  }

  public static Body of(String type) {
    return new Body(type, null, null, null);
  }

  /// Builds a body whose fields are the components of the payload record.
  public static Body of(String type, Object payload) {
    final ObjectNode fields = payload == null ? null : Jsons.mapper().valueToTree(payload);
    return new Body(type, null, null, fields);
  }

  public static Body error(int code, String text) {
    final var fields = Jsons.mapper().createObjectNode()
        .put("code", code)
        .put("text", text == null ? "" : text);
    return new Body("error", null, null, fields);
  }

  public static Body error(ErrorCode code, String text) {
    return error(code.code(), text);
  }

  /// @return a copy of the fields so that the body stays immutable.
  @Override
  public ObjectNode fields() {
    return fields.deepCopy();
  }

  /// @return the named field or a missing node.
  public JsonNode field(String name) {
    return fields.path(name).deepCopy();
  }

  public boolean isError() {
    return "error".equals(type);
  }

  /// Binds the fields to a payload record.
  ///
  /// @throws NodeException with [ErrorCode#MALFORMED_REQUEST] when a field is missing or has the wrong shape.
  public <T> T payload(Class<T> payloadType) {
    try {
      return Jsons.mapper().treeToValue(fields, payloadType);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      final var detail = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
      throw new NodeException(ErrorCode.MALFORMED_REQUEST, "malformed " + type + " body: " + detail);
    }
  }
}
