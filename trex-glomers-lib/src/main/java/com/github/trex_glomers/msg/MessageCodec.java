// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.trex_glomers.msg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/// Converts between a [Message] and the single line of JSON that carries it. Framing is by line so encoded
/// messages never contain a line terminator. Jackson escapes control characters inside strings.
///
/// ```
/// {"src":"c1","dest":"n1","body":{"type":"echo","msg_id":1,"echo":"hello"}}
/// ```
public class MessageCodec {
  private final ObjectMapper mapper;

  public MessageCodec() {
    this(Jsons.mapper());
  }

  MessageCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public Message decode(String line) throws DecodeException {
    final JsonNode root;
    try {
      root = mapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new DecodeException("malformed JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new DecodeException("envelope is not a JSON object");
    }
    final var src = requireText(root.get("src"), "src");
    final var dest = requireText(root.get("dest"), "dest");
    final var bodyNode = root.get("body");
    if (bodyNode == null || !bodyNode.isObject()) {
      throw new DecodeException("body is missing or not a JSON object");
    }
    final ObjectNode fields = ((ObjectNode) bodyNode).deepCopy();
    final var type = requireText(fields.remove(Body.TYPE), "body.type");
    final var msgId = optionalId(fields.remove(Body.MSG_ID), "body.msg_id");
    final var inReplyTo = optionalId(fields.remove(Body.IN_REPLY_TO), "body.in_reply_to");
    try {
      return new Message(src, dest, new Body(type, msgId, inReplyTo, fields));
    } catch (IllegalArgumentException e) {
      throw new DecodeException(e.getMessage(), e);
    }
  }

  public String encode(Message message) {
    final var body = mapper.createObjectNode();
    body.put(Body.TYPE, message.body().type());
    if (message.body().msgId() != null) {
      body.put(Body.MSG_ID, message.body().msgId());
    }
    if (message.body().inReplyTo() != null) {
      body.put(Body.IN_REPLY_TO, message.body().inReplyTo());
    }
    body.setAll(message.body().fields());
    final var envelope = mapper.createObjectNode();
    envelope.put("src", message.src());
    envelope.put("dest", message.dest());
    envelope.set("body", body);
    try {
      return mapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      // a tree of plain JSON nodes always serializes
      throw new IllegalStateException("Failed to encode " + message, e);
    }
  }

  private static String requireText(JsonNode node, String name) throws DecodeException {
    if (node == null || !node.isTextual() || node.textValue().isEmpty()) {
      throw new DecodeException("missing or non-string field: " + name);
    }
    return node.textValue();
  }

  private static Long optionalId(JsonNode node, String name) throws DecodeException {
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isIntegralNumber() || !node.canConvertToLong()) {
      throw new DecodeException("non-integer field: " + name);
    }
    return node.longValue();
  }
}
