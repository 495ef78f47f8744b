package io.wfpath.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw history records, as printed by {@code temporal workflow show -o json}, into {@link
 * WorkflowEvent}s.
 */
public final class EventParser {

  private static final Logger LOG = LoggerFactory.getLogger(EventParser.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String ATTRIBUTES_SUFFIX = "EventAttributes";

  private EventParser() {}

  /**
   * Parses a history document.
   *
   * @param json {@code {"events": [...]}} or a bare array of events
   * @return events in history order
   * @throws MalformedEventException if a record is malformed or ids do not strictly increase
   */
  public static List<WorkflowEvent> parseHistory(String json) {
    try {
      return parseHistory(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new MalformedEventException("history", "not valid JSON: " + e.getOriginalMessage());
    }
  }

  public static List<WorkflowEvent> parseHistory(JsonNode document) {
    JsonNode events = document;
    if (document != null && !document.isArray()) {
      events = document.get("events");
    }
    if (events == null || !events.isArray()) {
      throw new MalformedEventException(
          "history", "expected an array of events or an object with an events array");
    }
    List<WorkflowEvent> result = new ArrayList<>(events.size());
    long previous = Long.MIN_VALUE;
    int position = 0;
    for (JsonNode raw : events) {
      WorkflowEvent event = parse(raw, position++);
      if (event.eventId() <= previous) {
        throw new MalformedEventException(
            "event " + event.eventId(),
            "event ids must strictly increase, previous was " + previous);
      }
      previous = event.eventId();
      result.add(event);
    }
    LOG.debug("Parsed {} history events", result.size());
    return List.copyOf(result);
  }

  public static WorkflowEvent parse(JsonNode raw) {
    return parse(raw, -1);
  }

  private static WorkflowEvent parse(JsonNode raw, int position) {
    String where = position >= 0 ? "event at position " + position : "event";
    if (raw == null || !raw.isObject()) {
      throw new MalformedEventException(where, "record is not an object");
    }
    long eventId = eventId(raw.get("eventId"), where);
    String location = "event " + eventId;

    JsonNode typeNode = raw.get("eventType");
    if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
      throw new MalformedEventException(location, "missing eventType");
    }
    String eventType = EventTypes.canonicalize(typeNode.asText());

    String attributesKey = null;
    JsonNode attributes = null;
    Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getKey().endsWith(ATTRIBUTES_SUFFIX) && field.getValue().isObject()) {
        attributesKey = field.getKey();
        attributes = field.getValue();
        break;
      }
    }

    List<Payload> payloads = new ArrayList<>();
    if (attributes != null) {
      collectPayloads(attributes, "", payloads);
    }
    Instant eventTime = eventTime(raw.get("eventTime"), location);
    return new WorkflowEvent(eventId, eventType, eventTime, attributesKey, attributes, payloads);
  }

  private static long eventId(JsonNode node, String where) {
    if (node == null || node.isNull()) {
      throw new MalformedEventException(where, "missing eventId");
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return node.asLong();
    }
    if (node.isTextual()) {
      try {
        return Long.parseLong(node.asText().trim());
      } catch (NumberFormatException e) {
        throw new MalformedEventException(where, "eventId is not a number: " + node.asText());
      }
    }
    throw new MalformedEventException(where, "eventId is not a number: " + node);
  }

  private static Instant eventTime(JsonNode node, String location) {
    if (node == null || !node.isTextual()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(node.asText()).toInstant();
    } catch (DateTimeParseException e) {
      LOG.debug("{}: unreadable eventTime '{}'", location, node.asText());
      return null;
    }
  }

  private static void collectPayloads(JsonNode node, String path, List<Payload> out) {
    if (node.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        String childPath = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
        if (field.getKey().equals("payloads") && field.getValue().isArray()) {
          for (JsonNode p : field.getValue()) {
            JsonNode data = p.get("data");
            if (data != null && data.isTextual()) {
              String encoding = encoding(p.path("metadata").get("encoding"));
              out.add(new Payload(path, encoding, data.asText()));
            }
          }
        } else {
          collectPayloads(field.getValue(), childPath, out);
        }
      }
    } else if (node.isArray()) {
      int i = 0;
      for (JsonNode element : node) {
        collectPayloads(element, path + "[" + i++ + "]", out);
      }
    }
  }

  // Metadata values are base64 encoded like the data itself.
  private static String encoding(JsonNode node) {
    if (node == null || !node.isTextual()) {
      return null;
    }
    try {
      return new String(Base64.getDecoder().decode(node.asText()), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return node.asText();
    }
  }
}
