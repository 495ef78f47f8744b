package io.wfpath.history;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of decoding one payload.
 *
 * @param raw the base64 text as recorded
 * @param decoded decoded text, pretty-printed if it was JSON; null if base64 decoding failed
 * @param parsedJson the parsed JSON value, null if the text is not JSON or was truncated
 * @param truncated whether {@code decoded} was cut to the limit of code points; a cut string may
 *     hold more UTF-16 units than the limit when it contains supplementary characters
 * @param originalLength length of the decoded text before truncation, in code points
 */
public record DecodedPayload(
    String raw, String decoded, JsonNode parsedJson, boolean truncated, int originalLength) {

  public boolean isJson() {
    return parsedJson != null;
  }

  /** Map form for results. The raw text is only included when decoding failed. */
  public Map<String, Object> toMap(Payload source) {
    Map<String, Object> map = new LinkedHashMap<>();
    if (source != null && !source.path().isEmpty()) {
      map.put("path", source.path());
    }
    if (source != null && source.encoding() != null) {
      map.put("encoding", source.encoding());
    }
    if (decoded == null) {
      map.put("raw", raw);
      map.put("decoded", null);
      return map;
    }
    if (parsedJson != null) {
      map.put("json", parsedJson);
    } else {
      map.put("text", decoded);
    }
    map.put("truncated", truncated);
    map.put("originalLength", originalLength);
    return map;
  }
}
