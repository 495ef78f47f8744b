package io.wfpath.history;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Decodes payload data: base64, then JSON when the text parses, then truncation to a length
 * limit. Never throws for bad payloads; failures become {@link DecodeWarning}s.
 */
public final class PayloadCodec {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final ObjectWriter PRETTY = MAPPER.writer(new TwoSpacePrinter());

  private PayloadCodec() {}

  /**
   * Decodes one payload.
   *
   * @param eventId event carrying the payload, for warnings
   * @param index payload index within the event, for warnings
   * @param raw base64 text
   * @param maxLength length limit for the decoded text, in code points
   * @param warnings receives a warning if the payload cannot be decoded
   * @return the decoded payload; {@code decoded} is null on failure
   */
  public static DecodedPayload decode(
      long eventId, int index, String raw, int maxLength, Consumer<DecodeWarning> warnings) {
    byte[] bytes;
    try {
      if (raw == null) {
        throw new IllegalArgumentException("payload has no data");
      }
      bytes = Base64.getDecoder().decode(WHITESPACE.matcher(raw).replaceAll(""));
    } catch (IllegalArgumentException e) {
      warnings.accept(new DecodeWarning(eventId, index, "invalid base64: " + e.getMessage()));
      return new DecodedPayload(raw, null, null, false, 0);
    }

    String text;
    try {
      text =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString();
    } catch (CharacterCodingException e) {
      warnings.accept(new DecodeWarning(eventId, index, "payload is not UTF-8 text"));
      return new DecodedPayload(raw, null, null, false, 0);
    }

    JsonNode json = null;
    try {
      JsonNode parsed = MAPPER.readTree(text);
      if (parsed != null && !parsed.isMissingNode()) {
        json = parsed;
        text = PRETTY.writeValueAsString(parsed);
      }
    } catch (JsonProcessingException e) {
      // plain text payload
    }

    int length = text.codePointCount(0, text.length());
    if (length > maxLength) {
      String cut = text.substring(0, text.offsetByCodePoints(0, maxLength));
      return new DecodedPayload(raw, cut, null, true, length);
    }
    return new DecodedPayload(raw, text, json, false, length);
  }

  /** Pretty-prints JSON with two-space indentation, {@code \n} line breaks and {@code ": "}. */
  public static String pretty(JsonNode node) throws JsonProcessingException {
    return PRETTY.writeValueAsString(node);
  }

  private static final class TwoSpacePrinter extends DefaultPrettyPrinter {
    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    TwoSpacePrinter() {
      _objectIndenter = INDENTER;
      _arrayIndenter = INDENTER;
    }

    TwoSpacePrinter(TwoSpacePrinter base) {
      super(base);
    }

    @Override
    public TwoSpacePrinter createInstance() {
      return new TwoSpacePrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
      --_nesting;
      if (nrOfEntries > 0) {
        _objectIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
      --_nesting;
      if (nrOfValues > 0) {
        _arrayIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw(']');
    }
  }
}
