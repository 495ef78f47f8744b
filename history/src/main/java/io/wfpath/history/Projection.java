package io.wfpath.history;

import java.util.Locale;

/** How much of each event survives the pipeline. */
public enum Projection {
  /** Id, type and time. */
  MINIMAL,
  /** Minimal plus failure message, one identifying attribute and decoded payloads. */
  STANDARD,
  /** Every attribute as recorded, plus decoded payloads. */
  FULL;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean decodesPayloads() {
    return this != MINIMAL;
  }

  public static Projection fromText(String text) {
    try {
      return valueOf(text.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown fields projection: " + text + " (expected minimal, standard or full)");
    }
  }
}
