package io.wfpath.history;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Immutable description of what a {@link HistoryPipeline} run keeps and how it shapes events. */
public final class HistoryFilter {

  public static final int DEFAULT_MAX_PAYLOAD_LENGTH = 4000;
  public static final int DEFAULT_FAILURE_CONTEXT_SIZE = 10;

  private final Set<String> includeTypes;
  private final Set<String> excludeTypes;
  private final Preset preset;
  private final Projection projection;
  private final int limit;
  private final boolean reverse;
  private final boolean decodePayloads;
  private final int maxPayloadLength;
  private final int failureContextSize;

  private HistoryFilter(Builder b) {
    this.includeTypes = Set.copyOf(b.includeTypes);
    this.excludeTypes = Set.copyOf(b.excludeTypes);
    this.preset = b.preset;
    this.projection = b.projection;
    this.limit = b.limit;
    this.reverse = b.reverse;
    this.decodePayloads = b.decodePayloads;
    this.maxPayloadLength = b.maxPayloadLength;
    this.failureContextSize = b.failureContextSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Standard projection, every event, payloads decoded. */
  public static HistoryFilter defaults() {
    return builder().build();
  }

  public Set<String> includeTypes() {
    return includeTypes;
  }

  public Set<String> excludeTypes() {
    return excludeTypes;
  }

  /** The preset, or null if the type lists apply. */
  public Preset preset() {
    return preset;
  }

  public Projection projection() {
    return projection;
  }

  /** Maximum number of events returned; 0 means no cap. */
  public int limit() {
    return limit;
  }

  public boolean reverse() {
    return reverse;
  }

  public boolean decodePayloads() {
    return decodePayloads;
  }

  public int maxPayloadLength() {
    return maxPayloadLength;
  }

  public int failureContextSize() {
    return failureContextSize;
  }

  /** Human-readable list of the non-default settings, in pipeline order. */
  public List<String> describe() {
    List<String> applied = new ArrayList<>();
    if (preset != null) {
      applied.add("preset=" + preset.id());
    } else if (!includeTypes.isEmpty()) {
      applied.add("event_types=" + sorted(includeTypes));
    } else if (!excludeTypes.isEmpty()) {
      applied.add("exclude_event_types=" + sorted(excludeTypes));
    }
    if (limit > 0) {
      applied.add("limit=" + limit);
    }
    if (reverse) {
      applied.add("reverse=true");
    }
    applied.add("fields=" + projection.id());
    if (!decodePayloads) {
      applied.add("decode_payloads=false");
    }
    return applied;
  }

  private static List<String> sorted(Set<String> types) {
    return types.stream().sorted().toList();
  }

  public static final class Builder {
    private final Set<String> includeTypes = new LinkedHashSet<>();
    private final Set<String> excludeTypes = new LinkedHashSet<>();
    private Preset preset;
    private Projection projection = Projection.STANDARD;
    private int limit;
    private boolean reverse;
    private boolean decodePayloads = true;
    private int maxPayloadLength = DEFAULT_MAX_PAYLOAD_LENGTH;
    private int failureContextSize = DEFAULT_FAILURE_CONTEXT_SIZE;

    private Builder() {}

    /** Keeps only these types. Names are canonicalized, so any spelling works. */
    public Builder includeTypes(Collection<String> types) {
      for (String t : types) {
        includeTypes.add(EventTypes.canonicalize(t));
      }
      return this;
    }

    /** Drops these types. Names are canonicalized, so any spelling works. */
    public Builder excludeTypes(Collection<String> types) {
      for (String t : types) {
        excludeTypes.add(EventTypes.canonicalize(t));
      }
      return this;
    }

    public Builder preset(Preset preset) {
      this.preset = preset;
      return this;
    }

    public Builder projection(Projection projection) {
      this.projection = projection;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = Math.max(limit, 0);
      return this;
    }

    public Builder reverse(boolean reverse) {
      this.reverse = reverse;
      return this;
    }

    public Builder decodePayloads(boolean decodePayloads) {
      this.decodePayloads = decodePayloads;
      return this;
    }

    public Builder maxPayloadLength(int maxPayloadLength) {
      this.maxPayloadLength = maxPayloadLength;
      return this;
    }

    public Builder failureContextSize(int failureContextSize) {
      this.failureContextSize = failureContextSize;
      return this;
    }

    /**
     * @throws IllegalArgumentException if both include and exclude types are given, or a size is
     *     out of range
     */
    public HistoryFilter build() {
      if (!includeTypes.isEmpty() && !excludeTypes.isEmpty()) {
        throw new IllegalArgumentException(
            "eventTypes and excludeEventTypes are mutually exclusive");
      }
      if (projection == null) {
        throw new IllegalArgumentException("Projection is required");
      }
      if (maxPayloadLength <= 0) {
        throw new IllegalArgumentException(
            "maxPayloadLength must be positive: " + maxPayloadLength);
      }
      if (failureContextSize < 0) {
        throw new IllegalArgumentException(
            "failureContextSize must not be negative: " + failureContextSize);
      }
      return new HistoryFilter(this);
    }
  }
}
