package io.wfpath.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filters, windows and projects a parsed workflow history.
 *
 * <p>Stages run in a fixed order: type filter, window, projection, payload decode. Each stage
 * returns a new list; the input is never modified, so one parsed history can be run through any
 * number of filters, concurrently if need be.
 */
public final class HistoryPipeline {

  private static final Logger LOG = LoggerFactory.getLogger(HistoryPipeline.class);

  private HistoryPipeline() {}

  /**
   * Runs every stage.
   *
   * @param events history in event id order
   * @param filter what to keep and how to shape it
   * @return projected events, filter summary and decode warnings
   */
  public static HistoryView run(List<WorkflowEvent> events, HistoryFilter filter) {
    List<WorkflowEvent> selected = window(filterTypes(events, filter), filter);
    List<DecodeWarning> warnings = new ArrayList<>();
    List<ProjectedEvent> projected = new ArrayList<>(selected.size());
    for (WorkflowEvent e : selected) {
      projected.add(project(e, filter, warnings));
    }
    LOG.debug(
        "History pipeline kept {} of {} events ({}), {} decode warnings",
        projected.size(),
        events.size(),
        filter.describe(),
        warnings.size());
    FilterInfo info = new FilterInfo(filter.describe(), events.size(), projected.size());
    return new HistoryView(projected, info, warnings);
  }

  /** Stage 1: preset expansion, then include or exclude by type. */
  public static List<WorkflowEvent> filterTypes(List<WorkflowEvent> events, HistoryFilter filter) {
    Preset preset = filter.preset();
    if (preset == Preset.LAST_FAILURE_CONTEXT) {
      for (int i = events.size() - 1; i >= 0; i--) {
        if (EventTypes.isFailure(events.get(i).eventType())) {
          int from = Math.max(0, i - filter.failureContextSize());
          return List.copyOf(events.subList(from, i + 1));
        }
      }
      preset = Preset.CRITICAL_PATH;
    }
    Set<String> include = preset != null ? preset.include() : filter.includeTypes();
    Set<String> exclude = preset != null ? preset.exclude() : filter.excludeTypes();

    List<WorkflowEvent> kept = new ArrayList<>();
    for (WorkflowEvent e : events) {
      if (!include.isEmpty()) {
        if (include.contains(e.eventType())) {
          kept.add(e);
        }
      } else if (!exclude.contains(e.eventType())) {
        kept.add(e);
      }
    }
    return Collections.unmodifiableList(kept);
  }

  /** Stage 2: optional reversal, then the limit. */
  public static List<WorkflowEvent> window(List<WorkflowEvent> events, HistoryFilter filter) {
    List<WorkflowEvent> ordered = events;
    if (filter.reverse()) {
      ordered = new ArrayList<>(events);
      Collections.reverse(ordered);
    }
    if (filter.limit() > 0 && ordered.size() > filter.limit()) {
      ordered = ordered.subList(0, filter.limit());
    }
    return List.copyOf(ordered);
  }

  /** Stages 3 and 4 for one event. */
  static ProjectedEvent project(
      WorkflowEvent e, HistoryFilter filter, List<DecodeWarning> warnings) {
    Projection projection = filter.projection();
    if (projection == Projection.MINIMAL) {
      return new ProjectedEvent(
          e.eventId(), e.eventType(), e.eventTime(), null, null, null, null, null, null);
    }

    Attribute primary = projection == Projection.STANDARD ? primaryAttribute(e) : null;

    List<DecodedPayload> decoded = new ArrayList<>();
    if (filter.decodePayloads()) {
      List<Payload> payloads = e.payloads();
      for (int i = 0; i < payloads.size(); i++) {
        decoded.add(
            PayloadCodec.decode(
                e.eventId(), i, payloads.get(i).data(), filter.maxPayloadLength(), warnings::add));
      }
    }
    return new ProjectedEvent(
        e.eventId(),
        e.eventType(),
        e.eventTime(),
        e.failureMessage(),
        primary != null ? primary.name() : null,
        primary != null ? primary.value() : null,
        projection == Projection.FULL ? e.attributes().deepCopy() : null,
        filter.decodePayloads() ? e.payloads() : null,
        decoded);
  }

  private record Attribute(String name, String value) {}

  // First match wins.
  private static Attribute primaryAttribute(WorkflowEvent e) {
    List<Attribute> candidates =
        List.of(
            new Attribute("activityType", e.activityType()),
            new Attribute("signalName", e.signalName()),
            new Attribute("workflowType", e.workflowType()),
            new Attribute("timerId", e.timerId()),
            new Attribute("markerName", e.markerName()),
            new Attribute("childWorkflowId", e.childWorkflowId()),
            new Attribute("scheduledEventId", e.scheduledEventId()));
    for (Attribute a : candidates) {
      if (a.value() != null) {
        return a;
      }
    }
    return null;
  }
}
