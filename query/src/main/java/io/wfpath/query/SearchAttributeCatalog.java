package io.wfpath.query;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide holder of the current {@link TypeRegistry}.
 *
 * <p>Readers take a snapshot with {@link #current()} and never see a partially updated registry.
 * Writers replace the whole registry under a single lock.
 */
public final class SearchAttributeCatalog {

  private static final Logger LOG = LoggerFactory.getLogger(SearchAttributeCatalog.class);

  private final AtomicReference<TypeRegistry> registry;
  private final Object writeLock = new Object();

  public SearchAttributeCatalog() {
    this(TypeRegistry.builtins());
  }

  public SearchAttributeCatalog(TypeRegistry initial) {
    this.registry = new AtomicReference<>(initial);
  }

  public TypeRegistry current() {
    return registry.get();
  }

  /**
   * Swaps in a new registry.
   *
   * @param next registry to publish
   * @return the registry that was replaced
   */
  public TypeRegistry replace(TypeRegistry next) {
    if (next == null) {
      throw new IllegalArgumentException("Registry is required");
    }
    synchronized (writeLock) {
      TypeRegistry previous = registry.getAndSet(next);
      LOG.debug("Search attribute registry replaced: {} -> {}", previous, next);
      return previous;
    }
  }

  /** Replaces the custom attributes, keeping the builtins. */
  public TypeRegistry replaceCustomFields(Map<String, FieldType> customFields) {
    return replace(TypeRegistry.withCustomFields(customFields));
  }
}
