package dev.henneberger.vertx.streamsync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keys created, updated and deleted between two item snapshots.
 */
public final class ItemDelta {
  private static final ItemDelta EMPTY = new ItemDelta(List.of(), List.of(), List.of());

  private final List<String> created;
  private final List<String> updated;
  private final List<String> deleted;

  private ItemDelta(List<String> created, List<String> updated, List<String> deleted) {
    this.created = Collections.unmodifiableList(created);
    this.updated = Collections.unmodifiableList(updated);
    this.deleted = Collections.unmodifiableList(deleted);
  }

  public static ItemDelta empty() {
    return EMPTY;
  }

  /**
   * Created and updated keys follow the iteration order of {@code newState}, deleted keys
   * that of {@code oldState}. Values are compared with {@link Objects#equals}.
   */
  public static ItemDelta between(Map<String, ?> newState, Map<String, ?> oldState) {
    Map<String, ?> next = newState == null ? Map.of() : newState;
    Map<String, ?> previous = oldState == null ? Map.of() : oldState;

    List<String> created = new ArrayList<>();
    List<String> updated = new ArrayList<>();
    List<String> deleted = new ArrayList<>();

    for (Map.Entry<String, ?> entry : next.entrySet()) {
      if (!previous.containsKey(entry.getKey())) {
        created.add(entry.getKey());
      } else if (!Objects.equals(entry.getValue(), previous.get(entry.getKey()))) {
        updated.add(entry.getKey());
      }
    }
    for (String key : previous.keySet()) {
      if (!next.containsKey(key)) {
        deleted.add(key);
      }
    }
    return new ItemDelta(created, updated, deleted);
  }

  public List<String> created() {
    return created;
  }

  public List<String> updated() {
    return updated;
  }

  public List<String> deleted() {
    return deleted;
  }

  public boolean isEmpty() {
    return created.isEmpty() && updated.isEmpty() && deleted.isEmpty();
  }

  @Override
  public String toString() {
    return "ItemDelta{created=" + created + ", updated=" + updated + ", deleted=" + deleted + "}";
  }
}
