package io.b2mash.revel.notification.channel;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Result of dispatching a batch: the notifications handled and the ones that failed with why. */
public record DispatchReport(List<UUID> dispatched, Map<UUID, String> failures) {

  public DispatchReport {
    dispatched = List.copyOf(dispatched);
    failures = Map.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
