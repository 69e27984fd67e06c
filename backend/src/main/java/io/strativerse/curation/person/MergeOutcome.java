package io.strativerse.curation.person;

import io.strativerse.curation.annotation.TransferResult;
import java.util.List;
import java.util.UUID;

/**
 * Result of {@link PersonMergeService#combine}. A rejected outcome is a no-op carrying a message
 * for the curator, not an error.
 */
public record MergeOutcome(
    boolean merged, Person survivor, List<UUID> removedIds, TransferResult annotations,
    String message) {

  public static MergeOutcome merged(
      Person survivor, List<UUID> removedIds, TransferResult annotations) {
    return new MergeOutcome(
        true,
        survivor,
        List.copyOf(removedIds),
        annotations,
        "Combined " + (removedIds.size() + 1) + " people into " + survivor.displayName());
  }

  public static MergeOutcome rejected(String message) {
    return new MergeOutcome(false, null, List.of(), new TransferResult(0, 0), message);
  }
}
