package io.strativerse.curation.annotation;

/**
 * Outcome of moving annotations between owners.
 *
 * @param moved annotations re-pointed at the target owner
 * @param discarded source annotations deleted because the target already had the same (type, key)
 */
public record TransferResult(int moved, int discarded) {

  public TransferResult plus(TransferResult other) {
    return new TransferResult(moved + other.moved, discarded + other.discarded);
  }
}
