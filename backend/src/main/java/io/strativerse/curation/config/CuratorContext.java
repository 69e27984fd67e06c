package io.strativerse.curation.config;

/**
 * Thread-bound name of the curator performing the current request. Bound by {@link
 * CuratorLoggingFilter}, read by the audit builder.
 */
public final class CuratorContext {

  private static final ThreadLocal<String> CURRENT_CURATOR = new ThreadLocal<>();

  private CuratorContext() {}

  public static void setCurrentCurator(String curator) {
    CURRENT_CURATOR.set(curator);
  }

  /** Returns the bound curator, or null outside a request. */
  public static String getCurrentCurator() {
    return CURRENT_CURATOR.get();
  }

  public static void clear() {
    CURRENT_CURATOR.remove();
  }
}
