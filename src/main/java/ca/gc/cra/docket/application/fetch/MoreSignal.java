package ca.gc.cra.docket.application.fetch;

/**
 * Rule deciding whether another page should be requested after the current one.
 *
 * <p>An empty page always ends pagination regardless of the rule.</p>
 *
 * @since 0.1.0
 */
public enum MoreSignal {
  /** Explicit flag or cursor, or a page filled to the requested limit. */
  FLAG_OR_FULL_PAGE {
    @Override
    boolean test(Page page, int limit) {
      return FLAG_ONLY.test(page, limit) || FULL_PAGE.test(page, limit);
    }
  },
  /** Only an explicit {@code hasMore: true} or a {@code nextOffset} cursor. */
  FLAG_ONLY {
    @Override
    boolean test(Page page, int limit) {
      return page.hasMoreFlag().orElse(Boolean.FALSE) || page.nextOffset().isPresent();
    }
  },
  /** Only a page filled to the requested limit; shorter pages are the last. */
  FULL_PAGE {
    @Override
    boolean test(Page page, int limit) {
      return page.items().size() >= limit;
    }
  };

  abstract boolean test(Page page, int limit);

  /**
   * Evaluates the rule for a received page.
   *
   * @param page page just received
   * @param limit page size that was requested
   * @return {@code true} when another page should be requested
   */
  public boolean hasMore(Page page, int limit) {
    return !page.isEmpty() && test(page, limit);
  }
}
