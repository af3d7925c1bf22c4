package eventsync.spi;

/**
 * Commit boundary of the event-sourcing runtime that replayed events are applied to.
 *
 * <p>The replay engine calls {@link #commit()} once per batch after every handler in the
 * batch has run; records are marked replayed only if the commit succeeds.
 */
@FunctionalInterface
public interface UnitOfWork {

  /** Unit of work with nothing to commit. */
  UnitOfWork NOOP = () -> { };

  /**
   * Persists the effects of the handlers invoked since the last commit.
   *
   * @throws Exception if the commit fails; the batch is then reported failed
   */
  void commit() throws Exception;
}
