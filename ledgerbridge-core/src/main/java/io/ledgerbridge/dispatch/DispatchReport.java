package io.ledgerbridge.dispatch;

/**
 * Outcome of dispatching one inbound batch.
 *
 * @param handled messages whose handler completed
 * @param failed  messages recorded as failed
 */
public record DispatchReport(int handled, int failed) {

  public boolean allHandled() {
    return failed == 0;
  }
}
