package io.ledgerbridge.dispatch;

import io.ledgerbridge.Message;
import io.ledgerbridge.MessageHandler;
import io.ledgerbridge.registry.HandlerRegistry;
import io.ledgerbridge.spi.FailedMessageStore;
import io.ledgerbridge.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs inbound messages through interceptors and their {@link MessageHandler}.
 *
 * <p>Each message is isolated: a failing handler is logged, counted and recorded in the
 * {@link FailedMessageStore}, and the next message of the batch still runs.
 */
public final class InboundDispatcher {
  private static final Logger logger = Logger.getLogger(InboundDispatcher.class.getName());

  private final HandlerRegistry handlerRegistry;
  private final FailedMessageStore failedMessageStore;
  private final MetricsExporter metrics;
  private final List<MessageInterceptor> interceptors;

  public InboundDispatcher(HandlerRegistry handlerRegistry, FailedMessageStore failedMessageStore,
      MetricsExporter metrics, List<MessageInterceptor> interceptors) {
    this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry");
    this.failedMessageStore = Objects.requireNonNull(failedMessageStore, "failedMessageStore");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(interceptors));
  }

  /**
   * Dispatches every message of a batch in order.
   */
  public DispatchReport dispatchAll(int sourceNetwork, List<Message> messages) {
    int handled = 0;
    int failed = 0;
    for (Message message : messages) {
      try {
        deliver(sourceNetwork, message);
        metrics.incrementMessageHandled();
        handled++;
      } catch (Exception e) {
        recordFailure(sourceNetwork, message, e);
        failed++;
      }
    }
    return new DispatchReport(handled, failed);
  }

  /**
   * Dispatches one message and propagates its failure instead of recording it.
   *
   * @throws Exception the handler's or an interceptor's failure, or
   *     {@link UnroutableMessageException}
   */
  public void dispatchOne(int sourceNetwork, Message message) throws Exception {
    deliver(sourceNetwork, message);
    metrics.incrementMessageHandled();
  }

  void recordFailure(int sourceNetwork, Message message, Exception failure) {
    metrics.incrementMessageFailed();
    logger.log(Level.WARNING, "Handler failed for " + message + " from network " + sourceNetwork, failure);
    try {
      failedMessageStore.recordFailure(sourceNetwork, message, describe(failure));
    } catch (RuntimeException e) {
      // The batch is already delivered; the rest of it must still run.
      logger.log(Level.WARNING, "Could not record failure of " + message + " from network " + sourceNetwork
          + "; it cannot be retried", e);
    }
  }

  private void deliver(int sourceNetwork, Message message) throws Exception {
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDispatch(sourceNetwork, message);
        completedBefore = i + 1;
      }

      MessageHandler handler = handlerRegistry.handlerFor(message.kind());
      if (handler == null) {
        throw new UnroutableMessageException("No handler for message kind " + message.kind());
      }
      handler.handle(sourceNetwork, message);

      runAfterDispatch(sourceNetwork, message, null, completedBefore);
    } catch (Exception e) {
      runAfterDispatch(sourceNetwork, message, e, completedBefore);
      throw e;
    }
  }

  private void runAfterDispatch(int sourceNetwork, Message message, Exception error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(sourceNetwork, message, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }

  private static String describe(Exception failure) {
    String text = failure.getMessage();
    return text != null ? failure.getClass().getSimpleName() + ": " + text : failure.getClass().getSimpleName();
  }
}
