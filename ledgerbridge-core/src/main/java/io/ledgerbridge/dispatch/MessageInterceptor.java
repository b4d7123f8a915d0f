package io.ledgerbridge.dispatch;

import io.ledgerbridge.Message;

/**
 * Cross-cutting hook for observing inbound message dispatch.
 *
 * <p>Interceptors run around handler invocation:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, the message fails without reaching its handler.
 * {@code afterDispatch} exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Gateway.builder()
 *     .interceptor(MessageInterceptor.before((source, message) ->
 *         audit.log(source, message.kind())))
 *     .interceptor(MessageInterceptor.after((source, message, error) -> {
 *         if (error != null) alerts.raise(source, error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface MessageInterceptor {

    /**
     * Called before the handler is invoked.
     *
     * @throws Exception to fail the message without invoking its handler
     */
    default void beforeDispatch(int sourceNetwork, Message message) throws Exception {
    }

    /**
     * Called after handler invocation (or after beforeDispatch failure).
     *
     * @param error null on success, the exception on failure
     */
    default void afterDispatch(int sourceNetwork, Message message, Exception error) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static MessageInterceptor before(BeforeHook hook) {
        return new MessageInterceptor() {
            @Override
            public void beforeDispatch(int sourceNetwork, Message message) throws Exception {
                hook.accept(sourceNetwork, message);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static MessageInterceptor after(AfterHook hook) {
        return new MessageInterceptor() {
            @Override
            public void afterDispatch(int sourceNetwork, Message message, Exception error) {
                hook.accept(sourceNetwork, message, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(int sourceNetwork, Message message) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(int sourceNetwork, Message message, Exception error);
    }
}
