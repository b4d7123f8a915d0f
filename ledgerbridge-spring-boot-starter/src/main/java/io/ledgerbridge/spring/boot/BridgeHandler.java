package io.ledgerbridge.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler for one inbound message kind.
 *
 * <p>The annotated bean must implement {@link io.ledgerbridge.MessageHandler}.
 *
 * <pre>{@code
 * @Component
 * @BridgeHandler(kind = 1)
 * public class TransferHandler implements MessageHandler {
 *   public void handle(int sourceNetwork, Message message) { ... }
 * }
 * }</pre>
 *
 * <p>Leaving {@link #kind()} unset registers the bean as the catch-all handler for kinds
 * without a dedicated one. At most one catch-all and one handler per kind may exist.
 *
 * @see BridgeHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface BridgeHandler {

    /**
     * Marker for the catch-all handler.
     */
    int ALL_KINDS = -1;

    /**
     * Message kind, 0..255, or {@link #ALL_KINDS}.
     */
    int kind() default ALL_KINDS;
}
