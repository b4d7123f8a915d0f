/**
 * Spring Boot auto-configuration for the bridge.
 *
 * <p>{@link io.ledgerbridge.spring.boot.LedgerBridgeAutoConfiguration} wires a
 * {@link io.ledgerbridge.router.MultiAdapter} and {@link io.ledgerbridge.Gateway} from
 * {@code ledgerbridge.*} properties. Beans annotated with
 * {@link io.ledgerbridge.spring.boot.BridgeHandler} are registered as message handlers.
 */
package io.ledgerbridge.spring.boot;
