/**
 * Service provider interfaces: relay {@link io.ledgerbridge.spi.Adapter}s, the state
 * stores, and the {@link io.ledgerbridge.spi.MetricsExporter} hook.
 *
 * <p>In-memory store implementations live in {@code io.ledgerbridge.store}; JDBC ones in the
 * {@code ledgerbridge-jdbc} module.
 */
package io.ledgerbridge.spi;
