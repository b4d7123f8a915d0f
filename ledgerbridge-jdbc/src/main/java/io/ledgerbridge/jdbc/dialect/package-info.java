/**
 * Built-in SQL dialects and the {@link io.ledgerbridge.jdbc.dialect.Dialects} registry.
 */
package io.ledgerbridge.jdbc.dialect;
