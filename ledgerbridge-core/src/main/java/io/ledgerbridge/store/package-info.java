/**
 * In-memory implementations of the store SPIs, used by default and in tests.
 */
package io.ledgerbridge.store;
