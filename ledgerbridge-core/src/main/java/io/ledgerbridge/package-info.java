/**
 * Root API for ledgerbridge: exactly-once, in-order delivery of domain messages between
 * ledger networks over several mutually distrusting relay adapters.
 *
 * <h2>Core Design</h2>
 * <p>Producers hand {@link io.ledgerbridge.Message}s to the {@link io.ledgerbridge.Gateway},
 * which packs them per route into batches and pays each batch from the tenant's prepaid
 * subsidy. The {@linkplain io.ledgerbridge.router.MultiAdapter router} sends each batch through
 * one primary adapter and a hash-only proof through every other adapter. On the receiving side
 * the router counts one vote per adapter per hash and releases the batch once, when a
 * threshold of registered adapters agree and the payload is present. The gateway then
 * dispatches each message to its {@link io.ledgerbridge.MessageHandler} by message kind.
 *
 * <p>Safety never depends on adapter honesty: a batch is never delivered twice and never
 * without quorum agreement on its hash. Liveness does: with too few honest adapters a batch
 * stalls and shows up as pending in
 * {@link io.ledgerbridge.router.MultiAdapter#voteStatus voteStatus}. Deduplication is by batch
 * content, so producers should give every message a unique id in its body.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>ledgerbridge-core</b>: codec, router, gateway, registries, in-memory stores</li>
 *   <li><b>ledgerbridge-jdbc</b>: JDBC stores (H2, MySQL, PostgreSQL)</li>
 *   <li><b>ledgerbridge-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>ledgerbridge-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * MultiAdapter router = MultiAdapter.builder()
 *     .localNetwork(1)
 *     .wards(Wards.of("ops"))
 *     .build();
 * router.setAdapters("ops", 2, Tenant.GLOBAL, List.of(primary, second, third), 2, 3);
 *
 * Gateway gateway = Gateway.builder()
 *     .router(router)
 *     .handlerRegistry(new DefaultHandlerRegistry()
 *         .register(1, (source, message) -> transfers.apply(message.body())))
 *     .build();
 *
 * gateway.depositSubsidy(Tenant.GLOBAL, 1_000_000);
 * gateway.send(2, Tenant.GLOBAL, Message.of(1, body));
 * }</pre>
 */
package io.ledgerbridge;
