package io.ledgerbridge.spring.boot;

import io.ledgerbridge.Gateway;
import io.ledgerbridge.GatewayConfig;
import io.ledgerbridge.Message;
import io.ledgerbridge.MessageHandler;
import io.ledgerbridge.Tenant;
import io.ledgerbridge.auth.Wards;
import io.ledgerbridge.jdbc.JdbcBridgeStores;
import io.ledgerbridge.jdbc.store.JdbcSubsidyStore;
import io.ledgerbridge.registry.DefaultHandlerRegistry;
import io.ledgerbridge.router.MultiAdapter;
import io.ledgerbridge.spi.SubsidyStore;
import io.ledgerbridge.spi.VoteStore;
import io.ledgerbridge.store.InMemoryFailedMessageStore;
import io.ledgerbridge.store.InMemorySubsidyStore;
import io.ledgerbridge.store.InMemoryVoteStore;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LedgerBridgeAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(LedgerBridgeAutoConfiguration.class))
      .withPropertyValues("ledgerbridge.local-network=1", "ledgerbridge.wards=ops,admin");

  private final ApplicationContextRunner jdbcRunner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          LedgerBridgeAutoConfiguration.class))
      .withPropertyValues(
          "ledgerbridge.local-network=1",
          "ledgerbridge.store=jdbc",
          "spring.datasource.url=jdbc:h2:mem:bridge_auto_test;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:ledgerbridge/schema-h2.sql");

  @Test
  void createsAllBeansWithMemoryStores() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("bridgeWards"));
      assertTrue(ctx.containsBean("handlerRegistry"));
      assertTrue(ctx.containsBean("bridgeHandlerRegistrar"));
      assertTrue(ctx.containsBean("multiAdapter"));
      assertTrue(ctx.containsBean("gateway"));

      assertInstanceOf(InMemoryVoteStore.class, ctx.getBean(VoteStore.class));
      assertInstanceOf(InMemorySubsidyStore.class, ctx.getBean(SubsidyStore.class));
      assertInstanceOf(InMemoryFailedMessageStore.class, ctx.getBean("failedMessageStore"));
      assertEquals(1, ctx.getBean(MultiAdapter.class).localNetwork());
      assertEquals(GatewayConfig.DEFAULT, ctx.getBean(Gateway.class).config());
    });
  }

  @Test
  void bindsWardsAndGasLimits() {
    runner
        .withPropertyValues("ledgerbridge.message-gas-limit=50000",
            "ledgerbridge.max-batch-gas-limit=200000")
        .run(ctx -> {
          Wards wards = ctx.getBean(Wards.class);
          assertTrue(wards.isWard("ops"));
          assertTrue(wards.isWard("admin"));
          assertSame(wards, ctx.getBean(MultiAdapter.class).wards());
          assertEquals(new GatewayConfig(50_000, 200_000), ctx.getBean(Gateway.class).config());
        });
  }

  @Test
  void invalidGasLimitsFailStartup() {
    runner
        .withPropertyValues("ledgerbridge.max-batch-gas-limit=10")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void registersAnnotatedHandlers() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertSame(ctx.getBean(TransferHandler.class), registry.handlerFor(1));
    });
  }

  @Test
  void notLoadedWithoutLocalNetwork() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(LedgerBridgeAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("gateway")));
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomSubsidyConfig.class).run(ctx -> {
      assertEquals("mySubsidyStore", ctx.getBeanNamesForType(SubsidyStore.class)[0]);
      ctx.getBean(Gateway.class).depositSubsidy(Tenant.GLOBAL, 9);
      assertEquals(9, ctx.getBean(SubsidyStore.class).balance(Tenant.GLOBAL));
    });
  }

  @Test
  void jdbcStoreKeepsSubsidyInDatabase() {
    jdbcRunner.run(ctx -> {
      assertTrue(ctx.containsBean("jdbcBridgeStores"));
      assertInstanceOf(JdbcSubsidyStore.class, ctx.getBean(SubsidyStore.class));

      ctx.getBean(Gateway.class).depositSubsidy(7L, 250);

      assertEquals(250, ctx.getBean(JdbcBridgeStores.class).subsidyStore().balance(7L));
    });
  }

  @Test
  void jdbcStoreWithCustomTablePrefix() {
    jdbcRunner
        .withPropertyValues("ledgerbridge.table-prefix=eth_",
            "spring.datasource.url=jdbc:h2:mem:bridge_auto_prefix_test;DB_CLOSE_DELAY=-1",
            "spring.sql.init.schema-locations=classpath:schema-custom.sql")
        .run(ctx -> {
          ctx.getBean(Gateway.class).depositSubsidy(Tenant.GLOBAL, 3);
          assertEquals(3, ctx.getBean(SubsidyStore.class).balance(Tenant.GLOBAL));
        });
  }

  // ── Test configurations ──────────────────────────────────────

  @BridgeHandler(kind = 1)
  static class TransferHandler implements MessageHandler {
    final List<Message> received = new ArrayList<>();

    @Override
    public void handle(int sourceNetwork, Message message) {
      received.add(message);
    }
  }

  @Configuration
  static class HandlerConfig {
    @Bean
    TransferHandler transferHandler() {
      return new TransferHandler();
    }
  }

  @Configuration
  static class CustomSubsidyConfig {
    @Bean
    SubsidyStore mySubsidyStore() {
      return new InMemorySubsidyStore();
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
