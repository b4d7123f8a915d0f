package io.ledgerbridge.spring.boot;

import io.ledgerbridge.Gateway;
import io.ledgerbridge.Message;
import io.ledgerbridge.Tenant;
import io.ledgerbridge.micrometer.MicrometerMetricsExporter;
import io.ledgerbridge.router.MultiAdapter;
import io.ledgerbridge.spi.Adapter;
import io.ledgerbridge.spi.AdapterReceipt;
import io.ledgerbridge.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LedgerBridgeMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LedgerBridgeMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("ledgerbridge.metrics.name-prefix=eth.bridge").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("eth.bridge.batch.sent").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("ledgerbridge.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            assertFalse(ctx.getBean(MetricsExporter.class) instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void gatewayReportsThroughExporter() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        LedgerBridgeMicrometerAutoConfiguration.class, LedgerBridgeAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("ledgerbridge.local-network=1", "ledgerbridge.wards=ops")
                .run(ctx -> {
                    ctx.getBean(MultiAdapter.class).setAdapters("ops", 2, Tenant.GLOBAL,
                            List.of(new FreeAdapter("a"), new FreeAdapter("b")), 2, 2);
                    Gateway gateway = ctx.getBean(Gateway.class);

                    gateway.send(2, Tenant.GLOBAL, Message.of(1, new byte[] {1}));

                    var registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.find("ledgerbridge.batch.sent").counter().count());
                    assertEquals(1.0, registry.find("ledgerbridge.message.sent").counter().count());
                });
    }

    static final class FreeAdapter implements Adapter {
        private final String id;

        FreeAdapter(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public AdapterReceipt send(int remoteNetwork, byte[] payload, long gasLimit, String refundAddress) {
            return new AdapterReceipt(id, id + "-1", 0);
        }

        @Override
        public long estimate(int remoteNetwork, byte[] payload, long gasLimit) {
            return 0;
        }
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
