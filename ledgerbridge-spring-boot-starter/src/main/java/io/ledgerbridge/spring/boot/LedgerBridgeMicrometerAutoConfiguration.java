package io.ledgerbridge.spring.boot;

import io.ledgerbridge.micrometer.MicrometerMetricsExporter;
import io.ledgerbridge.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code ledgerbridge.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link LedgerBridgeAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the router and gateway.
 */
@AutoConfiguration(before = LedgerBridgeAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "ledgerbridge.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LedgerBridgeProperties.class)
public class LedgerBridgeMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, LedgerBridgeProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
