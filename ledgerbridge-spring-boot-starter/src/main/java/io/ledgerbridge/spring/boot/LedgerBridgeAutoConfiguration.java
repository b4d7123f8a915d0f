package io.ledgerbridge.spring.boot;

import io.ledgerbridge.Gateway;
import io.ledgerbridge.auth.Wards;
import io.ledgerbridge.dispatch.MessageInterceptor;
import io.ledgerbridge.jdbc.JdbcBridgeStores;
import io.ledgerbridge.registry.DefaultHandlerRegistry;
import io.ledgerbridge.router.MultiAdapter;
import io.ledgerbridge.router.TenantResolver;
import io.ledgerbridge.spi.FailedMessageStore;
import io.ledgerbridge.spi.MetricsExporter;
import io.ledgerbridge.spi.SubsidyStore;
import io.ledgerbridge.spi.VoteStore;
import io.ledgerbridge.store.InMemoryFailedMessageStore;
import io.ledgerbridge.store.InMemorySubsidyStore;
import io.ledgerbridge.store.InMemoryVoteStore;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Auto-configuration for the bridge.
 *
 * <p>Wires a {@link MultiAdapter} and a {@link Gateway} from {@link LedgerBridgeProperties}
 * once {@code ledgerbridge.local-network} is set. Adapter sets are registered at runtime
 * through {@link MultiAdapter#setAdapters}.
 *
 * @see LedgerBridgeProperties
 * @see LedgerBridgeMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Gateway.class)
@ConditionalOnProperty(prefix = "ledgerbridge", name = "local-network")
@EnableConfigurationProperties(LedgerBridgeProperties.class)
public class LedgerBridgeAutoConfiguration {

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "ledgerbridge", name = "store", havingValue = "memory", matchIfMissing = true)
  static class MemoryStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(VoteStore.class)
    InMemoryVoteStore voteStore() {
      return new InMemoryVoteStore();
    }

    @Bean
    @ConditionalOnMissingBean(SubsidyStore.class)
    InMemorySubsidyStore subsidyStore() {
      return new InMemorySubsidyStore();
    }

    @Bean
    @ConditionalOnMissingBean(FailedMessageStore.class)
    InMemoryFailedMessageStore failedMessageStore() {
      return new InMemoryFailedMessageStore();
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "ledgerbridge", name = "store", havingValue = "jdbc")
  @ConditionalOnBean(DataSource.class)
  static class JdbcStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    JdbcBridgeStores jdbcBridgeStores(DataSource dataSource, LedgerBridgeProperties props) {
      return JdbcBridgeStores.create(dataSource, props.getTablePrefix());
    }

    @Bean
    @ConditionalOnMissingBean(VoteStore.class)
    VoteStore voteStore(JdbcBridgeStores stores) {
      return stores.voteStore();
    }

    @Bean
    @ConditionalOnMissingBean(SubsidyStore.class)
    SubsidyStore subsidyStore(JdbcBridgeStores stores) {
      return stores.subsidyStore();
    }

    @Bean
    @ConditionalOnMissingBean(FailedMessageStore.class)
    FailedMessageStore failedMessageStore(JdbcBridgeStores stores) {
      return stores.failedMessageStore();
    }
  }

  @Bean
  @ConditionalOnMissingBean
  public Wards bridgeWards(LedgerBridgeProperties props) {
    return new Wards(props.getWards());
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultHandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public BridgeHandlerRegistrar bridgeHandlerRegistrar(ListableBeanFactory beanFactory,
      DefaultHandlerRegistry handlerRegistry) {
    return new BridgeHandlerRegistrar(beanFactory, handlerRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public MultiAdapter multiAdapter(LedgerBridgeProperties props,
      Wards wards,
      VoteStore voteStore,
      ObjectProvider<TenantResolver> tenantResolverProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = MultiAdapter.builder()
        .localNetwork(props.getLocalNetwork())
        .wards(wards)
        .voteStore(voteStore);
    tenantResolverProvider.ifAvailable(builder::tenantResolver);
    metricsProvider.ifAvailable(builder::metrics);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public Gateway gateway(LedgerBridgeProperties props,
      MultiAdapter multiAdapter,
      DefaultHandlerRegistry handlerRegistry,
      SubsidyStore subsidyStore,
      FailedMessageStore failedMessageStore,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<MessageInterceptor> interceptorProvider) {
    List<MessageInterceptor> interceptors = interceptorProvider.orderedStream().toList();
    var builder = Gateway.builder()
        .router(multiAdapter)
        .handlerRegistry(handlerRegistry)
        .subsidyStore(subsidyStore)
        .failedMessageStore(failedMessageStore)
        .config(props.toGatewayConfig())
        .interceptors(interceptors);
    metricsProvider.ifAvailable(builder::metrics);
    return builder.build();
  }
}
