package io.ledgerbridge.spring.boot;

import io.ledgerbridge.GatewayConfig;
import io.ledgerbridge.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the bridge.
 *
 * @see LedgerBridgeAutoConfiguration
 */
@ConfigurationProperties(prefix = "ledgerbridge")
public class LedgerBridgeProperties {

    /**
     * Identifier of the network this bridge runs on. Required.
     */
    private Integer localNetwork;

    /**
     * Principals allowed to change adapter sets, subsidy withdrawals and route blocks.
     */
    private List<String> wards = new ArrayList<>();

    /**
     * Base gas limit granted to every outbound message.
     */
    private long messageGasLimit = GatewayConfig.DEFAULT.messageGasLimit();

    /**
     * Upper bound on the summed gas limit of one batch.
     */
    private long maxBatchGasLimit = GatewayConfig.DEFAULT.maxBatchGasLimit();

    /**
     * Where votes, subsidy balances and failed messages are kept.
     */
    private Store store = Store.MEMORY;

    /**
     * Prefix of the JDBC tables when {@code store=jdbc}.
     */
    private String tablePrefix = TableNames.DEFAULT_PREFIX;

    private final Metrics metrics = new Metrics();

    public Integer getLocalNetwork() {
        return localNetwork;
    }

    public void setLocalNetwork(Integer localNetwork) {
        this.localNetwork = localNetwork;
    }

    public List<String> getWards() {
        return wards;
    }

    public void setWards(List<String> wards) {
        this.wards = wards;
    }

    public long getMessageGasLimit() {
        return messageGasLimit;
    }

    public void setMessageGasLimit(long messageGasLimit) {
        this.messageGasLimit = messageGasLimit;
    }

    public long getMaxBatchGasLimit() {
        return maxBatchGasLimit;
    }

    public void setMaxBatchGasLimit(long maxBatchGasLimit) {
        this.maxBatchGasLimit = maxBatchGasLimit;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    GatewayConfig toGatewayConfig() {
        return new GatewayConfig(messageGasLimit, maxBatchGasLimit);
    }

    public enum Store {
        MEMORY,
        JDBC
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "ledgerbridge";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
