package com.chainpulse.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-network RPC config. Key = NetworkId name (e.g. ETHEREUM, LISK).
 */
@ConfigurationProperties(prefix = "chainpulse.ingestion")
@NoArgsConstructor
@Getter
@Setter
public class IngestionNetworkProperties {

    /** Missing network: default rotator and a 2000-block eth_getLogs batch. */
    private Map<String, NetworkIngestionEntry> network = new HashMap<>();

    public void setNetwork(Map<String, NetworkIngestionEntry> network) {
        this.network = network != null ? network : new HashMap<>();
    }

    /** Block span of one eth_getLogs request for the network. */
    public int batchBlockSize(String networkName) {
        NetworkIngestionEntry entry = network.get(networkName);
        if (entry == null || entry.getBatchBlockSize() == null || entry.getBatchBlockSize() <= 0) {
            return NetworkIngestionEntry.DEFAULT_BATCH_BLOCK_SIZE;
        }
        return entry.getBatchBlockSize();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NetworkIngestionEntry {

        static final int DEFAULT_BATCH_BLOCK_SIZE = 2_000;

        private List<String> urls = new ArrayList<>();
        private Integer batchBlockSize;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
