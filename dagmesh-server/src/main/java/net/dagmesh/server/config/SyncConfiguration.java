/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sync")
public class SyncConfiguration {
    private int maxretries = 3;
    // idle time of a session before it is retried, ms
    private long timeout = 30000;
    // wait for tip reports after the get_tips broadcast, ms
    private long settledelay = 5000;
    // ids a peer reports in its answer to get_tips
    private int maxinventory = 500;

    public int getMaxretries() {
        return maxretries;
    }

    public void setMaxretries(int maxretries) {
        this.maxretries = maxretries;
    }

    public long getTimeout() {
        return timeout;
    }

    public void setTimeout(long timeout) {
        this.timeout = timeout;
    }

    public long getSettledelay() {
        return settledelay;
    }

    public void setSettledelay(long settledelay) {
        this.settledelay = settledelay;
    }

    public int getMaxinventory() {
        return maxinventory;
    }

    public void setMaxinventory(int maxinventory) {
        this.maxinventory = maxinventory;
    }
}
