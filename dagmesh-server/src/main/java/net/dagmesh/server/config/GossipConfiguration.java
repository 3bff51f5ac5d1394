/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "gossip")
public class GossipConfiguration {
    private int ttl = 3;
    // wait of a broadcast for acknowledgements, ms
    private long acktimeout = 5000;
    // age at which the monitor gives up on a pending broadcast, ms
    private long pendingacktimeout = 30000;
    // retention of seen message ids and cached messages, ms
    private long messagemaxage = 3600000;

    public int getTtl() {
        return ttl;
    }

    public void setTtl(int ttl) {
        this.ttl = ttl;
    }

    public long getAcktimeout() {
        return acktimeout;
    }

    public void setAcktimeout(long acktimeout) {
        this.acktimeout = acktimeout;
    }

    public long getPendingacktimeout() {
        return pendingacktimeout;
    }

    public void setPendingacktimeout(long pendingacktimeout) {
        this.pendingacktimeout = pendingacktimeout;
    }

    public long getMessagemaxage() {
        return messagemaxage;
    }

    public void setMessagemaxage(long messagemaxage) {
        this.messagemaxage = messagemaxage;
    }
}
