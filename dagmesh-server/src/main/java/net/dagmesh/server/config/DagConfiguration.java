/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "dag")
public class DagConfiguration {
    // accepted distance between a node timestamp and local time, ms
    private long maxtimedrift = 300000;
    // fork list length above which the newest child is marked suspicious
    private int forkthreshold = 3;
    private long prunemaxage = 3600000;
    // public keys (hex) allowed to sign nodes, any key when empty
    private List<String> trustedkeys = new ArrayList<String>();

    public long getMaxtimedrift() {
        return maxtimedrift;
    }

    public void setMaxtimedrift(long maxtimedrift) {
        this.maxtimedrift = maxtimedrift;
    }

    public int getForkthreshold() {
        return forkthreshold;
    }

    public void setForkthreshold(int forkthreshold) {
        this.forkthreshold = forkthreshold;
    }

    public long getPrunemaxage() {
        return prunemaxage;
    }

    public void setPrunemaxage(long prunemaxage) {
        this.prunemaxage = prunemaxage;
    }

    public List<String> getTrustedkeys() {
        return trustedkeys;
    }

    public void setTrustedkeys(List<String> trustedkeys) {
        this.trustedkeys = trustedkeys;
    }
}
