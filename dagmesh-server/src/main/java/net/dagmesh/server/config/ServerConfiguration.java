/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.google.common.base.MoreObjects;

@Component
@ConfigurationProperties(prefix = "server")
public class ServerConfiguration {
    // identity of this node in the peer set
    private String nodeid = "node-1";

    private List<String> peers = new ArrayList<String>();
    // peers that re-deliver messages a direct send could not hand over
    private List<String> fallbacknodes = new ArrayList<String>();

    // hex, a fresh key is generated when empty
    private String privatekey;

    // loopback or the name of a transport bean provided by the embedding process
    private String transport = "loopback";

    // does not reply to any request until service is set ready
    private Boolean serviceReady = false;

    public synchronized Boolean checkService() {
        if (!serviceReady) {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return serviceReady;
    }

    public synchronized void setServiceOK() {
        serviceReady = true;
    }

    public synchronized void setServiceWait() {
        serviceReady = false;
    }

    public boolean isLoopback() {
        return "loopback".equals(transport);
    }

    public String getNodeid() {
        return nodeid;
    }

    public void setNodeid(String nodeid) {
        this.nodeid = nodeid;
    }

    public List<String> getPeers() {
        return peers;
    }

    public void setPeers(List<String> peers) {
        this.peers = peers;
    }

    public List<String> getFallbacknodes() {
        return fallbacknodes;
    }

    public void setFallbacknodes(List<String> fallbacknodes) {
        this.fallbacknodes = fallbacknodes;
    }

    public String getPrivatekey() {
        return privatekey;
    }

    public void setPrivatekey(String privatekey) {
        this.privatekey = privatekey;
    }

    public String getTransport() {
        return transport;
    }

    public void setTransport(String transport) {
        this.transport = transport;
    }

    public Boolean getServiceReady() {
        return serviceReady;
    }

    public void setServiceReady(Boolean serviceReady) {
        this.serviceReady = serviceReady;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("nodeid", nodeid).add("peers", peers)
                .add("fallbacknodes", fallbacknodes).add("transport", transport).add("serviceReady", serviceReady)
                .toString();
    }
}
