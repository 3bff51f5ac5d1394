/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.net;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dagmesh.server.service.GossipService;

/**
 * In-process network of gossip endpoints. Delivery is synchronous on the
 * sending thread; a detached endpoint is unreachable.
 */
public class LoopbackNetwork {
    private static final Logger log = LoggerFactory.getLogger(LoopbackNetwork.class);

    private final Map<String, GossipService> endpoints = new ConcurrentHashMap<String, GossipService>();

    public void attach(String nodeId, GossipService gossipService) {
        endpoints.put(nodeId, gossipService);
    }

    public void detach(String nodeId) {
        endpoints.remove(nodeId);
    }

    public boolean isAttached(String nodeId) {
        return endpoints.containsKey(nodeId);
    }

    public boolean deliver(String from, String to, byte[] data) {
        GossipService target = endpoints.get(to);
        if (target == null) {
            log.debug("{} -> {}: not attached", from, to);
            return false;
        }
        target.receive(data, from);
        return true;
    }

    public Transport transport(String localId) {
        return new LoopbackTransport(this, localId);
    }
}
