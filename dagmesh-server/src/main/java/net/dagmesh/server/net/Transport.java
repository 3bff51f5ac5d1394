/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.net;

/**
 * Hands an encoded gossip message to a peer. Implementations deliver to the
 * remote {@code GossipService#receive(byte[], String)}.
 */
public interface Transport {

    /**
     * @return false when the peer could not be reached
     */
    boolean send(String peerId, byte[] data);
}
