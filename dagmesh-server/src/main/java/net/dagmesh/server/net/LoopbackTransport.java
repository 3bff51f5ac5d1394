/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.net;

public class LoopbackTransport implements Transport {

    private final LoopbackNetwork network;
    private final String localId;

    public LoopbackTransport(LoopbackNetwork network, String localId) {
        this.network = network;
        this.localId = localId;
    }

    @Override
    public boolean send(String peerId, byte[] data) {
        return network.deliver(localId, peerId, data);
    }

    public String getLocalId() {
        return localId;
    }
}
