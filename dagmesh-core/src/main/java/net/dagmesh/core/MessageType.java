/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core;

public enum MessageType {
    BLOCK, TRANSACTION, PEER_DISCOVERY, SYNC_REQUEST, SYNC_RESPONSE, FALLBACK_REQUEST, FALLBACK_RESPONSE, ACK;

    /**
     * Replies travel point to point and are never relayed.
     */
    public boolean isReply() {
        return this == SYNC_RESPONSE || this == FALLBACK_RESPONSE;
    }

    /**
     * Ledger content whose delivery failures go through the fallback nodes.
     */
    public boolean isPayload() {
        return this == BLOCK || this == TRANSACTION;
    }
}
