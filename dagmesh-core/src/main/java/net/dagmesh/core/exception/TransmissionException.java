/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core.exception;

/**
 * A message could not be handed to a peer. Never surfaces to broadcasting
 * callers; it routes the message to the fallback nodes instead.
 */
@SuppressWarnings("serial")
public class TransmissionException extends Exception {

    private final String peer;

    public TransmissionException(String peer) {
        super("Peer unreachable: " + peer);
        this.peer = peer;
    }

    public TransmissionException(String peer, Throwable cause) {
        super("Peer unreachable: " + peer, cause);
        this.peer = peer;
    }

    public String getPeer() {
        return peer;
    }
}
