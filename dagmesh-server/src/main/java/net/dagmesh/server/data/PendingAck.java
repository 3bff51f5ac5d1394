/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.data;

import java.util.HashSet;
import java.util.Set;

import net.dagmesh.core.GossipMessage;

/**
 * Peers that still owe an acknowledgement for one broadcast. A peer leaves the
 * set exactly once, by acknowledging, by a failed send or by being drained for
 * the fallback path, so no peer is handed to the fallback nodes twice.
 */
public class PendingAck {

    private final GossipMessage message;
    private final Set<String> peers;
    private final long createdAt;
    private boolean abandoned;

    public PendingAck(GossipMessage message, Set<String> peers, long createdAt) {
        this.message = message;
        this.peers = new HashSet<String>(peers);
        this.createdAt = createdAt;
    }

    public synchronized boolean acknowledge(String peer) {
        boolean removed = peers.remove(peer);
        if (peers.isEmpty()) {
            notifyAll();
        }
        return removed;
    }

    /** A send to the peer failed, it no longer owes an acknowledgement. */
    public synchronized boolean remove(String peer) {
        return acknowledge(peer);
    }

    /**
     * Waits until every peer has acknowledged or the timeout elapsed. Returns
     * whether the set is empty.
     */
    public synchronized boolean await(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (!peers.isEmpty()) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            wait(remaining);
        }
        return peers.isEmpty();
    }

    /** Removes and returns the peers that did not acknowledge. */
    public synchronized Set<String> drain() {
        Set<String> remaining = new HashSet<String>(peers);
        abandoned |= !remaining.isEmpty();
        peers.clear();
        notifyAll();
        return remaining;
    }

    /** Whether some peer was drained without acknowledging. */
    public synchronized boolean isAbandoned() {
        return abandoned;
    }

    public synchronized Set<String> getPeers() {
        return new HashSet<String>(peers);
    }

    public GossipMessage getMessage() {
        return message;
    }

    public long getCreatedAt() {
        return createdAt;
    }
}
