/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.data;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.base.MoreObjects;

import net.dagmesh.core.DagNode;

/**
 * Reconciliation state with one peer. Callers synchronize on the session for
 * every read-modify-write.
 */
public class SyncSession {

    private final String peerId;
    private final String sessionId;
    private final long startTime;
    private long lastActivity;
    private final Set<String> missingBlocks = new LinkedHashSet<String>();
    private final Map<String, DagNode> receivedBlocks = new LinkedHashMap<String, DagNode>();
    // delivered but waiting for their parents
    private final Map<String, DagNode> deferredBlocks = new LinkedHashMap<String, DagNode>();
    private SyncState state = SyncState.SYNCING;
    private int retries;

    public SyncSession(String localId, String peerId, long startTime) {
        this.peerId = peerId;
        this.sessionId = localId + "_" + peerId + "_" + startTime;
        this.startTime = startTime;
        this.lastActivity = startTime;
    }

    public void touch(long now) {
        lastActivity = now;
    }

    public boolean isIdle(long now, long timeout) {
        return now - lastActivity > timeout;
    }

    public void addMissing(Collection<String> ids) {
        for (String id : ids) {
            addMissing(id);
        }
    }

    public void addMissing(String id) {
        if (!receivedBlocks.containsKey(id)) {
            missingBlocks.add(id);
        }
    }

    public void defer(DagNode node) {
        deferredBlocks.put(node.getNodeId(), node);
    }

    public void received(DagNode node) {
        missingBlocks.remove(node.getNodeId());
        deferredBlocks.remove(node.getNodeId());
        receivedBlocks.put(node.getNodeId(), node);
    }

    /** An id the local DAG already holds, nothing to receive for it. */
    public void resolved(String nodeId) {
        missingBlocks.remove(nodeId);
        deferredBlocks.remove(nodeId);
    }

    public boolean isComplete() {
        return missingBlocks.isEmpty();
    }

    public int incrementRetries() {
        return ++retries;
    }

    public String getPeerId() {
        return peerId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getLastActivity() {
        return lastActivity;
    }

    public Set<String> getMissingBlocks() {
        return missingBlocks;
    }

    public Map<String, DagNode> getReceivedBlocks() {
        return receivedBlocks;
    }

    public Map<String, DagNode> getDeferredBlocks() {
        return deferredBlocks;
    }

    public SyncState getState() {
        return state;
    }

    public void setState(SyncState state) {
        this.state = state;
    }

    public int getRetries() {
        return retries;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("sessionId", sessionId).add("state", state)
                .add("missing", missingBlocks.size()).add("received", receivedBlocks.size()).add("retries", retries)
                .toString();
    }
}
