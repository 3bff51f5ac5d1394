/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.data;

import com.google.common.base.MoreObjects;

public class SyncStatus {

    private SyncState state;
    private int activeSessions;
    private int totalMissingBlocks;
    private int totalReceivedBlocks;

    public SyncStatus() {
    }

    public SyncStatus(SyncState state, int activeSessions, int totalMissingBlocks, int totalReceivedBlocks) {
        this.state = state;
        this.activeSessions = activeSessions;
        this.totalMissingBlocks = totalMissingBlocks;
        this.totalReceivedBlocks = totalReceivedBlocks;
    }

    public SyncState getState() {
        return state;
    }

    public void setState(SyncState state) {
        this.state = state;
    }

    public int getActiveSessions() {
        return activeSessions;
    }

    public void setActiveSessions(int activeSessions) {
        this.activeSessions = activeSessions;
    }

    public int getTotalMissingBlocks() {
        return totalMissingBlocks;
    }

    public void setTotalMissingBlocks(int totalMissingBlocks) {
        this.totalMissingBlocks = totalMissingBlocks;
    }

    public int getTotalReceivedBlocks() {
        return totalReceivedBlocks;
    }

    public void setTotalReceivedBlocks(int totalReceivedBlocks) {
        this.totalReceivedBlocks = totalReceivedBlocks;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("state", state).add("activeSessions", activeSessions)
                .add("missing", totalMissingBlocks).add("received", totalReceivedBlocks).toString();
    }
}
