/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.data;

import java.util.ArrayList;
import java.util.List;

/**
 * Answer of a peer to a get_tips request.
 */
public class PeerReport {

    private String peerId;
    private List<String> tips = new ArrayList<String>();
    private List<String> blocks = new ArrayList<String>();
    private long receivedAt;

    public PeerReport() {
    }

    public PeerReport(String peerId, List<String> tips, List<String> blocks, long receivedAt) {
        this.peerId = peerId;
        this.tips = tips;
        this.blocks = blocks;
        this.receivedAt = receivedAt;
    }

    public String getPeerId() {
        return peerId;
    }

    public void setPeerId(String peerId) {
        this.peerId = peerId;
    }

    public List<String> getTips() {
        return tips;
    }

    public void setTips(List<String> tips) {
        this.tips = tips;
    }

    public List<String> getBlocks() {
        return blocks;
    }

    public void setBlocks(List<String> blocks) {
        this.blocks = blocks;
    }

    public long getReceivedAt() {
        return receivedAt;
    }

    public void setReceivedAt(long receivedAt) {
        this.receivedAt = receivedAt;
    }
}
