/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import net.dagmesh.utils.Json;

/**
 * <p>
 * A signed vertex of the ledger DAG. The payload {@link #getData()} is opaque to
 * the ledger; its schema belongs to the producer.
 * </p>
 *
 * <p>
 * The signature covers the canonical encoding of
 * {@code {node_id, type, sorted(parents), timestamp, data}}, see
 * {@link #getSigningData()}. Height and weight are derived by the DAG at
 * insertion and are not part of the signed content.
 * </p>
 */
public class DagNode {

    private String nodeId;
    private NodeType nodeType;
    private List<String> parents = new ArrayList<String>();
    // milliseconds since the epoch, producer clock
    private long timestamp;
    private byte[] data = new byte[0];
    private String signature;
    // compressed secp256k1 key of the producer, hex
    private String publicKey;

    private int height;
    private double weight = 1.0;

    public DagNode() {
    }

    public DagNode(String nodeId, NodeType nodeType, List<String> parents, long timestamp, byte[] data) {
        this.nodeId = nodeId;
        this.nodeType = nodeType;
        this.parents = new ArrayList<String>(parents);
        this.timestamp = timestamp;
        this.data = data;
    }

    public DagNode(DagNode other) {
        this.nodeId = other.nodeId;
        this.nodeType = other.nodeType;
        this.parents = new ArrayList<String>(other.parents);
        this.timestamp = other.timestamp;
        this.data = other.data == null ? null : other.data.clone();
        this.signature = other.signature;
        this.publicKey = other.publicKey;
        this.height = other.height;
        this.weight = other.weight;
    }

    /**
     * Creates an unsigned node whose id is derived from its content.
     */
    public static DagNode create(NodeType nodeType, List<String> parents, long timestamp, byte[] data) {
        Map<String, Object> content = new TreeMap<String, Object>();
        content.put("type", nodeType.name());
        content.put("parents", sorted(parents));
        content.put("timestamp", timestamp);
        content.put("data", data);
        return new DagNode(Utils.sha256Hex(Json.canonical(content)), nodeType, parents, timestamp, data);
    }

    /**
     * The bytes covered by the signature: canonical JSON with sorted keys and
     * sorted parents, UTF-8 encoded.
     */
    @JsonIgnore
    public byte[] getSigningData() {
        Map<String, Object> content = new TreeMap<String, Object>();
        content.put("node_id", nodeId);
        content.put("type", nodeType == null ? null : nodeType.name());
        content.put("parents", sorted(parents));
        content.put("timestamp", timestamp);
        content.put("data", data);
        return Json.canonical(content).getBytes(StandardCharsets.UTF_8);
    }

    /** SHA-256 of {@link #getSigningData()}, the value that is actually signed. */
    @JsonIgnore
    public byte[] getSigningHash() {
        return Utils.sha256(getSigningData());
    }

    @JsonIgnore
    public boolean isRoot() {
        return parents.isEmpty();
    }

    public Map<String, Object> toMap() {
        return Json.toMap(this);
    }

    public static DagNode fromMap(Map<String, Object> map) {
        return Json.fromMap(map, DagNode.class);
    }

    private static List<String> sorted(List<String> parents) {
        List<String> s = new ArrayList<String>(parents == null ? Collections.<String>emptyList() : parents);
        Collections.sort(s);
        return s;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public void setNodeType(NodeType nodeType) {
        this.nodeType = nodeType;
    }

    public List<String> getParents() {
        return parents;
    }

    public void setParents(List<String> parents) {
        this.parents = parents == null ? new ArrayList<String>() : new ArrayList<String>(parents);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public byte[] getData() {
        return data;
    }

    public void setData(byte[] data) {
        this.data = data;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public void setPublicKey(String publicKey) {
        this.publicKey = publicKey;
    }

    public int getHeight() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        DagNode other = (DagNode) o;
        return timestamp == other.timestamp && Objects.equal(nodeId, other.nodeId) && nodeType == other.nodeType
                && Objects.equal(parents, other.parents) && Arrays.equals(data, other.data)
                && Objects.equal(signature, other.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(nodeId, nodeType, parents, timestamp, signature);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("nodeId", nodeId).add("type", nodeType).add("parents", parents)
                .add("timestamp", timestamp).add("height", height).add("weight", weight).toString();
    }
}
