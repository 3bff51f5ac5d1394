/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.google.common.base.MoreObjects;

import net.dagmesh.utils.Json;

/**
 * Unit of dissemination between peers. The message id is a pure function of
 * payload, timestamp and sender, so a message relayed through several peers is
 * recognised as the same message everywhere.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GossipMessage {

    public static final int DEFAULT_TTL = 3;

    private MessageType type;
    private Map<String, Object> payload = new LinkedHashMap<String, Object>();
    private String sender;
    private long timestamp;
    private String messageId;
    private int ttl = DEFAULT_TTL;
    private String signature;

    public GossipMessage() {
    }

    public static GossipMessage create(MessageType type, Map<String, Object> payload, String sender,
            long timestamp) {
        return create(type, payload, sender, timestamp, DEFAULT_TTL);
    }

    public static GossipMessage create(MessageType type, Map<String, Object> payload, String sender, long timestamp,
            int ttl) {
        GossipMessage m = new GossipMessage();
        m.type = type;
        m.payload = new LinkedHashMap<String, Object>(payload);
        m.sender = sender;
        m.timestamp = timestamp;
        m.ttl = ttl;
        m.messageId = computeMessageId(m.payload, timestamp, sender);
        return m;
    }

    public static String computeMessageId(Map<String, Object> payload, long timestamp, String sender) {
        return Utils.sha256Hex(Json.canonical(payload) + timestamp + sender);
    }

    /** Same message one hop further: identical id, ttl reduced by one. */
    public GossipMessage relayCopy() {
        GossipMessage m = new GossipMessage();
        m.type = type;
        m.payload = payload;
        m.sender = sender;
        m.timestamp = timestamp;
        m.messageId = messageId;
        m.ttl = ttl - 1;
        m.signature = signature;
        return m;
    }

    public byte[] toByteArray() {
        try {
            return Json.jsonmapper().writeValueAsBytes(this);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    public static GossipMessage parse(byte[] data) throws IOException {
        return Json.jsonmapper().readValue(data, GossipMessage.class);
    }

    public MessageType getType() {
        return type;
    }

    public void setType(MessageType type) {
        this.type = type;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public String getSender() {
        return sender;
    }

    public void setSender(String sender) {
        this.sender = sender;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public int getTtl() {
        return ttl;
    }

    public void setTtl(int ttl) {
        this.ttl = ttl;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("type", type).add("messageId", messageId).add("sender", sender)
                .add("ttl", ttl).toString();
    }
}
