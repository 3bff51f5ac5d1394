/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import net.dagmesh.core.GossipMessage;
import net.dagmesh.core.MessageType;
import net.dagmesh.core.Utils;
import net.dagmesh.core.exception.TransmissionException;
import net.dagmesh.server.config.GossipConfiguration;
import net.dagmesh.server.config.ServerConfiguration;
import net.dagmesh.server.data.PendingAck;
import net.dagmesh.server.net.Transport;
import net.dagmesh.utils.Json;
import net.dagmesh.utils.Threading;

/**
 * <p>
 * Epidemic dissemination of messages to the known peers. Every message is
 * processed at most once per node (by message id), acknowledged to the peer
 * that handed it over and, for ledger content, relayed further while its ttl
 * lasts.
 * </p>
 * <p>
 * A broadcast that requires acknowledgements waits for them up to
 * {@code gossip.acktimeout}. Peers that failed or stayed silent are handed to
 * the registered fallback nodes with a FALLBACK_REQUEST, which re-deliver the
 * message and report back with a FALLBACK_RESPONSE.
 * </p>
 */
@Service
public class GossipService {

    private static final Logger log = LoggerFactory.getLogger(GossipService.class);

    public static final String ORIGINAL_MESSAGE_ID = "original_message_id";
    public static final String FAILED_PEER = "failed_peer";

    private final GossipConfiguration gossipConfiguration;
    private final Transport transport;
    private final String nodeId;

    private final Set<String> peers = ConcurrentHashMap.newKeySet();
    private final Set<String> fallbackNodes = ConcurrentHashMap.newKeySet();

    // message id -> local time first seen
    private final Map<String, Long> seenMessages = new ConcurrentHashMap<String, Long>();
    private final Map<String, GossipMessage> messageCache = new ConcurrentHashMap<String, GossipMessage>();
    // node id -> id of the cached BLOCK message carrying it
    private final Map<String, String> blockIndex = new ConcurrentHashMap<String, String>();
    private final Map<String, PendingAck> pendingAcks = new ConcurrentHashMap<String, PendingAck>();

    private final Map<MessageType, List<GossipMessageListener>> listeners = new ConcurrentHashMap<MessageType, List<GossipMessageListener>>();
    private volatile SyncRequestResponder syncRequestResponder;

    private final ExecutorService executor;

    @Autowired
    public GossipService(ServerConfiguration serverConfiguration, GossipConfiguration gossipConfiguration,
            Transport transport) {
        this.gossipConfiguration = gossipConfiguration;
        this.transport = transport;
        this.nodeId = serverConfiguration.getNodeid();
        for (String peer : serverConfiguration.getPeers()) {
            addPeer(peer);
        }
        for (String node : serverConfiguration.getFallbacknodes()) {
            registerFallbackNode(node);
        }
        this.executor = Threading.newWorkerPool("gossip-" + nodeId);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public GossipMessage createMessage(MessageType type, Map<String, Object> payload) {
        return GossipMessage.create(type, payload, nodeId, Utils.currentTimeMillis(), gossipConfiguration.getTtl());
    }

    /**
     * Sends the message to every known peer.
     *
     * @return true when every peer took the message and, if required,
     *         acknowledged it in time
     */
    public boolean broadcast(GossipMessage message, boolean requireAck) {
        seenMessages.putIfAbsent(message.getMessageId(), Utils.currentTimeMillis());
        cacheMessage(message);
        return fanOut(message, requireAck, null);
    }

    private boolean fanOut(final GossipMessage message, boolean requireAck, String exclude) {
        final List<String> targets = new ArrayList<String>(peers);
        if (exclude != null) {
            targets.remove(exclude);
        }
        if (targets.isEmpty()) {
            return true;
        }

        PendingAck pending = null;
        if (requireAck) {
            pending = new PendingAck(message, new HashSet<String>(targets), Utils.currentTimeMillis());
            pendingAcks.put(message.getMessageId(), pending);
        }

        final byte[] data = message.toByteArray();
        List<Future<Boolean>> futures = new ArrayList<Future<Boolean>>();
        for (final String peer : targets) {
            futures.add(executor.submit(() -> deliver(peer, data)));
        }

        boolean allSent = true;
        for (int i = 0; i < targets.size(); i++) {
            String peer = targets.get(i);
            boolean sent;
            try {
                sent = futures.get(i).get();
            } catch (ExecutionException e) {
                log.warn("send of {} to {} failed", message.getMessageId(), peer, e.getCause());
                sent = false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                sent = false;
            }
            if (!sent) {
                allSent = false;
                // other types stay pending, the timeout hands them to the fallback nodes
                if (message.getType().isPayload() && (pending == null || pending.remove(peer))) {
                    handleTransmissionFailure(message, peer);
                }
            }
        }

        if (pending == null) {
            return allSent;
        }
        try {
            pending.await(gossipConfiguration.getAcktimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pendingAcks.remove(message.getMessageId(), pending);
        Set<String> silent = pending.drain();
        for (String peer : silent) {
            log.warn("no acknowledgement of {} from {}", message.getMessageId(), peer);
            handleTransmissionFailure(message, peer);
        }
        return allSent && !pending.isAbandoned();
    }

    /**
     * Point to point send. Failures are logged and reported as false.
     */
    public boolean send(String peer, GossipMessage message) {
        return deliver(peer, message.toByteArray());
    }

    private boolean deliver(String peer, byte[] data) {
        try {
            transmit(peer, data);
            return true;
        } catch (TransmissionException e) {
            log.warn(e.getMessage(), e.getCause());
            return false;
        }
    }

    private void transmit(String peer, byte[] data) throws TransmissionException {
        boolean sent;
        try {
            sent = transport.send(peer, data);
        } catch (RuntimeException e) {
            throw new TransmissionException(peer, e);
        }
        if (!sent) {
            throw new TransmissionException(peer);
        }
    }

    private void handleTransmissionFailure(GossipMessage message, String failedPeer) {
        List<String> targets = new ArrayList<String>(fallbackNodes);
        targets.remove(failedPeer);
        targets.remove(nodeId);
        if (targets.isEmpty()) {
            log.error("no fallback node available for {} to {}", message.getMessageId(), failedPeer);
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<String, Object>();
        payload.put(ORIGINAL_MESSAGE_ID, message.getMessageId());
        payload.put(FAILED_PEER, failedPeer);
        payload.put("retry_count", 0);
        payload.put("original_message", Json.toMap(message));
        GossipMessage request = createMessage(MessageType.FALLBACK_REQUEST, payload);
        seenMessages.putIfAbsent(request.getMessageId(), Utils.currentTimeMillis());

        for (String node : targets) {
            if (send(node, request)) {
                log.info("asked fallback node {} to deliver {} to {}", node, message.getMessageId(), failedPeer);
            } else {
                log.error("fallback transmission to {} failed", node);
            }
        }
    }

    /**
     * Entry point for transports.
     *
     * @param from the peer that delivered the bytes
     */
    public void receive(byte[] data, String from) {
        GossipMessage message;
        try {
            message = GossipMessage.parse(data);
        } catch (IOException e) {
            log.warn("dropped undecodable message from {}: {}", from, e.getMessage());
            return;
        }
        try {
            handleMessage(message, from);
        } catch (RuntimeException e) {
            log.error("failed to handle {} from {}", message, from, e);
        }
    }

    public void handleMessage(GossipMessage message, String from) {
        if (message.getType() == null || message.getMessageId() == null) {
            log.warn("dropped message without type or id from {}", from);
            return;
        }
        if (message.getType() == MessageType.ACK) {
            handleAck(message, from);
            return;
        }
        if (seenMessages.putIfAbsent(message.getMessageId(), Utils.currentTimeMillis()) != null) {
            // the peer still waits for our acknowledgement
            sendAck(message, from);
            return;
        }
        cacheMessage(message);

        switch (message.getType()) {
        case SYNC_REQUEST:
            handleSyncRequest(message, from);
            break;
        case FALLBACK_REQUEST:
            handleFallbackRequest(message, from);
            break;
        case PEER_DISCOVERY:
            handlePeerDiscovery(message);
            notifyListeners(message, from);
            break;
        default:
            notifyListeners(message, from);
        }
        sendAck(message, from);

        if (message.getType().isPayload() && message.getTtl() > 0) {
            fanOut(message.relayCopy(), false, from);
        }
    }

    private void handleAck(GossipMessage message, String from) {
        Object original = message.getPayload().get(ORIGINAL_MESSAGE_ID);
        if (original instanceof String) {
            PendingAck pending = pendingAcks.get(original);
            if (pending != null && pending.acknowledge(from)) {
                log.debug("{} acknowledged {}", from, original);
            }
            return;
        }
        if (seenMessages.putIfAbsent(message.getMessageId(), Utils.currentTimeMillis()) == null) {
            notifyListeners(message, from);
        }
    }

    private void sendAck(GossipMessage message, String to) {
        Map<String, Object> payload = new LinkedHashMap<String, Object>();
        payload.put(ORIGINAL_MESSAGE_ID, message.getMessageId());
        if (!send(to, createMessage(MessageType.ACK, payload))) {
            log.debug("acknowledgement of {} to {} not delivered", message.getMessageId(), to);
        }
    }

    private void handleSyncRequest(GossipMessage message, String from) {
        SyncRequestResponder responder = syncRequestResponder;
        Map<String, Object> answer = responder != null ? responder.respond(message, from) : respondFromCache(message);
        if (answer == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<String, Object>(answer);
        payload.put("request_id", message.getMessageId());
        send(from, createMessage(MessageType.SYNC_RESPONSE, payload));
    }

    /*
     * Without a ledger behind this node, requested ids are looked up in the
     * message cache.
     */
    @SuppressWarnings("unchecked")
    private Map<String, Object> respondFromCache(GossipMessage message) {
        Object requested = message.getPayload().get("missing_blocks");
        if (!(requested instanceof Collection)) {
            return null;
        }
        Map<String, Object> blocks = new LinkedHashMap<String, Object>();
        for (Object id : (Collection<Object>) requested) {
            GossipMessage cached = findCached(String.valueOf(id));
            if (cached != null) {
                Object node = cached.getPayload().get("node");
                blocks.put(String.valueOf(id), node instanceof Map ? node : cached.getPayload());
            }
        }
        Map<String, Object> payload = new LinkedHashMap<String, Object>();
        payload.put("blocks", blocks);
        return payload;
    }

    private GossipMessage findCached(String id) {
        GossipMessage cached = messageCache.get(id);
        if (cached == null) {
            String messageId = blockIndex.get(id);
            if (messageId != null) {
                cached = messageCache.get(messageId);
            }
        }
        return cached;
    }

    @SuppressWarnings("unchecked")
    private void handleFallbackRequest(GossipMessage message, String from) {
        Map<String, Object> payload = message.getPayload();
        String originalId = (String) payload.get(ORIGINAL_MESSAGE_ID);
        String failedPeer = (String) payload.get(FAILED_PEER);
        if (originalId == null || failedPeer == null) {
            log.warn("incomplete fallback request {} from {}", message.getMessageId(), from);
            return;
        }
        GossipMessage original = messageCache.get(originalId);
        if (original == null && payload.get("original_message") instanceof Map) {
            original = Json.fromMap((Map<String, Object>) payload.get("original_message"), GossipMessage.class);
        }

        boolean delivered = false;
        if (original == null) {
            log.warn("fallback request for unknown message {}", originalId);
        } else {
            delivered = send(failedPeer, original);
            log.info("fallback delivery of {} to {}: {}", originalId, failedPeer, delivered ? "ok" : "failed");
        }

        Map<String, Object> response = new LinkedHashMap<String, Object>();
        response.put(ORIGINAL_MESSAGE_ID, originalId);
        response.put(FAILED_PEER, failedPeer);
        response.put("delivered", delivered);
        send(from, createMessage(MessageType.FALLBACK_RESPONSE, response));
    }

    @SuppressWarnings("unchecked")
    private void handlePeerDiscovery(GossipMessage message) {
        addPeer(message.getSender());
        Object announced = message.getPayload().get("peers");
        if (announced instanceof Collection) {
            for (Object peer : (Collection<Object>) announced) {
                addPeer(String.valueOf(peer));
            }
        }
    }

    /** Tells the direct peers about this node and its peer set. */
    public void announcePeers() {
        Map<String, Object> payload = new LinkedHashMap<String, Object>();
        payload.put("peers", new ArrayList<String>(peers));
        broadcast(createMessage(MessageType.PEER_DISCOVERY, payload), false);
    }

    private void notifyListeners(GossipMessage message, String from) {
        List<GossipMessageListener> registered = listeners.get(message.getType());
        if (registered == null) {
            return;
        }
        for (GossipMessageListener listener : registered) {
            try {
                listener.onMessage(message, from);
            } catch (RuntimeException e) {
                log.error("listener failed on {}", message, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void cacheMessage(GossipMessage message) {
        messageCache.put(message.getMessageId(), message);
        if (message.getType() == MessageType.BLOCK && message.getPayload().get("node") instanceof Map) {
            Object id = ((Map<String, Object>) message.getPayload().get("node")).get("nodeId");
            if (id != null) {
                blockIndex.put(String.valueOf(id), message.getMessageId());
            }
        }
    }

    /**
     * Forgets message ids and cached messages older than
     * {@code gossip.messagemaxage}.
     *
     * @return number of forgotten ids
     */
    public int cleanupSeenMessages() {
        long cutoff = Utils.currentTimeMillis() - gossipConfiguration.getMessagemaxage();
        int removed = 0;
        for (Iterator<Map.Entry<String, Long>> it = seenMessages.entrySet().iterator(); it.hasNext();) {
            Map.Entry<String, Long> e = it.next();
            if (e.getValue() < cutoff) {
                it.remove();
                messageCache.remove(e.getKey());
                removed++;
            }
        }
        blockIndex.values().removeIf(messageId -> !messageCache.containsKey(messageId));
        if (removed > 0) {
            log.debug("forgot {} messages, {} remembered", removed, seenMessages.size());
        }
        return removed;
    }

    /**
     * Gives up on broadcasts still waiting after
     * {@code gossip.pendingacktimeout}; their silent peers go to the fallback
     * nodes.
     */
    public void monitorPendingAcks() {
        long now = Utils.currentTimeMillis();
        for (Map.Entry<String, PendingAck> e : pendingAcks.entrySet()) {
            PendingAck pending = e.getValue();
            if (now - pending.getCreatedAt() > gossipConfiguration.getPendingacktimeout()
                    && pendingAcks.remove(e.getKey(), pending)) {
                for (String peer : pending.drain()) {
                    log.warn("acknowledgement of {} from {} overdue", e.getKey(), peer);
                    handleTransmissionFailure(pending.getMessage(), peer);
                }
            }
        }
    }

    public void addMessageListener(MessageType type, GossipMessageListener listener) {
        listeners.computeIfAbsent(type, t -> new CopyOnWriteArrayList<GossipMessageListener>()).add(listener);
    }

    public void setSyncRequestResponder(SyncRequestResponder syncRequestResponder) {
        this.syncRequestResponder = syncRequestResponder;
    }

    public void addPeer(String peer) {
        if (peer != null && !peer.isEmpty() && !peer.equals(nodeId)) {
            peers.add(peer);
        }
    }

    public void removePeer(String peer) {
        peers.remove(peer);
    }

    public Set<String> getPeers() {
        return new HashSet<String>(peers);
    }

    public void registerFallbackNode(String node) {
        fallbackNodes.add(node);
    }

    public void unregisterFallbackNode(String node) {
        fallbackNodes.remove(node);
    }

    public Set<String> getFallbackNodes() {
        return new HashSet<String>(fallbackNodes);
    }

    public boolean hasSeen(String messageId) {
        return seenMessages.containsKey(messageId);
    }

    public GossipMessage getCachedMessage(String messageId) {
        return messageCache.get(messageId);
    }

    public int getPendingAckCount() {
        return pendingAcks.size();
    }

    public String getNodeId() {
        return nodeId;
    }
}
