/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.google.common.base.Stopwatch;

import jakarta.annotation.PostConstruct;
import net.dagmesh.core.DagNode;
import net.dagmesh.core.GossipMessage;
import net.dagmesh.core.MessageType;
import net.dagmesh.core.Utils;
import net.dagmesh.server.config.ServerConfiguration;
import net.dagmesh.server.config.SyncConfiguration;
import net.dagmesh.server.data.PeerReport;
import net.dagmesh.server.data.SyncSession;
import net.dagmesh.server.data.SyncState;
import net.dagmesh.server.data.SyncStatus;

/**
 * <p>
 * Closes gaps between the local DAG and the DAGs of the peers.
 * </p>
 * <p>
 * A pass asks every peer for its tips and block inventory, waits for the
 * reports to settle, and opens one {@link SyncSession} per peer for the ids the
 * local DAG does not hold. Delivered nodes are inserted parents first;
 * unknown parents of delivered nodes are requested in the next round. A
 * session ends when nothing is missing, or after {@code sync.maxretries}
 * rounds.
 * </p>
 * <p>
 * Only one pass runs at a time. Sessions are independent and each one is
 * guarded by its own monitor.
 * </p>
 */
@Service
public class SyncService implements SyncRequestResponder {

    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    public static final String REQUEST_TYPE = "request_type";
    public static final String GET_TIPS = "get_tips";
    public static final String TIPS = "tips";
    public static final String MISSING_BLOCKS = "missing_blocks";
    public static final String SESSION_ID = "session_id";
    public static final String BLOCKS = "blocks";

    private enum Outcome {
        WAIT, RETRY, COMPLETE
    }

    private final String nodeId;
    private final SyncConfiguration syncConfiguration;
    private final DagService dagService;
    private final GossipService gossipService;

    private final AtomicReference<SyncState> state = new AtomicReference<SyncState>(SyncState.IDLE);
    // keyed by peer id
    private final Map<String, SyncSession> activeSessions = new ConcurrentHashMap<String, SyncSession>();
    private final Map<String, PeerReport> peerReports = new ConcurrentHashMap<String, PeerReport>();

    @Autowired
    public SyncService(ServerConfiguration serverConfiguration, SyncConfiguration syncConfiguration,
            DagService dagService, GossipService gossipService) {
        this.nodeId = serverConfiguration.getNodeid();
        this.syncConfiguration = syncConfiguration;
        this.dagService = dagService;
        this.gossipService = gossipService;
    }

    @PostConstruct
    public void init() {
        gossipService.setSyncRequestResponder(this);
        gossipService.addMessageListener(MessageType.SYNC_RESPONSE, this::onSyncResponse);
    }

    /**
     * Runs one reconciliation pass.
     *
     * @return false when another pass was running or this one failed
     */
    public boolean syncWithNetwork() {
        if (!state.compareAndSet(SyncState.IDLE, SyncState.SYNCING)) {
            log.warn("sync already in progress, state {}", state.get());
            return false;
        }
        Stopwatch watch = Stopwatch.createStarted();
        try {
            peerReports.clear();
            Map<String, Object> request = new LinkedHashMap<String, Object>();
            request.put(REQUEST_TYPE, GET_TIPS);
            gossipService.broadcast(gossipService.createMessage(MessageType.SYNC_REQUEST, request), true);

            if (syncConfiguration.getSettledelay() > 0) {
                Thread.sleep(syncConfiguration.getSettledelay());
            }
            state.set(SyncState.VALIDATING);

            Set<String> missing = identifyMissingBlocks();
            if (!missing.isEmpty()) {
                requestMissingBlocks(missing);
            }
            log.info("sync pass: {} peer reports, {} blocks missing, {} sessions open, {} ms", peerReports.size(),
                    missing.size(), activeSessions.size(), watch.elapsed(TimeUnit.MILLISECONDS));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.set(SyncState.ERROR);
            return false;
        } catch (RuntimeException e) {
            log.error("network sync failed", e);
            state.set(SyncState.ERROR);
            return false;
        } finally {
            state.set(SyncState.IDLE);
        }
    }

    /*
     * Everything a peer reported that the local table does not hold. Local tips
     * are part of the table, so they are never requested again.
     */
    private Set<String> identifyMissingBlocks() {
        Set<String> missing = new LinkedHashSet<String>();
        for (PeerReport report : peerReports.values()) {
            for (String id : report.getTips()) {
                if (!dagService.contains(id)) {
                    missing.add(id);
                }
            }
            for (String id : report.getBlocks()) {
                if (!dagService.contains(id)) {
                    missing.add(id);
                }
            }
        }
        return missing;
    }

    private void requestMissingBlocks(Set<String> missing) {
        for (String peer : gossipService.getPeers()) {
            List<String> wanted = new ArrayList<String>();
            PeerReport report = peerReports.get(peer);
            for (String id : missing) {
                if (dagService.contains(id)) {
                    continue;
                }
                if (report == null || report.getTips().contains(id) || report.getBlocks().contains(id)) {
                    wanted.add(id);
                }
            }
            if (wanted.isEmpty()) {
                continue;
            }
            long now = Utils.currentTimeMillis();
            SyncSession session = activeSessions.computeIfAbsent(peer, p -> new SyncSession(nodeId, p, now));
            synchronized (session) {
                session.addMissing(wanted);
                session.touch(now);
                session.setState(SyncState.SYNCING);
            }
            log.debug("requesting {} blocks from {}", wanted.size(), peer);
            sendRequest(session);
        }
    }

    private void sendRequest(SyncSession session) {
        Map<String, Object> payload = new LinkedHashMap<String, Object>();
        synchronized (session) {
            payload.put(MISSING_BLOCKS, new ArrayList<String>(session.getMissingBlocks()));
            payload.put(SESSION_ID, session.getSessionId());
            if (session.getRetries() > 0) {
                payload.put("retry", session.getRetries());
            }
        }
        if (!gossipService.send(session.getPeerId(), gossipService.createMessage(MessageType.SYNC_REQUEST, payload))) {
            log.warn("sync request of session {} not delivered", session.getSessionId());
        }
    }

    @Override
    public Map<String, Object> respond(GossipMessage request, String from) {
        Map<String, Object> payload = request.getPayload();
        if (GET_TIPS.equals(payload.get(REQUEST_TYPE))) {
            Map<String, Object> answer = new LinkedHashMap<String, Object>();
            answer.put(REQUEST_TYPE, TIPS);
            answer.put(TIPS, dagService.getTipIds());
            answer.put(BLOCKS, dagService.getInventory(syncConfiguration.getMaxinventory()));
            return answer;
        }
        Object requested = payload.get(MISSING_BLOCKS);
        if (requested instanceof Collection) {
            Map<String, Object> blocks = new LinkedHashMap<String, Object>();
            for (Object id : (Collection<?>) requested) {
                DagNode node = dagService.getNode(String.valueOf(id));
                if (node != null) {
                    blocks.put(node.getNodeId(), node.toMap());
                }
            }
            log.debug("serving {} of {} requested blocks to {}", blocks.size(), ((Collection<?>) requested).size(),
                    from);
            Map<String, Object> answer = new LinkedHashMap<String, Object>();
            answer.put(BLOCKS, blocks);
            answer.put(SESSION_ID, payload.get(SESSION_ID));
            return answer;
        }
        log.warn("unknown sync request {} from {}", request.getMessageId(), from);
        return null;
    }

    private void onSyncResponse(GossipMessage message, String from) {
        if (TIPS.equals(message.getPayload().get(REQUEST_TYPE))) {
            recordReport(message, from);
        } else {
            handleSyncResponse(message, from);
        }
    }

    private void recordReport(GossipMessage message, String from) {
        PeerReport report = new PeerReport(from, stringList(message.getPayload().get(TIPS)),
                stringList(message.getPayload().get(BLOCKS)), Utils.currentTimeMillis());
        peerReports.put(from, report);
        log.debug("{} reported {} tips, {} blocks", from, report.getTips().size(), report.getBlocks().size());
    }

    /**
     * Inserts the nodes a peer delivered for its session and decides whether
     * the session is done, retried or given up.
     */
    @SuppressWarnings("unchecked")
    public void handleSyncResponse(GossipMessage message, String from) {
        SyncSession session = activeSessions.get(from);
        if (session == null) {
            log.warn("sync response from {} without an active session", from);
            return;
        }
        Object sessionId = message.getPayload().get(SESSION_ID);
        if (sessionId != null && !sessionId.equals(session.getSessionId())) {
            log.warn("sync response for stale session {} from {}", sessionId, from);
            return;
        }
        Object delivered = message.getPayload().get(BLOCKS);
        Map<String, Object> blocks = delivered instanceof Map ? (Map<String, Object>) delivered
                : Collections.<String, Object>emptyMap();

        Outcome outcome;
        synchronized (session) {
            if (activeSessions.get(from) != session) {
                return;
            }
            session.touch(Utils.currentTimeMillis());
            session.setState(SyncState.VALIDATING);

            for (Map.Entry<String, Object> e : blocks.entrySet()) {
                if (!session.getMissingBlocks().contains(e.getKey()) || !(e.getValue() instanceof Map)) {
                    continue;
                }
                DagNode node = decode((Map<String, Object>) e.getValue());
                if (node == null || !e.getKey().equals(node.getNodeId())) {
                    log.warn("undecodable block {} from {}", e.getKey(), from);
                    continue;
                }
                session.defer(node);
            }
            insertDeferred(session);

            for (String id : new ArrayList<String>(session.getMissingBlocks())) {
                if (dagService.contains(id)) {
                    session.resolved(id);
                }
            }
            // ask for the parents that kept a delivered node out
            for (DagNode node : session.getDeferredBlocks().values()) {
                for (String parent : node.getParents()) {
                    if (!dagService.contains(parent) && !session.getDeferredBlocks().containsKey(parent)) {
                        session.addMissing(parent);
                    }
                }
            }

            if (session.isComplete()) {
                session.setState(SyncState.IDLE);
                outcome = Outcome.COMPLETE;
            } else if (session.getRetries() < syncConfiguration.getMaxretries()) {
                session.incrementRetries();
                session.setState(SyncState.SYNCING);
                outcome = Outcome.RETRY;
            } else {
                log.warn("sync with {} failed after {} retries, {} blocks missing", from, session.getRetries(),
                        session.getMissingBlocks().size());
                session.setState(SyncState.ERROR);
                outcome = Outcome.COMPLETE;
            }
        }

        if (outcome == Outcome.RETRY) {
            sendRequest(session);
        } else if (outcome == Outcome.COMPLETE) {
            completeSession(session);
        }
    }

    /*
     * Inserts deferred nodes whose parents are all present, lowest first,
     * until a round makes no progress.
     */
    private void insertDeferred(SyncSession session) {
        boolean progress = true;
        while (progress) {
            progress = false;
            List<DagNode> ready = new ArrayList<DagNode>(session.getDeferredBlocks().values());
            Collections.sort(ready, new Comparator<DagNode>() {
                @Override
                public int compare(DagNode a, DagNode b) {
                    return Integer.compare(a.getHeight(), b.getHeight());
                }
            });
            for (DagNode node : ready) {
                if (dagService.contains(node.getNodeId())) {
                    session.resolved(node.getNodeId());
                    progress = true;
                } else if (parentsPresent(node) && dagService.addNode(node, false)) {
                    session.received(node);
                    progress = true;
                }
            }
        }
    }

    private boolean parentsPresent(DagNode node) {
        for (String parent : node.getParents()) {
            if (!dagService.contains(parent)) {
                return false;
            }
        }
        return true;
    }

    private DagNode decode(Map<String, Object> map) {
        try {
            return DagNode.fromMap(map);
        } catch (IllegalArgumentException e) {
            log.debug("cannot decode block: {}", e.getMessage());
            return null;
        }
    }

    private void completeSession(SyncSession session) {
        if (!activeSessions.remove(session.getPeerId(), session)) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<String, Object>();
        synchronized (session) {
            payload.put(SESSION_ID, session.getSessionId());
            payload.put("received_blocks", new ArrayList<String>(session.getReceivedBlocks().keySet()));
            log.info("sync session {} closed in state {}: {} received, {} missing", session.getSessionId(),
                    session.getState(), session.getReceivedBlocks().size(), session.getMissingBlocks().size());
        }
        gossipService.broadcast(gossipService.createMessage(MessageType.ACK, payload), false);
    }

    /**
     * Retries sessions that have been idle longer than {@code sync.timeout} and
     * closes those that are out of retries.
     */
    public void monitorSessions() {
        long now = Utils.currentTimeMillis();
        for (SyncSession session : activeSessions.values()) {
            Outcome outcome = Outcome.WAIT;
            synchronized (session) {
                if (!session.isIdle(now, syncConfiguration.getTimeout())) {
                    continue;
                }
                if (session.getRetries() < syncConfiguration.getMaxretries()) {
                    session.incrementRetries();
                    session.touch(now);
                    session.setState(SyncState.SYNCING);
                    outcome = Outcome.RETRY;
                } else {
                    log.warn("sync session {} timed out", session.getSessionId());
                    session.setState(SyncState.ERROR);
                    outcome = Outcome.COMPLETE;
                }
            }
            if (outcome == Outcome.RETRY) {
                sendRequest(session);
            } else {
                completeSession(session);
            }
        }
    }

    public SyncStatus getSyncStatus() {
        int missing = 0;
        int received = 0;
        for (SyncSession session : activeSessions.values()) {
            synchronized (session) {
                missing += session.getMissingBlocks().size();
                received += session.getReceivedBlocks().size();
            }
        }
        return new SyncStatus(state.get(), activeSessions.size(), missing, received);
    }

    public SyncState getState() {
        return state.get();
    }

    public Map<String, SyncSession> getActiveSessions() {
        return new HashMap<String, SyncSession>(activeSessions);
    }

    public Map<String, PeerReport> getPeerReports() {
        return new HashMap<String, PeerReport>(peerReports);
    }

    private static List<String> stringList(Object value) {
        List<String> list = new ArrayList<String>();
        if (value instanceof Collection) {
            for (Object o : (Collection<?>) value) {
                list.add(String.valueOf(o));
            }
        }
        return list;
    }
}
