/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import net.dagmesh.core.DagNode;
import net.dagmesh.core.GossipMessage;
import net.dagmesh.core.MessageType;
import net.dagmesh.core.NodeType;
import net.dagmesh.core.Utils;

/**
 * <p>
 * Provides services for blocks: creation of signed nodes on top of the current
 * tips, local insertion followed by dissemination, and insertion of nodes
 * arriving through gossip.
 * </p>
 */
@Service
public class BlockService {

    private static final Logger logger = LoggerFactory.getLogger(BlockService.class);

    public static final String NODE = "node";

    private final DagService dagService;
    private final GossipService gossipService;

    @Autowired
    public BlockService(DagService dagService, GossipService gossipService) {
        this.dagService = dagService;
        this.gossipService = gossipService;
    }

    @PostConstruct
    public void init() {
        gossipService.addMessageListener(MessageType.BLOCK, this::onBlock);
    }

    /**
     * A signed node referencing every current tip, timestamped after all of
     * them.
     */
    public DagNode createNode(NodeType type, byte[] data) {
        List<DagNode> tips = dagService.getTips();
        List<String> parents = new ArrayList<String>();
        long timestamp = Utils.currentTimeMillis();
        for (DagNode tip : tips) {
            parents.add(tip.getNodeId());
            timestamp = Math.max(timestamp, tip.getTimestamp() + 1);
        }
        DagNode node = DagNode.create(type, parents, timestamp, data);
        dagService.signNode(node);
        return node;
    }

    /**
     * Inserts the node and, when accepted, broadcasts it with
     * acknowledgements.
     *
     * @return the stored node, empty when the DAG rejected it
     */
    public Optional<DagNode> saveBlock(DagNode node) {
        if (!dagService.addNode(node)) {
            return Optional.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<String, Object>();
        payload.put(NODE, node.toMap());
        GossipMessage message = gossipService.createMessage(MessageType.BLOCK, payload);
        if (!gossipService.broadcast(message, true)) {
            logger.info("block {} not acknowledged by every peer, fallback engaged", node.getNodeId());
        }
        return Optional.ofNullable(dagService.getNode(node.getNodeId()));
    }

    public Optional<DagNode> createAndSave(NodeType type, byte[] data) {
        return saveBlock(createNode(type, data));
    }

    @SuppressWarnings("unchecked")
    private void onBlock(GossipMessage message, String from) {
        Object node = message.getPayload().get(NODE);
        if (!(node instanceof Map)) {
            logger.warn("block message {} from {} without node", message.getMessageId(), from);
            return;
        }
        DagNode received;
        try {
            received = DagNode.fromMap((Map<String, Object>) node);
        } catch (IllegalArgumentException e) {
            logger.warn("undecodable node in {} from {}: {}", message.getMessageId(), from, e.getMessage());
            return;
        }
        if (dagService.addNode(received)) {
            logger.debug("block {} from {} added", received.getNodeId(), from);
        }
    }
}
