/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class GossipMessageTest {

    @Test
    public void idDependsOnPayloadTimestampAndSender() {
        Map<String, Object> payload = new LinkedHashMap<String, Object>();
        payload.put("b", 2);
        payload.put("a", 1);
        Map<String, Object> reordered = new HashMap<String, Object>();
        reordered.put("a", 1);
        reordered.put("b", 2);

        GossipMessage m1 = GossipMessage.create(MessageType.BLOCK, payload, "n1", 100L);
        GossipMessage m2 = GossipMessage.create(MessageType.BLOCK, reordered, "n1", 100L);
        assertEquals(m1.getMessageId(), m2.getMessageId());

        assertNotEquals(m1.getMessageId(), GossipMessage.create(MessageType.BLOCK, payload, "n2", 100L).getMessageId());
        assertNotEquals(m1.getMessageId(), GossipMessage.create(MessageType.BLOCK, payload, "n1", 101L).getMessageId());
    }

    @Test
    public void relayCopyKeepsIdentity() {
        Map<String, Object> payload = new HashMap<String, Object>();
        payload.put("k", "v");
        GossipMessage m = GossipMessage.create(MessageType.TRANSACTION, payload, "n1", 5L);
        GossipMessage relayed = m.relayCopy();
        assertEquals(m.getMessageId(), relayed.getMessageId());
        assertEquals(GossipMessage.DEFAULT_TTL - 1, relayed.getTtl());
        assertEquals(GossipMessage.DEFAULT_TTL, m.getTtl());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void wireFormat() throws IOException {
        DagNode node = DagNode.create(NodeType.BLOCK, Arrays.asList("p"), 9L, "x".getBytes(StandardCharsets.UTF_8));
        Map<String, Object> payload = new HashMap<String, Object>();
        payload.put("node", node.toMap());
        payload.put("ids", Arrays.asList("a", "b"));
        GossipMessage m = GossipMessage.create(MessageType.BLOCK, payload, "n1", 5L);

        GossipMessage parsed = GossipMessage.parse(m.toByteArray());
        assertEquals(m.getMessageId(), parsed.getMessageId());
        assertEquals(MessageType.BLOCK, parsed.getType());
        assertEquals("n1", parsed.getSender());
        assertEquals(Arrays.asList("a", "b"), (List<String>) parsed.getPayload().get("ids"));
        assertEquals(node, DagNode.fromMap((Map<String, Object>) parsed.getPayload().get("node")));
        assertEquals(m.getMessageId(),
                GossipMessage.computeMessageId(parsed.getPayload(), parsed.getTimestamp(), parsed.getSender()));
    }

    @Test
    public void garbageIsRejected() {
        assertThrows(IOException.class, () -> GossipMessage.parse("not json".getBytes(StandardCharsets.UTF_8)));
    }
}
