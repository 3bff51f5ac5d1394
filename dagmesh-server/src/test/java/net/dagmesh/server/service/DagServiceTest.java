/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import net.dagmesh.core.DagNode;
import net.dagmesh.core.ECKey;
import net.dagmesh.core.NodeType;
import net.dagmesh.core.Utils;
import net.dagmesh.server.config.DagConfiguration;

public class DagServiceTest {

    private DagConfiguration dagConfiguration;
    private ECKey key;
    private DagService dagService;
    private long now;
    private int counter;

    @BeforeEach
    public void setUp() {
        Utils.setMockClock();
        now = Utils.currentTimeMillis();
        dagConfiguration = new DagConfiguration();
        key = new ECKey();
        dagService = new DagService(dagConfiguration, key);
    }

    @AfterEach
    public void tearDown() {
        Utils.resetMocking();
    }

    private DagNode node(long timestamp, String... parents) {
        byte[] data = ("payload-" + counter++).getBytes(StandardCharsets.UTF_8);
        DagNode n = DagNode.create(NodeType.BLOCK, Arrays.asList(parents), timestamp, data);
        dagService.signNode(n);
        return n;
    }

    @Test
    public void rootChildrenAndCommonAncestor() {
        DagNode r = node(now - 4000);
        assertTrue(dagService.addNode(r));
        assertEquals(0, dagService.getNode(r.getNodeId()).getHeight());

        DagNode c1 = node(now - 3000, r.getNodeId());
        assertTrue(dagService.addNode(c1));
        assertEquals(1, dagService.getNode(c1.getNodeId()).getHeight());

        List<String> tipsBefore = dagService.getTipIds();
        Set<String> rootsBefore = dagService.getRoots();
        Map<String, List<String>> forksBefore = dagService.getForkPoints();
        assertFalse(dagService.addNode(c1));
        assertEquals(tipsBefore, dagService.getTipIds());
        assertEquals(rootsBefore, dagService.getRoots());
        assertEquals(forksBefore, dagService.getForkPoints());
        assertEquals(2, dagService.size());

        DagNode c2 = node(now - 2999, r.getNodeId());
        assertTrue(dagService.addNode(c2));
        assertEquals(1, dagService.getNode(c2.getNodeId()).getHeight());
        assertEquals(Collections.singletonList(c2.getNodeId()), dagService.getForkPoints().get(r.getNodeId()));

        DagNode g = node(now - 2000, c1.getNodeId());
        assertTrue(dagService.addNode(g));
        assertEquals(2, dagService.getNode(g.getNodeId()).getHeight());

        assertEquals(Optional.of(r.getNodeId()), dagService.getCommonAncestor(c1.getNodeId(), c2.getNodeId()));
        assertEquals(Optional.of(c1.getNodeId()), dagService.getCommonAncestor(g.getNodeId(), c1.getNodeId()));
        assertEquals(Optional.of(r.getNodeId()), dagService.getCommonAncestor(g.getNodeId(), c2.getNodeId()));
        assertEquals(new HashSet<String>(Arrays.asList(c2.getNodeId(), g.getNodeId())),
                new HashSet<String>(dagService.getTipIds()));
        assertEquals(Collections.singleton(r.getNodeId()), dagService.getRoots());
    }

    @Test
    public void heightAndWeight() {
        DagNode r = node(now - 4000);
        DagNode a = node(now - 3000, r.getNodeId());
        DagNode b = node(now - 2900, r.getNodeId());
        DagNode m = node(now - 2000, a.getNodeId(), b.getNodeId());
        assertTrue(dagService.addNode(r));
        assertTrue(dagService.addNode(a));
        assertTrue(dagService.addNode(b));
        assertTrue(dagService.addNode(m));

        assertEquals(1.0, dagService.getNode(r.getNodeId()).getWeight(), 1e-9);
        assertEquals(2.0, dagService.getNode(a.getNodeId()).getWeight(), 1e-9);
        DagNode merged = dagService.getNode(m.getNodeId());
        assertEquals(2, merged.getHeight());
        assertEquals(3.0, merged.getWeight(), 1e-9);
        assertEquals(Collections.singletonList(m.getNodeId()), dagService.getTipIds());
    }

    @Test
    public void heightsAreTopological() {
        DagNode r = node(now - 10000);
        assertTrue(dagService.addNode(r));
        List<DagNode> added = new ArrayList<DagNode>();
        added.add(r);
        for (int i = 1; i < 20; i++) {
            DagNode p1 = added.get(added.size() - 1);
            DagNode p2 = added.get(i / 2);
            DagNode n = p1.getNodeId().equals(p2.getNodeId()) ? node(now - 10000 + i * 10, p1.getNodeId())
                    : node(now - 10000 + i * 10, p1.getNodeId(), p2.getNodeId());
            assertTrue(dagService.addNode(n));
            added.add(n);
        }
        for (DagNode n : added) {
            DagNode stored = dagService.getNode(n.getNodeId());
            for (String parent : stored.getParents()) {
                assertTrue(dagService.getNode(parent).getHeight() < stored.getHeight());
                assertTrue(dagService.isAncestor(parent, stored.getNodeId()));
            }
        }
    }

    @Test
    public void rejectsMissingParent() {
        DagNode orphan = node(now - 1000, "unknown");
        assertFalse(dagService.addNode(orphan));
        assertEquals(0, dagService.size());
        assertTrue(dagService.getTipIds().isEmpty());
    }

    @Test
    public void rejectsSelfReference() {
        DagNode r = node(now - 2000);
        assertTrue(dagService.addNode(r));
        DagNode self = new DagNode("self", NodeType.BLOCK, Arrays.asList(r.getNodeId(), "self"), now - 1000,
                new byte[] { 1 });
        dagService.signNode(self);
        assertFalse(dagService.addNode(self));
        assertFalse(dagService.contains("self"));
    }

    @Test
    public void rejectsTimestampOutsideWindow() {
        DagNode stale = node(now - 300001);
        assertFalse(dagService.addNode(stale));
        DagNode future = node(now + 300001);
        assertFalse(dagService.addNode(future));
        DagNode edge = node(now - 300000);
        assertTrue(dagService.addNode(edge));
    }

    @Test
    public void historicalNodesSkipOnlyTheWindow() {
        DagNode old = node(now - 7200000);
        assertTrue(dagService.addNode(old, false));

        DagNode orphan = node(now - 7100000, "unknown");
        assertFalse(dagService.addNode(orphan, false));

        DagNode tampered = node(now - 7000000, old.getNodeId());
        tampered.setData("other".getBytes(StandardCharsets.UTF_8));
        assertFalse(dagService.addNode(tampered, false));
    }

    @Test
    public void rejectsParentNotOlder() {
        DagNode r = node(now - 1000);
        assertTrue(dagService.addNode(r));
        DagNode same = node(now - 1000, r.getNodeId());
        assertFalse(dagService.addNode(same));
        DagNode older = node(now - 1500, r.getNodeId());
        assertFalse(dagService.addNode(older));
        assertEquals(1, dagService.size());
    }

    @Test
    public void rejectsBadSignatures() {
        DagNode r = node(now - 1000);
        r.setData("changed".getBytes(StandardCharsets.UTF_8));
        assertFalse(dagService.addNode(r));

        DagNode unsigned = DagNode.create(NodeType.BLOCK, Collections.<String>emptyList(), now - 1000,
                new byte[] { 1 });
        assertFalse(dagService.addNode(unsigned));

        DagNode garbage = node(now - 900);
        garbage.setSignature("zz");
        assertFalse(dagService.addNode(garbage));

        DagNode otherKey = node(now - 800);
        otherKey.setPublicKey(new ECKey().getPublicKeyString());
        assertFalse(dagService.addNode(otherKey));

        assertEquals(0, dagService.size());
    }

    @Test
    public void acceptsNodesOfOtherProducers() {
        ECKey producer = new ECKey();
        DagNode n = DagNode.create(NodeType.CHECKPOINT, Collections.<String>emptyList(), now - 10, new byte[] { 7 });
        n.setPublicKey(producer.getPublicKeyString());
        n.setSignature(Utils.HEX.encode(producer.sign(n.getSigningHash()).encodeToDER()));
        assertTrue(dagService.addNode(n));
    }

    @Test
    public void trustedKeysRestrictProducers() {
        dagConfiguration.setTrustedkeys(Collections.singletonList(new ECKey().getPublicKeyString()));
        assertFalse(dagService.addNode(node(now - 10)));

        dagConfiguration.setTrustedkeys(Collections.singletonList(key.getPublicKeyString()));
        assertTrue(dagService.addNode(node(now - 5)));
    }

    @Test
    public void rejectsMalformed() {
        DagNode n = node(now - 10);
        n.setNodeType(null);
        assertFalse(dagService.addNode(n));
        assertFalse(dagService.addNode(null));
        DagNode noId = node(now - 10);
        noId.setNodeId(null);
        assertFalse(dagService.addNode(noId));
    }

    @Test
    public void marksSuspiciousForks() {
        DagNode r = node(now - 5000);
        assertTrue(dagService.addNode(r));
        List<DagNode> children = new ArrayList<DagNode>();
        for (int i = 0; i < 5; i++) {
            DagNode c = node(now - 4000 + i, r.getNodeId());
            assertTrue(dagService.addNode(c));
            children.add(c);
        }
        // the first child is not a fork, the second to fifth are
        assertEquals(4, dagService.getForkPoints().get(r.getNodeId()).size());
        // one crowded fork point is not enough to report the fifth child
        assertTrue(dagService.getSuspiciousNodes().isEmpty());
    }

    @Test
    public void reportsNodesExtendingManyCrowdedForks() {
        List<String> roots = new ArrayList<String>();
        for (int r = 0; r < 4; r++) {
            DagNode root = node(now - 9000 + r);
            assertTrue(dagService.addNode(root));
            roots.add(root.getNodeId());
            for (int i = 0; i < 4; i++) {
                assertTrue(dagService.addNode(node(now - 8000 + r * 10 + i, root.getNodeId())));
            }
        }
        assertTrue(dagService.getSuspiciousNodes().isEmpty());

        DagNode merge = node(now - 1000, roots.toArray(new String[0]));
        assertTrue(dagService.addNode(merge));
        for (String root : roots) {
            assertEquals(4, dagService.getForkPoints().get(root).size());
        }
        Map<String, Integer> suspicious = dagService.getSuspiciousNodes();
        assertEquals(1, suspicious.size());
        assertEquals(Integer.valueOf(4), suspicious.get(merge.getNodeId()));
    }

    @Test
    public void pathsAndAncestry() {
        DagNode r = node(now - 4000);
        DagNode c1 = node(now - 3000, r.getNodeId());
        DagNode c2 = node(now - 2999, r.getNodeId());
        DagNode g = node(now - 2000, c1.getNodeId());
        for (DagNode n : Arrays.asList(r, c1, c2, g)) {
            assertTrue(dagService.addNode(n));
        }
        assertEquals(Arrays.asList(g.getNodeId(), c1.getNodeId(), r.getNodeId()),
                dagService.getPathToRoot(g.getNodeId()));
        assertTrue(dagService.getPathToRoot("unknown").isEmpty());

        assertTrue(dagService.isAncestor(r.getNodeId(), g.getNodeId()));
        assertTrue(dagService.isAncestor(g.getNodeId(), g.getNodeId()));
        assertFalse(dagService.isAncestor(c2.getNodeId(), g.getNodeId()));
        assertFalse(dagService.isAncestor(g.getNodeId(), r.getNodeId()));
        assertFalse(dagService.getCommonAncestor(g.getNodeId(), "unknown").isPresent());

        assertEquals(Arrays.asList(g.getNodeId()), dagService.getInventory(1));
        assertEquals(4, dagService.getInventory(100).size());
    }

    @Test
    public void storedNodesAreCopies() {
        DagNode r = node(now - 1000);
        assertTrue(dagService.addNode(r));
        r.getParents().add("mutated");
        DagNode stored = dagService.getNode(r.getNodeId());
        assertTrue(stored.getParents().isEmpty());
        stored.setHeight(99);
        assertEquals(0, dagService.getNode(r.getNodeId()).getHeight());
        assertNull(dagService.getNode("unknown"));
    }

    @Test
    public void pruneKeepsTipsAndLastRoot() {
        DagNode r = node(now - 7200000);
        DagNode a = node(now - 7100000, r.getNodeId());
        DagNode a2 = node(now - 7099000, r.getNodeId());
        assertTrue(dagService.addNode(r, false));
        assertTrue(dagService.addNode(a, false));
        assertTrue(dagService.addNode(a2, false));
        assertNotNull(dagService.getForkPoints().get(r.getNodeId()));

        DagNode t1 = node(now - 1000, a.getNodeId());
        DagNode t2 = node(now - 999, a2.getNodeId());
        assertTrue(dagService.addNode(t1));
        assertTrue(dagService.addNode(t2));

        assertEquals(2, dagService.pruneOldNodes(3600000));

        assertEquals(3, dagService.size());
        assertFalse(dagService.contains(a.getNodeId()));
        assertFalse(dagService.contains(a2.getNodeId()));
        assertEquals(Collections.singleton(r.getNodeId()), dagService.getRoots());
        assertTrue(dagService.getForkPoints().isEmpty());
        assertTrue(dagService.isAncestor(r.getNodeId(), t1.getNodeId()));
        assertTrue(dagService.isAncestor(r.getNodeId(), t2.getNodeId()));
        assertFalse(dagService.isAncestor(a.getNodeId(), t1.getNodeId()));
        assertEquals(new HashSet<String>(Arrays.asList(t1.getNodeId(), t2.getNodeId())),
                new HashSet<String>(dagService.getTipIds()));

        // nothing left to prune
        assertEquals(0, dagService.pruneOldNodes(3600000));
    }

    @Test
    public void pruneNeverRemovesTips() {
        DagNode r = node(now - 7200000);
        assertTrue(dagService.addNode(r, false));
        Utils.rollMockClock(3600 * 5);
        assertEquals(0, dagService.pruneOldNodes(1000));
        assertTrue(dagService.contains(r.getNodeId()));
    }

    @Test
    public void prunedSurvivorsAcceptChildren() {
        DagNode r = node(now - 7200000);
        DagNode a = node(now - 7100000, r.getNodeId());
        DagNode b = node(now - 2000, a.getNodeId());
        assertTrue(dagService.addNode(r, false));
        assertTrue(dagService.addNode(a, false));
        assertTrue(dagService.addNode(b));
        assertEquals(1, dagService.pruneOldNodes(3600000));

        DagNode c = node(now - 1000, b.getNodeId());
        assertTrue(dagService.addNode(c));
        assertEquals(Arrays.asList(c.getNodeId(), b.getNodeId()), dagService.getPathToRoot(c.getNodeId()));
    }

    @Test
    public void rejectsNodeClosingACycle() {
        DagNode r = node(now - 7200000);
        DagNode x = node(now - 7100000, r.getNodeId());
        DagNode y = node(now - 2000, x.getNodeId());
        assertTrue(dagService.addNode(r, false));
        assertTrue(dagService.addNode(x, false));
        assertTrue(dagService.addNode(y));
        assertEquals(1, dagService.pruneOldNodes(3600000));
        assertFalse(dagService.contains(x.getNodeId()));

        // reuses the pruned id and points back at its own descendant
        DagNode loop = node(now - 1000, y.getNodeId());
        loop.setNodeId(x.getNodeId());
        dagService.signNode(loop);

        List<String> tipsBefore = dagService.getTipIds();
        Set<String> rootsBefore = dagService.getRoots();
        Map<String, List<String>> forksBefore = dagService.getForkPoints();
        assertFalse(dagService.addNode(loop));
        assertFalse(dagService.contains(x.getNodeId()));
        assertEquals(tipsBefore, dagService.getTipIds());
        assertEquals(rootsBefore, dagService.getRoots());
        assertEquals(forksBefore, dagService.getForkPoints());
        assertEquals(2, dagService.size());
    }

    @Test
    public void concurrentInsertsAreSerialized() throws Exception {
        final DagNode r = node(now - 5000);
        assertTrue(dagService.addNode(r));
        final List<DagNode> children = new ArrayList<DagNode>();
        for (int i = 0; i < 50; i++) {
            children.add(node(now - 4000 + i, r.getNodeId()));
        }
        final DagNode contested = node(now - 100, r.getNodeId());

        ExecutorService executor = Executors.newFixedThreadPool(8);
        final CountDownLatch start = new CountDownLatch(1);
        final AtomicInteger contestedWins = new AtomicInteger();
        List<Future<Boolean>> futures = new ArrayList<Future<Boolean>>();
        try {
            for (final DagNode c : children) {
                futures.add(executor.submit(new Callable<Boolean>() {
                    @Override
                    public Boolean call() throws Exception {
                        start.await();
                        if (dagService.addNode(new DagNode(contested))) {
                            contestedWins.incrementAndGet();
                        }
                        return dagService.addNode(c);
                    }
                }));
            }
            start.countDown();
            for (Future<Boolean> f : futures) {
                assertTrue(f.get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, contestedWins.get());
        assertEquals(52, dagService.size());
        assertEquals(51, dagService.getTipIds().size());
        assertEquals(50, dagService.getForkPoints().get(r.getNodeId()).size());
    }
}
