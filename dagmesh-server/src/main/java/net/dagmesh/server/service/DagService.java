/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.server.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.google.common.base.Preconditions;

import net.dagmesh.core.DagNode;
import net.dagmesh.core.ECKey;
import net.dagmesh.core.Utils;
import net.dagmesh.core.exception.VerificationException;
import net.dagmesh.core.exception.VerificationException.AncestryException;
import net.dagmesh.core.exception.VerificationException.CycleException;
import net.dagmesh.core.exception.VerificationException.DuplicateNodeException;
import net.dagmesh.core.exception.VerificationException.InvalidSignatureException;
import net.dagmesh.core.exception.VerificationException.MalformedNodeException;
import net.dagmesh.core.exception.VerificationException.MissingParentException;
import net.dagmesh.core.exception.VerificationException.TimestampOutOfRangeException;
import net.dagmesh.server.config.DagConfiguration;
import net.dagmesh.store.MemoryDagStore;
import net.dagmesh.utils.Threading;

/**
 * <p>
 * Owns the local DAG. Every insert is validated against the rules below, in
 * this order, and the first failing rule rejects the node without touching any
 * structure:
 * </p>
 * <ol>
 * <li>well formed: id, type and timestamp present</li>
 * <li>not already present</li>
 * <li>timestamp within {@code dag.maxtimedrift} of local time (skipped for
 * historical nodes inserted with {@code validate=false})</li>
 * <li>every parent present, no self reference</li>
 * <li>no cycle through the declared parents</li>
 * <li>every parent strictly older</li>
 * <li>signature valid for the embedded public key</li>
 * </ol>
 * <p>
 * All reads and writes go through one lock, so cycle detection and tip
 * bookkeeping always observe a consistent table.
 * </p>
 */
@Service
public class DagService {

    private static final Logger log = LoggerFactory.getLogger(DagService.class);

    private final DagConfiguration dagConfiguration;
    private final ECKey nodeKey;
    private final MemoryDagStore store = new MemoryDagStore();

    protected final ReentrantLock lock = Threading.lock("DagService");

    @Autowired
    public DagService(DagConfiguration dagConfiguration, ECKey nodeKey) {
        this.dagConfiguration = dagConfiguration;
        this.nodeKey = nodeKey;
    }

    public boolean addNode(DagNode node) {
        return addNode(node, true);
    }

    /**
     * Validates and inserts a node.
     *
     * @param validate false for nodes fetched during reconciliation, their
     *                 age is expected to exceed the freshness window
     * @return false when the node was rejected, the reason is logged
     */
    public boolean addNode(DagNode node, boolean validate) {
        lock.lock();
        try {
            checkNode(node, validate);
            DagNode stored = new DagNode(node);
            updateMetrics(stored);
            List<String> forked = store.insert(stored);
            for (String parent : forked) {
                if (store.forkCount(parent) > dagConfiguration.getForkthreshold()) {
                    log.warn("node {} extends fork point {} with {} branches", stored.getNodeId(), parent,
                            store.forkCount(parent));
                    store.markSuspicious(stored.getNodeId());
                }
            }
            log.debug("added node {} height {} weight {}", stored.getNodeId(), stored.getHeight(),
                    stored.getWeight());
            return true;
        } catch (DuplicateNodeException e) {
            log.debug(e.getMessage());
            return false;
        } catch (VerificationException e) {
            log.warn("rejected node: {}", e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void checkNode(DagNode node, boolean validate) {
        if (node == null) {
            throw new MalformedNodeException("null");
        }
        if (node.getNodeId() == null || node.getNodeId().isEmpty()) {
            throw new MalformedNodeException("missing node id");
        }
        if (node.getNodeType() == null) {
            throw new MalformedNodeException("missing type on " + node.getNodeId());
        }
        if (node.getTimestamp() <= 0) {
            throw new MalformedNodeException("missing timestamp on " + node.getNodeId());
        }
        if (store.contains(node.getNodeId())) {
            throw new DuplicateNodeException(node.getNodeId());
        }
        if (validate) {
            long now = Utils.currentTimeMillis();
            if (Math.abs(now - node.getTimestamp()) > dagConfiguration.getMaxtimedrift()) {
                throw new TimestampOutOfRangeException(node.getTimestamp(), now, dagConfiguration.getMaxtimedrift());
            }
        }
        for (String parent : node.getParents()) {
            if (node.getNodeId().equals(parent) || !store.contains(parent)) {
                throw new MissingParentException(node.getNodeId(), parent);
            }
        }
        if (wouldCreateCycle(node)) {
            throw new CycleException(node.getNodeId());
        }
        for (String parent : node.getParents()) {
            if (store.get(parent).getTimestamp() >= node.getTimestamp()) {
                throw new AncestryException(node.getNodeId(), parent);
            }
        }
        verifySignature(node);
    }

    /*
     * Walks up from the declared parents through the current table looking for
     * the candidate id. Nothing is inserted while searching.
     */
    private boolean wouldCreateCycle(DagNode node) {
        Deque<String> stack = new ArrayDeque<String>(node.getParents());
        Set<String> visited = new HashSet<String>();
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(node.getNodeId())) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            DagNode n = store.get(current);
            if (n != null) {
                stack.addAll(n.getParents());
            }
        }
        return false;
    }

    private void verifySignature(DagNode node) {
        if (node.getSignature() == null || node.getPublicKey() == null) {
            throw new InvalidSignatureException(node.getNodeId(), "unsigned");
        }
        List<String> trusted = dagConfiguration.getTrustedkeys();
        if (trusted != null && !trusted.isEmpty() && !trusted.contains(node.getPublicKey())) {
            throw new InvalidSignatureException(node.getNodeId(), "untrusted key " + node.getPublicKey());
        }
        boolean valid;
        try {
            valid = ECKey.verify(node.getSigningHash(), Utils.HEX.decode(node.getSignature()),
                    Utils.HEX.decode(node.getPublicKey()));
        } catch (IllegalArgumentException e) {
            throw new InvalidSignatureException(node.getNodeId(), "undecodable " + e.getMessage());
        }
        if (!valid) {
            throw new InvalidSignatureException(node.getNodeId(), "verification failed");
        }
    }

    private void updateMetrics(DagNode node) {
        if (node.getParents().isEmpty()) {
            node.setHeight(0);
            node.setWeight(1.0);
            return;
        }
        int maxHeight = 0;
        double totalWeight = 0;
        for (String parent : node.getParents()) {
            DagNode p = store.get(parent);
            maxHeight = Math.max(maxHeight, p.getHeight());
            totalWeight += p.getWeight();
        }
        node.setHeight(maxHeight + 1);
        node.setWeight(1.0 + totalWeight / node.getParents().size());
    }

    /** Signs the node with the key of this process. */
    public void signNode(DagNode node) {
        Preconditions.checkNotNull(node.getNodeId(), "node id");
        node.setPublicKey(nodeKey.getPublicKeyString());
        node.setSignature(Utils.HEX.encode(nodeKey.sign(node.getSigningHash()).encodeToDER()));
    }

    public DagNode getNode(String nodeId) {
        lock.lock();
        try {
            DagNode n = store.get(nodeId);
            return n == null ? null : new DagNode(n);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String nodeId) {
        lock.lock();
        try {
            return store.contains(nodeId);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    public List<DagNode> getTips() {
        lock.lock();
        try {
            List<DagNode> tips = new ArrayList<DagNode>();
            for (String id : store.getTips()) {
                tips.add(new DagNode(store.get(id)));
            }
            return tips;
        } finally {
            lock.unlock();
        }
    }

    public List<String> getTipIds() {
        lock.lock();
        try {
            return new ArrayList<String>(store.getTips());
        } finally {
            lock.unlock();
        }
    }

    public Set<String> getRoots() {
        lock.lock();
        try {
            return new LinkedHashSet<String>(store.getRoots());
        } finally {
            lock.unlock();
        }
    }

    public Map<String, List<String>> getForkPoints() {
        lock.lock();
        try {
            return store.getForkPoints();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Nodes that extended more than {@code dag.forkthreshold} fork points past
     * the threshold, with the number of such fork points. A node extending a
     * single crowded fork point is tracked but not reported.
     */
    public Map<String, Integer> getSuspiciousNodes() {
        lock.lock();
        try {
            Map<String, Integer> suspicious = store.getSuspicious();
            suspicious.values().removeIf(count -> count <= dagConfiguration.getForkthreshold());
            return suspicious;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids of held nodes, highest first, at most {@code limit}.
     */
    public List<String> getInventory(int limit) {
        lock.lock();
        try {
            List<DagNode> all = new ArrayList<DagNode>(store.getAll());
            Collections.sort(all, new Comparator<DagNode>() {
                @Override
                public int compare(DagNode a, DagNode b) {
                    return Integer.compare(b.getHeight(), a.getHeight());
                }
            });
            List<String> ids = new ArrayList<String>();
            for (DagNode n : all) {
                if (ids.size() >= limit) {
                    break;
                }
                ids.add(n.getNodeId());
            }
            return ids;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Follows the first parent of every node until a root, or a parent no
     * longer held, is reached. Starts with the node itself.
     */
    public List<String> getPathToRoot(String nodeId) {
        lock.lock();
        try {
            return pathToRoot(nodeId);
        } finally {
            lock.unlock();
        }
    }

    private List<String> pathToRoot(String nodeId) {
        List<String> path = new ArrayList<String>();
        DagNode current = store.get(nodeId);
        while (current != null) {
            path.add(current.getNodeId());
            if (current.getParents().isEmpty()) {
                break;
            }
            current = store.get(current.getParents().get(0));
        }
        return path;
    }

    /**
     * True when {@code descendant} can reach {@code ancestor} through parent
     * links. A node counts as its own ancestor.
     */
    public boolean isAncestor(String ancestor, String descendant) {
        lock.lock();
        try {
            if (!store.contains(descendant)) {
                return false;
            }
            if (ancestor.equals(descendant)) {
                return true;
            }
            return store.getAncestors(descendant).contains(ancestor);
        } finally {
            lock.unlock();
        }
    }

    /**
     * First node of the first-parent path of {@code b} that also lies on the
     * first-parent path of {@code a}. Roots take part.
     */
    public Optional<String> getCommonAncestor(String a, String b) {
        lock.lock();
        try {
            if (!store.contains(a) || !store.contains(b)) {
                return Optional.empty();
            }
            Set<String> first = new HashSet<String>(pathToRoot(a));
            for (String id : pathToRoot(b)) {
                if (first.contains(id)) {
                    return Optional.of(id);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes nodes older than the given age. Tips are kept, and so is the
     * last remaining root.
     *
     * @return number of removed nodes
     */
    public int pruneOldNodes(long maxAgeMillis) {
        lock.lock();
        try {
            long cutoff = Utils.currentTimeMillis() - maxAgeMillis;
            List<String> candidates = new ArrayList<String>();
            for (DagNode n : store.getAll()) {
                if (n.getTimestamp() < cutoff && !store.getTips().contains(n.getNodeId())) {
                    candidates.add(n.getNodeId());
                }
            }
            int removed = 0;
            for (String id : candidates) {
                if (store.getRoots().contains(id) && store.getRoots().size() == 1) {
                    continue;
                }
                store.remove(id);
                removed++;
            }
            store.checkIntegrity();
            if (removed > 0) {
                log.info("pruned {} nodes older than {}, {} remaining", removed, Utils.dateTimeFormat(cutoff),
                        store.size());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int pruneOldNodes() {
        return pruneOldNodes(dagConfiguration.getPrunemaxage());
    }

    public String getPublicKey() {
        return nodeKey.getPublicKeyString();
    }
}
