/*******************************************************************************
 *  Copyright   2018  Inasset GmbH.
 *
 *******************************************************************************/
package net.dagmesh.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.dagmesh.core.DagNode;
import net.dagmesh.core.exception.InvariantViolationException;

/**
 * Keeps the DAG in memory as an id keyed table. Parents and children are
 * referenced by id only, so a node can be struck out without touching the
 * objects of its neighbours.
 *
 * Not thread safe, callers hold the lock of the owning service.
 */
public class MemoryDagStore {

    private final Map<String, DagNode> nodes = new LinkedHashMap<String, DagNode>();
    private final Map<String, List<String>> children = new HashMap<String, List<String>>();
    private final Set<String> tips = new LinkedHashSet<String>();
    private final Set<String> roots = new LinkedHashSet<String>();
    private final Map<String, List<String>> forkPoints = new LinkedHashMap<String, List<String>>();
    // node id -> all transitive ancestors accepted at insertion
    private final Map<String, Set<String>> validatedPaths = new HashMap<String, Set<String>>();
    private final Map<String, Integer> suspicious = new LinkedHashMap<String, Integer>();

    public DagNode get(String nodeId) {
        return nodes.get(nodeId);
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public int size() {
        return nodes.size();
    }

    public Collection<DagNode> getAll() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<String> getTips() {
        return Collections.unmodifiableSet(tips);
    }

    public Set<String> getRoots() {
        return Collections.unmodifiableSet(roots);
    }

    public List<String> getChildren(String nodeId) {
        List<String> c = children.get(nodeId);
        return c == null ? Collections.<String>emptyList() : Collections.unmodifiableList(c);
    }

    public Set<String> getAncestors(String nodeId) {
        Set<String> a = validatedPaths.get(nodeId);
        return a == null ? Collections.<String>emptySet() : Collections.unmodifiableSet(a);
    }

    public Map<String, List<String>> getForkPoints() {
        Map<String, List<String>> copy = new LinkedHashMap<String, List<String>>();
        for (Map.Entry<String, List<String>> e : forkPoints.entrySet()) {
            copy.put(e.getKey(), new ArrayList<String>(e.getValue()));
        }
        return copy;
    }

    public Map<String, Integer> getSuspicious() {
        return new LinkedHashMap<String, Integer>(suspicious);
    }

    /**
     * Links an already validated node into the table. Returns the parents that
     * became fork points because of it.
     */
    public List<String> insert(DagNode node) {
        String id = node.getNodeId();
        nodes.put(id, node);

        Set<String> ancestors = new HashSet<String>();
        for (String parent : node.getParents()) {
            ancestors.add(parent);
            ancestors.addAll(getAncestors(parent));
            tips.remove(parent);
        }
        validatedPaths.put(id, ancestors);
        tips.add(id);
        if (node.getParents().isEmpty()) {
            roots.add(id);
        }

        List<String> forked = new ArrayList<String>();
        for (String parent : node.getParents()) {
            List<String> c = children.get(parent);
            if (c == null) {
                c = new ArrayList<String>();
                children.put(parent, c);
            }
            c.add(id);
            if (c.size() > 1) {
                List<String> forks = forkPoints.get(parent);
                if (forks == null) {
                    forks = new ArrayList<String>();
                    forkPoints.put(parent, forks);
                }
                forks.add(id);
                forked.add(parent);
            }
        }
        return forked;
    }

    public int forkCount(String parent) {
        List<String> forks = forkPoints.get(parent);
        return forks == null ? 0 : forks.size();
    }

    public void markSuspicious(String nodeId) {
        Integer count = suspicious.get(nodeId);
        suspicious.put(nodeId, count == null ? 1 : count + 1);
    }

    /**
     * Strikes a node from every structure. Surviving children keep their parent
     * reference, their cached ancestry keeps resolving the nodes above it.
     */
    public void remove(String nodeId) {
        DagNode node = nodes.remove(nodeId);
        if (node == null) {
            return;
        }
        tips.remove(nodeId);
        roots.remove(nodeId);
        validatedPaths.remove(nodeId);
        for (Set<String> ancestors : validatedPaths.values()) {
            ancestors.remove(nodeId);
        }

        forkPoints.remove(nodeId);
        for (Iterator<List<String>> it = forkPoints.values().iterator(); it.hasNext();) {
            List<String> forks = it.next();
            forks.remove(nodeId);
            if (forks.isEmpty()) {
                it.remove();
            }
        }

        children.remove(nodeId);
        for (String parent : node.getParents()) {
            List<String> c = children.get(parent);
            if (c != null) {
                c.remove(nodeId);
                if (c.isEmpty()) {
                    children.remove(parent);
                }
            }
        }
        suspicious.remove(nodeId);
    }

    /**
     * Throws when a derived structure refers to a node that is not in the
     * table.
     */
    public void checkIntegrity() {
        for (String id : tips) {
            requirePresent(id, "tips");
        }
        for (String id : roots) {
            requirePresent(id, "roots");
        }
        for (Map.Entry<String, List<String>> e : forkPoints.entrySet()) {
            requirePresent(e.getKey(), "fork point");
            for (String id : e.getValue()) {
                requirePresent(id, "fork list of " + e.getKey());
            }
        }
        for (Map.Entry<String, List<String>> e : children.entrySet()) {
            requirePresent(e.getKey(), "children index");
            for (String id : e.getValue()) {
                requirePresent(id, "children of " + e.getKey());
            }
        }
        for (Map.Entry<String, Set<String>> e : validatedPaths.entrySet()) {
            requirePresent(e.getKey(), "ancestry cache");
            for (String id : e.getValue()) {
                requirePresent(id, "ancestry of " + e.getKey());
            }
        }
        for (String id : suspicious.keySet()) {
            requirePresent(id, "suspicious nodes");
        }
    }

    private void requirePresent(String id, String where) {
        if (!nodes.containsKey(id)) {
            throw new InvariantViolationException("Dangling reference to " + id + " in " + where);
        }
    }
}
