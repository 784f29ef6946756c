/*
 * This file is part of JCBDD.
 * Copyright (c) 2024 The JCBDD authors.
 *
 * JCBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JCBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JCBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jcbdd;

import static de.tum.in.jcbdd.Util.checkState;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores the nodes of a diagram. For each level there is a unique table mapping the content of a node, i.e.
 * (level, then, else), to the single resident node with that content. Insertion is an atomic check-then-insert, so
 * concurrent attempts to create the same node yield exactly one resident node.
 *
 * <p>Each inner node carries a reference count, which is the number of owned edges pointing to it (from parent nodes
 * and from outside). Nodes with a reference count of zero are removed by {@link #collectGarbage()}.</p>
 *
 * <p>Lookups, insertions and reference counting may happen concurrently. {@link #collectGarbage()} and
 * {@link #ensureLevels(int)} require exclusive access to the table.</p>
 */
public final class NodeTable {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    private final Terminal terminal = new Terminal();
    private final Edge trueEdge = Edge.borrowed(terminal, EdgeTag.NONE);
    private final Edge falseEdge = Edge.borrowed(terminal, EdgeTag.COMPLEMENTED);

    private final int maximumNodeCount;
    private final int initialLevelCapacity;
    private volatile UniqueTable[] levels = new UniqueTable[0];

    private final AtomicInteger nodeCount = new AtomicInteger();
    private final AtomicInteger nextNodeId = new AtomicInteger();
    /* Number of nodes whose reference count dropped to zero since the last collection. This is only an approximation
     * of the dead node count, as a node might be revived after it became unreferenced and nodes might only be kept
     * alive by dead parents. */
    private final LongAdder approximateDeadNodeCount = new LongAdder();

    // Statistics
    private final LongAdder createdNodes = new LongAdder();
    private final LongAdder lookups = new LongAdder();
    private final LongAdder lookupHits = new LongAdder();
    private final LongAdder allocationFailures = new LongAdder();
    private long garbageCollectionCount = 0;
    private long garbageCollectedNodeCount = 0;
    private long garbageCollectionTime = 0;

    public NodeTable(int maximumNodeCount, int initialLevelCapacity) {
        this.maximumNodeCount = maximumNodeCount;
        this.initialLevelCapacity = initialLevelCapacity;
    }

    /**
     * Returns a borrowed edge to the terminal which denotes the given {@code value}.
     */
    public Edge terminalEdge(boolean value) {
        return value ? trueEdge : falseEdge;
    }

    public int maximumNodeCount() {
        return maximumNodeCount;
    }

    /**
     * Makes sure that nodes can be stored on all levels below {@code count}. Requires exclusive access.
     */
    void ensureLevels(int count) {
        UniqueTable[] levels = this.levels;
        if (count <= levels.length) {
            return;
        }
        UniqueTable[] grown = Arrays.copyOf(levels, count);
        for (int level = levels.length; level < count; level++) {
            grown[level] = new UniqueTable(initialLevelCapacity);
        }
        logger.log(Level.FINE, "Growing levels of {0} from {1} to {2}", new Object[] {this, levels.length, count});
        this.levels = grown;
    }

    // Nodes

    /**
     * Finds the resident node equal to {@code candidate} or makes {@code candidate} resident. In the former case, the
     * children of the candidate are released. In both cases an owned edge with the given {@code tag} to the resident
     * node is returned.
     *
     * @throws NodeAllocationException
     *     if the candidate would be a new node but the table is full. The children of the candidate are released.
     */
    Edge insert(InnerNode candidate, EdgeTag tag) throws NodeAllocationException {
        UniqueTable[] levels = this.levels;
        assert candidate.level() < levels.length : "Level " + candidate.level() + " does not exist";
        Map<InnerNode, InnerNode> table = levels[candidate.level()].nodes;

        lookups.increment();
        InnerNode node = table.get(candidate);
        if (node == null) {
            if (nodeCount.incrementAndGet() > maximumNodeCount) {
                nodeCount.decrementAndGet();
                allocationFailures.increment();
                releaseChildren(candidate);
                throw new NodeAllocationException(maximumNodeCount);
            }
            candidate.assignId(nextNodeId.getAndIncrement());
            node = table.putIfAbsent(candidate, candidate);
            if (node == null) {
                createdNodes.increment();
                node = candidate;
            } else {
                // Another thread inserted the same node in between
                nodeCount.decrementAndGet();
                lookupHits.increment();
                releaseChildren(candidate);
            }
        } else {
            lookupHits.increment();
            releaseChildren(candidate);
        }
        node.incrementReferences();
        return Edge.owned(node, tag);
    }

    private void releaseChildren(InnerNode node) {
        dropEdge(node.ownedThen());
        dropEdge(node.ownedElse());
    }

    // Reference counting

    /**
     * Returns a new owned edge equal to the given one.
     */
    public Edge cloneEdge(Edge edge) {
        Node node = edge.node();
        if (!node.isTerminal()) {
            ((InnerNode) node).incrementReferences();
        }
        return Edge.owned(node, edge.tag());
    }

    /**
     * Releases the given owned edge.
     */
    public void dropEdge(Edge edge) {
        assert edge.isOwned() : "Dropping borrowed edge " + edge;
        Node node = edge.node();
        if (!node.isTerminal() && ((InnerNode) node).decrementReferences() == 0) {
            approximateDeadNodeCount.increment();
        }
    }

    /**
     * Returns the reference count of the node of the given edge or {@literal -1} for the terminal.
     */
    public int referenceCount(Edge edge) {
        Node node = edge.node();
        return node.isTerminal() ? -1 : ((InnerNode) node).referenceCount();
    }

    public int nodeCount() {
        return nodeCount.get();
    }

    long approximateDeadNodeCount() {
        return approximateDeadNodeCount.sum();
    }

    /**
     * Counts the inner nodes reachable from the given {@code edge}.
     */
    public int nodeCount(Edge edge) {
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(edge.node());
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.isTerminal() || !visited.add(node)) {
                continue;
            }
            InnerNode inner = (InnerNode) node;
            stack.push(inner.ownedThen().node());
            stack.push(inner.ownedElse().node());
        }
        return visited.size();
    }

    // Memory management

    /**
     * Removes all nodes which are not referenced anymore. Requires exclusive access to the table.
     *
     * @return Number of freed nodes.
     */
    int collectGarbage() {
        long startTimestamp = System.currentTimeMillis();
        logger.log(Level.FINE, "Running GC on {0} with {1} nodes and approximately {2} dead nodes", new Object[] {
            this, nodeCount.get(), approximateDeadNodeCount.sum()
        });

        // Children always are on a greater level than their parents, hence a single pass in ascending level order
        // also frees nodes which only were kept alive by dead parents.
        int freedNodes = 0;
        for (UniqueTable level : levels) {
            Iterator<InnerNode> iterator = level.nodes.values().iterator();
            while (iterator.hasNext()) {
                InnerNode node = iterator.next();
                if (node.referenceCount() == 0) {
                    iterator.remove();
                    releaseChildren(node);
                    freedNodes += 1;
                }
            }
        }
        nodeCount.addAndGet(-freedNodes);
        approximateDeadNodeCount.reset();

        garbageCollectionCount += 1;
        garbageCollectedNodeCount += freedNodes;
        garbageCollectionTime += System.currentTimeMillis() - startTimestamp;
        logger.log(Level.FINE, "Collected {0} nodes", freedNodes);
        return freedNodes;
    }

    // Integrity checks and utility

    /**
     * Performs integrity / invariant checks. Requires that no other thread modifies the table.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        UniqueTable[] levels = this.levels;
        Map<InnerNode, Integer> parentCount = new IdentityHashMap<>();

        int count = 0;
        for (int level = 0; level < levels.length; level++) {
            for (Map.Entry<InnerNode, InnerNode> entry : levels[level].nodes.entrySet()) {
                InnerNode node = entry.getValue();
                count += 1;
                checkState(entry.getKey() == node, "Node (%s) is stored under a different key", node);
                checkState(node.level() == level, "Node (%s) is stored on level %d", node, level);
                checkState(!node.ownedThen().isComplemented(), "Node (%s) has a complemented then edge", node);
                checkState(!node.ownedThen().equals(node.ownedElse()), "Node (%s) is redundant", node);
                checkState(node.referenceCount() >= 0, "Node (%s) has negative reference count", node);

                for (Edge child : new Edge[] {node.ownedThen(), node.ownedElse()}) {
                    checkState(child.isOwned(), "Child (%s) of (%s) is not owned", child, node);
                    if (child.isTerminal()) {
                        checkState(child.node() == terminal, "(%s) -> (%s) points to a foreign terminal", node, child);
                        continue;
                    }
                    InnerNode childNode = (InnerNode) child.node();
                    checkState(level < childNode.level(), "(%s) -> (%s) does not descend", node, childNode);
                    checkState(
                            childNode.level() < levels.length
                                    && levels[childNode.level()].nodes.get(childNode) == childNode,
                            "(%s) -> (%s) is not resident",
                            node,
                            childNode);
                    parentCount.merge(childNode, 1, Integer::sum);
                }
            }
        }
        checkState(count == nodeCount.get(), "Invalid # of nodes: counted %d, expected %d", count, nodeCount.get());

        parentCount.forEach((node, parents) -> checkState(
                parents <= node.referenceCount(),
                "Node (%s) has %d parents but only %d references",
                node,
                parents,
                node.referenceCount()));
        return true;
    }

    public String statistics() {
        long lookups = this.lookups.sum();
        long hits = lookupHits.sum();
        UniqueTable[] levels = this.levels;
        int largestLevel = 0;
        for (UniqueTable level : levels) {
            largestLevel = Math.max(largestLevel, level.nodes.size());
        }

        return String.format(
                "Node table statistics:%n"
                        + "%1$d levels (largest %2$d nodes), %3$d nodes (max %4$d), %5$d created nodes%n"
                        + "Unique table: %6$d lookups, %7$d hits (%8$.2f), %9$d allocation failures%n"
                        + "%10$d GC runs (%11$.2f s), %12$d freed",
                levels.length,
                largestLevel,
                nodeCount.get(),
                maximumNodeCount,
                createdNodes.sum(),
                lookups,
                hits,
                hits * 1.0 / Math.max(lookups, 1L),
                allocationFailures.sum(),
                garbageCollectionCount,
                garbageCollectionTime / 1000.0,
                garbageCollectedNodeCount);
    }

    private static final class UniqueTable {
        final Map<InnerNode, InnerNode> nodes;

        UniqueTable(int initialCapacity) {
            this.nodes = new ConcurrentHashMap<>(initialCapacity);
        }
    }
}
