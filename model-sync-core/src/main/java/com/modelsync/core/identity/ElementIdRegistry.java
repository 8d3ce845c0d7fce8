package com.modelsync.core.identity;

import com.modelsync.core.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Assigns stable element IDs to AST nodes across reparses.
 *
 * <p>Every parse produces new node instances, so identity is carried by a
 * {@link Fingerprint} instead of the node reference. {@link #reconcile(AstNode, String)}
 * walks a fresh tree and:
 * <ul>
 *   <li>reuses the ID of every fingerprint seen before</li>
 *   <li>mints a random UUID for every new fingerprint</li>
 *   <li>prunes IDs whose fingerprint no longer occurs</li>
 * </ul>
 *
 * <p>Nodes sharing a fingerprint within one tree are told apart by occurrence order, so an
 * ID is never handed to two live nodes at once.
 *
 * <p>Not thread-safe: a registry belongs to one document and is only touched from that
 * document's task queue.
 */
public class ElementIdRegistry {

    private static final Logger log = LoggerFactory.getLogger(ElementIdRegistry.class);

    private final Map<AstNode, String> nodeToId = new IdentityHashMap<>();
    private final Map<String, AstNode> idToNode = new HashMap<>();
    private final Map<String, String> fingerprintToId = new HashMap<>();
    private final Map<String, String> idToFingerprint = new HashMap<>();
    private final Map<String, String> pending = new HashMap<>();
    private boolean reconciled;

    /**
     * Rebuilds the node to ID mapping from a freshly parsed tree.
     *
     * @param root root of the new tree
     * @param uri document URI, for logging
     * @return reconcile statistics
     */
    public ReconcileStats reconcile(AstNode root, String uri) {
        Objects.requireNonNull(root, "root must not be null");

        Map<String, String> known = new HashMap<>(fingerprintToId);
        known.putAll(pending);

        Map<String, Integer> occurrences = new HashMap<>();
        Set<String> claimed = new HashSet<>();
        Map<String, String> newFingerprintToId = new HashMap<>();
        int reused = 0;
        int minted = 0;

        nodeToId.clear();
        idToNode.clear();

        for (AstNode node : root.descendantsAndSelf()) {
            String base = Fingerprint.of(node).key();
            int occurrence = occurrences.merge(base, 1, Integer::sum);
            String key = occurrence == 1 ? base : base + "#" + occurrence;

            String id = known.get(key);
            if (id == null || claimed.contains(id)) {
                id = UUID.randomUUID().toString();
                minted++;
            } else {
                reused++;
            }
            claimed.add(id);
            nodeToId.put(node, id);
            idToNode.put(id, node);
            newFingerprintToId.put(key, id);
            pending.remove(key);
        }

        int pruned = (int) fingerprintToId.values().stream().filter(id -> !claimed.contains(id)).count();

        fingerprintToId.clear();
        fingerprintToId.putAll(newFingerprintToId);
        idToFingerprint.clear();
        newFingerprintToId.forEach((key, id) -> idToFingerprint.put(id, key));
        reconciled = true;

        ReconcileStats stats = new ReconcileStats(reused, minted, pruned);
        log.debug("Reconciled element IDs for {}: {} reused, {} new, {} pruned", uri, reused, minted, pruned);
        return stats;
    }

    /**
     * Returns the element ID of a node of the last reconciled tree.
     *
     * @param node AST node
     * @return element ID, empty if the node is unknown or no reconcile happened
     */
    public Optional<String> getUuid(AstNode node) {
        return Optional.ofNullable(nodeToId.get(node));
    }

    public Optional<AstNode> getAstNode(String elementId) {
        return Optional.ofNullable(idToNode.get(elementId));
    }

    public Optional<String> fingerprintOf(String elementId) {
        return Optional.ofNullable(idToFingerprint.get(elementId));
    }

    /**
     * Reserves an ID for a node that exists on the diagram but not yet in the text. When the
     * materialized text is reparsed, the node with the expected fingerprint takes this ID.
     *
     * @param elementId client-minted element ID
     * @param expected fingerprint the reparsed node will have
     */
    public void registerPending(String elementId, Fingerprint expected) {
        pending.put(expected.key(), elementId);
        log.debug("Registered pending element {} for {}", elementId, expected.key());
    }

    /**
     * Forgets a pending registration, for example when its creation is undone.
     *
     * @param elementId element ID
     */
    public void unregisterPending(String elementId) {
        pending.values().removeIf(elementId::equals);
    }

    /**
     * Exports ID to fingerprint pairs so clients can persist identity across reloads.
     *
     * @return element ID to fingerprint key
     */
    public Map<String, String> exportToLayoutData() {
        Map<String, String> data = new LinkedHashMap<>(idToFingerprint);
        pending.forEach((key, id) -> data.putIfAbsent(id, key));
        return data;
    }

    /**
     * Seeds the registry from previously exported layout data. The next reconcile reuses
     * these IDs for matching fingerprints.
     *
     * @param layoutData element ID to fingerprint key
     */
    public void loadFromLayoutData(Map<String, String> layoutData) {
        layoutData.forEach((id, key) -> {
            fingerprintToId.put(key, id);
            idToFingerprint.put(id, key);
        });
        log.debug("Loaded {} element IDs from layout data", layoutData.size());
    }

    public boolean isReconciled() {
        return reconciled;
    }

    public int size() {
        return nodeToId.size();
    }

    public void clear() {
        nodeToId.clear();
        idToNode.clear();
        fingerprintToId.clear();
        idToFingerprint.clear();
        pending.clear();
        reconciled = false;
    }

    /**
     * Outcome of one reconcile.
     *
     * @param reused IDs carried over from the previous tree
     * @param minted newly minted IDs
     * @param pruned IDs whose fingerprint disappeared
     */
    public record ReconcileStats(int reused, int minted, int pruned) {
    }
}
