package com.auditchain.core.canonical;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Merkle tree over the entry hashes of one checkpoint segment.
 * <p>
 * Parents are {@code SHA-256(left || right)} over the hex strings. A level with an odd
 * number of nodes repeats its last node. A proof records, per level, the sibling hash and
 * whether the sibling sits on the left, which also fixes the position of the proven leaf.
 */
public final class MerkleTree {

    private final List<String> leaves;
    private final List<List<String>> levels;

    private MerkleTree(List<String> leaves, List<List<String>> levels) {
        this.leaves = Collections.unmodifiableList(leaves);
        this.levels = levels;
    }

    public static MerkleTree build(List<String> leafHashes) {
        if (leafHashes == null || leafHashes.isEmpty()) {
            throw new IllegalArgumentException("Cannot build Merkle tree from empty list");
        }
        List<List<String>> levels = new ArrayList<>();
        List<String> current = padded(new ArrayList<>(leafHashes));
        levels.add(current);

        while (current.size() > 1) {
            List<String> next = new ArrayList<>();
            for (int i = 0; i < current.size(); i += 2) {
                next.add(hashPair(current.get(i), current.get(i + 1)));
            }
            current = next.size() > 1 ? padded(next) : next;
            levels.add(current);
        }
        return new MerkleTree(List.copyOf(leafHashes), levels);
    }

    public String root() {
        List<String> top = levels.get(levels.size() - 1);
        return top.get(0);
    }

    public int size() {
        return leaves.size();
    }

    /**
     * Sibling path from the leaf at {@code leafIndex} to the root.
     */
    public List<ProofStep> proof(int leafIndex) {
        if (leafIndex < 0 || leafIndex >= leaves.size()) {
            throw new IndexOutOfBoundsException("Leaf index out of bounds: " + leafIndex);
        }
        List<ProofStep> steps = new ArrayList<>();
        int index = leafIndex;
        for (int level = 0; level < levels.size() - 1; level++) {
            List<String> nodes = levels.get(level);
            boolean siblingOnLeft = index % 2 != 0;
            steps.add(new ProofStep(nodes.get(siblingOnLeft ? index - 1 : index + 1), siblingOnLeft));
            index /= 2;
        }
        return List.copyOf(steps);
    }

    /**
     * Root reached by walking {@code steps} up from {@code leafHash}.
     */
    public static String rootOf(String leafHash, List<ProofStep> steps) {
        Objects.requireNonNull(leafHash, "Leaf hash cannot be null");
        String current = leafHash;
        for (ProofStep step : steps) {
            current = step.siblingOnLeft() ? hashPair(step.hash(), current) : hashPair(current, step.hash());
        }
        return current;
    }

    /**
     * Leaf position encoded by the sibling sides of {@code steps}.
     */
    public static long indexOf(List<ProofStep> steps) {
        long index = 0;
        for (int level = 0; level < steps.size(); level++) {
            if (steps.get(level).siblingOnLeft()) {
                index |= 1L << level;
            }
        }
        return index;
    }

    private static List<String> padded(List<String> level) {
        if (level.size() % 2 != 0) {
            level.add(level.get(level.size() - 1));
        }
        return level;
    }

    private static String hashPair(String left, String right) {
        return EntryHasher.sha256Hex((left + right).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * One level of an inclusion path.
     */
    public record ProofStep(String hash, boolean siblingOnLeft) {}
}
