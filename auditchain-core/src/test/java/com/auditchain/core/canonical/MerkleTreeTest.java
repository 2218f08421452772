package com.auditchain.core.canonical;

import com.auditchain.core.ChainFixtures;
import com.auditchain.core.domain.AuditEntry;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class MerkleTreeTest {

    private static List<String> leaves(int count) {
        return ChainFixtures.chain("orders", count).stream().map(AuditEntry::entryHash).toList();
    }

    private static String pair(String left, String right) {
        return EntryHasher.sha256Hex((left + right).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void rootOfFourLeaves_isPairwiseHash() {
        // Given
        List<String> l = leaves(4);

        // When
        MerkleTree tree = MerkleTree.build(l);

        // Then
        assertThat(tree.size()).isEqualTo(4);
        assertThat(tree.root()).isEqualTo(pair(pair(l.get(0), l.get(1)), pair(l.get(2), l.get(3))));
    }

    @Test
    void oddLevel_repeatsLastNode() {
        List<String> l = leaves(3);

        assertThat(MerkleTree.build(l).root())
                .isEqualTo(pair(pair(l.get(0), l.get(1)), pair(l.get(2), l.get(2))));
    }

    @Test
    void singleLeaf_isPairedWithItself() {
        String leaf = leaves(1).get(0);

        MerkleTree tree = MerkleTree.build(List.of(leaf));

        assertThat(tree.root()).isEqualTo(pair(leaf, leaf));
        assertThat(MerkleTree.rootOf(leaf, tree.proof(0))).isEqualTo(tree.root());
    }

    @Test
    void emptyLeaves_areRejected() {
        assertThatThrownBy(() -> MerkleTree.build(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void everyLeafProvesToRoot_andPathEncodesItsIndex() {
        // Given
        List<String> l = leaves(7);
        MerkleTree tree = MerkleTree.build(l);

        // When / Then
        IntStream.range(0, l.size()).forEach(i -> {
            List<MerkleTree.ProofStep> proof = tree.proof(i);
            assertThat(MerkleTree.rootOf(l.get(i), proof)).isEqualTo(tree.root());
            assertThat(MerkleTree.indexOf(proof)).isEqualTo(i);
        });
    }

    @Test
    void proofForOneLeaf_doesNotProveAnother() {
        // Given
        List<String> l = leaves(5);
        MerkleTree tree = MerkleTree.build(l);

        // When
        String reached = MerkleTree.rootOf(l.get(2), tree.proof(1));

        // Then
        assertThat(reached).isNotEqualTo(tree.root());
    }

    @Test
    void tamperedSibling_changesRoot() {
        // Given
        List<String> l = leaves(6);
        MerkleTree tree = MerkleTree.build(l);
        List<MerkleTree.ProofStep> proof = tree.proof(4);
        MerkleTree.ProofStep first = proof.get(0);
        List<MerkleTree.ProofStep> tampered = new ArrayList<>(proof);
        tampered.set(0, new MerkleTree.ProofStep("ab".repeat(32), first.siblingOnLeft()));

        // When / Then
        assertThat(MerkleTree.rootOf(l.get(4), tampered)).isNotEqualTo(tree.root());
    }

    @Test
    void proofOutsideLeaves_isRejected() {
        MerkleTree tree = MerkleTree.build(leaves(3));

        assertThatThrownBy(() -> tree.proof(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> tree.proof(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
