package com.auditchain.blockchain.service;

import com.auditchain.blockchain.contract.CheckpointAnchorContract;
import com.auditchain.core.canonical.EntryHasher;
import com.auditchain.core.domain.CheckpointArtifact;
import com.auditchain.core.export.CheckpointExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Exports checkpoints by anchoring them on an EVM chain.
 * <p>
 * Every anchor is read back after its transaction is mined; the export only counts
 * once the contract returns the same root. Positions are write-once on chain, so a
 * position that already holds the same root counts as exported without a new transaction.
 */
public class BlockchainCheckpointExporter implements CheckpointExporter {

    private static final Logger log = LoggerFactory.getLogger(BlockchainCheckpointExporter.class);

    private final BlockchainConfig config;
    private final CheckpointAnchorContract contract;

    public BlockchainCheckpointExporter(BlockchainConfig config) {
        this(config, config.isEnabled() ? initializeContract(config) : null);
    }

    BlockchainCheckpointExporter(BlockchainConfig config, CheckpointAnchorContract contract) {
        this.config = config;
        this.contract = contract;
    }

    private static CheckpointAnchorContract initializeContract(BlockchainConfig config) {
        Web3j web3j = Web3j.build(new HttpService(config.getNodeUrl()));
        Credentials credentials = Credentials.create(config.getPrivateKey());
        StaticGasProvider gasProvider = new StaticGasProvider(
                BigInteger.valueOf(config.getGasPrice()),
                BigInteger.valueOf(config.getGasLimit()));
        CheckpointAnchorContract contract = CheckpointAnchorContract.load(
                config.getAnchorContractAddress(), web3j, credentials, gasProvider);
        log.info("Checkpoint anchor contract initialized at {}", config.getAnchorContractAddress());
        return contract;
    }

    @Override
    public String export(CheckpointArtifact artifact) {
        if (!isEnabled()) {
            throw new IllegalStateException("Blockchain anchoring is disabled");
        }
        Optional<String> existing = anchoredRoot(artifact.chainId(), artifact.sequence());
        if (existing.isPresent()) {
            if (!existing.get().equals(artifact.rootHash())) {
                throw new IllegalStateException("Chain already holds a different root for " + describe(artifact));
            }
            log.info("Checkpoint {} already anchored, skipping transaction", describe(artifact));
            return "evm:" + config.getAnchorContractAddress() + "/anchor/" + artifact.chainId() + "/" + artifact.sequence();
        }
        byte[] chainKey = chainKey(artifact.chainId());
        byte[] root = hexToBytes32(artifact.rootHash());
        BigInteger sequence = BigInteger.valueOf(artifact.sequence());
        TransactionReceipt receipt;
        try {
            receipt = contract.anchorCheckpoint(chainKey, sequence, root,
                    BigInteger.valueOf(artifact.timestamp().getEpochSecond())).send();
        } catch (Exception e) {
            throw new IllegalStateException("Anchor transaction failed for " + describe(artifact), e);
        }
        if (!receipt.isStatusOK()) {
            throw new IllegalStateException("Anchor transaction " + receipt.getTransactionHash()
                    + " reverted for " + describe(artifact));
        }
        String anchored = anchoredRoot(artifact.chainId(), artifact.sequence())
                .orElseThrow(() -> new IllegalStateException("Anchor not readable after commit for " + describe(artifact)));
        if (!anchored.equals(artifact.rootHash())) {
            throw new IllegalStateException("Chain holds a different root for " + describe(artifact));
        }
        log.info("Anchored checkpoint {} in tx {} block {}", describe(artifact),
                receipt.getTransactionHash(), receipt.getBlockNumber());
        return "evm:" + config.getAnchorContractAddress() + "/tx/" + receipt.getTransactionHash();
    }

    /**
     * Root hash anchored for a chain position, if any.
     */
    public Optional<String> anchoredRoot(String chainId, long sequence) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        byte[] root;
        try {
            root = contract.getCheckpointRoot(chainKey(chainId), BigInteger.valueOf(sequence)).send();
        } catch (Exception e) {
            throw new IllegalStateException("Could not read anchor for " + chainId + "@" + sequence, e);
        }
        if (root == null || Arrays.equals(root, new byte[32])) {
            return Optional.empty();
        }
        return Optional.of(HexFormat.of().formatHex(root));
    }

    @Override
    public String name() {
        return "blockchain";
    }

    public boolean isEnabled() {
        return config.isEnabled() && contract != null;
    }

    static byte[] chainKey(String chainId) {
        return HexFormat.of().parseHex(EntryHasher.sha256Hex(chainId.getBytes(StandardCharsets.UTF_8)));
    }

    static byte[] hexToBytes32(String hex) {
        String cleanHex = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (cleanHex.length() != 64) {
            throw new IllegalArgumentException("Expected a 32-byte hex value, got " + cleanHex.length() + " characters");
        }
        return HexFormat.of().parseHex(cleanHex);
    }

    private static String describe(CheckpointArtifact artifact) {
        return artifact.chainId() + "@" + artifact.sequence();
    }
}
