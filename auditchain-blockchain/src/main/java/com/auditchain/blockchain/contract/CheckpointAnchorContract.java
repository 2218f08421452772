package com.auditchain.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * Checkpoint anchor contract - Web3j wrapper.
 * <p>
 * Stores {@code (chainKey, sequence) -> rootHash} write-once and emits an event per
 * anchor. {@code chainKey} is the SHA-256 of the chain id, so tenant names never go on chain.
 */
public class CheckpointAnchorContract extends Contract {

    public static final String BINARY = "";
    public static final String FUNC_ANCHORCHECKPOINT = "anchorCheckpoint";
    public static final String FUNC_GETCHECKPOINTROOT = "getCheckpointRoot";

    public static final Event CHECKPOINT_ANCHORED_EVENT = new Event("CheckpointAnchored",
            Arrays.asList(
                    new TypeReference<Bytes32>(true) {},  // chainKey
                    new TypeReference<Uint256>(true) {},  // sequence
                    new TypeReference<Bytes32>() {},      // rootHash
                    new TypeReference<Uint256>() {}       // timestamp
            ));

    protected CheckpointAnchorContract(String contractAddress, Web3j web3j,
                                       Credentials credentials, ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Anchors one checkpoint. Reverts if the position is already anchored.
     */
    public RemoteFunctionCall<TransactionReceipt> anchorCheckpoint(
            byte[] chainKey, BigInteger sequence, byte[] rootHash, BigInteger timestamp) {
        final Function function = new Function(
                FUNC_ANCHORCHECKPOINT,
                Arrays.asList(
                        new Bytes32(chainKey),
                        new Uint256(sequence),
                        new Bytes32(rootHash),
                        new Uint256(timestamp)
                ),
                Collections.emptyList());
        return executeRemoteCallTransaction(function);
    }

    /**
     * Root hash anchored for a position; all zero bytes when none was anchored.
     */
    public RemoteFunctionCall<byte[]> getCheckpointRoot(byte[] chainKey, BigInteger sequence) {
        final Function function = new Function(
                FUNC_GETCHECKPOINTROOT,
                Arrays.asList(new Bytes32(chainKey), new Uint256(sequence)),
                Arrays.asList(new TypeReference<Bytes32>() {}));
        return executeRemoteCallSingleValueReturn(function, byte[].class);
    }

    public static CheckpointAnchorContract load(String contractAddress, Web3j web3j,
                                                Credentials credentials, ContractGasProvider gasProvider) {
        return new CheckpointAnchorContract(contractAddress, web3j, credentials, gasProvider);
    }
}
