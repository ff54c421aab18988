package dao.tron.anchor.service;

import dao.tron.anchor.config.LedgerProperties;
import dao.tron.anchor.exception.LedgerUnavailableException;
import dao.tron.anchor.model.LedgerConfirmation;
import dao.tron.anchor.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tron.trident.abi.FunctionEncoder;
import org.tron.trident.abi.datatypes.Function;
import org.tron.trident.abi.datatypes.generated.Bytes32;
import org.tron.trident.core.ApiWrapper;
import org.tron.trident.proto.Chain;
import org.tron.trident.proto.Response;

import java.util.Collections;

/**
 * Anchors roots on TRON by calling {@code anchor(bytes32)} on the configured contract.
 */
@Slf4j
@Service
public class LedgerClientTrident implements LedgerClient {

    private final ApiWrapper wrapper;
    private final String ownerAddress;
    private final String contractAddress;
    private final long feeLimit;
    private final int minConfirmations;
    /**
     * Guard signing/broadcasting; ApiWrapper internals are not thread-safe.
     */
    private final Object broadcastLock = new Object();

    public LedgerClientTrident(LedgerProperties props) {
        this.contractAddress = props.getContractAddress();
        this.feeLimit = props.getFeeLimit();
        this.minConfirmations = Math.max(1, props.getMinConfirmations());

        String privateKey = props.getPrivateKey();
        if (privateKey == null || privateKey.isEmpty() || privateKey.equals("YOUR_PRIVATE_KEY_HERE")) {
            log.warn("No valid private key configured. Set ANCHOR_PRIVATE_KEY to enable anchoring; batches will stay FAILED.");
            this.wrapper = null;
            this.ownerAddress = "NOT_CONFIGURED";
            return;
        }

        if (privateKey.length() % 2 != 0) {
            log.error("Invalid private key format: odd-length hex string");
            this.wrapper = null;
            this.ownerAddress = "INVALID_KEY_FORMAT";
            return;
        }

        ApiWrapper tempWrapper;
        String tempOwnerAddress;

        try {
            tempWrapper = connect(props.getNetwork(), privateKey, props.getApiKey());
            tempOwnerAddress = tempWrapper.keyPair.toBase58CheckAddress();
            log.info("LedgerClientTrident initialized: network={}, owner={}, contract={}",
                    props.getNetwork(), tempOwnerAddress, contractAddress);
        } catch (Exception e) {
            log.error("Failed to initialize: {}", e.getMessage());
            tempWrapper = null;
            tempOwnerAddress = "INIT_FAILED";
        }

        this.wrapper = tempWrapper;
        this.ownerAddress = tempOwnerAddress;
    }

    private static ApiWrapper connect(String network, String privateKey, String apiKey) {
        String net = network == null ? "nile" : network.toLowerCase();
        return switch (net) {
            case "mainnet" -> ApiWrapper.ofMainnet(privateKey, apiKey);
            case "shasta" -> ApiWrapper.ofShasta(privateKey);
            case "nile" -> ApiWrapper.ofNile(privateKey);
            default -> throw new IllegalArgumentException("Unknown TRON network: " + network);
        };
    }

    @Override
    public String submit(byte[] root) {
        requireWrapper();
        if (root == null || root.length != HexUtil.DIGEST_LENGTH) {
            throw new IllegalArgumentException("Merkle root must be 32 bytes");
        }
        try {
            Function anchorFn = new Function(
                    "anchor",
                    Collections.singletonList(new Bytes32(root)),
                    Collections.emptyList()
            );

            String encodedHex = FunctionEncoder.encode(anchorFn);

            Response.TransactionExtention txnExt = wrapper.triggerContract(
                    ownerAddress,
                    contractAddress,
                    encodedHex,
                    0L,
                    0L,
                    null,
                    feeLimit
            );

            if (!txnExt.getResult().getResult()) {
                String msg = txnExt.getResult().getMessage().toStringUtf8();
                throw new LedgerUnavailableException("anchor trigger failed: " + msg);
            }

            String txId;
            synchronized (broadcastLock) {
                Chain.Transaction signed = wrapper.signTransaction(txnExt);
                txId = wrapper.broadcastTransaction(signed);
            }
            log.info("anchor broadcast: root={}, txId={}", HexUtil.toHex(root), txId);
            return txId;
        } catch (LedgerUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new LedgerUnavailableException("anchor submission failed: " + e.getMessage(), e);
        }
    }

    /**
     * Confirmed once the anchoring block is buried under {@code minConfirmations} blocks
     * and the contract call succeeded. A transaction the node does not know yet is unconfirmed.
     */
    @Override
    public LedgerConfirmation query(String txHash) {
        requireWrapper();
        try {
            Response.TransactionInfo info = wrapper.getTransactionInfoById(txHash);
            if (info == null || info.getBlockNumber() == 0L) {
                return LedgerConfirmation.unconfirmed();
            }
            if (info.getResult() != Response.TransactionInfo.code.SUCESS) {
                String errorMsg = info.getResMessage() != null ? info.getResMessage().toStringUtf8() : "Unknown error";
                throw new LedgerUnavailableException("anchor tx " + txHash + " failed on-chain: " + errorMsg);
            }

            long head = wrapper.getNowBlock().getBlockHeader().getRawData().getNumber();
            if (head - info.getBlockNumber() + 1 < minConfirmations) {
                return LedgerConfirmation.unconfirmed();
            }
            return LedgerConfirmation.confirmed(info.getBlockNumber(), info.getBlockTimeStamp() / 1000L);
        } catch (LedgerUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new LedgerUnavailableException("query of " + txHash + " failed: " + e.getMessage(), e);
        }
    }

    private void requireWrapper() {
        if (wrapper == null) {
            throw new LedgerUnavailableException("Ledger client not configured (" + ownerAddress + ")");
        }
    }
}
