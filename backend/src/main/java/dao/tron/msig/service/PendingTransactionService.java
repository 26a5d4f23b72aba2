package dao.tron.msig.service;

import dao.tron.msig.config.CoordinatorProperties;
import dao.tron.msig.error.ErrorCategory;
import dao.tron.msig.error.FailureReason;
import dao.tron.msig.error.MultisigException;
import dao.tron.msig.gateway.AccountPermission;
import dao.tron.msig.gateway.NativeAccountGateway;
import dao.tron.msig.model.PendingTransaction;
import dao.tron.msig.model.PendingTxStatus;
import dao.tron.msig.repository.PendingTransactionStore;
import dao.tron.msig.util.CryptoUtil;
import dao.tron.msig.util.TransferValidation;
import dao.tron.msig.util.TronAddresses;
import dao.tron.msig.util.TronTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tron.trident.proto.Chain;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects signatures for transfers out of a native multi-key account.
 * <p>
 * Reaching quorum only marks a record READY; nothing is submitted until {@link #broadcast}
 * is called. Instances of this service on different custodians' machines converge only
 * through export and {@link #importAndMerge}.
 */
@Slf4j
@Service
public class PendingTransactionService {

    /** Used when a payload carries no expiration of its own. */
    private static final long DEFAULT_EXPIRY_MS = 60_000L;
    private static final int UINT256_BITS = 256;

    private final PendingTransactionStore store;
    private final NativeAccountGateway gateway;
    private final LocalSigner signer;
    private final PendingTransactionCodec codec;
    private final CoordinatorProperties props;
    private final Clock clock;

    public PendingTransactionService(PendingTransactionStore store,
                                     NativeAccountGateway gateway,
                                     LocalSigner signer,
                                     PendingTransactionCodec codec,
                                     CoordinatorProperties props,
                                     Clock clock) {
        this.store = store;
        this.gateway = gateway;
        this.signer = signer;
        this.codec = codec;
        this.props = props;
        this.clock = clock;
    }

    public synchronized PendingTransaction create(String to, BigInteger amount, String asset, String description) {
        String localAddress = signer.address();
        String account = requireAccount();
        String recipient = TransferValidation.requireRecipient(to);
        TransferValidation.requirePositiveAmount(amount);
        boolean nativeAsset = asset == null || asset.isBlank() || PendingTransaction.NATIVE_ASSET.equalsIgnoreCase(asset);
        String assetId = nativeAsset ? PendingTransaction.NATIVE_ASSET : TronAddresses.normalize(asset);
        if (nativeAsset && amount.bitLength() > 63) {
            throw new MultisigException(FailureReason.AMOUNT_OUT_OF_RANGE, "TRX amount exceeds 64-bit SUN: " + amount);
        }
        if (!nativeAsset && amount.bitLength() > UINT256_BITS) {
            throw new MultisigException(FailureReason.AMOUNT_OUT_OF_RANGE, "Token amount exceeds uint256: " + amount);
        }

        AccountPermission permission = gateway.fetchPermission(account, props.getPermissionId());
        Chain.Transaction unsigned = nativeAsset
                ? gateway.createTrxTransfer(account, recipient, amount.longValueExact())
                : gateway.createTrc20Transfer(account, assetId, recipient, amount, props.getTrc20FeeLimit());
        Chain.Transaction tx = TronTransactions.prepare(
                unsigned, props.getExpirationExtensionSeconds() * 1000L, props.getPermissionId());

        tx = TronTransactions.addSignature(tx, signer.sign(TronTransactions.txId(tx)));
        List<String> signers = TronTransactions.recoverSigners(tx);

        long now = clock.millis();
        long expiration = tx.getRawData().getExpiration();
        PendingTransaction record = PendingTransaction.builder()
                .id(CryptoUtil.newLocalId(now))
                .txId(TronTransactions.txIdHex(tx))
                .payload(tx.toByteArray())
                .fromAddress(account)
                .toAddress(recipient)
                .amount(amount)
                .asset(assetId)
                .threshold(Math.max(1, permission.threshold()))
                .signers(signers)
                .createdAt(now)
                .expiresAt(expiration > 0 ? expiration : now + DEFAULT_EXPIRY_MS)
                .description(description)
                .build();
        record.setStatus(quorumStatus(record));
        store.save(record);

        log.info("Created pending tx {} (txId={}): {} {} -> {}, signed by {}, {}/{} signatures",
                record.getId(), record.getTxId(), amount, assetId, recipient, localAddress,
                record.signatureCount(), record.getThreshold());
        return record;
    }

    /**
     * Adds the local custodian's signature.
     *
     * @return true once the signature is stored
     */
    public synchronized boolean sign(String id) {
        PendingTransaction record = require(id);
        requireAcceptsSignatures(record);
        String localAddress = signer.address();
        if (record.getSigners().contains(localAddress)) {
            throw new MultisigException(FailureReason.ALREADY_SIGNED, localAddress + " already signed " + id);
        }

        Chain.Transaction tx = TronTransactions.parse(record.getPayload());
        tx = TronTransactions.addSignature(tx, signer.sign(TronTransactions.txId(tx)));
        record.setPayload(tx.toByteArray());
        record.setSigners(TronTransactions.recoverSigners(tx));
        record.setStatus(quorumStatus(record));
        store.save(record);

        log.info("Signed pending tx {} as {}: {}/{} signatures ({})",
                id, localAddress, record.signatureCount(), record.getThreshold(), record.getStatus());
        return true;
    }

    /**
     * Imports a blob exported by another custodian. A known txId has its signatures merged
     * into the local record; an unknown one becomes a new record.
     */
    public synchronized PendingTransaction importAndMerge(String blob) {
        PendingTransaction incoming = codec.decode(blob);

        var existing = store.findByTxId(incoming.getTxId());
        if (existing.isEmpty()) {
            if (incoming.getId() == null || incoming.getId().isBlank()
                    || store.findById(incoming.getId()).isPresent()) {
                incoming.setId(CryptoUtil.newLocalId(clock.millis()));
            }
            if (incoming.getAsset() == null || incoming.getAsset().isBlank()) {
                incoming.setAsset(PendingTransaction.NATIVE_ASSET);
            }
            if (incoming.getCreatedAt() == 0L) {
                incoming.setCreatedAt(clock.millis());
            }
            incoming.setErrorMessage(null);
            incoming.setBroadcastTxId(null);
            long now = clock.millis();
            incoming.setStatus(incoming.isExpiredAt(now) ? PendingTxStatus.EXPIRED : quorumStatus(incoming));
            store.save(incoming);
            log.info("Imported new pending tx {} (txId={}): {}/{} signatures ({})",
                    incoming.getId(), incoming.getTxId(), incoming.signatureCount(), incoming.getThreshold(),
                    incoming.getStatus());
            return incoming;
        }

        PendingTransaction record = existing.get();
        requireAcceptsSignatures(record);
        int before = record.signatureCount();
        Chain.Transaction merged = TronTransactions.mergeSignatures(
                TronTransactions.parse(record.getPayload()),
                TronTransactions.parse(incoming.getPayload()));
        record.setPayload(merged.toByteArray());
        record.setSigners(TronTransactions.recoverSigners(merged));
        record.setStatus(quorumStatus(record));
        store.save(record);

        log.info("Merged import into pending tx {}: {} -> {} signatures ({})",
                record.getId(), before, record.signatureCount(), record.getStatus());
        return record;
    }

    /**
     * Submits the transaction if it has quorum and has not expired. A transport rejection
     * is recorded on the record (status FAILED) and then rethrown; a FAILED record is not
     * broadcast again until a sign or import has re-derived its status.
     *
     * @return network transaction id
     */
    public synchronized String broadcast(String id) {
        PendingTransaction record = require(id);
        long now = clock.millis();
        if (!record.canBroadcastAt(now)) {
            String why = record.isExpiredAt(now) || record.getStatus() == PendingTxStatus.EXPIRED
                    ? "expired at " + record.getExpiresAt()
                    : record.getStatus() == PendingTxStatus.BROADCAST
                    ? "already broadcast as " + record.getBroadcastTxId()
                    : record.getStatus() == PendingTxStatus.FAILED
                    ? "last broadcast failed (" + record.getErrorMessage() + "), sign or import to retry"
                    : record.signatureCount() + "/" + record.getThreshold() + " signatures";
            throw new MultisigException(FailureReason.NOT_BROADCASTABLE, "Pending tx " + id + " cannot be broadcast: " + why);
        }

        Chain.Transaction tx = TronTransactions.parse(record.getPayload());
        try {
            String networkId = gateway.broadcast(tx);
            record.setStatus(PendingTxStatus.BROADCAST);
            record.setBroadcastTxId(networkId);
            record.setErrorMessage(null);
            store.save(record);
            log.info("Broadcast pending tx {}: networkId={}", id, networkId);
            return networkId;
        } catch (MultisigException e) {
            if (e.getCategory() != ErrorCategory.TRANSPORT) throw e;
            record.setStatus(PendingTxStatus.FAILED);
            record.setErrorMessage(e.getMessage());
            store.save(record);
            log.warn("Broadcast of pending tx {} rejected: {}", id, e.getMessage());
            throw e;
        }
    }

    public String export(String id) {
        return codec.encode(require(id));
    }

    public synchronized void delete(String id) {
        if (!store.delete(id)) {
            throw MultisigException.notFound("Pending transaction", id);
        }
        log.info("Deleted pending tx {}", id);
    }

    /**
     * Drops PENDING/READY records another custodian already got on chain and expires the
     * ones past their deadline. A failure on one record is logged and does not stop the others.
     */
    public synchronized void reconcile() {
        long now = clock.millis();
        for (PendingTransaction record : store.findAll()) {
            try {
                reconcileOne(record, now);
            } catch (RuntimeException e) {
                log.warn("Reconciliation of pending tx {} (txId={}) failed: {}",
                        record.getId(), record.getTxId(), e.getMessage());
            }
        }
    }

    private void reconcileOne(PendingTransaction record, long now) {
        if (!isLive(record)) {
            return;
        }
        if (gateway.isSettled(record.getTxId())) {
            store.delete(record.getId());
            log.info("Pending tx {} settled on chain (txId={}), removed", record.getId(), record.getTxId());
            return;
        }
        if (record.isExpiredAt(now)) {
            record.setStatus(PendingTxStatus.EXPIRED);
            store.save(record);
            log.info("Pending tx {} expired at {}", record.getId(), record.getExpiresAt());
        }
    }

    public List<PendingTransaction> list() {
        return store.findAll();
    }

    /** Records still collecting signatures and not yet expired. */
    public List<PendingTransaction> listActive() {
        long now = clock.millis();
        return store.findAll().stream()
                .filter(PendingTransactionService::isLive)
                .filter(r -> !r.isExpiredAt(now))
                .collect(Collectors.toList());
    }

    public PendingTransaction get(String id) {
        return require(id);
    }

    public boolean hasSigned(String id) {
        return require(id).getSigners().contains(signer.address());
    }

    // ---- internals ----

    private PendingTransaction require(String id) {
        return store.findById(id).orElseThrow(() -> MultisigException.notFound("Pending transaction", id));
    }

    private String requireAccount() {
        String account = props.getAccountAddress();
        if (account == null || account.isBlank()) {
            throw new MultisigException(FailureReason.INVALID_ADDRESS, "coordinator.account-address is not configured");
        }
        return TronAddresses.normalize(account);
    }

    private static void requireAcceptsSignatures(PendingTransaction record) {
        if (!record.getStatus().acceptsSignatures()) {
            throw new MultisigException(FailureReason.ALREADY_TERMINAL,
                    "Pending tx " + record.getId() + " is " + record.getStatus());
        }
    }

    private static PendingTxStatus quorumStatus(PendingTransaction record) {
        return record.signatureCount() >= record.getThreshold() ? PendingTxStatus.READY : PendingTxStatus.PENDING;
    }

    private static boolean isLive(PendingTransaction record) {
        return record.getStatus() == PendingTxStatus.PENDING || record.getStatus() == PendingTxStatus.READY;
    }
}
