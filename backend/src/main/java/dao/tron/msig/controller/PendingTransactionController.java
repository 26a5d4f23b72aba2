package dao.tron.msig.controller;

import dao.tron.msig.model.CreatePendingRequest;
import dao.tron.msig.model.ImportRequest;
import dao.tron.msig.model.PendingTransaction;
import dao.tron.msig.service.PendingTransactionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/pending")
public class PendingTransactionController {

    private final PendingTransactionService pendingService;
    private final Clock clock;

    public PendingTransactionController(PendingTransactionService pendingService, Clock clock) {
        this.pendingService = pendingService;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody CreatePendingRequest req) {
        PendingTransaction record = pendingService.create(
                req.getTo(), new BigInteger(req.getAmount()), req.getAsset(), req.getDescription());
        return single(record);
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(defaultValue = "false") boolean activeOnly) {
        List<PendingTransaction> records = activeOnly ? pendingService.listActive() : pendingService.list();
        List<Map<String, Object>> views = new ArrayList<>();
        for (PendingTransaction record : records) {
            views.add(view(record));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("count", views.size());
        response.put("transactions", views);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String id) {
        return single(pendingService.get(id));
    }

    @GetMapping("/{id}/signed")
    public ResponseEntity<Map<String, Object>> hasSigned(@PathVariable String id) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("signed", pendingService.hasSigned(id));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{id}/sign")
    public ResponseEntity<Map<String, Object>> sign(@PathVariable String id) {
        pendingService.sign(id);
        return single(pendingService.get(id));
    }

    @PostMapping("/import")
    public ResponseEntity<Map<String, Object>> importAndMerge(@Valid @RequestBody ImportRequest req) {
        return single(pendingService.importAndMerge(req.getBlob()));
    }

    @PostMapping("/{id}/broadcast")
    public ResponseEntity<Map<String, Object>> broadcast(@PathVariable String id) {
        String networkId = pendingService.broadcast(id);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("networkTxId", networkId);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}/export")
    public ResponseEntity<Map<String, Object>> export(@PathVariable String id) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("blob", pendingService.export(id));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        pendingService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/reconcile")
    public ResponseEntity<Void> reconcile() {
        pendingService.reconcile();
        return ResponseEntity.accepted().build();
    }

    private ResponseEntity<Map<String, Object>> single(PendingTransaction record) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("transaction", view(record));
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> view(PendingTransaction record) {
        long now = clock.millis();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("id", record.getId());
        info.put("txId", record.getTxId());
        info.put("from", record.getFromAddress());
        info.put("to", record.getToAddress());
        info.put("amount", record.getAmount() != null ? record.getAmount().toString() : null);
        info.put("asset", record.getAsset());
        info.put("threshold", record.getThreshold());
        info.put("signers", record.getSigners());
        info.put("signatureCount", record.signatureCount());
        info.put("remainingSignatures", record.remainingSignatures());
        info.put("status", record.getStatus());
        info.put("canBroadcast", record.canBroadcastAt(now));
        info.put("createdAt", record.getCreatedAt());
        info.put("expiresAt", record.getExpiresAt());
        info.put("timeRemainingMs", Math.max(0L, record.getExpiresAt() - now));
        info.put("description", record.getDescription());
        info.put("errorMessage", record.getErrorMessage());
        info.put("broadcastTxId", record.getBroadcastTxId());
        return info;
    }
}
