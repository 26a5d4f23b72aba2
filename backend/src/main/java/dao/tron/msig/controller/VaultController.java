package dao.tron.msig.controller;

import dao.tron.msig.model.SubmitProposalRequest;
import dao.tron.msig.vault.CustodyVault;
import dao.tron.msig.vault.Proposal;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-process approval vault. The acting custodian is named by the
 * {@code X-Custodian-Address} header.
 */
@RestController
@RequestMapping("/api/vault")
@ConditionalOnProperty(prefix = "vault", name = "enabled", havingValue = "true")
public class VaultController {

    static final String CALLER_HEADER = "X-Custodian-Address";

    private final CustodyVault vault;

    public VaultController(CustodyVault vault) {
        this.vault = vault;
    }

    @PostMapping("/proposals")
    public ResponseEntity<Map<String, Object>> submit(@RequestHeader(CALLER_HEADER) String caller,
                                                      @Valid @RequestBody SubmitProposalRequest req) {
        long id = vault.submit(caller, req.getTo(), new BigInteger(req.getAmount()));
        return ok("proposal", vault.getTransaction(id));
    }

    @PostMapping("/proposals/{id}/approve")
    public ResponseEntity<Map<String, Object>> approve(@RequestHeader(CALLER_HEADER) String caller,
                                                       @PathVariable long id) {
        vault.approve(caller, id);
        return ok("proposal", vault.getTransaction(id));
    }

    @PostMapping("/proposals/{id}/revoke")
    public ResponseEntity<Map<String, Object>> revoke(@RequestHeader(CALLER_HEADER) String caller,
                                                      @PathVariable long id) {
        vault.revoke(caller, id);
        return ok("proposal", vault.getTransaction(id));
    }

    @PostMapping("/proposals/{id}/cancel-expired")
    public ResponseEntity<Map<String, Object>> cancelExpired(@RequestHeader(CALLER_HEADER) String caller,
                                                             @PathVariable long id) {
        vault.cancelExpired(caller, id);
        return ok("proposal", vault.getTransaction(id));
    }

    @GetMapping("/proposals")
    public ResponseEntity<Map<String, Object>> list() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("transactionCount", vault.getTransactionCount());
        response.put("proposals", vault.getTransactions());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/proposals/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable long id) {
        Proposal proposal = vault.getTransaction(id);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("proposal", proposal);
        response.put("expired", vault.isExpired(id));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/proposals/{id}/approvals/{custodian}")
    public ResponseEntity<Map<String, Object>> isApproved(@PathVariable long id, @PathVariable String custodian) {
        return ok("approved", vault.isApproved(id, custodian));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("owners", vault.getOwners());
        response.put("ownerCount", vault.getOwnerCount());
        response.put("threshold", vault.getThreshold());
        response.put("expirationPeriodSeconds", vault.getExpirationPeriod().getSeconds());
        response.put("transactionCount", vault.getTransactionCount());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/balance")
    public ResponseEntity<Map<String, Object>> balance() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("custodyAddress", vault.getCustodyAddress());
        response.put("balance", vault.getBalance().toString());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/owners/{address}")
    public ResponseEntity<Map<String, Object>> isOwner(@PathVariable String address) {
        return ok("owner", vault.isOwner(address));
    }

    private static ResponseEntity<Map<String, Object>> ok(String key, Object value) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put(key, value);
        return ResponseEntity.ok(response);
    }
}
