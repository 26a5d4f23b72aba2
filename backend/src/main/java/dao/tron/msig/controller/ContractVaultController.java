package dao.tron.msig.controller;

import dao.tron.msig.contract.VaultContractClient;
import dao.tron.msig.model.SubmitProposalRequest;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deployed vault contract, acting as the locally configured custodian key.
 */
@RestController
@RequestMapping("/api/contract")
@ConditionalOnProperty(prefix = "contract", name = "address")
public class ContractVaultController {

    private final VaultContractClient client;

    public ContractVaultController(VaultContractClient client) {
        this.client = client;
    }

    @PostMapping("/proposals")
    public ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody SubmitProposalRequest req) {
        return tx(client.submitTransaction(req.getTo(), new BigInteger(req.getAmount())));
    }

    @PostMapping("/proposals/{id}/approve")
    public ResponseEntity<Map<String, Object>> approve(@PathVariable long id) {
        return tx(client.approveTransaction(id));
    }

    @PostMapping("/proposals/{id}/revoke")
    public ResponseEntity<Map<String, Object>> revoke(@PathVariable long id) {
        return tx(client.revokeApproval(id));
    }

    @PostMapping("/proposals/{id}/cancel-expired")
    public ResponseEntity<Map<String, Object>> cancelExpired(@PathVariable long id) {
        return tx(client.cancelExpiredTransaction(id));
    }

    @GetMapping("/proposals/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable long id) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("proposal", client.getTransaction(id));
        response.put("expired", client.isExpired(id));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/proposals/{id}/approvals/{owner}")
    public ResponseEntity<Map<String, Object>> isApproved(@PathVariable long id, @PathVariable String owner) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("approved", client.isApproved(id, owner));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("token", client.getToken());
        response.put("owners", client.getOwners());
        response.put("ownerCount", client.getOwnerCount());
        response.put("threshold", client.getThreshold());
        response.put("expirationPeriodSeconds", client.getExpirationPeriod());
        response.put("transactionCount", client.getTransactionCount());
        response.put("balance", client.getBalance().toString());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/owners/{address}")
    public ResponseEntity<Map<String, Object>> isOwner(@PathVariable String address) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("owner", client.isOwner(address));
        return ResponseEntity.ok(response);
    }

    private static ResponseEntity<Map<String, Object>> tx(String txId) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("txId", txId);
        return ResponseEntity.ok(response);
    }
}
