package dao.tron.msig.controller;

import dao.tron.msig.model.CustodianRoster;
import dao.tron.msig.support.MutableClock;
import dao.tron.msig.vault.CustodyVault;
import dao.tron.msig.vault.TokenLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static dao.tron.msig.support.Custodians.A;
import static dao.tron.msig.support.Custodians.B;
import static dao.tron.msig.support.Custodians.C;
import static dao.tron.msig.support.Custodians.D;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class VaultControllerTest {

    private TokenLedger ledger;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ledger = mock(TokenLedger.class);
        when(ledger.custodyAddress()).thenReturn(C);
        when(ledger.balanceOf(C)).thenReturn(BigInteger.valueOf(500));
        CustodyVault vault = new CustodyVault(
                CustodianRoster.of(List.of(A, B), 2),
                ledger,
                Duration.ofDays(1),
                new MutableClock(Instant.parse("2024-05-01T12:00:00Z")),
                event -> { });
        mvc = MockMvcBuilders.standaloneSetup(new VaultController(vault))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void submitAsCustodian() throws Exception {
        mvc.perform(post("/api/vault/proposals")
                        .header(VaultController.CALLER_HEADER, A)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"" + D + "\",\"amount\":\"100\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.proposal.id").value(0))
                .andExpect(jsonPath("$.proposal.approvalCount").value(1))
                .andExpect(jsonPath("$.proposal.state").value("OPEN"));

        mvc.perform(get("/api/vault/proposals/0/approvals/" + A))
                .andExpect(jsonPath("$.approved").value(true));
        verify(ledger, never()).transfer(any(), any());
    }

    @Test
    void outsiderIsForbidden() throws Exception {
        mvc.perform(post("/api/vault/proposals")
                        .header(VaultController.CALLER_HEADER, D)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"" + D + "\",\"amount\":\"100\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("NOT_AUTHORIZED"));
    }

    @Test
    void missingCallerHeader_isUnauthorized() throws Exception {
        mvc.perform(post("/api/vault/proposals/0/approve"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void approvingUnknownProposal_is404() throws Exception {
        mvc.perform(post("/api/vault/proposals/9/approve").header(VaultController.CALLER_HEADER, B))
                .andExpect(status().isNotFound());
    }

    @Test
    void info() throws Exception {
        mvc.perform(get("/api/vault/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ownerCount").value(2))
                .andExpect(jsonPath("$.threshold").value(2))
                .andExpect(jsonPath("$.expirationPeriodSeconds").value(86_400));
    }
}
