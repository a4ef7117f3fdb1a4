package com.flagship.token_ledger.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * API Tests: token ledger endpoints
 *
 * These tests verify:
 * - Each operation is reachable over HTTP with the caller header
 * - Ledger rejections map to the documented HTTP statuses
 * - Missing headers and invalid bodies are rejected before reaching the ledger
 *
 * The application context (and so the ledger) is shared between tests, so
 * every test works with its own freshly named principals.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class LedgerControllerTest {

    private static final String CALLER = LedgerController.CALLER_HEADER;
    private static final String OWNER = "test-owner";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String alice;
    private String bob;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        alice = "alice-" + UUID.randomUUID().toString().substring(0, 8);
        bob = "bob-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private String transferBody(String recipient, long amount) throws Exception {
        return objectMapper.writeValueAsString(Map.of("recipient", recipient, "amount", amount));
    }

    private void mint(String recipient, long amount) throws Exception {
        mockMvc.perform(post("/api/mint")
                .header(CALLER, OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transferBody(recipient, amount)))
            .andExpect(status().isCreated());
    }

    private BigInteger totalSupply() throws Exception {
        String json = mockMvc.perform(get("/api/token"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(json).get("total_supply").bigIntegerValue();
    }

    @Test
    @DisplayName("Token info reflects configuration")
    void testTokenInfo() throws Exception {
        mockMvc.perform(get("/api/token"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("Test Token"))
            .andExpect(jsonPath("$.symbol").value("TST"))
            .andExpect(jsonPath("$.decimals").value(8))
            .andExpect(jsonPath("$.total_supply").exists());
    }

    @Test
    @DisplayName("Create wallet returns 201 first and 200 afterwards")
    void testCreateWallet() throws Exception {
        printTestHeader("Create Wallet");
        printInput("Caller", alice);

        mockMvc.perform(post("/api/wallets").header(CALLER, alice))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.principal").value(alice))
            .andExpect(jsonPath("$.created").value(true))
            .andExpect(jsonPath("$.balance").value(0));

        mockMvc.perform(post("/api/wallets").header(CALLER, alice))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.created").value(false));

        printSuccess("Wallet creation is idempotent");
    }

    @Test
    @DisplayName("Unknown principal has zero balance")
    void testUnknownBalance() throws Exception {
        mockMvc.perform(get("/api/balances/{principal}", bob))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.principal").value(bob))
            .andExpect(jsonPath("$.balance").value(0));
    }

    @Test
    @DisplayName("Mint, transfer and burn flow end to end")
    void testMintTransferBurn() throws Exception {
        printTestHeader("Mint, Transfer, Burn");
        BigInteger supplyBefore = totalSupply();

        mockMvc.perform(post("/api/mint")
                .header(CALLER, OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transferBody(alice, 500)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.kind").value("MINT"))
            .andExpect(jsonPath("$.from").doesNotExist())
            .andExpect(jsonPath("$.to").value(alice))
            .andExpect(jsonPath("$.amount").value(500))
            .andExpect(jsonPath("$.sequence_number").exists())
            .andExpect(jsonPath("$.timestamp").exists());

        mockMvc.perform(post("/api/transfers")
                .header(CALLER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transferBody(bob, 200)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.kind").value("TRANSFER"))
            .andExpect(jsonPath("$.from").value(alice))
            .andExpect(jsonPath("$.to").value(bob));

        mockMvc.perform(post("/api/burn")
                .header(CALLER, bob)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 50}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.kind").value("BURN"))
            .andExpect(jsonPath("$.to").doesNotExist());

        mockMvc.perform(get("/api/balances/{principal}", alice))
            .andExpect(jsonPath("$.balance").value(300));
        mockMvc.perform(get("/api/balances/{principal}", bob))
            .andExpect(jsonPath("$.balance").value(150));

        BigInteger supplyAfter = totalSupply();
        printOutput("Supply delta", supplyAfter.subtract(supplyBefore));
        assertEquals(BigInteger.valueOf(450), supplyAfter.subtract(supplyBefore));
        printSuccess("Balances and supply updated");
    }

    @Test
    @DisplayName("Transfer history lists records in sequence order")
    void testTransferHistory() throws Exception {
        mint(alice, 10);
        mint(bob, 20);

        String json = mockMvc.perform(get("/api/transfers"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        JsonNode history = objectMapper.readTree(json);

        assertTrue(history.size() >= 3, "Genesis plus two mints");
        assertEquals(1, history.get(0).get("sequence_number").asLong());
        assertEquals(OWNER, history.get(0).get("to").asText());
        for (int i = 1; i < history.size(); i++) {
            assertEquals(history.get(i - 1).get("sequence_number").asLong() + 1,
                history.get(i).get("sequence_number").asLong());
        }
        JsonNode last = history.get(history.size() - 1);
        assertEquals(bob, last.get("to").asText());
    }

    @Test
    @DisplayName("Mint by a non-owner is forbidden")
    void testMintUnauthorized() throws Exception {
        mockMvc.perform(post("/api/mint")
                .header(CALLER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transferBody(alice, 100)))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(get("/api/balances/{principal}", alice))
            .andExpect(jsonPath("$.balance").value(0));
    }

    @Test
    @DisplayName("Zero amount is a bad request")
    void testZeroAmount() throws Exception {
        mockMvc.perform(post("/api/mint")
                .header(CALLER, OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transferBody(alice, 0)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_AMOUNT"));
    }

    @Test
    @DisplayName("Overdraft is a conflict")
    void testInsufficientBalance() throws Exception {
        mint(alice, 100);

        mockMvc.perform(post("/api/transfers")
                .header(CALLER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transferBody(bob, 101)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"));
    }

    @Test
    @DisplayName("Self-transfer is a bad request")
    void testSameAccount() throws Exception {
        mint(alice, 100);

        mockMvc.perform(post("/api/transfers")
                .header(CALLER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transferBody(alice, 10)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("SAME_ACCOUNT"));
    }

    @Test
    @DisplayName("Minting past the numeric maximum is unprocessable")
    void testOverflow() throws Exception {
        String body = "{\"recipient\": \"" + alice + "\", \"amount\": 340282366920938463463374607431768211455}";

        mockMvc.perform(post("/api/mint")
                .header(CALLER, OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("OVERFLOW"));
    }

    @Test
    @DisplayName("Missing caller header is rejected")
    void testMissingCallerHeader() throws Exception {
        mockMvc.perform(post("/api/wallets"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Invalid request body fails validation")
    void testValidationFailure() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .header(CALLER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"recipient\": \"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.recipient").exists())
            .andExpect(jsonPath("$.details.amount").exists());
    }

    @Test
    @DisplayName("Blank caller identity is rejected")
    void testBlankCaller() throws Exception {
        mockMvc.perform(post("/api/wallets").header(CALLER, " "))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Ownership can be handed over and back")
    void testChangeOwner() throws Exception {
        printTestHeader("Change Owner");

        mockMvc.perform(put("/api/owner")
                .header(CALLER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"new_owner\": \"" + alice + "\"}"))
            .andExpect(status().isForbidden());

        mockMvc.perform(put("/api/owner")
                .header(CALLER, OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"new_owner\": \"" + alice + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.owner").value(alice));

        mockMvc.perform(get("/api/owner"))
            .andExpect(jsonPath("$.owner").value(alice));

        // restore for the rest of the suite
        mockMvc.perform(put("/api/owner")
                .header(CALLER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"new_owner\": \"" + OWNER + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.owner").value(OWNER));

        printSuccess("Ownership handed over and restored");
    }

    @Test
    @DisplayName("Base unit conversion uses token decimals")
    void testBaseUnits() throws Exception {
        mockMvc.perform(get("/api/token/base-units").param("whole", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.whole").value(5))
            .andExpect(jsonPath("$.decimals").value(8))
            .andExpect(jsonPath("$.base_units").value(500_000_000));

        mockMvc.perform(get("/api/token/base-units").param("whole", "not-a-number"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Correlation ID is echoed on responses")
    void testCorrelationIdHeader() throws Exception {
        mockMvc.perform(get("/api/token").header("X-Correlation-ID", "abc12345"))
            .andExpect(header().string("X-Correlation-ID", "abc12345"));
    }

    @Test
    @DisplayName("Plain health endpoint reports the ledger as consistent")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.ledger").value("UP"));
    }

    @Test
    @DisplayName("Fractional amounts are rejected as malformed and move no tokens")
    void testFractionalAmountRejected() throws Exception {
        printTestHeader("Fractional Amount Rejected");
        mint(alice, 100);
        String fractionalTransfer = "{\"recipient\":\"" + bob + "\",\"amount\":7.9}";
        printInput("Body", fractionalTransfer);

        mockMvc.perform(post("/api/mint")
                .header(CALLER, OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(fractionalTransfer))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"));

        mockMvc.perform(post("/api/transfers")
                .header(CALLER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content(fractionalTransfer))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"));

        mockMvc.perform(post("/api/burn")
                .header(CALLER, alice)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":0.5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"))
            .andExpect(jsonPath("$.code").doesNotExist());

        mockMvc.perform(get("/api/balances/{principal}", alice))
            .andExpect(jsonPath("$.balance").value(100));
        mockMvc.perform(get("/api/balances/{principal}", bob))
            .andExpect(jsonPath("$.balance").value(0));
        printSuccess("No balance changed");
    }
}
