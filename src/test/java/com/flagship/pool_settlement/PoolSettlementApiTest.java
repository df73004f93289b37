package com.flagship.pool_settlement;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pool_settlement.observability.CorrelationContext;
import com.flagship.pool_settlement.redemption.dto.LenderAmountRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests: REST API
 *
 * These tests verify:
 * - Lender approval and deposits through the tranche endpoints
 * - Pool snapshot and health endpoints
 * - Business and validation failures are mapped to ApiError responses
 * - Combined principal payment and drawdown requests are validated
 * - Correlation IDs are echoed back
 */
@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class PoolSettlementApiTest {

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        // Schedulers would close epochs and refresh bills behind the test's back
        registry.add("pool.scheduler.epoch-close-enabled", () -> "false");
        registry.add("pool.scheduler.billing-refresh-enabled", () -> "false");
        // Each context gets its own in-memory database
        registry.add("spring.datasource.url", () -> "jdbc:h2:mem:" + UUID.randomUUID()
            + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;LOCK_TIMEOUT=10000");
        registry.add("spring.datasource.driver-class-name", () -> "org.h2.Driver");
        registry.add("spring.datasource.username", () -> "sa");
        registry.add("spring.datasource.password", () -> "");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

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

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private void printExceptionDetails(Exception e) {
        String message = e.getMessage();
        if (e.getCause() != null && e.getCause().getMessage() != null) {
            message = e.getCause().getMessage();
        }
        System.out.println("  Exception Message: " + message);
    }

    private void assertAmount(String expected, BigDecimal actual, String message) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            message + ". Expected: " + expected + ", Actual: " + actual);
    }

    private String json(String lenderId, String amount) throws Exception {
        return objectMapper.writeValueAsString(LenderAmountRequest.builder()
            .lenderId(lenderId)
            .amount(new BigDecimal(amount))
            .build());
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Approved lender deposit should mint shares and show up in the pool snapshot")
    void testDepositThroughApi() throws Exception {
        printTestHeader("API - Lender Deposit");

        // Given: An approved junior lender
        mockMvc.perform(put("/api/tranches/junior/lenders/lender-a"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.approved").value(true));

        // When
        String request = json("lender-a", "250");
        printInput("Deposit", request);
        MvcResult deposit = mockMvc.perform(post("/api/tranches/junior/deposits")
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isOk())
            .andReturn();
        printOutput("Deposit Response", deposit.getResponse().getContentAsString());

        // Then
        assertAmount("250", new BigDecimal(body(deposit).get("shares").asText()), "Shares minted at price 1");
        MvcResult pool = mockMvc.perform(get("/api/pool"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.enabled").value(true))
            .andExpect(jsonPath("$.value_invariant_holds").value(true))
            .andReturn();
        JsonNode snapshot = body(pool);
        printOutput("Pool", snapshot);
        assertAmount("250", new BigDecimal(snapshot.get("junior_assets").asText()), "Junior assets");
        assertAmount("250", new BigDecimal(snapshot.get("available_liquidity").asText()), "Pool safe");

        mockMvc.perform(get("/api/tranches/junior/lenders/lender-a"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lender_id").value("lender-a"));
        printSuccess("Deposit visible through the API");
    }

    @Test
    @DisplayName("Business failures should map to their error code and status")
    void testBusinessErrorsMapped() throws Exception {
        printTestHeader("API - Business Error Mapping");

        printExpectedException("UnauthorizedException", "Lender was never approved");
        mockMvc.perform(post("/api/tranches/junior/deposits")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json("stranger", "100")))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        printExpectedException("EpochInProgressException", "Epoch has not reached its end date");
        mockMvc.perform(post("/api/epochs/current/close"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("EPOCH_IN_PROGRESS"));

        printExpectedException("ResourceNotFoundException", "Unknown credit");
        mockMvc.perform(get("/api/credits/CREDIT_LINE:nobody"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        printExpectedException("IllegalArgumentException", "Unknown tranche");
        mockMvc.perform(get("/api/tranches/mezzanine"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Unknown tranche: mezzanine"));
        printSuccess("Errors mapped to ApiError");
    }

    @Test
    @DisplayName("Invalid request bodies should be rejected with field details")
    void testValidationErrors() throws Exception {
        printTestHeader("API - Validation");

        printExpectedException("MethodArgumentNotValidException", "Amount must be positive");
        mockMvc.perform(post("/api/tranches/junior/deposits")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"lender_id\":\"lender-a\",\"amount\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.amount").value("Amount must be greater than 0"));

        printExpectedException("HttpMessageNotReadableException", "Malformed JSON");
        mockMvc.perform(post("/api/tranches/junior/deposits")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Malformed request body"));
        printSuccess("Validation errors reported");
    }

    @Test
    @DisplayName("Principal payment and drawdown requests should be validated before touching the line")
    void testPrincipalPaymentAndDrawdownRequest() throws Exception {
        printTestHeader("API - Principal Payment and Drawdown");

        printExpectedException("MethodArgumentNotValidException", "Drawdown receivable missing");
        mockMvc.perform(post("/api/receivable-backed-lines/bob/principal-payment-drawdowns")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"payment_receivable_id\":\"r-1\",\"payment_amount\":100,\"drawdown_amount\":50}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.drawdownReceivableId").value("Drawdown receivable is required"));

        printExpectedException("IllegalArgumentException", "Same receivable on both sides");
        mockMvc.perform(post("/api/receivable-backed-lines/bob/principal-payment-drawdowns")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"payment_receivable_id\":\"r-1\",\"payment_amount\":100,"
                    + "\"drawdown_receivable_id\":\"r-1\",\"drawdown_amount\":50}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Payment and drawdown must use different receivables"));
        printSuccess("Combined request validated");
    }

    @Test
    @DisplayName("Health endpoint should report the books and echo the correlation ID")
    void testHealthAndCorrelationId() throws Exception {
        printTestHeader("API - Health and Correlation");

        mockMvc.perform(get("/health").header(CorrelationContext.CORRELATION_ID_HEADER, "corr-123"))
            .andExpect(status().isOk())
            .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "corr-123"))
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.books").value("UP"))
            .andExpect(jsonPath("$.pool").value("ENABLED"));

        MvcResult generated = mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andReturn();
        String correlationId = generated.getResponse().getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        printOutput("Generated Correlation ID", correlationId);
        assertNotNull(correlationId);
        assertFalse(correlationId.isBlank());
        printSuccess("Health reported with correlation ID");
    }
}
