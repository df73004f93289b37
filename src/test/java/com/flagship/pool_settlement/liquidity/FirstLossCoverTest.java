package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.PoolTestFixture;
import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.exception.CoverCapExceededException;
import com.flagship.pool_settlement.exception.InsufficientLiquidityException;
import com.flagship.pool_settlement.exception.ResourceNotFoundException;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests: First-loss cover limits
 *
 * These tests verify:
 * - Cover assets never exceed maxLiquidity
 * - Loss cover honours coverRate and coverCapPerLoss
 * - Rejected movements leave balances untouched
 */
class FirstLossCoverTest {

    private PoolTestFixture fixture;

    @BeforeEach
    void setUp() {
        PoolProperties properties = PoolTestFixture.plainProperties();
        PoolProperties.FirstLossCover capped = PoolTestFixture.cover("capped-cover", 0, "100");
        capped.setCoverRateBps(5000);
        capped.setCoverCapPerLoss(new BigDecimal("30"));
        properties.getFirstLossCovers().add(capped);
        fixture = new PoolTestFixture(properties, LocalDate.of(2024, 1, 15));
    }

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

    @Test
    @DisplayName("Deposit beyond maxLiquidity should be rejected and leave the cover unchanged")
    void testCoverCapExceeded_ShouldFail() {
        printTestHeader("Cover Cap Exceeded");

        // Given: Cover holds 80 of 100
        fixture.pool.depositCover("capped-cover", "provider", new BigDecimal("80"));
        printInput("Cover Assets", fixture.firstLossCovers.get("capped-cover").getCoverAssets());
        printExpectedException("CoverCapExceededException", "80 + 30 exceeds 100");

        // When/Then
        CoverCapExceededException exception = assertThrows(CoverCapExceededException.class,
            () -> fixture.pool.depositCover("capped-cover", "provider", new BigDecimal("30")));
        printExceptionDetails(exception);

        // Then: Nothing moved
        assertAmount("80", fixture.firstLossCovers.get("capped-cover").getCoverAssets(), "Cover assets");
        assertAmount("80", fixture.ledgerService.getAccountBalance(CustodyAccounts.cover("capped-cover")),
            "Cover custody account");
        assertAmount("80", fixture.pool.totalPoolValue(), "Total pool value");
        printSuccess("Cap enforced without side effects");
    }

    @Test
    @DisplayName("Loss cover is the smallest of rate share, per-loss cap and cover assets")
    void testCalcLossCover() {
        printTestHeader("Loss Cover Calculation");

        fixture.pool.depositCover("capped-cover", "provider", new BigDecimal("80"));
        FirstLossCover cover = fixture.firstLossCovers.get("capped-cover");
        printInput("Cover Rate", cover.getCoverRateBps());
        printInput("Cap Per Loss", cover.getCoverCapPerLoss());

        // 50% of 40 = 20 is below the cap
        assertAmount("20", cover.calcLossCover(new BigDecimal("40")), "Rate limited");
        // 50% of 100 = 50 is above the cap of 30
        BigDecimal capped = cover.calcLossCover(new BigDecimal("100"));
        printOutput("Cover for loss 100", capped);
        assertAmount("30", capped, "Cap limited");
        printSuccess("Loss cover bounded");
    }

    @Test
    @DisplayName("Withdrawal above cover assets should be rejected")
    void testWithdrawTooMuch_ShouldFail() {
        printTestHeader("Cover Over-Withdrawal");

        fixture.pool.depositCover("capped-cover", "provider", new BigDecimal("50"));
        printExpectedException("InsufficientLiquidityException", "Cover holds 50");

        assertThrows(InsufficientLiquidityException.class,
            () -> fixture.pool.withdrawCover("capped-cover", "provider", new BigDecimal("60")));

        BigDecimal remaining = fixture.pool.withdrawCover("capped-cover", "provider", new BigDecimal("20"));
        printOutput("Remaining", remaining);
        assertAmount("30", remaining, "Cover assets after withdrawal");
        assertAmount("30", fixture.pool.totalPoolValue(), "Total pool value follows the cover");
        assertTrue(fixture.pool.checkValueInvariant(), "Pool value invariant must hold");
        printSuccess("Withdrawal bounded by cover assets");
    }

    @Test
    @DisplayName("Unknown cover id should be reported as not found")
    void testUnknownCover_ShouldFail() {
        printTestHeader("Unknown Cover");

        printExpectedException("ResourceNotFoundException", "No such cover");
        assertThrows(ResourceNotFoundException.class,
            () -> fixture.pool.depositCover("missing-cover", "provider", new BigDecimal("10")));
        printSuccess("Unknown cover rejected");
    }
}
