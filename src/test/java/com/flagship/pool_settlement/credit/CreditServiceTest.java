package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.PoolTestFixture;
import com.flagship.pool_settlement.calendar.PayPeriodDuration;
import com.flagship.pool_settlement.exception.InsufficientCreditException;
import com.flagship.pool_settlement.exception.InsufficientLiquidityException;
import com.flagship.pool_settlement.exception.InvalidStateTransitionException;
import com.flagship.pool_settlement.exception.MaturityExceededException;
import com.flagship.pool_settlement.exception.PoolDisabledException;
import com.flagship.pool_settlement.exception.UnauthorizedException;
import com.flagship.pool_settlement.ledger.Amounts;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import com.flagship.pool_settlement.liquidity.Tranche;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests: Credit lifecycle
 *
 * These tests verify:
 * - Payments move the credit between GOOD_STANDING, DELAYED and CLOSED
 * - Missed periods default the credit and book the principal as a pool loss
 * - Rejected drawdowns leave the record, available credit and funds untouched
 */
class CreditServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 15);
    private static final String CREDIT_ID = CreditType.CREDIT_LINE.creditId("bob");

    private PoolTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new PoolTestFixture(PoolTestFixture.plainProperties(), TODAY);
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

    private CreditConfig config(int yieldBps, int periods, boolean revolving) {
        return CreditConfig.builder()
            .creditLimit(new BigDecimal("1000"))
            .committedAmount(BigDecimal.ZERO)
            .yieldBps(yieldBps)
            .numOfPeriods(periods)
            .payPeriodDuration(PayPeriodDuration.MONTHLY)
            .revolving(revolving)
            .build();
    }

    @Test
    @DisplayName("Payment clearing past due should return a delayed credit to good standing")
    void testPaymentRestoresGoodStanding() {
        printTestHeader("Delayed Credit Payment");

        // Given: A delayed credit with pastDue 50, nextDue 100 (yield), unbilled 1000
        CreditRecord delayed = CreditRecord.approved(CREDIT_ID, "bob", CreditType.CREDIT_LINE, null, 5)
            .toBuilder()
            .state(CreditState.DELAYED)
            .nextDueDate(LocalDate.of(2024, 2, 1))
            .maturityDate(LocalDate.of(2024, 6, 1))
            .unbilledPrincipal(Amounts.of(1000))
            .yieldDue(Amounts.of(100))
            .nextDue(Amounts.of(100))
            .dueDetail(DueDetail.empty().toBuilder().yieldPastDue(Amounts.of(50)).build())
            .missedPeriods(1)
            .remainingPeriods(4)
            .build();
        fixture.creditService.registerCredit(delayed, config(1200, 5, true), Amounts.ZERO);
        printInput("Past Due", delayed.getPastDue());
        printInput("Next Due", delayed.getNextDue());

        // When: Borrower pays 120
        PaymentResult result = fixture.creditLine.makePayment("bob", new BigDecimal("120"));
        CreditRecord record = result.getRecord();
        printOutput("Record", record);

        // Then
        assertEquals(CreditState.GOOD_STANDING, record.getState());
        assertEquals(0, record.getMissedPeriods());
        assertAmount("0", record.getPastDue(), "Past due");
        assertAmount("30", record.getNextDue(), "Next due");
        assertAmount("1000", record.getUnbilledPrincipal(), "Unbilled principal");
        assertAmount("120", result.getIncomePaid(), "Income");
        assertAmount("120", fixture.pool.trancheAssets(Tranche.JUNIOR), "Income distributed as profit");
        assertAmount("120", fixture.pool.availableLiquidity(), "Payment collected into the pool safe");
        assertEquals(CreditState.GOOD_STANDING, fixture.creditManager.getCreditRecord(CREDIT_ID).getState());
        printSuccess("Credit back in good standing");
    }

    @Test
    @DisplayName("Paying everything in the final period should close the credit")
    void testFinalPeriodPayoffCloses() {
        printTestHeader("Final Period Payoff");

        // Given: Final period, nextDue 1150 (150 yield + 1000 principal)
        CreditRecord finalPeriod = CreditRecord.approved(CREDIT_ID, "bob", CreditType.CREDIT_LINE, null, 1)
            .toBuilder()
            .state(CreditState.GOOD_STANDING)
            .nextDueDate(LocalDate.of(2024, 2, 1))
            .maturityDate(LocalDate.of(2024, 2, 1))
            .unbilledPrincipal(Amounts.ZERO)
            .yieldDue(Amounts.of(150))
            .nextDue(Amounts.of(1150))
            .remainingPeriods(0)
            .build();
        fixture.creditService.registerCredit(finalPeriod, config(1200, 1, false), Amounts.ZERO);
        printInput("Payoff", fixture.creditLine.payoffAmount("bob"));

        // When
        PaymentResult result = fixture.creditLine.makePayment("bob", new BigDecimal("1150"));
        printOutput("Record", result.getRecord());

        // Then
        assertTrue(result.isPaidOff());
        assertEquals(CreditState.CLOSED, result.getRecord().getState());
        assertAmount("0", result.getRecord().getPayoffAmount(), "Nothing left to pay");
        assertAmount("0", result.getRecord().getNextDue(), "Next due");
        assertAmount("1000", result.getPrincipalPaid(), "Principal paid");
        assertAmount("150", result.getIncomePaid(), "Yield paid");

        printExpectedException("InvalidStateTransitionException", "Closed credits take no payments");
        assertThrows(InvalidStateTransitionException.class,
            () -> fixture.creditLine.makePayment("bob", new BigDecimal("1")));
        printSuccess("Credit closed");
    }

    @Test
    @DisplayName("Missed periods should delay, then default the credit and book the principal as a loss")
    void testMissedPeriodsDefault() {
        printTestHeader("Delay and Default");

        // Given: Junior liquidity of 2000 and a 1000 drawdown on a 12%, 3 period line
        fixture.deposit(Tranche.JUNIOR, "junior-lender", "2000");
        fixture.creditManager.approveBorrower("bob", CreditType.CREDIT_LINE, config(1200, 3, true));
        DrawdownResult drawdown = fixture.creditLine.drawdown("bob", new BigDecimal("1000"));
        printInput("Drawdown", drawdown.getNetAmount());
        assertAmount("1000", fixture.ledgerService.getAccountBalance(CustodyAccounts.borrower("bob")),
            "Borrower received the drawdown");
        assertAmount("0", fixture.creditManager.availableCredit(CREDIT_ID), "Limit used up");

        // When: The first due date passes unpaid
        fixture.clock.setDate(LocalDate.of(2024, 2, 1));
        CreditRecord delayed = fixture.creditManager.refreshCredit(CREDIT_ID);
        printOutput("After February", delayed.getState());

        // Then
        assertEquals(CreditState.DELAYED, delayed.getState());
        assertEquals(1, delayed.getMissedPeriods());

        // When: Two more due dates pass
        fixture.clock.setDate(LocalDate.of(2024, 4, 1));
        CreditRecord defaulted = fixture.creditManager.refreshCredit(CREDIT_ID);
        printOutput("After April", defaulted.getState());

        // Then: Principal written off against junior
        assertEquals(CreditState.DEFAULTED, defaulted.getState());
        assertAmount("1000", fixture.pool.trancheAssets(Tranche.JUNIOR), "Junior took the loss");
        assertAmount("1000", fixture.pool.trancheLosses().getJunior(), "Junior losses");
        assertAmount("0", fixture.creditManager.availableCredit(CREDIT_ID), "No credit after default");

        // When: Borrower pays 500 after default
        PaymentResult recovery = fixture.creditLine.makePayment("bob", new BigDecimal("500"));
        printOutput("Recovery", recovery);

        // Then: The payment is a loss recovery
        assertTrue(recovery.isLossRecovery());
        assertAmount("1500", fixture.pool.trancheAssets(Tranche.JUNIOR), "Junior recovered");
        assertAmount("500", fixture.pool.trancheLosses().getJunior(), "Remaining junior losses");
        assertTrue(fixture.pool.checkValueInvariant(), "Pool value invariant must hold");
        printSuccess("Credit defaulted and recovered");
    }

    @Test
    @DisplayName("Drawdown above available credit should be rejected")
    void testDrawdownExceedsAvailable_ShouldFail() {
        printTestHeader("Drawdown - Insufficient Credit");

        fixture.deposit(Tranche.JUNIOR, "junior-lender", "2000");
        fixture.creditManager.approveBorrower("bob", CreditType.CREDIT_LINE, config(1200, 3, true));
        printInput("Available", fixture.creditManager.availableCredit(CREDIT_ID));
        printExpectedException("InsufficientCreditException", "1001 exceeds 1000");

        InsufficientCreditException exception = assertThrows(InsufficientCreditException.class,
            () -> fixture.creditLine.drawdown("bob", new BigDecimal("1001")));
        printExceptionDetails(exception);

        assertEquals(CreditState.APPROVED, fixture.creditLine.getCreditRecord("bob").getState());
        assertAmount("2000", fixture.pool.availableLiquidity(), "No funds moved");
        printSuccess("Drawdown rejected");
    }

    @Test
    @DisplayName("Drawdown the pool cannot fund should be rolled back completely")
    void testDrawdownWithoutLiquidity_ShouldRollBack() {
        printTestHeader("Drawdown - No Liquidity");

        fixture.creditManager.approveBorrower("bob", CreditType.CREDIT_LINE, config(1200, 3, true));
        printInput("Pool Liquidity", fixture.pool.availableLiquidity());
        printExpectedException("InsufficientLiquidityException", "Pool safe is empty");

        assertThrows(InsufficientLiquidityException.class,
            () -> fixture.creditLine.drawdown("bob", new BigDecimal("100")));

        CreditRecord record = fixture.creditLine.getCreditRecord("bob");
        printOutput("Record", record);
        assertEquals(CreditState.APPROVED, record.getState());
        assertNull(record.getNextDueDate(), "No schedule was set");
        assertAmount("1000", fixture.creditManager.availableCredit(CREDIT_ID), "Available credit restored");
        printSuccess("Failed drawdown left no trace");
    }

    @Test
    @DisplayName("Drawdown on a matured credit should be rejected")
    void testDrawdownAfterMaturity_ShouldFail() {
        printTestHeader("Drawdown - Matured");

        // Given: Interest free 2 period line drawn and repaid early
        fixture.deposit(Tranche.JUNIOR, "junior-lender", "2000");
        fixture.creditManager.approveBorrower("bob", CreditType.CREDIT_LINE, config(0, 2, true));
        fixture.creditLine.drawdown("bob", new BigDecimal("100"));
        fixture.clock.setDate(LocalDate.of(2024, 1, 20));
        PaymentResult repaid = fixture.creditLine.makePayment("bob", new BigDecimal("100"));
        assertTrue(repaid.isPaidOff());
        assertEquals(CreditState.GOOD_STANDING, repaid.getRecord().getState(), "Not closed before the final period");
        assertAmount("1000", fixture.creditManager.availableCredit(CREDIT_ID), "Revolving credit restored");
        printInput("Maturity", repaid.getRecord().getMaturityDate());

        // When: Drawing on the maturity date
        fixture.clock.setDate(LocalDate.of(2024, 3, 1));
        printExpectedException("MaturityExceededException", "Credit matured on 2024-03-01");
        MaturityExceededException exception = assertThrows(MaturityExceededException.class,
            () -> fixture.creditLine.drawdown("bob", new BigDecimal("50")));
        printExceptionDetails(exception);
        printSuccess("Matured credit refused drawdown");
    }

    @Test
    @DisplayName("Drawdown should be refused for unknown borrowers and while the pool is disabled")
    void testDrawdownGuards_ShouldFail() {
        printTestHeader("Drawdown Guards");

        fixture.deposit(Tranche.JUNIOR, "junior-lender", "2000");
        fixture.creditManager.approveBorrower("bob", CreditType.CREDIT_LINE, config(1200, 3, true));

        printExpectedException("UnauthorizedException", "alice has no credit line");
        assertThrows(UnauthorizedException.class,
            () -> fixture.creditLine.drawdown("alice", new BigDecimal("100")));

        fixture.pool.disablePool();
        printExpectedException("PoolDisabledException", "Pool is off");
        assertThrows(PoolDisabledException.class,
            () -> fixture.creditLine.drawdown("bob", new BigDecimal("100")));

        fixture.pool.enablePool();
        DrawdownResult result = fixture.creditLine.drawdown("bob", new BigDecimal("100"));
        printOutput("Drawdown After Enable", result.getAmount());
        assertAmount("100", result.getNetAmount(), "Net amount without fees");
        printSuccess("Guards enforced");
    }

    @Test
    @DisplayName("Front loading fee should be taken from the drawdown and distributed as profit")
    void testFrontLoadingFee() {
        printTestHeader("Front Loading Fee");

        fixture.properties.getCredit().setFrontLoadingFeeFlat(new BigDecimal("5"));
        fixture.properties.getCredit().setFrontLoadingFeeBps(100);
        fixture.deposit(Tranche.JUNIOR, "junior-lender", "2000");
        fixture.creditManager.approveBorrower("bob", CreditType.CREDIT_LINE, config(1200, 3, true));

        DrawdownResult result = fixture.creditLine.drawdown("bob", new BigDecimal("500"));
        printOutput("Fee", result.getFrontLoadingFee());
        printOutput("Net", result.getNetAmount());

        assertAmount("10", result.getFrontLoadingFee(), "5 flat + 1% of 500");
        assertAmount("490", result.getNetAmount(), "Borrower receives the net amount");
        assertAmount("2010", fixture.pool.trancheAssets(Tranche.JUNIOR), "Fee is junior profit");
        assertAmount("1510", fixture.pool.availableLiquidity(), "Fee stays in the pool safe");

        printExpectedException("IllegalArgumentException", "Drawdown does not cover the fee");
        assertThrows(IllegalArgumentException.class,
            () -> fixture.creditLine.drawdown("bob", new BigDecimal("5")));
        printSuccess("Fee applied");
    }

    @Test
    @DisplayName("Manual default and write-off should follow the credit state machine")
    void testForceDefaultAndClose() {
        printTestHeader("Force Default and Write-Off");

        fixture.deposit(Tranche.JUNIOR, "junior-lender", "2000");
        fixture.creditManager.approveBorrower("bob", CreditType.CREDIT_LINE, config(1200, 3, true));

        printExpectedException("InvalidStateTransitionException", "Nothing drawn yet");
        assertThrows(InvalidStateTransitionException.class,
            () -> fixture.creditManager.forceDefault(CREDIT_ID, "fraud"));

        fixture.creditLine.drawdown("bob", new BigDecimal("400"));
        printExpectedException("InvalidStateTransitionException", "No periods missed");
        assertThrows(InvalidStateTransitionException.class, () -> fixture.creditManager.triggerDefault(CREDIT_ID));
        assertThrows(InvalidStateTransitionException.class, () -> fixture.creditManager.closeCredit(CREDIT_ID));

        CreditRecord defaulted = fixture.creditManager.forceDefault(CREDIT_ID, "fraud");
        printOutput("State", defaulted.getState());
        assertEquals(CreditState.DEFAULTED, defaulted.getState());
        assertAmount("1600", fixture.pool.trancheAssets(Tranche.JUNIOR), "Principal written off");

        CreditRecord closed = fixture.creditManager.closeCredit(CREDIT_ID);
        assertEquals(CreditState.CLOSED, closed.getState());
        assertEquals(0, fixture.creditManager.refreshAll(), "Closed credits are not billed");
        printSuccess("State machine followed");
    }
}
