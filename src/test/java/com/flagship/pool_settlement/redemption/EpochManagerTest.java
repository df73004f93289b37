package com.flagship.pool_settlement.redemption;

import com.flagship.pool_settlement.PoolTestFixture;
import com.flagship.pool_settlement.calendar.PayPeriodDuration;
import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.credit.CreditConfig;
import com.flagship.pool_settlement.credit.CreditType;
import com.flagship.pool_settlement.exception.EpochInProgressException;
import com.flagship.pool_settlement.exception.PoolDisabledException;
import com.flagship.pool_settlement.exception.UnauthorizedException;
import com.flagship.pool_settlement.ledger.Account;
import com.flagship.pool_settlement.ledger.CustodyAccounts;
import com.flagship.pool_settlement.liquidity.Tranche;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.ConcurrencyFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests: EpochManager and TrancheVault
 *
 * These tests verify:
 * - Epoch close processes requests up to the pool's free liquidity
 * - Partially processed requests carry over and lenders are settled pro rata
 * - Senior first and pro rata priorities, including the junior ratio guard
 * - Disbursement from the tranche redemption reserve
 * - Share supply stays whole when carried over requests are cancelled
 * - Concurrent closes settle an epoch once
 */
class EpochManagerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 15);

    private PoolTestFixture fixture;

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

    private void drawFromPool(String amount) {
        fixture.creditManager.approveBorrower("bob", CreditType.CREDIT_LINE, CreditConfig.builder()
            .creditLimit(new BigDecimal("10000"))
            .committedAmount(BigDecimal.ZERO)
            .yieldBps(1200)
            .numOfPeriods(12)
            .payPeriodDuration(PayPeriodDuration.MONTHLY)
            .revolving(true)
            .build());
        fixture.creditLine.drawdown("bob", new BigDecimal(amount));
    }

    @Test
    @DisplayName("Epoch close should process requests up to available liquidity and carry over the rest")
    void testCloseEpoch_PartialThenFull() {
        printTestHeader("Epoch Close - Partial Processing and Carry Over");

        // Given: Junior lenders A and B hold 600 and 400, 400 is lent out
        fixture = new PoolTestFixture(PoolTestFixture.plainProperties(), TODAY);
        TrancheVault junior = fixture.vaults.junior();
        fixture.deposit(Tranche.JUNIOR, "lender-a", "600");
        fixture.deposit(Tranche.JUNIOR, "lender-b", "400");
        drawFromPool("400");
        junior.addRedemptionRequest("lender-a", new BigDecimal("600"));
        junior.addRedemptionRequest("lender-b", new BigDecimal("400"));
        assertEquals(LocalDate.of(2024, 2, 1), fixture.epochManager.currentEpoch().getEndDate());
        printInput("Requested Shares", junior.getOpenSummary().getTotalSharesRequested());
        printInput("Available Liquidity", fixture.pool.availableLiquidity());

        // When: Epoch 1 closes
        fixture.clock.setDate(LocalDate.of(2024, 2, 1));
        EpochCloseResult result = fixture.epochManager.closeEpoch();
        printOutput("Junior Summary", result.getJuniorSummary());

        // Then: 600 of 1000 shares processed at price 1
        assertEquals(1L, result.getClosedEpochId());
        assertEquals(2L, result.getNextEpoch().getId());
        assertEquals(LocalDate.of(2024, 3, 1), result.getNextEpoch().getEndDate());
        assertTrue(result.getJuniorSummary().isSealed());
        assertAmount("600", result.getJuniorSummary().getTotalSharesProcessed(), "Shares processed");
        assertAmount("600", result.getJuniorSummary().getTotalAmountProcessed(), "Amount processed");
        assertAmount("0", result.getSeniorSummary().getTotalSharesProcessed(), "No senior requests");
        assertAmount("600", fixture.ledgerService.getAccountBalance(junior.getReserveAccount()), "Reserve funded");
        assertAmount("400", fixture.pool.trancheAssets(Tranche.JUNIOR), "Junior assets reduced");
        assertAmount("400", junior.totalSupply(), "Processed shares burned");

        // And: Lenders are settled pro rata to their requests
        assertAmount("360", junior.withdrawableAssets("lender-a"), "A gets 60%");
        assertAmount("240", junior.withdrawableAssets("lender-b"), "B gets 40%");
        assertAmount("160", junior.redemptionRecord("lender-b").getSharesRequested(), "B still waiting on 160");

        // When: A collects twice
        BigDecimal first = junior.disburse("lender-a");
        BigDecimal second = junior.disburse("lender-a");
        printOutput("First Disbursement", first);
        printOutput("Second Disbursement", second);
        assertAmount("360", first, "Processed amount paid");
        assertAmount("0", second, "Nothing left to pay");
        assertAmount("240", fixture.ledgerService.getAccountBalance(junior.getReserveAccount()), "B's part stays");

        // And: Epoch 2 starts with the unprocessed shares and fresh liquidity settles them
        assertAmount("400", junior.getOpenSummary().getTotalSharesRequested(), "Carried over");
        BigDecimal minted = fixture.deposit(Tranche.JUNIOR, "lender-c", "400");
        assertAmount("400", minted, "Price is still 1");
        fixture.clock.setDate(LocalDate.of(2024, 3, 1));
        EpochCloseResult nextClose = fixture.epochManager.closeEpoch();

        assertAmount("400", nextClose.getJuniorSummary().getTotalSharesProcessed(), "Carry over fully processed");
        assertAmount("600", junior.redemptionRecord("lender-a").getTotalAmountProcessed(), "A fully redeemed");
        assertAmount("400", junior.redemptionRecord("lender-b").getTotalAmountProcessed(), "B fully redeemed");
        assertAmount("0", junior.escrowedShares(), "Escrow emptied");
        assertTrue(fixture.pool.checkValueInvariant());
        printSuccess("Epochs processed requests within liquidity");
    }

    @Test
    @DisplayName("Closing before the end date or while the pool is disabled should be rejected")
    void testCloseEpoch_ShouldFail() {
        printTestHeader("Epoch Close - Guards");

        fixture = new PoolTestFixture(PoolTestFixture.plainProperties(), TODAY);

        printExpectedException("EpochInProgressException", "Epoch ends 2024-02-01");
        EpochInProgressException early = assertThrows(EpochInProgressException.class,
            () -> fixture.epochManager.closeEpoch());
        printExceptionDetails(early);

        fixture.clock.setDate(LocalDate.of(2024, 2, 1));
        fixture.pool.disablePool();
        printExpectedException("PoolDisabledException", "Pool disabled");
        assertThrows(PoolDisabledException.class, () -> fixture.epochManager.closeEpoch());
        assertEquals(1L, fixture.epochManager.currentEpoch().getId(), "Epoch not advanced");

        fixture.pool.enablePool();
        assertEquals(1L, fixture.epochManager.closeEpoch().getClosedEpochId());
        printSuccess("Epoch close guards enforced");
    }

    @Test
    @DisplayName("Senior first should serve senior requests and keep junior within the ratio")
    void testCloseEpoch_SeniorFirstWithRatioGuard() {
        printTestHeader("Epoch Close - Senior First");

        // Given: Junior 100, senior 400 at the 4:1 cap
        fixture = new PoolTestFixture(PoolTestFixture.plainProperties(), TODAY);
        fixture.deposit(Tranche.JUNIOR, "junior-lender", "100");
        fixture.deposit(Tranche.SENIOR, "senior-lender", "400");
        fixture.vaults.senior().addRedemptionRequest("senior-lender", new BigDecimal("200"));
        fixture.vaults.junior().addRedemptionRequest("junior-lender", new BigDecimal("100"));

        // When
        fixture.clock.setDate(LocalDate.of(2024, 2, 1));
        EpochCloseResult result = fixture.epochManager.closeEpoch();
        printOutput("Senior", result.getSeniorSummary());
        printOutput("Junior", result.getJuniorSummary());

        // Then: Senior fully served; junior may only fall to 200 / 4 = 50
        assertAmount("200", result.getSeniorSummary().getTotalAmountProcessed(), "Senior served first");
        assertAmount("50", result.getJuniorSummary().getTotalAmountProcessed(), "Junior limited by the ratio");
        assertAmount("200", fixture.pool.trancheAssets(Tranche.SENIOR), "Senior after");
        assertAmount("50", fixture.pool.trancheAssets(Tranche.JUNIOR), "Junior after");
        assertAmount("50", fixture.vaults.junior().getOpenSummary().getTotalSharesRequested(), "Junior carry over");
        printSuccess("Ratio guard applied");
    }

    @Test
    @DisplayName("Pro rata should split scarce liquidity by requested value")
    void testCloseEpoch_ProRata() {
        printTestHeader("Epoch Close - Pro Rata");

        PoolProperties properties = PoolTestFixture.plainProperties();
        properties.setMaxSeniorJuniorRatio(0);
        properties.getRedemption().setPriority(RedemptionPriority.PRO_RATA);
        fixture = new PoolTestFixture(properties, TODAY);
        fixture.deposit(Tranche.JUNIOR, "junior-lender", "100");
        fixture.deposit(Tranche.SENIOR, "senior-lender", "400");
        drawFromPool("300");
        fixture.vaults.senior().addRedemptionRequest("senior-lender", new BigDecimal("200"));
        fixture.vaults.junior().addRedemptionRequest("junior-lender", new BigDecimal("100"));
        printInput("Available Liquidity", fixture.pool.availableLiquidity());

        fixture.clock.setDate(LocalDate.of(2024, 2, 1));
        EpochCloseResult result = fixture.epochManager.closeEpoch();

        // Then: 200 liquidity split 2:1
        assertAmount("133.333333", result.getSeniorSummary().getTotalAmountProcessed(), "Senior share");
        assertAmount("66.666667", result.getJuniorSummary().getTotalAmountProcessed(), "Junior share");
        assertAmount("0", fixture.pool.availableLiquidity(), "All liquidity reserved");
        printSuccess("Liquidity split pro rata");
    }

    @Test
    @DisplayName("Vault should enforce lender approval and share balances")
    void testVaultGuards() {
        printTestHeader("Tranche Vault - Guards");

        fixture = new PoolTestFixture(PoolTestFixture.plainProperties(), TODAY);
        TrancheVault junior = fixture.vaults.junior();

        printExpectedException("UnauthorizedException", "Lender not approved");
        assertThrows(UnauthorizedException.class, () -> junior.deposit("stranger", new BigDecimal("100")));

        fixture.deposit(Tranche.JUNIOR, "lender-a", "100");
        printExpectedException("IllegalArgumentException", "Request above share balance");
        assertThrows(IllegalArgumentException.class,
            () -> junior.addRedemptionRequest("lender-a", new BigDecimal("101")));

        junior.addRedemptionRequest("lender-a", new BigDecimal("60"));
        printExpectedException("IllegalArgumentException", "Cancel above outstanding request");
        assertThrows(IllegalArgumentException.class,
            () -> junior.cancelRedemptionRequest("lender-a", new BigDecimal("61")));

        junior.cancelRedemptionRequest("lender-a", new BigDecimal("40"));
        assertAmount("80", junior.balanceOf("lender-a"), "Circulating shares");
        assertAmount("20", junior.escrowedShares(), "Escrowed shares");
        assertAmount("20", junior.getOpenSummary().getTotalSharesRequested(), "Open requests");
        assertAmount("100", junior.totalSupply(), "Escrow still counts towards supply");
        assertAmount("-100", fixture.ledgerService.getAccountBalance(CustodyAccounts.lender("lender-a")),
            "Lender funded the deposit");

        junior.removeApprovedLender("lender-a");
        assertFalse(junior.isApprovedLender("lender-a"));
        assertAmount("80", junior.balanceOf("lender-a"), "Shares kept after removal");
        printSuccess("Vault guards enforced");
    }

    @Test
    @DisplayName("Cancelling carried over requests should keep balances plus escrow equal to supply")
    void testCancelCarriedOverRequests() {
        printTestHeader("Tranche Vault - Cancel After Partial Processing");

        // Given: Three lenders hold one share each and only 1 of liquidity is left
        fixture = new PoolTestFixture(PoolTestFixture.plainProperties(), TODAY);
        TrancheVault junior = fixture.vaults.junior();
        List<String> lenders = List.of("lender-a", "lender-b", "lender-c");
        for (String lender : lenders) {
            fixture.deposit(Tranche.JUNIOR, lender, "1");
        }
        drawFromPool("2");
        for (String lender : lenders) {
            junior.addRedemptionRequest(lender, BigDecimal.ONE);
        }

        // When: The close processes one of the three shares
        fixture.clock.setDate(LocalDate.of(2024, 2, 1));
        EpochCloseResult result = fixture.epochManager.closeEpoch();
        printOutput("Junior Summary", result.getJuniorSummary());
        assertAmount("1", result.getJuniorSummary().getTotalSharesProcessed(), "One share processed");

        // And: Every lender cancels whatever is still outstanding
        for (String lender : lenders) {
            BigDecimal outstanding = junior.redemptionRecord(lender).getSharesRequested();
            printInput("Outstanding " + lender, outstanding);
            junior.cancelRedemptionRequest(lender, outstanding);
        }

        // Then: No share was created or lost
        BigDecimal balances = fixture.vaultRepository.sumShareBalances(Tranche.JUNIOR);
        printOutput("Sum Of Balances", balances);
        printOutput("Escrowed", junior.escrowedShares());
        printOutput("Total Supply", junior.totalSupply());
        assertTrue(junior.escrowedShares().signum() >= 0, "Escrow never negative");
        assertAmount(junior.totalSupply().toPlainString(), balances.add(junior.escrowedShares()),
            "Balances plus escrow equal supply");
        for (String lender : lenders) {
            assertAmount("0", junior.redemptionRecord(lender).getSharesRequested(), lender + " has nothing pending");
        }

        // And: The processed amounts fit in the reserve
        BigDecimal paid = BigDecimal.ZERO;
        for (String lender : lenders) {
            paid = paid.add(junior.disburse(lender));
        }
        printOutput("Disbursed", paid);
        assertTrue(paid.compareTo(BigDecimal.ONE) <= 0, "Never more than the reserve held");
        assertTrue(fixture.ledgerService.getAccountBalance(junior.getReserveAccount()).signum() >= 0);
        printSuccess("Supply accounting intact after cancellations");
    }

    @Test
    @DisplayName("Concurrent closes of the same epoch should settle it exactly once")
    void testConcurrentCloseEpoch() throws InterruptedException {
        printTestHeader("Epoch Close - Concurrent");

        // Given: A junior request that the pool can fully serve
        fixture = new PoolTestFixture(PoolTestFixture.plainProperties(), TODAY);
        TrancheVault junior = fixture.vaults.junior();
        fixture.deposit(Tranche.JUNIOR, "lender-a", "500");
        junior.addRedemptionRequest("lender-a", new BigDecimal("200"));
        fixture.clock.setDate(LocalDate.of(2024, 2, 1));

        // When: Two closes race
        int numThreads = 2;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(numThreads);
        AtomicInteger closedCount = new AtomicInteger(0);
        AtomicInteger rejectedCount = new AtomicInteger(0);
        AtomicInteger otherCount = new AtomicInteger(0);

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    fixture.epochManager.closeEpoch();
                    closedCount.incrementAndGet();
                } catch (EpochInProgressException | ConcurrencyFailureException e) {
                    rejectedCount.incrementAndGet();
                } catch (Exception e) {
                    e.printStackTrace();
                    otherCount.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        done.await();
        executor.shutdown();

        printOutput("Closed", closedCount.get());
        printOutput("Rejected", rejectedCount.get());

        // Then: One close won, the other was turned away, and the redemption was paid once
        assertEquals(1, closedCount.get(), "Exactly one close succeeds");
        assertEquals(1, rejectedCount.get(), "The other close is rejected");
        assertEquals(0, otherCount.get(), "No other failures");
        assertEquals(2L, fixture.epochManager.currentEpoch().getId());
        assertAmount("200", fixture.ledgerService.getAccountBalance(junior.getReserveAccount()), "Reserve funded once");
        assertAmount("300", fixture.pool.trancheAssets(Tranche.JUNIOR), "Junior assets reduced once");
        assertAmount("300", junior.totalSupply(), "Shares burned once");
        assertTrue(fixture.pool.checkValueInvariant());
        printSuccess("Epoch settled once");
    }

    @Test
    @DisplayName("Assets left in a tranche without shares should go to the next depositor")
    void testFirstDepositorAfterFullExit() {
        printTestHeader("Tranche Vault - Assets Without Shares");

        // Given: The only junior lender redeemed everything
        fixture = new PoolTestFixture(PoolTestFixture.plainProperties(), TODAY);
        TrancheVault junior = fixture.vaults.junior();
        fixture.deposit(Tranche.JUNIOR, "lender-a", "100");
        junior.addRedemptionRequest("lender-a", new BigDecimal("100"));
        fixture.clock.setDate(LocalDate.of(2024, 2, 1));
        fixture.epochManager.closeEpoch();
        assertAmount("0", junior.totalSupply(), "No shares left");

        // And: A late profit of 1 lands in the empty tranche
        fixture.ledgerService.openAccount(CustodyAccounts.payer("late"), Account.AccountType.EXTERNAL);
        fixture.ledgerService.transfer(CustodyAccounts.payer("late"), CustodyAccounts.POOL_SAFE, BigDecimal.ONE,
            "Late income");
        fixture.pool.distributeProfit(BigDecimal.ONE);
        printInput("Junior Assets", fixture.pool.trancheAssets(Tranche.JUNIOR));

        // When: A new lender deposits 10
        BigDecimal minted = fixture.deposit(Tranche.JUNIOR, "lender-b", "10");
        printOutput("Shares Minted", minted);

        // Then: Shares are minted at 1 and the new lender owns the leftover profit too
        assertAmount("10", minted, "Minted at price 1");
        assertAmount("11", junior.convertToAssets(minted), "Leftover profit belongs to the new lender");
        assertTrue(fixture.pool.checkValueInvariant());
        printSuccess("First depositor absorbs assets left without shares");
    }
}
