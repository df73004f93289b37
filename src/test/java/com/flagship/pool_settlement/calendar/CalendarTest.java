package com.flagship.pool_settlement.calendar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests: 30/360 day count and period boundaries
 *
 * Billing and epochs depend on these functions, so edge days
 * (month ends, the 31st, quarter alignment) are checked explicitly.
 */
class CalendarTest {

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

    @Test
    @DisplayName("Day count uses 30 day months and clamps the 31st")
    void testDaysDiff() {
        printTestHeader("30/360 Day Count");

        // Given: Dates around month ends
        LocalDate midJanuary = LocalDate.of(2024, 1, 15);
        LocalDate firstFebruary = LocalDate.of(2024, 2, 1);
        printInput("Start", midJanuary);
        printInput("End", firstFebruary);

        // When/Then: Partial month
        long days = Calendar.daysDiff(midJanuary, firstFebruary);
        printOutput("Days", days);
        assertEquals(16, days, "15th to the 1st of next month is 16 days");

        // When/Then: 31st to 31st counts as 30th to 30th
        assertEquals(60, Calendar.daysDiff(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 3, 31)),
            "Both ends on the 31st count as the 30th");

        // When/Then: End on the 31st is kept when the start is before the 30th
        assertEquals(33, Calendar.daysDiff(LocalDate.of(2024, 2, 28), LocalDate.of(2024, 3, 31)),
            "End day is kept when the start is before the 30th");

        // When/Then: One year
        assertEquals(360, Calendar.daysDiff(LocalDate.of(2024, 3, 1), LocalDate.of(2025, 3, 1)),
            "A year is 360 days");
        printSuccess("Day counts follow 30/360");
    }

    @Test
    @DisplayName("Start date after end date should be rejected")
    void testDaysDiff_StartAfterEnd() {
        printTestHeader("Day Count - Reversed Dates");

        LocalDate start = LocalDate.of(2024, 3, 1);
        LocalDate end = LocalDate.of(2024, 2, 1);
        printInput("Start", start);
        printInput("End", end);

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> Calendar.daysDiff(start, end));
        printOutput("Exception", exception.getMessage());
        assertTrue(exception.getMessage().contains("after"));
        printSuccess("Reversed dates rejected");
    }

    @Test
    @DisplayName("Periods are aligned to calendar months and to January for longer durations")
    void testPeriodBoundaries() {
        printTestHeader("Period Boundaries");

        LocalDate date = LocalDate.of(2024, 5, 20);
        printInput("Date", date);

        assertEquals(LocalDate.of(2024, 5, 1), Calendar.startOfPeriod(PayPeriodDuration.MONTHLY, date));
        assertEquals(LocalDate.of(2024, 6, 1), Calendar.startOfNextPeriod(PayPeriodDuration.MONTHLY, date));
        assertEquals(LocalDate.of(2024, 4, 1), Calendar.startOfPeriod(PayPeriodDuration.QUARTERLY, date));
        assertEquals(LocalDate.of(2024, 7, 1), Calendar.startOfNextPeriod(PayPeriodDuration.QUARTERLY, date));

        LocalDate august = LocalDate.of(2024, 8, 10);
        assertEquals(LocalDate.of(2024, 7, 1), Calendar.startOfPeriod(PayPeriodDuration.SEMI_ANNUALLY, august));
        assertEquals(LocalDate.of(2025, 1, 1),
            Calendar.startOfNextPeriod(PayPeriodDuration.SEMI_ANNUALLY, august));

        long remaining = Calendar.daysRemainingInPeriod(PayPeriodDuration.MONTHLY, date);
        printOutput("Days remaining in May", remaining);
        assertEquals(11, remaining, "20th to the 1st of June is 11 days");
        printSuccess("Period boundaries aligned");
    }

    @Test
    @DisplayName("Periods passed counts every due date up to and including today")
    void testPeriodsPassed() {
        printTestHeader("Periods Passed");

        LocalDate dueDate = LocalDate.of(2024, 2, 1);
        printInput("Due date", dueDate);

        assertEquals(0, Calendar.periodsPassed(PayPeriodDuration.MONTHLY, dueDate, LocalDate.of(2024, 1, 31)),
            "Nothing passed before the due date");
        assertEquals(1, Calendar.periodsPassed(PayPeriodDuration.MONTHLY, dueDate, dueDate),
            "The due date itself counts");
        int passed = Calendar.periodsPassed(PayPeriodDuration.MONTHLY, dueDate, LocalDate.of(2024, 4, 15));
        printOutput("Periods passed by April 15", passed);
        assertEquals(3, passed, "February, March and April boundaries");
        printSuccess("Periods passed counted");
    }

    @Test
    @DisplayName("Periods until maturity include the current partial period")
    void testPeriodsUntil() {
        printTestHeader("Periods Until Maturity");

        LocalDate today = LocalDate.of(2024, 1, 15);
        printInput("Today", today);

        int periods = Calendar.periodsUntil(PayPeriodDuration.MONTHLY, today, LocalDate.of(2024, 4, 15));
        printOutput("Periods until April 15", periods);
        assertEquals(4, periods);
        assertEquals(1, Calendar.periodsUntil(PayPeriodDuration.MONTHLY, today, LocalDate.of(2024, 2, 1)),
            "Maturity on the next boundary is a single period");
        printSuccess("Periods until maturity counted");
    }
}
