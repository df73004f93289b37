package com.flagship.pool_settlement.calendar;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Day count and period boundary functions on the 30/360 convention.
 *
 * Periods start on the first day of a calendar month and cover 1, 3 or 6 months.
 * Quarterly and semi-annual periods are aligned to January 1st.
 */
public final class Calendar {

    public static final int DAYS_IN_A_MONTH = 30;
    public static final int DAYS_IN_A_YEAR = 360;

    private Calendar() {
    }

    public static LocalDate startOfPeriod(PayPeriodDuration duration, LocalDate date) {
        int months = duration.getMonths();
        int monthIndex = date.getMonthValue() - 1;
        int startMonth = monthIndex - (monthIndex % months) + 1;
        return LocalDate.of(date.getYear(), startMonth, 1);
    }

    public static LocalDate startOfNextPeriod(PayPeriodDuration duration, LocalDate date) {
        return startOfPeriod(duration, date).plusMonths(duration.getMonths());
    }

    /**
     * Days between two dates under 30/360 (US).
     *
     * A start on the 31st counts as the 30th. An end on the 31st counts as the
     * 30th only when the start is on the 30th or 31st.
     *
     * @throws IllegalArgumentException if start is after end
     */
    public static long daysDiff(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                String.format("Start date %s is after end date %s", start, end));
        }
        int startDay = start.getDayOfMonth();
        int endDay = end.getDayOfMonth();
        if (startDay == 31) {
            startDay = 30;
        }
        if (endDay == 31 && startDay >= 30) {
            endDay = 30;
        }
        return (long) DAYS_IN_A_YEAR * (end.getYear() - start.getYear())
            + (long) DAYS_IN_A_MONTH * (end.getMonthValue() - start.getMonthValue())
            + (endDay - startDay);
    }

    /**
     * Days from the given date to the start of the next period.
     */
    public static long daysRemainingInPeriod(PayPeriodDuration duration, LocalDate date) {
        return daysDiff(date, startOfNextPeriod(duration, date));
    }

    /**
     * Number of period boundaries crossed from a due date up to and including today.
     * Zero when today is before the due date.
     */
    public static int periodsPassed(PayPeriodDuration duration, LocalDate dueDate, LocalDate today) {
        if (today.isBefore(dueDate)) {
            return 0;
        }
        long months = ChronoUnit.MONTHS.between(dueDate.withDayOfMonth(1), startOfPeriod(duration, today));
        return (int) (months / duration.getMonths()) + 1;
    }

    /**
     * Number of whole or partial periods from today until the given maturity date,
     * counting the current partial period. At least one.
     */
    public static int periodsUntil(PayPeriodDuration duration, LocalDate today, LocalDate maturityDate) {
        LocalDate boundary = startOfNextPeriod(duration, today);
        int periods = 1;
        while (boundary.isBefore(maturityDate)) {
            boundary = boundary.plusMonths(duration.getMonths());
            periods++;
        }
        return periods;
    }
}
