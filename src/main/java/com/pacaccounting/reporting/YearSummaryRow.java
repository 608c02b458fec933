package com.pacaccounting.reporting;

import com.pacaccounting.utils.Utils;

import java.util.List;

/**
 * One company in the yearly summary.
 *
 * @param monthlyMinutes   effective minutes of January to December, each month including the extra
 * @param baseMinutes      sum of the month minutes without the extra
 * @param extraMonthly     recurring monthly extra
 * @param adjustedMinutes  base plus twelve times the extra
 * @param averageMinutes   adjusted total over the months used for the average
 */
public record YearSummaryRow(String company,
                             String technician,
                             List<Integer> monthlyMinutes,
                             long baseMinutes,
                             int extraMonthly,
                             long adjustedMinutes,
                             int averageMinutes) {

    public YearSummaryRow {
        monthlyMinutes = List.copyOf(monthlyMinutes);
    }

    public int minutesFor(int month) {
        return monthlyMinutes.get(month - 1);
    }

    public String formattedAverage() {
        return averageMinutes > 0 ? Utils.formatMinutes(averageMinutes) : "";
    }

    public String formattedAdjusted() {
        return adjustedMinutes > 0 ? Utils.formatMinutes(adjustedMinutes) : "";
    }
}
