package com.pacaccounting.reporting;

import com.pacaccounting.utils.Utils;

import java.util.List;

/**
 * Yearly map of one technician: the clients they are responsible for and their totals.
 *
 * @param monthlyMinutes  January to December over all clients, extras included
 * @param baseMinutes     month minutes of all clients without extras
 * @param extraMonthly    sum of the clients' monthly extras
 * @param adjustedMinutes base plus twelve times the extras
 * @param averageMinutes  adjusted total over twelve months
 */
public record TechnicianMap(String technician,
                            List<TechnicianClientRow> clients,
                            List<Integer> monthlyMinutes,
                            long baseMinutes,
                            int extraMonthly,
                            long adjustedMinutes,
                            int averageMinutes) {

    public TechnicianMap {
        clients = List.copyOf(clients);
        monthlyMinutes = List.copyOf(monthlyMinutes);
    }

    public int minutesFor(int month) {
        return monthlyMinutes.get(month - 1);
    }

    public String formattedAverage() {
        return averageMinutes > 0 ? Utils.formatMinutes(averageMinutes) : "";
    }
}
