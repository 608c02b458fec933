package com.pacaccounting.reporting;

import com.pacaccounting.utils.Utils;

import java.util.List;

/**
 * One client in a technician's yearly map.
 *
 * @param client                      ledger company name, or the registry name when the ledger has none
 * @param monthlyMinutes              January to December, each month including the client's extra
 * @param baseMinutes                 month minutes of the year without the extra
 * @param extraMonthly                recurring monthly extra of the client
 * @param adjustedMinutes             base plus twelve times the extra
 * @param averageMinutes              adjusted total over twelve months
 * @param detailMinutes               minutes the ledger breakdown attributes to this technician personally
 * @param noTimings                   neither month minutes nor an extra for the client
 * @param timingsUnderOtherTechnician the client has minutes in the ledger, but they are listed under another technician
 */
public record TechnicianClientRow(String client,
                                  List<Integer> monthlyMinutes,
                                  long baseMinutes,
                                  int extraMonthly,
                                  long adjustedMinutes,
                                  int averageMinutes,
                                  long detailMinutes,
                                  boolean noTimings,
                                  boolean timingsUnderOtherTechnician) {

    public TechnicianClientRow {
        monthlyMinutes = List.copyOf(monthlyMinutes);
    }

    public int minutesFor(int month) {
        return monthlyMinutes.get(month - 1);
    }

    public String formattedAverage() {
        return averageMinutes > 0 ? Utils.formatMinutes(averageMinutes) : "";
    }
}
