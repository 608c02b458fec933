package com.pacaccounting.reporting;

import java.util.List;
import java.util.Optional;

/**
 * Maps of every technician for one year, with the totals across technicians.
 *
 * @param technicians    one map per technician, sorted by name
 * @param monthlyMinutes January to December over all technicians
 * @param yearMinutes    adjusted minutes of the year over all technicians
 * @param averageMinutes year minutes over twelve months
 */
public record TechnicianMaps(int year,
                             List<TechnicianMap> technicians,
                             List<Integer> monthlyMinutes,
                             long yearMinutes,
                             int averageMinutes) {

    public TechnicianMaps {
        technicians = List.copyOf(technicians);
        monthlyMinutes = List.copyOf(monthlyMinutes);
    }

    public List<String> technicianNames() {
        return technicians.stream().map(TechnicianMap::technician).toList();
    }

    public Optional<TechnicianMap> forTechnician(String technician) {
        return technicians.stream().filter(map -> map.technician().equals(technician)).findFirst();
    }

    public int minutesFor(int month) {
        return monthlyMinutes.get(month - 1);
    }
}
