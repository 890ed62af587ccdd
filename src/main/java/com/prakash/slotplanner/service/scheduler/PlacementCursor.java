package com.prakash.slotplanner.service.scheduler;

import lombok.Value;

import java.time.LocalDate;

/**
 * Accumulator threaded through placement: the date being filled and the first grid
 * index a later task may use on it. Only ever moves forward.
 */
@Value
public class PlacementCursor {

    LocalDate date;
    int slotIndex;

    public static PlacementCursor startingAt(LocalDate referenceDate) {
        return new PlacementCursor(referenceDate, 0);
    }

    public PlacementCursor after(int lastPlacedSlot) {
        return new PlacementCursor(date, lastPlacedSlot + 1);
    }

    public PlacementCursor nextDay() {
        return new PlacementCursor(date.plusDays(1), 0);
    }
}
