package com.prakash.slotplanner.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

// One task's contiguous run of slots on a single date
@Value
public class Placement {

    Task task;
    LocalDate date;
    int firstSlot; // grid index, inclusive
    int lastSlot;  // grid index, inclusive
    List<String> slotLabels;

    public int slotCount() {
        return lastSlot - firstSlot + 1;
    }
}
