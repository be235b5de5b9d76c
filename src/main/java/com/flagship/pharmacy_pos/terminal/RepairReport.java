package com.flagship.pharmacy_pos.terminal;

import lombok.Value;

@Value
public class RepairReport {
    int terminalsReleased;
    int sessionsClosed;
    /** Items skipped because they were busy or already fixed by someone else. */
    int skipped;
}
