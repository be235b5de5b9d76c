package com.flagship.pharmacy_pos.terminal;

public enum TerminalStatus {
    CLOSED,
    OPEN,
    DELETED
}
