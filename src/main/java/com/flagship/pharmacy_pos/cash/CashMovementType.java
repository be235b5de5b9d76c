package com.flagship.pharmacy_pos.cash;

/**
 * Cash-affecting events. Sales and refunds are written by the checkout subsystem.
 */
public enum CashMovementType {
    OPEN_FLOAT,
    CLOSE_COUNT,
    WITHDRAWAL,
    SALE,
    REFUND
}
