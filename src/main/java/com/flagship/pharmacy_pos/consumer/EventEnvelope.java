package com.flagship.pharmacy_pos.consumer;

import java.util.UUID;

/**
 * The routing fields every session event carries, read before the payload
 * is bound to its concrete type.
 */
record EventEnvelope(UUID eventId, UUID terminalId, String eventType) {
}
