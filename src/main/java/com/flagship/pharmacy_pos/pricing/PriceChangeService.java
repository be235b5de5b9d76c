package com.flagship.pharmacy_pos.pricing;

import com.flagship.pharmacy_pos.config.PosProperties;
import com.flagship.pharmacy_pos.exception.PosException;
import com.flagship.pharmacy_pos.exception.ResourceBusyException;
import com.flagship.pharmacy_pos.exception.SerializationConflictException;
import com.flagship.pharmacy_pos.exception.StoreErrorTranslator;
import com.flagship.pharmacy_pos.exception.ValidationException;
import com.flagship.pharmacy_pos.observability.PosMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Entry point for supervised price changes.
 *
 * Each attempt runs in its own SERIALIZABLE transaction inside
 * {@link PriceChangeProcessor}; busy rows and serialization conflicts are
 * retried here with backoff before surfacing to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceChangeService {

    private final PriceChangeProcessor processor;
    private final StoreErrorTranslator errorTranslator;
    private final PosProperties properties;
    private final PosMetrics metrics;

    @Retryable(
            retryFor = {ResourceBusyException.class, SerializationConflictException.class},
            maxAttemptsExpression = "${pos.retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${pos.retry.delay-ms:200}",
                    multiplierExpression = "${pos.retry.multiplier:2}",
                    maxDelayExpression = "${pos.retry.max-delay-ms:5000}"))
    public PriceChangeResult changePrice(PriceChangeCommand command) {
        validate(command);

        long startTime = System.currentTimeMillis();
        try {
            PriceChangeResult result = processor.apply(command);
            metrics.recordLatency("price_change", System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            PosException translated = errorTranslator.translate(e);
            metrics.recordRejected("price_change", translated.getKind());
            log.warn("Price change rejected: productId={}, kind={}, reason={}",
                    command.getProductId(), translated.getKind(), translated.getMessage());
            throw translated;
        }
    }

    private void validate(PriceChangeCommand command) {
        if (command.getProductId() == null) {
            throw new ValidationException("productId is required");
        }
        if (command.getActorId() == null) {
            throw new ValidationException("actorId is required");
        }
        if (command.getNewPrice() == null || command.getNewPrice().signum() < 0) {
            throw new ValidationException("newPrice must be zero or more");
        }
        if (command.getNewCostPrice() != null && command.getNewCostPrice().signum() < 0) {
            throw new ValidationException("newCostPrice must be zero or more");
        }
        int minReason = properties.getPricing().getMinReasonLength();
        if (command.getReason() == null || command.getReason().trim().length() < minReason) {
            throw new ValidationException("reason must be at least " + minReason + " characters");
        }
    }
}
