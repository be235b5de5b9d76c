package com.flagship.pharmacy_pos.pricing;

import java.util.Optional;
import java.util.UUID;

public interface ProductRepository {

    Optional<Product> findById(UUID id);

    int applyPriceUpdate(UUID productId, ProductPriceUpdate update);

    /**
     * Copies the new price (and cost, when present) onto every inventory batch of the product.
     *
     * @return batches updated
     */
    int propagateToBatches(UUID productId, ProductPriceUpdate update);
}
