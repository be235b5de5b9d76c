package com.flagship.pharmacy_pos.pricing;

import com.flagship.pharmacy_pos.audit.AuditAction;
import com.flagship.pharmacy_pos.audit.AuditEntityType;
import com.flagship.pharmacy_pos.audit.AuditEntry;
import com.flagship.pharmacy_pos.audit.AuditRecorder;
import com.flagship.pharmacy_pos.audit.Criticality;
import com.flagship.pharmacy_pos.auth.PinAuthorizer;
import com.flagship.pharmacy_pos.auth.Principal;
import com.flagship.pharmacy_pos.auth.PrincipalRepository;
import com.flagship.pharmacy_pos.auth.Role;
import com.flagship.pharmacy_pos.config.PosProperties;
import com.flagship.pharmacy_pos.exception.ResourceNotFoundException;
import com.flagship.pharmacy_pos.exception.UnauthorizedException;
import com.flagship.pharmacy_pos.locking.LockableResource;
import com.flagship.pharmacy_pos.locking.ResourceLockCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies a product price change in one serializable unit of work. Large
 * changes need a manager's PIN; the audit record is mandatory either way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceChangeProcessor {

    private final ProductRepository productRepository;
    private final PrincipalRepository principalRepository;
    private final ResourceLockCoordinator lockCoordinator;
    private final PinAuthorizer pinAuthorizer;
    private final AuditRecorder auditRecorder;
    private final PosProperties properties;

    @Transactional(isolation = Isolation.SERIALIZABLE)
    public PriceChangeResult apply(PriceChangeCommand command) {
        Principal actor = principalRepository.findById(command.getActorId())
                .orElseThrow(() -> new ResourceNotFoundException("User", command.getActorId()));

        lockCoordinator.lockOrThrow(LockableResource.PRODUCT, command.getProductId());
        Product product = productRepository.findById(command.getProductId())
                .orElseThrow(() -> new ResourceNotFoundException("Product", command.getProductId()));

        BigDecimal ratio = changeRatio(product.getPrice(), command.getNewPrice());
        Principal approver = null;
        if (ratio.compareTo(properties.getPricing().getApprovalThreshold()) > 0) {
            if (command.getManagerPin() == null || command.getManagerPin().isBlank()) {
                throw new UnauthorizedException("Price change of " + percent(ratio)
                        + " exceeds the approval threshold: approval required");
            }
            approver = pinAuthorizer.authorize(command.getManagerPin(), Role.SUPERVISOR_ROLES);
        }

        ProductPriceUpdate update = ProductPriceUpdate.builder()
                .price(command.getNewPrice())
                .costPrice(Optional.ofNullable(command.getNewCostPrice()))
                .build();
        productRepository.applyPriceUpdate(product.getId(), update);
        int batches = productRepository.propagateToBatches(product.getId(), update);

        Map<String, Object> oldValues = new LinkedHashMap<>();
        oldValues.put("price", product.getPrice());
        oldValues.put("cost_price", product.getCostPrice());

        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("price", command.getNewPrice());
        newValues.put("cost_price", command.getNewCostPrice());
        newValues.put("change_percent", percent(ratio));
        newValues.put("batches_updated", batches);

        auditRecorder.record(AuditEntry.builder()
                .actorId(actor.getId())
                .actorName(actor.getName())
                .actorRole(actor.getRole().name())
                .action(AuditAction.PRICE_CHANGE)
                .entityType(AuditEntityType.PRODUCT)
                .entityId(product.getId().toString())
                .oldValues(oldValues)
                .newValues(newValues)
                .justification(command.getReason())
                .authorizedBy(approver != null ? approver.getId() : null)
                .build(), Criticality.MANDATORY);

        log.info("Price changed: product={}, {} -> {}, change={}, approvedBy={}, batches={}",
                product.getSku(), product.getPrice(), command.getNewPrice(), percent(ratio),
                approver != null ? approver.getId() : null, batches);

        return new PriceChangeResult(product.getId(), product.getPrice(), command.getNewPrice(), ratio,
                approver != null ? approver.getId() : null, batches);
    }

    /**
     * A change from a zero price counts as a 100% change.
     */
    static BigDecimal changeRatio(BigDecimal oldPrice, BigDecimal newPrice) {
        if (oldPrice == null || oldPrice.signum() == 0) {
            return BigDecimal.ONE;
        }
        return newPrice.subtract(oldPrice).abs().divide(oldPrice, 6, RoundingMode.HALF_UP);
    }

    static String percent(BigDecimal ratio) {
        return ratio.multiply(BigDecimal.valueOf(100)).setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
