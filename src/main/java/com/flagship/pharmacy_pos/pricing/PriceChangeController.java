package com.flagship.pharmacy_pos.pricing;

import com.flagship.pharmacy_pos.pricing.dto.PriceChangeRequest;
import com.flagship.pharmacy_pos.pricing.dto.PriceChangeResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
@Slf4j
public class PriceChangeController {

    private final PriceChangeService priceChangeService;

    @PostMapping("/{productId}/price")
    public ResponseEntity<PriceChangeResponse> changePrice(
            @PathVariable("productId") UUID productId,
            @Valid @RequestBody PriceChangeRequest request) {

        log.info("Price change requested: productId={}, userId={}, newPrice={}",
                productId, request.getUserId(), request.getNewPrice());

        PriceChangeResult result = priceChangeService.changePrice(PriceChangeCommand.builder()
                .productId(productId)
                .actorId(request.getUserId())
                .newPrice(request.getNewPrice())
                .newCostPrice(request.getNewCostPrice())
                .reason(request.getReason())
                .managerPin(request.getManagerPin())
                .build());

        return ResponseEntity.ok(PriceChangeResponse.from(result));
    }
}
