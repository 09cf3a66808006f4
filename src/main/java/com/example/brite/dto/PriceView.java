package com.example.brite.dto;

import com.example.brite.domain.Price;
import com.example.brite.domain.Store;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 가격 응답 DTO (매장 정보 포함)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PriceView {

    private Long id;
    private Long productId;
    private Long storeId;
    private BigDecimal amount;
    private String currency;
    private LocalDateTime lastUpdated;
    private Store store;

    public static PriceView from(Price price) {
        return PriceView.builder()
                .id(price.getId())
                .productId(price.getProduct().getId())
                .storeId(price.getStore().getId())
                .amount(price.getAmount())
                .currency(price.getCurrency())
                .lastUpdated(price.getLastUpdated())
                .store(price.getStore())
                .build();
    }
}
