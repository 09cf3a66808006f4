package com.example.brite.dto;

import com.example.brite.domain.Product;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 바코드 조회 응답 DTO
 * prices에는 노출 중인 매장의 가격만 포함됩니다.
 */
@Getter
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BarcodeLookupResult {

    private final boolean found;
    private final String barcode;
    private final Product product;
    private final List<PriceView> prices;

    public static BarcodeLookupResult notFound() {
        return BarcodeLookupResult.builder().found(false).build();
    }
}
