package com.example.brite.dto;

import com.example.brite.domain.Price;
import com.example.brite.domain.Product;
import com.example.brite.domain.Store;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 상품 등록 처리 결과
 */
@Getter
@AllArgsConstructor
@Builder
public class ProductCreationResult {

    private final Store store;
    private final Product product;
    private final Price price;
}
