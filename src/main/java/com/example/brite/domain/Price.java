package com.example.brite.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 가격 원장 엔티티
 * (상품, 매장) 쌍마다 한 행만 존재하며 재등록 시 금액/통화/시각을 덮어씁니다.
 */
@Entity
@Table(name = "prices", uniqueConstraints = {
        @UniqueConstraint(name = "uk_prices_product_store", columnNames = {"product_id", "store_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Price {

    public static final int AMOUNT_SCALE = 2;
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999.99");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "store_id", nullable = false)
    private Store store;

    @Column(nullable = false, precision = 12, scale = AMOUNT_SCALE)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false)
    private LocalDateTime lastUpdated;
}
