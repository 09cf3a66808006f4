package com.example.brite.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 상품 엔티티
 * 상품명은 카탈로그 전체에서 유일하며 먼저 등록된 상품이 유지됩니다.
 */
@Entity
@Table(name = "products",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_products_name", columnNames = "name")
        },
        indexes = {
                @Index(name = "idx_products_match_key", columnList = "match_key"),
                @Index(name = "idx_products_updated_at", columnList = "updated_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Product {

    public static final int NAME_MAX_LENGTH = 255;
    public static final int DESCRIPTION_MAX_LENGTH = 2000;
    public static final int URL_MAX_LENGTH = 1000;
    public static final int SHORT_TEXT_MAX_LENGTH = 255; // brand, size, category, match_key (기본 컬럼 길이)

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(length = DESCRIPTION_MAX_LENGTH)
    private String description;

    private String brand;

    private String size; // 용량/중량 (예: "400g", "1L")

    private String category;

    @Column(length = URL_MAX_LENGTH)
    private String imageUrl;

    @Column(length = URL_MAX_LENGTH)
    private String productUrl;

    @Column(name = "match_key")
    private String matchKey; // 데이터 소스 간 동일 상품 연결용 키 (정확히 일치할 때만)

    @Column(precision = 12, scale = 2)
    private BigDecimal estimatedPrice; // 가격 원장 평균 (파생 값)

    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
