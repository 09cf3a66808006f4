package com.example.brite.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 바코드 → 상품 매핑 엔티티 (사용자 스캔으로 수집)
 */
@Entity
@Table(name = "barcode_mappings", uniqueConstraints = {
        @UniqueConstraint(name = "uk_barcode_mappings_barcode", columnNames = "barcode")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BarcodeMapping {

    public static final String SOURCE_USER_SCAN = "user_scan";
    public static final int BARCODE_MAX_LENGTH = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = BARCODE_MAX_LENGTH)
    private String barcode;

    @Column(nullable = false)
    private Long productId;

    private String productName; // 매핑 시점의 상품명

    private String source;

    private LocalDateTime createdAt;
}
