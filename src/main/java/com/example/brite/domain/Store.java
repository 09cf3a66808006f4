package com.example.brite.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 매장 엔티티
 * 외부 장소 ID(Google place_id)로 식별되며, 한 place_id 당 매장은 하나만 존재합니다.
 */
@Entity
@Table(name = "stores", uniqueConstraints = {
        @UniqueConstraint(name = "uk_stores_place_id", columnNames = "place_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Store {

    public static final int PLACE_ID_MAX_LENGTH = 255;
    public static final int NAME_MAX_LENGTH = 255;
    public static final int ADDRESS_MAX_LENGTH = 500;
    public static final int LINK_MAX_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "place_id", nullable = false, updatable = false, length = PLACE_ID_MAX_LENGTH)
    private String placeId; // Google place_id 또는 온라인 매장용 합성 ID

    @Column(nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(length = ADDRESS_MAX_LENGTH)
    private String address;

    private Double latitude;

    private Double longitude;

    @Column(length = LINK_MAX_LENGTH)
    private String link; // 매장 웹사이트

    private boolean online; // 온라인 전용 매장 여부

    @Builder.Default
    private boolean visible = true; // false면 가격 목록에서 숨김

    private LocalDateTime createdAt;

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
