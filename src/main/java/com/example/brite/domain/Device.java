package com.example.brite.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 모바일 기기 엔티티
 * device_id 당 한 행이며, 앱의 장보기 목록을 JSON 배열 그대로 보관합니다.
 */
@Entity
@Table(name = "devices", uniqueConstraints = {
        @UniqueConstraint(name = "uk_devices_device_id", columnNames = "device_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Device {

    public static final int DEVICE_ID_MAX_LENGTH = 128;
    public static final int PUSH_TOKEN_MAX_LENGTH = 512;

    public static final String PLATFORM_UNKNOWN = "unknown";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false, updatable = false, length = DEVICE_ID_MAX_LENGTH)
    private String deviceId;

    @Column(length = 16)
    private String platform; // ios, android, web, unknown

    @Column(length = PUSH_TOKEN_MAX_LENGTH)
    private String pushToken;

    @Lob
    @Column(name = "shopping_list")
    private String shoppingList; // JSON 배열

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
