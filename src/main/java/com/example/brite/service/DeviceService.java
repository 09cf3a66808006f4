package com.example.brite.service;

import com.example.brite.constants.ApiMessages;
import com.example.brite.domain.Device;
import com.example.brite.dto.DeviceRegisterRequest;
import com.example.brite.dto.ShoppingListRequest;
import com.example.brite.exception.ValidationException;
import com.example.brite.repository.DeviceRepository;
import com.example.brite.util.FieldLengthValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 모바일 기기 서비스
 * device_id 기준으로 기기 프로필과 장보기 목록을 등록/갱신합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceService {

    private static final Set<String> KNOWN_PLATFORMS = Set.of("ios", "android", "web");
    private static final String EMPTY_LIST = "[]";

    private final DeviceRepository deviceRepository;
    private final ObjectMapper objectMapper;

    /**
     * 기기 등록 또는 프로필 갱신 (장보기 목록은 유지)
     *
     * @throws ValidationException device_id 누락 또는 길이 초과
     */
    public Device register(DeviceRegisterRequest request) {
        String deviceId = request != null ? trimToNull(request.getDeviceId()) : null;
        validateDeviceId(deviceId);

        String platform = normalizePlatform(request.getPlatform());
        String pushToken = trimToNull(request.getPushToken());
        FieldLengthValidator.checkMaxLength("push_token", pushToken, Device.PUSH_TOKEN_MAX_LENGTH);

        Device saved = upsert(deviceId, device -> {
            device.setPlatform(platform);
            device.setPushToken(pushToken);
        });
        log.info("기기 등록: deviceId={}, platform={}", deviceId, platform);
        return saved;
    }

    /**
     * 장보기 목록 조회 (등록되지 않은 기기는 빈 목록)
     */
    @Transactional(readOnly = true)
    public List<Object> getShoppingList(String deviceId) {
        return deviceRepository.findByDeviceId(deviceId)
                .map(device -> readList(device.getShoppingList()))
                .orElse(Collections.emptyList());
    }

    /**
     * 장보기 목록 덮어쓰기 (기기가 없으면 생성)
     *
     * @return 저장된 항목 수
     * @throws ValidationException shopping_list가 배열이 아님
     */
    public int syncShoppingList(String deviceId, ShoppingListRequest request) {
        if (request == null || !(request.getShoppingList() instanceof List)) {
            throw new ValidationException(ApiMessages.SHOPPING_LIST_NOT_ARRAY);
        }
        validateDeviceId(deviceId);

        List<?> items = (List<?>) request.getShoppingList();
        String json = writeList(items);
        upsert(deviceId, device -> device.setShoppingList(json));
        log.info("장보기 목록 동기화: deviceId={}, 항목 {}건", deviceId, items.size());
        return items.size();
    }

    /**
     * device_id로 찾아 변경을 적용하고, 없으면 새로 생성
     * 동시 생성 경합에서 진 쪽은 먼저 저장된 행에 변경을 다시 적용합니다.
     */
    private Device upsert(String deviceId, Consumer<Device> changes) {
        Optional<Device> existing = deviceRepository.findByDeviceId(deviceId);
        Device device = existing.orElseGet(() -> Device.builder()
                .deviceId(deviceId)
                .platform(Device.PLATFORM_UNKNOWN)
                .shoppingList(EMPTY_LIST)
                .build());
        changes.accept(device);

        try {
            return deviceRepository.saveAndFlush(device);
        } catch (DataIntegrityViolationException e) {
            log.info("기기 동시 등록 감지, 기존 행 갱신: deviceId={}", deviceId);
            Device winner = deviceRepository.findByDeviceId(deviceId)
                    .orElseThrow(() -> e);
            changes.accept(winner);
            return deviceRepository.saveAndFlush(winner);
        }
    }

    private void validateDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new ValidationException(ApiMessages.DEVICE_ID_REQUIRED);
        }
        FieldLengthValidator.checkMaxLength("device_id", deviceId, Device.DEVICE_ID_MAX_LENGTH);
    }

    private String normalizePlatform(String platform) {
        String normalized = platform != null ? platform.trim().toLowerCase(Locale.ROOT) : "";
        return KNOWN_PLATFORMS.contains(normalized) ? normalized : Device.PLATFORM_UNKNOWN;
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private List<Object> readList(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("저장된 장보기 목록을 읽을 수 없습니다", e);
        }
    }

    private String writeList(List<?> items) {
        try {
            return objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("장보기 목록을 직렬화할 수 없습니다", e);
        }
    }
}
