package com.example.brite.controller;

import com.example.brite.domain.Device;
import com.example.brite.dto.DeviceRegisterRequest;
import com.example.brite.dto.ShoppingListRequest;
import com.example.brite.service.DeviceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 모바일 기기 / 장보기 목록 REST API
 */
@Tag(name = "기기", description = "모바일 기기 등록과 장보기 목록 동기화 API")
@RestController
@RequestMapping("/devices")
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceService deviceService;

    @Operation(summary = "기기 등록", description = "같은 device_id로 다시 등록하면 platform/push_token만 갱신됩니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "등록 성공"),
            @ApiResponse(responseCode = "400", description = "device_id 누락")
    })
    @PostMapping
    public ResponseEntity<Map<String, Object>> register(@RequestBody(required = false) DeviceRegisterRequest request) {
        Device device = deviceService.register(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("device_id", device.getDeviceId());
        body.put("platform", device.getPlatform());
        body.put("created_at", device.getCreatedAt());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "장보기 목록 조회", description = "등록되지 않은 기기는 빈 목록을 반환합니다.")
    @GetMapping("/{deviceId}/shopping-list")
    public ResponseEntity<Map<String, Object>> getShoppingList(@PathVariable String deviceId) {
        return ResponseEntity.ok(Map.of("shopping_list", deviceService.getShoppingList(deviceId)));
    }

    @Operation(summary = "장보기 목록 동기화", description = "기기의 장보기 목록을 요청 배열로 덮어씁니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "동기화 성공"),
            @ApiResponse(responseCode = "400", description = "shopping_list가 배열이 아님")
    })
    @PutMapping("/{deviceId}/shopping-list")
    public ResponseEntity<Map<String, Object>> syncShoppingList(@PathVariable String deviceId,
                                                                @RequestBody(required = false) ShoppingListRequest request) {
        int count = deviceService.syncShoppingList(deviceId, request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Shopping list synced");
        body.put("count", count);
        return ResponseEntity.ok(body);
    }
}
