package com.example.brite.service;

import com.example.brite.constants.UploadColumns;
import com.example.brite.dto.PlaceCandidate;
import com.example.brite.dto.ProductCreateRequest;
import com.example.brite.dto.ProductData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 엑셀 행 → 상품 등록 요청 변환기
 * 값 검증은 하지 않으며, 등록 처리({@link ProductCreationService})가 담당합니다.
 */
@Slf4j
@Component
public class ExcelToProductConverter {

    public ProductCreateRequest convert(Map<String, Object> rowData) {
        ProductData productData = ProductData.builder()
                .name(getStringValue(rowData, UploadColumns.PRODUCT_NAME))
                .description(getStringValue(rowData, UploadColumns.DESCRIPTION))
                .brand(getStringValue(rowData, UploadColumns.BRAND))
                .size(getStringValue(rowData, UploadColumns.SIZE))
                .category(getStringValue(rowData, UploadColumns.CATEGORY))
                .matchKey(getStringValue(rowData, UploadColumns.MATCH_KEY))
                .build();

        PlaceCandidate storeInfo = null;
        String placeId = getStringValue(rowData, UploadColumns.PLACE_ID);
        String storeName = getStringValue(rowData, UploadColumns.STORE);
        if (placeId != null || storeName != null) {
            storeInfo = PlaceCandidate.builder()
                    .placeId(placeId)
                    .name(storeName)
                    .address(getStringValue(rowData, UploadColumns.ADDRESS))
                    .latitude(getDoubleValue(rowData, UploadColumns.LATITUDE))
                    .longitude(getDoubleValue(rowData, UploadColumns.LONGITUDE))
                    .online(getBooleanValue(rowData, UploadColumns.ONLINE))
                    .build();
        }

        return ProductCreateRequest.builder()
                .productData(productData)
                .storeInfo(storeInfo)
                .price(getPriceValue(rowData))
                .currency(getStringValue(rowData, UploadColumns.CURRENCY))
                .build();
    }

    private String getStringValue(Map<String, Object> rowData, String key) {
        Object value = rowData.get(key);
        if (value == null) {
            return null;
        }
        String str = value.toString().trim();
        return str.isEmpty() ? null : str;
    }

    private Double getDoubleValue(Map<String, Object> rowData, String key) {
        Object value = rowData.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("행 {}: {} 값을 숫자로 변환 실패: {}", rowData.get(UploadColumns.ROW_NUMBER), key, value);
            }
        }
        return null;
    }

    private Boolean getBooleanValue(Map<String, Object> rowData, String key) {
        Object value = rowData.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        if (value instanceof String) {
            String str = ((String) value).trim();
            return "true".equalsIgnoreCase(str) || "yes".equalsIgnoreCase(str) || "y".equalsIgnoreCase(str);
        }
        return null;
    }

    /**
     * 가격 셀 값
     * 텍스트 셀의 숫자("1,250")는 BigDecimal로 바꾸고, 숫자가 아니면 원래 값을 넘겨 등록 단계에서 거부되도록 함
     */
    private Object getPriceValue(Map<String, Object> rowData) {
        Object value = rowData.get(UploadColumns.PRICE);
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            String str = ((String) value).trim().replace(",", "");
            try {
                return new BigDecimal(str);
            } catch (NumberFormatException e) {
                log.warn("행 {}: 가격 값을 숫자로 변환 실패: {}", rowData.get(UploadColumns.ROW_NUMBER), value);
            }
        }
        return value;
    }
}
