package com.example.brite.constants;

/**
 * API 응답 메시지 상수 클래스
 * 클라이언트(모바일 앱, 카탈로그 빌더)가 문자열을 그대로 비교하므로 변경 시 주의해야 합니다.
 */
public class ApiMessages {

    /**
     * 상품 등록 요청 검증 메시지
     */
    public static final String PRODUCT_NAME_REQUIRED = "Product data with name is required";
    public static final String STORE_INFO_REQUIRED = "Store info is required";
    public static final String STORE_PLACE_ID_REQUIRED = "Store place_id is required";
    public static final String PRICE_REQUIRED = "Price is required and must be a number";

    /**
     * 개별 모델 검증 메시지
     */
    public static final String STORE_NAME_REQUIRED = "Store name is required";
    public static final String PRICE_MUST_BE_POSITIVE = "Price must be greater than zero";
    public static final String CURRENCY_INVALID = "Currency must be a three-letter code";
    public static final String PRODUCT_ID_REQUIRED = "product_id is required";
    public static final String VISIBLE_REQUIRED = "visible is required";
    public static final String PRICE_TOO_LARGE = "Price must be less than 10000000000";
    public static final String FIELD_TOO_LONG = "%s must be at most %d characters"; // String.format(필드명, 최대 길이)
    public static final String DEVICE_ID_REQUIRED = "device_id is required";
    public static final String SHOPPING_LIST_NOT_ARRAY = "shopping_list must be an array";

    /**
     * 매장 검색 메시지
     */
    public static final String SEARCH_QUERY_REQUIRED = "A 'name' or 'address' query parameter is required";
    public static final String SEARCH_QUERY_AMBIGUOUS = "Provide either a 'name' or an 'address' query parameter, not both";

    /**
     * 조회 실패 메시지
     */
    public static final String PRODUCT_NOT_FOUND = "Product not found";
    public static final String STORE_NOT_FOUND = "Store not found";
    public static final String PRICE_NOT_FOUND = "No price found for product";
    public static final String BARCODE_MAPPING_NOT_FOUND = "Barcode mapping not found";

    /**
     * 엑셀 일괄 등록 메시지
     */
    public static final String UPLOAD_FILE_EMPTY = "Uploaded file is empty";
    public static final String UPLOAD_FILE_TYPE_INVALID = "Only .xlsx spreadsheets are supported";
    public static final String UPLOAD_NO_DATA = "Spreadsheet has no data rows";
    public static final String UPLOAD_UNREADABLE = "Spreadsheet could not be read";

    /**
     * 공통 메시지
     */
    public static final String INTERNAL_ERROR = "An internal server error occurred";
    public static final String INVALID_API_KEY = "Missing or invalid API key";

    /**
     * Private constructor to prevent instantiation
     */
    private ApiMessages() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
