package com.example.brite.google.constants;

/**
 * Google Maps API 상수 클래스
 */
public final class GoogleMapsApiConstants {

    private GoogleMapsApiConstants() {
        // 인스턴스화 방지
    }

    // ========== 경로 (Path) ==========

    public static final String TEXT_SEARCH_PATH = "/maps/api/place/textsearch/json";
    public static final String GEOCODE_PATH = "/maps/api/geocode/json";

    // ========== 응답 상태값 (Status) ==========

    /**
     * Places / Geocoding 공통 응답 status 값
     */
    public static final class Status {
        public static final String OK = "OK";
        public static final String ZERO_RESULTS = "ZERO_RESULTS"; // 검색 결과 없음 (오류 아님)
        public static final String INVALID_REQUEST = "INVALID_REQUEST"; // 필수 파라미터 누락 등
        public static final String REQUEST_DENIED = "REQUEST_DENIED"; // API 키 오류
        public static final String OVER_QUERY_LIMIT = "OVER_QUERY_LIMIT"; // 할당량 초과
        public static final String UNKNOWN_ERROR = "UNKNOWN_ERROR"; // 서버 오류 (재시도 가능)

        private Status() {}
    }

    // ========== 응답 필드 (Field) ==========

    public static final class Field {
        public static final String STATUS = "status";
        public static final String ERROR_MESSAGE = "error_message";
        public static final String RESULTS = "results";
        public static final String NAME = "name";
        public static final String PLACE_ID = "place_id";
        public static final String FORMATTED_ADDRESS = "formatted_address";
        public static final String GEOMETRY = "geometry";
        public static final String LOCATION = "location";
        public static final String LAT = "lat";
        public static final String LNG = "lng";

        private Field() {}
    }

    /**
     * 주소가 없는 장소에 표시할 문구
     */
    public static final String ADDRESS_NOT_AVAILABLE = "Address not available";
}
