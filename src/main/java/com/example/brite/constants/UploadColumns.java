package com.example.brite.constants;

import java.util.List;

/**
 * 가격 일괄 등록 엑셀 컬럼명 (헤더 행)
 */
public class UploadColumns {

    public static final String ROW_NUMBER = "_rowNumber";

    public static final String PRODUCT_NAME = "product_name";
    public static final String DESCRIPTION = "description";
    public static final String BRAND = "brand";
    public static final String SIZE = "size";
    public static final String CATEGORY = "category";
    public static final String MATCH_KEY = "match_key";
    public static final String PLACE_ID = "place_id";
    public static final String STORE = "store";
    public static final String ADDRESS = "address";
    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String ONLINE = "online";
    public static final String PRICE = "price";
    public static final String CURRENCY = "currency";

    /**
     * 템플릿 헤더 순서
     */
    public static final List<String> ALL = List.of(
            PRODUCT_NAME, DESCRIPTION, BRAND, SIZE, CATEGORY, MATCH_KEY,
            PLACE_ID, STORE, ADDRESS, LATITUDE, LONGITUDE, ONLINE,
            PRICE, CURRENCY
    );

    private UploadColumns() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
