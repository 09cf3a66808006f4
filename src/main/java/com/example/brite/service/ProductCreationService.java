package com.example.brite.service;

import com.example.brite.constants.ApiMessages;
import com.example.brite.domain.Price;
import com.example.brite.domain.Product;
import com.example.brite.domain.Store;
import com.example.brite.dto.ProductCreateRequest;
import com.example.brite.dto.ProductCreationResult;
import com.example.brite.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * 상품 등록 처리 서비스
 * <p>
 * 매장 확정 → 상품 확정 → 가격 반영 순서로 진행합니다.
 * 단계 사이에 트랜잭션이 없으므로 뒤 단계가 실패해도 앞에서 만든 매장/상품은 남습니다.
 * 같은 요청을 다시 보내면 같은 매장/상품으로 수렴하고 가격 행만 갱신됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductCreationService {

    /**
     * 처리 단계
     */
    public enum State {
        RECEIVED_REQUEST,
        STORE_RESOLVED,
        PRODUCT_RESOLVED,
        PRICE_UPSERTED,
        DONE,
        FAILED
    }

    private final StoreService storeService;
    private final ProductService productService;
    private final PriceService priceService;

    /**
     * 상품 등록 요청 처리
     *
     * @param request 상품 데이터, 매장 후보, 가격
     * @return 확정된 매장, 상품, 가격
     * @throws ValidationException 필수 값 누락 (쓰기 전에 검증)
     */
    public ProductCreationResult createProduct(ProductCreateRequest request) {
        State state = State.RECEIVED_REQUEST;
        String productName = request != null && request.getProductData() != null
                ? request.getProductData().getName() : null;
        log.info("상품 등록 요청: state={}, productName={}", state, productName);

        try {
            BigDecimal amount = validate(request);
            String currency = priceService.normalizeCurrency(request.getCurrency());

            Store store = storeService.resolveOrCreateStore(request.getStoreInfo());
            state = transition(state, State.STORE_RESOLVED, "storeId=" + store.getId());

            Product product = productService.resolveOrCreateProduct(request.getProductData());
            state = transition(state, State.PRODUCT_RESOLVED, "productId=" + product.getId());

            Price price = priceService.upsertPrice(product.getId(), store.getId(), amount, currency);
            state = transition(state, State.PRICE_UPSERTED, "priceId=" + price.getId());

            transition(state, State.DONE, "productName=" + productName);
            return ProductCreationResult.builder()
                    .store(store)
                    .product(product)
                    .price(price)
                    .build();
        } catch (RuntimeException e) {
            log.warn("상품 등록 실패: state={} -> {}, productName={}, error={}",
                    state, State.FAILED, productName, e.getMessage());
            throw e;
        }
    }

    private BigDecimal validate(ProductCreateRequest request) {
        if (request == null || request.getProductData() == null
                || request.getProductData().getName() == null
                || request.getProductData().getName().isBlank()) {
            throw new ValidationException(ApiMessages.PRODUCT_NAME_REQUIRED);
        }
        if (request.getStoreInfo() == null) {
            throw new ValidationException(ApiMessages.STORE_INFO_REQUIRED);
        }
        String placeId = request.getStoreInfo().getPlaceId();
        if (placeId == null || placeId.isBlank()) {
            throw new ValidationException(ApiMessages.STORE_PLACE_ID_REQUIRED);
        }
        BigDecimal amount = PriceService.parseAmount(request.getPrice());

        // 매장/상품 쓰기 전에 길이 제한까지 모두 검증
        productService.validateProductData(request.getProductData());
        storeService.validateCandidate(request.getStoreInfo());
        return amount;
    }

    private State transition(State from, State to, String detail) {
        log.debug("상품 등록 단계 전환: {} -> {} ({})", from, to, detail);
        return to;
    }
}
