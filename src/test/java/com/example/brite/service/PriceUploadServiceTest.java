package com.example.brite.service;

import com.example.brite.domain.Product;
import com.example.brite.domain.Store;
import com.example.brite.dto.PriceUploadResult;
import com.example.brite.dto.ProductCreateRequest;
import com.example.brite.dto.ProductCreationResult;
import com.example.brite.exception.ValidationException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PriceUploadServiceTest {

    @Mock
    private ProductCreationService productCreationService;

    private PriceUploadService priceUploadService;

    @BeforeEach
    void setUp() {
        priceUploadService = new PriceUploadService(new ExcelService(), new ExcelToProductConverter(), productCreationService);
    }

    @Test
    void processRows_ShouldContinueAfterFailedRow() {
        when(productCreationService.createProduct(any()))
                .thenReturn(result(1L, 10L))
                .thenThrow(new ValidationException("Store place_id is required"))
                .thenThrow(new IllegalStateException("connection reset"));

        PriceUploadResult result = priceUploadService.processRows(List.of(
                row(2, "Grace Kidney Beans", "P1", 250L),
                row(3, "Lasco Food Drink", null, 180L),
                row(4, "Excelsior Crackers", "P2", 120L)));

        assertThat(result.getTotalCount()).isEqualTo(3);
        assertThat(result.getSuccessCount()).isEqualTo(1);
        assertThat(result.getFailureCount()).isEqualTo(2);
        assertThat(result.getSuccessItems().get(0).getProductId()).isEqualTo(1L);
        assertThat(result.getSuccessItems().get(0).getStoreId()).isEqualTo(10L);

        PriceUploadResult.FailureItem validation = result.getFailureItems().get(0);
        assertThat(validation.getRowNumber()).isEqualTo(3);
        assertThat(validation.getProductName()).isEqualTo("Lasco Food Drink");
        assertThat(validation.getErrorType()).isEqualTo(PriceUploadService.ERROR_TYPE_VALIDATION);

        PriceUploadResult.FailureItem internal = result.getFailureItems().get(1);
        assertThat(internal.getErrorType()).isEqualTo(PriceUploadService.ERROR_TYPE_INTERNAL);
        assertThat(internal.getErrorMessage()).isEqualTo("An internal server error occurred");

        verify(productCreationService, times(3)).createProduct(any());
    }

    @Test
    void processRows_ShouldConvertSpreadsheetValues() {
        when(productCreationService.createProduct(any())).thenReturn(result(1L, 10L));
        Map<String, Object> row = row(2, "Grace Kidney Beans", "P1", null);
        row.put("price", "1,250.50");
        row.put("latitude", 18.01);
        row.put("online", "yes");

        priceUploadService.processRows(List.of(row));

        ArgumentCaptor<ProductCreateRequest> captor = ArgumentCaptor.forClass(ProductCreateRequest.class);
        verify(productCreationService).createProduct(captor.capture());
        ProductCreateRequest request = captor.getValue();
        assertThat((BigDecimal) request.getPrice()).isEqualByComparingTo("1250.50");
        assertThat(request.getStoreInfo().getName()).isEqualTo("Store P1");
        assertThat(request.getStoreInfo().getLatitude()).isEqualTo(18.01);
        assertThat(request.getStoreInfo().getOnline()).isTrue();
    }

    @Test
    void uploadPrices_ShouldRejectBadFiles() {
        MockMultipartFile empty = new MockMultipartFile("file", "prices.xlsx", null, new byte[0]);
        MockMultipartFile csv = new MockMultipartFile("file", "prices.csv", "text/csv", "a,b".getBytes());
        MockMultipartFile corrupt = new MockMultipartFile("file", "prices.xlsx", null, "not excel".getBytes());

        assertThatThrownBy(() -> priceUploadService.uploadPrices(empty))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Uploaded file is empty");
        assertThatThrownBy(() -> priceUploadService.uploadPrices(csv))
                .hasMessage("Only .xlsx spreadsheets are supported");
        assertThatThrownBy(() -> priceUploadService.uploadPrices(corrupt))
                .hasMessage("Spreadsheet could not be read");
        verifyNoInteractions(productCreationService);
    }

    private Map<String, Object> row(int rowNumber, String name, String placeId, Long price) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("_rowNumber", rowNumber);
        row.put("product_name", name);
        row.put("place_id", placeId);
        row.put("store", placeId != null ? "Store " + placeId : null);
        row.put("price", price);
        return row;
    }

    private ProductCreationResult result(Long productId, Long storeId) {
        return ProductCreationResult.builder()
                .product(Product.builder().id(productId).build())
                .store(Store.builder().id(storeId).build())
                .build();
    }
}
