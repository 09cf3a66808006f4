package com.example.brite.controller;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.brite.domain.BarcodeMapping;
import com.example.brite.domain.Product;
import com.example.brite.dto.BarcodeLookupResult;
import com.example.brite.exception.NotFoundException;
import com.example.brite.exception.ValidationException;
import com.example.brite.service.BarcodeService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class BarcodeControllerTests {

    private MockMvc mockMvc;

    @Mock
    private BarcodeService barcodeService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new BarcodeController(barcodeService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void lookupFound() throws Exception {
        when(barcodeService.lookup("123")).thenReturn(BarcodeLookupResult.builder()
                .found(true)
                .barcode("123")
                .product(Product.builder().id(5L).name("Grace Kidney Beans").build())
                .prices(List.of())
                .build());

        mockMvc.perform(get("/barcodes/123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.product.name").value("Grace Kidney Beans"));
    }

    @Test
    void lookupMissing() throws Exception {
        when(barcodeService.lookup("404")).thenReturn(BarcodeLookupResult.notFound());

        mockMvc.perform(get("/barcodes/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.found").value(false))
                .andExpect(jsonPath("$.product").doesNotExist());
    }

    @Test
    void linkCreatesMapping() throws Exception {
        when(barcodeService.link("123", "5")).thenReturn(
                BarcodeMapping.builder().barcode("123").productId(5L).build());

        mockMvc.perform(post("/barcodes/123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":\"5\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Barcode linked"))
                .andExpect(jsonPath("$.product_id").value(5));
    }

    @Test
    void linkRequiresProductId() throws Exception {
        when(barcodeService.link("123", null)).thenThrow(new ValidationException("product_id is required"));

        mockMvc.perform(post("/barcodes/123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("product_id is required"));
    }

    @Test
    void unlinkMissingMapping() throws Exception {
        doThrow(new NotFoundException("Barcode mapping not found"))
                .when(barcodeService).unlink("123");

        mockMvc.perform(delete("/barcodes/123"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Barcode mapping not found"));
    }
}
