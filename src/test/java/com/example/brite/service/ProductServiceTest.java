package com.example.brite.service;

import com.example.brite.domain.Product;
import com.example.brite.domain.Store;
import com.example.brite.dto.PlaceCandidate;
import com.example.brite.dto.ProductData;
import com.example.brite.exception.NotFoundException;
import com.example.brite.exception.ValidationException;
import com.example.brite.repository.ProductRepository;
import com.example.brite.support.DatabaseCleaner;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class ProductServiceTest {

    @Autowired
    private ProductService productService;

    @Autowired
    private StoreService storeService;

    @Autowired
    private PriceService priceService;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private DatabaseCleaner databaseCleaner;

    @AfterEach
    void tearDown() {
        databaseCleaner.clean();
    }

    @Test
    void resolveOrCreateProduct_ShouldReturnExistingProductForSameName() {
        Product first = productService.resolveOrCreateProduct(data("Grace Kidney Beans", "first"));
        Product second = productService.resolveOrCreateProduct(data("Grace Kidney Beans", "second"));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(productRepository.count()).isEqualTo(1);
        assertThat(productRepository.findById(first.getId()).orElseThrow().getDescription()).isEqualTo("first");
        assertThat(first.getEstimatedPrice()).isNull();
    }

    @Test
    void resolveOrCreateProduct_ShouldMatchNamesCaseSensitively() {
        Product upper = productService.resolveOrCreateProduct(data("Grace Kidney Beans", null));
        Product lower = productService.resolveOrCreateProduct(data("grace kidney beans", null));

        assertThat(lower.getId()).isNotEqualTo(upper.getId());
        assertThat(productRepository.count()).isEqualTo(2);
    }

    @Test
    void resolveOrCreateProduct_ShouldFallBackToMatchKey() {
        ProductData original = data("Grace Kidney Beans 400g", null);
        original.setMatchKey("grace-kidney-beans-400g");
        Product first = productService.resolveOrCreateProduct(original);

        ProductData otherSource = data("GRACE Red Kidney Beans (400 g)", null);
        otherSource.setMatchKey("grace-kidney-beans-400g");
        Product matched = productService.resolveOrCreateProduct(otherSource);

        assertThat(matched.getId()).isEqualTo(first.getId());
        assertThat(productRepository.count()).isEqualTo(1);
    }

    @Test
    void resolveOrCreateProduct_ShouldConvergeUnderConcurrentCreation() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Product>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String description = "submission " + i;
                Callable<Product> task = () -> {
                    start.await();
                    return productService.resolveOrCreateProduct(data("Lasco Food Drink", description));
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            Long expectedId = null;
            for (Future<Product> future : futures) {
                Product product = future.get(30, TimeUnit.SECONDS);
                if (expectedId == null) {
                    expectedId = product.getId();
                }
                assertThat(product.getId()).isEqualTo(expectedId);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(productRepository.count()).isEqualTo(1);
        assertThat(productRepository.findByName("Lasco Food Drink")).isPresent();
    }

    @Test
    void resolveOrCreateProduct_ShouldRejectOversizedFields() {
        ProductData longCategory = data("Grace Kidney Beans", null);
        longCategory.setCategory("c".repeat(256));

        assertThatThrownBy(() -> productService.resolveOrCreateProduct(longCategory))
                .isInstanceOf(ValidationException.class)
                .hasMessage("product_data.category must be at most 255 characters");
        assertThat(productRepository.count()).isZero();
    }

    @Test
    void resolveOrCreateProduct_ShouldRejectMissingName() {
        assertThatThrownBy(() -> productService.resolveOrCreateProduct(null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Product data with name is required");
        assertThatThrownBy(() -> productService.resolveOrCreateProduct(data("", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Product data with name is required");
    }

    @Test
    void recomputeEstimatedPrice_ShouldStoreRoundedMean() {
        Product product = productService.resolveOrCreateProduct(data("Lasco Food Drink", null));
        Store s1 = storeService.resolveOrCreateStore(store("P1"));
        Store s2 = storeService.resolveOrCreateStore(store("P2"));
        Store s3 = storeService.resolveOrCreateStore(store("P3"));

        priceService.upsertPrice(product.getId(), s1.getId(), new BigDecimal("100"), null);
        priceService.upsertPrice(product.getId(), s2.getId(), new BigDecimal("100"), null);
        priceService.upsertPrice(product.getId(), s3.getId(), new BigDecimal("101"), null);

        BigDecimal again = productService.recomputeEstimatedPrice(product.getId());

        assertThat(again).isEqualByComparingTo("100.33");
        assertThat(productService.getProduct(product.getId()).getEstimatedPrice()).isEqualByComparingTo("100.33");
    }

    @Test
    void recomputeEstimatedPrice_ShouldBeNullWithoutPrices() {
        Product product = productService.resolveOrCreateProduct(data("Excelsior Crackers", null));

        assertThat(productService.recomputeEstimatedPrice(product.getId())).isNull();
        assertThat(productService.getProduct(product.getId()).getEstimatedPrice()).isNull();
        assertThatThrownBy(() -> productService.recomputeEstimatedPrice(-1L))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void listProducts_ShouldFilterByNameIgnoringCase() {
        productService.resolveOrCreateProduct(data("Grace Kidney Beans", null));
        productService.resolveOrCreateProduct(data("Grace Baked Beans", null));
        productService.resolveOrCreateProduct(data("Lasco Food Drink", null));

        List<Product> beans = productService.listProducts("BEANS", null);
        List<Product> all = productService.listProducts(null, null);
        List<Product> limited = productService.listProducts(null, 2);

        assertThat(beans).extracting(Product::getName)
                .containsExactly("Grace Baked Beans", "Grace Kidney Beans");
        assertThat(all).hasSize(3);
        assertThat(limited).hasSize(2);
    }

    @Test
    void getCategories_ShouldReturnDistinctSortedValues() {
        ProductData beans = data("Grace Kidney Beans", null);
        beans.setCategory("Canned Goods");
        ProductData drink = data("Lasco Food Drink", null);
        drink.setCategory("Beverages");
        ProductData peas = data("Grace Gungo Peas", null);
        peas.setCategory("Canned Goods");
        productService.resolveOrCreateProduct(beans);
        productService.resolveOrCreateProduct(drink);
        productService.resolveOrCreateProduct(peas);
        productService.resolveOrCreateProduct(data("Uncategorised", null));

        assertThat(productService.getCategories()).containsExactly("Beverages", "Canned Goods");
    }

    private ProductData data(String name, String description) {
        return ProductData.builder().name(name).description(description).build();
    }

    private PlaceCandidate store(String placeId) {
        return PlaceCandidate.builder().placeId(placeId).name("Store " + placeId).build();
    }
}
