package com.example.brite.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger/OpenAPI 설정
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Brite Shopping API")
                        .description("상품/매장/가격 데이터를 관리하고 Google Maps로 매장을 검색하는 API")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Brite Shopping")
                                .email("support@example.com")));
    }
}
