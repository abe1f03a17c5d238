package io.eventasaurus.ticketing.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Ticketing Checkout API")
                .description("티켓 주문 생성 / 결제 웹훅 / 결제 상태 동기화 API")
                .version("1.0.0"));
    }
}
