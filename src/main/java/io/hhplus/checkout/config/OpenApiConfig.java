package io.hhplus.checkout.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.IntegerSchema;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Checkout API")
                .description("장바구니 → 주문 → 결제 체크아웃 코어 API 문서")
                .version("1.0.0"))
            .components(new Components()
                .addParameters("X-User-Id", new Parameter()
                    .in("header")
                    .name("X-User-Id")
                    .description("인증된 사용자 ID")
                    .required(true)
                    .schema(new IntegerSchema().format("int64")))
                .addParameters("Stripe-Signature", new Parameter()
                    .in("header")
                    .name("Stripe-Signature")
                    .description("웹훅 서명 (t=<unix seconds>,v1=<hex hmac-sha256>)")
                    .required(true)
                    .schema(new StringSchema())));
    }
}
