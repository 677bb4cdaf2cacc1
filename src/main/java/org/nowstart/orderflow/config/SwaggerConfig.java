package org.nowstart.orderflow.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    static final String STATUS_STREAM_TAG = "Order Status Stream";

    private final BuildProperties buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        // springdoc does not scan WebSocket handlers, so the stream is described as a tag.
        return new OpenAPI()
                .info(new Info()
                        .title("orderflow API")
                        .description("주문 실행 엔진(orderflow)의 API 문서입니다.")
                        .version(buildProperties.getVersion()))
                .addTagsItem(new Tag()
                        .name(STATUS_STREAM_TAG)
                        .description("WebSocket ws://{host}/api/orders/{orderId}/status 로 주문 상태"
                                + "(pending, routing, building, submitted, confirmed, failed)를 구독합니다."));
    }
}
