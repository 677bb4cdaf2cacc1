package org.nowstart.orderflow.data.property;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "orderflow.engine")
public record OrderEngineProperties(
        // 동시에 처리하는 주문 수(워커 슬롯)
        @Positive @DefaultValue("10") int workerConcurrency,
        // 분당 허용되는 주문 처리 시도 수
        @Positive @DefaultValue("100") int rateLimitPerMinute,
        // 주문당 최대 처리 시도 횟수
        @Positive @DefaultValue("3") int maxAttempts,
        // 재시도 지수 백오프 시작 간격
        @NotNull @DefaultValue("2s") Duration backoffBase,
        // 재시도 백오프 상한
        @NotNull @DefaultValue("8s") Duration backoffMax,
        // 트랜잭션 빌드 시뮬레이션 지연
        @NotNull @DefaultValue("500ms") Duration buildDelay,
        // Redis 주문 스냅샷 TTL
        @NotNull @DefaultValue("24h") Duration snapshotTtl,
        // 기동 시 orders:active 주문 재등록 여부
        @DefaultValue("true") boolean recoverActiveOrders
) {
}
