package org.nowstart.orderflow.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "orderflow.venue")
public record VenueSimulationProperties(
        // 견적 조회 네트워크 지연
        @NotNull @DefaultValue("200ms") Duration quoteLatency,
        // 체결 시뮬레이션 최소 지연
        @NotNull @DefaultValue("2s") Duration executionDelayMin,
        // 체결 시뮬레이션 최대 지연
        @NotNull @DefaultValue("3s") Duration executionDelayMax,
        // 견적 대비 최대 슬리피지 비율(예: 0.005 = 0.5%)
        @DecimalMin("0") @DecimalMax("0.5") @DefaultValue("0.005") BigDecimal maxSlippage,
        // 체결 단계 일시 장애 주입 확률(0~1)
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0") double transientFailureRate
) {
}
