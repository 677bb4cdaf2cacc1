package org.nowstart.orderflow.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.nowstart.orderflow.data.dto.HealthDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health", description = "헬스 체크 API")
public class HealthController {

    @GetMapping("/health")
    @Operation(summary = "헬스 체크", description = "서버 기동 여부를 확인합니다.")
    public HealthDto health() {
        return new HealthDto("ok", System.currentTimeMillis());
    }
}
