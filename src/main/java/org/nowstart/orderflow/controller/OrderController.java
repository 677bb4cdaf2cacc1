package org.nowstart.orderflow.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.orderflow.data.dto.OrderSnapshot;
import org.nowstart.orderflow.data.dto.OrderSubmissionRequest;
import org.nowstart.orderflow.data.dto.OrderSubmissionResponse;
import org.nowstart.orderflow.service.OrderSubmissionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "주문 접수 및 주문 상태 조회 API")
public class OrderController {

    private final OrderSubmissionService orderSubmissionService;

    public OrderController(OrderSubmissionService orderSubmissionService) {
        this.orderSubmissionService = orderSubmissionService;
    }

    @PostMapping("/execute")
    @Operation(summary = "주문 접수", description = "시장가 주문을 접수하고 비동기 실행 큐에 등록합니다. 진행 상태는 WebSocket으로 전달됩니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "접수 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "422", description = "지원하지 않는 주문 유형")
    })
    public ResponseEntity<OrderSubmissionResponse> execute(@RequestBody @Valid OrderSubmissionRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(orderSubmissionService.submit(request));
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "주문 조회", description = "orderId로 주문 스냅샷을 조회합니다. 진행 중인 주문은 Redis, 완료된 주문은 DB에서 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "주문 없음")
    })
    public OrderSnapshot getOrder(@PathVariable String orderId) {
        return orderSubmissionService.getOrder(orderId);
    }
}
