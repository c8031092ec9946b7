package org.nowstart.overlay.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.nowstart.overlay.data.dto.BacktestReport;
import org.nowstart.overlay.data.dto.BacktestRequest;
import org.nowstart.overlay.data.dto.ClosePositionRequest;
import org.nowstart.overlay.data.dto.OpenPositionRequest;
import org.nowstart.overlay.data.dto.PortfolioPerformance;
import org.nowstart.overlay.data.dto.PositionOpenResult;
import org.nowstart.overlay.data.dto.PositionUpdateResult;
import org.nowstart.overlay.data.dto.PositionView;
import org.nowstart.overlay.data.dto.TradeRecord;
import org.nowstart.overlay.data.dto.UpdatePositionRequest;
import org.nowstart.overlay.data.model.TransitionLogEntry;
import org.nowstart.overlay.service.RiskOverlayService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/risk")
@Tag(name = "Risk Overlay", description = "포지션 손절/익절 관리, 성과 조회, 멀티 레이어 백테스트 API")
public class RiskOverlayController {

    private final RiskOverlayService riskOverlayService;

    public RiskOverlayController(RiskOverlayService riskOverlayService) {
        this.riskOverlayService = riskOverlayService;
    }

    @PostMapping("/positions")
    @Operation(summary = "포지션 진입", description = "레짐을 판정하고 손절가와 3단계 익절 목표를 계산해 포지션을 등록합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "진입 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "409", description = "이미 보유 중인 종목")
    })
    public ResponseEntity<PositionOpenResult> openPosition(@RequestBody @Valid OpenPositionRequest request) {
        PositionOpenResult result = riskOverlayService.openPosition(
                request.symbol(),
                request.entryPrice(),
                request.market().toSnapshot(),
                request.positionSizePct(),
                request.trueRange()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PutMapping("/positions/{symbol}")
    @Operation(summary = "일별 업데이트", description = "일봉 고가/저가/종가로 손절, 익절, 레짐 재조정, 기간 청산을 우선순위대로 평가합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "평가 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패"),
            @ApiResponse(responseCode = "404", description = "보유 포지션 없음")
    })
    public PositionUpdateResult updatePosition(
            @PathVariable String symbol,
            @RequestBody @Valid UpdatePositionRequest request
    ) {
        return riskOverlayService.updatePosition(
                symbol,
                request.high(),
                request.low(),
                request.close(),
                request.market().toSnapshot()
        );
    }

    @PostMapping("/positions/{symbol}/close")
    @Operation(summary = "수동 청산", description = "남은 포지션 전량을 지정 가격으로 청산합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "청산 성공"),
            @ApiResponse(responseCode = "404", description = "보유 포지션 없음")
    })
    public PositionUpdateResult closePosition(
            @PathVariable String symbol,
            @RequestBody @Valid ClosePositionRequest request
    ) {
        return riskOverlayService.closePosition(symbol, request.price());
    }

    @GetMapping("/positions")
    @Operation(summary = "보유 포지션 목록", description = "활성 포지션을 종목 순으로 조회합니다.")
    public List<PositionView> getActivePositions() {
        return riskOverlayService.getActivePositions();
    }

    @GetMapping("/positions/{symbol}")
    @Operation(summary = "보유 포지션 조회", description = "종목의 활성 포지션 상태를 조회합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "보유 포지션 없음")
    })
    public PositionView getPosition(@PathVariable String symbol) {
        return riskOverlayService.getPosition(symbol);
    }

    @GetMapping("/performance")
    @Operation(summary = "포트폴리오 성과", description = "청산된 거래 수익률로 승률, 샤프 지수, 낙폭을 계산합니다.")
    public PortfolioPerformance getPortfolioPerformance() {
        return riskOverlayService.getPortfolioPerformance();
    }

    @GetMapping("/trade-history")
    @Operation(summary = "거래 이력", description = "청산된 거래 목록을 조회합니다.")
    public List<TradeRecord> getTradeHistory() {
        return riskOverlayService.getTradeHistory();
    }

    @GetMapping("/transitions")
    @Operation(summary = "레짐 전환 이력", description = "감지된 레짐 전환과 긴급 프로토콜 이력을 조회합니다.")
    public List<TransitionLogEntry> getTransitionHistory() {
        return riskOverlayService.getTransitionHistory();
    }

    @PostMapping("/backtest")
    @Operation(summary = "멀티 레이어 백테스트", description = "기준/손절 단독/익절 단독/통합 레이어를 비교하고, 요청 시 그리드 서치를 수행합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "백테스트 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패")
    })
    public BacktestReport runBacktest(@RequestBody @Valid BacktestRequest request) {
        return riskOverlayService.runBacktest(request.trades(), request.overrides());
    }
}
