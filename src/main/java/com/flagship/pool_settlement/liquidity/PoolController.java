package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.liquidity.dto.AmountRequest;
import com.flagship.pool_settlement.liquidity.dto.CoverFundingRequest;
import com.flagship.pool_settlement.liquidity.dto.FeeScheduleRequest;
import com.flagship.pool_settlement.liquidity.dto.PoolResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * REST endpoints for pool administration: distributions, status, covers and fees.
 */
@RestController
@RequestMapping("/api/pool")
@RequiredArgsConstructor
@Slf4j
public class PoolController {

    private final Pool pool;
    private final FirstLossCovers firstLossCovers;
    private final PoolFeeManager poolFeeManager;

    @GetMapping
    public ResponseEntity<PoolResponse> getPool() {
        return ResponseEntity.ok(PoolResponse.from(pool, firstLossCovers.inAbsorptionOrder()));
    }

    @PostMapping("/profit")
    public ResponseEntity<ProfitDistribution> distributeProfit(@Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(pool.distributeProfit(request.getAmount()));
    }

    @PostMapping("/loss")
    public ResponseEntity<LossDistribution> distributeLoss(@Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(pool.distributeLoss(request.getAmount()));
    }

    @PostMapping("/loss-recovery")
    public ResponseEntity<LossRecoveryDistribution> distributeLossRecovery(
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(pool.distributeLossRecovery(request.getAmount()));
    }

    @PostMapping("/enable")
    public ResponseEntity<PoolResponse> enablePool() {
        pool.enablePool();
        return getPool();
    }

    @PostMapping("/disable")
    public ResponseEntity<PoolResponse> disablePool() {
        pool.disablePool();
        return getPool();
    }

    @PostMapping("/covers/{coverId}/deposits")
    public ResponseEntity<Map<String, Object>> depositCover(@PathVariable("coverId") String coverId,
                                                            @Valid @RequestBody CoverFundingRequest request) {
        BigDecimal coverAssets = pool.depositCover(coverId, request.getProviderId(), request.getAmount());
        return ResponseEntity.ok(coverBody(coverId, coverAssets));
    }

    @PostMapping("/covers/{coverId}/withdrawals")
    public ResponseEntity<Map<String, Object>> withdrawCover(@PathVariable("coverId") String coverId,
                                                             @Valid @RequestBody CoverFundingRequest request) {
        BigDecimal coverAssets = pool.withdrawCover(coverId, request.getProviderId(), request.getAmount());
        return ResponseEntity.ok(coverBody(coverId, coverAssets));
    }

    @GetMapping("/fees")
    public ResponseEntity<Map<String, Object>> getFees() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("schedule", poolFeeManager.getFeeSchedule());
        for (FeeRecipient recipient : FeeRecipient.values()) {
            body.put(recipient.name().toLowerCase(Locale.ROOT) + "_withdrawable",
                poolFeeManager.withdrawable(recipient));
        }
        return ResponseEntity.ok(body);
    }

    @PutMapping("/fees/schedule")
    public ResponseEntity<FeeSchedule> updateFeeSchedule(@Valid @RequestBody FeeScheduleRequest request) {
        return ResponseEntity.ok(poolFeeManager.updateFeeSchedule(request.toFeeSchedule()));
    }

    /**
     * Moves accrued fees of one recipient (protocol, pool_owner, evaluation_agent) to its treasury.
     */
    @PostMapping("/fees/{recipient}/withdrawals")
    public ResponseEntity<Map<String, Object>> withdrawFee(@PathVariable("recipient") String recipient,
                                                           @Valid @RequestBody AmountRequest request) {
        FeeRecipient feeRecipient = FeeRecipient.valueOf(recipient.toUpperCase(Locale.ROOT));
        BigDecimal withdrawn = poolFeeManager.withdraw(feeRecipient, request.getAmount());
        log.info("Fee withdrawal: recipient={}, amount={}", feeRecipient, withdrawn);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("recipient", feeRecipient.name());
        body.put("withdrawn", withdrawn);
        body.put("remaining", poolFeeManager.withdrawable(feeRecipient));
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> coverBody(String coverId, BigDecimal coverAssets) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cover_id", coverId);
        body.put("cover_assets", coverAssets);
        return body;
    }
}
