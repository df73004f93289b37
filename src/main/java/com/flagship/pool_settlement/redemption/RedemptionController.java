package com.flagship.pool_settlement.redemption;

import com.flagship.pool_settlement.liquidity.Tranche;
import com.flagship.pool_settlement.redemption.dto.LenderAmountRequest;
import com.flagship.pool_settlement.redemption.dto.LenderPositionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST endpoints for tranche vaults and redemption epochs.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class RedemptionController {

    private final TrancheVaults vaults;
    private final EpochManager epochManager;

    @PutMapping("/tranches/{tranche}/lenders/{lenderId}")
    public ResponseEntity<LenderPositionResponse> addApprovedLender(@PathVariable("tranche") String tranche,
                                                                    @PathVariable("lenderId") String lenderId) {
        TrancheVault vault = vault(tranche);
        vault.addApprovedLender(lenderId);
        return ResponseEntity.ok(LenderPositionResponse.from(vault, lenderId));
    }

    @DeleteMapping("/tranches/{tranche}/lenders/{lenderId}")
    public ResponseEntity<LenderPositionResponse> removeApprovedLender(@PathVariable("tranche") String tranche,
                                                                       @PathVariable("lenderId") String lenderId) {
        TrancheVault vault = vault(tranche);
        vault.removeApprovedLender(lenderId);
        return ResponseEntity.ok(LenderPositionResponse.from(vault, lenderId));
    }

    @GetMapping("/tranches/{tranche}/lenders/{lenderId}")
    public ResponseEntity<LenderPositionResponse> getLenderPosition(@PathVariable("tranche") String tranche,
                                                                    @PathVariable("lenderId") String lenderId) {
        return ResponseEntity.ok(LenderPositionResponse.from(vault(tranche), lenderId));
    }

    @GetMapping("/tranches/{tranche}")
    public ResponseEntity<Map<String, Object>> getTranche(@PathVariable("tranche") String tranche) {
        TrancheVault vault = vault(tranche);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tranche", vault.getTranche().id());
        body.put("total_assets", vault.totalAssets());
        body.put("total_supply", vault.totalSupply());
        body.put("escrowed_shares", vault.escrowedShares());
        body.put("price_per_share", vault.pricePerShare());
        body.put("open_summary", vault.getOpenSummary());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/tranches/{tranche}/deposits")
    public ResponseEntity<Map<String, Object>> deposit(@PathVariable("tranche") String tranche,
                                                       @Valid @RequestBody LenderAmountRequest request) {
        BigDecimal shares = vault(tranche).deposit(request.getLenderId(), request.getAmount());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("lender_id", request.getLenderId());
        body.put("assets", request.getAmount());
        body.put("shares", shares);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/tranches/{tranche}/redemption-requests")
    public ResponseEntity<LenderRedemptionRecord> addRedemptionRequest(@PathVariable("tranche") String tranche,
                                                                       @Valid @RequestBody LenderAmountRequest request) {
        return ResponseEntity.ok(vault(tranche).addRedemptionRequest(request.getLenderId(), request.getAmount()));
    }

    @PostMapping("/tranches/{tranche}/redemption-cancellations")
    public ResponseEntity<LenderRedemptionRecord> cancelRedemptionRequest(
            @PathVariable("tranche") String tranche,
            @Valid @RequestBody LenderAmountRequest request) {
        return ResponseEntity.ok(vault(tranche).cancelRedemptionRequest(request.getLenderId(),
            request.getAmount()));
    }

    @PostMapping("/tranches/{tranche}/lenders/{lenderId}/disbursements")
    public ResponseEntity<Map<String, Object>> disburse(@PathVariable("tranche") String tranche,
                                                        @PathVariable("lenderId") String lenderId) {
        BigDecimal disbursed = vault(tranche).disburse(lenderId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("lender_id", lenderId);
        body.put("disbursed", disbursed);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/tranches/{tranche}/epochs/{epochId}")
    public ResponseEntity<EpochRedemptionSummary> getRedemptionSummary(@PathVariable("tranche") String tranche,
                                                                       @PathVariable("epochId") long epochId) {
        return ResponseEntity.ok(epochManager.redemptionSummary(Tranche.fromId(tranche), epochId));
    }

    @GetMapping("/epochs/current")
    public ResponseEntity<Epoch> currentEpoch() {
        return ResponseEntity.ok(epochManager.currentEpoch());
    }

    @PostMapping("/epochs/current/close")
    public ResponseEntity<EpochCloseResult> closeEpoch() {
        return ResponseEntity.ok(epochManager.closeEpoch());
    }

    private TrancheVault vault(String tranche) {
        return vaults.get(Tranche.fromId(tranche));
    }
}
