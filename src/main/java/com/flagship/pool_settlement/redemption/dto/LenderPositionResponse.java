package com.flagship.pool_settlement.redemption.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_settlement.redemption.LenderRedemptionRecord;
import com.flagship.pool_settlement.redemption.TrancheVault;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class LenderPositionResponse {

    @JsonProperty("tranche")
    String tranche;

    @JsonProperty("lender_id")
    String lenderId;

    @JsonProperty("approved")
    boolean approved;

    @JsonProperty("shares")
    BigDecimal shares;

    @JsonProperty("assets")
    BigDecimal assets;

    @JsonProperty("shares_requested")
    BigDecimal sharesRequested;

    @JsonProperty("total_shares_processed")
    BigDecimal totalSharesProcessed;

    @JsonProperty("total_amount_processed")
    BigDecimal totalAmountProcessed;

    @JsonProperty("total_amount_withdrawn")
    BigDecimal totalAmountWithdrawn;

    @JsonProperty("withdrawable")
    BigDecimal withdrawable;

    public static LenderPositionResponse from(TrancheVault vault, String lenderId) {
        LenderRedemptionRecord record = vault.redemptionRecord(lenderId);
        BigDecimal shares = vault.balanceOf(lenderId);
        return LenderPositionResponse.builder()
            .tranche(vault.getTranche().id())
            .lenderId(lenderId)
            .approved(vault.isApprovedLender(lenderId))
            .shares(shares)
            .assets(vault.convertToAssets(shares))
            .sharesRequested(record.getSharesRequested())
            .totalSharesProcessed(record.getTotalSharesProcessed())
            .totalAmountProcessed(record.getTotalAmountProcessed())
            .totalAmountWithdrawn(record.getTotalAmountWithdrawn())
            .withdrawable(record.getWithdrawableAmount())
            .build();
    }
}
