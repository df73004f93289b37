package com.flagship.pool_settlement.receivable.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class CreateReceivableRequest {

    @NotBlank(message = "Owner ID is required")
    @JsonProperty("owner_id")
    String ownerId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.000001", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Maturity date is required")
    @JsonProperty("maturity_date")
    LocalDate maturityDate;

    @JsonProperty("reference_id")
    String referenceId;
}
