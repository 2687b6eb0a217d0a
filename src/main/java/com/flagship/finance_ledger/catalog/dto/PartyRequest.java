package com.flagship.finance_ledger.catalog.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PartyRequest {

    @NotBlank(message = "Full name is required")
    String fullName;

    @NotBlank(message = "Phone is required")
    String phone;

    @NotBlank(message = "Address is required")
    String address;

    String email;

    String notes;
}
