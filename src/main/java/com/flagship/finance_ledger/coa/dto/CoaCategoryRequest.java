package com.flagship.finance_ledger.coa.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CoaCategoryRequest {

    Long parentId;

    @NotBlank(message = "Name is required")
    String name;

    @NotBlank(message = "Code is required")
    String code;

    /** Asset, Liability, Equity, Revenue or Expense. */
    @NotBlank(message = "Category type is required")
    String categoryType;
}
