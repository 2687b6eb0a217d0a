package com.flagship.finance_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Append-only audit row for a deposit or withdrawal.
 * {@code total} is the base-currency equivalent, amount &times; rate.
 */
@Value
@Builder
public class AccountTransaction {
    Long id;
    Long accountId;
    TransactionType transactionType;
    BigDecimal amount;
    String currency;
    BigDecimal rate;
    BigDecimal total;
    LocalDate transactionDate;
    @JsonProperty("is_full")
    boolean full;
    String notes;
}
