package com.flagship.finance_ledger.catalog;

import lombok.Builder;
import lombok.Value;

/**
 * A supplier or a customer.
 */
@Value
@Builder
public class Party {
    Long id;
    String fullName;
    String phone;
    String address;
    String email;
    String notes;
}
