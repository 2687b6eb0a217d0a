package com.flagship.finance_ledger.purchase;

import com.flagship.finance_ledger.common.AdditionalCost;
import lombok.Value;

import java.util.List;

@Value
public class PurchaseDetail {
    Purchase purchase;
    List<PurchaseItem> items;
    List<AdditionalCost> additionalCosts;
}
