package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.common.AdditionalCost;
import lombok.Value;

import java.util.List;

@Value
public class SaleDetail {
    Sale sale;
    List<SaleItem> items;
    List<SaleServiceItem> serviceItems;
    List<AdditionalCost> additionalCosts;
}
