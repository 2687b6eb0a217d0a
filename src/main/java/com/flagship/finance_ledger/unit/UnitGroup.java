package com.flagship.finance_ledger.unit;

import lombok.Value;

@Value
public class UnitGroup {
    Long id;
    String name;
}
