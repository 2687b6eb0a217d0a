package com.flagship.finance_ledger.coa;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Value;

import java.util.List;

@Value
public class CoaCategoryNode {
    @JsonUnwrapped
    CoaCategory category;
    List<CoaCategoryNode> children;
}
