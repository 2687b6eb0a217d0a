package com.flagship.finance_ledger.coa;

import lombok.Builder;
import lombok.Value;

/**
 * Chart-of-accounts category. level = parent's level + 1, 0 for a root.
 */
@Value
@Builder
public class CoaCategory {
    Long id;
    Long parentId;
    String name;
    String code;
    String categoryType;
    int level;
}
