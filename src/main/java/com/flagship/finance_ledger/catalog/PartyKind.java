package com.flagship.finance_ledger.catalog;

/**
 * Suppliers and customers share one record shape and live in separate tables.
 */
public enum PartyKind {
    SUPPLIER("suppliers", "Supplier", "SELECT COUNT(*) FROM purchases WHERE supplier_id = ?"),
    CUSTOMER("customers", "Customer", "SELECT COUNT(*) FROM sales WHERE customer_id = ?");

    private final String table;
    private final String label;
    private final String referenceCountSql;

    PartyKind(String table, String label, String referenceCountSql) {
        this.table = table;
        this.label = label;
        this.referenceCountSql = referenceCountSql;
    }

    String table() {
        return table;
    }

    public String label() {
        return label;
    }

    String referenceCountSql() {
        return referenceCountSql;
    }
}
