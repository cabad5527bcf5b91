package com.cashcow.domain.enums;

/**
 * Side of the cash flow a category rolls into.
 */
public enum CategoryKind {
    REVENUE,
    EXPENSE
}
