package com.traceradar.domain;

/**
 * Which get_sale_data flavour a stored sale snapshot was read with.
 */
public enum SaleContractKind {
    GETGEMS,
    BASIC
}
