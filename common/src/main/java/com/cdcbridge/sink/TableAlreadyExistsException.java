package com.cdcbridge.sink;

/**
 * Raised by {@link WarehouseClient#createTable} when another writer created the table first.
 */
public class TableAlreadyExistsException extends Exception {

    private static final long serialVersionUID = 1L;

    public TableAlreadyExistsException(WarehouseTableRef table) {
        super("Table already exists: " + table);
    }
}
