package com.simsci.cvd.api;

/** Table lookup beyond the table's age or year range with extrapolation disabled. */
public class OutOfRangeException extends DataRangeException {
    private final String tableKey;

    public OutOfRangeException(String tableKey, String message) {
        super("Table '" + tableKey + "': " + message);
        this.tableKey = tableKey;
    }

    public String tableKey() {
        return tableKey;
    }
}
