package com.tablecache;

/**
 * Thrown when a key is absent from a table and cannot be supplied.
 */
public class KeyNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Object key;
    private final String tableName;

    public KeyNotFoundException(String tableName, Object key) {
        this("Key not found in table " + tableName + ": " + key, tableName, key);
    }

    protected KeyNotFoundException(String message, String tableName, Object key) {
        super(message);
        this.tableName = tableName;
        this.key = key;
    }

    /**
     * Returns the key that was requested.
     *
     * @return missing key
     */
    public Object getKey() {
        return key;
    }

    /**
     * Returns the name of the table that was queried.
     *
     * @return table name
     */
    public String getTableName() {
        return tableName;
    }
}
