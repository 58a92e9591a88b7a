package com.tablecache;

/**
 * Thrown when a key is absent and the table's loader could not supply it.
 */
public class KeyNotLoadableException extends KeyNotFoundException {

    private static final long serialVersionUID = 1L;

    public KeyNotLoadableException(String tableName, Object key) {
        super("Key not found and not loadable in table " + tableName + ": " + key, tableName, key);
    }
}
