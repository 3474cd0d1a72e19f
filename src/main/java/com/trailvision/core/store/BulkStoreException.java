package com.trailvision.core.store;

/** Ошибка чтения/записи bulk-хранилища наблюдений. */
public class BulkStoreException extends RuntimeException {

    public BulkStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
