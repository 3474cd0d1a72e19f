package com.trailvision.core.geo;

/** Ошибка хранилища метаданных кластеров (SQL, транзакция). Батч при этом откатан целиком. */
public class MetadataStoreException extends RuntimeException {

    public MetadataStoreException(String message) {
        super(message);
    }

    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
