package org.qbitspark.filevaultbackend.storage_service.service;

/**
 * Narrow byte store the content store writes through. Implementations must be thread-safe
 * and must not keep any registry state.
 */
public interface StorageBackend {

    /**
     * Writes the object, replacing anything already stored under the key.
     *
     * @throws org.qbitspark.filevaultbackend.globeadvice.exceptions.StorageException on I/O failure
     */
    void put(String key, byte[] content);

    /**
     * @throws org.qbitspark.filevaultbackend.globeadvice.exceptions.StorageException.ObjectNotFoundException
     *         if nothing is stored under the key
     */
    byte[] get(String key);

    /**
     * Removes the object. Deleting a missing key is not an error.
     */
    void delete(String key);

    String name();
}
