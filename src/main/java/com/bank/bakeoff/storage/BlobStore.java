package com.bank.bakeoff.storage;

/**
 * Opaque object storage for dataset files, feature matrices, model artifacts and
 * scored outputs. Objects are addressed by the URL returned from {@link #upload}.
 */
public interface BlobStore {

    /**
     * Stores {@code content} under {@code path}, replacing any existing object.
     *
     * @return the URL to read the object back with
     */
    String upload(String path, byte[] content);

    byte[] download(String url);

    /**
     * @return true if an object was removed
     */
    boolean delete(String url);
}
