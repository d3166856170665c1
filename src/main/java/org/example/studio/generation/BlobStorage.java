package org.example.studio.generation;

import java.util.Optional;

public interface BlobStorage {

    /**
     * Store bytes under a key, replacing any previous content.
     *
     * @return the public reference for the stored object
     */
    String upload(String key, byte[] bytes);

    /**
     * Read back an object by the reference {@link #upload} returned. Empty when the reference
     * is not served by this storage or the object is gone.
     */
    Optional<byte[]> read(String ref);
}
