package com.williamcallahan.knowledgeindex.store;

import java.io.IOException;
import java.io.InputStream;

/**
 * Source of original document bytes, addressed by scope and logical path.
 */
public interface ContentStore {

    void save(String scopeId, String path, byte[] content) throws IOException;

    /**
     * Opens the stored bytes. The returned stream is not guaranteed to support mark/reset.
     *
     * @throws java.nio.file.NoSuchFileException when nothing is stored at the path
     */
    InputStream open(String scopeId, String path) throws IOException;

    boolean exists(String scopeId, String path);

    void delete(String scopeId, String path) throws IOException;
}
