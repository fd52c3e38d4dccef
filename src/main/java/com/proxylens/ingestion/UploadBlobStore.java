package com.proxylens.ingestion;

import java.io.IOException;
import java.io.InputStream;

/**
 * Raw file storage owned outside this service. Only read access is needed here.
 */
public interface UploadBlobStore {

    /**
     * Open the bytes of an upload
     *
     * @throws java.io.FileNotFoundException if the upload does not exist
     */
    InputStream open(String uploadId) throws IOException;
}
