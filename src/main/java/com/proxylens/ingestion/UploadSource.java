package com.proxylens.ingestion;

import java.io.IOException;
import java.io.InputStream;

/**
 * Read-only byte stream of one upload, opened by the ingest worker.
 */
@FunctionalInterface
public interface UploadSource {

    InputStream open() throws IOException;
}
