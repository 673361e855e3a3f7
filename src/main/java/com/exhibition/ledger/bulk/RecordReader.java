package com.exhibition.ledger.bulk;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads raw records from one extractor's output format.
 */
public interface RecordReader {

    /**
     * Reads records from a stream.
     *
     * @param input  the stream to read; not closed by this method
     * @param origin file name recorded on every record as its back-reference
     * @return the records read
     * @throws IOException when the stream cannot be read or is not in the expected format
     */
    ReadResult read(InputStream input, String origin) throws IOException;

    default ReadResult read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.getFileName().toString());
        }
    }

    /**
     * Returns the format handled by this reader (e.g. "json", "xlsx").
     */
    String getFormat();
}
