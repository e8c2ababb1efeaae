package com.cdcbridge.sink;

import com.cdcbridge.model.WindowBatch;

import java.io.Serializable;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Deterministic file names for window batches:
 * {@code {prefix}-{start}-{end}-shard-{partition}} with compact UTC timestamps, plus
 * {@code -late-{offset}} for late batches. The same input always maps to the same names.
 */
public class WindowedFileNaming implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final String prefix;

    public WindowedFileNaming(String prefix) {
        this.prefix = prefix;
    }

    public String fileName(WindowBatch batch) {
        StringBuilder name = new StringBuilder(prefix)
                .append('-').append(TIMESTAMP.format(Instant.ofEpochMilli(batch.getWindowStart())))
                .append('-').append(TIMESTAMP.format(Instant.ofEpochMilli(batch.getWindowEnd())))
                .append("-shard-").append(String.format("%05d", batch.getShard()));
        if (batch.isLate()) {
            name.append("-late-").append(batch.getFirstOffset());
        }
        return name.toString();
    }
}
