package com.cdcbridge.sink;

/**
 * Destination of fired windows, chosen once when the pipeline is built.
 */
public enum SinkKind {

    /** Append to the warehouse table. */
    TABLE,

    /** Write pretty-printed rows to one file per window and shard. Diagnostic use only. */
    FILE;

    public static SinkKind resolve(String outputPath) {
        return outputPath == null || outputPath.isBlank() ? TABLE : FILE;
    }
}
