package com.cdcbridge.sink;

import com.cdcbridge.model.WindowBatch;
import org.apache.flink.api.connector.sink2.Sink;
import org.apache.flink.api.connector.sink2.SinkWriter;
import org.apache.flink.api.connector.sink2.WriterInitContext;

/**
 * Diagnostic sink writing one pretty-printed file per window and shard.
 */
public class WindowedFileSink implements Sink<WindowBatch> {

    private static final long serialVersionUID = 1L;

    private final WindowedFileNaming naming;

    public WindowedFileSink(String outputPath) {
        this.naming = new WindowedFileNaming(outputPath);
    }

    @Override
    public SinkWriter<WindowBatch> createWriter(InitContext context) {
        return new WindowedFileWriter(naming);
    }

    @Override
    public SinkWriter<WindowBatch> createWriter(WriterInitContext context) {
        return new WindowedFileWriter(naming);
    }
}
