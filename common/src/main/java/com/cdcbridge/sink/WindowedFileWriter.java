package com.cdcbridge.sink;

import com.cdcbridge.error.SinkWriteException;
import com.cdcbridge.model.WindowBatch;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.connector.sink2.SinkWriter;
import org.apache.flink.core.fs.FSDataOutputStream;
import org.apache.flink.core.fs.FileSystem;
import org.apache.flink.core.fs.Path;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes each window batch to its own file. Files are overwritten when a batch is replayed
 * after recovery, so a window's file always reflects one complete firing.
 */
@Slf4j
public class WindowedFileWriter implements SinkWriter<WindowBatch> {

    private final WindowedFileNaming naming;

    public WindowedFileWriter(WindowedFileNaming naming) {
        this.naming = naming;
    }

    @Override
    public void write(WindowBatch batch, Context context) {
        Path path = new Path(naming.fileName(batch));
        byte[] content = PrettyRowFormat.format(batch.getRows()).getBytes(StandardCharsets.UTF_8);
        try {
            FileSystem fs = path.getFileSystem();
            try (FSDataOutputStream out = fs.create(path, FileSystem.WriteMode.OVERWRITE)) {
                out.write(content);
            }
        } catch (IOException e) {
            throw new SinkWriteException("Failed to write window file " + path, e);
        }
        log.info("Wrote {} rows to {}", batch.size(), path);
    }

    @Override
    public void flush(boolean endOfInput) {
        // files are closed as soon as they are written
    }

    @Override
    public void close() {
        // no open handles
    }
}
