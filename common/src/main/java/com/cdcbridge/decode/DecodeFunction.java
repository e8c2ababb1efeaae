package com.cdcbridge.decode;

import com.cdcbridge.config.PipelineConfig;
import com.cdcbridge.model.DecodedRecord;
import com.cdcbridge.model.RawEvent;
import com.cdcbridge.registry.CachingSchemaResolver;
import com.cdcbridge.registry.HttpSchemaRegistryClient;
import com.cdcbridge.registry.SchemaRegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.apache.flink.api.common.functions.OpenContext;
import org.apache.flink.api.common.functions.RichMapFunction;

/**
 * Flink operator decoding raw log records.
 *
 * <p>The registry client and schema cache are created in {@link #open} and released in
 * {@link #close}, so they live exactly as long as the subtask. Any decode failure is
 * rethrown: the task fails and Flink's restart strategy decides what happens next.</p>
 */
@Slf4j
public class DecodeFunction extends RichMapFunction<RawEvent, DecodedRecord> {

    private static final long serialVersionUID = 1L;

    private final PipelineConfig config;
    private final RecordContract contract;

    private transient RegistryAvroDecoder decoder;

    public DecodeFunction(PipelineConfig config, RecordContract contract) {
        this.config = config;
        this.contract = contract;
    }

    @Override
    public void open(OpenContext openContext) throws Exception {
        super.open(openContext);
        this.decoder = new RegistryAvroDecoder(new CachingSchemaResolver(createRegistryClient()), contract);
        log.info("Decoder opened for contract '{}' against {}", contract.getName(), config.getSchemaRegistryUrl());
    }

    /**
     * Hook for tests to substitute the registry.
     */
    protected SchemaRegistryClient createRegistryClient() {
        return new HttpSchemaRegistryClient(config.getSchemaRegistry(), config.getRegistryRetryPolicy());
    }

    @Override
    public DecodedRecord map(RawEvent event) {
        try {
            return decoder.decode(event);
        } catch (RuntimeException e) {
            log.error("Failed to decode record partition={} offset={}: {}",
                    event.getPartition(), event.getOffset(), e.getMessage());
            throw e;
        }
    }

    @Override
    public void close() throws Exception {
        if (decoder != null) {
            decoder.close();
        }
        super.close();
    }
}
