package com.cdcbridge.customers;

import com.cdcbridge.CdcBridgeJobBase;
import com.cdcbridge.config.PipelineConfig;
import com.cdcbridge.customers.model.CustomerTable;
import com.cdcbridge.projection.TableBinding;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for the customers CDC Flink job.
 *
 * <p>Usage:
 * <pre>
 *   flink run cdc-bridge-customers.jar [--config path] [--outputPath prefix] [--windowSizeSeconds n]
 * </pre>
 *
 * <p>Without {@code --config} the classpath resource {@code pipeline-config.yaml} is used.</p>
 */
@Slf4j
public class CustomersJob extends CdcBridgeJobBase {

    private static final String DEFAULT_CONFIG = "pipeline-config.yaml";

    @Override
    protected String getDefaultConfigResource() {
        return DEFAULT_CONFIG;
    }

    @Override
    protected String getJobName(PipelineConfig config) {
        return "CDC Bridge Customers [" + config.getKafka().getTopic() + " → " + config.getSinkKind() + "]";
    }

    @Override
    protected TableBinding getTableBinding() {
        return CustomerTable.BINDING;
    }

    public static void main(String[] args) throws Exception {
        new CustomersJob().run(args);
    }
}
