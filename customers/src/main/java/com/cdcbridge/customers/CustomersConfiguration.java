package com.cdcbridge.customers;

import com.cdcbridge.config.CdcBridgeAutoConfiguration;
import com.cdcbridge.customers.model.CustomerTable;
import com.cdcbridge.projection.TableBinding;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Spring wiring of the customers table into the generic pipeline beans.
 */
@Configuration
@Import(CdcBridgeAutoConfiguration.class)
public class CustomersConfiguration {

    @Bean
    public TableBinding customersTableBinding() {
        return CustomerTable.BINDING;
    }
}
