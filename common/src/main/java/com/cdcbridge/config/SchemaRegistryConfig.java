package com.cdcbridge.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Schema registry connection configuration.
 */
@Data
@NoArgsConstructor
public class SchemaRegistryConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String url = "http://localhost:8081";
    private int connectTimeoutMs = 5000;
    private int requestTimeoutMs = 10000;
    private int maxAttempts = 5;
    private long retryBackoffMs = 500;
    private long maxRetryBackoffMs = 10_000;
}
