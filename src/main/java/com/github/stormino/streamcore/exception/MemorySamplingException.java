package com.github.stormino.streamcore.exception;

/**
 * Exception thrown when a memory sampler cannot produce a reading.
 */
public class MemorySamplingException extends StreamCoreException {

    private final String samplerName;

    public MemorySamplingException(String message, String samplerName) {
        super(message);
        this.samplerName = samplerName;
    }

    public MemorySamplingException(String message, String samplerName, Throwable cause) {
        super(message, cause);
        this.samplerName = samplerName;
    }

    public String getSamplerName() {
        return samplerName;
    }
}
