package com.purchasingpower.thesugraph.exception;

import lombok.Getter;

/**
 * The external layout engine is missing, failed or timed out.
 */
@Getter
public class LayoutOracleException extends RuntimeException {

    private final String engineOutput;

    public LayoutOracleException(String message, String engineOutput) {
        super(message);
        this.engineOutput = engineOutput;
    }

    public LayoutOracleException(String message, Throwable cause) {
        super(message, cause);
        this.engineOutput = "";
    }
}
