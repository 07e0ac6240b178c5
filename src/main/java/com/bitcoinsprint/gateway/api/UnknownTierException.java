package com.bitcoinsprint.gateway.api;

import lombok.Getter;

@Getter
public class UnknownTierException extends RuntimeException {

    private final String value;

    public UnknownTierException(String value) {
        super("Invalid tier '" + value + "'. Must be one of: free, pro, enterprise");
        this.value = value;
    }
}
