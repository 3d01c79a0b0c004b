package com.momentumquant.rebalancer.domain;

/**
 * Raised when price data is missing so badly that a simulator run cannot
 * produce a meaningful result. Aborts the one run that raised it.
 */
public class CatastrophicDataException extends RuntimeException {

    public CatastrophicDataException(String message) {
        super(message);
    }
}
