package com.vidnyan.netedit.domain.error;

/**
 * Base type for every failure raised by the netlist document model.
 */
public class NetlistException extends RuntimeException {

    public NetlistException(String message) {
        super(message);
    }

    public NetlistException(String message, Throwable cause) {
        super(message, cause);
    }
}
