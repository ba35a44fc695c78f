package com.vidnyan.netedit.domain.error;

public class EncodingDetectException extends NetlistException {

    public EncodingDetectException(String message) {
        super(message);
    }
}
