package com.herzen.irt.analysis;

import com.herzen.irt.error.AnalysisException;
import com.herzen.irt.error.ErrorKind;

public class InvalidRequestException extends AnalysisException {
    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
