package com.herzen.irt.estimation;

import com.herzen.irt.error.AnalysisException;
import com.herzen.irt.error.ErrorKind;

public class EstimationException extends AnalysisException {
    public EstimationException(String message) {
        super(ErrorKind.ESTIMATION, message);
    }

    public EstimationException(String message, Throwable cause) {
        super(ErrorKind.ESTIMATION, message, cause);
    }
}
