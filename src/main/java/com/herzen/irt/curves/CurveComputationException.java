package com.herzen.irt.curves;

import com.herzen.irt.error.AnalysisException;
import com.herzen.irt.error.ErrorKind;

public class CurveComputationException extends AnalysisException {
    public CurveComputationException(String message, Throwable cause) {
        super(ErrorKind.CURVE_COMPUTATION, message, cause);
    }
}
