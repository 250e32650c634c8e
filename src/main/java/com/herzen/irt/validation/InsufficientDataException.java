package com.herzen.irt.validation;

import com.herzen.irt.error.AnalysisException;
import com.herzen.irt.error.ErrorKind;

public class InsufficientDataException extends AnalysisException {
    private final int validRows;

    public InsufficientDataException(int validRows) {
        super(ErrorKind.INSUFFICIENT_DATA, "Not enough valid response patterns after filtering");
        this.validRows = validRows;
    }

    public int validRows() {
        return validRows;
    }
}
