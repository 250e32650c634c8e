package com.herzen.irt.validation;

import com.herzen.irt.error.AnalysisException;
import com.herzen.irt.error.ErrorKind;

public class SchemaException extends AnalysisException {
    public SchemaException(String message) {
        super(ErrorKind.SCHEMA, message);
    }
}
