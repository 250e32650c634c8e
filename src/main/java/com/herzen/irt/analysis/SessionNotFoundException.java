package com.herzen.irt.analysis;

import com.herzen.irt.error.AnalysisException;
import com.herzen.irt.error.ErrorKind;

public class SessionNotFoundException extends AnalysisException {
    public SessionNotFoundException(String sessionId) {
        super(ErrorKind.SESSION_NOT_FOUND, "Analysis session not found: " + sessionId);
    }
}
