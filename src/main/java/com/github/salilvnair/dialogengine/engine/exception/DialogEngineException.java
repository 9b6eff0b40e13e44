package com.github.salilvnair.dialogengine.engine.exception;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class DialogEngineException extends RuntimeException {

    private final String errorCode;
    private final ErrorCategory category;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public DialogEngineException(DialogEngineErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.category = code.category();
        this.recoverable = code.recoverable();
    }

    public DialogEngineException(DialogEngineErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.category = code.category();
        this.recoverable = code.recoverable();
    }

    public DialogEngineException(DialogEngineErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.category = code.category();
        this.recoverable = code.recoverable();
    }

    public DialogEngineException withMetaData(Map<String, Object> metaData) {
        if (metaData == null || metaData.isEmpty()) {
            return this;
        }
        if (this.metaData == null) {
            this.metaData = new LinkedHashMap<>();
        }
        // inner metadata (closest to the failure) wins
        metaData.forEach(this.metaData::putIfAbsent);
        return this;
    }

    public boolean is(DialogEngineErrorCode code) {
        return code != null && code.name().equals(errorCode);
    }
}
