package com.geico.poc.policyjobs.errors;

/**
 * Exception thrown by job administration, validation and execution.
 *
 * Mirrors a database error report: a code, a primary message and optional
 * detail and hint lines.
 */
public class JobException extends RuntimeException {

    private final ErrorCode code;
    private final String detail;
    private final String hint;

    public JobException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public JobException(ErrorCode code, String message, String detail, String hint) {
        super(message);
        this.code = code;
        this.detail = detail;
        this.hint = hint;
    }

    public JobException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.detail = null;
        this.hint = null;
    }

    public static JobException invalidParameter(String message) {
        return new JobException(ErrorCode.INVALID_PARAMETER, message);
    }

    public static JobException invalidParameter(String message, String detail, String hint) {
        return new JobException(ErrorCode.INVALID_PARAMETER, message, detail, hint);
    }

    public static JobException undefinedObject(String message) {
        return new JobException(ErrorCode.UNDEFINED_OBJECT, message);
    }

    public static JobException undefinedObject(String message, String detail) {
        return new JobException(ErrorCode.UNDEFINED_OBJECT, message, detail, null);
    }

    public static JobException insufficientPrivilege(String message, String hint) {
        return new JobException(ErrorCode.INSUFFICIENT_PRIVILEGE, message, null, hint);
    }

    public static JobException featureNotSupported(String message) {
        return new JobException(ErrorCode.FEATURE_NOT_SUPPORTED, message);
    }

    public static JobException internal(String message) {
        return new JobException(ErrorCode.INTERNAL, message);
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getDetail() {
        return detail;
    }

    public String getHint() {
        return hint;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("JobException{code=").append(code)
            .append(", message=").append(getMessage());
        if (detail != null) {
            sb.append(", detail=").append(detail);
        }
        if (hint != null) {
            sb.append(", hint=").append(hint);
        }
        return sb.append('}').toString();
    }
}
