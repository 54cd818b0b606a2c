package hrms.hrmsbackend.exception;

import lombok.Getter;

/**
 * 업무 규칙 위반 예외. message 는 사용자에게 그대로 노출된다.
 */
@Getter
public class EssException extends RuntimeException {

    private final ErrorKind kind;

    public EssException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EssException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static EssException validation(String message) {
        return new EssException(ErrorKind.VALIDATION, message);
    }

    public static EssException forbidden(String reason) {
        return new EssException(ErrorKind.AUTHORIZATION, reason);
    }

    public static EssException unauthenticated(String message) {
        return new EssException(ErrorKind.AUTHENTICATION, message);
    }

    public static EssException notFound(String entityName) {
        return new EssException(ErrorKind.NOT_FOUND, entityName + " not found");
    }

    public static EssException conflict(String message) {
        return new EssException(ErrorKind.CONFLICT, message);
    }

    public static EssException internal(String message) {
        return new EssException(ErrorKind.INTERNAL, message);
    }
}
