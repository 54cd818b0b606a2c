package hrms.hrmsbackend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 코어가 밖으로 내보내는 오류 종류와 HTTP 상태 매핑
 */
@Getter
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST),
    AUTHENTICATION(HttpStatus.UNAUTHORIZED),
    AUTHORIZATION(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    DEPENDENCY(HttpStatus.BAD_GATEWAY),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }
}
