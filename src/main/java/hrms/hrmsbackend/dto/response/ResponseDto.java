package hrms.hrmsbackend.dto.response;

import hrms.hrmsbackend.common.ResponseCode;
import hrms.hrmsbackend.common.ResponseMessage;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 단순 성공 응답 { code, message }
 */
@Getter
@AllArgsConstructor
public class ResponseDto {

    private String code;
    private String message;

    public static ResponseDto success() {
        return new ResponseDto(ResponseCode.SUCCESS, ResponseMessage.SUCCESS);
    }

    public static ResponseDto success(String message) {
        return new ResponseDto(ResponseCode.SUCCESS, message);
    }
}
