package hrms.hrmsbackend.common;

public interface ResponseMessage {

    // 성공적인 작업을 나타내는 메시지
    String SUCCESS = "Success.";

    String LOGOUT_SUCCESS = "Logged out.";
}
