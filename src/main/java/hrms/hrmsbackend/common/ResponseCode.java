package hrms.hrmsbackend.common;

public interface ResponseCode {

    // 성공적인 작업을 나타내는 코드
    String SUCCESS = "SU";
}
