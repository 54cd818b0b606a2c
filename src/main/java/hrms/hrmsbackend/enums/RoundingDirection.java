package hrms.hrmsbackend.enums;

/**
 * 연차 비례 계산 / OT 시간 반올림 방향
 */
public enum RoundingDirection {
    UP,
    DOWN,
    NEAREST
}
