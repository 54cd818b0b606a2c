package hrms.hrmsbackend.enums;

public enum Gender {
    MALE,
    FEMALE;

    public String displayName() {
        return name().toLowerCase();
    }
}
