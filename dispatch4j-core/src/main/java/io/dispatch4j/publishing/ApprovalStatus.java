package io.dispatch4j.publishing;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    AUTO_APPROVED,
    REJECTED;

    public boolean isApproved() {
        return this == APPROVED || this == AUTO_APPROVED;
    }
}
