package com.example.timesheet.approval;

public enum ApprovalEvent {
    CREATE("create", Party.OWNER),
    UPDATE("update", Party.OWNER),
    SUBMIT("submit", Party.OWNER),
    APPROVE("approve", Party.ADMIN),
    REJECT("reject", Party.ADMIN),
    DELETE("delete", Party.OWNER);

    /** Who may fire the event. */
    public enum Party {
        OWNER,
        ADMIN
    }

    private final String label;
    private final Party party;

    ApprovalEvent(String label, Party party) {
        this.label = label;
        this.party = party;
    }

    public String label() {
        return label;
    }

    public Party party() {
        return party;
    }
}
