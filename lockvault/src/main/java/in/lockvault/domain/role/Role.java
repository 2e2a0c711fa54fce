package in.lockvault.domain.role;

/**
 * Reputation roles issued from deposit behaviour.
 */
public enum Role {
    LONG_TERM_COMMITTER("LongTermCommitter", true),
    FREQUENT_DEPOSITOR("FrequentDepositor", true),
    BIG_DEPOSITOR("BigDepositor", true),
    ACTIVE_PARTICIPANT("ActiveParticipant", false);

    private final String displayName;
    private final boolean permanent;

    Role(String displayName, boolean permanent) {
        this.displayName = displayName;
        this.permanent = permanent;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Permanent roles are never revoked once granted; the temporary role lapses without activity.
     */
    public boolean isPermanent() {
        return permanent;
    }
}
