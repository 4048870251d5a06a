package work.lcod.bridge.member;

import java.util.Objects;

/**
 * Result of applying one payload entry to one member.
 */
public record MemberOutcome(String member, Status status, String message, Object value) {
    public enum Status {
        APPLIED,
        NOT_FOUND,
        UNSUPPORTED,
        FAILED
    }

    public MemberOutcome {
        Objects.requireNonNull(member, "member");
        Objects.requireNonNull(status, "status");
    }

    public static MemberOutcome applied(String member, Object value) {
        return new MemberOutcome(member, Status.APPLIED, null, value);
    }

    public static MemberOutcome notFound(String member, String typeName) {
        return new MemberOutcome(member, Status.NOT_FOUND, "Member '" + member + "' not found on type " + typeName, null);
    }

    public static MemberOutcome unsupported(String member, String message) {
        return new MemberOutcome(member, Status.UNSUPPORTED, message, null);
    }

    public static MemberOutcome failed(String member, String message) {
        return new MemberOutcome(member, Status.FAILED, message, null);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
