package duotalk.room;

/**
 * Outcome of a room admission request.
 */
public enum JoinResult {
    ADMITTED,
    FULL;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
