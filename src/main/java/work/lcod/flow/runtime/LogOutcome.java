package work.lcod.flow.runtime;

public enum LogOutcome {
    SUCCESS,
    FAILURE,
    SKIPPED
}
