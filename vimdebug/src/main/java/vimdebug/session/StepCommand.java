package vimdebug.session;

/**
 * The commands a paused interpreter accepts as the answer to GetCommand.
 */
public enum StepCommand {
    CONTINUE("cont"),
    NEXT("next"),
    STEP_IN("step"),
    STEP_OUT("finish"),
    /** end the debug session, leave Vim running */
    QUIT("quit"),
    /** quit Vim itself */
    FORCE_QUIT(":qa!");

    public final String wireName;

    StepCommand(String wireName) {
        this.wireName = wireName;
    }

    boolean isStep() {
        return this == NEXT || this == STEP_IN || this == STEP_OUT;
    }
}
