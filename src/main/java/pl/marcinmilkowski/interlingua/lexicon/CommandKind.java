package pl.marcinmilkowski.interlingua.lexicon;

/**
 * Non-declarative commands recognised in prose input.
 */
public enum CommandKind {
    HELP,
    SHOW_STATUS,
    RUN_AGENT,
    RENDER_HIERO,
    SET_GOAL;

    static CommandKind fromId(String id) {
        return switch (id) {
            case "help" -> HELP;
            case "show_status" -> SHOW_STATUS;
            case "run_agent" -> RUN_AGENT;
            case "render_hiero" -> RENDER_HIERO;
            case "set_goal" -> SET_GOAL;
            default -> throw new IllegalArgumentException("Unknown command kind: " + id);
        };
    }
}
