package pl.marcinmilkowski.interlingua.lexicon;

import java.util.Objects;

/**
 * A recognised command.
 *
 * @param cycles for {@link CommandKind#RUN_AGENT}, the requested cycle count or {@code null}
 * @param argument entity for {@link CommandKind#RENDER_HIERO}, description for
 *                 {@link CommandKind#SET_GOAL}, otherwise {@code null}
 */
public record Command(CommandKind kind, Integer cycles, String argument) {

    public Command {
        Objects.requireNonNull(kind, "kind");
    }

    public static Command help() {
        return new Command(CommandKind.HELP, null, null);
    }

    public static Command showStatus() {
        return new Command(CommandKind.SHOW_STATUS, null, null);
    }

    public static Command runAgent(Integer cycles) {
        return new Command(CommandKind.RUN_AGENT, cycles, null);
    }

    public static Command renderHiero(String entity) {
        return new Command(CommandKind.RENDER_HIERO, null, entity);
    }

    public static Command setGoal(String description) {
        return new Command(CommandKind.SET_GOAL, null, Objects.requireNonNull(description));
    }

    @Override
    public String toString() {
        return switch (kind) {
            case HELP -> "Help";
            case SHOW_STATUS -> "ShowStatus";
            case RUN_AGENT -> "RunAgent{cycles=" + cycles + "}";
            case RENDER_HIERO -> "RenderHiero{entity=" + argument + "}";
            case SET_GOAL -> "SetGoal{description=" + argument + "}";
        };
    }
}
