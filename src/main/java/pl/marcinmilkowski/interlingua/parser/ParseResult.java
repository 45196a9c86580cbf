package pl.marcinmilkowski.interlingua.parser;

import pl.marcinmilkowski.interlingua.lexicon.Command;
import pl.marcinmilkowski.interlingua.lexicon.QuestionFrame;
import pl.marcinmilkowski.interlingua.tree.SemanticTree;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of parsing one prose input.
 */
public interface ParseResult {

    /**
     * One or more statements.
     */
    record Facts(List<SemanticTree> trees) implements ParseResult {
        public Facts {
            trees = List.copyOf(trees);
        }
    }

    /**
     * A question about {@code subject}; {@code tree} is the subject as an entity.
     */
    record Query(String subject, SemanticTree tree, QuestionFrame frame) implements ParseResult {
        public Query {
            Objects.requireNonNull(subject, "subject");
            Objects.requireNonNull(tree, "tree");
        }
    }

    record CommandRequest(Command command) implements ParseResult {
        public CommandRequest {
            Objects.requireNonNull(command, "command");
        }
    }

    record Goal(String description) implements ParseResult {
    }

    /**
     * Text with no structured reading, plus any clauses that did parse.
     */
    record Freeform(String text, List<SemanticTree> partial) implements ParseResult {
        public Freeform {
            partial = List.copyOf(partial);
        }
    }
}
