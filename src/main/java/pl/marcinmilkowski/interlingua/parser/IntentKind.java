package pl.marcinmilkowski.interlingua.parser;

public enum IntentKind {
    EMPTY,
    COMMAND,
    GOAL,
    QUESTION,
    STATEMENT
}
