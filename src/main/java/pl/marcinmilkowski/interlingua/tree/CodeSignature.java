package pl.marcinmilkowski.interlingua.tree;

import pl.marcinmilkowski.interlingua.symbol.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * Declaration of a function, type, trait or impl block.
 *
 * For functions {@code paramsOrFields} holds parameters, for structs fields
 * ({@code "name: Type"}), for enums variants, for traits and impls method names.
 * {@code traits} holds derives for structs and enums and the implemented trait
 * for impls.
 */
public record CodeSignature(
    SignatureKind kind,
    String name,
    String docSummary,
    List<String> paramsOrFields,
    String returnType,
    List<String> traits,
    Double importance
) implements SemanticTree {

    public CodeSignature {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        paramsOrFields = paramsOrFields == null ? List.of() : List.copyOf(paramsOrFields);
        traits = traits == null ? List.of() : List.copyOf(traits);
    }

    public CodeSignature(SignatureKind kind, String name) {
        this(kind, name, null, List.of(), null, List.of(), null);
    }

    @Override
    public Category category() {
        return Category.CODE_SIGNATURE;
    }

    @Override
    public List<SemanticTree> children() {
        return List.of();
    }

    @Override
    public CodeSignature ground(SymbolTable table) {
        return this;
    }
}
