package pl.marcinmilkowski.interlingua.lexer;

import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.interlingua.config.InterlinguaConfig;
import pl.marcinmilkowski.interlingua.error.VsaException;
import pl.marcinmilkowski.interlingua.lexicon.Lexicon;
import pl.marcinmilkowski.interlingua.lexicon.RelationalPattern;
import pl.marcinmilkowski.interlingua.symbol.SymbolId;
import pl.marcinmilkowski.interlingua.symbol.SymbolTable;
import pl.marcinmilkowski.interlingua.vsa.HyperVector;
import pl.marcinmilkowski.interlingua.vsa.HypervectorIndex;
import pl.marcinmilkowski.interlingua.vsa.SearchResult;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Splits prose into tokens and ties them to symbols.
 *
 * Resolution runs in three tiers, each only for tokens the previous tier left open:
 * <ol>
 *   <li>compounds: windows of 4 down to 2 adjacent words looked up as one label</li>
 *   <li>exact: case-insensitive label lookup</li>
 *   <li>fuzzy: nearest neighbour of the token's label vector, accepted above a threshold</li>
 * </ol>
 */
public class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    /** Largest token the whitespace tokenizer accepts; longer words would be split. */
    static final int MAX_TOKEN_LENGTH = 1024 * 1024;

    private static final String STRIP_CHARS = ".,!?;:\"()[]{}«»“”„‘’…،؛؟。、！？「」¿¡";

    private final InterlinguaConfig.LexerSettings settings;

    public Lexer() {
        this(InterlinguaConfig.defaults().lexer());
    }

    public Lexer(InterlinguaConfig.LexerSettings settings) {
        this.settings = settings;
    }

    /**
     * Tokenize without symbol resolution.
     */
    public List<Token> tokenize(String input, Lexicon lexicon) {
        return split(input, lexicon);
    }

    /**
     * Tokenize and resolve.
     *
     * @param table symbol table, or {@code null} to skip resolution
     * @param index vector index, or {@code null} to skip the fuzzy tier
     * @throws VsaException if the nearest-neighbour search fails
     */
    public List<Token> tokenize(String input, SymbolTable table, HypervectorIndex index, Lexicon lexicon)
            throws VsaException {
        List<Token> tokens = split(input, lexicon);
        if (table == null || tokens.isEmpty()) {
            return tokens;
        }
        resolveCompounds(tokens, table);
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.resolution().isResolved() || token.isVoid()) {
                continue;
            }
            Optional<SymbolId> exact = table.lookup(token.normalized());
            if (exact.isPresent()) {
                tokens.set(i, token.withResolution(Resolution.exact(exact.get())));
            } else if (index != null) {
                Resolution fuzzy = resolveFuzzy(token, index);
                if (fuzzy.isResolved()) {
                    tokens.set(i, token.withResolution(fuzzy));
                }
            }
        }
        return tokens;
    }

    private List<Token> split(String input, Lexicon lexicon) {
        List<Token> tokens = new ArrayList<>();
        if (input == null || input.isBlank()) {
            return tokens;
        }
        String text = Normalizer.normalize(input, Normalizer.Form.NFC);
        ByteOffsets offsets = new ByteOffsets(text);

        try (WhitespaceTokenizer tokenizer = new WhitespaceTokenizer(TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY, MAX_TOKEN_LENGTH)) {
            tokenizer.setReader(new StringReader(text));
            CharTermAttribute term = tokenizer.addAttribute(CharTermAttribute.class);
            OffsetAttribute offset = tokenizer.addAttribute(OffsetAttribute.class);
            tokenizer.reset();
            while (tokenizer.incrementToken()) {
                String word = term.toString();
                int lead = 0;
                int trail = word.length();
                while (lead < trail && STRIP_CHARS.indexOf(word.charAt(lead)) >= 0) lead++;
                while (trail > lead && STRIP_CHARS.indexOf(word.charAt(trail - 1)) >= 0) trail--;
                if (lead == trail) {
                    continue;
                }
                String clean = word.substring(lead, trail);
                int start = offset.startOffset() + lead;
                int end = offset.startOffset() + trail;
                tokens.add(new Token(
                    clean,
                    clean.toLowerCase(Locale.ROOT),
                    new Span(offsets.at(start), offsets.at(end)),
                    lexicon.isVoid(clean),
                    Resolution.unresolved()));
            }
            tokenizer.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Tokenizing in-memory text failed", e);
        }
        return tokens;
    }

    /**
     * Greedy longest-match merge of adjacent tokens that together name a symbol.
     */
    private void resolveCompounds(List<Token> tokens, SymbolTable table) {
        int maxWindow = Math.min(settings.compoundMaxWindow(), tokens.size());
        for (int window = maxWindow; window >= settings.compoundMinWindow(); window--) {
            int i = 0;
            while (i + window <= tokens.size()) {
                List<Token> run = tokens.subList(i, i + window);
                if (run.stream().anyMatch(t -> t.resolution().type() == Resolution.Type.COMPOUND)) {
                    i++;
                    continue;
                }
                String compound = String.join(" ", run.stream().map(Token::normalized).toList());
                Optional<SymbolId> id = table.lookup(compound);
                if (id.isPresent()) {
                    Token merged = new Token(
                        String.join(" ", run.stream().map(Token::surface).toList()),
                        compound,
                        new Span(run.get(0).span().start(), run.get(window - 1).span().end()),
                        false,
                        Resolution.compound(id.get(), window));
                    run.clear();
                    tokens.add(i, merged);
                    logger.debug("Merged compound '{}' ({} words)", compound, window);
                }
                i++;
            }
        }
    }

    private Resolution resolveFuzzy(Token token, HypervectorIndex index) throws VsaException {
        if (token.normalized().codePointCount(0, token.normalized().length()) < settings.fuzzyMinChars()) {
            return Resolution.unresolved();
        }
        HyperVector query = index.ops().encodeLabel(token.normalized());
        List<SearchResult> hits = index.search(query, settings.fuzzyK());
        if (!hits.isEmpty() && hits.get(0).similarity() > settings.fuzzyThreshold()) {
            SearchResult best = hits.get(0);
            logger.debug("Fuzzy match '{}' -> {} ({})", token.normalized(), best.symbol(), best.similarity());
            return Resolution.fuzzy(best.symbol(), best.similarity());
        }
        return Resolution.unresolved();
    }

    /**
     * Locate a relational pattern strictly inside the token stream: at least one
     * token must precede it and at least one follow it.
     *
     * @return {@code [subjectEnd, objectStart]} token indices, or empty
     */
    public static Optional<int[]> findRelationalPattern(List<Token> tokens, RelationalPattern pattern) {
        int plen = pattern.length();
        if (tokens.size() < plen + 2) {
            return Optional.empty();
        }
        for (int i = 1; i <= tokens.size() - plen - 1; i++) {
            boolean matches = true;
            for (int j = 0; j < plen; j++) {
                if (!tokens.get(i + j).normalized().equals(pattern.words().get(j))) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                return Optional.of(new int[] {i, i + plen});
            }
        }
        return Optional.empty();
    }

    /**
     * Char index to UTF-8 byte offset, computed in one pass.
     */
    private static final class ByteOffsets {
        private final int[] byCharIndex;

        ByteOffsets(String text) {
            byCharIndex = new int[text.length() + 1];
            int bytes = 0;
            for (int i = 0; i < text.length(); i++) {
                byCharIndex[i] = bytes;
                char c = text.charAt(i);
                if (c < 0x80) {
                    bytes += 1;
                } else if (c < 0x800) {
                    bytes += 2;
                } else if (Character.isHighSurrogate(c)) {
                    bytes += 4;
                } else if (!Character.isLowSurrogate(c)) {
                    bytes += 3;
                }
            }
            byCharIndex[text.length()] = bytes;
        }

        int at(int charIndex) {
            return byCharIndex[charIndex];
        }
    }
}
