package pl.marcinmilkowski.interlingua.vsa;

import pl.marcinmilkowski.interlingua.symbol.SymbolId;

/**
 * One nearest-neighbour hit: the symbol and its similarity in [0, 1].
 */
public record SearchResult(SymbolId symbol, double similarity) {
}
