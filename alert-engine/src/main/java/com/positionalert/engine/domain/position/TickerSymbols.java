package com.positionalert.engine.domain.position;

import java.util.Locale;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class TickerSymbols {

    /** Prefix marking an index rather than an equity, e.g. {@code $SPX}. */
    public static final String INDEX_MARKER = "$";

    /**
     * Trims, upper-cases and swaps the broker share-class separator {@code /} for the
     * provider's {@code .} ({@code brk/b} becomes {@code BRK.B}).
     *
     * @return the normalised ticker, or an empty string when nothing is left
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().replace('/', '.').toUpperCase(Locale.ROOT);
    }

    public static boolean isIndex(String ticker) {
        return ticker.startsWith(INDEX_MARKER) && ticker.length() > INDEX_MARKER.length();
    }
}
