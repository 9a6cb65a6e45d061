package com.ledgersync.instrument;

import com.ledgersync.domain.enums.InstrumentType;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure symbol classification helpers. No I/O.
 *
 * <p>Recognised formats:
 * <ul>
 *   <li>Options: OCC symbology, root + YYMMDD + C/P + strike x 1000 padded to 8 digits,
 *       e.g. {@code AAPL240119C00150000}. Padded roots ({@code "SPY   240119P00400000"})
 *       and a leading dot ({@code .SPY240119P00400000}) are accepted.</li>
 *   <li>Futures: leading slash, root + month code + year, e.g. {@code /ESZ4} or {@code /MESH25}.</li>
 *   <li>Anything else is an equity (or crypto pair) whose underlying is itself.</li>
 * </ul>
 */
public final class SymbolClassifier {

    /** Contract multiplier applied to every equity option. */
    public static final int OPTION_MULTIPLIER = 100;

    private static final Pattern OPTION_PATTERN =
            Pattern.compile("^\\.?([A-Z][A-Z0-9.]{0,5})\\s*(\\d{6})([CP])(\\d{8})$");

    private static final Pattern FUTURES_PATTERN = Pattern.compile("^/([A-Z0-9]{1,4}?)([FGHJKMNQUVXZ])(\\d{1,2})$");

    /** Point value per futures root. Unknown roots fall back to 1. */
    private static final Map<String, Integer> FUTURES_CONTRACT_SIZES = Map.ofEntries(
            Map.entry("ES", 50),
            Map.entry("MES", 5),
            Map.entry("NQ", 20),
            Map.entry("MNQ", 2),
            Map.entry("YM", 5),
            Map.entry("MYM", 1),
            Map.entry("RTY", 50),
            Map.entry("M2K", 5),
            Map.entry("CL", 1000),
            Map.entry("MCL", 100),
            Map.entry("NG", 10000),
            Map.entry("GC", 100),
            Map.entry("MGC", 10),
            Map.entry("SI", 5000),
            Map.entry("HG", 25000),
            Map.entry("ZB", 1000),
            Map.entry("ZN", 1000),
            Map.entry("ZF", 1000),
            Map.entry("ZC", 50),
            Map.entry("ZS", 50),
            Map.entry("ZW", 50),
            Map.entry("6E", 125000),
            Map.entry("BTC", 5),
            Map.entry("MBT", 1));

    private SymbolClassifier() {}

    public static boolean isOption(String symbol) {
        return symbol != null && OPTION_PATTERN.matcher(normalize(symbol)).matches();
    }

    public static boolean isFuturesSymbol(String symbol) {
        return symbol != null && FUTURES_PATTERN.matcher(normalize(symbol)).matches();
    }

    public static InstrumentType classify(String symbol) {
        if (isOption(symbol)) {
            return InstrumentType.OPTION;
        }
        if (isFuturesSymbol(symbol)) {
            return InstrumentType.FUTURE;
        }
        return InstrumentType.EQUITY;
    }

    /** Option root for OCC symbols; the symbol itself for futures and equities. */
    public static String extractUnderlying(String symbol) {
        Matcher matcher = OPTION_PATTERN.matcher(normalize(symbol));
        if (matcher.matches()) {
            return matcher.group(1);
        }
        return symbol;
    }

    /** Point value of a futures contract; 1 for unknown roots and non-futures symbols. */
    public static int contractSize(String symbol) {
        Matcher matcher = FUTURES_PATTERN.matcher(normalize(symbol));
        if (!matcher.matches()) {
            return 1;
        }
        return FUTURES_CONTRACT_SIZES.getOrDefault(matcher.group(1), 1);
    }

    /** Factor converting price x quantity into market value: 100 for options, contract size for futures. */
    public static BigDecimal valueMultiplier(String symbol) {
        return switch (classify(symbol)) {
            case OPTION -> BigDecimal.valueOf(OPTION_MULTIPLIER);
            case FUTURE -> BigDecimal.valueOf(contractSize(symbol));
            case EQUITY -> BigDecimal.ONE;
        };
    }

    private static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }
}
