package com.gridcalc.format;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

/**
 * Resolves format codes such as {@code F2}, {@code C0} or {@code G} to a
 * {@link FormatSpec}.
 *
 * A code is a prefix followed by optional digits; the digits are handed to the
 * prefix's factory, or -1 when absent. Prefixes are case-insensitive. Unknown
 * codes fall back to general. Resolved specs are cached per code.
 */
public final class FormatTable {
    private static final Logger log = LogManager.getLogger(FormatTable.class);

    public static final String GENERAL = "G";

    private final Map<String, IntFunction<FormatSpec>> factories = new ConcurrentHashMap<>();
    private final Map<String, FormatSpec> resolved = new ConcurrentHashMap<>();

    public FormatTable() {
        registerBuiltins();
    }

    private void registerBuiltins() {
        register("G", d -> FormatCodes.general());
        register("H", d -> FormatCodes.hidden());
        register("F", d -> FormatCodes.fixed(digitsOrDefault(d)));
        register("S", d -> FormatCodes.scientific(digitsOrDefault(d)));
        register("C", d -> FormatCodes.currency(digitsOrDefault(d)));
        register(",", d -> FormatCodes.comma(digitsOrDefault(d)));
        register("P", d -> FormatCodes.percent(digitsOrDefault(d)));
        register("+", FormatCodes::bar);
    }

    private static int digitsOrDefault(int digits) {
        return digits < 0 ? FormatCodes.DEFAULT_DIGITS : digits;
    }

    /** Adds or replaces the factory for a prefix. */
    public void register(String prefix, IntFunction<FormatSpec> factory) {
        if (prefix == null || prefix.isEmpty() || Character.isDigit(prefix.charAt(prefix.length() - 1)))
            throw new IllegalArgumentException("Invalid format prefix: " + prefix);
        factories.put(prefix.toUpperCase(Locale.ROOT), factory);
        resolved.clear();
    }

    public boolean contains(String prefix) {
        return prefix != null && factories.containsKey(prefix.toUpperCase(Locale.ROOT));
    }

    public Set<String> prefixes() {
        return factories.keySet();
    }

    /** Upper-cases and trims a code; null or blank becomes general. */
    public static String normalize(String code) {
        if (code == null || code.isBlank())
            return GENERAL;
        return code.trim().toUpperCase(Locale.ROOT);
    }

    public boolean isValid(String code) {
        String c = normalize(code);
        return factories.containsKey(prefixOf(c));
    }

    public FormatSpec resolve(String code) {
        return resolved.computeIfAbsent(normalize(code), this::build);
    }

    private FormatSpec build(String code) {
        String prefix = prefixOf(code);
        IntFunction<FormatSpec> factory = factories.get(prefix);
        if (factory == null) {
            log.debug("Unknown format code '{}', using general", code);
            return FormatCodes.general();
        }
        String digits = code.substring(prefix.length());
        int n = -1;
        if (!digits.isEmpty()) {
            try {
                n = FormatCodes.clampDigits(Integer.parseInt(digits));
            } catch (NumberFormatException e) {
                log.debug("Bad digits in format code '{}', using the default", code);
            }
        }
        return factory.apply(n);
    }

    private static String prefixOf(String code) {
        int end = code.length();
        while (end > 0 && Character.isDigit(code.charAt(end - 1)))
            end--;
        return code.substring(0, end);
    }
}
