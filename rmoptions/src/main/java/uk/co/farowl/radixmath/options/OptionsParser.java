// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.options;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for option strings of the form {@code key=value;key=value}.
 * Keys are compared without regard to (ASCII) case, and where a key is
 * repeated the last value given wins. A token without {@code =} is
 * ignored, as are empty tokens.
 */
public final class OptionsParser {

    /** Logger for option parsing. */
    static final Logger logger = LoggerFactory.getLogger(OptionsParser.class);

    private final Map<String, String> values = new HashMap<>();

    /**
     * Parse an option string.
     *
     * @param options to parse
     */
    public OptionsParser(String options) {
        Objects.requireNonNull(options, "options");
        for (String token : options.split(";", -1)) {
            int eq = token.indexOf('=');
            if (eq < 0) {
                if (!token.isEmpty()) {
                    logger.atDebug().setMessage("ignoring option token '{}'")
                            .addArgument(token).log();
                }
            } else {
                values.put(lower(token.substring(0, eq)),
                        token.substring(eq + 1));
            }
        }
    }

    /**
     * Lower case in ASCII only: {@code 'A'} to {@code 'Z'} are folded and
     * every other character is kept as it is.
     *
     * @param s to fold
     * @return {@code s} with ASCII upper case letters made lower case
     */
    static String lower(String s) {
        StringBuilder b = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                if (b == null) { b = new StringBuilder(s); }
                b.setCharAt(i, (char)(c + ('a' - 'A')));
            }
        }
        return b == null ? s : b.toString();
    }

    /**
     * @param key option name (any case)
     * @return whether the option was given
     */
    public boolean has(String key) { return values.containsKey(lower(key)); }

    /**
     * The value given for an option, exactly as written.
     *
     * @param key option name (any case)
     * @param defaultValue if the option was not given
     * @return the value
     */
    public String getString(String key, String defaultValue) {
        return values.getOrDefault(lower(key), defaultValue);
    }

    /**
     * The value given for an option, in lower case.
     *
     * @param key option name (any case)
     * @param defaultValue if the option was not given
     * @return the value
     */
    public String getLowerCaseString(String key, String defaultValue) {
        String v = values.get(lower(key));
        return v == null ? defaultValue : lower(v);
    }

    /**
     * A boolean option. The values {@code 1}, {@code true}, {@code yes}
     * and {@code on}, in any case, are true, and any other value given
     * is false.
     *
     * @param key option name (any case)
     * @param defaultValue if the option was not given
     * @return the value
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        String v = getLowerCaseString(key, null);
        if (v == null) { return defaultValue; }
        switch (v) {
            case "1":
            case "true":
            case "yes":
            case "on":
                return true;
            default:
                return false;
        }
    }
}
