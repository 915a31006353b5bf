// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.radixmath.options;

/**
 * Options controlling the reading and writing of JSON, given as an
 * option string such as
 * {@code "allowduplicatekeys=true;numberconversion=double"}. Unknown
 * keys are ignored.
 */
public final class JsonOptions {

    /**
     * The default options. These differ from the parse of an empty
     * option string in that base64 text is not padded.
     */
    public static final JsonOptions DEFAULT =
            new JsonOptions(false, false, false, NumberConversion.FULL);

    private final boolean allowDuplicateKeys;
    private final boolean base64Padding;
    private final boolean replaceSurrogates;
    private final NumberConversion numberConversion;

    /**
     * Parse an option string. The keys are {@code allowduplicatekeys}
     * (default false), {@code base64padding} (default true),
     * {@code replacesurrogates} (default false) and
     * {@code numberconversion} (default {@code full}).
     *
     * @param options option string
     * @throws NullPointerException if {@code options} is {@code null}
     */
    public JsonOptions(String options) {
        OptionsParser parser = new OptionsParser(options);
        this.allowDuplicateKeys =
                parser.getBoolean("allowduplicatekeys", false);
        this.base64Padding = parser.getBoolean("base64padding", true);
        this.replaceSurrogates =
                parser.getBoolean("replacesurrogates", false);
        this.numberConversion = NumberConversion.fromOptionName(
                parser.getLowerCaseString("numberconversion", null));
    }

    private JsonOptions(boolean allowDuplicateKeys, boolean base64Padding,
            boolean replaceSurrogates, NumberConversion numberConversion) {
        this.allowDuplicateKeys = allowDuplicateKeys;
        this.base64Padding = base64Padding;
        this.replaceSurrogates = replaceSurrogates;
        this.numberConversion = numberConversion;
    }

    /** @return whether a repeated key in an object is accepted */
    public boolean isAllowDuplicateKeys() { return allowDuplicateKeys; }

    /** @return whether base64 text is padded */
    public boolean isBase64Padding() { return base64Padding; }

    /** @return whether unpaired surrogates are replaced */
    public boolean isReplaceSurrogates() { return replaceSurrogates; }

    /** @return how numbers are converted */
    public NumberConversion getNumberConversion() { return numberConversion; }

    /**
     * The options as an option string, from which an equal set of
     * options may be parsed.
     */
    @Override
    public String toString() {
        return new StringBuilder() //
                .append("base64padding=").append(base64Padding)
                .append(";replacesurrogates=").append(replaceSurrogates)
                .append(";numberconversion=")
                .append(numberConversion.optionName)
                .append(";allowduplicatekeys=").append(allowDuplicateKeys)
                .toString();
    }
}
