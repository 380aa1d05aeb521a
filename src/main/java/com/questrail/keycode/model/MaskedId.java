package com.questrail.keycode.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Textual {@code WRAPPER(INNER)} split into its two parts.
 *
 * <p>{@code LT3(KC_A)} parses to wrapper {@code LT3} and inner {@code KC_A}.
 * The inner part is taken verbatim and may itself contain parentheses.</p>
 */
public record MaskedId(String wrapper, String inner)
{
    /** Placeholder inner text used by masked templates such as {@code LSFT(kc)}. */
    public static final String TEMPLATE_ARGUMENT = "kc";

    private static final String TEMPLATE_SUFFIX = "(" + TEMPLATE_ARGUMENT + ")";

    public MaskedId {
        Objects.requireNonNull(wrapper, "wrapper");
        Objects.requireNonNull(inner, "inner");
    }

    public static MaskedId of(String wrapper, String inner) {
        return new MaskedId(wrapper, inner);
    }

    /**
     * @return the split text, or empty when {@code text} has no opening
     *         parenthesis or does not end with a closing one
     */
    public static Optional<MaskedId> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int open = text.indexOf('(');
        if (open < 0 || !text.endsWith(")")) {
            return Optional.empty();
        }
        return Optional.of(new MaskedId(text.substring(0, open), text.substring(open + 1, text.length() - 1)));
    }

    /**
     * Lookup key for a descriptor id: masked templates lose their
     * {@code (kc)} suffix, everything else is returned unchanged.
     */
    public static String lookupKey(String id) {
        return id.endsWith(TEMPLATE_SUFFIX) ? id.substring(0, id.length() - TEMPLATE_SUFFIX.length()) : id;
    }

    public boolean isTemplate() {
        return TEMPLATE_ARGUMENT.equals(inner);
    }

    public String template() {
        return wrapper + TEMPLATE_SUFFIX;
    }

    public String render() {
        return wrapper + "(" + inner + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
