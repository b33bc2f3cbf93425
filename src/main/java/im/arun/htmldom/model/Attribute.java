package im.arun.htmldom.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Attribute of an opening tag: a name and the whitespace-separated tokens of its value.
 *
 * <p>Instances are immutable; use {@link #withValues(List)} or {@link #withName(String)} to
 * derive a changed copy and store it with {@link Node#overwriteAttribute(Attribute)}.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Attribute {

    private final String name;

    private final List<String> values;

    private Attribute(String name, List<String> values) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        this.name = name;
        this.values = List.copyOf(values);
    }

    /**
     * Create from a name and a raw value; the value is split on whitespace.
     */
    public static Attribute of(String name, String rawValue) {
        List<String> values = new ArrayList<>();
        if (rawValue != null) {
            for (String token : rawValue.split("\\s+")) {
                if (!token.isEmpty()) {
                    values.add(token);
                }
            }
        }
        return new Attribute(name, values);
    }

    /**
     * Create from a name and already separated value tokens.
     *
     * @throws IllegalArgumentException if a token contains whitespace
     */
    public static Attribute of(String name, List<String> values) {
        checkTokens(values);
        return new Attribute(name, values);
    }

    public Attribute withName(String newName) {
        return new Attribute(newName, values);
    }

    /**
     * Copy of this attribute with its value tokens replaced.
     *
     * @throws IllegalArgumentException if a token contains whitespace
     */
    public Attribute withValues(List<String> newValues) {
        checkTokens(newValues);
        return new Attribute(name, newValues);
    }

    /**
     * All value tokens joined with single spaces. Spacing of the parsed value is not preserved.
     */
    public String valuesToString() {
        return String.join(" ", values);
    }

    public Optional<String> firstValue() {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    /**
     * Whether {@code token} is exactly one of the value tokens.
     */
    public boolean hasValue(String token) {
        return values.contains(token);
    }

    private static void checkTokens(List<String> values) {
        for (String value : values) {
            if (value == null || value.isEmpty() || value.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Attribute value token must be non-empty and "
                    + "contain no whitespace: '" + value + "'");
            }
        }
    }
}
