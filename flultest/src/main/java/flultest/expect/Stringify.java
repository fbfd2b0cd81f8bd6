package flultest.expect;

import java.util.Arrays;
import java.util.Formattable;
import java.util.Locale;

/**
 * Renders arbitrary values for failure messages.
 *
 * <p>Tries, in order:
 * <ol>
 *   <li>structured formatting: null, character sequences, boxed primitives, enums,
 *       arrays and {@link Formattable} values</li>
 *   <li>the {@code toString()} convention, when a class below {@code Object}
 *       overrides it</li>
 *   <li>the fixed placeholder {@value #NON_PRINTABLE}</li>
 * </ol>
 *
 * <p>Never throws: it runs inside failure reporting.
 */
public final class Stringify {

    public static final String NON_PRINTABLE = "<non-printable>";

    private Stringify() {}

    /**
     * Returns the textual form of a value.
     *
     * @param value any value, may be null
     * @return its text, or {@value #NON_PRINTABLE}
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "null";
        }
        try {
            String structured = structured(value);
            if (structured != null) {
                return structured;
            }
            if (overridesToString(value.getClass())) {
                String s = value.toString();
                return s != null ? s : NON_PRINTABLE;
            }
        } catch (RuntimeException e) {
            return NON_PRINTABLE;
        }
        return NON_PRINTABLE;
    }

    /**
     * Returns a readable name for a type, used as the expected text of
     * {@link ExpectCallable#toThrow(Class)}.
     *
     * <p>Prefers the canonical name and degrades to the binary name for local,
     * anonymous and hidden classes, which have none.
     *
     * @param type the type
     * @return a non-null name
     */
    public static String typeName(Class<?> type) {
        if (type == null) {
            return "null";
        }
        String canonical = type.getCanonicalName();
        return canonical != null ? canonical : type.getName();
    }

    /**
     * Returns the message of a throwable, or its class name when it has none.
     *
     * @param error the throwable
     * @return a non-null description
     */
    public static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getName();
    }

    private static String structured(Object value) {
        if (value instanceof CharSequence || value instanceof Number
                || value instanceof Boolean || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Enum<?>) {
            return ((Enum<?>) value).name();
        }
        if (value instanceof Formattable) {
            return String.format(Locale.ROOT, "%s", value);
        }
        if (value.getClass().isArray()) {
            return array(value);
        }
        return null;
    }

    private static String array(Object value) {
        if (value instanceof Object[]) return Arrays.deepToString((Object[]) value);
        if (value instanceof int[]) return Arrays.toString((int[]) value);
        if (value instanceof long[]) return Arrays.toString((long[]) value);
        if (value instanceof double[]) return Arrays.toString((double[]) value);
        if (value instanceof float[]) return Arrays.toString((float[]) value);
        if (value instanceof boolean[]) return Arrays.toString((boolean[]) value);
        if (value instanceof char[]) return Arrays.toString((char[]) value);
        if (value instanceof byte[]) return Arrays.toString((byte[]) value);
        if (value instanceof short[]) return Arrays.toString((short[]) value);
        return null;
    }

    private static boolean overridesToString(Class<?> type) {
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException | SecurityException e) {
            return false;
        }
    }
}
