package flultest.expect;

import java.util.Objects;

/**
 * Call-site coordinates of an expectation or of a runner catch site.
 *
 * <p>Captured automatically with {@link StackWalker}: {@link #current()} returns the
 * first frame that does not belong to the expectation DSL itself, so user code never
 * has to pass a location explicitly.
 *
 * @see AssertionFailure
 */
public final class SourceLocation {

    private static final StackWalker WALKER =
            StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    /** Location used when no stack frame is available. */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, "<unknown>", "<unknown>");

    private final String fileName;
    private final int lineNumber;
    private final String className;
    private final String methodName;

    /**
     * Creates a location.
     *
     * @param fileName source file name, or null if unknown
     * @param lineNumber line number, 0 or negative if unknown
     * @param className fully qualified class name
     * @param methodName method name
     */
    public SourceLocation(String fileName, int lineNumber, String className, String methodName) {
        this.fileName = fileName != null ? fileName : "<unknown>";
        this.lineNumber = Math.max(lineNumber, 0);
        this.className = Objects.requireNonNull(className, "className");
        this.methodName = Objects.requireNonNull(methodName, "methodName");
    }

    /**
     * Returns the location of the nearest caller outside the expectation classes.
     *
     * @return the caller location, or {@link #UNKNOWN} if the stack has no such frame
     */
    public static SourceLocation current() {
        return WALKER.walk(frames -> frames
                .filter(f -> !isDslFrame(f.getDeclaringClass()))
                .findFirst()
                .map(f -> new SourceLocation(f.getFileName(), f.getLineNumber(),
                        f.getClassName(), f.getMethodName()))
                .orElse(UNKNOWN));
    }

    private static boolean isDslFrame(Class<?> type) {
        return type == SourceLocation.class
                || type == Expect.class
                || type == ExpectCallable.class
                || AbstractExpect.class.isAssignableFrom(type);
    }

    public String fileName() { return fileName; }

    public int lineNumber() { return lineNumber; }

    public String className() { return className; }

    public String methodName() { return methodName; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return lineNumber == that.lineNumber
                && fileName.equals(that.fileName)
                && className.equals(that.className)
                && methodName.equals(that.methodName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, lineNumber, className, methodName);
    }

    /** Returns {@code file:line}, the prefix used in failure messages. */
    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
