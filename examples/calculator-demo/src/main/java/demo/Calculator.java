package demo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Integer calculator with a running memory. The code under test of the demo.
 */
public class Calculator {

    private long memory;
    private final List<String> history = new ArrayList<>();

    public long add(long a, long b) {
        return record("add", Math.addExact(a, b));
    }

    public long subtract(long a, long b) {
        return record("subtract", Math.subtractExact(a, b));
    }

    public long multiply(long a, long b) {
        return record("multiply", Math.multiplyExact(a, b));
    }

    /**
     * Integer division.
     *
     * @throws ArithmeticException if {@code divisor} is zero
     */
    public long divide(long dividend, long divisor) {
        if (divisor == 0) {
            throw new ArithmeticException("division by zero");
        }
        return record("divide", dividend / divisor);
    }

    /**
     * Parses a decimal integer, ignoring surrounding whitespace.
     *
     * @throws NumberFormatException if {@code text} is not an integer
     */
    public long parse(String text) {
        if (text == null) {
            throw new NumberFormatException("null input");
        }
        return Long.parseLong(text.trim());
    }

    public void store(long value) {
        memory = value;
    }

    public long recall() {
        return memory;
    }

    public void clear() {
        memory = 0;
        history.clear();
    }

    public List<String> history() {
        return Collections.unmodifiableList(history);
    }

    private long record(String op, long result) {
        history.add(op + "=" + result);
        return result;
    }
}
