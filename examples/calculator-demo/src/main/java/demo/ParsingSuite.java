package demo;

import flultest.registry.Registry;
import flultest.suite.Suite;

import static flultest.expect.Expect.expect;
import static flultest.expect.Expect.expectCallable;

/**
 * Input parsing tests, registered one by one. {@code knownBroken} fails on purpose and is
 * excluded by the bundled {@code flultest.yml}.
 */
public class ParsingSuite extends Suite {

    private final Calculator calculator = new Calculator();

    public static void register(Registry registry) {
        registry.add("ParsingSuite", "parsesPlainNumbers", ParsingSuite::new, ParsingSuite::parsesPlainNumbers, "fast");
        registry.add("ParsingSuite", "trimsWhitespace", ParsingSuite::new, ParsingSuite::trimsWhitespace, "fast");
        registry.add("ParsingSuite", "rejectsGarbage", ParsingSuite::new, ParsingSuite::rejectsGarbage, "errors");
        registry.add("ParsingSuite", "knownBroken", ParsingSuite::new, ParsingSuite::knownBroken, "broken");
    }

    void parsesPlainNumbers() {
        expect(calculator.parse("42")).toEqual(42L).toNotEqual(24L);
    }

    void trimsWhitespace() {
        expect(calculator.parse("  -7 \n")).toEqual(-7L);
    }

    void rejectsGarbage() {
        expectCallable(() -> calculator.parse("forty-two")).toThrow(NumberFormatException.class);
        expectCallable(() -> calculator.parse(null)).toThrow(IllegalArgumentException.class);
    }

    void knownBroken() {
        // hex input is not supported yet
        calculator.parse("0x2A");
    }
}
