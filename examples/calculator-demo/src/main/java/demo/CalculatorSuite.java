package demo;

import flultest.registry.Registry;
import flultest.suite.Suite;

import static flultest.expect.Expect.expect;
import static flultest.expect.Expect.expectCallable;

/**
 * Arithmetic tests. Each test gets its own {@link Calculator} seeded with 10 in memory.
 */
public class CalculatorSuite extends Suite {

    private Calculator calculator;

    @Override
    public void setUp() {
        calculator = new Calculator();
        calculator.store(10);
    }

    @Override
    public void tearDown() {
        calculator.clear();
    }

    public static void register(Registry registry) {
        registry.suite("CalculatorSuite", CalculatorSuite::new)
                .tags("arithmetic")
                .test("addsNumbers", CalculatorSuite::addsNumbers, "fast")
                .test("subtractsNumbers", CalculatorSuite::subtractsNumbers, "fast")
                .test("multipliesNumbers", CalculatorSuite::multipliesNumbers, "fast")
                .test("dividesNumbers", CalculatorSuite::dividesNumbers, "fast")
                .test("rejectsDivisionByZero", CalculatorSuite::rejectsDivisionByZero, "fast", "errors")
                .test("detectsOverflow", CalculatorSuite::detectsOverflow, "errors")
                .test("memoryStartsSeeded", CalculatorSuite::memoryStartsSeeded)
                .test("memoryIsNotShared", CalculatorSuite::memoryIsNotShared)
                .register();
    }

    void addsNumbers() {
        expect(calculator.add(2, 3)).toEqual(5L).toBeGreaterThan(4L);
    }

    void subtractsNumbers() {
        expect(calculator.subtract(2, 3)).toEqual(-1L).toBeLessThan(0L);
    }

    void multipliesNumbers() {
        expect(calculator.multiply(6, 7)).toEqual(42L);
        expect(calculator.history().size()).toEqual(1);
    }

    void dividesNumbers() {
        expect(calculator.divide(7, 2)).toEqual(3L);
    }

    void rejectsDivisionByZero() {
        ArithmeticException e = expectCallable(() -> calculator.divide(1, 0)).toThrow(ArithmeticException.class);
        expect(e.getMessage()).toEqual("division by zero");
        expectCallable(() -> calculator.divide(1, 1)).toNotThrow();
    }

    void detectsOverflow() {
        expectCallable(() -> calculator.add(Long.MAX_VALUE, 1)).toThrow(ArithmeticException.class);
    }

    void memoryStartsSeeded() {
        expect(calculator.recall()).toEqual(10L);
        calculator.store(99);
    }

    void memoryIsNotShared() {
        expect(calculator.recall()).toEqual(10L);
        expect(calculator.history().isEmpty()).toBeTrue();
    }
}
