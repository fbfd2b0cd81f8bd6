package demo;

import flultest.FlulTest;
import flultest.registry.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Test binary for the calculator.
 *
 * <h2>Usage:</h2>
 * <pre>
 * java -cp &lt;classpath&gt; demo.DemoMain                 # run everything not excluded by flultest.yml
 * java -cp &lt;classpath&gt; demo.DemoMain --list-verbose  # show tests and tags
 * java -cp &lt;classpath&gt; demo.DemoMain --tag errors    # only error-path tests
 * </pre>
 */
public class DemoMain {

    private static final Logger log = LoggerFactory.getLogger(DemoMain.class);

    public static void main(String[] args) {
        FlulTest.exit(args, buildRegistry());
    }

    static Registry buildRegistry() {
        Registry registry = new Registry();
        CalculatorSuite.register(registry);
        ParsingSuite.register(registry);
        log.info("Registered {} calculator tests", registry.size());
        return registry;
    }
}
