package flultest.suite;

/**
 * Base class of every test suite.
 *
 * <p>A suite groups tests that share a fixture. The runner never reuses an instance:
 * each test gets a freshly constructed suite, then {@link #setUp()}, the test body and
 * {@link #tearDown()} run on it, in that order. {@code tearDown} runs even when the
 * body or {@code setUp} fails.
 *
 * <h2>Example:</h2>
 * <pre>
 * public class StackSuite extends Suite {
 *     private Deque&lt;Integer&gt; stack;
 *
 *     {@literal @}Override
 *     public void setUp() {
 *         stack = new ArrayDeque&lt;&gt;();
 *     }
 *
 *     public void pushThenPop() {
 *         stack.push(1);
 *         expect(stack.pop()).toEqual(1);
 *     }
 *
 *     public static void register(Registry registry) {
 *         registry.suite("StackSuite", StackSuite::new)
 *                 .test("pushThenPop", StackSuite::pushThenPop)
 *                 .register();
 *     }
 * }
 * </pre>
 *
 * @see FixtureInvocation
 */
public abstract class Suite {

    protected Suite() {}

    /**
     * Prepares the fixture. Runs before each test on a fresh instance.
     *
     * @throws Exception if the fixture cannot be prepared; the test then fails
     */
    public void setUp() throws Exception {}

    /**
     * Releases the fixture. Runs after each test, whether or not it passed.
     *
     * @throws Exception if the fixture cannot be released
     */
    public void tearDown() throws Exception {}
}
