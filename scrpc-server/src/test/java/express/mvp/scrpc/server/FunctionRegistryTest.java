package express.mvp.scrpc.server;

import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FunctionRegistry}.
 */
class FunctionRegistryTest {

    private FunctionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new FunctionRegistry();
    }

    public static class Calculator {
        public int add(int a, int b) {
            return a + b;
        }

        public int scale(int value) {
            return value * 2;
        }

        public int scale(int value, int factor) {
            return value * factor;
        }

        public String fail(String message) throws IOException {
            throw new IOException(message);
        }
    }

    public static class Annotated {
        @RemoteMethod
        public String echo(String value) {
            return value;
        }

        @RemoteMethod("upper")
        public String toUpper(String value) {
            return value.toUpperCase();
        }

        public String notExported() {
            return "hidden";
        }
    }

    // ==================== Registration Tests ====================

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Registered function is found by name")
        void registerAndLookup() throws Exception {
            registry.register("add", args -> (Integer) args[0] + (Integer) args[1]);

            assertTrue(registry.contains("add"));
            assertEquals(5, registry.lookup("add").orElseThrow().invoke(2, 3));
            assertTrue(registry.lookup("sub").isEmpty());
        }

        @Test
        @DisplayName("Second registration of a name fails and keeps the first")
        void duplicateName() throws Exception {
            registry.register("f", args -> "first");

            DuplicateFunctionException e = assertThrows(
                    DuplicateFunctionException.class, () -> registry.register("f", args -> "second"));

            assertEquals("The function name f is already taken.", e.getMessage());
            assertEquals("f", e.getFunctionName());
            assertEquals("first", registry.lookup("f").orElseThrow().invoke());
        }

        @Test
        @DisplayName("Empty name is rejected")
        void emptyName() {
            assertThrows(IllegalArgumentException.class, () -> registry.register("", args -> null));
        }

        @Test
        @DisplayName("Names are returned sorted")
        void sortedNames() {
            registry.register("zeta", args -> null);
            registry.register("alpha", args -> null);
            registry.register("alpha_intent", args -> null);

            assertEquals(List.of("alpha", "alpha_intent", "zeta"), List.copyOf(registry.names()));
            assertEquals(3, registry.size());
        }

        @Test
        @DisplayName("Names snapshot cannot be modified")
        void namesUnmodifiable() {
            registry.register("f", args -> null);
            Set<String> names = registry.names();

            assertThrows(UnsupportedOperationException.class, () -> names.add("g"));
        }

        @Test
        @DisplayName("Frozen registry refuses registration")
        void frozen() {
            registry.register("f", args -> null);
            registry.freeze();

            assertTrue(registry.isFrozen());
            IllegalStateException e =
                    assertThrows(IllegalStateException.class, () -> registry.register("g", args -> null));
            assertEquals("Functions must be registered before the server starts", e.getMessage());
            assertTrue(registry.contains("f"));
        }
    }

    // ==================== Reflective Registration Tests ====================

    @Nested
    @DisplayName("Method binding")
    class MethodBinding {

        @Test
        @DisplayName("Public method is registered under its own name")
        void bindsMethod() throws Exception {
            registry.register(new Calculator(), "add");

            assertEquals(7, registry.lookup("add").orElseThrow().invoke(3, 4));
        }

        @Test
        @DisplayName("Exception raised by the method is rethrown unwrapped")
        void unwrapsInvocationTarget() {
            registry.register(new Calculator(), "fail");
            RemoteFunction fail = registry.lookup("fail").orElseThrow();

            IOException e = assertThrows(IOException.class, () -> fail.invoke("disk full"));
            assertEquals("disk full", e.getMessage());
        }

        @Test
        @DisplayName("Wrong argument count surfaces as IllegalArgumentException")
        void wrongArity() {
            registry.register(new Calculator(), "add");
            RemoteFunction add = registry.lookup("add").orElseThrow();

            assertThrows(IllegalArgumentException.class, () -> add.invoke(1));
        }

        @Test
        @DisplayName("Missing and overloaded methods are rejected")
        void badMethods() {
            Calculator calculator = new Calculator();

            assertThrows(IllegalArgumentException.class, () -> registry.register(calculator, "divide"));
            assertThrows(IllegalArgumentException.class, () -> registry.register(calculator, "scale"));
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("Annotated methods are registered, with optional renaming")
        void annotated() throws Exception {
            int registered = registry.registerAnnotated(new Annotated());

            assertEquals(2, registered);
            assertEquals(Set.of("echo", "upper"), registry.names());
            assertEquals("ABC", registry.lookup("upper").orElseThrow().invoke("abc"));
            assertFalse(registry.contains("notExported"));
        }

        @Test
        @DisplayName("Object without annotated methods is rejected")
        void noAnnotatedMethods() {
            assertThrows(IllegalArgumentException.class, () -> registry.registerAnnotated(new Calculator()));
        }
    }
}
