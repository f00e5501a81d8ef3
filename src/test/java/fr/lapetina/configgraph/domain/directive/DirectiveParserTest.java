package fr.lapetina.configgraph.domain.directive;

import fr.lapetina.configgraph.TestTypes;
import fr.lapetina.configgraph.TestTypes.Calculator;
import fr.lapetina.configgraph.TestTypes.Organization;
import fr.lapetina.configgraph.TestTypes.Person;
import fr.lapetina.configgraph.domain.exception.CyclicDependencyException;
import fr.lapetina.configgraph.domain.exception.MissingSectionException;
import fr.lapetina.configgraph.domain.exception.ObjectInstantiationException;
import fr.lapetina.configgraph.domain.graph.InstanceGraphBuilder;
import fr.lapetina.configgraph.domain.graph.RegisteredType;
import fr.lapetina.configgraph.domain.graph.ResolutionContext;
import fr.lapetina.configgraph.domain.model.Settings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectiveParserTest {

    private static final String CONFIG = """
            [bob]
            class_name = Person
            first = Bob
            age = 42

            [alice]
            class_name = Person
            first = Alice
            age = 37

            [limits]
            size = 10
            name = main
            nested = alias: limits:size

            [loops]
            loop_a = alias: loops:loop_b
            loop_b = alias: loops:loop_a

            [calc]
            class_name = Calculator
            scale = 2

            [greeting]
            class_name = Greeting
            who = world
            """;

    private InstanceGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = TestTypes.builder(CONFIG);
    }

    private Object parse(String raw) {
        return builder.getParser().parse(raw, new DirectiveContext(builder, ResolutionContext.root(), "test"));
    }

    @Nested
    @DisplayName("scalars")
    class Scalars {

        @Test
        @DisplayName("should parse integers with sign and width")
        void shouldParseIntegers() {
            assertThat(parse("42")).isEqualTo(42);
            assertThat(parse("-3")).isEqualTo(-3);
            assertThat(parse("+7")).isEqualTo(7);
            assertThat(parse("10000000000")).isEqualTo(10_000_000_000L);
            assertThat(parse("123456789012345678901234567890"))
                    .isEqualTo(new BigInteger("123456789012345678901234567890"));
        }

        @Test
        @DisplayName("should parse reals")
        void shouldParseReals() {
            assertThat(parse("3.14")).isEqualTo(3.14);
            assertThat(parse(".5")).isEqualTo(0.5);
            assertThat(parse("-0.25")).isEqualTo(-0.25);
        }

        @Test
        @DisplayName("should parse booleans and None exactly")
        void shouldParseKeywords() {
            assertThat(parse("True")).isEqualTo(true);
            assertThat(parse("False")).isEqualTo(false);
            assertThat(parse("None")).isNull();
            assertThat(parse("true")).isEqualTo("true");
        }

        @Test
        @DisplayName("should return anything else as a literal")
        void shouldReturnLiteral() {
            assertThat(parse("hello world")).isEqualTo("hello world");
            assertThat(parse("1.2.3")).isEqualTo("1.2.3");
            assertThat(parse("http://example.com")).isEqualTo("http://example.com");
            assertThat(parse("")).isEqualTo("");
        }
    }

    @Nested
    @DisplayName("value directives")
    class ValueDirectives {

        @Test
        @DisplayName("should keep str payloads verbatim")
        void shouldKeepStr() {
            assertThat(parse("str: 42")).isEqualTo("42");
        }

        @Test
        @DisplayName("should split lists without classifying elements")
        void shouldSplitList() {
            assertThat(parse("list: 1, 2, 3")).isEqualTo(List.of("1", "2", "3"));
            assertThat(parse("list:")).isEqualTo(List.of());
        }

        @Test
        @DisplayName("should return an unmodifiable tuple")
        void shouldReturnTuple() {
            @SuppressWarnings("unchecked")
            List<Object> tuple = (List<Object>) parse("tuple: a, b");

            assertThat(tuple).containsExactly("a", "b");
            assertThatThrownBy(() -> tuple.add("c")).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("should parse json payloads")
        void shouldParseJson() {
            Map<String, Object> expected = new LinkedHashMap<>();
            expected.put("a", List.of(1, 2));
            expected.put("b", null);

            assertThat(parse("json: {\"a\": [1, 2], \"b\": null}")).isEqualTo(expected);
            assertThat(parse("json: [1, \"x\", true]")).isEqualTo(List.of(1, "x", true));
        }

        @Test
        @DisplayName("should build paths and expand the home directory")
        void shouldBuildPath() {
            assertThat(parse("path: /tmp/data")).isEqualTo(Path.of("/tmp/data"));
            assertThat(parse("path: ~/data"))
                    .isEqualTo(Path.of(System.getProperty("user.home"), "data"));
        }

        @Test
        @DisplayName("should evaluate expressions with imported modules")
        void shouldEvaluate() {
            assertThat(parse("eval({'import': ['itertools as it']}): list(it.islice(it.count(), 3))"))
                    .isEqualTo(List.of(0, 1, 2));
            assertThat(parse("eval: 2 ** 10")).isEqualTo(1024);
        }

        @Test
        @DisplayName("should evaluate against resolved sections")
        void shouldEvaluateResolved() {
            assertThat(parse("eval({'resolve': {'l': 'limits'}}): l.size * 2")).isEqualTo(20);
        }
    }

    @Nested
    @DisplayName("instantiation directives")
    class InstantiationDirectives {

        @Test
        @DisplayName("should resolve shared instances")
        void shouldResolveInstance() {
            Object bob = parse("instance: bob");

            assertThat(bob).isEqualTo(new Person("Bob", 42)).isSameAs(builder.resolve("bob"));
        }

        @Test
        @DisplayName("should apply param overrides")
        void shouldApplyParams() {
            Object older = parse("instance({'param': {'age': 43}, 'share': 'evict'}): bob");

            assertThat(older).isEqualTo(new Person("Bob", 43));
        }

        @Test
        @DisplayName("should resolve a list of sections")
        void shouldResolveList() {
            assertThat(parse("instance: list: bob, alice"))
                    .isEqualTo(List.of(new Person("Bob", 42), new Person("Alice", 37)));
        }

        @Test
        @DisplayName("should resolve a mapping of sections")
        void shouldResolveMapping() {
            assertThat(parse("instance: json: {\"lead\": \"bob\"}"))
                    .isEqualTo(Map.of("lead", new Person("Bob", 42)));
        }

        @Test
        @DisplayName("should build a fresh object from a type id")
        void shouldBuildObject() {
            Object person = parse("object({'param': {'first': 'Eve', 'age': 30}}): Person");

            assertThat(person).isEqualTo(new Person("Eve", 30));
        }

        @Test
        @DisplayName("should return registered types")
        void shouldReturnClass() {
            assertThat(parse("class: Person")).isInstanceOf(RegisteredType.class)
                    .extracting(t -> ((RegisteredType) t).type()).isEqualTo(Person.class);
        }

        @Test
        @DisplayName("should fail on an unknown class")
        void shouldFailOnUnknownClass() {
            assertThatThrownBy(() -> parse("class: Nope")).isInstanceOf(MissingSectionException.class);
        }

        @Test
        @DisplayName("should return an untyped section as a map")
        void shouldReturnAsDict() {
            Object dict = parse("asdict: limits");

            assertThat(dict).isInstanceOf(Map.class);
            assertThat(((Map<?, ?>) dict).get("size")).isEqualTo(10);
        }

        @Test
        @DisplayName("should refuse asdict on a typed section")
        void shouldRefuseAsDictOnTyped() {
            assertThatThrownBy(() -> parse("asdict: bob")).isInstanceOf(ObjectInstantiationException.class);
        }

        @Test
        @DisplayName("should bind a section onto a record type")
        void shouldBindDataclass() {
            InstanceGraphBuilder graph = TestTypes.builder("""
                    [org]
                    title = ACME
                    leader = instance: bob

                    [bob]
                    class_name = Person
                    first = Bob
                    age = 42
                    """);

            Object org = graph.getParser().parse("dataclass(Organization): org",
                    new DirectiveContext(graph, ResolutionContext.root(), "test"));

            assertThat(org).isEqualTo(new Organization("ACME", new Person("Bob", 42)));
        }

        @Test
        @DisplayName("should fail a dataclass with a missing field")
        void shouldFailDataclassMissingField() {
            assertThatThrownBy(() -> parse("dataclass(Person): limits"))
                    .isInstanceOf(ObjectInstantiationException.class)
                    .hasMessageContaining("Missing required field 'first'");
        }
    }

    @Nested
    @DisplayName("reference directives")
    class ReferenceDirectives {

        @Test
        @DisplayName("should follow an alias to a typed value")
        void shouldFollowAlias() {
            assertThat(parse("alias: limits:size")).isEqualTo(10);
            assertThat(parse("alias: limits:nested")).isEqualTo(10);
        }

        @Test
        @DisplayName("should detect alias cycles")
        void shouldDetectAliasCycle() {
            assertThatThrownBy(() -> parse("alias: loops:loop_a"))
                    .isInstanceOf(CyclicDependencyException.class)
                    .hasMessageContaining("Alias cycle");
        }

        @Test
        @DisplayName("should fail on an alias to a missing option")
        void shouldFailOnMissingAliasTarget() {
            assertThatThrownBy(() -> parse("alias: limits:nope")).isInstanceOf(MissingSectionException.class);
        }

        @Test
        @DisplayName("should call a method with keyword arguments")
        void shouldCallMethod() {
            assertThat(parse("call({'method': 'add', 'a': 1, 'b': 2}): calc")).isEqualTo(6);
        }

        @Test
        @DisplayName("should read an attribute")
        void shouldReadAttribute() {
            assertThat(parse("call({'attribute': 'scale'}): calc")).isEqualTo(2);
            assertThat(parse("call({'attribute': 'name'}): limits")).isEqualTo("main");
        }

        @Test
        @DisplayName("should call a supplier")
        void shouldCallSupplier() {
            assertThat(parse("call: greeting")).isEqualTo("hello world");
        }

        @Test
        @DisplayName("should wrap call failures")
        void shouldWrapCallFailure() {
            assertThatThrownBy(() -> parse("call({'method': 'divide'}): calc"))
                    .isInstanceOf(ObjectInstantiationException.class)
                    .hasMessageContaining("divide");
        }

        @Test
        @DisplayName("should build from a nested tree node")
        void shouldBuildTree() {
            Object settings = parse("tree({'param': {'extra': 1}}): limits");

            assertThat(settings).isInstanceOf(Settings.class);
            assertThat(((Settings) settings).get("size")).isEqualTo(10);
            assertThat(((Settings) settings).get("extra")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("malformed directives")
    class Malformed {

        @Test
        @DisplayName("should fall back to the literal on unknown parameters")
        void shouldFallBackOnUnknownParams() {
            String raw = "instance({'bogus': 1}): bob";

            assertThat(parse(raw)).isEqualTo(raw);
        }

        @Test
        @DisplayName("should fall back to the literal on invalid parameter JSON")
        void shouldFallBackOnInvalidJson() {
            String raw = "instance({share: }): bob";

            assertThat(parse(raw)).isEqualTo(raw);
        }

        @Test
        @DisplayName("should fall back to the literal on unbalanced parameters")
        void shouldFallBackOnUnbalanced() {
            String raw = "instance({'share': 'deep'}: bob";

            assertThat(parse(raw)).isEqualTo(raw);
        }

        @Test
        @DisplayName("should fall back to the literal on an unknown share type")
        void shouldFallBackOnUnknownShare() {
            String raw = "instance({'share': 'sometimes'}): bob";

            assertThat(parse(raw)).isEqualTo(raw);
        }

        @Test
        @DisplayName("should fall back to the literal on invalid json")
        void shouldFallBackOnInvalidJsonPayload() {
            assertThat(parse("json: {oops")).isEqualTo("json: {oops");
        }
    }
}
