package com.complexityscan.core.metrics;

import com.complexityscan.core.AnalyzerTestBase;
import com.complexityscan.core.normalize.NodeClassifier;
import com.complexityscan.core.parser.ParseOutcome;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FunctionLocator}.
 */
class FunctionLocatorTest extends AnalyzerTestBase {

    @Test
    void qualifiedName_pythonMethod_isPrefixedWithClass() {
        // Given
        NodeClassifier classifier = classifier("python");
        ParseOutcome outcome = parse("python", """
            class Greeter:
                def hello(self, name):
                    return "hi " + name
            """);
        FunctionLocator locator = new FunctionLocator(classifier);

        // When
        TSNode method = firstFunction(outcome, classifier);

        // Then
        assertThat(locator.qualifiedName(method, outcome)).isEqualTo("Greeter.hello");
        assertThat(locator.parameterCount(method)).isEqualTo(2);
    }

    @Test
    void qualifiedName_pythonLambda_usesAssignedName() {
        // Given
        NodeClassifier classifier = classifier("python");
        ParseOutcome outcome = parse("python", "square = lambda x: x * x\n");
        FunctionLocator locator = new FunctionLocator(classifier);

        // When
        TSNode lambda = firstFunction(outcome, classifier);

        // Then
        assertThat(locator.qualifiedName(lambda, outcome)).isEqualTo("square");
        assertThat(locator.parameterCount(lambda)).isEqualTo(1);
    }

    @Test
    void qualifiedName_javascriptArrowFunction_usesVariableName() {
        // Given
        NodeClassifier classifier = classifier("javascript");
        ParseOutcome outcome = parse("javascript", "const handler = (req, res) => res.send(req.body);\n");
        FunctionLocator locator = new FunctionLocator(classifier);

        // When
        TSNode arrow = firstFunction(outcome, classifier);

        // Then
        assertThat(locator.qualifiedName(arrow, outcome)).isEqualTo("handler");
        assertThat(locator.parameterCount(arrow)).isEqualTo(2);
    }

    @Test
    void parameterCount_javascriptBareParameter_countsOne() {
        // Given
        NodeClassifier classifier = classifier("javascript");
        ParseOutcome outcome = parse("javascript", "const inc = x => x + 1;\n");
        FunctionLocator locator = new FunctionLocator(classifier);

        // When
        TSNode arrow = firstFunction(outcome, classifier);

        // Then
        assertThat(locator.parameterCount(arrow)).isEqualTo(1);
    }

    @Test
    void qualifiedName_anonymousCallback_isAnonymous() {
        // Given
        NodeClassifier classifier = classifier("javascript");
        ParseOutcome outcome = parse("javascript", "setTimeout(function () { run(); }, 10);\n");
        FunctionLocator locator = new FunctionLocator(classifier);

        // When
        TSNode callback = firstFunction(outcome, classifier);

        // Then
        assertThat(locator.qualifiedName(callback, outcome)).isEqualTo("<anonymous>");
        assertThat(locator.parameterCount(callback)).isZero();
    }

    @Test
    void qualifiedName_goMethod_isPrefixedWithReceiverType() {
        // Given
        NodeClassifier classifier = classifier("go");
        ParseOutcome outcome = parse("go", """
            package server

            func (s *Server) Handle(a, b int, name string) error {
            \treturn nil
            }
            """);
        FunctionLocator locator = new FunctionLocator(classifier);

        // When
        TSNode method = firstFunction(outcome, classifier);

        // Then
        assertThat(locator.qualifiedName(method, outcome)).isEqualTo("Server.Handle");
        assertThat(locator.parameterCount(method)).isEqualTo(3);
    }

    @Test
    void qualifiedName_rustImplMethod_isPrefixedWithImplType() {
        // Given
        NodeClassifier classifier = classifier("rust");
        ParseOutcome outcome = parse("rust", """
            struct Point { x: f64, y: f64 }

            impl Point {
                fn dist(&self, other: &Point) -> f64 {
                    (self.x - other.x).abs()
                }
            }
            """);
        FunctionLocator locator = new FunctionLocator(classifier);

        // When
        TSNode method = firstFunction(outcome, classifier);

        // Then
        assertThat(locator.qualifiedName(method, outcome)).isEqualTo("Point.dist");
        assertThat(locator.parameterCount(method)).isEqualTo(2);
    }

    @Test
    void qualifiedName_javaNestedClasses_joinsContainers() {
        // Given
        NodeClassifier classifier = classifier("java");
        ParseOutcome outcome = parse("java", """
            class Outer {
                static class Inner<T> {
                    int add(int a, int b) { return a + b; }
                }
            }
            """);
        FunctionLocator locator = new FunctionLocator(classifier);

        // When
        List<TSNode> found = functions(outcome, classifier);

        // Then
        assertThat(found).hasSize(1);
        assertThat(locator.qualifiedName(found.get(0), outcome)).isEqualTo("Outer.Inner.add");
        assertThat(locator.parameterCount(found.get(0))).isEqualTo(2);
    }

    @Test
    void cleanName_stripsQuotesAndRejectsExpressions() {
        assertThat(FunctionLocator.cleanName("'onClick'")).isEqualTo("onClick");
        assertThat(FunctionLocator.cleanName("  run ")).isEqualTo("run");
        assertThat(FunctionLocator.cleanName("a + b")).isEmpty();
        assertThat(FunctionLocator.cleanName("")).isEmpty();
    }
}
