package com.complexityscan.core.metrics;

import com.complexityscan.core.AnalyzerTestBase;
import com.complexityscan.core.model.FileMetrics;
import com.complexityscan.core.model.FunctionRecord;
import com.complexityscan.core.model.ParseStatus;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileAnalyzer}.
 */
class FileAnalyzerTest extends AnalyzerTestBase {

    private static final String SERVICE_PY = """
        class OrderService:
            def place(self, order):
                if order.total > 100 and order.vip:
                    return "priority"
                return "standard"

            def cancel(self, order):
                return None


        def helper():
            pass
        """;

    @Test
    void analyze_pythonModule_recordsEveryFunction() {
        // When
        FileMetrics metrics = analyzer("python")
            .analyze("src/service.py", SERVICE_PY.getBytes(StandardCharsets.UTF_8));

        // Then
        assertThat(metrics.source().status()).isEqualTo(ParseStatus.success());
        assertThat(metrics.source().language()).isEqualTo("python");
        assertThat(metrics.lineCount()).isEqualTo(12);
        assertThat(metrics.classCount()).isEqualTo(1);
        assertThat(metrics.functions())
            .extracting(FunctionRecord::name)
            .containsExactly("OrderService.place", "OrderService.cancel", "helper");
        assertThat(metrics.totalCyclomaticComplexity()).isEqualTo(5);
        assertThat(metrics.maxCyclomaticComplexity()).isEqualTo(3);
    }

    @Test
    void analyze_function_reportsOneBasedLinesAndSize() {
        // When
        FileMetrics metrics = analyzer("python")
            .analyze("src/service.py", SERVICE_PY.getBytes(StandardCharsets.UTF_8));

        // Then
        FunctionRecord place = metrics.functions().get(0);
        assertThat(place.file()).isEqualTo("src/service.py");
        assertThat(place.startLine()).isEqualTo(2);
        assertThat(place.endLine()).isEqualTo(5);
        assertThat(place.lineCount()).isEqualTo(4);
        assertThat(place.parameterCount()).isEqualTo(2);
        assertThat(place.cyclomaticComplexity()).isEqualTo(3);
        assertThat(place.cognitiveComplexity()).isEqualTo(3);
    }

    @Test
    void analyze_invalidUtf8_failsWithoutFunctions() {
        // Given
        byte[] content = {'d', 'e', 'f', ' ', (byte) 0xC3, (byte) 0x28, '(', ')', ':', '\n'};

        // When
        FileMetrics metrics = analyzer("python").analyze("bad.py", content);

        // Then
        assertThat(metrics.source().status().kind()).isEqualTo(ParseStatus.Kind.PARSE_FAILURE);
        assertThat(metrics.source().status().reason()).startsWith("invalid UTF-8");
        assertThat(metrics.functions()).isEmpty();
        assertThat(metrics.totalCyclomaticComplexity()).isZero();
    }

    @Test
    void analyze_emptyFile_succeedsWithNothing() {
        // When
        FileMetrics metrics = analyzer("javascript").analyze("empty.js", new byte[0]);

        // Then
        assertThat(metrics.source().status().isSuccess()).isTrue();
        assertThat(metrics.lineCount()).isZero();
        assertThat(metrics.functions()).isEmpty();
        assertThat(metrics.averageCyclomaticComplexity()).isZero();
    }

    @Test
    void analyze_sameContent_hasSameHash() {
        // Given
        byte[] content = "function f() {}\n".getBytes(StandardCharsets.UTF_8);

        // When
        FileMetrics first = analyzer("javascript").analyze("a.js", content);
        FileMetrics second = analyzer("javascript").analyze("b.js", content);

        // Then
        assertThat(first.source().contentHash())
            .hasSize(64)
            .isEqualTo(second.source().contentHash());
    }

    @Test
    void analyze_typescriptClass_countsMethodsAndArrowFields() {
        // Given
        String source = """
            export class Cart {
              private items: number[] = [];

              total(): number {
                let sum = 0;
                for (const item of this.items) {
                  sum += item;
                }
                return sum;
              }

              clear = (): void => {
                this.items = [];
              };
            }
            """;

        // When
        FileMetrics metrics = analyzer("typescript").analyze("cart.ts", source.getBytes(StandardCharsets.UTF_8));

        // Then
        assertThat(metrics.source().status().isSuccess()).isTrue();
        assertThat(metrics.classCount()).isEqualTo(1);
        assertThat(metrics.functions())
            .extracting(FunctionRecord::name)
            .containsExactly("Cart.total", "Cart.clear");
        assertThat(metrics.functions().get(0).cyclomaticComplexity()).isEqualTo(2);
    }
}
