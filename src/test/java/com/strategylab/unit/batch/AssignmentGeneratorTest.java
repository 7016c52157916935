package com.strategylab.unit.batch;

import static org.assertj.core.api.Assertions.assertThat;

import com.strategylab.batch.AssignmentBatch;
import com.strategylab.batch.AssignmentGenerator;
import com.strategylab.domain.model.VariableDetail;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AssignmentGenerator covering enumeration order, the cap and truncation
 * flag, empty inputs and the display total.
 */
class AssignmentGeneratorTest {

    private AssignmentGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new AssignmentGenerator();
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("single variable yields one assignment per value, in order")
        void singleVariable() {
            List<VariableDetail> detail = List.of(VariableDetail.of("rsi_period", List.of("10", "14", "20")));

            AssignmentBatch batch = generator.generate(detail, 10_000);

            assertThat(batch.getAssignments()).containsExactly(
                    Map.of("rsi_period", "10"), Map.of("rsi_period", "14"), Map.of("rsi_period", "20"));
            assertThat(batch.isTruncated()).isFalse();
            assertThat(generator.estimateTotal(detail)).isEqualTo(3);
        }

        @Test
        @DisplayName("cap below the product truncates; the last variable varies fastest")
        void capTruncates() {
            List<VariableDetail> detail = List.of(
                    VariableDetail.of("a", List.of("1", "2")), VariableDetail.of("b", List.of("x", "y")));

            AssignmentBatch batch = generator.generate(detail, 3);

            assertThat(batch.getAssignments()).containsExactly(
                    Map.of("a", "1", "b", "x"), Map.of("a", "1", "b", "y"), Map.of("a", "2", "b", "x"));
            assertThat(batch.isTruncated()).isTrue();
            assertThat(generator.estimateTotal(detail)).isEqualTo(4);
        }

        @Test
        @DisplayName("cap equal to the product is not a truncation")
        void capEqualToProduct() {
            List<VariableDetail> detail = List.of(
                    VariableDetail.of("a", List.of("1", "2")), VariableDetail.of("b", List.of("x", "y")));

            AssignmentBatch batch = generator.generate(detail, 4);

            assertThat(batch.size()).isEqualTo(4);
            assertThat(batch.isTruncated()).isFalse();
        }

        @Test
        @DisplayName("keys of every assignment follow detail order")
        void keyOrder() {
            List<VariableDetail> detail = List.of(
                    VariableDetail.of("z", List.of("1")), VariableDetail.of("a", List.of("2")));

            AssignmentBatch batch = generator.generate(detail, 10);

            assertThat(batch.getAssignments().get(0).keySet()).containsExactly("z", "a");
        }

        @Test
        @DisplayName("an empty values list empties the whole product")
        void emptyValuesList() {
            List<VariableDetail> detail = List.of(
                    VariableDetail.of("a", List.of("1", "2")), VariableDetail.of("b", List.of()));

            AssignmentBatch batch = generator.generate(detail, 100);

            assertThat(batch.getAssignments()).isEmpty();
            assertThat(batch.isTruncated()).isFalse();
            assertThat(generator.estimateTotal(detail)).isEqualTo(2);
        }

        @Test
        @DisplayName("no variables or a non-positive cap yield nothing")
        void degenerateInputs() {
            assertThat(generator.generate(List.of(), 10).getAssignments()).isEmpty();
            assertThat(generator.generate(List.of(VariableDetail.of("a", List.of("1"))), 0).getAssignments())
                    .isEmpty();
        }

        @Test
        @DisplayName("a non-positive cap over a non-empty product is reported as truncated")
        void nonPositiveCapTruncates() {
            List<VariableDetail> detail = List.of(VariableDetail.of("a", List.of("1", "2")));

            AssignmentBatch zero = generator.generate(detail, 0);
            AssignmentBatch negative = generator.generate(detail, -5);

            assertThat(zero.getAssignments()).isEmpty();
            assertThat(zero.isTruncated()).isTrue();
            assertThat(negative.isTruncated()).isTrue();
            assertThat(generator.generate(List.of(), 0).isTruncated()).isFalse();
        }

        @Test
        @DisplayName("identical inputs produce identical output")
        void deterministic() {
            List<VariableDetail> detail = List.of(
                    VariableDetail.of("a", List.of("1", "2", "3")), VariableDetail.of("b", List.of("x", "y")));

            assertThat(generator.generate(detail, 5)).isEqualTo(generator.generate(detail, 5));
        }

        @Test
        @DisplayName("a product far beyond the cap stops early")
        void hugeProductStopsAtCap() {
            List<String> hundred = IntStream.range(0, 100).mapToObj(String::valueOf).collect(Collectors.toList());
            List<VariableDetail> named = IntStream.range(0, 6)
                    .mapToObj(i -> VariableDetail.of("v" + i, hundred))
                    .collect(Collectors.toList());

            AssignmentBatch batch = generator.generate(named, 10_000);

            assertThat(batch.size()).isEqualTo(10_000);
            assertThat(batch.isTruncated()).isTrue();
            assertThat(generator.productSize(named)).isEqualTo(BigInteger.TEN.pow(12));
        }
    }

    @Test
    @DisplayName("estimateTotal is zero without variables and saturates on overflow")
    void estimateTotalBounds() {
        assertThat(generator.estimateTotal(List.of())).isZero();

        List<String> thousand = IntStream.range(0, 1000).mapToObj(String::valueOf).collect(Collectors.toList());
        List<VariableDetail> detail = IntStream.range(0, 8)
                .mapToObj(i -> VariableDetail.of("v" + i, thousand))
                .collect(Collectors.toList());

        assertThat(generator.estimateTotal(detail)).isEqualTo(Long.MAX_VALUE);
    }
}
