package com.strategylab.unit.variable;

import static org.assertj.core.api.Assertions.assertThat;

import com.strategylab.domain.enums.VariableType;
import com.strategylab.domain.model.VariableList;
import com.strategylab.variable.VariableTokens;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for VariableList construction and VariableTokens name handling. */
class VariableListTest {

    @Test
    @DisplayName("name loses its $ and case, values are de-duplicated in first-seen order")
    void normalizesNameAndValues() {
        VariableList list = VariableList.of("$Period", null, List.of("14", " 21 ", "14", "", "50"));

        assertThat(list.getName()).isEqualTo("period");
        assertThat(list.getValues()).containsExactly("14", "21", "50");
    }

    @Test
    @DisplayName("null values and a null collection are tolerated")
    void nullsTolerated() {
        assertThat(VariableList.of("x", null, null).getValues()).isEmpty();
        assertThat(VariableList.of("x", null, Arrays.asList("a", null, "b")).getValues()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("typed lists normalize tickers to upper case")
    void typedTickerList() {
        VariableList list = VariableList.of("sym", VariableType.TICKER, List.of("spy", "SPY", "qqq"));

        assertThat(list.getValues()).containsExactly("SPY", "QQQ");
    }

    @Test
    @DisplayName("token syntax requires $ followed by word characters")
    void tokenSyntax() {
        assertThat(VariableTokens.isToken("$rsi_14")).isTrue();
        assertThat(VariableTokens.isToken(" $w ")).isTrue();
        assertThat(VariableTokens.isToken("$")).isFalse();
        assertThat(VariableTokens.isToken("$a-b")).isFalse();
        assertThat(VariableTokens.isToken("rsi")).isFalse();
        assertThat(VariableTokens.isToken(null)).isFalse();
    }

    @Test
    @DisplayName("normalizeName trims, strips $ and lower-cases")
    void normalizeName() {
        assertThat(VariableTokens.normalizeName(" $RSI_Len ")).isEqualTo("rsi_len");
        assertThat(VariableTokens.normalizeName(null)).isEmpty();
    }
}
