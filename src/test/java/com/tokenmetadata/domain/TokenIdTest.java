package com.tokenmetadata.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenIdTest {

    @Test
    void key_keepsAddressCase() {
        TokenId upper = TokenId.of("KT1RJ6PbjHpwc3M5rw5s2Nbmefwbuwbdxton", "7");
        TokenId lower = TokenId.of("kt1rj6pbjhpwc3m5rw5s2nbmefwbuwbdxton", "7");

        assertThat(upper.key()).isEqualTo("KT1RJ6PbjHpwc3M5rw5s2Nbmefwbuwbdxton:7");
        assertThat(upper.key()).isNotEqualTo(lower.key());
    }

    @Test
    void key_stripsWhitespace() {
        assertThat(TokenId.of("  KT1Abc ", " 3 ").key()).isEqualTo("KT1Abc:3");
    }

    @Test
    void blankTokenIndex_isContractLevelKey() {
        assertThat(TokenId.of("KT1Abc", "  ").key()).isEqualTo("KT1Abc");
        assertThat(TokenId.of("KT1Abc", null).tokenIndex()).isNull();
    }

    @Test
    void blankContract_rejected() {
        assertThatThrownBy(() -> TokenId.of(" ", "1")).isInstanceOf(IllegalArgumentException.class);
    }
}
