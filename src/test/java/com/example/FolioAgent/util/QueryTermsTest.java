package com.example.FolioAgent.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTermsTest {

    @Test
    void dropsStopWordsShortTokensAndDuplicates() {
        assertThat(QueryTerms.extract("What is Yuqi's experience with Java and Spring? Java, again!"))
                .containsExactly("yuqi", "experience", "java", "spring", "again");
    }

    @Test
    void blankInputHasNoTerms() {
        assertThat(QueryTerms.extract("   ")).isEmpty();
        assertThat(QueryTerms.extract("a I ?")).isEmpty();
    }
}
