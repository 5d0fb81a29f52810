package com.example.FolioAgent.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CitationExtractorTest {

    @Test
    void readsAllCitationShapesInOrder() {
        String text = "Built with Spring [docId=12]. Deployed on Fly 【docId=3】, see also [DocId: 12] and [docId = 40].";

        assertThat(CitationExtractor.citedIds(text)).containsExactly(12L, 3L, 40L);
    }

    @Test
    void ignoresLookalikes() {
        assertThat(CitationExtractor.citedIds("[doc=5] docId=6 [docId=] [docId=abc]")).isEmpty();
        assertThat(CitationExtractor.citedIds(null)).isEmpty();
    }

    @Test
    void idsTooLongForALongAreSkipped() {
        assertThat(CitationExtractor.citedIds("[docId=99999999999999999999] [docId=7]")).containsExactly(7L);
    }
}
