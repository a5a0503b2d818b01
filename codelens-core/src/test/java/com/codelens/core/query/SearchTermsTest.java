package com.codelens.core.query;

import com.codelens.core.domain.DomainContext;
import com.codelens.core.domain.DomainTag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SearchTerms}.
 */
class SearchTermsTest {

    @Test
    void nameTokens_mixedCaseFileName_splitsAndDropsShortTokens() {
        assertThat(SearchTerms.nameTokens("postGLEntry.py")).containsExactly("post", "entry");
        assertThat(SearchTerms.nameTokens("make_gl_entries")).containsExactly("make", "entries");
    }

    @Test
    void queryTokens_punctuation_isRemovedButUnderscoresKept() {
        assertThat(SearchTerms.queryTokens("Ledger, posting!? gl")).containsExactly("ledger", "posting");
        assertThat(SearchTerms.queryTokens("journal_entry")).containsExactly("journal_entry");
        assertThat(SearchTerms.queryTokens("   ")).isEmpty();
        assertThat(SearchTerms.queryTokens(null)).isEmpty();
    }

    @Test
    void indexTerms_includeTagLabels() {
        DomainContext context = new DomainContext(
            List.of(new DomainTag("ledger", 0.4, List.of()), new DomainTag("journal_entry", 0.2, List.of())),
            "ledger", true);

        assertThat(SearchTerms.indexTerms("post", context)).containsExactly("post", "ledger", "journal_entry");
    }
}
