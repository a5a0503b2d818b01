package com.codelens.core.domain;

import com.codelens.core.model.CodeEntity;
import com.codelens.core.model.EntityKind;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.FunctionEntity;
import com.codelens.core.model.Location;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link DomainTagger}.
 */
class DomainTaggerTest {

    private final DomainTagger tagger = new DomainTagger();

    @Test
    void tagFile_taxUtilities_tagsTax() {
        FileAnalysis file = file("tax_utils.py", function("calculate_tax_amount", null));

        DomainContext context = tagger.tagFile(file);

        assertThat(context.primaryTag()).isEqualTo("tax");
        assertThat(context.domainRelated()).isTrue();
        DomainTag tax = context.tags().get(0);
        assertThat(tax.confidence()).isCloseTo(0.4, within(1e-9));
        assertThat(tax.reasoning()).containsExactly(
            "Found 1 keyword matches in file name: tax",
            "Found 1 keyword matches in name of calculate_tax_amount: tax");
    }

    @Test
    void tagFile_accountsPath_boostsEveryConcept() {
        FileAnalysis file = file("erpnext/accounts/doctype/gl_entry.py", function("make_gl_entries", null));

        DomainContext context = tagger.tagFile(file);

        assertThat(context.tagLabels()).containsExactly("ledger", "journal_entry");
        assertThat(context.tags().get(0).confidence()).isCloseTo(0.7, within(1e-9));
        assertThat(context.tags().get(1).confidence()).isCloseTo(0.5, within(1e-9));
        assertThat(context.tags().get(0).reasoning()).contains(
            "File path matches accounting pattern: .*accounts.*",
            "File path matches accounting pattern: .*erpnext.*accounts.*");
    }

    @Test
    void tagFile_pathOnly_isDomainRelatedWithoutTags() {
        FileAnalysis file = file("accounts/helpers.py", function("format_name", null));

        DomainContext context = tagger.tagFile(file);

        assertThat(context.tags()).isEmpty();
        assertThat(context.primaryTag()).isNull();
        assertThat(context.domainRelated()).isTrue();
    }

    @Test
    void tagFile_unrelatedCode_isNotDomainRelated() {
        FileAnalysis file = file("utils/strings.py", function("slugify", "Make a URL-safe slug."));

        DomainContext context = tagger.tagFile(file);

        assertThat(context).isEqualTo(DomainContext.empty());
    }

    @Test
    void tagEntity_nameAndDocstring_sumAndCapAtOne() {
        DomainContext context = tagger.tagEntity(
            function("ledger_posting", "Ledger posting with debit and credit lines."));

        assertThat(context.primaryTag()).isEqualTo("ledger");
        assertThat(context.topConfidence()).isEqualTo(1.0);
        assertThat(context.tags().get(0).reasoning()).containsExactly(
            "Found 2 keyword matches in entity name: ledger, posting",
            "Found 4 keyword matches in docstring: ledger, posting, debit (and 1 more)");
    }

    @Test
    void tagEntity_tie_keepsConceptOrder() {
        DomainContext context = tagger.tagEntity(function("validate_entry", null));

        assertThat(context.tagLabels()).containsExactly("ledger", "journal_entry");
        assertThat(context.primaryTag()).isEqualTo("ledger");
    }

    @Test
    void tagText_manyKeywords_capsTextConfidence() {
        List<DomainTag> tags = tagger.tagText("ledger posting debit credit balance", "docstring");

        assertThat(tags).singleElement().satisfies(tag -> {
            assertThat(tag.tag()).isEqualTo("ledger");
            assertThat(tag.confidence()).isCloseTo(0.8, within(1e-9));
        });
    }

    @Test
    void domainTag_confidenceOutOfRange_throws() {
        assertThatThrownBy(() -> new DomainTag("tax", 1.5, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static FileAnalysis file(String path, CodeEntity... entities) {
        return new FileAnalysis(path, List.of(entities), List.of(), List.of(), Map.of());
    }

    private static FunctionEntity function(String name, String docstring) {
        return new FunctionEntity(name, EntityKind.FUNCTION, new Location("f.py", 1, 3, 0), docstring, null, Map.of());
    }
}
