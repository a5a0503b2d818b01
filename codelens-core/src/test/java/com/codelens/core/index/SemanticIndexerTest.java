package com.codelens.core.index;

import com.codelens.core.analysis.ProjectAnalyzer;
import com.codelens.core.config.CodeLensConfig.AnalysisSettings;
import com.codelens.core.model.EntityKind;
import com.codelens.core.model.ProjectAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SemanticIndexer}.
 */
class SemanticIndexerTest {

    @TempDir
    Path tempDir;

    private ProjectAnalysis project;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tempDir.resolve("accounts"));
        Files.createDirectories(tempDir.resolve("utils"));
        Files.writeString(tempDir.resolve("accounts/posting.py"), """
            import frappe

            def post_journal_entry(doc):
                validate_entry(doc)

            def validate_entry(doc):
                write_to_ledger(doc)

            def write_to_ledger(doc):
                frappe.db.commit()
            """);
        Files.writeString(tempDir.resolve("utils/strings.py"), """
            def slugify(text):
                \"\"\"Make a URL-safe slug.\"\"\"
                return text.lower()
            """);
        project = new ProjectAnalyzer("books", AnalysisSettings.defaults()).analyze(tempDir);
    }

    @Test
    void build_project_indexesFilesAndEntities() {
        SemanticIndex index = new SemanticIndexer().build(project);

        assertThat(index.projectName()).isEqualTo("books");
        assertThat(index.files()).containsOnlyKeys("accounts/posting.py", "utils/strings.py");
        assertThat(index.files().get("accounts/posting.py").entities())
            .containsExactly("frappe", "post_journal_entry", "validate_entry", "write_to_ledger");
        assertThat(index.entities()).containsKeys(
            "accounts/posting.py::post_journal_entry", "utils/strings.py::slugify");
        assertThat(index.entities().get("accounts/posting.py::frappe").entityKind()).isEqualTo(EntityKind.IMPORT);
    }

    @Test
    void build_project_tagsEntitiesAndFiles() {
        SemanticIndex index = new SemanticIndexer().build(project);

        SemanticEntity posting = index.entities().get("accounts/posting.py::post_journal_entry");
        assertThat(posting.domainContext().primaryTag()).isEqualTo("journal_entry");
        assertThat(posting.contextScore().reasoning()).hasSize(4);

        assertThat(index.files().get("accounts/posting.py").domainContext().domainRelated()).isTrue();
        assertThat(index.files().get("utils/strings.py").domainContext().domainRelated()).isFalse();
    }

    @Test
    void build_project_detectsWorkflowsAndCountsMetadata() {
        SemanticIndex index = new SemanticIndexer().build(project);

        assertThat(index.workflows()).isNotEmpty();
        assertThat(index.workflows()).allSatisfy(workflow ->
            assertThat(workflow.businessProcess()).isEqualTo("ledger_posting"));

        IndexMetadata metadata = index.metadata();
        assertThat(metadata.totalFiles()).isEqualTo(2);
        assertThat(metadata.totalEntities()).isEqualTo(5);
        assertThat(metadata.totalWorkflows()).isEqualTo(index.workflows().size());
        assertThat(metadata.domainRelatedFiles()).isEqualTo(1);
    }

    @Test
    void build_emptyProject_returnsEmptyIndex() {
        SemanticIndex index = new SemanticIndexer().build(new ProjectAnalysis("empty", null, null, null));

        assertThat(index.files()).isEmpty();
        assertThat(index.entities()).isEmpty();
        assertThat(index.workflows()).isEmpty();
        assertThat(index.metadata()).isEqualTo(new IndexMetadata(0, 0, 0, 0, 0));
    }
}
