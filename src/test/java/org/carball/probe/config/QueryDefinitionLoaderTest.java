package org.carball.probe.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryDefinitionLoaderTest {

    private QueryDefinitionLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        loader = new QueryDefinitionLoader();
    }

    @Test
    void shouldLoadBundledDefinitions() throws IOException {
        // When
        QueryCatalog catalog = loader.loadDefault();

        // Then
        assertThat(catalog.definitions())
                .extracting(QueryDefinition::eventName)
                .containsExactly("MSSQLTopSlowQueries", "MSSQLWaitTimeAnalysis", "MSSQLBlockingSessionQueries");
        assertThat(catalog.definitions())
                .extracting(QueryDefinition::type)
                .containsExactly("slowQueries", "waitAnalysis", "blockingSessions");
        assertThat(catalog.executionPlanQuery()).contains("${queryId}").contains("${planCountLimit}");
    }

    @Test
    void shouldFormatEveryBundledTemplate() throws IOException {
        // Given
        QueryCatalog catalog = loader.loadDefault();
        ProbeSettings settings = ProbeSettings.defaults();

        // When/Then
        for (QueryDefinition definition : catalog.definitions()) {
            String sql = QueryTemplateFormatter.format(definition.query(), QueryTemplateFormatter.valuesFor(settings));
            assertThat(sql).doesNotContain("${");
        }
        String planSql = QueryTemplateFormatter.format(catalog.executionPlanQuery(),
                QueryTemplateFormatter.planValuesFor(settings, "0x0102030405060708"));
        assertThat(planSql).contains("'0x0102030405060708'").doesNotContain("${");
    }

    @Test
    void shouldLoadDefinitionsFromFileAndDropIncompleteOnes() throws IOException {
        // Given
        Path file = tempDir.resolve("queries.yml");
        Files.writeString(file, """
                definitions:
                  - eventName: CustomSlowQueries
                    type: slowQueries
                    query: SELECT TOP (${countThreshold}) * FROM custom_view
                  - eventName: MissingQuery
                    type: waitAnalysis
                  - eventName: Deadlocks
                    type: deadlocks
                    query: SELECT 1
                """);

        // When
        QueryCatalog catalog = loader.load(file);

        // Then
        assertThat(catalog.definitions()).extracting(QueryDefinition::eventName)
                .containsExactly("CustomSlowQueries", "Deadlocks");
        assertThat(catalog.executionPlanQuery()).isNull();
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.yml")))
                .isInstanceOf(FileNotFoundException.class);
    }
}
