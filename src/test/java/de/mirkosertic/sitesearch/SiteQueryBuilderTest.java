package de.mirkosertic.sitesearch;

import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.Query;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SiteQueryBuilder Tests")
class SiteQueryBuilderTest {

    private final SiteQueryBuilder queryBuilder = new SiteQueryBuilder(new SiteTextAnalyzer());

    @ParameterizedTest(name = "{0} allows {1} edits")
    @CsvSource({"a, 0", "ab, 1", "oil, 1", "engine, 2", "lubricnt, 2", "lubricantmanufacturer, 2"})
    @DisplayName("Fuzzy distance should scale with term length and be capped at 2")
    void shouldScaleFuzzyDistance(final String term, final int expectedEdits) {
        assertThat(SiteQueryBuilder.fuzzyEdits(term)).isEqualTo(expectedEdits);
    }

    @Test
    @DisplayName("Query text should be analyzed like indexed text")
    void shouldAnalyzeQuery() {
        assertThat(queryBuilder.analyze("Café ENGINE café")).containsExactly("cafe", "engine");
    }

    @Test
    @DisplayName("Every term should produce one boosted clause per searchable field")
    void shouldBuildFieldClauses() {
        final Optional<Query> query = queryBuilder.build("engine oil");

        assertThat(query).isPresent();
        final BooleanQuery booleanQuery = (BooleanQuery) query.get();
        final List<BooleanClause> clauses = booleanQuery.clauses();
        assertThat(clauses).hasSize(2 * IndexFields.SEARCHABLE.size());
        assertThat(clauses).allMatch(clause -> clause.getOccur() == BooleanClause.Occur.SHOULD);
        assertThat(clauses).extracting(clause -> ((BoostQuery) clause.getQuery()).getBoost())
                .containsExactly(2.0f, 1.0f, 1.5f, 1.0f, 2.0f, 1.0f, 1.5f, 1.0f);
    }

    @Test
    @DisplayName("Text without searchable terms should yield no query")
    void shouldReturnEmptyForPunctuation() {
        assertThat(queryBuilder.build("?! --")).isEmpty();
    }
}
