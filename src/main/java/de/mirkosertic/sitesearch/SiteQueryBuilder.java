package de.mirkosertic.sitesearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.DisjunctionMaxQuery;
import org.apache.lucene.search.FuzzyQuery;
import org.apache.lucene.search.MultiTermQuery;
import org.apache.lucene.search.PrefixQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the Lucene query for a free-text search.
 *
 * <p>The text is analyzed with the index analyzer. Every resulting term is matched
 * against every searchable field in three ways and the best of them counts:</p>
 * <ul>
 *   <li><b>exact</b> term match, weight 1</li>
 *   <li><b>prefix</b> match, weight {@value #PREFIX_WEIGHT}, so "lub" finds "lubricant"</li>
 *   <li><b>fuzzy</b> match, weight {@value #FUZZY_WEIGHT}, allowing
 *       {@code round(0.3 * length)} edits (at most 2), so "lubricnt" finds "lubricant"</li>
 * </ul>
 * <p>Each per-field match is boosted by {@link IndexFields#boost(String)} and all of them are
 * combined with OR semantics: a document matching any term in any field is a hit.</p>
 *
 * <h3>Example</h3>
 * <pre>
 * Input:  "engine oil"
 * Output: (title:engine | title:engine* | title:engine~2)^2.0
 *         (description:engine | ...)^1.5
 *         ...
 *         (links:oil | links:oil* | links:oil~1)
 * </pre>
 */
public class SiteQueryBuilder {

    static final float PREFIX_WEIGHT = 0.375f;
    static final float FUZZY_WEIGHT = 0.45f;
    static final double FUZZY_RATIO = 0.3;

    /**
     * Prefixes shorter than this use constant scoring; they match too many terms to score.
     */
    private static final int MIN_PREFIX_LENGTH_FOR_SCORING = 4;
    private static final int MAX_EXPANSIONS = 10;
    private static final int MAX_QUERY_TERMS = 10;

    private final Analyzer analyzer;

    public SiteQueryBuilder(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * @return the query, or empty if the text contains no searchable terms
     */
    public Optional<Query> build(final String queryText) {
        final List<String> terms = analyze(queryText);
        if (terms.isEmpty()) {
            return Optional.empty();
        }

        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (final String term : terms) {
            for (final String field : IndexFields.SEARCHABLE) {
                builder.add(new BoostQuery(termQuery(field, term), IndexFields.boost(field)), BooleanClause.Occur.SHOULD);
            }
        }
        return Optional.of(builder.build());
    }

    /**
     * Distinct analyzed terms of the text, in order of appearance.
     */
    List<String> analyze(final String text) {
        final Set<String> terms = new LinkedHashSet<>();
        try (final TokenStream stream = analyzer.tokenStream(IndexFields.CONTENT, text)) {
            final CharTermAttribute termAttribute = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken() && terms.size() < MAX_QUERY_TERMS) {
                terms.add(termAttribute.toString());
            }
            stream.end();
        } catch (final IOException e) {
            // analysis of an in-memory string
            throw new UncheckedIOException(e);
        }
        return new ArrayList<>(terms);
    }

    static int fuzzyEdits(final String term) {
        return (int) Math.min(FuzzyQuery.defaultMaxEdits, Math.round(FUZZY_RATIO * term.length()));
    }

    private Query termQuery(final String field, final String term) {
        final List<Query> alternatives = new ArrayList<>(3);
        alternatives.add(new TermQuery(new Term(field, term)));
        alternatives.add(new BoostQuery(prefixQuery(field, term), PREFIX_WEIGHT));

        final int edits = fuzzyEdits(term);
        if (edits > 0) {
            alternatives.add(new BoostQuery(
                    new FuzzyQuery(new Term(field, term), edits, 0, MAX_EXPANSIONS, true),
                    FUZZY_WEIGHT));
        }
        return new DisjunctionMaxQuery(alternatives, 0.0f);
    }

    private static Query prefixQuery(final String field, final String term) {
        if (term.length() >= MIN_PREFIX_LENGTH_FOR_SCORING) {
            return new PrefixQuery(new Term(field, term),
                    new MultiTermQuery.TopTermsBlendedFreqScoringRewrite(MAX_EXPANSIONS));
        }
        return new PrefixQuery(new Term(field, term));
    }
}
