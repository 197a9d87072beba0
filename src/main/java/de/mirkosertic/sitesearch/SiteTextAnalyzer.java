package de.mirkosertic.sitesearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;

/**
 * Analyzer used for indexing and for query terms alike.
 * <p>
 * Tokens are lower-cased and ICU folded (NFKC, case folding, diacritic removal), so that
 * "Café" matches "cafe" and full-width forms match their ASCII counterparts.
 */
public class SiteTextAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
