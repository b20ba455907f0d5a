package com.flamingo.ai.notevault.service.note;

import com.flamingo.ai.notevault.domain.entity.Note;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.springframework.stereotype.Component;

/**
 * Full-text relevance scoring for the lexical search path.
 *
 * <p>Candidate notes are indexed into an in-memory Lucene directory with {@link EnglishAnalyzer}
 * (stop words, possessives, Porter stemming) and ranked with {@link BM25Similarity}. A note matches
 * only when it contains every analysed query term.
 */
@Component
@Slf4j
public class LexicalScorer {

  private static final String CONTENT_FIELD = "content";
  private static final String POSITION_FIELD = "position";

  private final Analyzer analyzer = new EnglishAnalyzer();

  /** Distinct analysed query terms in first-seen order; empty for a stop-word-only query. */
  public List<String> queryTerms(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    Set<String> terms = new LinkedHashSet<>();
    try (TokenStream stream = analyzer.tokenStream(CONTENT_FIELD, query)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        terms.add(term.toString());
      }
      stream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to analyse query", e);
    }
    return new ArrayList<>(terms);
  }

  /**
   * Ranks notes against a query.
   *
   * @return one match per note containing every query term, best first; empty if the query has no
   *     searchable terms
   */
  public List<LexicalMatch> match(List<Note> notes, String query) {
    List<String> terms = queryTerms(query);
    if (terms.isEmpty() || notes.isEmpty()) {
      return List.of();
    }

    BM25Similarity similarity = new BM25Similarity();
    try (ByteBuffersDirectory directory = new ByteBuffersDirectory()) {
      IndexWriterConfig config = new IndexWriterConfig(analyzer);
      config.setSimilarity(similarity);
      try (IndexWriter writer = new IndexWriter(directory, config)) {
        for (int i = 0; i < notes.size(); i++) {
          String content = notes.get(i).getContent();
          Document doc = new Document();
          doc.add(new StoredField(POSITION_FIELD, i));
          doc.add(new TextField(CONTENT_FIELD, content == null ? "" : content, Field.Store.NO));
          writer.addDocument(doc);
        }
      }

      BooleanQuery.Builder builder = new BooleanQuery.Builder();
      for (String term : terms) {
        builder.add(new TermQuery(new Term(CONTENT_FIELD, term)), BooleanClause.Occur.MUST);
      }

      try (DirectoryReader reader = DirectoryReader.open(directory)) {
        IndexSearcher searcher = new IndexSearcher(reader);
        searcher.setSimilarity(similarity);
        List<LexicalMatch> matches = new ArrayList<>();
        for (ScoreDoc hit : searcher.search(builder.build(), notes.size()).scoreDocs) {
          Document doc = searcher.storedFields().document(hit.doc);
          int position = doc.getField(POSITION_FIELD).numericValue().intValue();
          matches.add(new LexicalMatch(notes.get(position), hit.score));
        }
        log.debug(
            "Lexical index: {} of {} note(s) match terms {}", matches.size(), notes.size(), terms);
        return matches;
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Lexical index failed", e);
    }
  }
}
