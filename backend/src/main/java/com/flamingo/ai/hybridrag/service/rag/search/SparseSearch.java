package com.flamingo.ai.hybridrag.service.rag.search;

import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import java.util.List;

/** Lexical (BM25) passage search over raw query text. */
public interface SparseSearch {

  /**
   * Returns passages ranked by lexical score, best first.
   *
   * @param text the query text
   * @param topK maximum number of passages
   * @return passages with {@code SPARSE} scores
   */
  List<RankedResult> search(String text, int topK);
}
