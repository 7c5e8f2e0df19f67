package com.flamingo.ai.hybridrag.service.rag.search;

import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import java.util.List;

/** Nearest-neighbour passage search over query embeddings. */
public interface DenseSearch {

  /**
   * Returns passages ranked by vector similarity, best first.
   *
   * @param embedding the query embedding
   * @param topK maximum number of passages
   * @return passages with {@code DENSE} scores
   */
  List<RankedResult> search(List<Float> embedding, int topK);
}
