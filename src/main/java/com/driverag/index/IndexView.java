package com.driverag.index;

import java.util.List;

/**
 * Read-only, point-in-time view of an index. Every search made through one view sees the same set of
 * entries, whatever writes happen meanwhile.
 */
public interface IndexView {

    List<ScoredEntry> vectorSearch(float[] queryVector, int k);

    List<ScoredEntry> keywordSearch(String queryText, int k);
}
