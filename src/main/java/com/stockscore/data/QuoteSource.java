package com.stockscore.data;

import com.stockscore.model.Quote;

import java.util.List;
import java.util.Map;

/**
 * Market-data boundary. Implementations may return a subset of the requested
 * entities; a missing entry is an expected outcome, not an error.
 */
public interface QuoteSource {

    Map<String, Quote> fetch(List<String> entityIds);
}
