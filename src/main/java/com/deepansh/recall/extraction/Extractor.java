package com.deepansh.recall.extraction;

import java.util.List;

/**
 * External fact extractor. Zero results is a valid answer.
 */
public interface Extractor {

    List<ExtractedFact> extract(String message);
}
