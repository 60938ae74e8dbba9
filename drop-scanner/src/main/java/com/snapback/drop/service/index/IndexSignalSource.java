package com.snapback.drop.service.index;

import com.snapback.drop.model.IndexVerdict;

/**
 * One content-index data source in the fallback chain.
 * Precedence among sources is given by {@link org.springframework.core.annotation.Order}.
 */
public interface IndexSignalSource {

    /** Short id written to reports, e.g. "archive" */
    String id();

    /** Fallback sources are only consulted when the caller opts in. */
    boolean isFallback();

    /**
     * @return a definitive PRESENT/ABSENT verdict, or an abstention; never throws
     */
    IndexVerdict probe(String domain);
}
