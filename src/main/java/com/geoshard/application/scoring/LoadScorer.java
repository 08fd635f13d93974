package com.geoshard.application.scoring;

import com.geoshard.domain.model.ScoredCellSet;
import com.geoshard.domain.model.User;

import java.util.Iterator;

/**
 * Strategy for scoring cells, e.g. by total users, active users or any other per-user weight.
 * Swapping the scorer never requires touching the enumerator or the partitioner.
 */
public interface LoadScorer {

    /**
     * Consumes {@code users} to exhaustion and adds their load to {@code cells}.
     *
     * @return the same cell set, scored
     * @throws com.geoshard.infrastructure.exception.BuildInvariantViolationException if a user maps to a
     *         cell that is not part of the set
     */
    ScoredCellSet score(ScoredCellSet cells, Iterator<? extends User> users);
}
