package com.geoshard.application.scoring;

import com.geoshard.application.port.out.SpatialIndex;
import com.geoshard.domain.model.CellId;
import com.geoshard.domain.model.ScoredCellSet;
import com.geoshard.domain.model.User;
import com.geoshard.infrastructure.exception.BuildInvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * Maps each user to its cell at the set's storage level and adds the user's weight.
 */
public abstract class AbstractUserScorer implements LoadScorer {

    private static final Logger log = LoggerFactory.getLogger(AbstractUserScorer.class);

    private final SpatialIndex spatialIndex;

    protected AbstractUserScorer(SpatialIndex spatialIndex) {
        this.spatialIndex = spatialIndex;
    }

    protected abstract long weightOf(User user);

    @Override
    public ScoredCellSet score(ScoredCellSet cells, Iterator<? extends User> users) {
        int storageLevel = cells.storageLevel();
        long scored = 0;
        while (users.hasNext()) {
            User user = users.next();
            CellId cell = spatialIndex.cellFor(user.location(), storageLevel);
            long weight = weightOf(user);
            boolean added;
            try {
                added = cells.addLoad(cell, weight);
            } catch (ArithmeticException e) {
                throw BuildInvariantViolationException.scoreOverflow(cell, weight);
            }
            if (!added) {
                throw BuildInvariantViolationException.cellNotEnumerated(user.location(), cell, storageLevel);
            }
            scored++;
        }
        log.debug("Scored {} users into {} cells with {}", scored, cells.size(), getClass().getSimpleName());
        return cells;
    }
}
