package com.geoshard.application.scoring;

import com.geoshard.application.port.out.SpatialIndex;
import com.geoshard.domain.model.User;

/**
 * Default scorer: every user counts once.
 */
public class UserCountScorer extends AbstractUserScorer {

    public UserCountScorer(SpatialIndex spatialIndex) {
        super(spatialIndex);
    }

    @Override
    protected long weightOf(User user) {
        return 1L;
    }
}
