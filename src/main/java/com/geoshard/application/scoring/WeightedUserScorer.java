package com.geoshard.application.scoring;

import com.geoshard.application.port.out.SpatialIndex;
import com.geoshard.domain.model.User;
import com.geoshard.domain.model.WeightedUser;

/**
 * Scores by each user's own weight. Users that carry no weight count once.
 */
public class WeightedUserScorer extends AbstractUserScorer {

    public WeightedUserScorer(SpatialIndex spatialIndex) {
        super(spatialIndex);
    }

    @Override
    protected long weightOf(User user) {
        if (user instanceof WeightedUser weighted) {
            return weighted.weight();
        }
        return 1L;
    }
}
