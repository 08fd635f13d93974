package com.geoshard.domain.model;

/**
 * A user that contributes more (or less) than one unit of load to its cell,
 * e.g. weighted by activity.
 */
public interface WeightedUser extends User {

    long weight();
}
