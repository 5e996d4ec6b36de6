package com.timeos.orchestrator.stage;

import java.util.List;

/** Canonical stage names. These are also the health and circuit keys. */
public final class StageNames {

    public static final String COLLECT       = "collect";
    public static final String TRUTH         = "truth";
    public static final String SNAPSHOT      = "snapshot";
    public static final String NOTIFY        = "notify";
    public static final String MAINTENANCE   = "maintenance";

    // Truth sub-stages
    public static final String TIME          = "time";
    public static final String COMMITMENT    = "commitment";
    public static final String CAPACITY      = "capacity";
    public static final String CLIENT_HEALTH = "client-health";

    public static final List<String> TRUTH_STAGES = List.of(TIME, COMMITMENT, CAPACITY, CLIENT_HEALTH);

    private StageNames() {}
}
