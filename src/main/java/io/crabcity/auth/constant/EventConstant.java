package io.crabcity.auth.constant;

import lombok.NoArgsConstructor;

import static java.nio.charset.StandardCharsets.UTF_8;
import static lombok.AccessLevel.PRIVATE;

@NoArgsConstructor(access = PRIVATE)
public class EventConstant {

    /**
     * Domain separation tag for checkpoint signatures.
     */
    public static final byte[] CHECKPOINT_TAG = "crab_city_checkpoint_v1:".getBytes(UTF_8);

    public static final int DEFAULT_CHECKPOINT_INTERVAL = 100;
}
