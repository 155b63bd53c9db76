package io.crabcity.auth.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;
import static io.crabcity.auth.constant.EventConstant.DEFAULT_CHECKPOINT_INTERVAL;
import static io.crabcity.auth.constant.InviteConstant.MAX_CHAIN_DEPTH;
import static java.util.Objects.isNull;

/**
 * Instance-wide tunables. Read from YAML, e.g.
 * <pre>
 * {@code
 * max_chain_depth: 8
 * checkpoint_interval: 100
 * }
 * </pre>
 * Missing keys, or an empty document, fall back to defaults.
 */
@ToString
@Getter
@NoArgsConstructor
public class AuthConf {

    private static final YAMLMapper mapper = YAMLMapper.builder()
            .configure(FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    /**
     * Upper bound on invite chain length, at most {@code MAX_CHAIN_DEPTH}.
     */
    @JsonProperty("max_chain_depth")
    private Integer maxChainDepth;

    /**
     * Sign a checkpoint every this many events.
     */
    @JsonProperty("checkpoint_interval")
    private Long checkpointInterval;

    public AuthConf(Integer maxChainDepth, Long checkpointInterval) {
        this.maxChainDepth = maxChainDepth;
        this.checkpointInterval = checkpointInterval;
        validate(this);
    }

    public static AuthConf defaults() {
        return new AuthConf(MAX_CHAIN_DEPTH, (long) DEFAULT_CHECKPOINT_INTERVAL);
    }

    public static AuthConf initConfig(Path configPath) throws IOException {
        try (var in = Files.newInputStream(configPath)) {
            return initConfig(in);
        }
    }

    public static AuthConf initConfig(InputStream in) throws IOException {
        return fromTree(mapper.readTree(in));
    }

    private static AuthConf fromTree(JsonNode tree) throws IOException {
        if (isNull(tree) || tree.isMissingNode() || tree.isNull()) {
            return defaults();
        }

        return validate(mapper.treeToValue(tree, AuthConf.class));
    }

    public int getMaxChainDepth() {
        return isNull(maxChainDepth) ? MAX_CHAIN_DEPTH : maxChainDepth;
    }

    public long getCheckpointInterval() {
        return isNull(checkpointInterval) ? DEFAULT_CHECKPOINT_INTERVAL : checkpointInterval;
    }

    private static AuthConf validate(AuthConf conf) {
        if (isNull(conf)) {
            return defaults();
        }
        var depth = conf.getMaxChainDepth();
        if (depth < 1 || depth > MAX_CHAIN_DEPTH) {
            throw new IllegalArgumentException("max_chain_depth must be between 1 and " + MAX_CHAIN_DEPTH + ": " + depth);
        }
        if (conf.getCheckpointInterval() < 1) {
            throw new IllegalArgumentException("checkpoint_interval must be positive: " + conf.getCheckpointInterval());
        }

        return conf;
    }
}
