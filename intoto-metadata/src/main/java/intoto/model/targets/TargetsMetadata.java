package intoto.model.targets;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import intoto.model.Metadata;
import intoto.model.TargetPath;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * TUF targets role: lists which target files are authorized, with their
 * length and digests, until an expiry time.
 * <p>
 * Expiry is kept at second precision, since that is what the wire format carries.
 */
@JsonPropertyOrder({"_type", "spec_version", "version", "expires", "targets"})
public final class TargetsMetadata implements Metadata {

    public static final String TYPE = "targets";
    public static final String SPEC_VERSION = "1.0";

    private final String specVersion;
    private final int version;
    private final Instant expires;
    private final SortedMap<TargetPath, TargetFile> targets;

    public TargetsMetadata(int version, Instant expires, Map<TargetPath, TargetFile> targets) {
        this(SPEC_VERSION, version, expires, targets);
    }

    TargetsMetadata(String specVersion, int version, Instant expires, Map<TargetPath, TargetFile> targets) {
        if (!specVersion.startsWith("1.")) {
            throw new IllegalArgumentException("Unsupported spec version " + specVersion);
        }
        if (version < 1) {
            throw new IllegalArgumentException("Metadata version must be at least 1: " + version);
        }
        this.specVersion = specVersion;
        this.version = version;
        this.expires = Objects.requireNonNull(expires, "expires").truncatedTo(ChronoUnit.SECONDS);
        this.targets = Collections.unmodifiableSortedMap(new TreeMap<>(targets));
    }

    @JsonCreator
    static TargetsMetadata fromJson(@JsonProperty(value = "_type", required = true) String type,
                                    @JsonProperty(value = "spec_version", required = true) String specVersion,
                                    @JsonProperty(value = "version", required = true) int version,
                                    @JsonProperty(value = "expires", required = true) Instant expires,
                                    @JsonProperty("targets") Map<TargetPath, TargetFile> targets) {
        if (!TYPE.equals(type)) {
            throw new IllegalArgumentException("Attempted to decode targets metadata labeled as " + type);
        }
        return new TargetsMetadata(specVersion, version, expires, targets == null ? Map.of() : targets);
    }

    @JsonProperty("_type")
    public String type() {
        return TYPE;
    }

    @JsonProperty("spec_version")
    public String specVersion() {
        return specVersion;
    }

    @JsonProperty("version")
    @Override
    public int version() {
        return version;
    }

    @JsonProperty("expires")
    public Instant expires() {
        return expires;
    }

    @JsonProperty("targets")
    public SortedMap<TargetPath, TargetFile> targets() {
        return targets;
    }

    public Optional<TargetFile> target(TargetPath path) {
        return Optional.ofNullable(targets.get(path));
    }

    public boolean isExpired(Instant now) {
        return expires.isBefore(now);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TargetsMetadata other
                && specVersion.equals(other.specVersion)
                && version == other.version
                && expires.equals(other.expires)
                && targets.equals(other.targets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(specVersion, version, expires, targets);
    }

    @Override
    public String toString() {
        return "TargetsMetadata{version=" + version + ", expires=" + expires + ", targets=" + targets.keySet() + "}";
    }
}
