package intoto.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import intoto.error.EncodingException;
import intoto.interchange.DataInterchange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Path of a metadata document, relative to the metadata directory.
 * <p>
 * The path does not include a file extension; that depends on the
 * interchange format and is added by {@link #components(DataInterchange)}.
 * Use {@code MetadataPath.of("root")}, not {@code MetadataPath.of("root.json")}.
 */
public final class MetadataPath implements Comparable<MetadataPath> {

    private final String path;

    private MetadataPath(String path) {
        this.path = path;
    }

    /**
     * @throws EncodingException if {@code path} is empty, absolute, or has a {@code ..} component
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MetadataPath of(String path) throws EncodingException {
        PathValidator.validate(path);
        return new MetadataPath(path);
    }

    @JsonValue
    public String value() {
        return path;
    }

    /**
     * Path components with the interchange's extension on the file name,
     * e.g. {@code targets/foo} becomes {@code [targets, foo.json]}.
     */
    public List<String> components(DataInterchange<?> interchange) {
        List<String> components = new ArrayList<>(Arrays.asList(path.split("/", -1)));
        int last = components.size() - 1;
        components.set(last, components.get(last) + "." + interchange.extension());
        return components;
    }

    /**
     * Like {@link #components(DataInterchange)}, with the file name prefixed by
     * {@code version}, e.g. {@code [1.root.json]}.
     */
    public List<String> components(DataInterchange<?> interchange, int version) {
        if (version < 1) {
            throw new IllegalArgumentException("Metadata version must be at least 1: " + version);
        }
        List<String> components = components(interchange);
        int last = components.size() - 1;
        components.set(last, version + "." + components.get(last));
        return components;
    }

    @Override
    public int compareTo(MetadataPath o) {
        return path.compareTo(o.path);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MetadataPath other && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
