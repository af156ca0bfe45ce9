package intoto.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import intoto.crypto.HashValue;
import intoto.error.EncodingException;

import java.util.Arrays;
import java.util.List;

/**
 * Path of a target file, relative to the targets directory.
 * Also used as the key of target and artifact maps in metadata.
 */
public final class TargetPath implements Comparable<TargetPath> {

    private final String path;

    private TargetPath(String path) {
        this.path = path;
    }

    /**
     * @throws EncodingException if {@code path} is empty, absolute, or has a {@code ..} component
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TargetPath of(String path) throws EncodingException {
        PathValidator.validate(path);
        return new TargetPath(path);
    }

    @JsonValue
    public String value() {
        return path;
    }

    /**
     * Components that can be joined into URL paths, Unix paths or Windows paths.
     * {@code foo/bar} gives {@code [foo, bar]}.
     */
    public List<String> components() {
        return Arrays.asList(path.split("/", -1));
    }

    /**
     * The sibling path addressing this target by content hash: the file name
     * gets a {@code <hash>.} prefix and the directories stay as they are.
     * {@code foo/bar} becomes {@code foo/<hash>.bar}.
     */
    public TargetPath withHashPrefix(HashValue hash) throws EncodingException {
        int slash = path.lastIndexOf('/');
        String dir = path.substring(0, slash + 1);
        String fileName = path.substring(slash + 1);
        return TargetPath.of(dir + hash + "." + fileName);
    }

    @Override
    public int compareTo(TargetPath o) {
        return path.compareTo(o.path);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TargetPath other && path.equals(other.path);
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
