package intoto.model;

import intoto.error.EncodingException;

/**
 * Checks that a string can be used as a relative, slash-separated path without
 * escaping the directory it is resolved against.
 * <p>
 * A path is rejected if it is empty, starts with {@code /}, or has a component
 * that is exactly {@code ..}. Components that merely contain dots, like
 * {@code ..foo} or {@code bar..}, are fine. The path is not normalized.
 */
public final class PathValidator {

    private PathValidator() {}

    public static void validate(String path) throws EncodingException {
        if (path == null || path.isEmpty()) {
            throw new EncodingException("Path cannot be empty");
        }
        if (path.startsWith("/")) {
            throw new EncodingException("Path cannot be absolute: " + path);
        }
        for (String component : path.split("/", -1)) {
            if (component.equals("..")) {
                throw new EncodingException("Path cannot contain a '..' component: " + path);
            }
        }
    }
}
