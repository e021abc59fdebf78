package io.restspy.core;

import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A path pattern with a stable identity.
 *
 * <p>The id is assigned at creation and never changes. Registries remove entries by id,
 * so two matchables with the same pattern are still distinct.
 *
 * <p>The pattern is a regular expression tested with {@link java.util.regex.Matcher#find()},
 * so an unanchored pattern matches anywhere in the path.
 */
public class Matchable {

    private final String id;
    private final String pattern;
    private final Pattern compiled;

    public Matchable(String pattern) {
        this(UUID.randomUUID().toString(), pattern);
    }

    protected Matchable(String id, String pattern) {
        this.id = Objects.requireNonNull(id, "id");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.compiled = Pattern.compile(pattern);
    }

    public String id() {
        return id;
    }

    public String pattern() {
        return pattern;
    }

    public boolean matches(String path) {
        return path != null && compiled.matcher(path).find();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", pattern=" + pattern + "}";
    }
}
