package io.autolv.panel;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Filesystem path. Stored as a {@link Path}, exposed as its string form.
 */
public final class PathControl extends Control<String> {

    private Path path = Path.of("");

    public PathControl(ControlAttributes attributes) {
        super(ControlKind.PATH, attributes);
    }

    @Override
    public String value() {
        return path.toString();
    }

    @Override
    public void setValue(Object value) {
        if (value instanceof Path p) {
            this.path = p;
            return;
        }
        if (!(value instanceof String text)) {
            throw ControlTypeException.rejected(this, value, "not a string or path");
        }
        try {
            this.path = Path.of(text);
        } catch (InvalidPathException ex) {
            throw ControlTypeException.rejected(this, value, "not a valid path", ex);
        }
    }

    public Path path() {
        return path;
    }
}
