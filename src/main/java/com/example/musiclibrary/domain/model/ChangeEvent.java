package com.example.musiclibrary.domain.model;

import java.nio.file.Path;
import lombok.Data;

/**
 * One classified filesystem notification as emitted by the watcher.
 */
@Data
public class ChangeEvent {

    public enum Type {
        FILE_CHANGED,
        FILE_REMOVED,
        FILE_RENAMED
    }

    private Type type;

    /** Affected path; for renames the destination. */
    private Path path;

    /** Rename source, null for other types. */
    private Path from;

    /** True when the OS reported a creation rather than a content modification. */
    private boolean isNew;

    public static ChangeEvent changed(Path path, boolean isNew) {
        ChangeEvent event = new ChangeEvent();
        event.setType(Type.FILE_CHANGED);
        event.setPath(path);
        event.setNew(isNew);
        return event;
    }

    public static ChangeEvent removed(Path path) {
        ChangeEvent event = new ChangeEvent();
        event.setType(Type.FILE_REMOVED);
        event.setPath(path);
        return event;
    }

    public static ChangeEvent renamed(Path from, Path to) {
        ChangeEvent event = new ChangeEvent();
        event.setType(Type.FILE_RENAMED);
        event.setFrom(from);
        event.setPath(to);
        return event;
    }
}
