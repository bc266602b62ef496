package com.example.musiclibrary.domain.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Data;

/**
 * A settled batch flushed by the debouncer. Exactly one of {@code paths} or {@code renames} is populated,
 * depending on the type.
 */
@Data
public class DebouncedEvent {

    public enum Type {
        FILES_CHANGED,
        FILES_REMOVED,
        FILES_RENAMED
    }

    private Type type;

    private List<Path> paths = Collections.emptyList();

    private List<RenamedPath> renames = Collections.emptyList();

    public static DebouncedEvent filesChanged(List<Path> paths) {
        DebouncedEvent event = new DebouncedEvent();
        event.setType(Type.FILES_CHANGED);
        event.setPaths(Collections.unmodifiableList(new ArrayList<>(paths)));
        return event;
    }

    public static DebouncedEvent filesRemoved(List<Path> paths) {
        DebouncedEvent event = new DebouncedEvent();
        event.setType(Type.FILES_REMOVED);
        event.setPaths(Collections.unmodifiableList(new ArrayList<>(paths)));
        return event;
    }

    public static DebouncedEvent filesRenamed(List<RenamedPath> renames) {
        DebouncedEvent event = new DebouncedEvent();
        event.setType(Type.FILES_RENAMED);
        event.setRenames(Collections.unmodifiableList(new ArrayList<>(renames)));
        return event;
    }

    public int size() {
        return type == Type.FILES_RENAMED ? renames.size() : paths.size();
    }
}
