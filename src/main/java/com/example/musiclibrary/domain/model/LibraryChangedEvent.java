package com.example.musiclibrary.domain.model;

import org.springframework.context.ApplicationEvent;

/**
 * Published after a batch or rescan changed the catalog. Listeners refresh their views; the engine keeps no
 * reference to them.
 */
public class LibraryChangedEvent extends ApplicationEvent {

    private final DebouncedEvent.Type trigger;
    private final SyncResult result;

    public LibraryChangedEvent(Object source, DebouncedEvent.Type trigger, SyncResult result) {
        super(source);
        this.trigger = trigger;
        this.result = result;
    }

    /** Batch type that caused the change, null for a full rescan. */
    public DebouncedEvent.Type getTrigger() {
        return trigger;
    }

    public SyncResult getResult() {
        return result;
    }
}
