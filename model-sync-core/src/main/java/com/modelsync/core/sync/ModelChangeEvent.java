package com.modelsync.core.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelsync.core.diagram.DiagramSnapshot;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Change notification delivered to model subscribers.
 *
 * @param type event type
 * @param uri document URI
 * @param version document version the event was computed for
 * @param timestamp creation time, epoch milliseconds
 * @param changes element changes relative to the previously published model
 * @param content the new model, null when the model was removed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelChangeEvent(
    Type type,
    String uri,
    long version,
    long timestamp,
    List<ElementChange> changes,
    DiagramSnapshot content
) {
    /**
     * Event types.
     */
    public enum Type {
        MODEL_UPDATED,
        MODEL_REMOVED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
    }

    public ModelChangeEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(uri, "uri must not be null");
        changes = changes != null ? List.copyOf(changes) : List.of();
    }

    public static ModelChangeEvent updated(String uri, long version, List<ElementChange> changes, DiagramSnapshot content) {
        return new ModelChangeEvent(Type.MODEL_UPDATED, uri, version, System.currentTimeMillis(), changes, content);
    }

    public static ModelChangeEvent removed(String uri, long version) {
        return new ModelChangeEvent(Type.MODEL_REMOVED, uri, version, System.currentTimeMillis(), List.of(), null);
    }

    public boolean isRemoval() {
        return type == Type.MODEL_REMOVED;
    }
}
