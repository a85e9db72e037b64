package work.lcod.lookup.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.lang.reflect.Field;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tag strings attached to a field, one per {@link TagSystem}.
 */
public final class FieldTags {
    private static final FieldTags EMPTY = new FieldTags(new EnumMap<>(TagSystem.class));

    private final Map<TagSystem, String> tags;

    private FieldTags(EnumMap<TagSystem, String> tags) {
        this.tags = Collections.unmodifiableMap(tags);
    }

    public static FieldTags empty() {
        return EMPTY;
    }

    public static FieldTags of(TagSystem system, String tag) {
        return EMPTY.with(system, tag);
    }

    /**
     * Reads {@link JsonProperty} and {@link LookupKey}. {@code @JsonInclude(NON_EMPTY)} next to a
     * {@code @JsonProperty} without a marker counts as {@code omitempty}.
     */
    public static FieldTags fromAnnotations(Field field) {
        FieldTags result = EMPTY;
        JsonProperty json = field.getAnnotation(JsonProperty.class);
        if (json != null && !json.value().isEmpty()) {
            String tag = json.value();
            JsonInclude include = field.getAnnotation(JsonInclude.class);
            if (include != null && include.value() == JsonInclude.Include.NON_EMPTY && tag.indexOf(',') < 0) {
                tag = tag + "," + TagSystem.JSON.optionalMarker();
            }
            result = result.with(TagSystem.JSON, tag);
        }
        LookupKey lookup = field.getAnnotation(LookupKey.class);
        if (lookup != null) {
            result = result.with(TagSystem.LOOKUP, lookup.value());
        }
        return result;
    }

    public FieldTags with(TagSystem system, String tag) {
        EnumMap<TagSystem, String> copy = tags.isEmpty() ? new EnumMap<>(TagSystem.class) : new EnumMap<>(tags);
        if (tag == null) {
            copy.remove(system);
        } else {
            copy.put(system, tag);
        }
        return new FieldTags(copy);
    }

    public Optional<String> get(TagSystem system) {
        return Optional.ofNullable(tags.get(system));
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}
