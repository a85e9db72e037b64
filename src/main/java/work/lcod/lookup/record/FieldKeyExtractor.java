package work.lcod.lookup.record;

import java.util.Optional;

/**
 * Derives the lookup key and optionality of a field from its tags.
 *
 * <p>Tag systems are tried in {@link TagSystem} order and the first present, non-empty tag wins;
 * the others are ignored even when they disagree. A tag is {@code key} or {@code key,marker}; the
 * field is optional iff the second part equals the tag system's marker. An empty key part falls
 * back to the field name. Fields without any tag are not resolved at all.
 */
public final class FieldKeyExtractor {
    private FieldKeyExtractor() {}

    public static Optional<FieldKey> extract(FieldDescriptor field) {
        return extract(field.name(), field.tags());
    }

    public static Optional<FieldKey> extract(String fieldName, FieldTags tags) {
        for (TagSystem system : TagSystem.values()) {
            Optional<String> tag = tags.get(system);
            if (tag.isEmpty() || tag.get().isEmpty()) {
                continue;
            }
            String[] parts = tag.get().split(",", -1);
            String key = parts[0].isEmpty() ? fieldName : parts[0];
            boolean optional = parts.length > 1 && parts[1].equals(system.optionalMarker());
            return Optional.of(new FieldKey(key, optional));
        }
        return Optional.empty();
    }
}
