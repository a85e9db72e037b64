package work.lcod.lookup.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FieldKeyExtractorTest {
    @SuppressWarnings("unused")
    static class Tagged {
        @LookupKey("PLAIN")
        String plain;

        @LookupKey("OPT,optional")
        String optional;

        @LookupKey("WRONG_MARKER,omitempty")
        String wrongMarker;

        @JsonProperty("JSON_OPT,omitempty")
        String jsonOptional;

        @JsonProperty("JSON_WRONG,optional")
        String jsonWrongMarker;

        @JsonProperty("JSON_INCLUDE")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        String jsonInclude;

        @JsonProperty("BOTH_JSON")
        @LookupKey("BOTH_LOOKUP,optional")
        String both;

        @JsonProperty
        @LookupKey("FALLBACK,optional")
        String emptyJson;

        @LookupKey(",optional")
        String unnamed;

        @LookupKey("EXTRA,optional,ignored")
        String extraParts;

        @LookupKey("")
        String emptyLookup;

        String untagged;
    }

    @Test
    void readsKeyAndMarker() {
        assertEquals(key("PLAIN", false), extract("plain"));
        assertEquals(key("OPT", true), extract("optional"));
        assertEquals(key("JSON_OPT", true), extract("jsonOptional"));
        assertEquals(key("EXTRA", true), extract("extraParts"));
    }

    @Test
    void markerMustMatchTagSystem() {
        assertEquals(key("WRONG_MARKER", false), extract("wrongMarker"));
        assertEquals(key("JSON_WRONG", false), extract("jsonWrongMarker"));
    }

    @Test
    void jsonIncludeNonEmptyMeansOmitempty() {
        assertEquals(key("JSON_INCLUDE", true), extract("jsonInclude"));
    }

    @Test
    void jsonTagTakesPrecedenceOverLookupTag() {
        assertEquals(key("BOTH_JSON", false), extract("both"));
    }

    @Test
    void emptyJsonTagFallsThroughToLookupTag() {
        assertEquals(key("FALLBACK", true), extract("emptyJson"));
    }

    @Test
    void emptyKeyUsesFieldName() {
        assertEquals(key("unnamed", true), extract("unnamed"));
    }

    @Test
    void fieldsWithoutUsableTagAreSkipped() {
        assertTrue(extractOptional("untagged").isEmpty());
        assertTrue(extractOptional("emptyLookup").isEmpty());
    }

    @Test
    void worksOnExplicitTags() {
        var tags = FieldTags.of(TagSystem.LOOKUP, "L,optional").with(TagSystem.JSON, "J");
        assertEquals(Optional.of(key("J", false)), FieldKeyExtractor.extract("f", tags));
        assertEquals(Optional.empty(), FieldKeyExtractor.extract("f", FieldTags.empty()));
    }

    private static FieldKey key(String key, boolean optional) {
        return new FieldKey(key, optional);
    }

    private static FieldKey extract(String field) {
        return extractOptional(field).orElseThrow();
    }

    private static Optional<FieldKey> extractOptional(String field) {
        return RecordSchemas.of(Tagged.class).fields().stream()
            .filter(descriptor -> descriptor.name().equals(field))
            .findFirst()
            .flatMap(FieldKeyExtractor::extract);
    }
}
