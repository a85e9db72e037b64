package work.lcod.lookup.record;

/**
 * Annotation conventions that attach a lookup key to a field, in priority order.
 */
public enum TagSystem {
    /** {@code @JsonProperty("KEY")} or {@code @JsonProperty("KEY,omitempty")}. */
    JSON("omitempty"),
    /** {@code @LookupKey("KEY")} or {@code @LookupKey("KEY,optional")}. */
    LOOKUP("optional");

    private final String optionalMarker;

    TagSystem(String optionalMarker) {
        this.optionalMarker = optionalMarker;
    }

    public String optionalMarker() {
        return optionalMarker;
    }
}
