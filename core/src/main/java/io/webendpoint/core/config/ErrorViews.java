package io.webendpoint.core.config;

/** Naming convention for the error view that renders an endpoint's error pages. */
public final class ErrorViews {

    static final String SUFFIX = "ErrorView";

    private ErrorViews() {
        // utility class
    }

    /**
     * Derives the error view target from the first namespace segment of the endpoint id, e.g.
     * {@code MyApp.Web.Endpoint} → {@code MyApp.ErrorView}.
     *
     * @throws IllegalArgumentException if the endpoint id is null or blank
     */
    public static String errorViewFor(String endpointId) {
        if (endpointId == null || endpointId.isBlank()) {
            throw new IllegalArgumentException("endpointId must not be null or blank");
        }
        String trimmed = endpointId.strip();
        int dot = trimmed.indexOf('.');
        String namespace = dot < 0 ? trimmed : trimmed.substring(0, dot);
        return namespace + "." + SUFFIX;
    }
}
