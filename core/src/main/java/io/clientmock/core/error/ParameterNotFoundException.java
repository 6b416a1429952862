package io.clientmock.core.error;

import java.util.List;

/**
 * Thrown when a logical parameter name cannot be resolved to any key of a request's parameter
 * map, under any of its naming variations.
 *
 * <p>The message is the primary way a test author learns which name the generator really used,
 * so it always lists the variations that were tried and the keys that were present.
 */
public final class ParameterNotFoundException extends ClientMockException {

    private static final long serialVersionUID = 1L;

    /** Which parameter map the lookup ran against. */
    public enum Kind {
        PATH,
        QUERY
    }

    private final String parameterName;
    private final Kind kind;
    private final List<String> attemptedVariations;
    private final String normalizedTemplate;
    private final List<String> availableKeys;

    public ParameterNotFoundException(
            String parameterName,
            Kind kind,
            List<String> attemptedVariations,
            String template,
            String normalizedTemplate,
            List<String> availableKeys) {
        super(
                buildMessage(parameterName, kind, attemptedVariations, template, normalizedTemplate, availableKeys),
                template,
                Phase.DISPATCH);
        this.parameterName = parameterName;
        this.kind = kind;
        this.attemptedVariations = List.copyOf(attemptedVariations);
        this.normalizedTemplate = normalizedTemplate;
        this.availableKeys = List.copyOf(availableKeys);
    }

    /** The logical name the caller asked for. */
    public String parameterName() {
        return parameterName;
    }

    public Kind kind() {
        return kind;
    }

    /** Every spelling that was looked up, in lookup order. */
    public List<String> attemptedVariations() {
        return attemptedVariations;
    }

    public String normalizedTemplate() {
        return normalizedTemplate;
    }

    /** Keys actually present, annotated with their decoded form where it differs. */
    public List<String> availableKeys() {
        return availableKeys;
    }

    private static String buildMessage(
            String parameterName,
            Kind kind,
            List<String> attemptedVariations,
            String template,
            String normalizedTemplate,
            List<String> availableKeys) {
        String label = kind == Kind.PATH ? "Path" : "Query";
        StringBuilder sb = new StringBuilder();
        sb.append(label)
                .append(" parameter '")
                .append(parameterName)
                .append("' not found in request for template '")
                .append(template)
                .append("' (normalized: '")
                .append(normalizedTemplate)
                .append("'). Tried variations: ")
                .append(attemptedVariations)
                .append(". Available keys: ");
        if (availableKeys.isEmpty()) {
            sb.append("(none)");
        } else {
            sb.append(availableKeys);
        }
        sb.append('.');
        return sb.toString();
    }
}
