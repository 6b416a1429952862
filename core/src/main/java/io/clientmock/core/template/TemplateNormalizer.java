package io.clientmock.core.template;

/**
 * Canonicalizes generator URL templates so that templates can be compared by shape rather than by
 * parameter spelling.
 *
 * <p>Normalization:
 * <ol>
 * <li>strips the base-URL marker ({@value #DEFAULT_BASE_URL_MARKER} by default) when it is a
 * prefix;</li>
 * <li>rewrites each query fragment ({@code {?a,b}} or the continuation form {@code {&a,b}}) to
 * {@code {?queryParam1,queryParam2}}, keeping its operator and arity;</li>
 * <li>rewrites every other placeholder to {@code {pathParam<N>}}, counting from 1 in order of
 * appearance;</li>
 * <li>prepends {@code /} when missing.</li>
 * </ol>
 *
 * <p>So {@code {+baseurl}/api/funds/{fund%2Did}{?select}}, {@code /api/funds/{fundId}{?expand}}
 * and {@code api/funds/{id}{?x}} all normalize to {@code /api/funds/{pathParam1}{?queryParam1}}.
 *
 * <p>Normalization is total: malformed input (an unterminated brace, say) is copied through, and
 * {@code null} or empty input yields {@code "/"}.
 *
 * <p>Stateless and thread-safe.
 */
public final class TemplateNormalizer {

    /** The marker generated clients put in front of every template. */
    public static final String DEFAULT_BASE_URL_MARKER = "{+baseurl}";

    static final String PATH_TOKEN = "pathParam";
    static final String QUERY_TOKEN = "queryParam";

    private TemplateNormalizer() {}

    /**
     * Normalizes a template using {@link #DEFAULT_BASE_URL_MARKER}.
     *
     * @param template raw template, may be null
     * @return the canonical template, never null
     */
    public static String normalize(String template) {
        return normalize(template, DEFAULT_BASE_URL_MARKER);
    }

    /**
     * Normalizes a template.
     *
     * @param template      raw template, may be null
     * @param baseUrlMarker prefix to strip; null or empty disables stripping
     * @return the canonical template, never null
     */
    public static String normalize(String template, String baseUrlMarker) {
        if (template == null || template.isEmpty()) {
            return "/";
        }
        String remaining = template;
        if (baseUrlMarker != null && !baseUrlMarker.isEmpty() && remaining.startsWith(baseUrlMarker)) {
            remaining = remaining.substring(baseUrlMarker.length());
        }

        StringBuilder out = new StringBuilder(remaining.length() + 16);
        int pathIndex = 0;
        int queryIndex = 0;
        int i = 0;
        while (i < remaining.length()) {
            char c = remaining.charAt(i);
            if (c != '{') {
                out.append(c);
                i++;
                continue;
            }
            int close = remaining.indexOf('}', i + 1);
            if (close < 0) {
                // Unterminated placeholder: keep the rest as-is
                out.append(remaining, i, remaining.length());
                break;
            }
            String body = remaining.substring(i + 1, close);
            if (isQueryFragment(body)) {
                String[] names = body.substring(1).split(",");
                out.append('{').append(body.charAt(0));
                int written = 0;
                for (String name : names) {
                    if (name.trim().isEmpty()) {
                        continue;
                    }
                    if (written++ > 0) {
                        out.append(',');
                    }
                    out.append(QUERY_TOKEN).append(++queryIndex);
                }
                out.append('}');
            } else {
                out.append('{').append(PATH_TOKEN).append(++pathIndex).append('}');
            }
            i = close + 1;
        }

        if (out.length() == 0 || out.charAt(0) != '/') {
            out.insert(0, '/');
        }
        return out.toString();
    }

    /**
     * Removes every query fragment from a template, leaving the path part.
     *
     * @param template raw or normalized template, may be null
     * @return the template without query fragments; {@code null} becomes {@code ""}
     */
    public static String stripQueryFragments(String template) {
        if (template == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(template.length());
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                int close = template.indexOf('}', i + 1);
                if (close > i && isQueryFragment(template.substring(i + 1, close))) {
                    i = close + 1;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /** Whether the template contains a {@code {?...}} or {@code {&...}} fragment. */
    public static boolean hasQueryFragment(String template) {
        return template != null && !stripQueryFragments(template).equals(template);
    }

    /**
     * Counts path placeholders, ignoring query fragments and the base-URL marker.
     *
     * @param template raw or normalized template
     */
    public static int pathParameterCount(String template) {
        String normalized = normalize(template);
        int count = 0;
        int from = 0;
        String token = "{" + PATH_TOKEN;
        while ((from = normalized.indexOf(token, from)) >= 0) {
            count++;
            from += token.length();
        }
        return count;
    }

    /**
     * Whether two templates have the same shape: identical literal segments and the same path and
     * query parameters in the same positions. Names are ignored.
     *
     * @param first      raw or normalized template
     * @param second     raw or normalized template
     * @param ignoreCase whether literal segments compare case-insensitively
     */
    public static boolean sameStructure(String first, String second, boolean ignoreCase) {
        String a = normalize(first);
        String b = normalize(second);
        return ignoreCase ? a.equalsIgnoreCase(b) : a.equals(b);
    }

    private static boolean isQueryFragment(String body) {
        return !body.isEmpty() && (body.charAt(0) == '?' || body.charAt(0) == '&');
    }
}
