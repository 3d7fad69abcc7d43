package uk.gegc.codejudge.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;
import java.util.Map;

/**
 * Builds the RFC 7807 bodies returned by the API. Every body carries a type URI from
 * {@link ErrorTypes}, the request path as {@code instance}, and a {@code timestamp}.
 */
public final class ProblemDetailBuilder {

    private static final String URI_PREFIX = "uri=";

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       HttpServletRequest request) {
        return create(status, type, title, detail, request, Map.of());
    }

    /**
     * Same as {@link #create(HttpStatus, URI, String, String, HttpServletRequest)} with extra
     * members added to the body, e.g. the offending contest slug or parameter name.
     */
    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       HttpServletRequest request, Map<String, Object> properties) {
        return build(status, type, title, detail, request != null ? request.getRequestURI() : null, properties);
    }

    /**
     * Variant for the {@code ResponseEntityExceptionHandler} overrides, which only see a {@link WebRequest}.
     */
    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       WebRequest request) {
        return build(status, type, title, detail, pathOf(request), Map.of());
    }

    private static String pathOf(WebRequest request) {
        if (request == null) {
            return null;
        }
        String description = request.getDescription(false);
        if (description == null) {
            return null;
        }
        return description.startsWith(URI_PREFIX) ? description.substring(URI_PREFIX.length()) : description;
    }

    private static ProblemDetail build(HttpStatus status, URI type, String title, String detail,
                                       String path, Map<String, Object> properties) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (path != null) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("timestamp", Instant.now());
        properties.forEach(problem::setProperty);
        return problem;
    }
}
