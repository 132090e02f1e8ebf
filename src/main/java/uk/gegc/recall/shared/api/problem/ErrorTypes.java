package uk.gegc.recall.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://recall.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== State Errors ====================
    public static final URI CARD_DELETED = URI.create(BASE_URL + "/card-deleted");
    public static final URI REVIEW_ALREADY_RECORDED = URI.create(BASE_URL + "/review-already-recorded");
    public static final URI ILLEGAL_STATE = URI.create(BASE_URL + "/illegal-state");
    public static final URI OPTIMISTIC_LOCK_CONFLICT = URI.create(BASE_URL + "/optimistic-lock-conflict");

    // ==================== Server Errors ====================
    public static final URI INTERNAL_ERROR = URI.create(BASE_URL + "/internal-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
