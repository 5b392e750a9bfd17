package tech.automator.platform.shared;

import jakarta.ws.rs.core.Response.Status;

/**
 * Catalogue of machine-readable error codes returned in the response envelope.
 * Each code fixes the HTTP status, the client-facing message and the default offending field.
 */
public enum ErrorCode {

    // ==================== Request validation ====================

    MISSING_CREDENTIALS(Status.BAD_REQUEST, "Email and password are required", "email,password"),
    MISSING_REQUIRED_FIELDS(Status.BAD_REQUEST, "Required fields are missing", "email,username,password"),
    INVALID_EMAIL_FORMAT(Status.BAD_REQUEST, "Invalid email format", "email"),
    INVALID_PASSWORD(Status.BAD_REQUEST, "Password does not meet length requirements", "password"),
    INVALID_LIMIT(Status.BAD_REQUEST, "Limit must be between 1 and 1000", "limit"),
    INVALID_SKIP(Status.BAD_REQUEST, "Skip must be a non-negative integer", "skip"),
    INVALID_FIELD(Status.BAD_REQUEST, "Field is not allowed or does not exist", null),
    INVALID_REQUEST_BODY(Status.BAD_REQUEST, "Request body is malformed", "body"),
    NO_FIELDS_TO_UPDATE(Status.BAD_REQUEST, "No fields provided to update", "body"),
    NO_CHANGES_MADE(Status.BAD_REQUEST, "No changes were made", "body"),
    MISSING_ORGANIZATION_NAME(Status.BAD_REQUEST, "Organization name is required", "name"),
    MISSING_BUSINESS_UNIT_NAME(Status.BAD_REQUEST, "Business unit name is required", "name"),
    MISSING_PROJECT_NAME(Status.BAD_REQUEST, "Project name is required", "name"),
    MISSING_MODULE_NAME(Status.BAD_REQUEST, "Module name is required", "name"),

    // ==================== Authentication / authorization ====================

    INVALID_CREDENTIALS(Status.UNAUTHORIZED, "Invalid email or password", "email,password"),
    INVALID_TOKEN(Status.UNAUTHORIZED, "Invalid authentication credentials", "authorization"),
    ACCESS_DENIED(Status.FORBIDDEN, "Insufficient permissions", "authorization"),
    ACCOUNT_INACTIVE(Status.FORBIDDEN, "Account is inactive", "is_active"),
    ACCOUNT_BANNED(Status.FORBIDDEN, "Account is banned", "is_banned"),
    ACCOUNT_SUSPENDED(Status.FORBIDDEN, "Account is suspended", "is_suspended"),
    NO_ORGANIZATION(Status.FORBIDDEN, "User is not associated with any organization", "org_id"),
    EMAIL_NOT_VERIFIED(Status.FORBIDDEN, "Email address is not verified", "email"),
    INVALID_ORGANIZATION(Status.BAD_REQUEST, "Invalid or inactive organization", "org_id"),

    // ==================== Not found ====================

    USER_NOT_FOUND(Status.NOT_FOUND, "User not found", "user_id"),
    ORGANIZATION_NOT_FOUND(Status.NOT_FOUND, "Organization not found", "org_id"),
    PARENT_ORGANIZATION_NOT_FOUND(Status.NOT_FOUND, "Parent organization not found", "org_id"),
    BUSINESS_UNIT_NOT_FOUND(Status.NOT_FOUND, "Business unit not found", "bu_id"),
    PROJECT_NOT_FOUND(Status.NOT_FOUND, "Project not found", "project_id"),
    MODULE_NOT_FOUND(Status.NOT_FOUND, "Module not found", "module_id"),

    // ==================== Conflicts ====================

    EMAIL_ALREADY_EXISTS(Status.BAD_REQUEST, "A user with this email already exists", "email"),
    USERNAME_ALREADY_EXISTS(Status.BAD_REQUEST, "A user with this username already exists", "username"),
    USER_ALREADY_EXISTS(Status.BAD_REQUEST, "A user with these identifiers already exists", "email,username"),
    ORG_ID_ALREADY_EXISTS(Status.BAD_REQUEST, "Organization ID already exists", "org_id"),
    ORG_NAME_ALREADY_EXISTS(Status.BAD_REQUEST, "Organization name already exists", "name"),
    BU_ID_ALREADY_EXISTS(Status.BAD_REQUEST, "Business unit ID already exists", "bu_id"),
    BU_NAME_ALREADY_EXISTS(Status.BAD_REQUEST, "Business unit name already exists in this organization", "name"),
    PROJECT_ID_ALREADY_EXISTS(Status.BAD_REQUEST, "Project ID already exists", "project_id"),
    PROJECT_NAME_ALREADY_EXISTS(Status.BAD_REQUEST, "Project name already exists in this organization", "name"),
    MODULE_ID_ALREADY_EXISTS(Status.BAD_REQUEST, "Module ID already exists", "module_id"),
    MODULE_NAME_ALREADY_EXISTS(Status.BAD_REQUEST, "Module name already exists in this project", "name"),

    // ==================== Dependencies ====================

    ORGANIZATION_HAS_DEPENDENCIES(Status.BAD_REQUEST, "Organization still has business units", "org_id"),
    BUSINESS_UNIT_HAS_DEPENDENCIES(Status.BAD_REQUEST, "Business unit still has child business units", "bu_id"),
    PROJECT_HAS_DEPENDENCIES(Status.BAD_REQUEST, "Project still has modules", "project_id"),

    // ==================== Infrastructure ====================

    DATABASE_ERROR(Status.INTERNAL_SERVER_ERROR, "Database error", "system"),
    USER_DATA_FORMAT_ERROR(Status.INTERNAL_SERVER_ERROR, "Stored user data is invalid", "system"),
    ACCOUNT_CONFIG_ERROR(Status.INTERNAL_SERVER_ERROR, "Account configuration error", "system"),
    TOKEN_GENERATION_ERROR(Status.INTERNAL_SERVER_ERROR, "Failed to generate authentication tokens", "system"),
    PASSWORD_ENCRYPTION_ERROR(Status.INTERNAL_SERVER_ERROR, "Failed to process password", "system"),
    LOGOUT_FAILED(Status.INTERNAL_SERVER_ERROR, "Failed to update logout status", "system"),
    INTERNAL_ERROR(Status.INTERNAL_SERVER_ERROR, "Internal server error", "system");

    private final Status status;
    private final String message;
    private final String field;

    ErrorCode(Status status, String message, String field) {
        this.status = status;
        this.message = message;
        this.field = field;
    }

    public Status status() {
        return status;
    }

    public String message() {
        return message;
    }

    public String field() {
        return field;
    }
}
