package tech.automator.platform.shared;

/**
 * Validated limit/skip window for list endpoints.
 */
public record PageRequest(int limit, int skip) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    /**
     * Validate raw query parameters. Absent values fall back to limit 100, skip 0.
     */
    public static ServiceResult<PageRequest> of(Integer limit, Integer skip) {
        int effectiveLimit = limit != null ? limit : DEFAULT_LIMIT;
        int effectiveSkip = skip != null ? skip : 0;

        if (effectiveLimit < 1 || effectiveLimit > MAX_LIMIT) {
            return ServiceResult.failure(ErrorCode.INVALID_LIMIT);
        }
        if (effectiveSkip < 0) {
            return ServiceResult.failure(ErrorCode.INVALID_SKIP);
        }
        return ServiceResult.success(new PageRequest(effectiveLimit, effectiveSkip));
    }

    /**
     * Inclusive end index for Panache {@code range(skip, lastIndex())}.
     */
    public int lastIndex() {
        return skip + limit - 1;
    }
}
