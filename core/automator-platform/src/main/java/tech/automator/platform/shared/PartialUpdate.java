package tech.automator.platform.shared;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Builder for partial updates against an already-loaded record.
 *
 * <p>Each {@code field(...)} call registers one optional patch value. Absent values
 * ({@code null}) are skipped. A supplied value whose target field is not present on the
 * existing record is collected as an {@link ErrorCode#INVALID_FIELD} detail. Values equal
 * to the current one are ignored. Nothing is written to the record until {@link #apply()}
 * succeeds, so a rejected patch leaves the record untouched.
 *
 * <pre>{@code
 * ServiceResult<List<String>> changed = PartialUpdate.builder()
 *     .field("name", patch.name(), org.name, v -> org.name = v)
 *     .field("address.city", org.address != null, patch.city(), cityOf(org), v -> org.address.city = v)
 *     .apply();
 * }</pre>
 */
public final class PartialUpdate {

    private final List<ErrorDetail> invalidFields = new ArrayList<>();
    private final List<String> changedFields = new ArrayList<>();
    private final List<Runnable> writes = new ArrayList<>();
    private int suppliedCount;

    private PartialUpdate() {
    }

    public static PartialUpdate builder() {
        return new PartialUpdate();
    }

    public <V> PartialUpdate field(String name, V requested, V current, Consumer<V> setter) {
        return field(name, true, requested, current, setter);
    }

    /**
     * @param present whether the existing record carries this field (or its enclosing structure)
     */
    public <V> PartialUpdate field(String name, boolean present, V requested, V current, Consumer<V> setter) {
        if (requested == null) {
            return this;
        }
        suppliedCount++;
        if (!present) {
            invalidFields.add(ErrorDetail.of(ErrorCode.INVALID_FIELD,
                "Field '" + name + "' does not exist on the target record", name));
            return this;
        }
        if (!Objects.equals(requested, current)) {
            changedFields.add(name);
            writes.add(() -> setter.accept(requested));
        }
        return this;
    }

    /**
     * Record a supplied field the caller has already determined cannot be changed.
     */
    public PartialUpdate reject(String name, String message) {
        suppliedCount++;
        invalidFields.add(ErrorDetail.of(ErrorCode.INVALID_FIELD, message, name));
        return this;
    }

    /**
     * Validate the accumulated patch and, if acceptable, write every changed value.
     *
     * @return the names of the fields that changed
     */
    public ServiceResult<List<String>> apply() {
        if (!invalidFields.isEmpty()) {
            return ServiceResult.failure(ErrorCode.INVALID_FIELD, invalidFields);
        }
        if (suppliedCount == 0) {
            return ServiceResult.failure(ErrorCode.NO_FIELDS_TO_UPDATE);
        }
        if (changedFields.isEmpty()) {
            return ServiceResult.failure(ErrorCode.NO_CHANGES_MADE);
        }
        writes.forEach(Runnable::run);
        return ServiceResult.success(List.copyOf(changedFields));
    }
}
