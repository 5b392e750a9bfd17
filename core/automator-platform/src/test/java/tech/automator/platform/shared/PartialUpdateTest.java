package tech.automator.platform.shared;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the partial-update builder.
 */
class PartialUpdateTest {

    /** Minimal mutable record under update. */
    private static final class Target {
        String name = "Acme";
        String city = "Berlin";
        Address address = null;
    }

    @Test
    @DisplayName("apply should write only the fields whose value changed")
    void apply_shouldWriteChangedFields() {
        // Arrange
        Target target = new Target();

        // Act
        ServiceResult<List<String>> result = PartialUpdate.builder()
            .field("name", "Acme Corp", target.name, v -> target.name = v)
            .field("city", "Berlin", target.city, v -> target.city = v)
            .apply();

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).containsExactly("name");
        assertThat(target.name).isEqualTo("Acme Corp");
        assertThat(target.city).isEqualTo("Berlin");
    }

    @Test
    @DisplayName("apply should report NO_FIELDS_TO_UPDATE when nothing was supplied")
    void apply_shouldReturnNoFieldsToUpdate_whenAllNull() {
        Target target = new Target();

        ServiceResult<List<String>> result = PartialUpdate.builder()
            .field("name", null, target.name, v -> target.name = v)
            .apply();

        assertThat(((ServiceResult.Failure<?>) result).code()).isEqualTo(ErrorCode.NO_FIELDS_TO_UPDATE);
    }

    @Test
    @DisplayName("apply should report NO_CHANGES_MADE when every supplied value is unchanged")
    void apply_shouldReturnNoChangesMade_whenValuesEqual() {
        Target target = new Target();

        ServiceResult<List<String>> result = PartialUpdate.builder()
            .field("name", "Acme", target.name, v -> target.name = v)
            .apply();

        assertThat(((ServiceResult.Failure<?>) result).code()).isEqualTo(ErrorCode.NO_CHANGES_MADE);
    }

    @Test
    @DisplayName("apply should reject a patch against an absent embedded structure and write nothing")
    void apply_shouldReturnInvalidField_whenEnclosingStructureAbsent() {
        // Arrange
        Target target = new Target();

        // Act
        ServiceResult<List<String>> result = PartialUpdate.builder()
            .field("name", "Changed", target.name, v -> target.name = v)
            .field("address.city", target.address != null, "Paris", null, v -> target.address.city = v)
            .field("address.country", target.address != null, "FR", null, v -> target.address.country = v)
            .apply();

        // Assert
        ServiceResult.Failure<?> failure = (ServiceResult.Failure<?>) result;
        assertThat(failure.code()).isEqualTo(ErrorCode.INVALID_FIELD);
        assertThat(failure.errors()).extracting(ErrorDetail::field).containsExactly("address.city", "address.country");
        assertThat(target.name).isEqualTo("Acme");
    }

    @Test
    @DisplayName("reject should surface as INVALID_FIELD with the given message")
    void reject_shouldProduceInvalidField() {
        ServiceResult<List<String>> result = PartialUpdate.builder()
            .reject("org_id", "Organization id cannot be changed")
            .apply();

        ServiceResult.Failure<?> failure = (ServiceResult.Failure<?>) result;
        assertThat(failure.code()).isEqualTo(ErrorCode.INVALID_FIELD);
        assertThat(failure.errors()).singleElement()
            .satisfies(detail -> {
                assertThat(detail.field()).isEqualTo("org_id");
                assertThat(detail.message()).isEqualTo("Organization id cannot be changed");
            });
    }
}
