package com.tektonqueue.mutation;

import com.tektonqueue.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MutationRequestTest {

    @Test
    @DisplayName("Factories should set kind, key and value")
    void factoriesShouldBuildRequests() {
        assertEquals(new MutationRequest(MutationKind.ANNOTATION, "a", "b"), MutationRequest.annotation("a", "b"));
        assertEquals(new MutationRequest(MutationKind.LABEL, "l", "v"), MutationRequest.label("l", "v"));
        assertEquals(new MutationRequest(MutationKind.RESOURCE, "r", "42"), MutationRequest.resource("r", 42));
    }

    @Test
    @DisplayName("Should accept complete requests")
    void shouldValidateCompleteRequest() {
        assertDoesNotThrow(() -> MutationRequest.label("team", "core").validate());
        assertDoesNotThrow(() -> MutationRequest.resource("cpu", 0).validate());
    }

    @Test
    @DisplayName("Should reject missing kind, key or value")
    void shouldRejectIncompleteRequests() {
        assertEquals("invalid mutation type: null",
                assertThrows(ValidationException.class,
                        () -> new MutationRequest(null, "k", "v").validate()).getMessage());
        assertEquals("mutation key cannot be empty",
                assertThrows(ValidationException.class,
                        () -> MutationRequest.label("", "v").validate()).getMessage());
        assertEquals("mutation value cannot be empty",
                assertThrows(ValidationException.class,
                        () -> MutationRequest.annotation("k", "").validate()).getMessage());
    }
}
