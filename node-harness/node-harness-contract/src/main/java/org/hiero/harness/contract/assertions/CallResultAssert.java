// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract.assertions;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import org.assertj.core.api.AbstractAssert;
import org.hiero.harness.contract.CallResult;

/**
 * Assertions for {@link CallResult}.
 */
public class CallResultAssert extends AbstractAssert<CallResultAssert, CallResult> {

    /**
     * Constructs an assertion for the given {@link CallResult}.
     *
     * @param actual the actual {@link CallResult} to assert
     */
    protected CallResultAssert(@Nullable final CallResult actual) {
        super(actual, CallResultAssert.class);
    }

    /**
     * Creates an assertion for the given {@link CallResult}.
     *
     * @param actual the actual {@link CallResult} to assert
     * @return a new instance of {@link CallResultAssert}
     */
    @NonNull
    public static CallResultAssert assertThat(@Nullable final CallResult actual) {
        return new CallResultAssert(actual);
    }

    /**
     * Verifies that the call succeeded.
     *
     * @return this assertion object for method chaining
     */
    @NonNull
    public CallResultAssert succeeded() {
        isNotNull();
        if (!actual.isSuccess()) {
            failWithMessage("Expected call to succeed, but it failed with: %s", actual.failureReason().orElseThrow());
        }
        return this;
    }

    /**
     * Verifies that the call failed.
     *
     * @return this assertion object for method chaining
     */
    @NonNull
    public CallResultAssert failed() {
        isNotNull();
        if (actual.isSuccess()) {
            failWithMessage("Expected call to fail, but it succeeded with: %s", actual.fields());
        }
        return this;
    }

    /**
     * Verifies that the call failed with a reason containing the given text.
     *
     * @param text the expected part of the failure reason
     * @return this assertion object for method chaining
     */
    @NonNull
    public CallResultAssert hasFailureReasonContaining(@NonNull final String text) {
        requireNonNull(text);
        failed();
        final String reason = actual.failureReason().orElseThrow();
        if (!reason.contains(text)) {
            failWithMessage("Expected failure reason to contain '%s', but was '%s'", text, reason);
        }
        return this;
    }

    @NonNull
    public CallResultAssert hasField(@NonNull final String field) {
        requireNonNull(field);
        succeeded();
        if (!actual.has(field)) {
            failWithMessage("Expected field '%s', but the answer has only %s", field, actual.fields().keySet());
        }
        return this;
    }

    /**
     * Verifies that the answer has the given field with the given textual value.
     *
     * @param field the field name
     * @param value the expected value, compared against the field's text
     * @return this assertion object for method chaining
     */
    @NonNull
    public CallResultAssert hasFieldValue(@NonNull final String field, @NonNull final String value) {
        requireNonNull(value);
        hasField(field);
        final JsonNode actualValue = requireNonNull(actual.get(field));
        if (!value.equals(actualValue.asText())) {
            failWithMessage("Expected field '%s' to be '%s', but was '%s'", field, value, actualValue);
        }
        return this;
    }
}
