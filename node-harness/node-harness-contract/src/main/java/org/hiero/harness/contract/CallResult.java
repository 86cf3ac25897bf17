// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import com.google.common.collect.Maps;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The outcome of one contract call. A successful result carries the fields of the node's answer unchanged, a failed
 * result carries only the failure reason.
 */
public final class CallResult {

    /** Field under which a non-object answer is stored. */
    public static final String RESULT_FIELD = "result";

    private final Map<String, JsonNode> fields;
    private final String failureReason;

    private CallResult(@NonNull final Map<String, JsonNode> fields, @Nullable final String failureReason) {
        this.fields = fields;
        this.failureReason = failureReason;
    }

    /**
     * Creates a successful result from the answer of a {@code callcontract} request.
     *
     * @param payload the answer
     * @return the result
     */
    @NonNull
    public static CallResult success(@NonNull final JsonNode payload) {
        requireNonNull(payload);
        final Map<String, JsonNode> fields = new LinkedHashMap<>();
        if (payload.isObject()) {
            payload.fields().forEachRemaining(entry -> fields.put(entry.getKey(), entry.getValue().deepCopy()));
        } else {
            fields.put(RESULT_FIELD, payload.deepCopy());
        }
        return new CallResult(Collections.unmodifiableMap(fields), null);
    }

    /**
     * Creates a failed result.
     *
     * @param reason the textual form of the failure
     * @return the result
     */
    @NonNull
    public static CallResult failure(@NonNull final String reason) {
        return new CallResult(Map.of(), requireNonNull(reason));
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    /**
     * Returns the fields of the node's answer, empty for a failed call.
     *
     * @return copies of the answer fields in the order the node sent them
     */
    @NonNull
    public Map<String, JsonNode> fields() {
        return Maps.transformValues(fields, node -> node.deepCopy());
    }

    public boolean has(@NonNull final String field) {
        return fields.containsKey(requireNonNull(field));
    }

    @Nullable
    public JsonNode get(@NonNull final String field) {
        final JsonNode value = fields.get(requireNonNull(field));
        return value == null ? null : value.deepCopy();
    }

    @NonNull
    public Optional<String> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? MoreObjects.toStringHelper(this).add("fields", fields).toString()
                : MoreObjects.toStringHelper(this)
                        .add("failureReason", failureReason)
                        .toString();
    }
}
