// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * What a node reports after publishing a contract.
 *
 * @param contractAddress the address of the new contract
 * @param senderAddress   the address that paid for the publication
 * @param txId            the id of the publishing transaction
 */
public record PublishReceipt(@NonNull String contractAddress, @NonNull String senderAddress, @NonNull String txId) {

    public PublishReceipt {
        requireNonNull(contractAddress, "contractAddress must not be null");
        requireNonNull(senderAddress, "senderAddress must not be null");
        requireNonNull(txId, "txId must not be null");
    }

    /**
     * Reads a receipt from a {@code publishcontract} answer.
     *
     * @param json the answer
     * @return the receipt
     * @throws IllegalArgumentException if a field is missing
     */
    @NonNull
    public static PublishReceipt fromJson(@NonNull final JsonNode json) {
        requireNonNull(json);
        return new PublishReceipt(
                requiredText(json, "contractaddress"), requiredText(json, "senderaddress"), requiredText(json, "txid"));
    }

    @NonNull
    private static String requiredText(@NonNull final JsonNode json, @NonNull final String field) {
        final JsonNode value = json.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            throw new IllegalArgumentException("publishcontract answer lacks '" + field + "': " + json);
        }
        return value.asText();
    }
}
