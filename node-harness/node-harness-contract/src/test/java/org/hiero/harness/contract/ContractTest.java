// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.contract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Random;
import org.hiero.harness.rpc.NodeRpc;
import org.hiero.harness.rpc.RpcException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link Contract}.
 */
@ExtendWith(MockitoExtension.class)
class ContractTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Path ARTIFACT = Path.of("contract_1", "contract.lua");

    @Mock
    private NodeRpc endpoint;

    @Mock
    private NodeRpc otherNode;

    private Contract contract;

    @BeforeEach
    void setUp() {
        contract = new Contract(endpoint, ARTIFACT, false, new Random(1));
    }

    private static ObjectNode receipt(final String address, final String sender, final String txId) {
        final ObjectNode json = MAPPER.createObjectNode();
        json.put("contractaddress", address);
        json.put("senderaddress", sender);
        json.put("txid", txId);
        return json;
    }

    @Test
    void newContractIsUnpublished() {
        assertThat(contract.isPublished()).isFalse();
        assertThatThrownBy(contract::address).isInstanceOf(NotPublishedException.class);
        assertThatThrownBy(contract::publisher).isInstanceOf(NotPublishedException.class);
        assertThatThrownBy(contract::publishTransactionId).isInstanceOf(NotPublishedException.class);
        verify(endpoint, never()).publishContract(any());
    }

    @Test
    void publishRecordsTheWholeReceipt() {
        when(endpoint.publishContract(ARTIFACT)).thenReturn(receipt("cAddr", "sAddr", "tx1"));

        contract.publish();

        assertThat(contract.isPublished()).isTrue();
        assertThat(contract.address()).isEqualTo("cAddr");
        assertThat(contract.publisher()).isEqualTo("sAddr");
        assertThat(contract.publishTransactionId()).isEqualTo("tx1");
    }

    @Test
    void secondPublishIsANoOp() {
        when(endpoint.publishContract(ARTIFACT)).thenReturn(receipt("cAddr", "sAddr", "tx1"));

        contract.publish();
        final PublishReceipt first = contract.receipt();
        contract.publish();

        assertThat(contract.receipt()).isSameAs(first);
        verify(endpoint, times(1)).publishContract(ARTIFACT);
    }

    @Test
    void incompleteReceiptLeavesContractUnpublished() {
        final ObjectNode incomplete = MAPPER.createObjectNode().put("contractaddress", "cAddr");
        when(endpoint.publishContract(ARTIFACT)).thenReturn(incomplete);

        assertThatThrownBy(contract::publish)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("senderaddress");
        assertThat(contract.isPublished()).isFalse();
    }

    @Test
    void rejectedPublishLeavesContractUnpublished() {
        when(endpoint.publishContract(ARTIFACT)).thenThrow(new RpcException("publishcontract", -4, "bad code"));

        assertThatThrownBy(contract::publish).isInstanceOf(RpcException.class);
        assertThat(contract.isPublished()).isFalse();
    }

    @Test
    void callerBeforePublishFailsFast() {
        assertThatThrownBy(() -> contract.caller("transfer")).isInstanceOf(NotPublishedException.class);
        assertThatThrownBy(() -> contract.resolve("call_transfer")).isInstanceOf(NotPublishedException.class);
    }

    @Test
    void unpublishedCheckComesBeforeNameCheck() {
        assertThatThrownBy(() -> contract.resolve("transfer")).isInstanceOf(NotPublishedException.class);
    }

    @Test
    void resolveStripsCallPrefix() {
        when(endpoint.publishContract(ARTIFACT)).thenReturn(receipt("cAddr", "sAddr", "tx1"));
        contract.publish();

        final Caller caller = contract.resolve("call_transfer");

        assertThat(caller.function()).isEqualTo("transfer");
        assertThat(caller.contractAddress()).isEqualTo("cAddr");
        assertThat(caller.defaultSender()).isEqualTo("sAddr");
    }

    @Test
    void resolveOnlyStripsTheFirstPrefix() {
        when(endpoint.publishContract(ARTIFACT)).thenReturn(receipt("cAddr", "sAddr", "tx1"));
        contract.publish();

        assertThat(contract.resolve("call_call_me").function()).isEqualTo("call_me");
    }

    @ParameterizedTest
    @ValueSource(strings = {"transfer", "call_", "Call_transfer", "getbalance"})
    void unknownSymbolicNamesAreRejected(final String name) {
        when(endpoint.publishContract(ARTIFACT)).thenReturn(receipt("cAddr", "sAddr", "tx1"));
        contract.publish();

        assertThatThrownBy(() -> contract.resolve(name))
                .isInstanceOfSatisfying(UnknownAttributeException.class, e -> assertThat(e.name())
                        .isEqualTo(name));
    }

    @Test
    void balanceIsQueriedOnBoundOrGivenNode() {
        when(endpoint.publishContract(ARTIFACT)).thenReturn(receipt("cAddr", "sAddr", "tx1"));
        when(endpoint.getBalanceOf("cAddr")).thenReturn(new BigDecimal("1.5"));
        when(otherNode.getBalanceOf("cAddr")).thenReturn(new BigDecimal("2.5"));
        contract.publish();

        assertThat(contract.balance()).isEqualByComparingTo("1.5");
        assertThat(contract.balance(otherNode)).isEqualByComparingTo("2.5");
    }

    @Test
    void balanceBeforePublishFailsFast() {
        assertThatThrownBy(contract::balance).isInstanceOf(NotPublishedException.class);
    }
}
