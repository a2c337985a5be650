/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.stompy.client.tcp;

import io.stompy.client.AckMode;
import io.stompy.client.Receipt;
import io.stompy.client.ReceiptFuture;
import io.stompy.client.Transaction;
import io.stompy.exception.StompTransactionClosedException;
import io.stompy.frame.Command;
import io.stompy.frame.Frame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeBroker broker;
    private StompTcpClient client;

    @BeforeEach
    void setUp() {
        broker = FakeBroker.start();
        client = StompTcpClient.builder()
                .address(broker.address())
                .connectionTimeout(WAIT)
                .buildAndConnect();
        broker.nextFrame(Command.CONNECT);
    }

    @AfterEach
    void tearDown() {
        client.close();
        broker.close();
    }

    @Test
    void shouldBeginWithReceiptAndCommitWithTransactionHeader() {
        // when
        Transaction transaction = client.transaction();
        transaction.message("/queue/a", "in tx");
        Optional<ReceiptFuture> commit = transaction.commit(Receipt.auto());

        // then
        assertThat(transaction.id()).isEqualTo("t.1");
        Frame begin = broker.nextFrame(Command.BEGIN);
        assertThat(begin.headers().keySet()).containsExactly("transaction", "receipt");
        assertThat(begin.get("receipt")).contains(transaction.beginReceipt().receiptId());
        assertThat(broker.nextFrame(Command.SEND).get("transaction")).contains("t.1");
        broker.nextFrame(Command.COMMIT);
        String receiptId = commit.orElseThrow().receiptId();
        assertThat(broker.rawText()).endsWith("COMMIT\ntransaction:t.1\nreceipt:" + receiptId + "\n\n\0");
        assertThat(transaction.isClosed()).isTrue();
    }

    @Test
    void shouldUseCallerChosenId() {
        // when
        Transaction transaction = client.transaction(Optional.of("batch-7"));

        // then
        assertThat(transaction.id()).isEqualTo("batch-7");
        assertThat(broker.nextFrame(Command.BEGIN).get("transaction")).contains("batch-7");
    }

    @Test
    void shouldResolveBeginReceipt() {
        // given
        broker.sendReceipts(true);
        Transaction transaction = client.transaction();
        broker.nextFrame(Command.BEGIN);
        broker.send("MESSAGE\nsubscription:s.0\ndestination:/queue/a\n\nwake\0");

        // when
        client.recv(WAIT);

        // then
        assertThat(transaction.beginReceipt().await(WAIT).get("receipt-id"))
                .contains(transaction.beginReceipt().receiptId());
    }

    @Test
    void shouldAbortWithoutReceipt() {
        // given
        Transaction transaction = client.transaction();
        broker.nextFrame(Command.BEGIN);

        // when
        Optional<ReceiptFuture> abort = transaction.abort();

        // then
        assertThat(abort).isEmpty();
        broker.nextFrame(Command.ABORT);
        assertThat(broker.rawText()).endsWith("ABORT\ntransaction:" + transaction.id() + "\n\n\0");
    }

    @Test
    void shouldRejectEveryOperationOnceFinished() {
        // given
        Transaction transaction = client.transaction();
        transaction.commit();

        // then
        assertThatThrownBy(() -> transaction.message("/queue/a", "late"))
                .isInstanceOfSatisfying(
                        StompTransactionClosedException.class,
                        e -> assertThat(e.getTransactionId()).isEqualTo(transaction.id()));
        assertThatThrownBy(transaction::commit).isInstanceOf(StompTransactionClosedException.class);
        assertThatThrownBy(transaction::abort).isInstanceOf(StompTransactionClosedException.class);
        assertThatThrownBy(() -> transaction.ack("a1")).isInstanceOf(StompTransactionClosedException.class);
        assertThatThrownBy(() -> transaction.nack("a1")).isInstanceOf(StompTransactionClosedException.class);
        assertThatThrownBy(() -> transaction.recv(Optional.of(WAIT)))
                .isInstanceOf(StompTransactionClosedException.class);
        assertThatThrownBy(() ->
                        transaction.send(Command.SEND, Map.of("destination", "/q"), new byte[0], Receipt.none()))
                .isInstanceOf(StompTransactionClosedException.class);
    }

    @Test
    void shouldTagAcksWithTransaction() {
        // given
        Transaction transaction = client.transaction();
        broker.nextFrame(Command.BEGIN);

        // when
        transaction.ack("a1");
        transaction.nack("a2");

        // then
        assertThat(broker.nextFrame(Command.ACK).headers())
                .containsEntry("id", "a1")
                .containsEntry("transaction", transaction.id());
        assertThat(broker.nextFrame(Command.NACK).headers())
                .containsEntry("id", "a2")
                .containsEntry("transaction", transaction.id());
    }

    @Test
    void shouldTagAutomaticAcksWithTransaction() {
        // given
        String subscription = client.subscribe("/queue/a", AckMode.CLIENT);
        Transaction transaction = client.transaction();
        broker.nextFrame(Command.SUBSCRIBE);
        broker.nextFrame(Command.BEGIN);

        // when
        broker.send("MESSAGE\nsubscription:" + subscription + "\nack:a5\ndestination:/queue/a\n\nbody\0");
        transaction.recv(Optional.of(WAIT));

        // then
        Frame ack = broker.nextFrame(Command.ACK);
        assertThat(ack.get("id")).contains("a5");
        assertThat(ack.get("transaction")).contains(transaction.id());
    }
}
