package dev.mars.pgprojection.outbox;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.pgprojection.api.storage.OperationRole;
import dev.mars.pgprojection.pg.storage.PgOperation;
import io.vertx.sqlclient.Tuple;

/**
 * Inserts one pending message into the outbox table.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public class PgOutboxInsertOperation extends PgOperation {

    static final String SQL = """
            INSERT INTO pgp_outbox (topic, message_type, payload, headers, batch_id, status, created_at)
            VALUES ($1, $2, $3::jsonb, $4::jsonb, $5, 'PENDING', NOW())
            """;

    private final String topic;
    private final String messageType;
    private final String payloadJson;
    private final String headersJson;
    private final String batchId;

    PgOutboxInsertOperation(String topic, String messageType, String payloadJson, String headersJson,
                            String batchId, String tenantId) {
        super(tenantId);
        this.topic = topic;
        this.messageType = messageType;
        this.payloadJson = payloadJson;
        this.headersJson = headersJson;
        this.batchId = batchId;
    }

    @Override
    public String getSql() {
        return SQL;
    }

    @Override
    public Tuple getParameters() {
        return Tuple.of(topic, messageType, payloadJson, headersJson, batchId);
    }

    public String getTopic() {
        return topic;
    }

    @Override
    public Class<?> getDocumentType() {
        return OutboxMessage.class;
    }

    @Override
    public OperationRole getRole() {
        return OperationRole.OTHER;
    }

    @Override
    public String toString() {
        return "PgOutboxInsertOperation{topic=" + topic + ", type=" + messageType + '}';
    }
}
