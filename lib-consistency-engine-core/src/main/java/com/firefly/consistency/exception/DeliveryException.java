/*
 * Copyright 2025 Firefly Software Solutions Inc
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

package com.firefly.consistency.exception;

/**
 * The message broker did not acknowledge an outbox message. Recoverable: the message
 * stays pending and is retried with backoff until it is dead-lettered.
 */
public class DeliveryException extends ConsistencyException {
    private final String messageId;
    private final String topic;

    public DeliveryException(String messageId, String topic, Throwable cause) {
        super("Delivery of outbox message " + messageId + " to topic " + topic + " failed"
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.messageId = messageId;
        this.topic = topic;
    }

    public String getMessageId() { return messageId; }
    public String getTopic() { return topic; }
}
