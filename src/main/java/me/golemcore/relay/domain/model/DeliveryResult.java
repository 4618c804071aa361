package me.golemcore.relay.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of sending a reply through the gateway.
 */
@Data
@Builder
public class DeliveryResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isDelivered()
    private boolean delivered;
    private String deliveryId;
    private GatewayFailureKind failureKind;
    private String error;

    public static DeliveryResult delivered(String deliveryId) {
        return DeliveryResult.builder()
                .delivered(true)
                .deliveryId(deliveryId)
                .build();
    }

    public static DeliveryResult failure(GatewayFailureKind kind, String error) {
        return DeliveryResult.builder()
                .delivered(false)
                .failureKind(kind)
                .error(error)
                .build();
    }
}
