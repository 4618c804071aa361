package me.golemcore.relay.adapter.inbound.onebot;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standard OneBot action response envelope.
 */
@Data
@NoArgsConstructor
public class OneBotResponse {

    private String status;
    private Integer retcode;
    private JsonNode data;
    private String message;
    private String wording;

    public boolean isOk() {
        return "ok".equalsIgnoreCase(status);
    }

    public String messageId() {
        if (data == null || !data.hasNonNull("message_id")) {
            return null;
        }
        return data.get("message_id").asText();
    }
}
