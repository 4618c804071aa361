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

import feign.Headers;
import feign.RequestLine;

/**
 * OneBot 11 HTTP command API, the subset used to publish replies.
 */
@Headers("Content-Type: application/json")
public interface OneBotApi {

    @RequestLine("POST /send_private_msg")
    OneBotResponse sendPrivateMessage(OneBotSendRequest request);

    @RequestLine("POST /send_group_msg")
    OneBotResponse sendGroupMessage(OneBotSendRequest request);
}
