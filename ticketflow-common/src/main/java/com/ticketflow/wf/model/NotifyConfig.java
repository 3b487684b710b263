/*
 *   Copyright Ticketflow Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package com.ticketflow.wf.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class NotifyConfig implements StepConfig {

    private final String notificationTemplate;
    private final List<String> recipients;

    public NotifyConfig(String notificationTemplate, List<String> recipients) {
        this.notificationTemplate = notificationTemplate;
        this.recipients = (recipients == null ? Collections.emptyList() : List.copyOf(recipients));
    }

    @Override
    public StepType getStepType() {
        return StepType.NOTIFY;
    }

    public String getNotificationTemplate() {
        return notificationTemplate;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof NotifyConfig)) {
            return false;
        }
        NotifyConfig that = (NotifyConfig) other;
        return Objects.equals(notificationTemplate, that.notificationTemplate) && recipients.equals(that.recipients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(notificationTemplate, recipients);
    }
}
