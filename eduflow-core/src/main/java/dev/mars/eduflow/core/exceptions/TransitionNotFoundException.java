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

package dev.mars.eduflow.core.exceptions;

import java.util.Collection;
import java.util.List;

public class TransitionNotFoundException extends WorkflowException {

    private final String templateId;
    private final String transitionId;
    private final List<String> availableTransitions;

    public TransitionNotFoundException(String contentUid, String templateId, String transitionId,
                                       Collection<String> availableTransitions) {
        super(ErrorKind.NOT_FOUND,
                String.format("Transition '%s' not found in template '%s'. Available transitions: %s",
                        transitionId, templateId, availableTransitions),
                details("content_uid", contentUid,
                        "template_id", templateId,
                        "transition_id", transitionId,
                        "available_transitions", List.copyOf(availableTransitions)));
        this.templateId = templateId;
        this.transitionId = transitionId;
        this.availableTransitions = List.copyOf(availableTransitions);
    }

    public String getTemplateId() {
        return templateId;
    }

    public String getTransitionId() {
        return transitionId;
    }

    public List<String> getAvailableTransitions() {
        return availableTransitions;
    }
}
