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

package com.ticketflow.studio.io;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ticketflow.wf.conditions.CompoundCondition;
import com.ticketflow.wf.conditions.Condition;
import com.ticketflow.wf.conditions.ConditionGroup;
import com.ticketflow.wf.conditions.ConditionLogic;
import com.ticketflow.wf.graph.WorkflowGraphException;
import com.ticketflow.wf.model.ApprovalConfig;
import com.ticketflow.wf.model.ApproverResolution;
import com.ticketflow.wf.model.Branch;
import com.ticketflow.wf.model.BranchFailurePolicy;
import com.ticketflow.wf.model.FormConfig;
import com.ticketflow.wf.model.ForkConfig;
import com.ticketflow.wf.model.JoinConfig;
import com.ticketflow.wf.model.JoinMode;
import com.ticketflow.wf.model.NotifyConfig;
import com.ticketflow.wf.model.ParallelApprovalRule;
import com.ticketflow.wf.model.Step;
import com.ticketflow.wf.model.StepConfig;
import com.ticketflow.wf.model.StepType;
import com.ticketflow.wf.model.SubWorkflowConfig;
import com.ticketflow.wf.model.TaskConfig;
import com.ticketflow.wf.model.Transition;
import com.ticketflow.wf.model.TransitionEvent;
import com.ticketflow.wf.model.WorkflowDefinition;
import com.ticketflow.wf.model.form.ConditionalRequirement;
import com.ticketflow.wf.model.form.DateValidation;
import com.ticketflow.wf.model.form.FieldType;
import com.ticketflow.wf.model.form.FormField;
import com.ticketflow.wf.model.form.RequirementOutcome;

/**
 * Converts workflow definitions to and from their stored JSON form.
 *
 * Stored steps are flat: the type-specific settings (fields, approver_resolution, branches, ...) sit next to
 * the common step attributes. Unknown properties are ignored so that documents written by newer versions
 * still load.
 */
public class WorkflowDefinitionCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public String write(WorkflowDefinition definition) {
        try {
            return MAPPER.writeValueAsString(toJson(definition));
        } catch (JsonProcessingException e) {
            throw new WorkflowDocumentException("Unable to serialize workflow definition", e);
        }
    }

    public WorkflowDefinition read(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new WorkflowDocumentException("Workflow definition is not valid JSON", e);
        }
    }

    public ObjectNode toJson(WorkflowDefinition definition) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode steps = root.putArray("steps");
        definition.getSteps().forEach(s -> steps.add(writeStep(s)));
        ArrayNode transitions = root.putArray("transitions");
        definition.getTransitions().forEach(t -> transitions.add(writeTransition(t)));
        root.put("start_step_id", definition.getStartStepId() == null ? "" : definition.getStartStepId());
        return root;
    }

    /**
     * @throws WorkflowDocumentException if the document is structurally unusable.
     */
    public WorkflowDefinition fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new WorkflowDocumentException("Workflow definition must be a JSON object");
        }
        try {
            // list position is authoritative; stored orders may be fractional in older documents
            List<Step> read = readList(root.get("steps"), this::readStep);
            List<Step> steps = new ArrayList<>(read.size());
            for (int i = 0; i < read.size(); i++) {
                steps.add(read.get(i).withOrder(i));
            }
            List<Transition> transitions = new ArrayList<>();
            JsonNode transitionNodes = root.get("transitions");
            if (transitionNodes != null && transitionNodes.isArray()) {
                for (int i = 0; i < transitionNodes.size(); i++) {
                    transitions.add(readTransition(transitionNodes.get(i), i));
                }
            }
            return new WorkflowDefinition(steps, transitions, text(root, "start_step_id"));
        } catch (WorkflowGraphException | IllegalArgumentException e) {
            throw new WorkflowDocumentException("Invalid workflow definition: " + e.getMessage(), e);
        }
    }

    private ObjectNode writeStep(Step step) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("step_id", step.getStepId());
        node.put("step_name", step.getStepName());
        node.put("step_type", step.getStepType().getWireName());
        if (step.getDescription() != null) {
            node.put("description", step.getDescription());
        }
        node.put("order", step.getOrder());
        node.put("is_start", step.isStart());
        node.put("is_terminal", step.isTerminal());
        if (step.getBranchId() != null) {
            node.put("branch_id", step.getBranchId());
            node.put("parent_fork_step_id", step.getParentForkStepId());
        }
        writeConfig(step.getConfig(), node);
        return node;
    }

    private void writeConfig(StepConfig config, ObjectNode node) {
        if (config instanceof FormConfig) {
            writeFields(((FormConfig) config).getFields(), node.putArray("fields"));
        } else if (config instanceof ApprovalConfig) {
            ApprovalConfig approval = (ApprovalConfig) config;
            putEnum(node, "approver_resolution", approval.getApproverResolution());
            putIfPresent(node, "specific_approver_email", approval.getSpecificApproverEmail());
            putIfPresent(node, "spoc_email", approval.getSpocEmail());
            putEnum(node, "parallel_approval", approval.getParallelApproval());
            if (!approval.getParallelApprovers().isEmpty()) {
                ArrayNode approvers = node.putArray("parallel_approvers");
                approval.getParallelApprovers().forEach(approvers::add);
            }
            node.put("allow_reassign", approval.isAllowReassign());
        } else if (config instanceof TaskConfig) {
            TaskConfig task = (TaskConfig) config;
            node.put("instructions", task.getInstructions());
            node.put("execution_notes_required", task.isExecutionNotesRequired());
            if (!task.getFields().isEmpty()) {
                writeFields(task.getFields(), node.putArray("fields"));
            }
        } else if (config instanceof NotifyConfig) {
            NotifyConfig notify = (NotifyConfig) config;
            putIfPresent(node, "notification_template", notify.getNotificationTemplate());
            if (!notify.getRecipients().isEmpty()) {
                ArrayNode recipients = node.putArray("recipients");
                notify.getRecipients().forEach(recipients::add);
            }
        } else if (config instanceof ForkConfig) {
            ForkConfig fork = (ForkConfig) config;
            ArrayNode branches = node.putArray("branches");
            for (Branch branch : fork.getBranches()) {
                ObjectNode branchNode = branches.addObject();
                branchNode.put("branch_id", branch.getBranchId());
                branchNode.put("branch_name", branch.getBranchName());
                putIfPresent(branchNode, "description", branch.getDescription());
                putIfPresent(branchNode, "assigned_team", branch.getAssignedTeam());
                putIfPresent(branchNode, "color", branch.getColor());
                branchNode.put("start_step_id", branch.hasStartStep() ? branch.getStartStepId() : "");
            }
            putEnum(node, "failure_policy", fork.getFailurePolicy());
        } else if (config instanceof JoinConfig) {
            JoinConfig join = (JoinConfig) config;
            node.put("source_fork_step_id", join.getSourceForkStepId() == null ? "" : join.getSourceForkStepId());
            putEnum(node, "join_mode", join.getJoinMode());
            if (join.getTimeoutMinutes() != null) {
                node.put("timeout_minutes", join.getTimeoutMinutes());
            }
        } else if (config instanceof SubWorkflowConfig) {
            SubWorkflowConfig sub = (SubWorkflowConfig) config;
            putIfPresent(node, "sub_workflow_id", sub.getSubWorkflowId());
            if (sub.getSubWorkflowVersion() != null) {
                node.put("sub_workflow_version", sub.getSubWorkflowVersion());
            }
            putIfPresent(node, "sub_workflow_name", sub.getSubWorkflowName());
        }
    }

    private void writeFields(List<FormField> fields, ArrayNode array) {
        for (FormField field : fields) {
            ObjectNode node = array.addObject();
            node.put("field_key", field.getFieldKey());
            putIfPresent(node, "field_label", field.getFieldLabel());
            node.put("field_type", field.getFieldType().name());
            node.put("required", field.isRequired());
            if (!field.getOptions().isEmpty()) {
                ArrayNode options = node.putArray("options");
                field.getOptions().forEach(options::add);
            }
            if (field.getDateValidation() != null) {
                node.putObject("validation").set("date_validation", writeDateValidation(field.getDateValidation()));
            }
            node.put("order", field.getOrder());
            putIfPresent(node, "section_id", field.getSectionId());
            if (!field.getConditionalRequirements().isEmpty()) {
                ArrayNode rules = node.putArray("conditional_requirements");
                for (ConditionalRequirement rule : field.getConditionalRequirements()) {
                    ObjectNode ruleNode = rules.addObject();
                    putIfPresent(ruleNode, "rule_id", rule.getRuleId());
                    ruleNode.set("when", writeCompound(rule.getWhen()));
                    ObjectNode then = ruleNode.putObject("then");
                    then.put("required", rule.getThen().isRequired());
                    if (rule.getThen().getDateValidation() != null) {
                        then.set("date_validation", writeDateValidation(rule.getThen().getDateValidation()));
                    }
                }
            }
        }
    }

    private ObjectNode writeDateValidation(DateValidation validation) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("allow_past_dates", validation.isAllowPastDates());
        node.put("allow_today", validation.isAllowToday());
        node.put("allow_future_dates", validation.isAllowFutureDates());
        return node;
    }

    private ObjectNode writeCompound(CompoundCondition compound) {
        ObjectNode node = writeCondition(compound.getPrimary(), "field_key");
        node.put("logic", compound.getLogic().name());
        if (!compound.getAdditionalConditions().isEmpty()) {
            ArrayNode conditions = node.putArray("conditions");
            compound.getAdditionalConditions().forEach(c -> conditions.add(writeCondition(c, "field_key")));
        }
        return node;
    }

    private ObjectNode writeCondition(Condition condition, String fieldProperty) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(fieldProperty, condition.getFieldKey());
        node.put("operator", condition.getOperatorName());
        node.set("value", MAPPER.valueToTree(condition.getValue()));
        return node;
    }

    private ObjectNode writeTransition(Transition transition) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("transition_id", transition.getTransitionId());
        node.put("from_step_id", transition.getFromStepId());
        node.put("to_step_id", transition.getToStepId());
        node.put("on_event", transition.getEvent().name());
        node.put("priority", transition.getPriority());
        if (transition.getCondition() != null) {
            ObjectNode condition = node.putObject("condition");
            condition.put("logic", transition.getCondition().getLogic().name());
            ArrayNode conditions = condition.putArray("conditions");
            transition.getCondition().getConditions().forEach(c -> conditions.add(writeCondition(c, "field")));
        }
        return node;
    }

    private Step readStep(JsonNode node) {
        String stepId = text(node, "step_id");
        if (stepId == null || stepId.isEmpty()) {
            throw new WorkflowDocumentException("Every step must have a step_id");
        }
        StepType type = StepType.fromWireName(text(node, "step_type"));
        if (type == null) {
            throw new WorkflowDocumentException("Step " + stepId + " has unknown step_type " + text(node, "step_type"));
        }
        return Step.builder(stepId, type)
                   .stepName(text(node, "step_name"))
                   .description(text(node, "description"))
                   .start(node.path("is_start").asBoolean(false))
                   .terminal(node.path("is_terminal").asBoolean(false))
                   .branchId(text(node, "branch_id"))
                   .parentForkStepId(text(node, "parent_fork_step_id"))
                   .config(readConfig(type, node))
                   .build();
    }

    private StepConfig readConfig(StepType type, JsonNode node) {
        switch (type) {
            case FORM:
                return new FormConfig(readList(node.get("fields"), this::readField));
            case APPROVAL:
                return new ApprovalConfig(readEnum(node, "approver_resolution", ApproverResolution::fromWireName),
                                          text(node, "specific_approver_email"),
                                          text(node, "spoc_email"),
                                          readEnum(node, "parallel_approval", ParallelApprovalRule::fromWireName),
                                          readList(node.get("parallel_approvers"), JsonNode::asText),
                                          node.path("allow_reassign").asBoolean(false));
            case TASK:
                return new TaskConfig(text(node, "instructions"),
                                      node.path("execution_notes_required").asBoolean(false),
                                      readList(node.get("fields"), this::readField));
            case NOTIFY:
                return new NotifyConfig(text(node, "notification_template"),
                                        readList(node.get("recipients"), JsonNode::asText));
            case FORK:
                return new ForkConfig(readList(node.get("branches"), this::readBranch),
                                      readEnum(node, "failure_policy", BranchFailurePolicy::fromWireName));
            case JOIN:
                JsonNode timeout = node.get("timeout_minutes");
                return new JoinConfig(text(node, "source_fork_step_id"),
                                      readEnum(node, "join_mode", JoinMode::fromWireName),
                                      timeout == null || timeout.isNull() ? null : timeout.asInt());
            case SUB_WORKFLOW:
                JsonNode version = node.get("sub_workflow_version");
                return new SubWorkflowConfig(text(node, "sub_workflow_id"),
                                             version == null || version.isNull() ? null : version.asInt(),
                                             text(node, "sub_workflow_name"));
            default:
                throw new IllegalStateException("No configuration reader for step type " + type);
        }
    }

    private Branch readBranch(JsonNode node) {
        String branchId = text(node, "branch_id");
        if (branchId == null || branchId.isEmpty()) {
            throw new WorkflowDocumentException("Every fork branch must have a branch_id");
        }
        return new Branch(branchId, text(node, "branch_name"), text(node, "description"),
                          text(node, "assigned_team"), text(node, "color"), text(node, "start_step_id"));
    }

    private FormField readField(JsonNode node) {
        String key = text(node, "field_key");
        FieldType fieldType = FieldType.fromWireName(text(node, "field_type"));
        JsonNode dateValidation = node.path("validation").get("date_validation");
        return FormField.builder(key, fieldType)
                        .fieldLabel(text(node, "field_label"))
                        .required(node.path("required").asBoolean(false))
                        .options(readList(node.get("options"), JsonNode::asText))
                        .dateValidation(readDateValidation(dateValidation))
                        .order(node.path("order").asInt(0))
                        .sectionId(text(node, "section_id"))
                        .conditionalRequirements(readList(node.get("conditional_requirements"), this::readRule))
                        .build();
    }

    private ConditionalRequirement readRule(JsonNode node) {
        JsonNode when = node.get("when");
        JsonNode then = node.get("then");
        if (when == null || then == null) {
            throw new WorkflowDocumentException("Conditional requirement " + text(node, "rule_id")
                                                + " must have both 'when' and 'then'");
        }
        CompoundCondition condition = new CompoundCondition(readCondition(when, "field_key"),
                                                            ConditionLogic.fromWireName(text(when, "logic")),
                                                            readList(when.get("conditions"),
                                                                     c -> readCondition(c, "field_key")));
        RequirementOutcome outcome = new RequirementOutcome(then.path("required").asBoolean(false),
                                                            readDateValidation(then.get("date_validation")));
        return new ConditionalRequirement(text(node, "rule_id"), condition, outcome);
    }

    // missing flags mean "allowed"
    private DateValidation readDateValidation(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new DateValidation(node.path("allow_past_dates").asBoolean(true),
                                  node.path("allow_today").asBoolean(true),
                                  node.path("allow_future_dates").asBoolean(true));
    }

    private Condition readCondition(JsonNode node, String fieldProperty) {
        String field = text(node, fieldProperty);
        if (field == null) {
            throw new WorkflowDocumentException("Condition is missing '" + fieldProperty + "'");
        }
        JsonNode value = node.get("value");
        Object converted = (value == null || value.isNull() ? null : MAPPER.convertValue(value, Object.class));
        return new Condition(field, text(node, "operator"), converted);
    }

    private Transition readTransition(JsonNode node, int index) {
        String transitionId = text(node, "transition_id");
        if (transitionId == null || transitionId.isEmpty()) {
            transitionId = "t_imported_" + index;
        }
        // older documents used trigger_event
        String eventName = (text(node, "on_event") != null ? text(node, "on_event") : text(node, "trigger_event"));
        TransitionEvent event = TransitionEvent.fromWireName(eventName);
        if (event == null) {
            throw new WorkflowDocumentException("Transition " + transitionId + " has unknown event " + eventName);
        }
        ConditionGroup condition = null;
        JsonNode conditionNode = node.get("condition");
        if (conditionNode != null && conditionNode.isObject()) {
            condition = new ConditionGroup(readList(conditionNode.get("conditions"), c -> readCondition(c, "field")),
                                           ConditionLogic.fromWireName(text(conditionNode, "logic")));
        }
        return new Transition(transitionId, text(node, "from_step_id"), text(node, "to_step_id"), event,
                              node.path("priority").asInt(0), condition);
    }

    private static <T> List<T> readList(JsonNode array, Function<JsonNode, T> reader) {
        List<T> result = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                result.add(reader.apply(element));
            }
        }
        return result;
    }

    private static <E extends Enum<E>> E readEnum(JsonNode node, String property, Function<String, E> parser) {
        String name = text(node, property);
        if (name == null || name.isEmpty()) {
            return null;
        }
        E value = parser.apply(name);
        if (value == null) {
            throw new WorkflowDocumentException("Unknown value '" + name + "' for " + property);
        }
        return value;
    }

    private static String text(JsonNode node, String property) {
        JsonNode value = node.get(property);
        return (value == null || value.isNull() ? null : value.asText());
    }

    private static void putIfPresent(ObjectNode node, String property, String value) {
        if (value != null) {
            node.put(property, value);
        }
    }

    private static void putEnum(ObjectNode node, String property, Enum<?> value) {
        if (value != null) {
            node.put(property, value.name());
        }
    }
}
