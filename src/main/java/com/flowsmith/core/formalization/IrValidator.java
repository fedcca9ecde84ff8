package com.flowsmith.core.formalization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowsmith.core.catalog.PluginCatalog;
import com.flowsmith.core.ir.AiOperation;
import com.flowsmith.core.ir.DataSourceSpec;
import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.ir.Delivery;
import com.flowsmith.core.ir.DeliveryRules;
import com.flowsmith.core.ir.FilterCondition;
import com.flowsmith.core.ir.FilterGroup;
import com.flowsmith.core.ir.IrValidationError;
import com.flowsmith.core.ir.IrValidationError.ErrorCode;
import com.flowsmith.core.ir.IrValidationResult;
import com.flowsmith.core.ir.Rendering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structural validation of the declarative IR, run before compilation.
 * Three passes: schema, forbidden execution tokens, semantic references.
 */
@Component
public class IrValidator {

    private static final Logger log = LoggerFactory.getLogger(IrValidator.class);

    static final List<String> FORBIDDEN_TOKENS = List.of(
            "\"plugin\"", "\"step_id\"", "\"execute\"", "\"workflow_steps\"", "\"dag\"",
            "\"loops\"", "\"for_each\"", "\"do\"", "\"scatter_gather\"", "\"fanout\"",
            "\"id\":");

    static final Set<String> IR_VERSIONS = Set.of("2.0", "3.0");
    static final Set<String> SOURCE_TYPES = Set.of("tabular", "api", "webhook", "database", "file", "stream");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PluginCatalog catalog;

    public IrValidator(PluginCatalog catalog) {
        this.catalog = catalog;
    }

    public IrValidationResult validate(DeclarativeIr ir) {
        return validate(ir, null);
    }

    /**
     * Validates a decoded IR. When the model's raw JSON is given, forbidden
     * tokens are searched in that text, so keys that decoding dropped still count.
     */
    public IrValidationResult validate(DeclarativeIr ir, String rawJson) {
        List<IrValidationError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (ir == null) {
            errors.add(IrValidationError.of(ErrorCode.INVALID_SCHEMA, "IR is missing", "$"));
            return new IrValidationResult(false, errors, warnings);
        }
        validateSchema(ir, errors);
        checkForbiddenTokens(ir, rawJson, errors);
        validateSemantics(ir, errors, warnings);
        if (!errors.isEmpty()) {
            log.warn("IR validation failed with {} error(s): {}", errors.size(),
                    errors.stream().map(IrValidationError::message).toList());
        }
        return new IrValidationResult(errors.isEmpty(), errors, warnings);
    }

    private void validateSchema(DeclarativeIr ir, List<IrValidationError> errors) {
        if (ir.irVersion() == null || !IR_VERSIONS.contains(ir.irVersion())) {
            errors.add(IrValidationError.of(ErrorCode.INVALID_SCHEMA,
                    "$.ir_version must be one of " + IR_VERSIONS + " but was " + ir.irVersion(), "$.ir_version"));
        }
        if (isBlank(ir.goal())) {
            errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD, "$.goal is required", "$.goal"));
        }
        if (ir.dataSources().isEmpty()) {
            errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD,
                    "$.data_sources must contain at least one source", "$.data_sources"));
        }
        for (int i = 0; i < ir.dataSources().size(); i++) {
            String type = ir.dataSources().get(i).type();
            if (type != null && !SOURCE_TYPES.contains(type)) {
                errors.add(IrValidationError.of(ErrorCode.INVALID_SCHEMA,
                        "Unknown data source type \"" + type + "\"", "$.data_sources[" + i + "].type"));
            }
        }
        checkOperators(ir.filters(), "$.filters", errors);
        checkOperators(ir.postAiFilters(), "$.post_ai_filters", errors);
        Rendering rendering = ir.rendering();
        if (rendering != null && rendering.type() != null && !Rendering.TYPES.contains(rendering.type())) {
            errors.add(IrValidationError.of(ErrorCode.INVALID_SCHEMA,
                    "Unknown rendering type \"" + rendering.type() + "\"", "$.rendering.type"));
        }
    }

    private static void checkOperators(FilterGroup group, String path, List<IrValidationError> errors) {
        if (group == null) {
            return;
        }
        for (int i = 0; i < group.conditions().size(); i++) {
            String operator = group.conditions().get(i).operator();
            if (operator == null || !FilterCondition.OPERATORS.contains(operator)) {
                errors.add(IrValidationError.of(ErrorCode.INVALID_SCHEMA,
                        "Unknown filter operator \"" + operator + "\"", path + ".conditions[" + i + "].operator"));
            }
        }
        for (int i = 0; i < group.groups().size(); i++) {
            checkOperators(group.groups().get(i), path + ".groups[" + i + "]", errors);
        }
    }

    private void checkForbiddenTokens(DeclarativeIr ir, String rawJson, List<IrValidationError> errors) {
        String raw;
        try {
            raw = objectMapper.writeValueAsString(ir).toLowerCase(Locale.ROOT);
        } catch (JsonProcessingException e) {
            errors.add(IrValidationError.of(ErrorCode.INVALID_SCHEMA, "IR is not serialisable: " + e.getOriginalMessage(), "$"));
            return;
        }
        if (rawJson != null && !rawJson.isBlank()) {
            raw = raw + "\n" + rawJson.toLowerCase(Locale.ROOT);
        }
        for (String token : FORBIDDEN_TOKENS) {
            if (raw.contains(token)) {
                errors.add(new IrValidationError(ErrorCode.FORBIDDEN_TOKEN,
                        "IR contains forbidden execution token: " + token, null, token));
            }
        }
    }

    private void validateSemantics(DeclarativeIr ir, List<IrValidationError> errors, List<String> warnings) {
        for (int i = 0; i < ir.dataSources().size(); i++) {
            DataSourceSpec source = ir.dataSources().get(i);
            if (isBlank(source.pluginKey())) {
                errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD,
                        "Data source at index " + i + " is missing 'plugin_key'", "$.data_sources[" + i + "].plugin_key"));
            } else if (!catalog.contains(source.pluginKey())) {
                warnings.add("Data source plugin \"" + source.pluginKey() + "\" is not in the plugin catalog");
            }
            if (isBlank(source.operationType())) {
                errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD,
                        "Data source at index " + i + " is missing 'operation_type'", "$.data_sources[" + i + "].operation_type"));
            }
        }

        checkConditionFields(ir.filters(), "$.filters", errors);

        DeliveryRules rules = ir.deliveryRules();
        if (rules == null) {
            errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD, "delivery_rules is required", "$.delivery_rules"));
            return;
        }

        boolean hasPluginDelivery = rules.allDeliveries().stream().anyMatch(Delivery::hasPlugin);
        if (!hasPluginDelivery) {
            errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD,
                    "At least one delivery method must specify a plugin_key", "$.delivery_rules"));
        }
        checkOperationType(rules.perItemDelivery(), "$.delivery_rules.per_item_delivery", errors);
        checkOperationType(rules.perGroupDelivery(), "$.delivery_rules.per_group_delivery", errors);
        checkOperationType(rules.summaryDelivery(), "$.delivery_rules.summary_delivery", errors);
        for (int i = 0; i < rules.multipleDestinations().size(); i++) {
            Delivery destination = rules.multipleDestinations().get(i);
            String path = "$.delivery_rules.multiple_destinations[" + i + "]";
            checkOperationType(destination, path, errors);
            if (!destination.hasRecipient()) {
                errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD,
                        "multiple_destinations[" + i + "] needs 'recipient' or 'recipient_source'", path + ".recipient"));
            }
        }

        if (rules.perGroupDelivery() != null && ir.grouping() == null) {
            errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD,
                    "per_group_delivery requires grouping to be specified", "$.grouping"));
        }
        if (ir.grouping() != null) {
            String groupBy = ir.grouping().groupBy();
            if (!isBlank(groupBy) && !"none".equals(groupBy) && !ir.partitions().isEmpty()
                    && ir.partitions().stream().noneMatch(p -> groupBy.equals(p.field()))) {
                errors.add(IrValidationError.of(ErrorCode.INVALID_REFERENCE,
                        "grouping.group_by references \"" + groupBy + "\" but no partition exists for this field",
                        "$.grouping.group_by"));
            }
        }

        for (int i = 0; i < ir.aiOperations().size(); i++) {
            AiOperation operation = ir.aiOperations().get(i);
            String path = "$.ai_operations[" + i + "]";
            if (isBlank(operation.type())) {
                errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD, "AI operation at index " + i + " is missing 'type'", path + ".type"));
            }
            if (isBlank(operation.instruction())) {
                errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD, "AI operation at index " + i + " is missing 'instruction'", path + ".instruction"));
            }
            if (operation.outputSchema() == null) {
                errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD, "AI operation at index " + i + " is missing 'output_schema'", path + ".output_schema"));
            }
        }
    }

    private static void checkConditionFields(FilterGroup group, String path, List<IrValidationError> errors) {
        if (group == null) {
            return;
        }
        for (int i = 0; i < group.conditions().size(); i++) {
            if (isBlank(group.conditions().get(i).field())) {
                errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD,
                        "Filter condition at " + path + ".conditions[" + i + "] is missing 'field'",
                        path + ".conditions[" + i + "].field"));
            }
        }
        for (int i = 0; i < group.groups().size(); i++) {
            checkConditionFields(group.groups().get(i), path + ".groups[" + i + "]", errors);
        }
    }

    private static void checkOperationType(Delivery delivery, String path, List<IrValidationError> errors) {
        if (delivery != null && delivery.hasPlugin() && isBlank(delivery.operationType())) {
            errors.add(IrValidationError.of(ErrorCode.MISSING_REQUIRED_FIELD,
                    path.substring(path.lastIndexOf('.') + 1) + " has plugin_key but is missing 'operation_type'",
                    path + ".operation_type"));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
